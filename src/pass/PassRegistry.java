package pass;

import exception.UnknownPassException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The passes a pipeline can run, keyed by id. Built once per invocation and
 * handed to {@link PassPipeline}; there is no process-wide table.
 */
public class PassRegistry {
    private record Entry(Supplier<? extends Pass> constructor, Set<String> optionKeys) {
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public static PassRegistry withBuiltins() {
        PassRegistry registry = new PassRegistry();
        for (IRPassType type : IRPassType.values()) {
            registry.register(type);
        }
        return registry;
    }

    public PassRegistry register(PassType<? extends Pass> type) {
        return register(type.getName(), type.constructor(), type.optionKeys());
    }

    public PassRegistry register(String id, Supplier<? extends Pass> constructor, Set<String> optionKeys) {
        if (entries.containsKey(id)) {
            throw new IllegalArgumentException("pass '" + id + "' is already registered");
        }
        entries.put(id, new Entry(constructor, Set.copyOf(optionKeys)));
        return this;
    }

    public PassRegistry register(String id, Supplier<? extends Pass> constructor) {
        return register(id, constructor, Set.of());
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public Set<String> getIds() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Set<String> getOptionKeys(String id) {
        return entry(id).optionKeys();
    }

    public Pass create(String id) {
        return entry(id).constructor().get();
    }

    private Entry entry(String id) {
        Entry e = entries.get(id);
        if (e == null) {
            throw new UnknownPassException(id);
        }
        return e;
    }
}
