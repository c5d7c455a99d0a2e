package ir;

import ir.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Module-wide table of the types functions have recovered. Append-only and
 * safe to register into from several worker threads; iteration order is the
 * type's textual form, so it does not depend on registration order.
 */
public class TypeTable {
    private final ConcurrentSkipListMap<String, Type> types = new ConcurrentSkipListMap<>();

    /**
     * @return the type already registered under the same textual form, or {@code type}
     */
    public Type register(Type type) {
        Type prev = types.putIfAbsent(type.toIR(), type);
        return prev != null ? prev : type;
    }

    public boolean contains(Type type) {
        return types.containsKey(type.toIR());
    }

    public List<Type> getTypes() {
        return new ArrayList<>(types.values());
    }

    public int size() {
        return types.size();
    }

    public TypeTable copy() {
        TypeTable t = new TypeTable();
        t.types.putAll(types);
        return t;
    }
}
