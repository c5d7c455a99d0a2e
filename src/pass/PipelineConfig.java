package pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of pass ids with their options.
 *
 * <p>The text form is {@code id[:key=value[;key=value]],id,...}, for example
 * {@code stack-recovery,type-inference:widen-small-ints=true,structure}.
 */
public final class PipelineConfig {
    public record Entry(String passId, PassOptions options) {
        @Override
        public String toString() {
            return options.asMap().isEmpty() ? passId : passId + ":" + options;
        }
    }

    public static final List<String> DEFAULT_PASSES = List.of(
            "stack-recovery", "merge-returns", "copy-propagation", "dead-code",
            "merge-blocks", "type-inference", "coalesce-variables", "structure");

    private final List<Entry> entries;

    private PipelineConfig(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static PipelineConfig of(String... passIds) {
        return of(List.of(passIds));
    }

    public static PipelineConfig of(List<String> passIds) {
        List<Entry> list = new ArrayList<>();
        for (String id : passIds) {
            list.add(new Entry(id, PassOptions.empty()));
        }
        return new PipelineConfig(list);
    }

    public static PipelineConfig defaults() {
        return of(DEFAULT_PASSES);
    }

    /**
     * Parses the text form and rejects option keys a known pass does not accept.
     * Unknown pass ids are kept; the pipeline rejects them before running anything.
     */
    public static PipelineConfig parse(String text, PassRegistry registry) {
        List<Entry> list = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            String id = item;
            Map<String, String> options = new LinkedHashMap<>();
            int colon = item.indexOf(':');
            if (colon >= 0) {
                id = item.substring(0, colon).trim();
                for (String kv : item.substring(colon + 1).split(";")) {
                    if (kv.isBlank()) {
                        continue;
                    }
                    int eq = kv.indexOf('=');
                    String key = (eq >= 0 ? kv.substring(0, eq) : kv).trim();
                    String value = eq >= 0 ? kv.substring(eq + 1).trim() : "";
                    options.put(key, value);
                }
            }
            if (registry.contains(id)) {
                for (String key : options.keySet()) {
                    if (!registry.getOptionKeys(id).contains(key)) {
                        throw new IllegalArgumentException(
                                "pass '" + id + "' has no option '" + key + "'");
                    }
                }
            }
            list.add(new Entry(id, PassOptions.of(options)));
        }
        return new PipelineConfig(list);
    }

    public PipelineConfig then(String passId, PassOptions options) {
        List<Entry> list = new ArrayList<>(entries);
        list.add(new Entry(passId, options));
        return new PipelineConfig(list);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry e : entries) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(e);
        }
        return sb.toString();
    }
}
