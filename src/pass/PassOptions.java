package pass;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Key/value options of one pipeline entry.
 */
public final class PassOptions {
    private static final PassOptions EMPTY = new PassOptions(Map.of());

    private final Map<String, String> values;

    private PassOptions(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static PassOptions empty() {
        return EMPTY;
    }

    public static PassOptions of(Map<String, String> values) {
        return values.isEmpty() ? EMPTY : new PassOptions(values);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public String getString(String key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    /**
     * A bare key counts as true.
     */
    public boolean getBoolean(String key, boolean fallback) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        return raw.isEmpty() || raw.equalsIgnoreCase("true");
    }

    public int getInt(String key, int fallback) {
        String raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option '" + key + "' is not a number: " + raw, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PassOptions other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
