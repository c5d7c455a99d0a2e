package pass;

import java.time.Duration;

/**
 * Outcome of one pass over the whole module.
 */
public record PassReport(String name, boolean changed, Duration duration) {
    @Override
    public String toString() {
        return String.format("%-20s %-9s %8.3f ms", name, changed ? "changed" : "unchanged",
                duration.toNanos() / 1_000_000.0);
    }
}
