package ir.value;

public enum EdgeKind {
    UNCONDITIONAL,
    TRUE,
    FALSE,
    SWITCH_CASE,
    FALLTHROUGH,
    // target could not be resolved to a block
    UNKNOWN;

    public String getName() {
        return name().toLowerCase();
    }
}
