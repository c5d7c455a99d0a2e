package pass;

public enum PassResult {
    UNCHANGED,
    // instructions or variables changed, blocks and edges did not
    CHANGED,
    CFG_CHANGED;

    public boolean isChanged() {
        return this != UNCHANGED;
    }

    public boolean isCfgChanged() {
        return this == CFG_CHANGED;
    }

    public PassResult merge(PassResult other) {
        return ordinal() >= other.ordinal() ? this : other;
    }

    public static PassResult of(boolean changed) {
        return changed ? CHANGED : UNCHANGED;
    }
}
