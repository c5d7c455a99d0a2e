package structure;

public enum RegionKind {
    LEAF,
    SEQUENCE,
    IF_THEN_ELSE,
    WHILE,
    DO_WHILE,
    // endless loop left through break, return or goto
    LOOP,
    SWITCH,
    GOTO_BLOCK,
    GOTO_UNKNOWN,
    BREAK,
    CONTINUE;

    public boolean isLoop() {
        return this == WHILE || this == DO_WHILE || this == LOOP;
    }

    /**
     * @return true if a C {@code break} inside this construct leaves it
     */
    public boolean isBreakable() {
        return isLoop() || this == SWITCH;
    }

    public boolean isJump() {
        return this == GOTO_BLOCK || this == GOTO_UNKNOWN || this == BREAK || this == CONTINUE;
    }

    public String getName() {
        return name().toLowerCase().replace('_', '-');
    }
}
