package ir;

/**
 * A non-fatal finding attached to a function.
 *
 * @param blockId block the finding is about, -1 if function-wide
 * @param address machine address involved, -1 if none
 */
public record Diagnostic(Kind kind, String function, int blockId, long address, String message) {
    public enum Kind {
        TYPE_CONFLICT,
        UNRESOLVED_CONTROL_TRANSFER
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("warning: ");
        sb.append(kind.name().toLowerCase()).append(" in ").append(function);
        if (blockId >= 0) {
            sb.append(", block ").append(blockId);
        }
        if (address >= 0) {
            sb.append(" at 0x").append(Long.toHexString(address));
        }
        return sb.append(": ").append(message).toString();
    }
}
