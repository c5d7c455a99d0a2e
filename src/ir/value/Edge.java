package ir.value;

import java.util.Objects;

/**
 * A successor edge of a {@link BasicBlock}. Immutable; retargeting produces a new edge.
 */
public final class Edge {
    public static final int UNKNOWN_TARGET = -1;

    private final EdgeKind kind;
    private final int target;
    private final long targetAddress;
    private final long caseValue;

    private Edge(EdgeKind kind, int target, long targetAddress, long caseValue) {
        this.kind = kind;
        this.target = target;
        this.targetAddress = targetAddress;
        this.caseValue = caseValue;
    }

    public static Edge of(EdgeKind kind, int target) {
        return new Edge(kind, target, -1, 0);
    }

    public static Edge switchCase(int target, long caseValue) {
        return new Edge(EdgeKind.SWITCH_CASE, target, -1, caseValue);
    }

    /**
     * @param address the unresolved target address, or -1 if none is known
     */
    public static Edge unknown(long address) {
        return new Edge(EdgeKind.UNKNOWN, UNKNOWN_TARGET, address, 0);
    }

    public EdgeKind getKind() {
        return kind;
    }

    public int getTarget() {
        return target;
    }

    public boolean isUnknown() {
        return kind == EdgeKind.UNKNOWN;
    }

    public long getTargetAddress() {
        return targetAddress;
    }

    public long getCaseValue() {
        return caseValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge edge)) return false;
        return target == edge.target && targetAddress == edge.targetAddress
                && caseValue == edge.caseValue && kind == edge.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, target, targetAddress, caseValue);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UNKNOWN -> targetAddress >= 0 ? "unknown(0x" + Long.toHexString(targetAddress) + ")" : "unknown";
            case SWITCH_CASE -> "case " + caseValue + ": bb" + target;
            default -> kind.getName() + ": bb" + target;
        };
    }
}
