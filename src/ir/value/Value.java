package ir.value;

import java.util.Objects;

/**
 * An operand: a constant, a reference to a {@link Variable}, or the result of
 * another instruction. References are ids into the owning function's
 * arenas, so values are immutable and can be shared freely.
 */
public final class Value {
    public enum Kind {
        CONSTANT,
        VARIABLE,
        RESULT
    }

    private final Kind kind;
    private final long constant;
    private final int ref;
    private final int bits;

    private Value(Kind kind, long constant, int ref, int bits) {
        this.kind = kind;
        this.constant = constant;
        this.ref = ref;
        this.bits = bits;
    }

    public static Value constant(long value) {
        return new Value(Kind.CONSTANT, value, -1, 32);
    }

    public static Value constant(long value, int bits) {
        return new Value(Kind.CONSTANT, value, -1, bits);
    }

    public static Value variable(int variableId) {
        return new Value(Kind.VARIABLE, 0, variableId, 0);
    }

    public static Value variable(Variable variable) {
        return variable(variable.getId());
    }

    public static Value result(int instructionId) {
        return new Value(Kind.RESULT, 0, instructionId, 0);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    public boolean isResult() {
        return kind == Kind.RESULT;
    }

    public long getConstant() {
        return constant;
    }

    public int getBits() {
        return bits;
    }

    public int getVariableId() {
        if (kind != Kind.VARIABLE) {
            throw new IllegalStateException("not a variable reference: " + this);
        }
        return ref;
    }

    public int getInstructionId() {
        if (kind != Kind.RESULT) {
            throw new IllegalStateException("not an instruction result: " + this);
        }
        return ref;
    }

    public boolean refersTo(Variable variable) {
        return kind == Kind.VARIABLE && ref == variable.getId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        return kind == other.kind && constant == other.constant && ref == other.ref;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, constant, ref);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CONSTANT -> constant >= 0 && constant < 10 ? Long.toString(constant)
                    : constant < 0 ? "-0x" + Long.toHexString(-constant) : "0x" + Long.toHexString(constant);
            case VARIABLE -> "$" + ref;
            case RESULT -> "%" + ref;
        };
    }
}
