package frontend;

import java.util.Objects;

/**
 * A decoded instruction operand in Intel syntax.
 */
public final class Operand {
    public enum Kind {
        REGISTER,
        IMMEDIATE,
        MEMORY,
        // a name the decoder could not classify, e.g. an imported function
        SYMBOL
    }

    private final Kind kind;
    private final String register;
    private final long immediate;
    private final String base;
    private final String index;
    private final int scale;
    private final long displacement;
    // access width in bytes, 0 when the listing leaves it implicit
    private final int width;

    private Operand(Kind kind, String register, long immediate, String base, String index,
            int scale, long displacement, int width) {
        this.kind = kind;
        this.register = register;
        this.immediate = immediate;
        this.base = base;
        this.index = index;
        this.scale = scale;
        this.displacement = displacement;
        this.width = width;
    }

    public static Operand register(String name) {
        String reg = name.toLowerCase();
        return new Operand(Registers.isRegister(reg) ? Kind.REGISTER : Kind.SYMBOL,
                Registers.isRegister(reg) ? reg : name, 0, null, null, 0, 0, 0);
    }

    public static Operand immediate(long value) {
        return new Operand(Kind.IMMEDIATE, null, value, null, null, 0, 0, 0);
    }

    /**
     * @param base  base register or null
     * @param index index register or null
     */
    public static Operand memory(String base, String index, int scale, long displacement, int width) {
        return new Operand(Kind.MEMORY, null, 0, base, index, index == null ? 0 : scale, displacement, width);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRegister() {
        return kind == Kind.REGISTER;
    }

    public boolean isImmediate() {
        return kind == Kind.IMMEDIATE;
    }

    public boolean isMemory() {
        return kind == Kind.MEMORY;
    }

    public String getRegister() {
        return register;
    }

    public String getSymbol() {
        return register;
    }

    public long getImmediate() {
        return immediate;
    }

    public String getBase() {
        return base;
    }

    public String getIndex() {
        return index;
    }

    public int getScale() {
        return scale;
    }

    public long getDisplacement() {
        return displacement;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return true for a memory operand with a constant address
     */
    public boolean isAbsolute() {
        return kind == Kind.MEMORY && base == null && index == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand op)) return false;
        return kind == op.kind && immediate == op.immediate && scale == op.scale
                && displacement == op.displacement && width == op.width
                && Objects.equals(register, op.register) && Objects.equals(base, op.base)
                && Objects.equals(index, op.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, register, immediate, base, index, scale, displacement, width);
    }

    @Override
    public String toString() {
        switch (kind) {
            case REGISTER:
            case SYMBOL:
                return register;
            case IMMEDIATE:
                return immediate < 0 ? "-0x" + Long.toHexString(-immediate) : "0x" + Long.toHexString(immediate);
            default:
                break;
        }
        StringBuilder sb = new StringBuilder();
        switch (width) {
            case 1 -> sb.append("byte ");
            case 2 -> sb.append("word ");
            case 4 -> sb.append("dword ");
            case 8 -> sb.append("qword ");
            default -> { }
        }
        sb.append('[');
        boolean first = true;
        if (base != null) {
            sb.append(base);
            first = false;
        }
        if (index != null) {
            sb.append(first ? "" : "+").append(index).append('*').append(scale);
            first = false;
        }
        if (displacement != 0 || first) {
            if (!first) {
                sb.append(displacement < 0 ? "-" : "+");
            }
            sb.append("0x").append(Long.toHexString(first ? displacement : Math.abs(displacement)));
        }
        return sb.append(']').toString();
    }
}
