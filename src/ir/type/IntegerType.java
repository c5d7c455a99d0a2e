package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import exception.DecompileException;

/**
 * Fixed-width integer; {@code i1} is the type of branch conditions.
 */
public final class IntegerType extends Type {
    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    public static final IntegerType i1 = IntegerType.getInteger(1);
    public static final IntegerType i8 = IntegerType.getInteger(8);
    public static final IntegerType i16 = IntegerType.getInteger(16);
    public static final IntegerType i32 = IntegerType.getInteger(32);

    private IntegerType(int bitWidth) {
        super(TypeKind.INTEGER);
        this.bitWidth = bitWidth;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public int getByteWidth() {
        return Math.max(1, bitWidth / 8);
    }

    public static IntegerType getInteger(int bitWidth) {
        return switch (bitWidth) {
            case 1, 8, 16, 32, 64 -> pool.computeIfAbsent(bitWidth, IntegerType::new);
            default -> throw DecompileException.unSupported("Integer with bitWidth " + bitWidth);
        };
    }

    /**
     * @param bytes access width in bytes (1, 2, 4 or 8)
     */
    public static IntegerType ofBytes(int bytes) {
        return getInteger(bytes * 8);
    }

    public static IntegerType getI32() {
        return i32;
    }

    public static IntegerType getI1() {
        return i1;
    }

    @Override
    public String toIR() {
        return "i" + bitWidth;
    }
}
