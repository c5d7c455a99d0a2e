package emit;

import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;

/**
 * C spellings of recovered types. Values whose type never got pinned down are
 * shown as {@code undefinedN}, N being the width in bytes; values whose uses
 * disagree fall back to a plain integer of their width.
 */
public final class TypeNames {
    private TypeNames() {
    }

    /**
     * @param widthBytes storage width, used when the type itself carries none
     */
    public static String of(Type type, int widthBytes) {
        int width = Math.max(1, widthBytes);
        if (type == null || type.isUnknown()) {
            return "undefined" + width;
        }
        if (type.isConflict()) {
            return "int" + width * 8 + "_t";
        }
        if (type.isVoid()) {
            return "void";
        }
        if (type instanceof IntegerType it) {
            return integer(it.getBitWidth());
        }
        if (type instanceof PointerType pt) {
            Type pointee = pt.getPointeeType();
            String inner = pointee.isUnknown() ? "void" : of(pointee, 4);
            return inner.endsWith("*") ? inner + "*" : inner + " *";
        }
        return "undefined" + width;
    }

    public static String integer(int bits) {
        return switch (bits) {
            case 1 -> "bool";
            case 8 -> "char";
            case 16 -> "short";
            case 32 -> "int";
            case 64 -> "long long";
            default -> "int" + bits + "_t";
        };
    }

    public static String unsigned(int bytes) {
        return "uint" + Math.max(1, bytes) * 8 + "_t";
    }

    public static String signed(int bytes) {
        return "int" + Math.max(1, bytes) * 8 + "_t";
    }

    /**
     * Joins a type and a name the way a C declaration does.
     */
    public static String declare(String typeName, String name) {
        return typeName.endsWith("*") ? typeName + name : typeName + " " + name;
    }
}
