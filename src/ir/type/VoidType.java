package ir.type;

/**
 * Return type of functions that leave nothing in eax. Never a variable's type.
 */
public final class VoidType extends Type {
    private static final VoidType VOID = new VoidType();

    private VoidType() {
        super(TypeKind.VOID);
    }

    public static VoidType getVoid() {
        return VOID;
    }

    @Override
    public String toIR() {
        return "void";
    }
}
