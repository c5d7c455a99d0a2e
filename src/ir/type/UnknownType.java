package ir.type;

/**
 * Top of the lattice: nothing has been learned yet.
 */
public final class UnknownType extends Type {
    private static final UnknownType INSTANCE = new UnknownType();

    private UnknownType() {
        super(TypeKind.UNKNOWN);
    }

    public static UnknownType get() {
        return INSTANCE;
    }

    @Override
    public String toIR() {
        return "?";
    }
}
