package ir.type;

/**
 * Bottom of the lattice: usages disagree. Absorbing under meet.
 */
public final class ConflictType extends Type {
    private static final ConflictType INSTANCE = new ConflictType();

    private ConflictType() {
        super(TypeKind.CONFLICT);
    }

    public static ConflictType get() {
        return INSTANCE;
    }

    @Override
    public String toIR() {
        return "conflict";
    }
}
