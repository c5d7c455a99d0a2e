package ir.type;

/**
 * A point of the recovery lattice. Every type is interned by its factory, so
 * two types are equal exactly when they are the same object.
 */
public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return kind;
    }

    /**
     * @return the textual form used by the IR printer and as the type table key, e.g. {@code i32*}
     */
    public abstract String toIR();

    public boolean isUnknown() {
        return kind == TypeKind.UNKNOWN;
    }

    public boolean isInteger() {
        return kind == TypeKind.INTEGER;
    }

    public boolean isPointer() {
        return kind == TypeKind.POINTER;
    }

    public boolean isConflict() {
        return kind == TypeKind.CONFLICT;
    }

    public boolean isVoid() {
        return kind == TypeKind.VOID;
    }

    @Override
    public String toString() {
        return toIR();
    }
}
