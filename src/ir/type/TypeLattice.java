package ir.type;

/**
 * Meet over the type lattice: Unknown on top, Conflict at the bottom, the
 * concrete integer and pointer types in between.
 * <p>
 * A meet never moves a type up: Unknown is the identity, Conflict absorbs,
 * and two concrete types that disagree meet to Conflict. Pointers meet
 * pointee-wise. With {@code widenSmallInts} two integers of different width
 * meet to the wider one instead of Conflict.
 */
public final class TypeLattice {
    private final boolean widenSmallInts;

    public TypeLattice(boolean widenSmallInts) {
        this.widenSmallInts = widenSmallInts;
    }

    public static TypeLattice strict() {
        return new TypeLattice(false);
    }

    public boolean widensSmallInts() {
        return widenSmallInts;
    }

    public Type meet(Type a, Type b) {
        if (a == null || a.isUnknown()) {
            return b == null ? UnknownType.get() : b;
        }
        if (b == null || b.isUnknown()) {
            return a;
        }
        if (a.isConflict() || b.isConflict()) {
            return ConflictType.get();
        }
        if (a.equals(b)) {
            return a;
        }
        if (a instanceof IntegerType ia && b instanceof IntegerType ib) {
            if (widenSmallInts && ia.getBitWidth() > 1 && ib.getBitWidth() > 1) {
                return ia.getBitWidth() >= ib.getBitWidth() ? ia : ib;
            }
            return ConflictType.get();
        }
        if (a instanceof PointerType pa && b instanceof PointerType pb) {
            Type pointee = meet(pa.getPointeeType(), pb.getPointeeType());
            return pointee.isConflict() ? ConflictType.get() : PointerType.get(pointee);
        }
        // integer against pointer, or anything against void
        return ConflictType.get();
    }

    /**
     * @return true if {@code lower} is reachable from {@code upper} by meets, i.e. lower ⊑ upper
     */
    public boolean isBelowOrEqual(Type lower, Type upper) {
        return meet(lower, upper).equals(lower);
    }
}
