package ir.type;

/**
 * Points of the recovery lattice, top to bottom: UNKNOWN, INTEGER, POINTER, CONFLICT.
 * VOID only describes functions that return nothing.
 */
public enum TypeKind {
    UNKNOWN,
    INTEGER,
    POINTER,
    CONFLICT,
    VOID
}
