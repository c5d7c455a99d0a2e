package ir.value;

/**
 * Closed set of IR operations. Every switch over opcodes in the code base is
 * exhaustive, so adding one is a compile-checked change.
 */
public enum Opcode {
    // binary arithmetic: result = op0 <op> op1
    ADD("+", 4),
    SUB("-", 4),
    MUL("*", 3),
    AND("&", 8),
    OR("|", 10),
    XOR("^", 9),
    SHL("<<", 5),
    SHR(">>", 5),
    SAR(">>", 5),

    // unary
    NEG("-", 2),
    NOT("~", 2),

    // compare, result is i1
    CMP_EQ("==", 7),
    CMP_NE("!=", 7),
    CMP_SLT("<", 6),
    CMP_SLE("<=", 6),
    CMP_SGT(">", 6),
    CMP_SGE(">=", 6),
    CMP_ULT("<", 6),
    CMP_ULE("<=", 6),
    CMP_UGT(">", 6),
    CMP_UGE(">=", 6),

    // width changes, result width is the instruction width
    ZEXT("", 2),
    SEXT("", 2),

    // memory
    LOAD("*", 2),
    STORE("=", 14),

    // data movement
    ASSIGN("=", 14),
    COPY("", 0),
    PHI("", 0),

    CALL("", 1),
    // decoded instruction without known semantics
    INTRINSIC("", 1),

    // terminators
    BRANCH("", 0),
    COND_BRANCH("", 0),
    SWITCH("", 0),
    RETURN("", 0),
    ;

    private final String symbol;
    private final int precedence;

    Opcode(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    /**
     * @return the C operator for arithmetic, unary and compare opcodes
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return C precedence level, lower binds tighter
     */
    public int getPrecedence() {
        return precedence;
    }

    public boolean isTerminator() {
        return this == BRANCH || this == COND_BRANCH || this == SWITCH || this == RETURN;
    }

    public boolean isBinary() {
        return switch (this) {
            case ADD, SUB, MUL, AND, OR, XOR, SHL, SHR, SAR -> true;
            default -> false;
        };
    }

    public boolean isCompare() {
        return switch (this) {
            case CMP_EQ, CMP_NE, CMP_SLT, CMP_SLE, CMP_SGT, CMP_SGE,
                    CMP_ULT, CMP_ULE, CMP_UGT, CMP_UGE -> true;
            default -> false;
        };
    }

    public boolean isUnsignedCompare() {
        return this == CMP_ULT || this == CMP_ULE || this == CMP_UGT || this == CMP_UGE;
    }

    /**
     * @return true if the instruction defines a value other instructions can reference
     */
    public boolean producesValue() {
        return switch (this) {
            case STORE, ASSIGN, BRANCH, COND_BRANCH, SWITCH, RETURN -> false;
            default -> true;
        };
    }

    /**
     * @return true if removing an unused instance cannot change program behavior
     */
    public boolean isPure() {
        return switch (this) {
            case STORE, ASSIGN, CALL, INTRINSIC, BRANCH, COND_BRANCH, SWITCH, RETURN -> false;
            default -> true;
        };
    }

    /**
     * @return the compare that holds exactly when this one does not
     */
    public Opcode inverse() {
        return switch (this) {
            case CMP_EQ -> CMP_NE;
            case CMP_NE -> CMP_EQ;
            case CMP_SLT -> CMP_SGE;
            case CMP_SGE -> CMP_SLT;
            case CMP_SLE -> CMP_SGT;
            case CMP_SGT -> CMP_SLE;
            case CMP_ULT -> CMP_UGE;
            case CMP_UGE -> CMP_ULT;
            case CMP_ULE -> CMP_UGT;
            case CMP_UGT -> CMP_ULE;
            default -> throw new IllegalStateException(this + " has no inverse");
        };
    }

    public String getName() {
        return name().toLowerCase();
    }
}
