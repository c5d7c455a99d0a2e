package frontend;

import java.util.Collections;
import java.util.List;

/**
 * One record of the decoder stream. Successors are the addresses control may
 * reach next, not counting call targets.
 */
public final class DecodedInstruction {
    private final long functionEntry;
    private final long address;
    private final String mnemonic;
    private final List<Operand> operands;
    private final List<Long> successors;
    private final boolean isCall;
    private final boolean isReturn;

    public DecodedInstruction(long functionEntry, long address, String mnemonic, List<Operand> operands,
            List<Long> successors, boolean isCall, boolean isReturn) {
        this.functionEntry = functionEntry;
        this.address = address;
        this.mnemonic = mnemonic.toLowerCase();
        this.operands = List.copyOf(operands);
        this.successors = List.copyOf(successors);
        this.isCall = isCall;
        this.isReturn = isReturn;
    }

    public long getFunctionEntry() {
        return functionEntry;
    }

    public long getAddress() {
        return address;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public List<Operand> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public Operand getOperand(int i) {
        return operands.get(i);
    }

    public int getNumOperands() {
        return operands.size();
    }

    public List<Long> getSuccessors() {
        return successors;
    }

    public boolean isCall() {
        return isCall;
    }

    public boolean isReturn() {
        return isReturn;
    }

    /**
     * @return true for jmp and every conditional jump, direct or indirect
     */
    public boolean isJump() {
        return mnemonic.startsWith("j");
    }

    public boolean isConditionalJump() {
        return mnemonic.startsWith("j") && !mnemonic.equals("jmp");
    }

    /**
     * @return the direct call target, or -1 for indirect or non-call instructions
     */
    public long getCallTarget() {
        if (!isCall || operands.isEmpty() || !operands.get(0).isImmediate()) {
            return -1;
        }
        return operands.get(0).getImmediate();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("0x").append(Long.toHexString(address)).append(": ").append(mnemonic);
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
        }
        if (!successors.isEmpty()) {
            sb.append(" ->");
            for (int i = 0; i < successors.size(); i++) {
                sb.append(i == 0 ? " " : ", ").append("0x").append(Long.toHexString(successors.get(i)));
            }
        }
        return sb.toString();
    }
}
