package ir.value.instructions;

import ir.type.Type;
import ir.type.UnknownType;
import ir.value.Opcode;
import ir.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One IR operation. Operands are {@link Value}s; the instruction's own result
 * is referenced as {@code Value.result(id)}.
 */
public class Instruction {
    private final int id;
    private Opcode opcode;
    private final List<Value> operands;
    // machine address of the decoded instruction this came from, -1 if synthesized
    private final long address;
    // result or access width in bytes
    private int width;
    private Type type = UnknownType.get();
    // target variable of ASSIGN
    private int destination = -1;
    // PHI: incomingBlocks.get(i) supplies operands.get(i)
    private final List<Integer> incomingBlocks = new ArrayList<>();
    // INTRINSIC mnemonic or CALL target symbol
    private String mnemonic;

    public Instruction(int id, Opcode opcode, long address, int width, List<Value> operands) {
        this.id = id;
        this.opcode = opcode;
        this.address = address;
        this.width = width;
        this.operands = new ArrayList<>(operands);
    }

    public Instruction copy() {
        Instruction inst = new Instruction(id, opcode, address, width, operands);
        inst.type = type;
        inst.destination = destination;
        inst.incomingBlocks.addAll(incomingBlocks);
        inst.mnemonic = mnemonic;
        return inst;
    }

    public int getId() {
        return id;
    }

    public Opcode opCode() {
        return opcode;
    }

    public void setOpcode(Opcode opcode) {
        this.opcode = opcode;
    }

    public long getAddress() {
        return address;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public Value getOperand(int index) {
        return operands.get(index);
    }

    public int getNumOperands() {
        return operands.size();
    }

    public void setOperand(int index, Value value) {
        operands.set(index, value);
    }

    public void setOperands(List<Value> values) {
        operands.clear();
        operands.addAll(values);
    }

    public void addOperand(Value value) {
        operands.add(value);
    }

    /**
     * Replaces every operand equal to {@code from}.
     *
     * @return true if any operand changed
     */
    public boolean replaceUsesOf(Value from, Value to) {
        boolean changed = false;
        for (int i = 0; i < operands.size(); i++) {
            if (operands.get(i).equals(from)) {
                operands.set(i, to);
                changed = true;
            }
        }
        return changed;
    }

    public boolean uses(Value value) {
        return operands.contains(value);
    }

    public int getDestination() {
        return destination;
    }

    public void setDestination(int variableId) {
        this.destination = variableId;
    }

    public boolean isAssign() {
        return opcode == Opcode.ASSIGN;
    }

    public List<Integer> getIncomingBlocks() {
        return Collections.unmodifiableList(incomingBlocks);
    }

    public void addIncoming(Value value, int blockId) {
        operands.add(value);
        incomingBlocks.add(blockId);
    }

    public void setIncomingBlock(int index, int blockId) {
        incomingBlocks.set(index, blockId);
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public void setMnemonic(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public boolean isTerminator() {
        return opcode.isTerminator();
    }

    public boolean producesValue() {
        return opcode.producesValue();
    }

    public Value asValue() {
        return Value.result(id);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (producesValue()) {
            sb.append('%').append(id).append(" = ");
        }
        sb.append(opcode.getName());
        if (mnemonic != null) {
            sb.append(' ').append(mnemonic);
        }
        if (destination >= 0) {
            sb.append(" $").append(destination).append(',');
        }
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
            if (opcode == Opcode.PHI) {
                sb.append(" <- bb").append(incomingBlocks.get(i));
            }
        }
        return sb.toString();
    }
}
