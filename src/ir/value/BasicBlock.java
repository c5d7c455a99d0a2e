package ir.value;

import ir.value.instructions.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BasicBlock {
    private final int id;
    private final String name;
    // address of the first decoded instruction, -1 for synthesized blocks
    private final long startAddress;
    private final List<Instruction> instructions = new ArrayList<>();
    private final List<Edge> successors = new ArrayList<>();
    private boolean unreachable;

    public BasicBlock(int id, String name, long startAddress) {
        this.id = id;
        this.name = name;
        this.startAddress = startAddress;
    }

    public static String nameFor(long address) {
        return "bb_" + Long.toHexString(address);
    }

    public BasicBlock copy() {
        BasicBlock bb = new BasicBlock(id, name, startAddress);
        for (Instruction inst : instructions) {
            bb.instructions.add(inst.copy());
        }
        bb.successors.addAll(successors);
        bb.unreachable = unreachable;
        return bb;
    }

    /* getter setter */
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getStartAddress() {
        return startAddress;
    }

    public String getLabel() {
        return startAddress >= 0 ? "label_" + Long.toHexString(startAddress) : "label_b" + id;
    }

    public boolean isUnreachable() {
        return unreachable;
    }

    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction getTerminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public void addInstruction(Instruction inst) {
        instructions.add(inst);
    }

    public boolean removeInstruction(Instruction inst) {
        return instructions.remove(inst);
    }

    public List<Edge> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public void addSuccessor(Edge edge) {
        successors.add(edge);
    }

    public void setSuccessors(List<Edge> edges) {
        successors.clear();
        successors.addAll(edges);
    }

    public void setSuccessor(int index, Edge edge) {
        successors.set(index, edge);
    }

    /**
     * @return ids of known successor blocks in edge order, duplicates preserved
     */
    public List<Integer> getSuccessorIds() {
        List<Integer> ids = new ArrayList<>();
        for (Edge e : successors) {
            if (!e.isUnknown()) {
                ids.add(e.getTarget());
            }
        }
        return ids;
    }

    public boolean hasUnknownSuccessor() {
        for (Edge e : successors) {
            if (e.isUnknown()) {
                return true;
            }
        }
        return false;
    }

    public boolean isReturnBlock() {
        Instruction term = getTerminator();
        return term != null && term.opCode() == Opcode.RETURN;
    }

    @Override
    public String toString() {
        return name;
    }
}
