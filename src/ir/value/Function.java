package ir.value;

import ir.Diagnostic;
import ir.type.Type;
import ir.type.UnknownType;
import ir.value.instructions.Instruction;
import structure.RegionTree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A recovered function. Blocks, variables and instructions live in
 * per-function arenas and reference each other by id.
 */
public class Function {
    private final String name;
    private final long entryAddress;
    private final LinkedHashMap<Integer, BasicBlock> blocks = new LinkedHashMap<>();
    private final LinkedHashMap<Integer, Variable> variables = new LinkedHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int entryBlockId = -1;
    private int nextBlockId = 0;
    private int nextInstructionId = 0;
    private int nextVariableId = 0;
    private Type returnType = UnknownType.get();
    private boolean returnsValue;
    private RegionTree regionTree;

    public Function(String name, long entryAddress) {
        this.name = name;
        this.entryAddress = entryAddress;
    }

    public static String defaultName(long address) {
        return "sub_" + Long.toHexString(address);
    }

    public Function copy() {
        Function f = new Function(name, entryAddress);
        blocks.forEach((id, bb) -> f.blocks.put(id, bb.copy()));
        variables.forEach((id, v) -> f.variables.put(id, v.copy()));
        f.diagnostics.addAll(diagnostics);
        f.entryBlockId = entryBlockId;
        f.nextBlockId = nextBlockId;
        f.nextInstructionId = nextInstructionId;
        f.nextVariableId = nextVariableId;
        f.returnType = returnType;
        f.returnsValue = returnsValue;
        f.regionTree = regionTree;
        return f;
    }

    /* getter setter */
    public String getName() {
        return name;
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    public Type getReturnType() {
        return returnType;
    }

    public void setReturnType(Type returnType) {
        this.returnType = returnType;
    }

    public boolean returnsValue() {
        return returnsValue;
    }

    public void setReturnsValue(boolean returnsValue) {
        this.returnsValue = returnsValue;
    }

    public RegionTree getRegionTree() {
        return regionTree;
    }

    public void setRegionTree(RegionTree regionTree) {
        this.regionTree = regionTree;
    }

    /* blocks */
    public BasicBlock newBlock(long address) {
        return newBlock(BasicBlock.nameFor(address), address);
    }

    public BasicBlock newBlock(String blockName, long address) {
        BasicBlock bb = new BasicBlock(nextBlockId++, blockName, address);
        blocks.put(bb.getId(), bb);
        if (entryBlockId < 0) {
            entryBlockId = bb.getId();
        }
        return bb;
    }

    public Collection<BasicBlock> getBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public BasicBlock getBlock(int id) {
        return blocks.get(id);
    }

    public boolean hasBlock(int id) {
        return blocks.containsKey(id);
    }

    public int getBlockCount() {
        return blocks.size();
    }

    public BasicBlock getEntryBlock() {
        return blocks.get(entryBlockId);
    }

    public int getEntryBlockId() {
        return entryBlockId;
    }

    public void setEntryBlockId(int id) {
        if (!blocks.containsKey(id)) {
            throw new IllegalArgumentException("no block " + id + " in " + name);
        }
        this.entryBlockId = id;
    }

    public void removeBlock(int id) {
        if (id == entryBlockId) {
            throw new IllegalArgumentException("cannot remove the entry block of " + name);
        }
        blocks.remove(id);
    }

    /**
     * @return block id to the ids of its known predecessors, in block order, without duplicates
     */
    public Map<Integer, List<Integer>> predecessors() {
        Map<Integer, Set<Integer>> preds = new LinkedHashMap<>();
        for (Integer id : blocks.keySet()) {
            preds.put(id, new LinkedHashSet<>());
        }
        for (BasicBlock bb : blocks.values()) {
            for (int succ : bb.getSuccessorIds()) {
                Set<Integer> set = preds.get(succ);
                if (set != null) {
                    set.add(bb.getId());
                }
            }
        }
        Map<Integer, List<Integer>> result = new LinkedHashMap<>();
        preds.forEach((id, set) -> result.put(id, new ArrayList<>(set)));
        return result;
    }

    /* instructions */
    public Instruction newInstruction(Opcode opcode, long address, int width, Value... operands) {
        return new Instruction(nextInstructionId++, opcode, address, width, Arrays.asList(operands));
    }

    public Instruction newInstruction(Opcode opcode, long address, int width, List<Value> operands) {
        return new Instruction(nextInstructionId++, opcode, address, width, operands);
    }

    public Instruction newAssign(Variable dest, Value value, long address) {
        Instruction inst = newInstruction(Opcode.ASSIGN, address, dest.getWidth(), value);
        inst.setDestination(dest.getId());
        return inst;
    }

    /**
     * @return instruction id to instruction, over all blocks
     */
    public Map<Integer, Instruction> definitions() {
        Map<Integer, Instruction> defs = new HashMap<>();
        for (BasicBlock bb : blocks.values()) {
            for (Instruction inst : bb.getInstructions()) {
                defs.put(inst.getId(), inst);
            }
        }
        return defs;
    }

    /**
     * @return instruction id to the id of the block holding it
     */
    public Map<Integer, Integer> instructionBlocks() {
        Map<Integer, Integer> owner = new HashMap<>();
        for (BasicBlock bb : blocks.values()) {
            for (Instruction inst : bb.getInstructions()) {
                owner.put(inst.getId(), bb.getId());
            }
        }
        return owner;
    }

    public int getInstructionCount() {
        int n = 0;
        for (BasicBlock bb : blocks.values()) {
            n += bb.getInstructions().size();
        }
        return n;
    }

    /* variables */
    public Variable getVariable(int id) {
        return variables.get(id);
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public void removeVariable(int id) {
        variables.remove(id);
    }

    public Variable newVariable(String varName, StorageClass storage, String register, long location, int width) {
        Variable v = new Variable(nextVariableId++, varName, storage, register, location, width);
        variables.put(v.getId(), v);
        return v;
    }

    public Variable findRegister(String register) {
        for (Variable v : variables.values()) {
            if (v.getStorage() == StorageClass.REGISTER && register.equals(v.getRegister())) {
                return v;
            }
        }
        return null;
    }

    public Variable getOrCreateRegister(String register) {
        Variable v = findRegister(register);
        return v != null ? v : newVariable(register, StorageClass.REGISTER, register, 0, 4);
    }

    /**
     * @param offset frame offset relative to the stack pointer at entry; the
     *               return address sits at offset 0
     */
    public Variable getOrCreateStackSlot(long offset, int width) {
        StorageClass storage = offset >= 4 ? StorageClass.PARAMETER : StorageClass.STACK;
        for (Variable v : variables.values()) {
            if (v.getStorage() == storage && v.getLocation() == offset) {
                if (width > v.getWidth()) {
                    v.setWidth(width);
                }
                return v;
            }
        }
        String slotName = storage == StorageClass.PARAMETER
                ? "arg" + ((offset - 4) / 4 + 1)
                : offset < 0 ? "local_" + Long.toHexString(-offset) : "stack_" + Long.toHexString(offset);
        return newVariable(slotName, storage, null, offset, width);
    }

    public Variable getOrCreateGlobal(long address, int width) {
        for (Variable v : variables.values()) {
            if (v.getStorage() == StorageClass.GLOBAL && v.getLocation() == address) {
                return v;
            }
        }
        return newVariable("g_" + Long.toHexString(address), StorageClass.GLOBAL, null, address, width);
    }

    /**
     * @return parameters ordered by frame offset
     */
    public List<Variable> getParameters() {
        List<Variable> params = new ArrayList<>();
        for (Variable v : variables.values()) {
            if (v.isParameter()) {
                params.add(v);
            }
        }
        params.sort(Comparator.comparingLong(Variable::getLocation));
        return params;
    }

    public Type typeOf(Value value) {
        return switch (value.getKind()) {
            case CONSTANT -> UnknownType.get();
            case VARIABLE -> {
                Variable v = variables.get(value.getVariableId());
                yield v == null ? UnknownType.get() : v.getType();
            }
            case RESULT -> {
                Instruction def = definitions().get(value.getInstructionId());
                yield def == null ? UnknownType.get() : def.getType();
            }
        };
    }

    /* diagnostics */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addDiagnostic(Diagnostic.Kind kind, int blockId, long address, String message) {
        diagnostics.add(new Diagnostic(kind, name, blockId, address, message));
    }

    @Override
    public String toString() {
        return name;
    }
}
