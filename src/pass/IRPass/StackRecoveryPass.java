package pass.IRPass;

import frontend.Registers;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.StorageClass;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.PassContext;
import pass.PassResult;
import pass.IRPass.analysis.AnalysisKind;
import pass.IRPass.analysis.ControlFlowGraph;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Recovers the stack frame.
 *
 * <p>A forward dataflow tracks which registers and results hold the entry
 * stack pointer plus a known offset. Loads and stores at known offsets become
 * reads and writes of slot variables: offsets at or above 4 are parameters,
 * negative ones locals. Pushes feeding a call are folded into the call's
 * arguments, callee-saved register spills are dropped, and finally the
 * stack and frame pointer bookkeeping is removed when nothing else reads it.
 */
public class StackRecoveryPass implements Pass.FunctionPass {
    private static final Logger logger = LoggingManager.getLogger(StackRecoveryPass.class);

    @Override
    public String getName() {
        return IRPassType.STACK_RECOVERY.getName();
    }

    @Override
    public Set<AnalysisKind> requiredAnalyses() {
        return Set.of(AnalysisKind.CFG);
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        Variable esp = function.findRegister(Registers.ESP);
        boolean changed = false;
        if (esp != null) {
            Offsets offsets = new Offsets(function, esp);
            offsets.run(context.getAnalyses().getCfg());
            changed |= rewriteAccesses(function, offsets);
            changed |= foldCallArguments(function, offsets);
        }
        changed |= ensureParameters(function);
        changed |= removeSpills(function);
        changed |= removeFrame(function);
        if (changed) {
            logger.debug("{}: frame recovered, {} parameters", function.getName(),
                    function.getParameters().size());
        }
        return PassResult.of(changed);
    }

    /**
     * Known stack offsets, relative to the stack pointer at entry.
     */
    private static final class Offsets {
        private final Function function;
        private final Variable esp;
        // result id -> offset held by the result
        private final Map<Integer, Long> results = new HashMap<>();
        // load/store id -> offset it accesses
        private final Map<Integer, Long> accesses = new HashMap<>();
        // call id -> stack pointer offset at the call
        private final Map<Integer, Long> calls = new HashMap<>();

        Offsets(Function function, Variable esp) {
            this.function = function;
            this.esp = esp;
        }

        void run(ControlFlowGraph cfg) {
            Map<Integer, Map<Integer, Long>> outs = new HashMap<>();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (int node : cfg.reversePostOrder()) {
                    Map<Integer, Long> state = null;
                    if (node == cfg.getEntry()) {
                        state = new HashMap<>();
                        state.put(esp.getId(), 0L);
                    }
                    for (int p : cfg.predecessors(node)) {
                        Map<Integer, Long> out = outs.get(cfg.idOf(p));
                        if (out != null) {
                            state = state == null ? new HashMap<>(out) : meet(state, out);
                        }
                    }
                    if (state == null) {
                        continue;
                    }
                    BasicBlock bb = function.getBlock(cfg.idOf(node));
                    Map<Integer, Long> out = transfer(bb, state);
                    if (!out.equals(outs.get(bb.getId()))) {
                        outs.put(bb.getId(), out);
                        changed = true;
                    }
                }
            }
        }

        private static Map<Integer, Long> meet(Map<Integer, Long> a, Map<Integer, Long> b) {
            Map<Integer, Long> m = new HashMap<>();
            for (Map.Entry<Integer, Long> e : a.entrySet()) {
                if (e.getValue().equals(b.get(e.getKey()))) {
                    m.put(e.getKey(), e.getValue());
                }
            }
            return m;
        }

        private Map<Integer, Long> transfer(BasicBlock bb, Map<Integer, Long> state) {
            for (Instruction inst : bb.getInstructions()) {
                int id = inst.getId();
                switch (inst.opCode()) {
                    case ADD, SUB -> {
                        Long a = offset(inst.getOperand(0), state);
                        Value b = inst.getOperand(1);
                        Long r = null;
                        if (a != null && b.isConstant()) {
                            r = inst.opCode() == Opcode.ADD ? a + b.getConstant() : a - b.getConstant();
                        } else if (inst.opCode() == Opcode.ADD && inst.getOperand(0).isConstant()) {
                            Long c = offset(b, state);
                            r = c == null ? null : c + inst.getOperand(0).getConstant();
                        }
                        record(results, id, r);
                    }
                    case COPY -> record(results, id, offset(inst.getOperand(0), state));
                    case LOAD -> record(accesses, id, offset(inst.getOperand(0), state));
                    case STORE -> record(accesses, id, offset(inst.getOperand(0), state));
                    case ASSIGN -> {
                        Long v = offset(inst.getOperand(0), state);
                        if (v != null) {
                            state.put(inst.getDestination(), v);
                        } else {
                            state.remove(inst.getDestination());
                        }
                    }
                    case CALL -> {
                        record(calls, id, state.get(esp.getId()));
                        for (String reg : Registers.CALL_CLOBBERED) {
                            Variable v = function.findRegister(reg);
                            if (v != null) {
                                state.remove(v.getId());
                            }
                        }
                    }
                    default -> {
                    }
                }
            }
            return state;
        }

        private Long offset(Value v, Map<Integer, Long> state) {
            if (v.isVariable()) {
                return state.get(v.getVariableId());
            }
            if (v.isResult()) {
                return results.get(v.getInstructionId());
            }
            return null;
        }

        private static void record(Map<Integer, Long> map, int id, Long value) {
            if (value != null) {
                map.put(id, value);
            } else {
                map.remove(id);
            }
        }
    }

    private boolean rewriteAccesses(Function f, Offsets offsets) {
        boolean changed = false;
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                Long k = offsets.accesses.get(inst.getId());
                if (k == null) {
                    continue;
                }
                Variable slot = f.getOrCreateStackSlot(k, inst.getWidth());
                if (inst.opCode() == Opcode.LOAD) {
                    inst.setOpcode(Opcode.COPY);
                    inst.setOperands(List.of(Value.variable(slot)));
                } else {
                    Value stored = inst.getOperand(1);
                    inst.setOpcode(Opcode.ASSIGN);
                    inst.setDestination(slot.getId());
                    inst.setOperands(List.of(stored));
                }
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Creates the parameters below the highest one used so their numbering has no gaps.
     */
    private boolean ensureParameters(Function f) {
        long max = 0;
        for (Variable v : f.getParameters()) {
            max = Math.max(max, v.getLocation());
        }
        boolean changed = false;
        Set<Long> present = new HashSet<>();
        for (Variable v : f.getParameters()) {
            present.add(v.getLocation());
        }
        for (long k = 4; k <= max; k += 4) {
            if (!present.contains(k)) {
                f.getOrCreateStackSlot(k, 4);
                changed = true;
            }
        }
        return changed;
    }

    private boolean foldCallArguments(Function f, Offsets offsets) {
        Set<Integer> readSlots = new HashSet<>();
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (Value v : inst.getOperands()) {
                    if (v.isVariable()) {
                        readSlots.add(v.getVariableId());
                    }
                }
            }
        }
        boolean changed = false;
        for (BasicBlock bb : f.getBlocks()) {
            List<Instruction> insts = bb.getInstructions();
            Map<Long, Integer> slotWrites = new HashMap<>();
            Set<Instruction> folded = new HashSet<>();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst.isAssign()) {
                    Variable dest = f.getVariable(inst.getDestination());
                    if (dest.getStorage() == StorageClass.STACK) {
                        slotWrites.put(dest.getLocation(), i);
                    }
                    continue;
                }
                if (inst.opCode() != Opcode.CALL) {
                    continue;
                }
                Long sp = offsets.calls.get(inst.getId());
                if (sp != null) {
                    for (long k = sp; slotWrites.containsKey(k); k += 4) {
                        Instruction push = insts.get(slotWrites.get(k));
                        if (readSlots.contains(push.getDestination())
                                || reassignedBetween(f, insts, push.getOperand(0), slotWrites.get(k), i)) {
                            break;
                        }
                        inst.addOperand(pushedValue(f, insts, push.getOperand(0), i));
                        folded.add(push);
                    }
                }
                slotWrites.clear();
            }
            if (!folded.isEmpty()) {
                insts.removeAll(folded);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * A pushed stack slot or register read arrives as the result of a COPY;
     * the call gets the copied variable itself while it still holds that value.
     */
    private static Value pushedValue(Function f, List<Instruction> insts, Value v, int call) {
        if (!v.isResult()) {
            return v;
        }
        for (int j = call - 1; j >= 0; j--) {
            Instruction def = insts.get(j);
            if (def.getId() != v.getInstructionId()) {
                continue;
            }
            if (def.opCode() == Opcode.COPY && def.getOperand(0).isVariable()
                    && !reassignedBetween(f, insts, def.getOperand(0), j, call)) {
                return def.getOperand(0);
            }
            return v;
        }
        return v;
    }

    private static boolean reassignedBetween(Function f, List<Instruction> insts, Value v, int from, int to) {
        if (!v.isVariable()) {
            return false;
        }
        for (int j = from + 1; j < to; j++) {
            Instruction inst = insts.get(j);
            if (inst.isAssign() && inst.getDestination() == v.getVariableId()) {
                return true;
            }
            if (inst.opCode() == Opcode.CALL && f.getVariable(v.getVariableId()).getStorage() != StorageClass.REGISTER) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops saves of callee-saved registers to stack slots together with the
     * matching restores, when the slot is used for nothing else.
     */
    private boolean removeSpills(Function f) {
        boolean changed = false;
        BasicBlock entry = f.getEntryBlock();
        for (String reg : Registers.CALLEE_SAVED) {
            Variable r = f.findRegister(reg);
            if (r == null) {
                continue;
            }
            Map<Integer, List<Instruction>> users = users(f);
            Set<Integer> candidates = new TreeSet<>();
            for (Instruction inst : entry.getInstructions()) {
                if (inst.isAssign() && inst.getOperand(0).refersTo(r)
                        && f.getVariable(inst.getDestination()).getStorage() == StorageClass.STACK) {
                    candidates.add(inst.getDestination());
                }
            }
            for (int slotId : candidates) {
                List<Instruction> remove = spillInstructions(f, entry, r, f.getVariable(slotId), users);
                if (remove == null) {
                    continue;
                }
                for (BasicBlock bb : f.getBlocks()) {
                    bb.getInstructions().removeAll(remove);
                }
                f.removeVariable(slotId);
                changed = true;
            }
        }
        return changed;
    }

    private List<Instruction> spillInstructions(Function f, BasicBlock entry, Variable reg, Variable slot,
            Map<Integer, List<Instruction>> users) {
        List<Instruction> remove = new ArrayList<>();
        boolean regWritten = false;
        for (Instruction inst : entry.getInstructions()) {
            if (inst.isAssign() && inst.getDestination() == slot.getId()) {
                if (regWritten || !inst.getOperand(0).refersTo(reg)) {
                    return null;
                }
                remove.add(inst);
            }
            if (inst.isAssign() && inst.getDestination() == reg.getId()) {
                regWritten = true;
            }
        }
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (bb != entry && inst.isAssign() && inst.getDestination() == slot.getId()) {
                    return null;
                }
                if (!inst.uses(Value.variable(slot)) || remove.contains(inst)) {
                    continue;
                }
                if (inst.opCode() != Opcode.COPY) {
                    return null;
                }
                remove.add(inst);
                for (Instruction user : users.getOrDefault(inst.getId(), List.of())) {
                    if (!user.isAssign() || user.getDestination() != reg.getId()) {
                        return null;
                    }
                    remove.add(user);
                }
            }
        }
        return remove;
    }

    /**
     * Removes all writes to the stack and frame pointers plus the pure
     * computations that only feed them, unless something else reads them.
     */
    private boolean removeFrame(Function f) {
        Set<Integer> frameRegs = new HashSet<>();
        for (String reg : List.of(Registers.ESP, Registers.EBP)) {
            Variable v = f.findRegister(reg);
            if (v != null) {
                frameRegs.add(v.getId());
            }
        }
        if (frameRegs.isEmpty()) {
            return false;
        }
        Map<Integer, List<Instruction>> users = users(f);
        Set<Instruction> dead = new HashSet<>();
        Set<Integer> deadResults = new HashSet<>();
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isAssign() && frameRegs.contains(inst.getDestination())) {
                    dead.add(inst);
                }
            }
        }
        if (dead.isEmpty()) {
            return false;
        }
        boolean grew = true;
        while (grew) {
            grew = false;
            for (BasicBlock bb : f.getBlocks()) {
                for (Instruction inst : bb.getInstructions()) {
                    if (dead.contains(inst) || !inst.producesValue() || !inst.opCode().isPure()
                            || !readsFrame(inst, frameRegs, deadResults)) {
                        continue;
                    }
                    if (dead.containsAll(users.getOrDefault(inst.getId(), List.of()))) {
                        dead.add(inst);
                        deadResults.add(inst.getId());
                        grew = true;
                    }
                }
            }
        }
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (!dead.contains(inst) && readsFrame(inst, frameRegs, deadResults)) {
                    logger.debug("{}: frame pointer escapes at {}", f.getName(), inst);
                    return false;
                }
            }
        }
        for (BasicBlock bb : f.getBlocks()) {
            bb.getInstructions().removeAll(dead);
        }
        return true;
    }

    private static boolean readsFrame(Instruction inst, Set<Integer> frameRegs, Set<Integer> deadResults) {
        for (Value v : inst.getOperands()) {
            if (v.isVariable() && frameRegs.contains(v.getVariableId())
                    || v.isResult() && deadResults.contains(v.getInstructionId())) {
                return true;
            }
        }
        return false;
    }

    static Map<Integer, List<Instruction>> users(Function f) {
        Map<Integer, List<Instruction>> users = new HashMap<>();
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (Value v : inst.getOperands()) {
                    if (v.isResult()) {
                        users.computeIfAbsent(v.getInstructionId(), k -> new ArrayList<>()).add(inst);
                    }
                }
            }
        }
        return users;
    }
}
