package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Backward liveness of variables at block granularity. A phi operand is a use
 * at the end of its incoming block, not in the phi's own block.
 */
public class Liveness {
    private final Map<Integer, Set<Integer>> uses = new HashMap<>();
    private final Map<Integer, Set<Integer>> defs = new HashMap<>();
    private final Map<Integer, Set<Integer>> liveIn = new HashMap<>();
    private final Map<Integer, Set<Integer>> liveOut = new HashMap<>();

    public Liveness(Function f) {
        Map<Integer, Set<Integer>> phiOut = new HashMap<>();
        List<BasicBlock> blocks = new ArrayList<>(f.getBlocks());
        for (BasicBlock bb : blocks) {
            uses.put(bb.getId(), new TreeSet<>());
            defs.put(bb.getId(), new TreeSet<>());
            liveIn.put(bb.getId(), new TreeSet<>());
            liveOut.put(bb.getId(), new TreeSet<>());
            phiOut.put(bb.getId(), new TreeSet<>());
        }
        for (BasicBlock bb : blocks) {
            Set<Integer> use = uses.get(bb.getId());
            Set<Integer> def = defs.get(bb.getId());
            for (Instruction inst : bb.getInstructions()) {
                if (inst.opCode() == Opcode.PHI) {
                    for (int i = 0; i < inst.getNumOperands(); i++) {
                        Value v = inst.getOperand(i);
                        Set<Integer> out = phiOut.get(inst.getIncomingBlocks().get(i));
                        if (v.isVariable() && out != null) {
                            out.add(v.getVariableId());
                        }
                    }
                    continue;
                }
                for (Value v : inst.getOperands()) {
                    if (v.isVariable() && !def.contains(v.getVariableId())) {
                        use.add(v.getVariableId());
                    }
                }
                if (inst.isAssign()) {
                    def.add(inst.getDestination());
                }
            }
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int k = blocks.size() - 1; k >= 0; k--) {
                BasicBlock bb = blocks.get(k);
                int id = bb.getId();
                Set<Integer> out = new TreeSet<>(phiOut.get(id));
                for (int s : bb.getSuccessorIds()) {
                    Set<Integer> in = liveIn.get(s);
                    if (in != null) {
                        out.addAll(in);
                    }
                }
                Set<Integer> in = new TreeSet<>(out);
                in.removeAll(defs.get(id));
                in.addAll(uses.get(id));
                if (!out.equals(liveOut.get(id)) || !in.equals(liveIn.get(id))) {
                    liveOut.put(id, out);
                    liveIn.put(id, in);
                    changed = true;
                }
            }
        }
    }

    public Set<Integer> getLiveIn(int blockId) {
        return Collections.unmodifiableSet(liveIn.getOrDefault(blockId, Set.of()));
    }

    public Set<Integer> getLiveOut(int blockId) {
        return Collections.unmodifiableSet(liveOut.getOrDefault(blockId, Set.of()));
    }

    public boolean isLiveOut(int variableId, int blockId) {
        return getLiveOut(blockId).contains(variableId);
    }

    /**
     * @return blocks where the variable is live on entry, live on exit, read or written
     */
    public Set<Integer> liveBlocks(int variableId) {
        Set<Integer> blocks = new TreeSet<>();
        for (Integer id : liveIn.keySet()) {
            if (liveIn.get(id).contains(variableId) || liveOut.get(id).contains(variableId)
                    || uses.get(id).contains(variableId) || defs.get(id).contains(variableId)) {
                blocks.add(id);
            }
        }
        return blocks;
    }
}
