package pass.IRPass;

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
import pass.IRPass.analysis.Liveness;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes pure instructions nobody uses and assignments to variables that are
 * dead afterwards, then drops variables nothing references. Blocks, stores,
 * calls, intrinsics, terminators and writes to globals always stay.
 */
public class DeadCodeEliminationPass implements Pass.FunctionPass {

    @Override
    public String getName() {
        return IRPassType.DEAD_CODE.getName();
    }

    @Override
    public Set<AnalysisKind> requiredAnalyses() {
        return Set.of(AnalysisKind.LIVENESS);
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        boolean changed = false;
        Liveness liveness = context.getAnalyses().getLiveness();
        while (sweep(function, liveness)) {
            changed = true;
            liveness = new Liveness(function);
        }
        changed |= removeUnusedVariables(function);
        return PassResult.of(changed);
    }

    private boolean sweep(Function f, Liveness liveness) {
        Map<Integer, Integer> useCount = new HashMap<>();
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (Value v : inst.getOperands()) {
                    if (v.isResult()) {
                        useCount.merge(v.getInstructionId(), 1, Integer::sum);
                    }
                }
            }
        }
        boolean changed = false;
        for (BasicBlock bb : f.getBlocks()) {
            Set<Integer> live = new HashSet<>(liveness.getLiveOut(bb.getId()));
            List<Instruction> insts = bb.getInstructions();
            List<Instruction> removed = new ArrayList<>();
            for (int i = insts.size() - 1; i >= 0; i--) {
                Instruction inst = insts.get(i);
                boolean dead;
                if (inst.isAssign()) {
                    Variable dest = f.getVariable(inst.getDestination());
                    dead = dest.getStorage() != StorageClass.GLOBAL && !live.contains(dest.getId());
                    if (!dead) {
                        live.remove(dest.getId());
                    }
                } else {
                    dead = inst.producesValue() && inst.opCode().isPure()
                            && useCount.getOrDefault(inst.getId(), 0) == 0;
                }
                if (dead) {
                    removed.add(inst);
                    for (Value v : inst.getOperands()) {
                        if (v.isResult()) {
                            useCount.merge(v.getInstructionId(), -1, Integer::sum);
                        }
                    }
                    continue;
                }
                if (inst.opCode() != Opcode.PHI) {
                    for (Value v : inst.getOperands()) {
                        if (v.isVariable()) {
                            live.add(v.getVariableId());
                        }
                    }
                }
            }
            if (!removed.isEmpty()) {
                insts.removeAll(removed);
                changed = true;
            }
        }
        return changed;
    }

    private boolean removeUnusedVariables(Function f) {
        Set<Integer> referenced = new HashSet<>();
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isAssign()) {
                    referenced.add(inst.getDestination());
                }
                for (Value v : inst.getOperands()) {
                    if (v.isVariable()) {
                        referenced.add(v.getVariableId());
                    }
                }
            }
        }
        List<Integer> unused = new ArrayList<>();
        for (Variable v : f.getVariables()) {
            if (!v.isParameter() && !referenced.contains(v.getId())) {
                unused.add(v.getId());
            }
        }
        unused.forEach(f::removeVariable);
        return !unused.isEmpty();
    }
}
