package pass.IRPass;

import frontend.Registers;
import ir.type.Type;
import ir.type.TypeLattice;
import ir.value.BasicBlock;
import ir.value.Function;
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
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Records each variable's live blocks, then folds variables whose live blocks
 * never overlap into one. Only variables of the same storage class, width and
 * a compatible type are folded; parameters, globals, the stack and frame
 * registers and anything read before it is written are left alone. The
 * variable with the lower id survives.
 */
public class CoalesceVariablesPass implements Pass.FunctionPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());
    private final TypeLattice lattice = TypeLattice.strict();

    @Override
    public String getName() {
        return IRPassType.COALESCE_VARIABLES.getName();
    }

    @Override
    public Set<AnalysisKind> requiredAnalyses() {
        return Set.of(AnalysisKind.LIVENESS);
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        Liveness liveness = context.getAnalyses().getLiveness();
        boolean changed = false;
        for (Variable v : function.getVariables()) {
            Set<Integer> blocks = liveness.liveBlocks(v.getId());
            if (!blocks.equals(v.getLiveBlocks())) {
                v.setLiveBlocks(blocks);
                changed = true;
            }
        }

        Set<Integer> liveAtEntry = liveness.getLiveIn(function.getEntryBlockId());
        List<Variable> candidates = new ArrayList<>();
        for (Variable v : function.getVariables()) {
            if (isCandidate(v) && !liveAtEntry.contains(v.getId())) {
                candidates.add(v);
            }
        }
        candidates.sort((a, b) -> Integer.compare(a.getId(), b.getId()));

        Set<Integer> merged = new TreeSet<>();
        for (int i = 0; i < candidates.size(); i++) {
            Variable keep = candidates.get(i);
            if (merged.contains(keep.getId())) {
                continue;
            }
            for (int j = i + 1; j < candidates.size(); j++) {
                Variable other = candidates.get(j);
                if (merged.contains(other.getId()) || !compatible(keep, other)) {
                    continue;
                }
                log.debug("{}: coalescing {} into {}", function.getName(), other.getName(), keep.getName());
                merge(function, keep, other);
                merged.add(other.getId());
            }
        }
        merged.forEach(function::removeVariable);
        return PassResult.of(changed || !merged.isEmpty());
    }

    private static boolean isCandidate(Variable v) {
        if (v.getStorage() == StorageClass.PARAMETER || v.getStorage() == StorageClass.GLOBAL) {
            return false;
        }
        return !v.isRegister() || !Registers.isStackRegister(v.getRegister());
    }

    private boolean compatible(Variable a, Variable b) {
        return a.getStorage() == b.getStorage()
                && a.getWidth() == b.getWidth()
                && !lattice.meet(a.getType(), b.getType()).isConflict()
                && Collections.disjoint(a.getLiveBlocks(), b.getLiveBlocks());
    }

    private void merge(Function f, Variable keep, Variable gone) {
        Value from = Value.variable(gone);
        Value to = Value.variable(keep);
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                inst.replaceUsesOf(from, to);
                if (inst.isAssign() && inst.getDestination() == gone.getId()) {
                    inst.setDestination(keep.getId());
                }
            }
        }
        Type met = lattice.meet(keep.getType(), gone.getType());
        keep.setType(met);
        Set<Integer> blocks = new TreeSet<>(keep.getLiveBlocks());
        blocks.addAll(gone.getLiveBlocks());
        keep.setLiveBlocks(blocks);
    }
}
