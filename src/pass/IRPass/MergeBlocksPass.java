package pass.IRPass;

import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.PassContext;
import pass.PassResult;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends a block to its predecessor when the predecessor ends in a plain
 * branch to it and it has no other predecessor. Single-incoming PHIs are
 * replaced by their value first.
 */
public class MergeBlocksPass implements Pass.FunctionPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public String getName() {
        return IRPassType.MERGE_BLOCKS.getName();
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        boolean changed = false;
        while (mergeOne(function)) {
            changed = true;
        }
        return changed ? PassResult.CFG_CHANGED : PassResult.UNCHANGED;
    }

    private boolean mergeOne(Function f) {
        Map<Integer, List<Integer>> preds = f.predecessors();
        for (BasicBlock a : f.getBlocks()) {
            Instruction term = a.getTerminator();
            if (term == null || term.opCode() != Opcode.BRANCH || a.getSuccessors().size() != 1) {
                continue;
            }
            Edge edge = a.getSuccessors().get(0);
            if (edge.isUnknown() || edge.getTarget() == a.getId() || edge.getTarget() == f.getEntryBlockId()) {
                continue;
            }
            BasicBlock b = f.getBlock(edge.getTarget());
            if (preds.get(b.getId()).size() != 1) {
                continue;
            }
            eliminateSingleIncomingPhis(f, b);
            a.removeInstruction(term);
            for (Instruction inst : b.getInstructions()) {
                a.addInstruction(inst);
            }
            a.setSuccessors(b.getSuccessors());
            retargetPhis(f, b.getId(), a.getId());
            f.removeBlock(b.getId());
            log.debug("{}: merged {} into {}", f.getName(), b.getName(), a.getName());
            return true;
        }
        return false;
    }

    private void eliminateSingleIncomingPhis(Function f, BasicBlock block) {
        List<Instruction> phis = new ArrayList<>();
        for (Instruction inst : block.getInstructions()) {
            if (inst.opCode() == Opcode.PHI) {
                phis.add(inst);
            }
        }
        for (Instruction phi : phis) {
            Value incoming = phi.getOperand(0);
            for (BasicBlock bb : f.getBlocks()) {
                for (Instruction inst : bb.getInstructions()) {
                    inst.replaceUsesOf(phi.asValue(), incoming);
                }
            }
            block.removeInstruction(phi);
        }
    }

    private static void retargetPhis(Function f, int from, int to) {
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.opCode() != Opcode.PHI) {
                    continue;
                }
                for (int i = 0; i < inst.getIncomingBlocks().size(); i++) {
                    if (inst.getIncomingBlocks().get(i) == from) {
                        inst.setIncomingBlock(i, to);
                    }
                }
            }
        }
    }
}
