package pass.IRPass;

import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.EdgeKind;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.Instruction;
import pass.IRPassType;
import pass.Pass;
import pass.PassContext;
import pass.PassResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Funnels every return through one exit block. When the returned values
 * differ, the exit block merges them with a PHI.
 */
public class MergeReturnsPass implements Pass.FunctionPass {

    @Override
    public String getName() {
        return IRPassType.MERGE_RETURNS.getName();
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        List<BasicBlock> returns = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            if (bb.isReturnBlock()) {
                returns.add(bb);
            }
        }
        if (returns.size() < 2) {
            return PassResult.UNCHANGED;
        }

        BasicBlock exit = function.newBlock("bb_exit", -1);
        boolean allUnreachable = true;
        List<Value> values = new ArrayList<>();
        for (BasicBlock bb : returns) {
            Instruction ret = bb.getTerminator();
            if (ret.getNumOperands() > 0) {
                values.add(ret.getOperand(0));
            }
            bb.removeInstruction(ret);
            bb.addInstruction(function.newInstruction(Opcode.BRANCH, ret.getAddress(), 0));
            bb.setSuccessors(List.of(Edge.of(EdgeKind.UNCONDITIONAL, exit.getId())));
            allUnreachable &= bb.isUnreachable();
        }
        exit.setUnreachable(allUnreachable);

        Instruction ret = function.newInstruction(Opcode.RETURN, -1, 0);
        if (values.size() == returns.size()) {
            if (values.stream().distinct().count() == 1) {
                ret.addOperand(values.get(0));
            } else {
                Instruction phi = function.newInstruction(Opcode.PHI, -1, 4);
                for (int i = 0; i < returns.size(); i++) {
                    phi.addIncoming(values.get(i), returns.get(i).getId());
                }
                exit.addInstruction(phi);
                ret.addOperand(phi.asValue());
            }
        }
        exit.addInstruction(ret);
        return PassResult.CFG_CHANGED;
    }
}
