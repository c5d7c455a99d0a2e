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

import java.util.HashMap;
import java.util.Map;

/**
 * Block-local forward propagation. A read of a variable is replaced by the
 * value last assigned to it in the same block, and a use of a COPY result by
 * the copied variable, for as long as neither has been overwritten. Calls,
 * stores and intrinsics overwrite every memory-backed variable.
 */
public class CopyPropagationPass implements Pass.FunctionPass {

    @Override
    public String getName() {
        return IRPassType.COPY_PROPAGATION.getName();
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        boolean changed = false;
        for (BasicBlock bb : function.getBlocks()) {
            changed |= propagate(function, bb);
        }
        return PassResult.of(changed);
    }

    private boolean propagate(Function f, BasicBlock bb) {
        Map<Integer, Value> available = new HashMap<>();
        Map<Integer, Value> copies = new HashMap<>();
        boolean changed = false;
        for (Instruction inst : bb.getInstructions()) {
            if (inst.opCode() != Opcode.PHI) {
                for (int i = 0; i < inst.getNumOperands(); i++) {
                    Value v = inst.getOperand(i);
                    Value r = resolve(v, available, copies);
                    if (!r.equals(v)) {
                        inst.setOperand(i, r);
                        changed = true;
                    }
                }
            }
            switch (inst.opCode()) {
                case COPY -> copies.put(inst.getId(), inst.getOperand(0));
                case ASSIGN -> {
                    int dest = inst.getDestination();
                    kill(dest, available, copies);
                    if (!inst.getOperand(0).isVariable() || inst.getOperand(0).getVariableId() != dest) {
                        available.put(dest, inst.getOperand(0));
                    }
                }
                case CALL, STORE, INTRINSIC -> {
                    for (Variable v : f.getVariables()) {
                        if (v.getStorage() != StorageClass.REGISTER
                                || inst.opCode() == Opcode.CALL && Registers.CALL_CLOBBERED.contains(v.getRegister())) {
                            kill(v.getId(), available, copies);
                        }
                    }
                }
                default -> {
                }
            }
        }
        return changed;
    }

    private static Value resolve(Value v, Map<Integer, Value> available, Map<Integer, Value> copies) {
        if (v.isVariable()) {
            Value a = available.get(v.getVariableId());
            return a != null ? a : v;
        }
        if (v.isResult()) {
            Value c = copies.get(v.getInstructionId());
            return c != null ? c : v;
        }
        return v;
    }

    private static void kill(int variableId, Map<Integer, Value> available, Map<Integer, Value> copies) {
        Value killed = Value.variable(variableId);
        available.remove(variableId);
        available.values().removeIf(killed::equals);
        copies.values().removeIf(killed::equals);
    }
}
