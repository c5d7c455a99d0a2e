package pass.IRPass;

import exception.InvariantViolationException;
import ir.IRModule;
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
import pass.IRPass.analysis.ControlFlowGraph;
import pass.IRPass.analysis.DominanceAnalysis;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural IR checks. Run by the pipeline after every pass that changed
 * something, and on a freshly built module.
 * - every block ends in exactly one terminator, with the edges its opcode requires
 * - edge targets are blocks of the function or the unknown sentinel
 * - operands reference existing variables and value-producing instructions
 * - a result is defined before its use: earlier in the same block or in a dominating block
 * - PHI nodes are grouped at the top of blocks and their incoming blocks are predecessors
 */
public class VerifyIRPass implements Pass.FunctionPass {

    @Override
    public String getName() {
        return IRPassType.VERIFY.getName();
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        verify(function);
        return PassResult.UNCHANGED;
    }

    public static void verify(IRModule module) {
        for (Function f : module.getFunctions()) {
            verify(f);
        }
    }

    public static void verify(Function f) {
        BasicBlock entry = f.getEntryBlock();
        if (entry == null) {
            throw new InvariantViolationException("function has no entry block", f.getName(), -1);
        }

        Map<Integer, Instruction> defs = new HashMap<>();
        Map<Integer, Integer> defBlock = new HashMap<>();
        Map<Integer, Integer> defIndex = new HashMap<>();
        for (BasicBlock bb : f.getBlocks()) {
            List<Instruction> insts = bb.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (defs.put(inst.getId(), inst) != null) {
                    fail(f, bb, "instruction id %" + inst.getId() + " is used twice");
                }
                defBlock.put(inst.getId(), bb.getId());
                defIndex.put(inst.getId(), i);
            }
        }

        Map<Integer, List<Integer>> preds = f.predecessors();
        ControlFlowGraph cfg = ControlFlowGraph.of(f);
        DominanceAnalysis dom = new DominanceAnalysis(cfg);

        for (BasicBlock bb : f.getBlocks()) {
            checkTerminator(f, bb);
            checkEdges(f, bb);
            List<Instruction> insts = bb.getInstructions();
            boolean seenNonPhi = false;
            for (int i = 0; i < insts.size(); i++) {
                Instruction inst = insts.get(i);
                if (inst.opCode() == Opcode.PHI) {
                    if (seenNonPhi) {
                        fail(f, bb, "PHI %" + inst.getId() + " appears after a non-PHI instruction");
                    }
                    checkPhi(f, bb, inst, preds.get(bb.getId()));
                } else {
                    seenNonPhi = true;
                }
                if (inst.isAssign() && f.getVariable(inst.getDestination()) == null) {
                    fail(f, bb, "assignment to unknown variable $" + inst.getDestination());
                }
                for (Value v : inst.getOperands()) {
                    if (v.isVariable() && f.getVariable(v.getVariableId()) == null) {
                        fail(f, bb, "%" + inst.getId() + " reads unknown variable " + v);
                    }
                    if (!v.isResult()) {
                        continue;
                    }
                    Instruction def = defs.get(v.getInstructionId());
                    if (def == null || !def.producesValue()) {
                        fail(f, bb, "%" + inst.getId() + " uses " + v + " which defines no value");
                    }
                    if (inst.opCode() == Opcode.PHI) {
                        continue;
                    }
                    int db = defBlock.get(def.getId());
                    if (db == bb.getId()) {
                        if (defIndex.get(def.getId()) >= i) {
                            fail(f, bb, "%" + inst.getId() + " uses " + v + " before its definition");
                        }
                    } else if (cfg.isReachable(cfg.indexOf(bb.getId()))
                            && !dom.dominates(cfg.indexOf(db), cfg.indexOf(bb.getId()))) {
                        fail(f, bb, "%" + inst.getId() + " uses " + v + " whose definition does not dominate it");
                    }
                }
            }
        }
    }

    private static void checkTerminator(Function f, BasicBlock bb) {
        List<Instruction> insts = bb.getInstructions();
        if (insts.isEmpty() || !insts.get(insts.size() - 1).isTerminator()) {
            fail(f, bb, "block " + bb.getName() + " has no terminator");
        }
        for (int i = 0; i < insts.size() - 1; i++) {
            if (insts.get(i).isTerminator()) {
                fail(f, bb, "terminator %" + insts.get(i).getId() + " in the middle of " + bb.getName());
            }
        }
    }

    private static void checkEdges(Function f, BasicBlock bb) {
        Instruction term = bb.getTerminator();
        List<Edge> edges = bb.getSuccessors();
        for (Edge e : edges) {
            if (e.isUnknown()) {
                if (e.getTarget() != Edge.UNKNOWN_TARGET) {
                    fail(f, bb, "unknown edge with a block target");
                }
            } else if (!f.hasBlock(e.getTarget())) {
                fail(f, bb, "edge to missing block " + e.getTarget());
            }
        }
        switch (term.opCode()) {
            case RETURN -> {
                if (!edges.isEmpty()) {
                    fail(f, bb, "return block has successors");
                }
            }
            case BRANCH -> {
                if (edges.size() != 1) {
                    fail(f, bb, "branch needs exactly one edge, has " + edges.size());
                }
            }
            case COND_BRANCH -> {
                if (edges.size() != 2 || term.getNumOperands() != 1) {
                    fail(f, bb, "conditional branch needs a condition and two edges");
                }
                if (!edges.get(0).isUnknown() && edges.get(0).getKind() != EdgeKind.TRUE
                        || !edges.get(1).isUnknown() && edges.get(1).getKind() != EdgeKind.FALSE) {
                    fail(f, bb, "conditional branch edges must be [true, false]");
                }
            }
            case SWITCH -> {
                if (edges.isEmpty() || term.getNumOperands() != 1) {
                    fail(f, bb, "switch needs an index and at least one edge");
                }
            }
            default -> fail(f, bb, term.opCode().getName() + " is not a terminator");
        }
    }

    private static void checkPhi(Function f, BasicBlock bb, Instruction phi, List<Integer> preds) {
        List<Integer> incoming = phi.getIncomingBlocks();
        if (incoming.size() != phi.getNumOperands()) {
            fail(f, bb, "PHI %" + phi.getId() + " has " + phi.getNumOperands() + " values for "
                    + incoming.size() + " blocks");
        }
        Set<Integer> predSet = new HashSet<>(preds);
        for (int from : incoming) {
            if (!predSet.contains(from)) {
                fail(f, bb, "PHI %" + phi.getId() + " names block " + from + " which is not a predecessor");
            }
        }
    }

    private static void fail(Function f, BasicBlock bb, String message) {
        throw new InvariantViolationException(message, f.getName(), bb.getId());
    }
}
