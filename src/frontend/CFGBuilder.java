package frontend;

import exception.MalformedInputException;
import ir.Diagnostic;
import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.EdgeKind;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.Variable;
import ir.value.instructions.Instruction;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link Function} per entry address from the decoder stream.
 *
 * <p>A block starts at the function entry, at every branch or call target inside
 * the function, and right after every control transfer. Successor addresses that
 * match no block become UNKNOWN edges and are reported as warnings. Blocks the
 * entry cannot reach are kept and flagged.
 */
public class CFGBuilder {
    private static final Logger logger = LoggingManager.getLogger(CFGBuilder.class);

    public IRModule build(Listing listing) {
        return build(listing.getName(), listing.getInstructions(), listing.getFunctionNames());
    }

    public IRModule build(String moduleName, List<DecodedInstruction> records, Map<Long, String> names) {
        Map<Long, List<DecodedInstruction>> groups = new LinkedHashMap<>();
        Map<Long, Long> owner = new HashMap<>();
        for (DecodedInstruction r : records) {
            String fn = nameOf(r.getFunctionEntry(), names);
            if (owner.putIfAbsent(r.getAddress(), r.getFunctionEntry()) != null) {
                throw MalformedInputException.duplicateAddress(fn, r.getAddress());
            }
            groups.computeIfAbsent(r.getFunctionEntry(), k -> new ArrayList<>()).add(r);
        }

        IRModule module = new IRModule(moduleName);
        for (Map.Entry<Long, List<DecodedInstruction>> group : groups.entrySet()) {
            long entry = group.getKey();
            String name = nameOf(entry, names);
            if (owner.get(entry) == null || owner.get(entry) != entry) {
                throw MalformedInputException.missingEntry(name, entry);
            }
            checkCrossFunctionEdges(name, entry, group.getValue(), owner, names);
            Function f = buildFunction(name, entry, group.getValue());
            module.addFunction(f);
        }
        logger.info("built {} functions from {} instructions", module.getFunctions().size(), records.size());
        return module;
    }

    private static String nameOf(long entry, Map<Long, String> names) {
        String n = names.get(entry);
        return n != null ? n : Function.defaultName(entry);
    }

    private void checkCrossFunctionEdges(String name, long entry, List<DecodedInstruction> recs,
            Map<Long, Long> owner, Map<Long, String> names) {
        for (DecodedInstruction r : recs) {
            if (r.isCall()) {
                continue;
            }
            for (long s : r.getSuccessors()) {
                Long o = owner.get(s);
                if (o != null && o != entry) {
                    throw MalformedInputException.crossFunctionEdge(name, r.getAddress(), s, nameOf(o, names));
                }
            }
        }
    }

    private Function buildFunction(String name, long entry, List<DecodedInstruction> recs) {
        Function f = new Function(name, entry);
        int n = recs.size();
        Map<Long, Integer> position = new HashMap<>();
        for (int i = 0; i < n; i++) {
            position.put(recs.get(i).getAddress(), i);
        }

        Set<Long> leaders = new HashSet<>();
        leaders.add(entry);
        leaders.add(recs.get(0).getAddress());
        for (int i = 0; i < n; i++) {
            DecodedInstruction r = recs.get(i);
            if (r.isCall()) {
                long t = r.getCallTarget();
                if (position.containsKey(t)) {
                    leaders.add(t);
                }
            } else if (isTransfer(recs, i)) {
                for (long s : r.getSuccessors()) {
                    if (position.containsKey(s)) {
                        leaders.add(s);
                    }
                }
            }
            if (isTransfer(recs, i) && i + 1 < n) {
                leaders.add(recs.get(i + 1).getAddress());
            }
        }

        // block boundaries: [start, end) positions into recs
        Map<Long, BasicBlock> blockAt = new LinkedHashMap<>();
        List<int[]> ranges = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= n; i++) {
            if (i == n || leaders.contains(recs.get(i).getAddress())) {
                BasicBlock bb = f.newBlock(recs.get(start).getAddress());
                blockAt.put(recs.get(start).getAddress(), bb);
                ranges.add(new int[]{start, i});
                start = i;
            }
        }
        f.setEntryBlockId(blockAt.get(entry).getId());

        Lifter lifter = new Lifter(f);
        List<BasicBlock> blocks = new ArrayList<>(blockAt.values());
        for (int b = 0; b < blocks.size(); b++) {
            BasicBlock bb = blocks.get(b);
            int[] range = ranges.get(b);
            lifter.startBlock(bb);
            for (int i = range[0]; i < range[1]; i++) {
                DecodedInstruction r = recs.get(i);
                try {
                    lifter.lift(r);
                } catch (IllegalArgumentException e) {
                    throw new MalformedInputException(e.getMessage(), name, r.getAddress());
                }
            }
            terminate(f, lifter, bb, recs, range[1] - 1, blockAt);
        }

        Variable eax = f.findRegister(Registers.EAX);
        if (eax != null && writes(f, eax)) {
            f.setReturnsValue(true);
            for (BasicBlock bb : f.getBlocks()) {
                if (bb.isReturnBlock()) {
                    bb.getTerminator().addOperand(Value.variable(eax));
                }
            }
        }
        markUnreachable(f);
        logger.debug("{}: {} blocks, {} instructions", name, f.getBlockCount(), f.getInstructionCount());
        return f;
    }

    /**
     * Jumps and returns always end a block; any other non-call instruction
     * does only when its successors are not just the next instruction.
     */
    private static boolean isTransfer(List<DecodedInstruction> recs, int i) {
        DecodedInstruction r = recs.get(i);
        if (r.isReturn() || r.isJump()) {
            return true;
        }
        if (r.isCall()) {
            return false;
        }
        List<Long> fallthrough = i + 1 < recs.size() ? List.of(recs.get(i + 1).getAddress()) : List.of();
        return !r.getSuccessors().equals(fallthrough);
    }

    private void terminate(Function f, Lifter lifter, BasicBlock bb, List<DecodedInstruction> recs, int last,
            Map<Long, BasicBlock> blockAt) {
        DecodedInstruction r = recs.get(last);
        long addr = r.getAddress();
        if (r.isReturn()) {
            bb.addInstruction(f.newInstruction(Opcode.RETURN, addr, 0));
            return;
        }
        if (!isTransfer(recs, last)) {
            bb.addInstruction(f.newInstruction(Opcode.BRANCH, addr, 0));
            if (last + 1 < recs.size()) {
                bb.addSuccessor(Edge.of(EdgeKind.FALLTHROUGH, blockAt.get(recs.get(last + 1).getAddress()).getId()));
            } else {
                bb.addSuccessor(Edge.unknown(-1));
                f.addDiagnostic(Diagnostic.Kind.UNRESOLVED_CONTROL_TRANSFER, bb.getId(), addr,
                        "control falls off the end of the function");
            }
            return;
        }
        List<Long> succs = r.getSuccessors();
        if (r.isConditionalJump() && succs.size() == 2) {
            Value cond = lifter.condition(r);
            bb.addInstruction(f.newInstruction(Opcode.COND_BRANCH, addr, 0, cond));
            bb.addSuccessor(edge(f, bb, EdgeKind.TRUE, succs.get(0), addr, blockAt));
            bb.addSuccessor(edge(f, bb, EdgeKind.FALSE, succs.get(1), addr, blockAt));
        } else if (succs.size() == 1) {
            bb.addInstruction(f.newInstruction(Opcode.BRANCH, addr, 0));
            bb.addSuccessor(edge(f, bb, EdgeKind.UNCONDITIONAL, succs.get(0), addr, blockAt));
        } else if (succs.isEmpty()) {
            bb.addInstruction(f.newInstruction(Opcode.BRANCH, addr, 0));
            bb.addSuccessor(Edge.unknown(-1));
            f.addDiagnostic(Diagnostic.Kind.UNRESOLVED_CONTROL_TRANSFER, bb.getId(), addr,
                    "no known successor for '" + r.getMnemonic() + "'");
        } else {
            Value index = lifter.switchIndex(r);
            bb.addInstruction(f.newInstruction(Opcode.SWITCH, addr, 4, index));
            for (int i = 0; i < succs.size(); i++) {
                Edge e = edge(f, bb, EdgeKind.SWITCH_CASE, succs.get(i), addr, blockAt);
                bb.addSuccessor(e.isUnknown() ? e : Edge.switchCase(e.getTarget(), i));
            }
        }
    }

    private Edge edge(Function f, BasicBlock from, EdgeKind kind, long target, long addr,
            Map<Long, BasicBlock> blockAt) {
        BasicBlock to = blockAt.get(target);
        if (to != null) {
            return Edge.of(kind, to.getId());
        }
        f.addDiagnostic(Diagnostic.Kind.UNRESOLVED_CONTROL_TRANSFER, from.getId(), addr,
                String.format("successor 0x%x was not decoded", target));
        return Edge.unknown(target);
    }

    private static boolean writes(Function f, Variable v) {
        for (BasicBlock bb : f.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isAssign() && inst.getDestination() == v.getId()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void markUnreachable(Function f) {
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        work.push(f.getEntryBlockId());
        seen.add(f.getEntryBlockId());
        while (!work.isEmpty()) {
            BasicBlock bb = f.getBlock(work.pop());
            for (int s : bb.getSuccessorIds()) {
                if (seen.add(s)) {
                    work.push(s);
                }
            }
        }
        for (BasicBlock bb : f.getBlocks()) {
            bb.setUnreachable(!seen.contains(bb.getId()));
        }
    }
}
