package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense-index view of a control flow graph. Node {@code i} stands for block
 * {@code idOf(i)}; successor lists keep edge order and drop unknown targets
 * and duplicates. The structurer builds instances over its own abstract nodes.
 */
public final class ControlFlowGraph {
    private final int[] ids;
    private final Map<Integer, Integer> index = new HashMap<>();
    private final List<List<Integer>> succs;
    private final List<List<Integer>> preds;
    private final int entry;
    private final int[] postOrder;
    private final int[] rpoNumber;

    public ControlFlowGraph(int[] ids, int entry, List<List<Integer>> successors) {
        this.ids = ids.clone();
        for (int i = 0; i < ids.length; i++) {
            index.put(ids[i], i);
        }
        this.entry = entry;
        this.succs = new ArrayList<>();
        this.preds = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            preds.add(new ArrayList<>());
        }
        for (int i = 0; i < ids.length; i++) {
            List<Integer> unique = new ArrayList<>();
            for (int s : successors.get(i)) {
                if (!unique.contains(s)) {
                    unique.add(s);
                    preds.get(s).add(i);
                }
            }
            succs.add(Collections.unmodifiableList(unique));
        }
        this.postOrder = computePostOrder();
        this.rpoNumber = new int[ids.length];
        Arrays.fill(rpoNumber, -1);
        for (int k = 0; k < postOrder.length; k++) {
            rpoNumber[postOrder[k]] = postOrder.length - 1 - k;
        }
    }

    /**
     * Graph over identity ids {@code 0..n-1}.
     */
    public static ControlFlowGraph of(int entry, List<List<Integer>> successors) {
        int[] ids = new int[successors.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = i;
        }
        return new ControlFlowGraph(ids, entry, successors);
    }

    public static ControlFlowGraph of(Function function) {
        List<BasicBlock> blocks = new ArrayList<>(function.getBlocks());
        int[] ids = new int[blocks.size()];
        Map<Integer, Integer> idx = new HashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            ids[i] = blocks.get(i).getId();
            idx.put(ids[i], i);
        }
        List<List<Integer>> succs = new ArrayList<>();
        for (BasicBlock bb : blocks) {
            List<Integer> s = new ArrayList<>();
            for (int target : bb.getSuccessorIds()) {
                Integer t = idx.get(target);
                if (t != null) {
                    s.add(t);
                }
            }
            succs.add(s);
        }
        return new ControlFlowGraph(ids, idx.get(function.getEntryBlockId()), succs);
    }

    private int[] computePostOrder() {
        int n = ids.length;
        boolean[] visited = new boolean[n];
        int[] order = new int[n];
        int count = 0;
        int[] stack = new int[n];
        int[] next = new int[n];
        int sp = 0;
        stack[sp++] = entry;
        visited[entry] = true;
        while (sp > 0) {
            int node = stack[sp - 1];
            List<Integer> s = succs.get(node);
            if (next[node] < s.size()) {
                int succ = s.get(next[node]++);
                if (!visited[succ]) {
                    visited[succ] = true;
                    stack[sp++] = succ;
                }
            } else {
                order[count++] = node;
                sp--;
            }
        }
        return Arrays.copyOf(order, count);
    }

    public int size() {
        return ids.length;
    }

    public int getEntry() {
        return entry;
    }

    public int idOf(int node) {
        return ids[node];
    }

    /**
     * @return the node index of a block id, or -1
     */
    public int indexOf(int id) {
        Integer i = index.get(id);
        return i == null ? -1 : i;
    }

    public List<Integer> successors(int node) {
        return succs.get(node);
    }

    public List<Integer> predecessors(int node) {
        return Collections.unmodifiableList(preds.get(node));
    }

    /**
     * @return reachable nodes in depth-first post order, successors visited in edge order
     */
    public int[] postOrder() {
        return postOrder.clone();
    }

    public int[] reversePostOrder() {
        int[] rpo = new int[postOrder.length];
        for (int k = 0; k < postOrder.length; k++) {
            rpo[k] = postOrder[postOrder.length - 1 - k];
        }
        return rpo;
    }

    /**
     * @return position in reverse post order, -1 if unreachable from the entry
     */
    public int rpoNumber(int node) {
        return rpoNumber[node];
    }

    public boolean isReachable(int node) {
        return rpoNumber[node] >= 0;
    }
}
