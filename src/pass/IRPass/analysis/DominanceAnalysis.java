package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dominator tree and dominance frontiers over a {@link ControlFlowGraph},
 * computed with the iterative Cooper-Harvey-Kennedy scheme. Nodes the entry
 * cannot reach have no immediate dominator and dominate only themselves.
 */
public class DominanceAnalysis {
    private final ControlFlowGraph cfg;
    private final int[] idom;
    private final int[] depth;
    private final List<List<Integer>> children = new ArrayList<>();
    private final List<Set<Integer>> frontier = new ArrayList<>();

    public DominanceAnalysis(ControlFlowGraph cfg) {
        this.cfg = cfg;
        int n = cfg.size();
        this.idom = new int[n];
        this.depth = new int[n];
        Arrays.fill(idom, -1);
        computeIdom();
        for (int i = 0; i < n; i++) {
            children.add(new ArrayList<>());
            frontier.add(new TreeSet<>());
        }
        for (int b : cfg.reversePostOrder()) {
            if (b != cfg.getEntry()) {
                children.get(idom[b]).add(b);
                depth[b] = depth[idom[b]] + 1;
            }
        }
        for (List<Integer> c : children) {
            Collections.sort(c);
        }
        computeFrontier();
    }

    private void computeIdom() {
        int entry = cfg.getEntry();
        idom[entry] = entry;
        int[] rpo = cfg.reversePostOrder();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int b : rpo) {
                if (b == entry) {
                    continue;
                }
                int newIdom = -1;
                for (int p : cfg.predecessors(b)) {
                    if (idom[p] < 0) {
                        continue;
                    }
                    newIdom = newIdom < 0 ? p : intersect(p, newIdom);
                }
                if (idom[b] != newIdom) {
                    idom[b] = newIdom;
                    changed = true;
                }
            }
        }
    }

    private int intersect(int a, int b) {
        while (a != b) {
            while (cfg.rpoNumber(a) > cfg.rpoNumber(b)) {
                a = idom[a];
            }
            while (cfg.rpoNumber(b) > cfg.rpoNumber(a)) {
                b = idom[b];
            }
        }
        return a;
    }

    private void computeFrontier() {
        for (int b = 0; b < cfg.size(); b++) {
            if (!cfg.isReachable(b)) {
                continue;
            }
            List<Integer> preds = cfg.predecessors(b);
            if (preds.size() < 2) {
                continue;
            }
            for (int p : preds) {
                if (!cfg.isReachable(p)) {
                    continue;
                }
                int runner = p;
                while (runner != idom[b]) {
                    frontier.get(runner).add(b);
                    if (runner == cfg.getEntry()) {
                        break;
                    }
                    runner = idom[runner];
                }
            }
        }
    }

    public ControlFlowGraph getGraph() {
        return cfg;
    }

    /**
     * @return immediate dominator, or -1 for the entry and unreachable nodes
     */
    public int getIdom(int node) {
        return node == cfg.getEntry() ? -1 : idom[node];
    }

    public int getDepth(int node) {
        return depth[node];
    }

    public boolean dominates(int a, int b) {
        if (a == b) {
            return true;
        }
        if (!cfg.isReachable(a) || !cfg.isReachable(b)) {
            return false;
        }
        int runner = b;
        while (runner != cfg.getEntry()) {
            runner = idom[runner];
            if (runner == a) {
                return true;
            }
        }
        return false;
    }

    public boolean strictlyDominates(int a, int b) {
        return a != b && dominates(a, b);
    }

    public List<Integer> getChildren(int node) {
        return Collections.unmodifiableList(children.get(node));
    }

    public Set<Integer> getFrontier(int node) {
        return Collections.unmodifiableSet(frontier.get(node));
    }

    /**
     * @return the deepest node dominating both, or -1 if either is unreachable
     */
    public int nearestCommonDominator(int a, int b) {
        if (!cfg.isReachable(a) || !cfg.isReachable(b)) {
            return -1;
        }
        return intersect(a, b);
    }
}
