package pass.IRPass.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Natural loops of a graph, one per header, nested by containment.
 */
public class LoopInfo {
    private final ControlFlowGraph cfg;
    private final List<Loop> loops = new ArrayList<>();
    private final List<Loop> topLevel = new ArrayList<>();

    public LoopInfo(DominanceAnalysis dom) {
        this.cfg = dom.getGraph();
        for (int h : cfg.reversePostOrder()) {
            Loop loop = null;
            for (int p : cfg.predecessors(h)) {
                if (cfg.isReachable(p) && dom.dominates(h, p)) {
                    if (loop == null) {
                        loop = new Loop(h);
                    }
                    loop.addLatch(p);
                }
            }
            if (loop != null) {
                collectBody(loop);
                loops.add(loop);
            }
        }
        for (Loop loop : loops) {
            Loop parent = null;
            for (Loop other : loops) {
                if (other == loop || !other.contains(loop.getHeader())
                        || other.getBlocks().size() <= loop.getBlocks().size()
                        || !other.getBlocks().containsAll(loop.getBlocks())) {
                    continue;
                }
                if (parent == null || other.getBlocks().size() < parent.getBlocks().size()) {
                    parent = other;
                }
            }
            if (parent != null) {
                loop.setParentLoop(parent);
            } else {
                topLevel.add(loop);
            }
        }
    }

    private void collectBody(Loop loop) {
        Deque<Integer> work = new ArrayDeque<>(loop.getLatches());
        while (!work.isEmpty()) {
            int b = work.pop();
            if (loop.contains(b)) {
                continue;
            }
            loop.addBlock(b);
            for (int p : cfg.predecessors(b)) {
                if (cfg.isReachable(p) && !loop.contains(p)) {
                    work.push(p);
                }
            }
        }
    }

    /**
     * @return all loops, headers in reverse post order
     */
    public List<Loop> getLoops() {
        return Collections.unmodifiableList(loops);
    }

    public List<Loop> getTopLevelLoops() {
        return Collections.unmodifiableList(topLevel);
    }

    /**
     * @return loops deepest first; equal depth keeps reverse post order of the headers
     */
    public List<Loop> innermostFirst() {
        List<Loop> sorted = new ArrayList<>(loops);
        sorted.sort(Comparator.comparingInt(Loop::getDepth).reversed()
                .thenComparingInt(l -> cfg.rpoNumber(l.getHeader())));
        return sorted;
    }

    /**
     * @return the innermost loop containing the node, or null
     */
    public Loop getLoopFor(int node) {
        Loop best = null;
        for (Loop loop : loops) {
            if (loop.contains(node) && (best == null || loop.getBlocks().size() < best.getBlocks().size())) {
                best = loop;
            }
        }
        return best;
    }

    public int getLoopDepth(int node) {
        Loop l = getLoopFor(node);
        return l == null ? 0 : l.getDepth();
    }

    public boolean isLoopHeader(int node) {
        for (Loop loop : loops) {
            if (loop.getHeader() == node) {
                return true;
            }
        }
        return false;
    }
}
