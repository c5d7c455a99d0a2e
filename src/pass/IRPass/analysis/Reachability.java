package pass.IRPass.analysis;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Block ids reachable from the function entry over known edges.
 */
public class Reachability {
    private final Set<Integer> reachable = new TreeSet<>();

    public Reachability(ControlFlowGraph cfg) {
        for (int node : cfg.postOrder()) {
            reachable.add(cfg.idOf(node));
        }
    }

    public boolean isReachable(int blockId) {
        return reachable.contains(blockId);
    }

    public Set<Integer> getReachable() {
        return Collections.unmodifiableSet(reachable);
    }
}
