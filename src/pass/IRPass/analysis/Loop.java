package pass.IRPass.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A natural loop: the header plus every node that reaches a back edge
 * source without passing through the header. Nodes are graph indices.
 */
public class Loop {
    private final int header;
    private final Set<Integer> blocks = new TreeSet<>();
    private final Set<Integer> latches = new TreeSet<>();
    private final List<Loop> subLoops = new ArrayList<>();
    private Loop parentLoop;

    public Loop(int header) {
        this.header = header;
        this.blocks.add(header);
    }

    public int getHeader() {
        return header;
    }

    public Set<Integer> getBlocks() {
        return Collections.unmodifiableSet(blocks);
    }

    public boolean contains(int node) {
        return blocks.contains(node);
    }

    /**
     * @return sources of the back edges into the header
     */
    public Set<Integer> getLatches() {
        return Collections.unmodifiableSet(latches);
    }

    public List<Loop> getSubLoops() {
        return Collections.unmodifiableList(subLoops);
    }

    public Loop getParentLoop() {
        return parentLoop;
    }

    public int getDepth() {
        int d = 1;
        for (Loop p = parentLoop; p != null; p = p.parentLoop) {
            d++;
        }
        return d;
    }

    /**
     * @return nodes outside the loop that a loop node branches to, ascending
     */
    public Set<Integer> getExits(ControlFlowGraph cfg) {
        Set<Integer> exits = new TreeSet<>();
        for (int b : blocks) {
            for (int s : cfg.successors(b)) {
                if (!blocks.contains(s)) {
                    exits.add(s);
                }
            }
        }
        return exits;
    }

    void addBlock(int node) {
        blocks.add(node);
    }

    void addLatch(int node) {
        latches.add(node);
    }

    void setParentLoop(Loop parent) {
        this.parentLoop = parent;
        parent.subLoops.add(this);
    }

    @Override
    public String toString() {
        return "Loop{header=" + header + ", blocks=" + blocks + "}";
    }
}
