package structure;

import ir.value.BasicBlock;
import ir.value.Edge;
import ir.value.EdgeKind;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.instructions.Instruction;
import pass.IRPass.analysis.ControlFlowGraph;
import pass.IRPass.analysis.DominanceAnalysis;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a function's control flow graph into a {@link RegionTree}.
 * <p>
 * Works by node elimination on an abstract graph whose nodes start out as
 * single blocks. Nodes are scanned deepest first (post order of a depth first
 * walk from the entry) and the first reduction that fits is applied: self loop,
 * while, switch, if-then-else, if-then, sequence. When nothing fits, the
 * innermost natural loop whose blocks form a single-entry node set is collapsed
 * into a LOOP with break and continue markers; failing that, one edge is turned
 * into an explicit goto. Every step removes a node or an edge, so the process
 * ends, and every block ends up in exactly one leaf.
 */
public class Structurer {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    public RegionTree structure(Function function) {
        if (function.getBlockCount() == 0) {
            return new RegionTree(Region.sequence(List.of()), new TreeMap<>());
        }
        ControlFlowGraph cfg = ControlFlowGraph.of(function);
        return structure(function, cfg, new LoopInfo(new DominanceAnalysis(cfg)));
    }

    public RegionTree structure(Function function, ControlFlowGraph cfg, LoopInfo loops) {
        if (function.getBlockCount() == 0) {
            return new RegionTree(Region.sequence(List.of()), new TreeMap<>());
        }
        List<LoopShape> shapes = new ArrayList<>();
        for (Loop loop : loops.innermostFirst()) {
            Set<Integer> blocks = new LinkedHashSet<>();
            for (int node : loop.getBlocks()) {
                blocks.add(cfg.idOf(node));
            }
            shapes.add(new LoopShape(cfg.idOf(loop.getHeader()), blocks));
        }
        Graph graph = new Graph(function, shapes);
        Node entry = graph.owner.get(function.getEntryBlockId());
        List<Region> parts = new ArrayList<>();
        for (Node n : graph.reduce(new LinkedHashSet<>(graph.nodes), entry)) {
            parts.add(n.region);
        }
        JumpResolver resolver = new JumpResolver(function);
        Region root = resolver.resolve(Region.sequence(parts), new ArrayDeque<>());
        RegionTree tree = new RegionTree(root, resolver.labels);
        log.debug("{}: {} regions left as goto", function.getName(),
                root.count(RegionKind.GOTO_BLOCK) + root.count(RegionKind.GOTO_UNKNOWN));
        return tree;
    }

    private record LoopShape(int header, Set<Integer> blocks) {
    }

    private enum Exit {
        // at most one successor, reached by falling off the end
        PLAIN,
        // two successors, the first taken when the test holds
        COND,
        SWITCH
    }

    private static final class Node {
        final int order;
        final int entryBlock;
        Region region;
        Exit exit = Exit.PLAIN;
        int testBlock = Region.NONE;
        final List<Node> succs = new ArrayList<>();
        // SWITCH: per case the target block (NONE if unresolved) and the body once known
        List<Integer> caseTargets;
        List<List<Long>> caseValues;
        List<Region> caseBodies;

        Node(int order, int block) {
            this.order = order;
            this.entryBlock = block;
            this.region = Region.leaf(block);
        }

        @Override
        public String toString() {
            return "node" + order + "(" + entryBlock + ")";
        }
    }

    private static final class Graph {
        final List<Node> nodes = new ArrayList<>();
        final Map<Integer, Node> owner = new HashMap<>();
        final List<LoopShape> loops;
        // scopes of the reductions in progress, innermost first
        private final Deque<Set<Node>> scopes = new ArrayDeque<>();

        Graph(Function f, List<LoopShape> loops) {
            this.loops = loops;
            int order = 0;
            for (BasicBlock bb : f.getBlocks()) {
                Node n = new Node(order++, bb.getId());
                nodes.add(n);
                owner.put(bb.getId(), n);
            }
            for (BasicBlock bb : f.getBlocks()) {
                connect(owner.get(bb.getId()), bb);
            }
        }

        private void connect(Node n, BasicBlock bb) {
            Instruction term = bb.getTerminator();
            Opcode op = term == null ? null : term.opCode();
            List<Edge> edges = bb.getSuccessors();
            if (op == Opcode.COND_BRANCH && edges.size() == 2) {
                Edge t = edges.get(0);
                Edge e = edges.get(1);
                if (t.isUnknown() && e.isUnknown()) {
                    n.region = Region.ifThenElse(n.region, bb.getId(), false,
                            Region.gotoUnknown(t.getTargetAddress()), Region.gotoUnknown(e.getTargetAddress()));
                } else if (t.isUnknown()) {
                    n.region = Region.ifThenElse(n.region, bb.getId(), false,
                            Region.gotoUnknown(t.getTargetAddress()), null);
                    n.succs.add(owner.get(e.getTarget()));
                } else if (e.isUnknown()) {
                    n.region = Region.ifThenElse(n.region, bb.getId(), true,
                            Region.gotoUnknown(e.getTargetAddress()), null);
                    n.succs.add(owner.get(t.getTarget()));
                } else if (t.getTarget() == e.getTarget()) {
                    n.succs.add(owner.get(t.getTarget()));
                } else {
                    n.exit = Exit.COND;
                    n.testBlock = bb.getId();
                    n.succs.add(owner.get(t.getTarget()));
                    n.succs.add(owner.get(e.getTarget()));
                }
                return;
            }
            if (op == Opcode.SWITCH && !edges.isEmpty()) {
                connectSwitch(n, bb, edges);
                return;
            }
            if (edges.size() == 1 && !edges.get(0).isUnknown()) {
                n.succs.add(owner.get(edges.get(0).getTarget()));
                return;
            }
            // nothing structured fits; every edge becomes an explicit jump
            List<Region> parts = new ArrayList<>();
            parts.add(n.region);
            for (Edge edge : edges) {
                parts.add(edge.isUnknown() ? Region.gotoUnknown(edge.getTargetAddress())
                        : Region.gotoBlock(edge.getTarget()));
            }
            n.region = parts.size() == 1 ? n.region : Region.sequence(parts);
        }

        private void connectSwitch(Node n, BasicBlock bb, List<Edge> edges) {
            n.exit = Exit.SWITCH;
            n.testBlock = bb.getId();
            n.caseTargets = new ArrayList<>();
            n.caseValues = new ArrayList<>();
            n.caseBodies = new ArrayList<>();
            Map<Integer, Integer> caseOf = new LinkedHashMap<>();
            for (Edge edge : edges) {
                long value = edge.getKind() == EdgeKind.SWITCH_CASE ? edge.getCaseValue() : n.caseTargets.size();
                if (edge.isUnknown()) {
                    n.caseTargets.add(Region.NONE);
                    n.caseValues.add(new ArrayList<>(List.of(value)));
                    n.caseBodies.add(Region.gotoUnknown(edge.getTargetAddress()));
                    continue;
                }
                Integer existing = caseOf.get(edge.getTarget());
                if (existing != null) {
                    n.caseValues.get(existing).add(value);
                    continue;
                }
                caseOf.put(edge.getTarget(), n.caseTargets.size());
                n.caseTargets.add(edge.getTarget());
                n.caseValues.add(new ArrayList<>(List.of(value)));
                n.caseBodies.add(null);
                n.succs.add(owner.get(edge.getTarget()));
            }
            if (n.succs.isEmpty()) {
                finishSwitch(n, Map.of(), null);
            }
        }

        /* reduction driver */

        List<Node> reduce(Set<Node> scope, Node entry) {
            scopes.push(scope);
            try {
                while (applyRule(scope, entry) || collapseLoop(scope, entry) || cutOne(scope, entry)) {
                    // keep going until no rule, loop or edge is left
                }
            } finally {
                scopes.pop();
            }
            List<Node> rest = new ArrayList<>();
            rest.add(entry);
            for (Node n : nodes) {
                if (n != entry && scope.contains(n)) {
                    rest.add(n);
                }
            }
            return rest;
        }

        /**
         * Depth first over the scope from its entry, then from every node not yet
         * seen, in block order.
         * @return the nodes in post order
         */
        private List<Node> postOrder(Set<Node> scope, Node entry, List<Node[]> retreating) {
            List<Node> order = new ArrayList<>();
            Set<Node> visited = new HashSet<>();
            Set<Node> onStack = new HashSet<>();
            List<Node> roots = new ArrayList<>();
            roots.add(entry);
            for (Node n : nodes) {
                if (scope.contains(n)) {
                    roots.add(n);
                }
            }
            for (Node root : roots) {
                if (visited.contains(root)) {
                    continue;
                }
                Deque<Node> stack = new ArrayDeque<>();
                Deque<Integer> next = new ArrayDeque<>();
                stack.push(root);
                next.push(0);
                visited.add(root);
                onStack.add(root);
                while (!stack.isEmpty()) {
                    Node n = stack.peek();
                    int i = next.pop();
                    if (i < n.succs.size()) {
                        next.push(i + 1);
                        Node s = n.succs.get(i);
                        if (!scope.contains(s)) {
                            continue;
                        }
                        if (onStack.contains(s)) {
                            if (retreating != null) {
                                retreating.add(new Node[]{n, s});
                            }
                        } else if (!visited.contains(s)) {
                            visited.add(s);
                            onStack.add(s);
                            stack.push(s);
                            next.push(0);
                        }
                    } else {
                        stack.pop();
                        onStack.remove(n);
                        order.add(n);
                    }
                }
            }
            return order;
        }

        private List<Node> preds(Node n) {
            List<Node> out = new ArrayList<>();
            for (Node m : nodes) {
                if (m.succs.contains(n)) {
                    out.add(m);
                }
            }
            return out;
        }

        private boolean canAbsorb(Node b, Node a, Set<Node> scope, Node entry) {
            if (b == a || b == entry || !scope.contains(b)) {
                return false;
            }
            List<Node> p = preds(b);
            return p.size() == 1 && p.get(0) == a;
        }

        private static boolean isSimpleBody(Node b) {
            return b.exit == Exit.PLAIN && !b.succs.contains(b);
        }

        private boolean applyRule(Set<Node> scope, Node entry) {
            for (Node a : postOrder(scope, entry, null)) {
                if (selfLoop(a) || whileLoop(a, scope, entry) || switchRegion(a, scope, entry)
                        || ifThenElse(a, scope, entry) || ifThen(a, scope, entry) || sequence(a, scope, entry)) {
                    return true;
                }
            }
            return false;
        }

        private boolean selfLoop(Node a) {
            if (!a.succs.contains(a)) {
                return false;
            }
            if (a.exit == Exit.PLAIN) {
                a.region = Region.loop(a.region, a.entryBlock, Region.NONE);
                a.succs.clear();
                return true;
            }
            if (a.exit == Exit.COND) {
                int self = a.succs.indexOf(a);
                Node out = a.succs.get(1 - self);
                a.region = Region.doWhile(a.region, a.entryBlock, a.testBlock, self == 1, out.entryBlock);
                a.exit = Exit.PLAIN;
                a.succs.clear();
                a.succs.add(out);
                return true;
            }
            return false;
        }

        private boolean whileLoop(Node a, Set<Node> scope, Node entry) {
            if (a.exit != Exit.COND) {
                return false;
            }
            for (int i = 0; i < 2; i++) {
                Node body = a.succs.get(i);
                Node out = a.succs.get(1 - i);
                if (canAbsorb(body, a, scope, entry) && body.exit == Exit.PLAIN
                        && body.succs.size() == 1 && body.succs.get(0) == a) {
                    a.region = Region.whileLoop(a.region, a.entryBlock, a.testBlock, i == 1, body.region, out.entryBlock);
                    a.exit = Exit.PLAIN;
                    a.succs.clear();
                    a.succs.add(out);
                    remove(body, a);
                    return true;
                }
            }
            return false;
        }

        private boolean switchRegion(Node a, Set<Node> scope, Node entry) {
            if (a.exit != Exit.SWITCH) {
                return false;
            }
            Map<Node, Region> bodies = new LinkedHashMap<>();
            Set<Node> follows = new LinkedHashSet<>();
            for (Node s : a.succs) {
                if (canAbsorb(s, a, scope, entry) && isSimpleBody(s) && s.succs.size() <= 1) {
                    bodies.put(s, s.region);
                    follows.addAll(s.succs);
                } else {
                    follows.add(s);
                }
            }
            if (follows.size() > 1) {
                return false;
            }
            Node follow = follows.isEmpty() ? null : follows.iterator().next();
            if (follow != null && bodies.containsKey(follow)) {
                return false;
            }
            finishSwitch(a, bodies, follow);
            for (Node b : bodies.keySet()) {
                remove(b, a);
            }
            return true;
        }

        private void finishSwitch(Node a, Map<Node, Region> bodies, Node follow) {
            List<Region> regions = new ArrayList<>();
            for (int i = 0; i < a.caseTargets.size(); i++) {
                Region body = a.caseBodies.get(i);
                if (body == null) {
                    Node target = owner.get(a.caseTargets.get(i));
                    Region absorbed = bodies.get(target);
                    body = absorbed != null ? absorbed : Region.breakTo(a.caseTargets.get(i));
                }
                regions.add(body);
            }
            int followBlock = follow == null ? Region.NONE : follow.entryBlock;
            a.region = Region.switchOf(a.region, a.testBlock, a.caseValues, regions, followBlock);
            a.exit = Exit.PLAIN;
            a.succs.clear();
            if (follow != null) {
                a.succs.add(follow);
            }
            a.caseTargets = null;
            a.caseValues = null;
            a.caseBodies = null;
        }

        private boolean ifThenElse(Node a, Set<Node> scope, Node entry) {
            if (a.exit != Exit.COND) {
                return false;
            }
            Node t = a.succs.get(0);
            Node e = a.succs.get(1);
            if (!canAbsorb(t, a, scope, entry) || !canAbsorb(e, a, scope, entry)
                    || !isSimpleBody(t) || !isSimpleBody(e)) {
                return false;
            }
            Set<Node> follows = new LinkedHashSet<>(t.succs);
            follows.addAll(e.succs);
            if (follows.size() > 1 || follows.contains(a)) {
                return false;
            }
            a.region = Region.ifThenElse(a.region, a.testBlock, false, t.region, e.region);
            a.exit = Exit.PLAIN;
            a.succs.clear();
            a.succs.addAll(follows);
            remove(t, a);
            remove(e, a);
            return true;
        }

        private boolean ifThen(Node a, Set<Node> scope, Node entry) {
            if (a.exit != Exit.COND) {
                return false;
            }
            for (int i = 0; i < 2; i++) {
                Node body = a.succs.get(i);
                Node out = a.succs.get(1 - i);
                if (canAbsorb(body, a, scope, entry) && isSimpleBody(body)
                        && (body.succs.isEmpty() || body.succs.size() == 1 && body.succs.get(0) == out)) {
                    a.region = Region.ifThenElse(a.region, a.testBlock, i == 1, body.region, null);
                    a.exit = Exit.PLAIN;
                    a.succs.clear();
                    a.succs.add(out);
                    remove(body, a);
                    return true;
                }
            }
            return false;
        }

        private boolean sequence(Node a, Set<Node> scope, Node entry) {
            if (a.exit != Exit.PLAIN || a.succs.size() != 1) {
                return false;
            }
            Node b = a.succs.get(0);
            if (!canAbsorb(b, a, scope, entry)) {
                return false;
            }
            a.region = Region.sequence(a.region, b.region);
            a.exit = b.exit;
            a.testBlock = b.testBlock;
            a.caseTargets = b.caseTargets;
            a.caseValues = b.caseValues;
            a.caseBodies = b.caseBodies;
            a.succs.clear();
            for (Node s : b.succs) {
                a.succs.add(s == b ? a : s);
            }
            remove(b, a);
            return true;
        }

        private void remove(Node gone, Node into) {
            nodes.remove(gone);
            for (Set<Node> scope : scopes) {
                scope.remove(gone);
            }
            for (int block : gone.region.leaves()) {
                owner.put(block, into);
            }
        }

        /* loops */

        private boolean collapseLoop(Set<Node> scope, Node entry) {
            for (LoopShape shape : loops) {
                Node header = owner.get(shape.header());
                if (!scope.contains(header) || header.entryBlock != shape.header()) {
                    continue;
                }
                Set<Node> body = new LinkedHashSet<>();
                for (Node n : nodes) {
                    for (int block : shape.blocks()) {
                        if (owner.get(block) == n) {
                            body.add(n);
                            break;
                        }
                    }
                }
                if (isCollapsible(body, header, scope, entry)) {
                    collapse(body, header, scope, entry);
                    return true;
                }
            }
            return false;
        }

        private boolean isCollapsible(Set<Node> body, Node header, Set<Node> scope, Node entry) {
            if (!scope.containsAll(body) || body.contains(entry) && entry != header) {
                return false;
            }
            boolean backEdge = false;
            for (Node n : body) {
                backEdge |= n.succs.contains(header);
                if (n != header && !body.containsAll(preds(n))) {
                    return false;
                }
            }
            return backEdge;
        }

        private void collapse(Set<Node> body, Node header, Set<Node> scope, Node entry) {
            List<Node> order = postOrder(scope, entry, null);
            Map<Node, Integer> exitCount = new LinkedHashMap<>();
            for (Node n : body) {
                for (Node s : n.succs) {
                    if (!body.contains(s)) {
                        exitCount.merge(s, 1, Integer::sum);
                    }
                }
            }
            Node follow = null;
            for (Map.Entry<Node, Integer> e : exitCount.entrySet()) {
                if (follow == null || e.getValue() > exitCount.get(follow)
                        || e.getValue().equals(exitCount.get(follow)) && rank(e.getKey(), order) < rank(follow, order)) {
                    follow = e.getKey();
                }
            }
            List<Node[]> cuts = new ArrayList<>();
            for (Node n : body) {
                for (Node s : n.succs) {
                    if (s == header || !body.contains(s)) {
                        cuts.add(new Node[]{n, s});
                    }
                }
            }
            for (Node[] c : cuts) {
                Node s = c[1];
                Region marker = s == header ? Region.continueTo(header.entryBlock)
                        : s == follow ? Region.breakTo(s.entryBlock) : Region.gotoBlock(s.entryBlock);
                cut(c[0], s, marker);
            }
            List<Region> parts = new ArrayList<>();
            List<Node> rest = reduce(new LinkedHashSet<>(body), header);
            for (Node n : rest) {
                parts.add(n.region);
            }
            for (Node n : rest) {
                if (n != header) {
                    remove(n, header);
                }
            }
            header.region = Region.loop(dropTrailingContinue(Region.sequence(parts), header.entryBlock),
                    header.entryBlock, follow == null ? Region.NONE : follow.entryBlock);
            header.exit = Exit.PLAIN;
            header.succs.clear();
            if (follow != null) {
                header.succs.add(follow);
            }
        }

        private static Region dropTrailingContinue(Region seq, int header) {
            List<Region> kids = seq.getChildren();
            if (kids.size() > 1) {
                Region last = kids.get(kids.size() - 1);
                if (last.getKind() == RegionKind.CONTINUE && last.getBlock() == header) {
                    return Region.sequence(kids.subList(0, kids.size() - 1));
                }
            }
            return seq;
        }

        // position in reverse post order; smaller is closer to the entry
        private static int rank(Node n, List<Node> postOrder) {
            int i = postOrder.indexOf(n);
            return i < 0 ? Integer.MAX_VALUE : postOrder.size() - 1 - i;
        }

        /* fallback */

        private boolean cutOne(Set<Node> scope, Node entry) {
            List<Node[]> retreating = new ArrayList<>();
            List<Node> order = postOrder(scope, entry, retreating);
            if (!retreating.isEmpty()) {
                Node[] edge = retreating.get(0);
                cut(edge[0], edge[1], Region.gotoBlock(edge[1].entryBlock));
                return true;
            }
            for (Node n : order) {
                List<Node> p = new ArrayList<>(preds(n));
                p.removeIf(m -> !scope.contains(m));
                if (p.size() < 2) {
                    continue;
                }
                Node latest = p.get(0);
                for (Node m : p) {
                    if (rank(m, order) > rank(latest, order)) {
                        latest = m;
                    }
                }
                cut(latest, n, Region.gotoBlock(n.entryBlock));
                return true;
            }
            for (Node n : order) {
                for (Node s : n.succs) {
                    if (scope.contains(s)) {
                        cut(n, s, Region.gotoBlock(s.entryBlock));
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Replaces the edge from {@code a} to {@code target} by the jump {@code marker}.
         */
        private void cut(Node a, Node target, Region marker) {
            switch (a.exit) {
                case PLAIN -> a.region = Region.sequence(a.region, marker);
                case COND -> {
                    int i = a.succs.indexOf(target);
                    a.region = Region.ifThenElse(a.region, a.testBlock, i == 1, marker, null);
                    a.exit = Exit.PLAIN;
                }
                case SWITCH -> {
                    for (int i = 0; i < a.caseTargets.size(); i++) {
                        if (a.caseTargets.get(i) == target.entryBlock && a.caseBodies.get(i) == null) {
                            a.caseBodies.set(i, marker);
                        }
                    }
                }
            }
            a.succs.remove(target);
            if (a.exit == Exit.SWITCH && a.succs.isEmpty()) {
                finishSwitch(a, Map.of(), null);
            }
        }
    }

    /**
     * Rewrites break and continue markers that C would bind to a different
     * construct into gotos, and collects the labels every goto needs.
     */
    private static final class JumpResolver {
        private final Function function;
        final TreeMap<Integer, String> labels = new TreeMap<>();

        JumpResolver(Function function) {
            this.function = function;
        }

        Region resolve(Region r, Deque<Region> enclosing) {
            switch (r.getKind()) {
                case BREAK -> {
                    Region inner = innermost(enclosing, false);
                    return inner != null && inner.getFollow() == r.getBlock() ? r : jump(r.getBlock());
                }
                case CONTINUE -> {
                    Region inner = innermost(enclosing, true);
                    boolean binds = inner != null && inner.getKind() != RegionKind.DO_WHILE
                            && inner.getBlock() == r.getBlock();
                    return binds ? r : jump(r.getBlock());
                }
                case GOTO_BLOCK -> {
                    return jump(r.getBlock());
                }
                default -> {
                }
            }
            if (r.getChildren().isEmpty()) {
                return r;
            }
            List<Region> kids = new ArrayList<>();
            for (int i = 0; i < r.getChildren().size(); i++) {
                // a switch head runs before the switch is entered
                boolean inside = r.getKind().isBreakable() && !(r.getKind() == RegionKind.SWITCH && i == 0);
                if (inside) {
                    enclosing.push(r);
                }
                kids.add(resolve(r.getChild(i), enclosing));
                if (inside) {
                    enclosing.pop();
                }
            }
            return kids.equals(r.getChildren()) ? r : r.withChildren(kids);
        }

        private static Region innermost(Deque<Region> enclosing, boolean loopsOnly) {
            for (Region r : enclosing) {
                if (!loopsOnly || r.getKind().isLoop()) {
                    return r;
                }
            }
            return null;
        }

        private Region jump(int target) {
            BasicBlock bb = function.getBlock(target);
            labels.put(target, bb == null ? "label_b" + target : bb.getLabel());
            return Region.gotoBlock(target);
        }
    }
}
