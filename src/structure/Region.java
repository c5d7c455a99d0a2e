package structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the structured AST. Regions refer to blocks by id only.
 * <ul>
 *   <li>LEAF: {@link #getBlock()} is the block.</li>
 *   <li>SEQUENCE: children run in order.</li>
 *   <li>IF_THEN_ELSE: children are head, then and an optional else. The branch
 *   taken when the test block's condition holds (or fails, if negated) is then.</li>
 *   <li>WHILE: head and body; the body runs while the (possibly negated) test holds.</li>
 *   <li>DO_WHILE: body only; it repeats while the test at its end holds.</li>
 *   <li>LOOP: body only, repeated until a jump leaves it.</li>
 *   <li>SWITCH: head followed by one body per case; {@link #getCaseValues()} lines up with the bodies.</li>
 *   <li>GOTO_BLOCK, BREAK, CONTINUE: {@link #getBlock()} is where control goes.</li>
 *   <li>GOTO_UNKNOWN: {@link #getTargetAddress()} is the unresolved address, -1 if none.</li>
 * </ul>
 * Loops carry their header in {@link #getBlock()}; loops and switches carry the
 * block control reaches when they are left through {@code break} in {@link #getFollow()}.
 */
public final class Region {
    public static final int NONE = -1;

    private final RegionKind kind;
    private final int block;
    private final long targetAddress;
    private final int testBlock;
    private final boolean negated;
    private final int follow;
    private final List<Region> children;
    private final List<List<Long>> caseValues;

    private Region(RegionKind kind, int block, long targetAddress, int testBlock, boolean negated,
                   int follow, List<Region> children, List<List<Long>> caseValues) {
        this.kind = kind;
        this.block = block;
        this.targetAddress = targetAddress;
        this.testBlock = testBlock;
        this.negated = negated;
        this.follow = follow;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.caseValues = Collections.unmodifiableList(new ArrayList<>(caseValues));
    }

    private static Region simple(RegionKind kind, int block, long address) {
        return new Region(kind, block, address, NONE, false, NONE, List.of(), List.of());
    }

    public static Region leaf(int block) {
        return simple(RegionKind.LEAF, block, -1);
    }

    /**
     * Nested sequences are flattened into the result.
     */
    public static Region sequence(List<Region> parts) {
        List<Region> flat = new ArrayList<>();
        for (Region r : parts) {
            if (r.kind == RegionKind.SEQUENCE) {
                flat.addAll(r.children);
            } else {
                flat.add(r);
            }
        }
        return new Region(RegionKind.SEQUENCE, NONE, -1, NONE, false, NONE, flat, List.of());
    }

    public static Region sequence(Region... parts) {
        return sequence(List.of(parts));
    }

    /**
     * @param elseRegion may be null
     */
    public static Region ifThenElse(Region head, int testBlock, boolean negated, Region thenRegion, Region elseRegion) {
        List<Region> kids = new ArrayList<>();
        kids.add(head);
        kids.add(thenRegion);
        if (elseRegion != null) {
            kids.add(elseRegion);
        }
        return new Region(RegionKind.IF_THEN_ELSE, NONE, -1, testBlock, negated, NONE, kids, List.of());
    }

    public static Region whileLoop(Region head, int header, int testBlock, boolean negated, Region body, int follow) {
        return new Region(RegionKind.WHILE, header, -1, testBlock, negated, follow, List.of(head, body), List.of());
    }

    public static Region doWhile(Region body, int header, int testBlock, boolean negated, int follow) {
        return new Region(RegionKind.DO_WHILE, header, -1, testBlock, negated, follow, List.of(body), List.of());
    }

    public static Region loop(Region body, int header, int follow) {
        return new Region(RegionKind.LOOP, header, -1, NONE, false, follow, List.of(body), List.of());
    }

    public static Region switchOf(Region head, int dispatchBlock, List<List<Long>> caseValues,
                                  List<Region> bodies, int follow) {
        if (caseValues.size() != bodies.size()) {
            throw new IllegalArgumentException("switch needs one body per case");
        }
        List<Region> kids = new ArrayList<>();
        kids.add(head);
        kids.addAll(bodies);
        return new Region(RegionKind.SWITCH, NONE, -1, dispatchBlock, false, follow, kids, caseValues);
    }

    public static Region gotoBlock(int target) {
        return simple(RegionKind.GOTO_BLOCK, target, -1);
    }

    public static Region gotoUnknown(long address) {
        return simple(RegionKind.GOTO_UNKNOWN, NONE, address);
    }

    public static Region breakTo(int follow) {
        return simple(RegionKind.BREAK, follow, -1);
    }

    public static Region continueTo(int header) {
        return simple(RegionKind.CONTINUE, header, -1);
    }

    public RegionKind getKind() {
        return kind;
    }

    public int getBlock() {
        return block;
    }

    public long getTargetAddress() {
        return targetAddress;
    }

    public int getTestBlock() {
        return testBlock;
    }

    public boolean isNegated() {
        return negated;
    }

    public int getFollow() {
        return follow;
    }

    public List<Region> getChildren() {
        return children;
    }

    public Region getChild(int i) {
        return children.get(i);
    }

    public List<List<Long>> getCaseValues() {
        return caseValues;
    }

    /**
     * Same region with other children; used when rewriting jumps.
     */
    Region withChildren(List<Region> newChildren) {
        return new Region(kind, block, targetAddress, testBlock, negated, follow, newChildren, caseValues);
    }

    /**
     * @return leaf block ids in document order
     */
    public List<Integer> leaves() {
        List<Integer> out = new ArrayList<>();
        collectLeaves(out);
        return out;
    }

    private void collectLeaves(List<Integer> out) {
        if (kind == RegionKind.LEAF) {
            out.add(block);
        }
        for (Region child : children) {
            child.collectLeaves(out);
        }
    }

    /**
     * @return the first region in document order of the given kind, or null
     */
    public Region find(RegionKind wanted) {
        if (kind == wanted) {
            return this;
        }
        for (Region child : children) {
            Region r = child.find(wanted);
            if (r != null) {
                return r;
            }
        }
        return null;
    }

    public int count(RegionKind wanted) {
        int n = kind == wanted ? 1 : 0;
        for (Region child : children) {
            n += child.count(wanted);
        }
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Region r)) return false;
        return kind == r.kind && block == r.block && targetAddress == r.targetAddress
                && testBlock == r.testBlock && negated == r.negated && follow == r.follow
                && children.equals(r.children) && caseValues.equals(r.caseValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, block, targetAddress, testBlock, negated, follow, children, caseValues);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    private void print(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(kind.getName());
        switch (kind) {
            case LEAF, GOTO_BLOCK, BREAK, CONTINUE -> sb.append(' ').append(block);
            case GOTO_UNKNOWN -> sb.append(" 0x").append(Long.toHexString(targetAddress));
            case IF_THEN_ELSE, WHILE, DO_WHILE, SWITCH -> sb.append(negated ? " !" : " ").append(testBlock);
            default -> {
            }
        }
        sb.append('\n');
        for (Region child : children) {
            child.print(sb, depth + 1);
        }
    }
}
