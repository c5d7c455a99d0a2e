package structure;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class RegionTest {

    @Test
    public void testSequencesFlatten() {
        Region inner = Region.sequence(Region.leaf(1), Region.leaf(2));
        Region outer = Region.sequence(Region.leaf(0), inner, Region.leaf(3));
        assertEquals(4, outer.getChildren().size());
        assertEquals(List.of(0, 1, 2, 3), outer.leaves());
    }

    @Test
    public void testLeavesInDocumentOrderSkipJumps() {
        Region r = Region.ifThenElse(Region.leaf(0), 0, false,
                Region.sequence(Region.leaf(1), Region.gotoBlock(3)),
                Region.sequence(Region.leaf(2), Region.breakTo(3)));
        assertEquals(List.of(0, 1, 2), r.leaves());
        assertEquals(1, r.count(RegionKind.GOTO_BLOCK));
        assertEquals(3, r.find(RegionKind.BREAK).getBlock());
        assertNull(r.find(RegionKind.SWITCH));
    }

    @Test
    public void testSwitchNeedsOneBodyPerCase() {
        assertThrows(IllegalArgumentException.class, () -> Region.switchOf(Region.leaf(0), 0,
                List.of(List.of(1L)), List.of(Region.leaf(1), Region.leaf(2)), Region.NONE));
    }

    @Test
    public void testStructuralEquality() {
        Region a = Region.whileLoop(Region.leaf(1), 1, 1, true, Region.leaf(2), 3);
        Region b = Region.whileLoop(Region.leaf(1), 1, 1, true, Region.leaf(2), 3);
        Region c = Region.whileLoop(Region.leaf(1), 1, 1, false, Region.leaf(2), 3);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }

    @Test
    public void testKinds() {
        assertTrue(RegionKind.DO_WHILE.isLoop());
        assertTrue(RegionKind.SWITCH.isBreakable());
        assertFalse(RegionKind.SWITCH.isLoop());
        assertTrue(RegionKind.CONTINUE.isJump());
        assertEquals("if-then-else", RegionKind.IF_THEN_ELSE.getName());
    }

    @Test
    public void testTreeLabels() {
        TreeMap<Integer, String> labels = new TreeMap<>();
        labels.put(4, "LAB_00401010");
        RegionTree tree = new RegionTree(Region.sequence(Region.leaf(0), Region.gotoBlock(4), Region.leaf(4)), labels);
        assertTrue(tree.isLabeled(4));
        assertFalse(tree.isLabeled(0));
        assertEquals("LAB_00401010", tree.labelOf(4));
        assertEquals(List.of(0, 4), tree.leaves());
        assertThrows(UnsupportedOperationException.class, () -> tree.getLabels().put(1, "x"));
    }
}
