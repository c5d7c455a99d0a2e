package structure;

import ir.value.BasicBlock;
import ir.value.Function;
import org.junit.jupiter.api.Test;
import util.TestListings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructurerTest {
    private final Structurer structurer = new Structurer();

    private static void assertEveryBlockOnce(Function f, RegionTree tree) {
        List<Integer> blocks = new ArrayList<>();
        for (BasicBlock bb : f.getBlocks()) {
            blocks.add(bb.getId());
        }
        List<Integer> leaves = new ArrayList<>(tree.leaves());
        Collections.sort(blocks);
        Collections.sort(leaves);
        assertEquals(blocks, leaves, tree.toString());
    }

    private static void assertGotosLabeled(RegionTree tree, Region r) {
        if (r.getKind() == RegionKind.GOTO_BLOCK) {
            assertTrue(tree.isLabeled(r.getBlock()), "goto to unlabeled block " + r.getBlock());
        }
        for (Region c : r.getChildren()) {
            assertGotosLabeled(tree, c);
        }
    }

    @Test
    public void testSingleBlockIsSequenceOfLeaf() {
        Function f = TestListings.function("identity.lst");
        RegionTree tree = structurer.structure(f);
        Region root = tree.getRoot();
        assertEquals(RegionKind.SEQUENCE, root.getKind());
        assertEquals(1, root.getChildren().size());
        assertEquals(RegionKind.LEAF, root.getChild(0).getKind());
        assertEquals(f.getEntryBlockId(), root.getChild(0).getBlock());
        assertTrue(tree.getLabels().isEmpty());
    }

    @Test
    public void testIfThenElseArmsStopAtTheMerge() {
        Function f = TestListings.function("pick.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        assertEquals(0, tree.getRoot().count(RegionKind.GOTO_BLOCK));

        Region ite = tree.getRoot().find(RegionKind.IF_THEN_ELSE);
        assertNotNull(ite, tree.toString());
        assertEquals(3, ite.getChildren().size());
        assertEquals(f.getEntryBlockId(), ite.getTestBlock());
        int merge = TestListings.blockAt(f, 0x401015).getId();
        assertFalse(ite.getChild(1).leaves().contains(merge));
        assertFalse(ite.getChild(2).leaves().contains(merge));
        // the taken branch of jle is the then arm unless negated
        int taken = TestListings.blockAt(f, 0x401010).getId();
        int thenBlock = ite.getChild(1).leaves().get(0);
        assertEquals(!ite.isNegated(), thenBlock == taken);

        List<Region> top = tree.getRoot().getChildren();
        assertEquals(RegionKind.LEAF, top.get(top.size() - 1).getKind());
        assertEquals(merge, top.get(top.size() - 1).getBlock());
    }

    @Test
    public void testWhileLoopTestsTheHeader() {
        Function f = TestListings.function("count.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        assertEquals(0, tree.getRoot().count(RegionKind.GOTO_BLOCK));

        Region loop = tree.getRoot().find(RegionKind.WHILE);
        assertNotNull(loop, tree.toString());
        int header = TestListings.blockAt(f, 0x40100a).getId();
        assertEquals(header, loop.getBlock());
        assertEquals(header, loop.getTestBlock());
        assertEquals(TestListings.blockAt(f, 0x40101a).getId(), loop.getFollow());
        assertEquals(List.of(TestListings.blockAt(f, 0x401010).getId()), loop.getChild(1).leaves());
    }

    @Test
    public void testSelfLoopIsDoWhile() {
        Function f = TestListings.function("spin.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        Region loop = tree.getRoot().find(RegionKind.DO_WHILE);
        assertNotNull(loop, tree.toString());
        int body = TestListings.blockAt(f, 0x401005).getId();
        assertEquals(body, loop.getTestBlock());
        assertEquals(List.of(body), loop.leaves());
        assertEquals(0, tree.getRoot().count(RegionKind.GOTO_BLOCK));
    }

    @Test
    public void testEndlessSelfLoop() {
        Function f = new frontend.CFGBuilder()
                .build(TestListings.parse("function 0x10 forever\n0x10: inc eax\n0x11: jmp 0x10\n", "t")).getFunctions().get(0);
        RegionTree tree = structurer.structure(f);
        Region loop = tree.getRoot().find(RegionKind.LOOP);
        assertNotNull(loop, tree.toString());
        assertEquals(Region.NONE, loop.getFollow());
        assertEveryBlockOnce(f, tree);
    }

    @Test
    public void testIrreducibleCycleStillCoversEveryBlock() {
        Function f = TestListings.function("tangle.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        assertTrue(tree.getRoot().count(RegionKind.GOTO_BLOCK) >= 1, tree.toString());
        assertFalse(tree.getLabels().isEmpty());
        assertGotosLabeled(tree, tree.getRoot());
        assertEquals(RegionKind.SEQUENCE, tree.getRoot().getKind());
    }

    @Test
    public void testJumpTable() {
        Function f = TestListings.function("classify.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        Region sw = tree.getRoot().find(RegionKind.SWITCH);
        assertNotNull(sw, tree.toString());
        assertEquals(TestListings.blockAt(f, 0x401009).getId(), sw.getTestBlock());
        List<Long> values = new ArrayList<>();
        sw.getCaseValues().forEach(values::addAll);
        Collections.sort(values);
        assertEquals(List.of(0L, 1L, 2L), values);
        assertEquals(sw.getCaseValues().size() + 1, sw.getChildren().size());
    }

    @Test
    public void testUnresolvedJumpBecomesGotoUnknown() {
        Function f = TestListings.function("dispatch.lst");
        RegionTree tree = structurer.structure(f);
        assertEveryBlockOnce(f, tree);
        assertNotNull(tree.getRoot().find(RegionKind.GOTO_UNKNOWN), tree.toString());
    }

    @Test
    public void testEmptyFunction() {
        RegionTree tree = structurer.structure(new Function("empty", 0x10));
        assertEquals(RegionKind.SEQUENCE, tree.getRoot().getKind());
        assertTrue(tree.getRoot().getChildren().isEmpty());
    }

    @Test
    public void testDeterministic() {
        for (String listing : List.of("pick.lst", "count.lst", "tangle.lst", "classify.lst")) {
            Function f = TestListings.function(listing);
            assertEquals(structurer.structure(f), structurer.structure(f), listing);
            assertEquals(structurer.structure(f), structurer.structure(TestListings.function(listing)), listing);
        }
    }

    @Test
    public void testEveryProgramFunctionCovered() {
        for (Function f : TestListings.module("program.lst").getFunctions()) {
            assertEveryBlockOnce(f, structurer.structure(f));
        }
    }
}
