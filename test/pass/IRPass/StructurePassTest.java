package pass.IRPass;

import ir.IRModule;
import ir.value.Function;
import org.junit.jupiter.api.Test;
import pass.PipelineResult;
import structure.RegionKind;
import structure.RegionTree;
import structure.Structurer;
import util.TestListings;

import static org.junit.jupiter.api.Assertions.*;

public class StructurePassTest {

    @Test
    public void testAttachesTreeToEveryFunction() {
        IRModule module = TestListings.module("program.lst");
        PipelineResult result = PassTestSupport.run(module, "structure");
        assertTrue(result.reports().get(0).changed());
        for (Function f : module.getFunctions()) {
            assertNotNull(f.getRegionTree(), f.getName());
            assertEquals(new Structurer().structure(f), f.getRegionTree(), f.getName());
        }
    }

    @Test
    public void testSecondRunIsUnchanged() {
        IRModule module = TestListings.module("count.lst");
        PassTestSupport.run(module, "structure");
        RegionTree first = module.getFunctions().get(0).getRegionTree();
        PipelineResult again = PassTestSupport.run(module, "structure");
        assertFalse(again.anyChanged());
        assertSame(first, module.getFunctions().get(0).getRegionTree());
    }

    @Test
    public void testDefaultPipelineStructuresLoops() {
        IRModule module = TestListings.module("count.lst");
        PassTestSupport.run(module, pass.PipelineConfig.defaults());
        RegionTree tree = module.getFunctions().get(0).getRegionTree();
        assertNotNull(tree.getRoot().find(RegionKind.WHILE), tree.toString());
        assertEquals(0, tree.getRoot().count(RegionKind.GOTO_BLOCK));
    }
}
