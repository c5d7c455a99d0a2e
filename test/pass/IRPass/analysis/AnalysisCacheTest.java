package pass.IRPass.analysis;

import org.junit.jupiter.api.Test;
import util.TestListings;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisCacheTest {

    @Test
    public void testResultsAreReused() {
        AnalysisCache cache = new AnalysisCache(TestListings.function("count.lst"));
        ControlFlowGraph cfg = cache.getCfg();
        assertSame(cfg, cache.getCfg());
        assertSame(cfg, cache.getDominance().getGraph());
        cache.getLoopInfo();
        cache.getLoopInfo();
        assertEquals(1, cache.getComputationCount(AnalysisKind.CFG));
        assertEquals(1, cache.getComputationCount(AnalysisKind.LOOPS));
    }

    @Test
    public void testInstructionChangeKeepsControlFlowAnalyses() {
        AnalysisCache cache = new AnalysisCache(TestListings.function("count.lst"));
        for (AnalysisKind kind : AnalysisKind.values()) {
            assertNotNull(cache.get(kind));
        }
        cache.invalidate(false);
        assertTrue(cache.isCached(AnalysisKind.CFG));
        assertTrue(cache.isCached(AnalysisKind.DOMINANCE));
        assertFalse(cache.isCached(AnalysisKind.LIVENESS));
    }

    @Test
    public void testControlFlowChangeDropsEverything() {
        AnalysisCache cache = new AnalysisCache(TestListings.function("count.lst"));
        cache.getLoopInfo();
        cache.invalidate(true);
        for (AnalysisKind kind : AnalysisKind.values()) {
            assertFalse(cache.isCached(kind));
        }
        cache.getCfg();
        assertEquals(2, cache.getComputationCount(AnalysisKind.CFG));
    }
}
