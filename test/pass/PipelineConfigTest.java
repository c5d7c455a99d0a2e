package pass;

import exception.UnknownPassException;
import org.junit.jupiter.api.Test;
import pass.IRPass.TypeInferencePass;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineConfigTest {
    private final PassRegistry registry = PassRegistry.withBuiltins();

    @Test
    public void testParseIdsAndOptions() {
        PipelineConfig config = PipelineConfig.parse(
                " stack-recovery , type-inference:widen-small-ints=true ,structure", registry);
        List<PipelineConfig.Entry> entries = config.getEntries();
        assertEquals(List.of("stack-recovery", "type-inference", "structure"),
                entries.stream().map(PipelineConfig.Entry::passId).toList());
        assertTrue(entries.get(1).options().getBoolean(TypeInferencePass.WIDEN_SMALL_INTS, false));
        assertTrue(entries.get(0).options().asMap().isEmpty());
    }

    @Test
    public void testBareOptionKeyIsTrue() {
        PipelineConfig config = PipelineConfig.parse("type-inference:widen-small-ints", registry);
        assertTrue(config.getEntries().get(0).options().getBoolean(TypeInferencePass.WIDEN_SMALL_INTS, false));
    }

    @Test
    public void testUnknownOptionRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineConfig.parse("dead-code:aggressive=1", registry));
        assertTrue(e.getMessage().contains("aggressive"));
    }

    @Test
    public void testUnknownPassKeptForThePipeline() {
        PipelineConfig config = PipelineConfig.parse("verify,frobnicate:x=1", registry);
        assertEquals("frobnicate", config.getEntries().get(1).passId());
    }

    @Test
    public void testEmptyItemsSkipped() {
        assertTrue(PipelineConfig.parse(" , ,", registry).getEntries().isEmpty());
    }

    @Test
    public void testDefaultsAreRegistered() {
        for (PipelineConfig.Entry e : PipelineConfig.defaults().getEntries()) {
            assertTrue(registry.contains(e.passId()), e.passId());
        }
        assertEquals("structure", PipelineConfig.defaults().getEntries()
                .get(PipelineConfig.DEFAULT_PASSES.size() - 1).passId());
    }

    @Test
    public void testThenAppends() {
        PipelineConfig config = PipelineConfig.of("verify").then("structure", PassOptions.empty());
        assertEquals(2, config.getEntries().size());
        assertEquals(1, PipelineConfig.of("verify").getEntries().size());
    }

    @Test
    public void testIntOption() {
        PassOptions options = PassOptions.of(java.util.Map.of("n", "3", "bad", "x"));
        assertEquals(3, options.getInt("n", 0));
        assertEquals(7, options.getInt("missing", 7));
        assertThrows(IllegalArgumentException.class, () -> options.getInt("bad", 0));
    }

    @Test
    public void testRegistry() {
        assertTrue(registry.getIds().containsAll(PipelineConfig.DEFAULT_PASSES));
        assertTrue(registry.contains("verify"));
        assertEquals("type-inference", registry.create("type-inference").getName());
        assertTrue(registry.getOptionKeys("type-inference").contains(TypeInferencePass.WIDEN_SMALL_INTS));
        assertThrows(UnknownPassException.class, () -> registry.create("nope"));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("verify", pass.IRPass.VerifyIRPass::new));
    }

    @Test
    public void testPassIdsFromEnumNames() {
        for (IRPassType type : IRPassType.values()) {
            assertSame(type, IRPassType.fromName(type.getName()));
            assertEquals(type.getName(), type.create().getName());
        }
        assertNull(IRPassType.fromName("mem2reg"));
    }
}
