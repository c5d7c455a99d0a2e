package pass.IRPass;

import ir.IRModule;
import ir.value.Function;
import pass.PassPipeline;
import pass.PassRegistry;
import pass.PipelineConfig;
import pass.PipelineResult;

/**
 * Runs passes the way the pipeline does, with verification after each change.
 */
final class PassTestSupport {
    private PassTestSupport() {
    }

    static PipelineResult run(IRModule module, String... passes) {
        return new PassPipeline(PassRegistry.withBuiltins(), 1, true).run(module, PipelineConfig.of(passes));
    }

    static PipelineResult run(IRModule module, PipelineConfig config) {
        return new PassPipeline(PassRegistry.withBuiltins(), 1, true).run(module, config);
    }

    static IRModule moduleOf(Function... functions) {
        IRModule module = new IRModule("test");
        for (Function f : functions) {
            module.addFunction(f);
        }
        return module;
    }
}
