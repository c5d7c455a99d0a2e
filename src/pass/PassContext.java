package pass;

import ir.IRModule;
import pass.IRPass.analysis.AnalysisCache;

/**
 * What a pass sees besides its function: the module, its options and, for
 * function passes, the function's analysis cache.
 */
public class PassContext {
    private final IRModule module;
    private final PassOptions options;
    private final AnalysisCache analyses;

    public PassContext(IRModule module, PassOptions options, AnalysisCache analyses) {
        this.module = module;
        this.options = options;
        this.analyses = analyses;
    }

    public IRModule getModule() {
        return module;
    }

    public PassOptions getOptions() {
        return options;
    }

    /**
     * @return the cache of the function being processed; null for module passes
     */
    public AnalysisCache getAnalyses() {
        return analyses;
    }
}
