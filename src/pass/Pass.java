package pass;

import ir.IRModule;
import ir.value.Function;
import pass.IRPass.analysis.AnalysisKind;

import java.util.Set;

public interface Pass {
    String getName();

    /**
     * Analyses the pipeline computes, or reuses from its cache, before the pass runs.
     */
    default Set<AnalysisKind> requiredAnalyses() {
        return Set.of();
    }

    interface FunctionPass extends Pass {
        PassResult runOnFunction(Function function, PassContext context);
    }

    interface ModulePass extends Pass {
        PassResult runOnModule(IRModule module, PassContext context);
    }
}
