package pass.IRPass;

import ir.value.Function;
import pass.IRPassType;
import pass.Pass;
import pass.PassContext;
import pass.PassResult;
import pass.IRPass.analysis.AnalysisCache;
import pass.IRPass.analysis.AnalysisKind;
import structure.RegionTree;
import structure.Structurer;

import java.util.Set;

/**
 * Attaches the structured region tree to the function. Reports a change only
 * when the tree differs from the one already attached.
 */
public class StructurePass implements Pass.FunctionPass {
    private final Structurer structurer = new Structurer();

    @Override
    public String getName() {
        return IRPassType.STRUCTURE.getName();
    }

    @Override
    public Set<AnalysisKind> requiredAnalyses() {
        return Set.of(AnalysisKind.CFG, AnalysisKind.LOOPS);
    }

    @Override
    public PassResult runOnFunction(Function function, PassContext context) {
        AnalysisCache analyses = context.getAnalyses();
        RegionTree tree = structurer.structure(function, analyses.getCfg(), analyses.getLoopInfo());
        if (tree.equals(function.getRegionTree())) {
            return PassResult.UNCHANGED;
        }
        function.setRegionTree(tree);
        return PassResult.CHANGED;
    }
}
