package pass;

import java.util.Set;
import java.util.function.Supplier;

import pass.IRPass.CoalesceVariablesPass;
import pass.IRPass.CopyPropagationPass;
import pass.IRPass.DeadCodeEliminationPass;
import pass.IRPass.MergeBlocksPass;
import pass.IRPass.MergeReturnsPass;
import pass.IRPass.StackRecoveryPass;
import pass.IRPass.StructurePass;
import pass.IRPass.TypeInferencePass;
import pass.IRPass.VerifyIRPass;

/**
 * Built-in passes, named by their pipeline id.
 */
public enum IRPassType implements PassType<Pass> {
    VERIFY(VerifyIRPass::new),
    STACK_RECOVERY(StackRecoveryPass::new),
    MERGE_RETURNS(MergeReturnsPass::new),
    COPY_PROPAGATION(CopyPropagationPass::new),
    DEAD_CODE(DeadCodeEliminationPass::new),
    MERGE_BLOCKS(MergeBlocksPass::new),
    TYPE_INFERENCE(TypeInferencePass::new, TypeInferencePass.WIDEN_SMALL_INTS),
    COALESCE_VARIABLES(CoalesceVariablesPass::new),
    STRUCTURE(StructurePass::new),
    // add more passes here
    ;

    private final Supplier<Pass> constructor;
    private final Set<String> optionKeys;

    IRPassType(Supplier<Pass> constructor, String... optionKeys) {
        this.constructor = constructor;
        this.optionKeys = Set.of(optionKeys);
    }

    @Override
    public Supplier<Pass> constructor() {
        return constructor;
    }

    @Override
    public Set<String> optionKeys() {
        return optionKeys;
    }

    public static IRPassType fromName(String name) {
        for (IRPassType t : values()) {
            if (t.getName().equals(name)) {
                return t;
            }
        }
        return null;
    }
}
