package driver;

import emit.EmitOptions;
import emit.PseudocodeEmitter;
import emit.RegionJsonWriter;
import frontend.CFGBuilder;
import frontend.Listing;
import frontend.ListingParseException;
import frontend.ListingReader;
import ir.IRModule;
import pass.PassPipeline;
import pass.PassRegistry;
import pass.PipelineConfig;
import pass.PipelineResult;
import pass.IRPass.VerifyIRPass;

import java.io.IOException;
import java.io.StringWriter;

/**
 * One place for both ways through the decompiler. {@link #buildModule} stops
 * after control flow recovery and verification; {@link #decompile} continues
 * through the pass pipeline, structuring and emission on the same module.
 */
public class Decompiler {
    private final PassRegistry registry;
    private final PassPipeline pipeline;
    private final EmitOptions emitOptions;

    public Decompiler() {
        this(PassRegistry.withBuiltins(), EmitOptions.defaults());
    }

    public Decompiler(PassRegistry registry, EmitOptions emitOptions) {
        this(registry, new PassPipeline(registry), emitOptions);
    }

    public Decompiler(PassRegistry registry, PassPipeline pipeline, EmitOptions emitOptions) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.emitOptions = emitOptions;
    }

    public PassRegistry getRegistry() {
        return registry;
    }

    public IRModule buildModule(Listing listing) {
        IRModule module = new CFGBuilder().build(listing);
        VerifyIRPass.verify(module);
        return module;
    }

    public Result decompile(Listing listing, PipelineConfig config) {
        PipelineResult run = pipeline.run(buildModule(listing), config);
        String text = new PseudocodeEmitter(emitOptions).emit(run.module());
        return new Result(run, text);
    }

    public Result decompile(String listingText, PipelineConfig config) throws ListingParseException {
        return decompile(new ListingReader().read(listingText, "<input>"), config);
    }

    public String toJson(IRModule module) {
        StringWriter sw = new StringWriter();
        try {
            new RegionJsonWriter(sw).serialize(module);
        } catch (IOException e) {
            throw new IllegalStateException("writing to a string failed", e);
        }
        return sw.toString();
    }

    /**
     * Outcome of a full run: the pipeline's module and reports, and the pseudocode text.
     */
    public record Result(PipelineResult pipeline, String pseudocode) {
        public IRModule module() {
            return pipeline.module();
        }
    }
}
