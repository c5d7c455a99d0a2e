package pass;

import driver.Config;
import exception.DecompileException;
import exception.InvariantViolationException;
import exception.UnknownPassException;
import ir.IRModule;
import ir.value.Function;
import pass.IRPass.VerifyIRPass;
import pass.IRPass.analysis.AnalysisCache;
import pass.IRPass.analysis.AnalysisKind;
import util.LoggingManager;
import util.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs an ordered list of passes over a module.
 *
 * <p>Every pass id is resolved before the first pass runs. Function passes are
 * applied to functions in module order; with more than one thread they run on
 * a worker pool but results are still collected in module order. Analyses are
 * cached per function for the whole run and dropped when a pass reports a
 * change that makes them stale.
 */
public class PassPipeline {
    private static final Logger logger = LoggingManager.getLogger(PassPipeline.class);

    private final PassRegistry registry;
    private final int threads;
    private final boolean verifyEachPass;

    public PassPipeline(PassRegistry registry) {
        this(registry, Config.getInstance().threads, Config.getInstance().verifyEachPass);
    }

    public PassPipeline(PassRegistry registry, int threads, boolean verifyEachPass) {
        this.registry = registry;
        this.threads = Math.max(1, threads);
        this.verifyEachPass = verifyEachPass;
    }

    public PipelineResult run(IRModule module, PipelineConfig config) {
        List<Pass> passes = new ArrayList<>();
        for (PipelineConfig.Entry entry : config.getEntries()) {
            if (!registry.contains(entry.passId())) {
                throw new UnknownPassException(entry.passId());
            }
            passes.add(registry.create(entry.passId()));
        }

        Map<Function, AnalysisCache> caches = new IdentityHashMap<>();
        List<PassReport> reports = new ArrayList<>();
        IRModule lastGood = module.copy();
        ExecutorService pool = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
        try {
            for (int i = 0; i < passes.size(); i++) {
                Pass pass = passes.get(i);
                PassOptions options = config.getEntries().get(i).options();
                long start = System.nanoTime();
                PassResult result;
                try {
                    result = runPass(pass, options, module, caches, pool);
                    if (verifyEachPass && result.isChanged()) {
                        VerifyIRPass.verify(module);
                    }
                } catch (InvariantViolationException e) {
                    logger.error("pass {} broke an invariant: {}", pass.getName(), e.getMessage());
                    throw e.attribute(pass.getName(), lastGood);
                }
                Duration duration = Duration.ofNanos(System.nanoTime() - start);
                reports.add(new PassReport(pass.getName(), result.isChanged(), duration));
                logger.debug("pass {} {} in {} us", pass.getName(), result, duration.toNanos() / 1000);
                if (result.isChanged()) {
                    lastGood = module.copy();
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
        return new PipelineResult(module, reports);
    }

    private PassResult runPass(Pass pass, PassOptions options, IRModule module,
            Map<Function, AnalysisCache> caches, ExecutorService pool) {
        if (pass instanceof Pass.ModulePass mp) {
            PassResult result = mp.runOnModule(module, new PassContext(module, options, null));
            if (result.isChanged()) {
                caches.values().forEach(c -> c.invalidate(result.isCfgChanged()));
            }
            return result;
        }
        if (!(pass instanceof Pass.FunctionPass fp)) {
            throw DecompileException.unSupported("pass " + pass.getName() + " is neither a function nor a module pass");
        }
        List<Function> functions = module.getFunctions();
        for (Function f : functions) {
            caches.computeIfAbsent(f, AnalysisCache::new);
        }
        PassResult combined = PassResult.UNCHANGED;
        if (pool == null || functions.size() < 2) {
            for (Function f : functions) {
                combined = combined.merge(runOnFunction(fp, f, options, module, caches.get(f)));
            }
            return combined;
        }
        List<Future<PassResult>> futures = new ArrayList<>();
        for (Function f : functions) {
            AnalysisCache cache = caches.get(f);
            futures.add(pool.submit(() -> runOnFunction(fp, f, options, module, cache)));
        }
        for (Future<PassResult> future : futures) {
            combined = combined.merge(await(future));
        }
        return combined;
    }

    private static PassResult runOnFunction(Pass.FunctionPass pass, Function f, PassOptions options,
            IRModule module, AnalysisCache cache) {
        for (AnalysisKind kind : pass.requiredAnalyses()) {
            cache.get(kind);
        }
        PassResult result = pass.runOnFunction(f, new PassContext(module, options, cache));
        if (result.isChanged()) {
            cache.invalidate(result.isCfgChanged());
        }
        return result;
    }

    private static PassResult await(Future<PassResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecompileException("interrupted while waiting for a pass", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new DecompileException("pass failed", cause);
        }
    }
}
