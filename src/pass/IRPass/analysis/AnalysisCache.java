package pass.IRPass.analysis;

import ir.value.Function;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Lazily computed analyses of one function. Owned by a single pipeline run
 * and touched only by the thread currently running a pass on that function.
 */
public class AnalysisCache {
    private final Function function;
    private final Map<AnalysisKind, Object> results = new EnumMap<>(AnalysisKind.class);
    private final Map<AnalysisKind, Integer> computations = new EnumMap<>(AnalysisKind.class);

    public AnalysisCache(Function function) {
        this.function = function;
    }

    public Function getFunction() {
        return function;
    }

    public ControlFlowGraph getCfg() {
        return get(AnalysisKind.CFG, () -> ControlFlowGraph.of(function));
    }

    public DominanceAnalysis getDominance() {
        return get(AnalysisKind.DOMINANCE, () -> new DominanceAnalysis(getCfg()));
    }

    public LoopInfo getLoopInfo() {
        return get(AnalysisKind.LOOPS, () -> new LoopInfo(getDominance()));
    }

    public Reachability getReachability() {
        return get(AnalysisKind.REACHABILITY, () -> new Reachability(getCfg()));
    }

    public Liveness getLiveness() {
        return get(AnalysisKind.LIVENESS, () -> new Liveness(function));
    }

    public Object get(AnalysisKind kind) {
        return switch (kind) {
            case CFG -> getCfg();
            case DOMINANCE -> getDominance();
            case LOOPS -> getLoopInfo();
            case REACHABILITY -> getReachability();
            case LIVENESS -> getLiveness();
        };
    }

    @SuppressWarnings("unchecked")
    private <T> T get(AnalysisKind kind, Supplier<T> compute) {
        Object cached = results.get(kind);
        if (cached == null) {
            cached = compute.get();
            results.put(kind, cached);
            computations.merge(kind, 1, Integer::sum);
        }
        return (T) cached;
    }

    public boolean isCached(AnalysisKind kind) {
        return results.containsKey(kind);
    }

    /**
     * @return how many times the analysis was computed during this run
     */
    public int getComputationCount(AnalysisKind kind) {
        return computations.getOrDefault(kind, 0);
    }

    /**
     * Drops results a change made stale.
     *
     * @param controlFlowChanged true if blocks or edges changed
     */
    public void invalidate(boolean controlFlowChanged) {
        if (controlFlowChanged) {
            results.clear();
            return;
        }
        results.keySet().removeIf(AnalysisKind::dependsOnInstructions);
    }
}
