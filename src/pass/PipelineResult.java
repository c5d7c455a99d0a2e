package pass;

import ir.Diagnostic;
import ir.IRModule;

import java.time.Duration;
import java.util.List;

/**
 * The mutated module plus one report per executed pass, in execution order.
 */
public record PipelineResult(IRModule module, List<PassReport> reports) {
    public PipelineResult {
        reports = List.copyOf(reports);
    }

    public boolean anyChanged() {
        return reports.stream().anyMatch(PassReport::changed);
    }

    public Duration totalDuration() {
        return reports.stream().map(PassReport::duration).reduce(Duration.ZERO, Duration::plus);
    }

    public List<Diagnostic> diagnostics() {
        return module.getDiagnostics();
    }
}
