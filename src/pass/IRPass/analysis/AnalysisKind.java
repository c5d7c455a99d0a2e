package pass.IRPass.analysis;

public enum AnalysisKind {
    CFG(false),
    DOMINANCE(false),
    LOOPS(false),
    REACHABILITY(false),
    LIVENESS(true);

    // true if any instruction change makes the result stale, not only control flow changes
    private final boolean dependsOnInstructions;

    AnalysisKind(boolean dependsOnInstructions) {
        this.dependsOnInstructions = dependsOnInstructions;
    }

    public boolean dependsOnInstructions() {
        return dependsOnInstructions;
    }
}
