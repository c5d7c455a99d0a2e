package exception;

import ir.IRModule;

/**
 * A pass left the IR in a structurally invalid state. When raised by the
 * pipeline it names the offending pass and carries the module as it was
 * after the last pass that completed cleanly.
 */
public class InvariantViolationException extends DecompileException {
    private final String passName;
    private final IRModule lastGoodModule;

    public InvariantViolationException(String message, String functionName, int blockId) {
        this(message, functionName, blockId, null, null);
    }

    private InvariantViolationException(String message, String functionName, int blockId,
            String passName, IRModule lastGoodModule) {
        super(message, functionName, blockId);
        this.passName = passName;
        this.lastGoodModule = lastGoodModule;
    }

    /**
     * Re-raise this violation attributed to {@code pass}.
     */
    public InvariantViolationException attribute(String pass, IRModule lastGood) {
        InvariantViolationException e = new InvariantViolationException(
                getDetail(), getFunctionName(), getBlockId(), pass, lastGood);
        e.initCause(this);
        return e;
    }

    public String getPassName() {
        return passName;
    }

    /**
     * @return the module after the last successful pass, or null when not raised by the pipeline
     */
    public IRModule getLastGoodModule() {
        return lastGoodModule;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        return passName == null ? msg : msg + " (pass " + passName + ")";
    }
}
