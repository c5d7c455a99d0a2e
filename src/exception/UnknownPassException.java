package exception;

/**
 * The pipeline configuration names a pass the registry does not know.
 * Raised before any pass is executed.
 */
public class UnknownPassException extends DecompileException {
    private final String passName;

    public UnknownPassException(String passName) {
        super("unknown pass: " + passName);
        this.passName = passName;
    }

    public String getPassName() {
        return passName;
    }
}
