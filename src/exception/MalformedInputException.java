package exception;

/**
 * The decoded instruction stream violates the CFG-building contract.
 * Raised before any pass runs.
 */
public class MalformedInputException extends DecompileException {
    private final long address;

    public MalformedInputException(String message, String functionName, long address) {
        super(message, functionName, -1);
        this.address = address;
    }

    public long getAddress() {
        return address;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + String.format(" at 0x%x", address);
    }

    public static MalformedInputException crossFunctionEdge(String function, long from, long to, String owner) {
        return new MalformedInputException(String.format(
                "successor 0x%x belongs to function %s but is reached without a call", to, owner),
                function, from);
    }

    public static MalformedInputException duplicateAddress(String function, long address) {
        return new MalformedInputException("instruction address decoded twice", function, address);
    }

    public static MalformedInputException missingEntry(String function, long entry) {
        return new MalformedInputException("function entry has no decoded instruction", function, entry);
    }

    public static MalformedInputException duplicateFunction(String function, long entry) {
        return new MalformedInputException("function name already used", function, entry);
    }
}
