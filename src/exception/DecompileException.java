package exception;

/**
 * Base of the fatal errors raised by the decompiler core. Each carries the
 * function and block it was raised for so a failure can be reproduced on
 * that function alone.
 */
public class DecompileException extends RuntimeException {
    private final String functionName;
    private final int blockId;

    public DecompileException(String message) {
        this(message, null, -1);
    }

    public DecompileException(String message, String functionName, int blockId) {
        super(message);
        this.functionName = functionName;
        this.blockId = blockId;
    }

    public DecompileException(String message, Throwable cause) {
        super(message, cause);
        this.functionName = null;
        this.blockId = -1;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * @return the offending block id, or -1 when the error is not tied to a block
     */
    public int getBlockId() {
        return blockId;
    }

    /**
     * @return the message without the function/block suffix
     */
    public String getDetail() {
        return super.getMessage();
    }

    protected String location() {
        StringBuilder sb = new StringBuilder();
        if (functionName != null) {
            sb.append(" [function ").append(functionName);
            if (blockId >= 0) {
                sb.append(", block ").append(blockId);
            }
            sb.append(']');
        }
        return sb.toString();
    }

    @Override
    public String getMessage() {
        return super.getMessage() + location();
    }

    public static DecompileException noArgs() {
        return new DecompileException("need args to process");
    }

    public static DecompileException wrongArgs(String msg) {
        return new DecompileException("Unexpected args: " + msg);
    }

    public static DecompileException unSupported(String msg) {
        return new DecompileException("UnSupported: " + msg);
    }
}
