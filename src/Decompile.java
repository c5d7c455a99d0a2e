import driver.*;
import util.logging.LogManager;

public class Decompile {
    /*
     * move the duty of the decompiler to the driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        DecompilerDriver driver = DecompilerDriver.getInstance();
        try {
            driver.parseArgs(args);
            driver.run();
        } finally {
            LogManager.shutdown();
        }
    }
}
