package driver;

import exception.DecompileException;
import frontend.Listing;
import frontend.ListingParseException;
import frontend.ListingReader;
import ir.Diagnostic;
import ir.IRModule;
import ir.IRPrinter;
import pass.PassReport;
import pass.PipelineConfig;
import util.LoggingManager;
import util.logging.LogLevel;
import util.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Command line front: {@code <listing> [-o out] [-passes list] [-json] [-S]}.
 * Without {@code -o} the result goes to standard output.
 */
public class DecompilerDriver {
    private static DecompilerDriver decompilerDriver = new DecompilerDriver();
    private static final Logger logger = LoggingManager.getLogger(DecompilerDriver.class);

    private String source = null;
    private String target = null;
    private String passes = null;
    private boolean emitJson = false;
    // stop after control flow recovery and print the IR
    private boolean emitIR = false;

    private DecompilerDriver() {
    }

    public static DecompilerDriver getInstance() {
        return decompilerDriver;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws DecompileException {
        if (args == null || args.length == 0) {
            throw DecompileException.noArgs();
        }
        source = null;
        target = null;
        passes = null;
        emitJson = false;
        emitIR = false;
        var iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw DecompileException.wrongArgs("Need arg after -o but got nothing");
                    }
                }
                case "-passes" -> {
                    if (iter.hasNext()) {
                        passes = iter.next();
                    } else {
                        throw DecompileException.wrongArgs("Need a pass list after -passes");
                    }
                }
                case "-json" -> emitJson = true;
                case "-S" -> emitIR = true;
                default -> {
                    if (cmd.startsWith("-") || source != null) {
                        throw DecompileException.wrongArgs(cmd);
                    }
                    source = cmd;
                }
            }
        }
        if (source == null) {
            throw DecompileException.wrongArgs("no listing given");
        }
    }

    public void run() {
        if (Config.getInstance().isDebug) {
            LoggingManager.setLevel(LogLevel.DEBUG);
        }
        Decompiler decompiler = new Decompiler();
        Listing listing = readListing(Path.of(source));
        String output;
        if (emitIR) {
            IRModule module = decompiler.buildModule(listing);
            output = new IRPrinter().print(module);
        } else {
            PipelineConfig config = passes == null ? PipelineConfig.defaults()
                    : PipelineConfig.parse(passes, decompiler.getRegistry());
            Decompiler.Result result = decompiler.decompile(listing, config);
            for (PassReport report : result.pipeline().reports()) {
                logger.info("{}", report);
            }
            logger.info("pipeline finished in {} ms", result.pipeline().totalDuration().toMillis());
            for (Diagnostic d : result.pipeline().diagnostics()) {
                logger.warn("{}", d);
            }
            output = emitJson ? decompiler.toJson(result.module()) : result.pseudocode();
        }
        write(output);
    }

    private Listing readListing(Path path) {
        try {
            return new ListingReader().read(path);
        } catch (IOException e) {
            throw new DecompileException("failed to read listing " + path, e);
        } catch (ListingParseException e) {
            for (ListingParseException.ParseError err : e.getErrors()) {
                logger.error("{}", err);
            }
            throw new DecompileException("failed to parse listing " + path + ": " + e.getMessage(), e);
        }
    }

    private void write(String output) {
        if (target == null) {
            System.out.print(output);
            return;
        }
        try {
            Files.writeString(Path.of(target), output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DecompileException("failed to write " + target, e);
        }
    }

    public String getSource() {
        return source;
    }
}
