package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import ast.ASTPrinter;
import exception.StructureException;
import frontend.ListingLoader;
import frontend.ParsedListing;
import pass.PassManager;
import solver.OracleType;
import util.LoggingManager;
import util.logging.Logger;

public class StructureDriver {
    private static StructureDriver structureDriver = new StructureDriver();
    private String source = null;
    private String target = null;
    private boolean snippet = false;
    private static final Logger logger = LoggingManager.getLogger(StructureDriver.class);

    private StructureDriver() {
    }

    public static StructureDriver getInstance() {
        return structureDriver;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws StructureException {
        if (args == null || args.length == 0) {
            throw StructureException.noArgs();
        }
        var iter = Arrays.asList(args).iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> target = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                case "--oracle" -> {
                    String name = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                    OracleType type = OracleType.fromName(name, null);
                    if (type == null) {
                        throw StructureException.wrongArgs("unknown oracle " + name);
                    }
                    Config.getInstance().oracle = type;
                }
                case "--max-iterations" -> {
                    String raw = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                    int value = Config.parsePositive(raw);
                    if (value <= 0) {
                        throw StructureException.wrongArgs("--max-iterations needs a positive number, got " + raw);
                    }
                    Config.getInstance().maxIterations = value;
                }
                case "--no-verify" -> Config.getInstance().verify = false;
                case "--snippet" -> snippet = true;
                default -> {
                    if (cmd.startsWith("-") || source != null) {
                        throw StructureException.wrongArgs(cmd);
                    }
                    source = cmd;
                }
            }
        }
        if (source == null) {
            throw StructureException.wrongArgs("no input listing");
        }
    }

    private static String requireValue(String value, String flag) {
        if (value == null) {
            throw StructureException.wrongArgs("Need arg after " + flag);
        }
        return value;
    }

    /*
     * real driver: load, structure, print
     */
    public String run() {
        Path input = Path.of(source);
        ParsedListing listing;
        if (snippet) {
            try {
                listing = ListingLoader.loadSnippet(Files.readString(input), input.getFileName().toString());
            } catch (IOException e) {
                throw new StructureException("failed to read listing " + input, e);
            }
        } else {
            listing = ListingLoader.loadFile(input);
        }
        logger.debug("input:\n{}", listing.ast());

        PassManager passManager = PassManager.getInstance();
        try {
            passManager.run(listing.ast(), listing.provenance());
        } finally {
            PassManager.resetInstance();
        }

        String output = ASTPrinter.print(listing.ast());
        if (target == null) {
            System.out.print(output);
        } else {
            try {
                Files.writeString(Path.of(target), output, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new StructureException("failed to write " + target, e);
            }
        }
        return output;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    /**
     * Forget the arguments of the previous run (used by tests)
     */
    public static void reset() {
        structureDriver = new StructureDriver();
    }
}
