package driver;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import util.logging.Logger;
import util.logging.LogManager;

import exception.CompileException;
import ir.IRModule;
import pass.IRPassType;
import pass.PassManager;
import util.llvm.LLVMIRLoader;
import util.llvm.LLVMParseException;
import util.llvm.LoaderConfig;

/**
 * Command line driver: {@code irsan [pass flags] [-verify] [-strict]
 * [-entry NAME] [-o OUT.ll] IN.ll}. Loads the module, runs the selected
 * passes and prints the result to OUT.ll or stdout.
 */
public class CompilerDriver {
    public static final String USAGE = "usage: irsan [-delete-undefined | -delete-undefined-nosym | -passes a,b]"
            + " [-verify] [-strict] [-entry NAME] [-o OUT.ll] IN.ll";

    private static CompilerDriver compilerDriver = new CompilerDriver();
    private String source = null;
    private String target = null;
    private final List<String> passNames = new ArrayList<>();
    private boolean verify = false;
    private boolean help = false;
    private static final Logger logger = LogManager.getLogger(CompilerDriver.class);

    private CompilerDriver() {
    }

    public static CompilerDriver getInstance() {
        return compilerDriver;
    }

    /* only for test !!! */
    public static void reset() {
        compilerDriver = new CompilerDriver();
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> target = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                case "-delete-undefined" -> passNames.add(IRPassType.DeleteUndefined.getName());
                case "-delete-undefined-nosym" -> passNames.add(IRPassType.DeleteUndefinedNoSym.getName());
                case "-passes" -> {
                    String list = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                    for (String name : list.split(",")) {
                        if (!name.isBlank()) {
                            // fail on a typo before the input is read
                            passNames.add(IRPassType.fromName(name).getName());
                        }
                    }
                }
                case "-verify" -> verify = true;
                case "-strict" -> Config.getInstance().isStrict = true;
                case "-entry" -> Config.getInstance().entryName = requireValue(iter.hasNext() ? iter.next() : null, cmd);
                case "-h", "-help", "--help" -> help = true;
                default -> {
                    if (cmd.startsWith("-")) {
                        throw CompileException.wrongArgs(cmd);
                    }
                    if (source != null) {
                        throw CompileException.wrongArgs("more than one input: " + source + ", " + cmd);
                    }
                    source = cmd;
                }
            }
        }
        if (source == null && !help) {
            throw CompileException.wrongArgs("no input .ll file");
        }
    }

    private static String requireValue(String value, String option) {
        if (value == null || value.startsWith("-")) {
            throw CompileException.wrongArgs("Need arg after " + option + " but got: "
                    + (value == null ? "nothing" : value));
        }
        return value;
    }

    /*
     * real driver: load, run the passes, print
     */
    public void run() throws IOException, LLVMParseException {
        if (help) {
            System.out.println(USAGE);
            return;
        }
        LoaderConfig cfg = LoaderConfig
                .defaultConfig()
                .setErrorHandling(LoaderConfig.ErrorHandling.STRICT)
                .setVerifyAfterLoad(verify);
        IRModule irModule = LLVMIRLoader.loadFromFile(source, cfg);

        PassManager passManager = new PassManager(getPassNames());
        passManager.setVerifyEach(verify);
        boolean changed = passManager.runIRPasses(irModule);
        logger.info("{}: {}", source, changed ? "module changed" : "nothing to do");

        if (target != null) {
            irModule.printToFile(target);
        } else {
            System.out.print(irModule.toLLVM());
        }
    }

    /**
     * parseArgs + run with every failure reported as a one-line
     * {@code error:} message.
     *
     * @return the process exit status
     */
    public int runCommandLine(String[] args, PrintStream err) {
        try {
            parseArgs(args);
            run();
            return 0;
        } catch (CompileException | LLVMParseException e) {
            err.println("error: " + firstLine(e.getMessage()));
            logger.debug("{}", e.getMessage());
        } catch (IOException e) {
            err.println("error: " + e.getMessage());
        }
        if (source == null) {
            err.println(USAGE);
        }
        return 1;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    /* the passes to run, delete-undefined when none was named */
    public List<String> getPassNames() {
        if (passNames.isEmpty()) {
            return List.of(IRPassType.DeleteUndefined.getName());
        }
        return Collections.unmodifiableList(passNames);
    }

    public boolean isVerify() {
        return verify;
    }

    public String getTarget() {
        return target;
    }

    public String getSource() {
        return source;
    }
}
