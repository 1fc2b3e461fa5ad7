package pass.IRPass;

import driver.Config;
import exception.CompileException;
import ir.IRModule;
import ir.type.Type;
import ir.value.Function;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import pass.IRPass.undef.CallClassifier;
import pass.IRPass.undef.NondetValueManager;
import pass.IRPass.undef.RemovedSymbolLog;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

import java.io.PrintStream;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Deletes calls to functions that have no body in the module.
 * <p>
 * A removed call that returns a value has its uses redirected first: to the
 * zero value of the type in nosym mode, otherwise to a load of a global cell
 * that the entry function marks symbolic (see {@link NondetValueManager}).
 * Calls to whitelisted functions are kept, see {@link CallClassifier}.
 * <p>
 * Cells, the make-symbolic declaration and the report of removed symbols
 * are shared by all functions of one module. {@link #run(IRModule)} starts
 * over for its module; {@link #runOnFunction(Function)} keeps using the
 * module's existing state, whatever other modules were handled in between.
 */
public class DeleteUndefinedPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    private final boolean nosym;
    private final boolean strict;
    private final String entryName;
    private final PrintStream diagnostics;

    private final CallClassifier classifier = new CallClassifier();
    // one context per module, kept across runOnFunction calls
    private final Map<IRModule, RunContext> contexts = new IdentityHashMap<>();
    private RunContext current;

    public DeleteUndefinedPass(boolean nosym) {
        this(nosym, Config.getInstance().isStrict, Config.getInstance().entryName, System.err);
    }

    public DeleteUndefinedPass(boolean nosym, boolean strict, String entryName, PrintStream diagnostics) {
        this.nosym = nosym;
        this.strict = strict;
        this.entryName = entryName;
        this.diagnostics = diagnostics;
    }

    @Override
    public IRPassType getType() {
        return nosym ? IRPassType.DeleteUndefinedNoSym : IRPassType.DeleteUndefined;
    }

    public boolean isNosym() {
        return nosym;
    }

    @Override
    public boolean run(IRModule module) {
        log.info("Running pass: {} (entry '{}')", getType().getName(), entryName);
        current = new RunContext(module);
        contexts.put(module, current);
        boolean changed = false;
        for (Function function : module.getFunctions()) {
            if (!function.isDeclaration()) {
                changed |= runOnFunction(function);
            }
        }
        log.info("{}: {} undefined symbol(s) removed, {} nondet cell(s)",
                getType().getName(), current.removedLog.size(), current.nondet.getNumCells());
        return changed;
    }

    /**
     * Removes the eligible calls of one function.
     *
     * @return true if a call was removed
     */
    public boolean runOnFunction(Function function) {
        current = contexts.computeIfAbsent(function.getParent(), RunContext::new);
        boolean modified = false;
        // instructions() has already stepped past inst when we get it, erasing it is safe
        for (Instruction inst : function.instructions()) {
            if (!(inst instanceof CallInst call)) {
                continue;
            }
            if (classifier.classify(call) != CallClassifier.Decision.ELIMINATE) {
                continue;
            }
            eliminate(call, CallClassifier.resolveCallee(call));
            modified = true;
        }
        return modified;
    }

    private void eliminate(CallInst call, Function callee) {
        Type type = call.getType();
        // all checks that can fail come before the first change
        checkPointerArguments(call, callee);
        Constant zero = null;
        if (!type.isVoid() && nosym) {
            zero = Constant.getNullValue(type);
        } else if (!type.isVoid() && !current.nondet.hasCell(type)) {
            current.nondet.checkCanCreateCell(type);
        }

        if (current.removedLog.firstRemoval(callee)) {
            current.removedLog.report(callee, type.isVoid() ? null : nosym ? "set to 0" : "made symbolic");
        }
        log.debug("removing {} in {}", call.toLLVM(), call.getFunction().getName());

        if (!type.isVoid()) {
            Value replacement = nosym ? zero : current.nondet.materialize(type, call);
            call.replaceAllUsesWith(replacement);
        }
        call.eraseFromParent();
    }

    /*
     * An undefined function taking a pointer may write through it, dropping
     * the call loses that effect. Warn once per callee, or refuse in strict mode.
     */
    private void checkPointerArguments(CallInst call, Function callee) {
        boolean hasPointer = false;
        for (Value arg : call.getArgs()) {
            if (arg.getType().isPointer()) {
                hasPointer = true;
                break;
            }
        }
        if (!hasPointer) {
            return;
        }
        if (strict) {
            throw CompileException.pointerArgument(callee.getName());
        }
        if (current.pointerWarned.add(callee)) {
            log.warn("removing calls to '{}' which takes pointer arguments, "
                    + "writes through them are lost", callee.getName());
        }
    }

    /* the manager of the module handled last, for tests */
    public NondetValueManager getNondetValueManager() {
        return current == null ? null : current.nondet;
    }

    /*
     * cells, reported symbols and pointer warnings of one module; run()
     * starts a fresh one, runOnFunction alone keeps adding to it
     */
    private class RunContext {
        final RemovedSymbolLog removedLog = new RemovedSymbolLog(diagnostics);
        final NondetValueManager nondet;
        // callees already warned about for pointer arguments
        final Set<Function> pointerWarned = Collections.newSetFromMap(new IdentityHashMap<>());

        RunContext(IRModule module) {
            this.nondet = new NondetValueManager(module, entryName);
        }
    }
}
