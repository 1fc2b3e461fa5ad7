package pass.IRPass.undef;

import ir.value.Function;
import ir.value.instructions.CallInst;
import util.LoggingManager;
import util.logging.Logger;

import java.util.Set;

/**
 * Decides whether a call site is removed by {@link pass.IRPass.DeleteUndefinedPass}.
 * <p>
 * A call is eliminated only when it directly (after stripping pointer casts)
 * calls a function without a body that downstream tools do not model
 * themselves. Everything else is left alone.
 */
public class CallClassifier {
    private static final Logger log = LoggingManager.getLogger(CallClassifier.class);

    public enum Decision {
        SKIP,
        ELIMINATE
    }

    /* modelled natively by symbolic executors and verifiers */
    private static final Set<String> LEAVE_CALLS = Set.of(
            "__assert_fail",
            "abort",
            "klee_make_symbolic",
            "klee_assume",
            "klee_abort",
            "klee_silent_exit",
            "klee_report_error",
            "klee_warning_once",
            "exit",
            "_exit",
            "malloc",
            "calloc",
            "realloc",
            "free",
            "memset",
            "memcmp",
            "memcpy",
            "memmove",
            "kzalloc",
            "__errno_location");

    private static final Set<String> NONDET_ALIASES = Set.of("nondet_int", "klee_int");

    public static final String VERIFIER_PREFIX = "__VERIFIER_";

    public Decision classify(CallInst call) {
        if (call.isInlineAsm()) {
            return Decision.SKIP;
        }
        Function callee = resolveCallee(call);
        if (callee == null || callee.getName() == null) {
            log.trace("skip indirect call {}", call.toLLVM());
            return Decision.SKIP;
        }
        if (callee.isIntrinsic()) {
            return Decision.SKIP;
        }
        String name = callee.getName();
        if (isWhitelisted(name)) {
            log.debug("skip call to whitelisted '{}'", name);
            return Decision.SKIP;
        }
        if (!callee.isDeclaration()) {
            return Decision.SKIP;
        }
        return Decision.ELIMINATE;
    }

    /* the called function with bitcasts looked through, null for indirect calls */
    public static Function resolveCallee(CallInst call) {
        return call.getCalledValue().stripPointerCasts() instanceof Function f ? f : null;
    }

    /**
     * Names never removed: the fixed list, the nondet int aliases and
     * anything in the verifier namespace.
     */
    public static boolean isWhitelisted(String name) {
        return LEAVE_CALLS.contains(name)
                || NONDET_ALIASES.contains(name)
                || name.startsWith(VERIFIER_PREFIX);
    }
}
