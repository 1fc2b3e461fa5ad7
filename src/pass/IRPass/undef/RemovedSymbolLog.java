package pass.IRPass.undef;

import ir.value.Function;

import java.io.PrintStream;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Remembers which undefined functions had calls removed during one pass run,
 * so each symbol is reported once no matter how many call sites it had.
 */
public class RemovedSymbolLog {
    public static final String PREFIX = "delete-undefined: ";

    private final Set<Function> removed = Collections.newSetFromMap(new IdentityHashMap<>());
    private final PrintStream out;

    public RemovedSymbolLog(PrintStream out) {
        this.out = out;
    }

    /* true the first time the function is seen in this run */
    public boolean firstRemoval(Function callee) {
        return removed.add(callee);
    }

    /**
     * @param retval what happened to the result: "made symbolic", "set to 0",
     *               or null for a call without result
     */
    public void report(Function callee, String retval) {
        StringBuilder sb = new StringBuilder(PREFIX)
                .append("removed calls to '").append(callee.getName())
                .append("' (function is undefined");
        if (retval != null) {
            sb.append(", retval ").append(retval);
        }
        out.println(sb.append(')'));
    }

    public int size() {
        return removed.size();
    }
}
