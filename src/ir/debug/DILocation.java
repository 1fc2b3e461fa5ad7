package ir.debug;

import java.util.Objects;

/**
 * Source location attached to an instruction with {@code !dbg}.
 */
public class DILocation extends Metadata {
    private final int line;
    private final int column;
    private final Metadata scope;
    // parsed locations may carry more (inlinedAt, isImplicitCode), keep their text
    private final String body;

    private DILocation(int line, int column, Metadata scope, String body) {
        this.line = line;
        this.column = column;
        this.scope = scope;
        this.body = body;
    }

    public static DILocation get(int line, int column, Metadata scope) {
        return new DILocation(line, column, Objects.requireNonNull(scope, "scope"), null);
    }

    public static DILocation parsed(int line, int column, Metadata scope, String body) {
        return new DILocation(line, column, scope, Objects.requireNonNull(body, "body"));
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public Metadata getScope() {
        return scope;
    }

    @Override
    public String bodyToLLVM() {
        if (body != null) {
            return body;
        }
        return "!DILocation(line: " + line + ", column: " + column
                + ", scope: " + scope.getReference() + ")";
    }
}
