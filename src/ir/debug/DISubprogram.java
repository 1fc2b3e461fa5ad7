package ir.debug;

import java.util.Objects;

/**
 * Debug descriptor of a function. Only the fields the passes read are
 * decoded, the rest of the node is printed back verbatim.
 */
public class DISubprogram extends Metadata {
    private final String name;
    private final int line;
    private final String body;

    public DISubprogram(String name, int line, String body) {
        this.name = name;
        this.line = line;
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String bodyToLLVM() {
        return body;
    }
}
