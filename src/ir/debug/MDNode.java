package ir.debug;

import java.util.Objects;

/* any node we do not need to look into, kept exactly as written */
public class MDNode extends Metadata {
    private final String body;

    public MDNode(String body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String bodyToLLVM() {
        return body;
    }
}
