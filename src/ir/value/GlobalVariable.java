package ir.value;

import ir.IRModule;
import ir.debug.Metadata;
import ir.type.PointerType;
import ir.type.Type;

import java.util.LinkedHashMap;
import java.util.Map;

public class GlobalVariable extends GlobalValue {
    // a constant or another global, null for a declaration
    private Value initializer;
    private boolean isConst;
    // 0 means "use the natural alignment of the value type"
    private int align;
    // section "...", comdat, ... as written, printed before the alignment
    private String trailers = "";
    private final Map<String, Metadata> attachments = new LinkedHashMap<>();

    public GlobalVariable(IRModule parent, Type valueType,
                          String name, Value initializer) {
        super(parent, PointerType.get(valueType), name);
        this.isConst = false; // 默认不是常量
        setInitializer(initializer);
    }



    /* getter setter */
    public Type getValueType() {
        return getType().getPointeeType();
    }

    public Value getInitializer() { return initializer; }

    /* null turns the global into a declaration */
    public void setInitializer(Value initializer) {
        if (initializer != null && !initializer.getType().equals(getValueType())) {
            throw new IllegalArgumentException("initializer of @" + getName() + " has type "
                    + initializer.getType() + ", expected " + getValueType());
        }
        if (initializer != null && !initializer.isConstant()) {
            throw new IllegalArgumentException("initializer of @" + getName() + " is not a constant");
        }
        this.initializer = initializer;
    }

    public boolean hasInitializer() { return initializer != null; }
    public boolean isConst() { return isConst; }
    public void setConst(boolean isConst) { this.isConst = isConst; }
    public int getAlign() { return align; }
    public void setAlign(int align) { this.align = align; }
    public String getTrailers() { return trailers; }
    public void setTrailers(String trailers) { this.trailers = trailers == null ? "" : trailers.trim(); }
    public Map<String, Metadata> getAttachments() { return attachments; }

    @Override
    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append(getReference()).append(" = ");
        // a global without initializer is a declaration, linkage goes first
        if (!hasInitializer() && !getQualifiers().contains("external")
                && !getQualifiers().contains("extern_weak")) {
            sb.append("external ");
        }
        if (!getQualifiers().isEmpty()) {
            sb.append(getQualifiers()).append(" ");
        }
        sb.append(isConst() ? "constant " : "global ");
        sb.append(getValueType().toLLVM());
        if (initializer != null) {
            sb.append(" ").append(initializer.getReference());
        }

        if (!trailers.isEmpty()) {
            sb.append(", ").append(trailers);
        }
        if (align > 0) {
            sb.append(", align ").append(align);
        } else if (getValueType().isSized()) {
            sb.append(", align ")
              .append(getParent().getTargetDataLayout().getABITypeAlignment(getValueType()));
        }
        for (var entry : attachments.entrySet()) {
            sb.append(", !").append(entry.getKey()).append(" ").append(entry.getValue().getReference());
        }
        return sb.toString();
    }

    @Override
    public String getHash() {
        return "GLOBAL" + getName() + getType().getHash();
    }
}
