package ir.value;

import ir.type.Type;

public class Argument extends Value {
    private final int index; // Argument index in the function
    private final Function parent; // The function this argument belongs to
    // parameter attributes as written, e.g. "noundef nonnull"
    private String attributes = "";

    public Argument(Type type, String name, int index, Function parent) {
        super(type, name);
        this.index = index;
        this.parent = parent;
    }


    public int getIndex() { return index; }
    public Function getParent() { return parent; }

    public String getAttributes() { return attributes; }
    public void setAttributes(String attributes) {
        this.attributes = attributes == null ? "" : attributes.trim();
    }

    /* as printed in a declaration: type and attributes only */
    public String toDeclLLVM() {
        return attributes.isEmpty()
                ? getType().toLLVM()
                : getType().toLLVM() + " " + attributes;
    }

    @Override
    public String toLLVM() {
        return toDeclLLVM() + " " + getReference();
    }

    @Override
    public String getHash() {
        return "ARG" + getType().getHash() + getName() + index;
    }
}
