package ir.value;

import ir.IRModule;
import ir.type.PointerType;

import java.util.Objects;

/**
 * Functions and global variables: module level values that are referenced
 * through their address, printed as {@code @name}.
 */
public abstract class GlobalValue extends Value {
    private final IRModule parent;
    // linkage, visibility and friends, kept as written: "private unnamed_addr", "dso_local", ...
    private String qualifiers = "";

    protected GlobalValue(IRModule parent, PointerType type, String name) {
        super(type, name);
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    public IRModule getParent() {
        return parent;
    }

    public String getQualifiers() {
        return qualifiers;
    }

    public void setQualifiers(String qualifiers) {
        this.qualifiers = qualifiers == null ? "" : qualifiers.trim();
    }

    /* the address of a global is a link-time constant */
    @Override
    public boolean isConstant() {
        return true;
    }

    public boolean isPrivate() {
        return (" " + qualifiers + " ").contains(" private ");
    }

    @Override
    public String getReference() {
        return "@" + quoteName(getName());
    }

    @Override
    public PointerType getType() {
        return (PointerType) super.getType();
    }
}
