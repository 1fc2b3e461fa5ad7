package ir.debug;

/**
 * A numbered metadata node, {@code !N = [distinct] <body>}.
 * <p>
 * Slots are stable: parsed nodes keep the number they were written with and
 * nodes created later get the next free number from the module, so node
 * bodies that refer to other nodes by number never need rewriting.
 */
public abstract class Metadata {
    private int slot = -1;
    private boolean distinct;

    public int getSlot() {
        return slot;
    }

    public void setSlot(int slot) {
        if (this.slot >= 0 && this.slot != slot) {
            throw new IllegalStateException("metadata !" + this.slot + " is already numbered");
        }
        this.slot = slot;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    public String getReference() {
        if (slot < 0) {
            throw new IllegalStateException("metadata node was never added to a module");
        }
        return "!" + slot;
    }

    /* the part after "=", without the distinct keyword */
    public abstract String bodyToLLVM();

    public String toLLVM() {
        return getReference() + " = " + (distinct ? "distinct " : "") + bodyToLLVM();
    }

    @Override
    public String toString() {
        return toLLVM();
    }
}
