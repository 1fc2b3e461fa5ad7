package ir.value;

import ir.type.MetadataType;

/**
 * A metadata operand of a call, e.g. the arguments of {@code llvm.dbg.declare}.
 * Either a node reference kept as text ({@code metadata !12}) or a wrapped
 * local value ({@code metadata i32* %x}), which stays a tracked use.
 */
public class MetadataValue extends User {
    private final String text;

    public MetadataValue(String text) {
        super(MetadataType.getMetadata(), null);
        this.text = text;
    }

    public MetadataValue(Value wrapped) {
        super(MetadataType.getMetadata(), null, wrapped);
        this.text = null;
    }

    public Value getWrapped() {
        return text == null ? getOperand(0) : null;
    }

    @Override
    public String getReference() {
        return text != null ? text : getOperand(0).getTypedReference();
    }

    @Override
    public String toLLVM() {
        return getTypedReference();
    }

    @Override
    public String getHash() {
        return "MD" + getReference();
    }
}
