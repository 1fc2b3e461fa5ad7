package ir.value.instructions;

import ir.type.PointerType;
import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class StoreInst extends Instruction {
    private boolean isVolatile;
    private int align;

    public StoreInst(Value value, Value pointer) {
        super(VoidType.getVoid(), null);
        if (!(pointer.getType() instanceof PointerType ptrType)
                || !ptrType.getPointeeType().equals(value.getType())) {
            throw new IllegalArgumentException("store of " + value.getTypedReference()
                    + " through " + pointer.getTypedReference());
        }
        addOperand(value);
        addOperand(pointer);
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Value getPointer() {
        return getOperand(1);
    }

    public boolean isVolatile() { return isVolatile; }
    public void setVolatile(boolean isVolatile) { this.isVolatile = isVolatile; }
    public int getAlign() { return align; }
    public void setAlign(int align) { this.align = align; }

    @Override
    public Opcode opCode() {
        return Opcode.STORE;
    }

    @Override
    protected String render() {
        return "store " + (isVolatile ? "volatile " : "") + getValue().getTypedReference()
                + ", " + getPointer().getTypedReference()
                + (align > 0 ? ", align " + align : "");
    }
}
