package ir.value.instructions;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class LoadInst extends Instruction {
    private boolean isVolatile;
    private int align;

    public LoadInst(Value pointer, String name) {
        super(pointeeOf(pointer), name);
        addOperand(pointer);
    }

    private static Type pointeeOf(Value pointer) {
        if (!(pointer.getType() instanceof PointerType ptrType)) {
            throw new IllegalArgumentException("load from non-pointer " + pointer.getTypedReference());
        }
        return ptrType.getPointeeType();
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public boolean isVolatile() { return isVolatile; }
    public void setVolatile(boolean isVolatile) { this.isVolatile = isVolatile; }
    public int getAlign() { return align; }
    public void setAlign(int align) { this.align = align; }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }

    @Override
    protected String render() {
        return "load " + (isVolatile ? "volatile " : "") + getType().toLLVM()
                + ", " + getPointer().getTypedReference()
                + (align > 0 ? ", align " + align : "");
    }
}
