package ir.value.instructions;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class AllocaInst extends Instruction {
    private final Type allocatedType;
    private int align;

    public AllocaInst(Type allocatedType, String name) {
        super(PointerType.get(allocatedType), name);
        this.allocatedType = allocatedType;
    }

    /* alloca T, iN count */
    public AllocaInst(Type allocatedType, Value arraySize, String name) {
        this(allocatedType, name);
        addOperand(arraySize);
    }

    public Type getAllocatedType() {
        return allocatedType;
    }

    public Value getArraySize() {
        return getNumOperands() > 0 ? getOperand(0) : null;
    }

    public int getAlign() { return align; }
    public void setAlign(int align) { this.align = align; }

    @Override
    public Opcode opCode() {
        return Opcode.ALLOCA;
    }

    @Override
    protected String render() {
        StringBuilder sb = new StringBuilder("alloca ").append(allocatedType.toLLVM());
        if (getArraySize() != null) {
            sb.append(", ").append(getArraySize().getTypedReference());
        }
        if (align > 0) {
            sb.append(", align ").append(align);
        }
        return sb.toString();
    }
}
