package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class ReturnInst extends Instruction {
    /* ret void */
    public ReturnInst() {
        super(VoidType.getVoid(), null);
    }

    public ReturnInst(Value value) {
        this();
        addOperand(value);
    }

    public Value getReturnValue() {
        return getNumOperands() > 0 ? getOperand(0) : null;
    }

    @Override
    public Opcode opCode() {
        return Opcode.RET;
    }

    @Override
    protected String render() {
        Value value = getReturnValue();
        return value == null ? "ret void" : "ret " + value.getTypedReference();
    }
}
