package ir.value.instructions;

import ir.value.Opcode;
import ir.value.Value;

public class SelectInst extends Instruction {
    public SelectInst(Value condition, Value trueValue, Value falseValue, String name) {
        super(trueValue.getType(), name);
        addOperand(condition);
        addOperand(trueValue);
        addOperand(falseValue);
    }

    public Value getCondition() { return getOperand(0); }
    public Value getTrueValue() { return getOperand(1); }
    public Value getFalseValue() { return getOperand(2); }

    @Override
    public Opcode opCode() {
        return Opcode.SELECT;
    }

    @Override
    protected String render() {
        return "select " + getCondition().getTypedReference() + ", "
                + getTrueValue().getTypedReference() + ", " + getFalseValue().getTypedReference();
    }
}
