package ir.value.instructions;

import ir.type.VoidType;
import ir.value.Opcode;

public class UnreachableInst extends Instruction {
    public UnreachableInst() {
        super(VoidType.getVoid(), null);
    }

    @Override
    public Opcode opCode() {
        return Opcode.UNREACHABLE;
    }

    @Override
    protected String render() {
        return "unreachable";
    }
}
