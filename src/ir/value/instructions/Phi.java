package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class Phi extends Instruction {
    public Phi(Type type, String name) {
        super(type, name);
    }

    public void addIncoming(Value value, BasicBlock block) {
        if (!value.getType().equals(getType())) {
            throw new IllegalArgumentException("PHI incoming value must match PHI type");
        }
        addOperand(value);
        addOperand(block);
    }

    public int getNumIncoming() {
        return getNumOperands() / 2;
    }

    public Value getIncomingValue(int index) {
        return getOperand(index * 2);
    }

    public BasicBlock getIncomingBlock(int index) {
        return (BasicBlock) getOperand(index * 2 + 1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.PHI;
    }

    @Override
    protected String render() {
        List<String> incoming = new ArrayList<>();
        for (int i = 0; i < getNumIncoming(); i++) {
            incoming.add("[ " + getOperand(i * 2).getReference() + ", "
                    + getOperand(i * 2 + 1).getReference() + " ]");
        }
        return "phi " + getType().toLLVM() + " " + String.join(", ", incoming);
    }
}
