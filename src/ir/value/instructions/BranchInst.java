package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class BranchInst extends Instruction {
    /* br label %dest */
    public BranchInst(BasicBlock dest) {
        super(VoidType.getVoid(), null);
        addOperand(dest);
    }

    /* br i1 %cond, label %t, label %f */
    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(VoidType.getVoid(), null);
        addOperand(condition);
        addOperand(thenBlock);
        addOperand(elseBlock);
    }

    public boolean isConditional() {
        return getNumOperands() == 3;
    }

    public Value getCondition() {
        return isConditional() ? getOperand(0) : null;
    }

    public List<BasicBlock> getSuccessors() {
        List<BasicBlock> succs = new ArrayList<>();
        for (int i = isConditional() ? 1 : 0; i < getNumOperands(); i++) {
            succs.add((BasicBlock) getOperand(i));
        }
        return succs;
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    @Override
    protected String render() {
        if (!isConditional()) {
            return "br " + getOperand(0).getTypedReference();
        }
        return "br " + getOperand(0).getTypedReference() + ", "
                + getOperand(1).getTypedReference() + ", " + getOperand(2).getTypedReference();
    }
}
