package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

/**
 * {@code switch}. Operands: condition, default block, then one
 * (case value, destination) pair per case.
 */
public class SwitchInst extends Instruction {
    public SwitchInst(Value condition, BasicBlock defaultDest) {
        super(VoidType.getVoid(), null);
        if (!condition.getType().isInteger()) {
            throw new IllegalArgumentException("switch condition must be an integer, got "
                    + condition.getType());
        }
        addOperand(condition);
        addOperand(defaultDest);
    }

    public void addCase(ConstantInt value, BasicBlock dest) {
        if (!value.getType().equals(getCondition().getType())) {
            throw new IllegalArgumentException("case value " + value.getTypedReference()
                    + " does not match the condition type");
        }
        addOperand(value);
        addOperand(dest);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public BasicBlock getDefaultDest() {
        return (BasicBlock) getOperand(1);
    }

    public int getNumCases() {
        return (getNumOperands() - 2) / 2;
    }

    public ConstantInt getCaseValue(int i) {
        return (ConstantInt) getOperand(2 + i * 2);
    }

    public BasicBlock getCaseDest(int i) {
        return (BasicBlock) getOperand(3 + i * 2);
    }

    public List<BasicBlock> getSuccessors() {
        List<BasicBlock> succs = new ArrayList<>();
        succs.add(getDefaultDest());
        for (int i = 0; i < getNumCases(); i++) {
            succs.add(getCaseDest(i));
        }
        return succs;
    }

    @Override
    public Opcode opCode() {
        return Opcode.SWITCH;
    }

    @Override
    protected String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("switch ").append(getCondition().getTypedReference())
          .append(", ").append(getDefaultDest().getTypedReference()).append(" [\n");
        for (int i = 0; i < getNumCases(); i++) {
            sb.append("    ").append(getCaseValue(i).getTypedReference())
              .append(", ").append(getCaseDest(i).getTypedReference()).append("\n");
        }
        sb.append("  ]");
        return sb.toString();
    }
}
