package ir.value.instructions;

import ir.value.Opcode;
import ir.value.Value;

public class BinOperator extends Instruction {
    private final Opcode opcode;
    // "nsw", "nuw nsw", "exact", "fast", ... kept as written
    private String flags = "";

    public BinOperator(Opcode opcode, Value lhs, Value rhs, String name) {
        super(lhs.getType(), name);
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException(opcode + " is not a binary operator");
        }
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("operand types differ: "
                    + lhs.getType() + " vs " + rhs.getType());
        }
        this.opcode = opcode;
        addOperand(lhs);
        addOperand(rhs);
    }

    public Value getLHS() { return getOperand(0); }
    public Value getRHS() { return getOperand(1); }

    public String getFlags() { return flags; }
    public void setFlags(String flags) { this.flags = flags == null ? "" : flags.trim(); }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    @Override
    protected String render() {
        return opcode.getKeyword() + (flags.isEmpty() ? "" : " " + flags)
                + " " + getLHS().getTypedReference() + ", " + getRHS().getReference();
    }
}
