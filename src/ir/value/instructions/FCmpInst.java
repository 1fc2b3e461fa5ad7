package ir.value.instructions;

import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class FCmpInst extends Instruction {
    public enum Predicate {
        FALSE, OEQ, OGT, OGE, OLT, OLE, ONE, ORD,
        UEQ, UGT, UGE, ULT, ULE, UNE, UNO, TRUE;

        public String getKeyword() {
            return name().toLowerCase();
        }

        public static Predicate fromKeyword(String keyword) {
            return valueOf(keyword.toUpperCase());
        }
    }

    private final Predicate predicate;
    private String flags = "";

    public FCmpInst(Predicate predicate, Value lhs, Value rhs, String name) {
        super(IntegerType.getI1(), name);
        this.predicate = predicate;
        addOperand(lhs);
        addOperand(rhs);
    }

    public Predicate getPredicate() { return predicate; }
    public Value getLHS() { return getOperand(0); }
    public Value getRHS() { return getOperand(1); }
    public void setFlags(String flags) { this.flags = flags == null ? "" : flags.trim(); }

    @Override
    public Opcode opCode() {
        return Opcode.FCMP;
    }

    @Override
    protected String render() {
        return "fcmp " + (flags.isEmpty() ? "" : flags + " ") + predicate.getKeyword() + " "
                + getLHS().getTypedReference() + ", " + getRHS().getReference();
    }
}
