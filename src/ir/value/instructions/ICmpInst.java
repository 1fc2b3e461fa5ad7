package ir.value.instructions;

import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class ICmpInst extends Instruction {
    public enum Predicate {
        EQ, NE, UGT, UGE, ULT, ULE, SGT, SGE, SLT, SLE;

        public String getKeyword() {
            return name().toLowerCase();
        }

        public static Predicate fromKeyword(String keyword) {
            return valueOf(keyword.toUpperCase());
        }
    }

    private final Predicate predicate;

    public ICmpInst(Predicate predicate, Value lhs, Value rhs, String name) {
        super(IntegerType.getI1(), name);
        this.predicate = predicate;
        addOperand(lhs);
        addOperand(rhs);
    }

    public Predicate getPredicate() { return predicate; }
    public Value getLHS() { return getOperand(0); }
    public Value getRHS() { return getOperand(1); }

    @Override
    public Opcode opCode() {
        return Opcode.ICMP;
    }

    @Override
    protected String render() {
        return "icmp " + predicate.getKeyword() + " "
                + getLHS().getTypedReference() + ", " + getRHS().getReference();
    }
}
