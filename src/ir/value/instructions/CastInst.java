package ir.value.instructions;

import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class CastInst extends Instruction {

    private final Opcode op;

    public CastInst(Opcode op, Value value, Type destType, String name) {
        super(destType, name);
        this.op = op;
        addOperand(value);
        Type srcType = value.getType();

        switch (op) {
            case ZEXT:
            case SEXT:
            case TRUNC:
                check(srcType.isInteger() && destType.isInteger() && !srcType.equals(destType),
                        value, destType);
                break;
            case FPEXT:
            case FPTRUNC:
                check(srcType.isFloatingPoint() && destType.isFloatingPoint(), value, destType);
                break;
            case SITOFP:
            case UITOFP:
                check(srcType.isInteger() && destType.isFloatingPoint(), value, destType);
                break;
            case FPTOSI:
            case FPTOUI:
                check(srcType.isFloatingPoint() && destType.isInteger(), value, destType);
                break;
            case BITCAST:
                check(srcType.isPointer() == destType.isPointer(), value, destType);
                break;
            case PTRTOINT:
                check(srcType.isPointer() && destType.isInteger(), value, destType);
                break;
            case INTTOPTR:
                check(srcType.isInteger() && destType.isPointer(), value, destType);
                break;
            default:
                throw new IllegalArgumentException("Unknown cast opcode: " + op);
        }
    }

    private void check(boolean ok, Value value, Type destType) {
        if (!ok) {
            throw new IllegalArgumentException("invalid " + op.getKeyword() + " of "
                    + value.getTypedReference() + " to " + destType.toLLVM());
        }
    }

    @Override
    public Opcode opCode() {
        return op;
    }

    public Value getValue() {
        return getOperand(0);
    }

    public Type getDestType() {
        return getType();
    }

    /* pointer to pointer bitcast, transparent for stripPointerCasts */
    public boolean isPointerBitcast() {
        return op == Opcode.BITCAST && getType().isPointer() && getValue().getType().isPointer();
    }

    @Override
    protected String render() {
        return op.getKeyword() + " " + getValue().getTypedReference() + " to " + getDestType().toLLVM();
    }
}
