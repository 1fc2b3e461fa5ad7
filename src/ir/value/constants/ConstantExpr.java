package ir.value.constants;

import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Constant expressions the loader understands: casts,
 * {@code bitcast (i32 (i32)* @f to void ()*)}, and address arithmetic,
 * {@code getelementptr inbounds ([7 x i8], [7 x i8]* @s, i64 0, i64 0)}.
 */
public class ConstantExpr extends Constant {
    private final Opcode opcode;
    // getelementptr only
    private final Type sourceElementType;
    private final boolean inBounds;

    private ConstantExpr(Opcode opcode, Type type, Type sourceElementType,
                         boolean inBounds, Value... operands) {
        super(type, operands);
        this.opcode = opcode;
        this.sourceElementType = sourceElementType;
        this.inBounds = inBounds;
        for (Value operand : operands) {
            if (!operand.isConstant()) {
                throw new IllegalArgumentException("constant expression over non-constant "
                        + operand.getTypedReference());
            }
        }
    }

    public static ConstantExpr getCast(Opcode opcode, Value value, Type destType) {
        if (!opcode.isCast()) {
            throw new IllegalArgumentException(opcode + " is not a cast");
        }
        return new ConstantExpr(opcode, destType, null, false, value);
    }

    public static ConstantExpr getBitCast(Value value, Type destType) {
        return getCast(Opcode.BITCAST, value, destType);
    }

    /**
     * @param resultType the pointer type the indices lead to, the caller
     *                   computes it since the loader and the passes both know it
     */
    public static ConstantExpr getGetElementPtr(Type sourceElementType, Value pointer,
                                                List<Value> indices, boolean inBounds,
                                                PointerType resultType) {
        Value[] operands = new Value[indices.size() + 1];
        operands[0] = pointer;
        for (int i = 0; i < indices.size(); i++) {
            operands[i + 1] = indices.get(i);
        }
        return new ConstantExpr(Opcode.GETELEMENTPTR, resultType, sourceElementType,
                inBounds, operands);
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public boolean isCast() {
        return opcode.isCast();
    }

    /* bitcast from one pointer type to another, what stripPointerCasts looks through */
    public boolean isPointerBitcast() {
        return opcode == Opcode.BITCAST
                && getType().isPointer()
                && getOperand(0).getType().isPointer();
    }

    public Type getSourceElementType() {
        return sourceElementType;
    }

    @Override
    public boolean isNullValue() {
        return false;
    }

    @Override
    public String getReference() {
        if (isCast()) {
            return opcode.getKeyword() + " (" + getOperand(0).getTypedReference()
                    + " to " + getType().toLLVM() + ")";
        }
        String operands = getOperands().stream()
                .map(Value::getTypedReference)
                .collect(Collectors.joining(", "));
        return opcode.getKeyword() + (inBounds ? " inbounds" : "")
                + " (" + sourceElementType.toLLVM() + ", " + operands + ")";
    }

    @Override
    public String getHash() {
        StringBuilder sb = new StringBuilder("CEXPR").append(opcode).append(getType().getHash());
        for (Value operand : getOperands()) {
            sb.append(operand.getHash());
        }
        return sb.toString();
    }
}
