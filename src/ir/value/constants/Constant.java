package ir.value.constants;

import exception.CompileException;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.User;
import ir.value.Value;

/**
 * Constants print their literal as the operand reference; {@link #toLLVM()}
 * adds the type in front, as it appears inside an instruction.
 */
public abstract class Constant extends User {
    protected Constant(Type type, Value... operands) {
        super(type, null, operands);
    }

    @Override public boolean isConstant() { return true; }

    public abstract boolean isNullValue();

    @Override
    public abstract String getReference();

    @Override
    public String toLLVM() {
        return getType().toLLVM() + " " + getReference();
    }

    /**
     * The all-zero value of a type: {@code 0}, {@code 0.0}, {@code null} or
     * {@code zeroinitializer}.
     */
    public static Constant getNullValue(Type type) {
        if (type instanceof IntegerType intType) {
            return ConstantInt.get(intType, 0);
        }
        if (type instanceof FloatType floatType) {
            return new ConstantFloat(floatType, 0.0);
        }
        if (type instanceof PointerType ptrType) {
            return ConstantPointerNull.get(ptrType);
        }
        // opaque structs included, a removed call may return one
        if (type instanceof ArrayType || type instanceof StructType) {
            return ConstantZeroInitializer.get(type);
        }
        throw CompileException.unSupported("null value of type " + type.toLLVM());
    }
}
