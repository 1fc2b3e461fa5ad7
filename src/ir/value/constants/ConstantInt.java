package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    // sign-extended to 64 bits, wider integers are not supported
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = truncate(type.getBitWidth(), value);
    }

    public static ConstantInt get(IntegerType type, long value) {
        return new ConstantInt(type, value);
    }

    // keep the value in range of the width, sign extended
    private static long truncate(int bits, long value) {
        if (bits >= 64) {
            return value;
        }
        int shift = 64 - bits;
        return (value << shift) >> shift;
    }

    public long getValue() { return value; }

    @Override
    public IntegerType getType() {
        return (IntegerType) super.getType();
    }

    @Override
    public boolean isNullValue() {
        return value == 0;
    }

    @Override
    public String getReference() {
        if (getType().getBitWidth() == 1) {
            return value == 0 ? "false" : "true";
        }
        return Long.toString(value);
    }

    @Override
    public String getHash() {
        return "CONST_INT" + getType().getHash() + value;
    }
}
