package ir.value.constants;

import ir.type.FloatType;

public class ConstantFloat extends Constant {
    private final double value;

    public ConstantFloat(FloatType type, double value) {
        super(type);
        this.value = type.getBitWidth() == 32 ? (double) (float) value : value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean isNullValue() {
        return Double.doubleToRawLongBits(value) == 0L;
    }

    /* always the hex form, it is exact for every width */
    @Override
    public String getReference() {
        return String.format("0x%016X", Double.doubleToRawLongBits(value));
    }

    @Override
    public String getHash() {
        return "CONST_FLOAT" + getType().getHash() + Double.toHexString(value);
    }
}
