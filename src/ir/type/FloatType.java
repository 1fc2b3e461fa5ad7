package ir.type;

import java.util.Objects;

/**
 * IEEE floating point types: half, float and double.
 */
public final class FloatType extends Type {

    private static final FloatType HALF = new FloatType(TypeKind.HALF, "half", 16);
    private static final FloatType FLOAT = new FloatType(TypeKind.FLOAT, "float", 32);
    private static final FloatType DOUBLE = new FloatType(TypeKind.DOUBLE, "double", 64);

    private final String keyword;
    private final int bitWidth;

    private FloatType(TypeKind kind, String keyword, int bitWidth) {
        super(kind);
        this.keyword = keyword;
        this.bitWidth = bitWidth;
    }

    public static FloatType getHalf() { return HALF; }
    public static FloatType getFloat() { return FLOAT; }
    public static FloatType getDouble() { return DOUBLE; }

    public int getBitWidth() {
        return bitWidth;
    }

    @Override
    public String toLLVM() {
        return keyword;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FloatType other && other.getKind() == getKind());
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }

    @Override
    public String getHash() {
        return "FP" + bitWidth;
    }
}
