package ir.type;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import exception.CompileException;

import java.util.Objects;

public final class IntegerType extends Type {
    // LLVM caps integer widths at 2^23 - 1 bits
    private static final int MAX_BIT_WIDTH = (1 << 23) - 1;

    private final int bitWidth;

    private static final Map<Integer, IntegerType> pool
        = new ConcurrentHashMap<>();

    private IntegerType(int bitWidth) {
        super(TypeKind.INTEGER);
        this.bitWidth = bitWidth;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public static IntegerType getInteger(int bitWidth) {
        if (bitWidth < 1 || bitWidth > MAX_BIT_WIDTH) {
            throw CompileException.
                unSupported("Integer with bitWidth " + bitWidth);
        }
        return pool.computeIfAbsent(bitWidth, IntegerType::new);
    }

    public static IntegerType getI1() { return getInteger(1); }
    public static IntegerType getI8() { return getInteger(8); }
    public static IntegerType getI32() { return getInteger(32); }
    public static IntegerType getI64() { return getInteger(64); }

    @Override
    public String toLLVM() {
        return "i" + bitWidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntegerType other)) return false;
        return bitWidth == other.bitWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), bitWidth);
    }

    @Override
    public String getHash() {
        return "INT" + bitWidth;
    }
}
