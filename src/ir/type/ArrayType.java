package ir.type;

import java.util.Objects;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import exception.CompileException;

public final class ArrayType extends Type {
    private final Type elementType;
    private final long length;

    private static final Map<Key, ArrayType> pool =
        new ConcurrentHashMap<>();


    private record Key(Type elementType, long length) {}

    private ArrayType(Type elementType, long length) {
        super(TypeKind.ARRAY);
        this.elementType = elementType;
        this.length = length;
    }

    public static ArrayType get(Type elementType, long length) {
        if (length < 0) {
            throw CompileException.
                unSupported("Array length cannot be negative");
        }

        return pool.computeIfAbsent(
            new Key(elementType, length),
            k -> new ArrayType(k.elementType(), k.length())
        );
    }

    public Type getElementType() {
        return elementType;
    }

    public long getLength() {
        return length;
    }

    @Override
    public boolean isSized() {
        return elementType.isSized();
    }

    @Override
    public String toLLVM() {
        return "[" + length + " x " + elementType.toLLVM() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType other)) return false;
        return length == other.length && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementType, length);
    }

    @Override
    public String getHash() {
        return "ARRAY" + elementType.getHash() + length;
    }
}
