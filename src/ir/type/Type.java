package ir.type;

public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    public abstract String toLLVM();

    public abstract String getHash();

    /**
     * A type is sized when values of it can live in memory, i.e. the layout
     * service can answer how many bytes it takes.
     */
    public boolean isSized() {
        return true;
    }

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isInteger() { return is(TypeKind.INTEGER); }
    public boolean isI1() { return isIntegerOf(1); }
    public boolean isFloatingPoint() {
        return is(TypeKind.HALF) || is(TypeKind.FLOAT) || is(TypeKind.DOUBLE);
    }
    public boolean isArray() { return is(TypeKind.ARRAY); }
    public boolean isStruct() { return is(TypeKind.STRUCT); }
    public boolean isAggregate() { return isArray() || isStruct(); }
    public boolean isVoid() { return is(TypeKind.VOID); }
    public boolean isPointer() { return is(TypeKind.POINTER); }

    private boolean isIntegerOf(int width) {
        return this instanceof IntegerType it && it.getBitWidth() == width;
    }

    @Override public String toString() { return toLLVM(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

}
