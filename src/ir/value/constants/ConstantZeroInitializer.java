package ir.value.constants;

import ir.type.Type;

/* zeroinitializer of an array or struct; elements are never materialized */
public class ConstantZeroInitializer extends Constant {
    private ConstantZeroInitializer(Type type) {
        super(type);
    }

    public static ConstantZeroInitializer get(Type type) {
        if (!type.isAggregate()) {
            throw new IllegalArgumentException("zeroinitializer needs an aggregate type, got " + type);
        }
        return new ConstantZeroInitializer(type);
    }

    @Override
    public boolean isNullValue() {
        return true;
    }

    @Override
    public String getReference() {
        return "zeroinitializer";
    }

    @Override
    public String getHash() {
        return "ZERO" + getType().getHash();
    }
}
