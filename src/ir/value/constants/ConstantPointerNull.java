package ir.value.constants;

import ir.type.PointerType;

public class ConstantPointerNull extends Constant {
    private ConstantPointerNull(PointerType type) {
        super(type);
    }

    public static ConstantPointerNull get(PointerType type) {
        return new ConstantPointerNull(type);
    }

    @Override
    public boolean isNullValue() {
        return true;
    }

    @Override
    public String getReference() {
        return "null";
    }

    @Override
    public String getHash() {
        return "NULL" + getType().getHash();
    }
}
