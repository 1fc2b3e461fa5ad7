package ir.value;

import ir.type.Type;
import ir.value.constants.Constant;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class UndefValue extends Constant {
    private static final Map<Type, UndefValue> undefs = new ConcurrentHashMap<>();

    private UndefValue(Type type) {
        super(type);
    }

    /* one shared instance per type */
    public static UndefValue get(Type type) {
        return undefs.computeIfAbsent(type, UndefValue::new);
    }

    @Override
    public boolean isNullValue() {
        return false;
    }

    @Override
    public String getReference() {
        return "undef";
    }

    @Override
    public String getHash() {
        return "UNDEF" + getType().getHash();
    }
}
