package ir.value.constants;

import ir.type.StructType;
import ir.value.Value;

import java.util.List;
import java.util.stream.Collectors;

public class ConstantStruct extends Constant {
    public ConstantStruct(StructType type, List<Value> fields) {
        super(type);
        if (fields.size() != type.getElementTypes().size()) {
            throw new IllegalArgumentException("struct " + type.toLLVM()
                    + " given " + fields.size() + " fields");
        }
        for (Value field : fields) {
            if (!field.isConstant()) {
                throw new IllegalArgumentException("Field is not a constant: " + field);
            }
            addOperand(field);
        }
    }

    @Override
    public StructType getType() {
        return (StructType) super.getType();
    }

    @Override
    public boolean isNullValue() {
        return false;
    }

    @Override
    public String getReference() {
        String inner = getOperands().stream()
            .map(Value::getTypedReference)
            .collect(Collectors.joining(", "));
        String braced = inner.isEmpty() ? "{}" : "{ " + inner + " }";
        return getType().isPacked() ? "<" + braced + ">" : braced;
    }

    @Override
    public String getHash() {
        StringBuilder sb = new StringBuilder("CONST_STRUCT").append(getType().getHash());
        for (Value field : getOperands()) {
            sb.append(field.getHash());
        }
        return sb.toString();
    }
}
