package ir.value.constants;

import ir.type.ArrayType;
import ir.value.Value;

import java.util.List;
import java.util.stream.Collectors;

public class ConstantArray extends Constant {
    public ConstantArray(ArrayType type, List<Value> elements) {
        super(type);
        if (elements.size() != type.getLength()) {
            throw new IllegalArgumentException("array of type " + type.toLLVM()
                    + " given " + elements.size() + " elements");
        }

        // 确保所有元素都是常量，并且类型匹配
        for (Value element : elements) {
            if (!element.isConstant()) {
                throw new IllegalArgumentException("Element is not a constant: " + element);
            }
            if (!element.getType().equals(type.getElementType())) {
                throw new IllegalArgumentException("element of type " + element.getType()
                        + " in array of " + type.getElementType());
            }
            // push into operand in use
            addOperand(element);
        }
    }

    public List<Value> getElements() {
        return getOperands();
    }

    @Override
    public boolean isNullValue() {
        return false;
    }

    @Override
    public String getReference() {
        return "[" + getElements().stream()
            .map(Value::getTypedReference)
            .collect(Collectors.joining(", ")) + "]";
    }

    @Override
    public String getHash() {
        StringBuilder sb = new StringBuilder();
        sb.append("CONST_ARRAY");
        sb.append(getType().getHash());
        for (Value element : getElements()) {
            sb.append(element.getHash());
        }
        return sb.toString();
    }
}
