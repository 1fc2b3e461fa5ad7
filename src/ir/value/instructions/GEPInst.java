package ir.value.instructions;

import java.util.List;
import java.util.stream.Collectors;

import ir.type.ArrayType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

public class GEPInst extends Instruction {
    private final Type sourceElementType;
    private final boolean inBounds;

    /**
     * operand: [pointer, idx1, idx2]
     */
    public GEPInst(Type sourceElementType, Value pointer, List<Value> indices,
                   boolean inBounds, String name) {
        super(calculateGEPType(sourceElementType, indices), name);

        if (indices.isEmpty()) {
            throw new IllegalArgumentException("GEP must have at least one index");
        }

        this.sourceElementType = sourceElementType;
        this.inBounds = inBounds;
        addOperand(pointer);

        for (var idx : indices) {
            addOperand(idx);
        }
    }

    public boolean isInBounds() {
        return inBounds;
    }

    public Type getSourceElementType() {
        return sourceElementType;
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public List<Value> getIndices() {
        return getOperands().subList(1, getOperands().size());
    }

    /**
     * Result type of indexing into {@code sourceElementType}: the first index
     * steps over the pointer, every further index selects an array element
     * or a struct field (struct indices must be constants).
     */
    public static PointerType calculateGEPType(Type sourceElementType, List<Value> indices) {
        Type currentType = sourceElementType;

        // LLVM GEP: 第一个 index 只是解引用，不深入结构
        for (int i = 1; i < indices.size(); i++) {
            if (currentType instanceof ArrayType arrayType) {
                currentType = arrayType.getElementType();
            } else if (currentType instanceof StructType structType) {
                if (!(indices.get(i) instanceof ConstantInt field)) {
                    throw new IllegalArgumentException("struct field index must be a constant");
                }
                List<Type> fields = structType.getElementTypes();
                if (field.getValue() < 0 || field.getValue() >= fields.size()) {
                    throw new IllegalArgumentException("field " + field.getValue()
                            + " out of range for " + structType.toLLVM());
                }
                currentType = fields.get((int) field.getValue());
            } else {
                throw new IllegalArgumentException("Unsupported GEP indexing into type: " + currentType);
            }
        }

        return PointerType.get(currentType);
    }

    @Override
    public Opcode opCode() {
        return Opcode.GETELEMENTPTR;
    }

    @Override
    protected String render() {
        String operands = getOperands().stream()
                .map(Value::getTypedReference)
                .collect(Collectors.joining(", "));
        return "getelementptr " + (inBounds ? "inbounds " : "")
                + sourceElementType.toLLVM() + ", " + operands;
    }
}
