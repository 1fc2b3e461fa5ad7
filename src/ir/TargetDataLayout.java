package ir;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import exception.CompileException;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;

/**
 * Sizes and alignments of types for one target, parsed from the module's
 * {@code target datalayout} string. Entries the string leaves out keep
 * LLVM's defaults: little endian, 64-bit pointers, {@code i64:32}.
 */
public final class TargetDataLayout {
    private final String dataLayoutString;
    private boolean bigEndian = false;
    private int pointerSizeInBits = 64;
    private int pointerABIAlignInBits = 64;
    private int aggregateABIAlignInBits = 0;
    // bit width -> ABI alignment in bits
    private final TreeMap<Integer, Integer> intAlignments = new TreeMap<>(Map.of(
            1, 8, 8, 8, 16, 16, 32, 32, 64, 32));
    private final TreeMap<Integer, Integer> floatAlignments = new TreeMap<>(Map.of(
            16, 16, 32, 32, 64, 64, 128, 128));

    private TargetDataLayout(String dataLayoutString) {
        this.dataLayoutString = dataLayoutString;
    }

    public static TargetDataLayout getDefault() {
        return parse("");
    }

    public static TargetDataLayout parse(String dataLayoutString) {
        TargetDataLayout layout = new TargetDataLayout(dataLayoutString == null ? "" : dataLayoutString);
        if (layout.dataLayoutString.isEmpty()) {
            return layout;
        }
        for (String spec : layout.dataLayoutString.split("-")) {
            if (spec.isEmpty()) {
                continue;
            }
            try {
                layout.parseSpec(spec);
            } catch (NumberFormatException e) {
                throw CompileException.invalidIR("malformed datalayout entry '" + spec + "'");
            }
        }
        return layout;
    }

    private void parseSpec(String spec) {
        String[] parts = spec.split(":");
        char kind = spec.charAt(0);
        switch (kind) {
            case 'e' -> bigEndian = false;
            case 'E' -> bigEndian = true;
            case 'p' -> {
                String addrSpace = parts[0].substring(1);
                // only the default address space matters here
                if (!addrSpace.isEmpty() && Integer.parseInt(addrSpace) != 0) {
                    return;
                }
                requireParts(spec, parts, 2);
                pointerSizeInBits = Integer.parseInt(parts[1]);
                pointerABIAlignInBits = parts.length > 2 ? Integer.parseInt(parts[2]) : pointerSizeInBits;
            }
            case 'i' -> {
                requireParts(spec, parts, 2);
                intAlignments.put(Integer.parseInt(parts[0].substring(1)), Integer.parseInt(parts[1]));
            }
            case 'f' -> {
                requireParts(spec, parts, 2);
                floatAlignments.put(Integer.parseInt(parts[0].substring(1)), Integer.parseInt(parts[1]));
            }
            case 'a' -> {
                requireParts(spec, parts, 2);
                aggregateABIAlignInBits = Integer.parseInt(parts[1]);
            }
            // mangling, native widths, stack alignment, vectors, address spaces, ...
            default -> { }
        }
    }

    private static void requireParts(String spec, String[] parts, int min) {
        if (parts.length < min) {
            throw CompileException.invalidIR("malformed datalayout entry '" + spec + "'");
        }
    }

    public String getDataLayoutString() {
        return dataLayoutString;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }

    public int getPointerSizeInBits() {
        return pointerSizeInBits;
    }

    /* integer type wide enough for object sizes: i64 on targets with pointers wider than 32 bits */
    public IntegerType getSizeType() {
        return pointerSizeInBits > 32 ? IntegerType.getI64() : IntegerType.getI32();
    }

    public long getTypeSizeInBits(Type type) {
        requireSized(type);
        if (type instanceof IntegerType intType) {
            return intType.getBitWidth();
        }
        if (type instanceof FloatType floatType) {
            return floatType.getBitWidth();
        }
        if (type instanceof PointerType) {
            return pointerSizeInBits;
        }
        if (type instanceof ArrayType arrayType) {
            return arrayType.getLength() * getTypeAllocSize(arrayType.getElementType()) * 8;
        }
        if (type instanceof StructType structType) {
            return getStructSize(structType) * 8;
        }
        throw CompileException.unsizedType(type.toLLVM());
    }

    /* bytes written by a store of the type */
    public long getTypeStoreSize(Type type) {
        return (getTypeSizeInBits(type) + 7) / 8;
    }

    /* distance in bytes between consecutive values of the type in memory */
    public long getTypeAllocSize(Type type) {
        return alignTo(getTypeStoreSize(type), getABITypeAlignment(type));
    }

    /* ABI alignment in bytes */
    public int getABITypeAlignment(Type type) {
        requireSized(type);
        if (type instanceof IntegerType intType) {
            return lookupIntAlignment(intType.getBitWidth()) / 8;
        }
        if (type instanceof FloatType floatType) {
            return floatAlignments.getOrDefault(floatType.getBitWidth(), floatType.getBitWidth()) / 8;
        }
        if (type instanceof PointerType) {
            return pointerABIAlignInBits / 8;
        }
        if (type instanceof ArrayType arrayType) {
            return getABITypeAlignment(arrayType.getElementType());
        }
        if (type instanceof StructType structType) {
            return getStructAlignment(structType);
        }
        throw CompileException.unsizedType(type.toLLVM());
    }

    /**
     * Byte offset of each field, padding inserted so every field is aligned
     * to its ABI alignment unless the struct is packed.
     */
    public long[] getStructFieldOffsets(StructType structType) {
        requireSized(structType);
        List<Type> fields = structType.getElementTypes();
        long[] offsets = new long[fields.size()];
        long offset = 0;
        for (int i = 0; i < fields.size(); i++) {
            Type field = fields.get(i);
            if (!structType.isPacked()) {
                offset = alignTo(offset, getABITypeAlignment(field));
            }
            offsets[i] = offset;
            offset += getTypeAllocSize(field);
        }
        return offsets;
    }

    private long getStructSize(StructType structType) {
        List<Type> fields = structType.getElementTypes();
        long[] offsets = getStructFieldOffsets(structType);
        long end = fields.isEmpty() ? 0
                : offsets[offsets.length - 1] + getTypeAllocSize(fields.get(fields.size() - 1));
        return alignTo(end, getStructAlignment(structType));
    }

    private int getStructAlignment(StructType structType) {
        if (structType.isPacked()) {
            return 1;
        }
        int align = Math.max(1, aggregateABIAlignInBits / 8);
        for (Type field : structType.getElementTypes()) {
            align = Math.max(align, getABITypeAlignment(field));
        }
        return align;
    }

    // widths without an entry use the next larger one, or the largest one
    private int lookupIntAlignment(int bitWidth) {
        Map.Entry<Integer, Integer> entry = intAlignments.ceilingEntry(bitWidth);
        if (entry == null) {
            entry = intAlignments.lastEntry();
        }
        return entry.getValue();
    }

    private static void requireSized(Type type) {
        if (!type.isSized()) {
            throw CompileException.unsizedType(type.toLLVM());
        }
    }

    private static long alignTo(long value, long align) {
        return (value + align - 1) / align * align;
    }

    @Override
    public String toString() {
        return dataLayoutString;
    }
}
