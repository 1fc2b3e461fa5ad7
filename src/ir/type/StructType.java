package ir.type;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Struct types come in two flavours:
 * <ul>
 *   <li>literal structs ({@code { i32, i8* }}), interned and compared structurally;</li>
 *   <li>identified structs ({@code %struct.node}), owned by a module and compared
 *       by identity. An identified struct without a body is opaque and unsized.</li>
 * </ul>
 */
public final class StructType extends Type {
    private final String name;
    private List<Type> elementTypes;
    private boolean packed;

    private static final Map<Key, StructType> literalPool =
        new ConcurrentHashMap<>();

    private record Key(List<Type> elements, boolean packed) {}

    private StructType(String name, List<Type> elementTypes, boolean packed) {
        super(TypeKind.STRUCT);
        this.name = name;
        this.elementTypes = elementTypes == null ? null : List.copyOf(elementTypes);
        this.packed = packed;
    }

    public static StructType getLiteral(List<Type> elementTypes, boolean packed) {
        return literalPool.computeIfAbsent(
            new Key(List.copyOf(elementTypes), packed),
            k -> new StructType(null, k.elements(), k.packed()));
    }

    /* only IRModule should call this, names are unique per module */
    public static StructType createIdentified(String name) {
        return new StructType(Objects.requireNonNull(name, "name"), null, false);
    }

    public void setBody(List<Type> elementTypes, boolean packed) {
        if (isLiteral()) {
            throw new IllegalStateException("cannot change the body of a literal struct");
        }
        this.elementTypes = List.copyOf(elementTypes);
        this.packed = packed;
    }

    public String getName() { return name; }
    public boolean isLiteral() { return name == null; }
    public boolean isOpaque() { return elementTypes == null; }
    public boolean isPacked() { return packed; }

    public List<Type> getElementTypes() {
        if (isOpaque()) {
            throw new IllegalStateException("opaque struct %" + name + " has no elements");
        }
        return elementTypes;
    }

    @Override
    public boolean isSized() {
        if (isOpaque()) {
            return false;
        }
        return elementTypes.stream().allMatch(Type::isSized);
    }

    /* body as written after "type" in a type definition */
    public String bodyToLLVM() {
        if (isOpaque()) {
            return "opaque";
        }
        String inner = elementTypes.stream()
            .map(Type::toLLVM)
            .collect(Collectors.joining(", "));
        String braced = inner.isEmpty() ? "{}" : "{ " + inner + " }";
        return packed ? "<" + braced + ">" : braced;
    }

    @Override
    public String toLLVM() {
        return isLiteral() ? bodyToLLVM() : "%" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType other)) return false;
        if (!isLiteral() || !other.isLiteral()) {
            // identified structs are nominal
            return false;
        }
        return packed == other.packed && elementTypes.equals(other.elementTypes);
    }

    @Override
    public int hashCode() {
        if (!isLiteral()) {
            return System.identityHashCode(this);
        }
        return Objects.hash(super.hashCode(), elementTypes, packed);
    }

    @Override
    public String getHash() {
        return isLiteral() ? "STRUCT" + bodyToLLVM() : "NAMED" + name;
    }
}
