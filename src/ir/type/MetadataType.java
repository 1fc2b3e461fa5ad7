package ir.type;

/* only appears as the parameter type of debug intrinsics */
public final class MetadataType extends Type {

    private static final MetadataType INSTANCE = new MetadataType();

    private MetadataType() {
        super(TypeKind.METADATA);
    }

    public static MetadataType getMetadata() {
        return INSTANCE;
    }

    @Override
    public boolean isSized() {
        return false;
    }

    @Override
    public String toLLVM() {
        return "metadata";
    }

    @Override
    public String getHash() {
        return "METADATA";
    }
}
