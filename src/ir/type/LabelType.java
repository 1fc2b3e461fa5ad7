package ir.type;

/* type of basic blocks */
public final class LabelType extends Type {

    private static final LabelType INSTANCE = new LabelType();

    private LabelType() {
        super(TypeKind.LABEL);
    }

    public static LabelType getLabel() {
        return INSTANCE;
    }

    @Override
    public boolean isSized() {
        return false;
    }

    @Override
    public String toLLVM() {
        return "label";
    }

    @Override
    public String getHash() {
        return "LABEL";
    }
}
