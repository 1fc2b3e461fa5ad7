package ir.value;

import ir.type.Type;
import ir.value.constants.ConstantExpr;
import ir.value.instructions.CastInst;

import java.util.LinkedList;
import java.util.Objects;
import java.util.regex.Pattern;

public abstract class Value {
    private static final Pattern PLAIN_NAME = Pattern.compile("[-a-zA-Z$._][-a-zA-Z$._0-9]*");

    private final Type type;
    private String name;

    // 谁用了我
    private final LinkedList<Use> usesList;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.usesList = new LinkedList<>();
    }

    public abstract String toLLVM();

    public abstract String getHash();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }
    public LinkedList<Use> getUses() { return usesList; }
    public boolean hasUses() { return !usesList.isEmpty(); }
    public boolean isConstant() { return false; }

    public void setName(String name) { this.name = name; }

    /**
     * The string used when this value appears as an operand, without its type:
     * {@code %x} for locals, {@code @g} for globals, the literal for constants.
     */
    public String getReference() {
        return "%" + quoteName(getName());
    }

    /* operand form with its type, "i32 %x", "i8* @g" */
    public String getTypedReference() {
        return getType().toLLVM() + " " + getReference();
    }

    /**
     * Strips bitcasts between pointer types, both constant expressions and
     * cast instructions, and returns the underlying value.
     */
    public Value stripPointerCasts() {
        Value current = this;
        while (true) {
            if (current instanceof ConstantExpr expr && expr.isPointerBitcast()) {
                current = expr.getOperand(0);
            } else if (current instanceof CastInst cast && cast.isPointerBitcast()) {
                current = cast.getValue();
            } else {
                return current;
            }
        }
    }

    /* names that are not plain identifiers are printed quoted, as LLVM does */
    protected static String quoteName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalStateException("value has no name to reference");
        }
        if (PLAIN_NAME.matcher(name).matches()) {
            return name;
        }
        return "\"" + name + "\"";
    }


    /* use field */
    // 将所有使用 this 的地方换成 newValue
    public void replaceAllUsesWith(Value newValue) {
        Objects.requireNonNull(newValue, "newValue");
        if (this == newValue) return;
        if (!newValue.getType().equals(getType())) {
            throw new IllegalArgumentException("replaceAllUsesWith: type mismatch, "
                    + getType() + " vs " + newValue.getType());
        }
        LinkedList<Use> oldUses = new LinkedList<>(usesList);
        for (Use use : oldUses) {
            use.getUser().setOperand(use.getOperandIndex(), newValue);
        }
    }

    void addUse(Use use) {
        Objects.requireNonNull(use, "use");
        this.usesList.add(use);
    }

    void removeUseFrom(User user) {
        usesList.removeIf(use -> use.getUser() == user);
    }

    void removeUseBy(User user, int index) {
        usesList.removeIf(use ->
                          use.getUser() == user
                          && use.getOperandIndex() == index);
    }

}
