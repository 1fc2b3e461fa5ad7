package ir.value;

import ir.type.FunctionType;
import ir.type.PointerType;

/**
 * The callee of {@code call void asm sideeffect "...", "..."()}. Calls through
 * inline assembly have no symbol to resolve and are never rewritten.
 */
public class InlineAsm extends Value {
    // "sideeffect", "alignstack", ... between "asm" and the strings
    private final String flags;
    private final String asmString;
    private final String constraints;

    public InlineAsm(FunctionType type, String flags, String asmString, String constraints) {
        super(PointerType.get(type), "asm");
        this.flags = flags == null ? "" : flags.trim();
        this.asmString = asmString;
        this.constraints = constraints;
    }

    public FunctionType getFunctionType() {
        return (FunctionType) ((PointerType) getType()).getPointeeType();
    }

    public String getAsmString() {
        return asmString;
    }

    public String getConstraints() {
        return constraints;
    }

    /* printed in place of the callee, the call prints the function type */
    @Override
    public String getReference() {
        return "asm " + (flags.isEmpty() ? "" : flags + " ")
                + "\"" + asmString + "\", \"" + constraints + "\"";
    }

    @Override
    public String toLLVM() {
        return getReference();
    }

    @Override
    public String getHash() {
        return "ASM" + asmString + constraints;
    }
}
