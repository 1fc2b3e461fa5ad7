package pass;

import exception.CompileException;
import java.util.Arrays;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import pass.IRPass.DeleteUndefinedPass;
import pass.IRPass.VerifyIRPass;
import pass.Pass.IRPass;

/**
 * IRPassFactory: create the IRPass here. The name is what the command line
 * and the {@code ir.passes} property use to select a pass.
 */
public enum IRPassType implements PassType<IRPass> {
    DeleteUndefined("delete-undefined", () -> new DeleteUndefinedPass(false)),
    DeleteUndefinedNoSym("delete-undefined-nosym", () -> new DeleteUndefinedPass(true)),
    Verify("verify", VerifyIRPass::new),
    // add more irpass here
    ;

    private final String passName;
    private final Supplier<IRPass> supplier;

    IRPassType(String passName, Supplier<IRPass> constructor) {
        this.passName = passName;
        this.supplier = constructor;
    }

    @Override
    public Supplier<IRPass> constructor() {
        return supplier;
    }

    @Override
    public String getName() {
        return passName;
    }

    public static IRPassType fromName(String name) {
        for (IRPassType type : values()) {
            if (type.matches(name)) {
                return type;
            }
        }
        throw CompileException.unknownPass(name + " (known: "
                + Arrays.stream(values()).map(IRPassType::getName).collect(Collectors.joining(", "))
                + ")");
    }
}
