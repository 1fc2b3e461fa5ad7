package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException noArgs() {
        return new CompileException("need args to process");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException("Unexpected args: " + msg);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    public static CompileException unknownPass(String name) {
        return new CompileException("Unknown pass: " + name);
    }

    public static CompileException missingEntry(String entryName) {
        return new CompileException("Entry function '" + entryName
                + "' not found, cannot initialize nondeterministic globals");
    }

    public static CompileException emptyEntry(String entryName) {
        return new CompileException("Entry function '" + entryName
                + "' has no instructions to insert the initialization before");
    }

    public static CompileException unsizedType(String what) {
        return new CompileException("Unsized type: " + what);
    }

    public static CompileException pointerArgument(String callee) {
        return new CompileException("Refusing to remove call to '" + callee
                + "': it takes pointer arguments and may write through them");
    }

    public static CompileException invalidIR(String msg) {
        return new CompileException("Invalid IR: " + msg);
    }
}
