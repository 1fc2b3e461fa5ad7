package util.llvm;

import java.util.ArrayList;
import java.util.List;

/**
 * LLVM IR 解析异常
 * <p>
 * Raised by {@link LLVMIRLoader} for syntax errors found by the parser and
 * for semantic errors found while building the module (undefined names,
 * type mismatches, unsupported constructs).
 */
public class LLVMParseException extends Exception {

    private final int lineNumber;
    private final String line;
    private final List<ParseError> errors;

    /**
     * 解析错误详情
     */
    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    public LLVMParseException(String message) {
        super(message);
        this.lineNumber = -1;
        this.line = null;
        this.errors = new ArrayList<>();
    }

    /**
     * 创建包含行号信息的异常
     */
    public LLVMParseException(String message, int lineNumber, String line, Throwable cause) {
        super(formatMessage(message, lineNumber, line), cause);
        this.lineNumber = lineNumber;
        this.line = line;
        this.errors = new ArrayList<>(List.of(new ParseError(lineNumber, line, message)));
    }

    /**
     * 创建包含多个错误的异常, the first error gives the line number
     */
    public LLVMParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.lineNumber = errors.isEmpty() ? -1 : errors.get(0).getLineNumber();
        this.line = errors.isEmpty() ? null : errors.get(0).getLine();
        this.errors = new ArrayList<>(errors);
    }

    public LLVMParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.line = null;
        this.errors = new ArrayList<>();
    }

    /* -1 when the error is not tied to a line */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    private static String formatMessage(String message, int lineNumber, String line) {
        StringBuilder sb = new StringBuilder(message);
        if (lineNumber >= 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        if (line != null && !line.isEmpty()) {
            sb.append("\n  -> ").append(line.trim());
        }
        return sb.toString();
    }

    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i).toString());
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }

    public static LLVMParseException syntaxError(String message, int lineNumber, String line) {
        return new LLVMParseException("Syntax error: " + message, lineNumber, line, null);
    }

    public static LLVMParseException semanticError(String message, int lineNumber, String line,
                                                   Throwable cause) {
        return new LLVMParseException("Invalid IR: " + message, lineNumber, line, cause);
    }
}
