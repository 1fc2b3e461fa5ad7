package ir.value.instructions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ir.type.FunctionType;
import ir.value.Function;
import ir.value.InlineAsm;
import ir.value.Opcode;
import ir.value.Value;

/**
 * {@code call}. Operands are the arguments followed by the callee, so the
 * callee is an ordinary use of the called value.
 */
public class CallInst extends Instruction {
    private final FunctionType functionType;
    // "tail", "musttail", "notail" or empty
    private String tailKind = "";
    // calling convention and return attributes, e.g. "fastcc noundef"
    private String retAttributes = "";
    // "#3", "nounwind", ... after the argument list
    private String fnAttributes = "";
    private final List<String> argAttributes;

    public CallInst(FunctionType functionType, Value callee, List<Value> args, String name) {
        super(functionType.getReturnType(), name);
        this.functionType = functionType;
        int fixed = functionType.getParamTypes().size();
        if (args.size() < fixed || (!functionType.isVarArg() && args.size() != fixed)) {
            throw new IllegalArgumentException("call of " + functionType.toLLVM()
                    + " with " + args.size() + " argument(s)");
        }

        for (Value arg : args) {
            addOperand(arg);
        }
        addOperand(callee);
        this.argAttributes = new ArrayList<>(Collections.nCopies(args.size(), ""));
    }

    /* direct call of a function with a matching signature */
    public CallInst(Function func, List<Value> args, String name) {
        this(func.getFunctionType(), func, args, name);
    }

    public FunctionType getFunctionType() {
        return functionType;
    }

    public Value getCalledValue() {
        return getOperand(getNumOperands() - 1);
    }

    /* the function called directly, without looking through casts */
    public Function getCalledFunction() {
        return getCalledValue() instanceof Function f ? f : null;
    }

    public boolean isInlineAsm() {
        return getCalledValue() instanceof InlineAsm;
    }

    public int getNumArgs() {
        return getNumOperands() - 1;
    }

    public Value getArg(int i) {
        if (i < 0 || i >= getNumArgs()) {
            throw new IndexOutOfBoundsException("argument " + i);
        }
        return getOperand(i);
    }

    public List<Value> getArgs() {
        return getOperands().subList(0, getNumArgs());
    }

    public boolean isVoid() {
        return getType().isVoid();
    }

    public void setTailKind(String tailKind) { this.tailKind = tailKind == null ? "" : tailKind.trim(); }
    public void setRetAttributes(String attrs) { this.retAttributes = attrs == null ? "" : attrs.trim(); }
    public void setFnAttributes(String attrs) { this.fnAttributes = attrs == null ? "" : attrs.trim(); }

    public void setArgAttributes(int i, String attrs) {
        argAttributes.set(i, attrs == null ? "" : attrs.trim());
    }

    @Override
    public Opcode opCode() {
        return Opcode.CALL;
    }

    @Override
    protected String render() {
        StringBuilder sb = new StringBuilder();
        if (!tailKind.isEmpty()) {
            sb.append(tailKind).append(" ");
        }
        sb.append("call ");
        if (!retAttributes.isEmpty()) {
            sb.append(retAttributes).append(" ");
        }
        // varargs callees need the full signature
        sb.append(functionType.isVarArg() ? functionType.toLLVM() : functionType.getReturnType().toLLVM());
        sb.append(" ").append(getCalledValue().getReference()).append("(");

        List<String> argStrings = new ArrayList<>();
        for (int i = 0; i < getNumArgs(); i++) {
            Value arg = getArg(i);
            String attrs = argAttributes.get(i);
            argStrings.add(attrs.isEmpty()
                    ? arg.getTypedReference()
                    : arg.getType().toLLVM() + " " + attrs + " " + arg.getReference());
        }
        sb.append(String.join(", ", argStrings)).append(")");
        if (!fnAttributes.isEmpty()) {
            sb.append(" ").append(fnAttributes);
        }
        return sb.toString();
    }

    @Override
    public String getHash() {
        StringBuilder sb = new StringBuilder();
        sb.append(opCode().toString());
        sb.append("@").append(getCalledValue().getReference());
        for (Value arg : getArgs())
            sb.append("|").append(arg.getHash());
        return sb.toString();
    }
}
