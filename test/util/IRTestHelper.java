package util;

import ir.IRModule;
import ir.value.Function;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import pass.IRPass.undef.CallClassifier;
import util.llvm.LLVMIRLoader;
import util.llvm.LLVMParseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/** Loading fixtures and looking things up in a module, shared by the tests. */
public final class IRTestHelper {
    private IRTestHelper() {
    }

    public static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    public static IRModule parse(String text) {
        try {
            return LLVMIRLoader.parseFromString(text, "test");
        } catch (LLVMParseException e) {
            throw new AssertionError("fixture does not parse: " + e.getMessage(), e);
        }
    }

    public static IRModule load(String resource) {
        try {
            return LLVMIRLoader.loadFromResource("ir/" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (LLVMParseException e) {
            throw new AssertionError("fixture " + resource + " does not parse: " + e.getMessage(), e);
        }
    }

    public static List<Instruction> instructions(Function function) {
        List<Instruction> result = new ArrayList<>();
        for (Instruction inst : function.instructions()) {
            result.add(inst);
        }
        return result;
    }

    /* the instruction whose result has this name */
    public static Instruction named(Function function, String name) {
        for (Instruction inst : function.instructions()) {
            if (name.equals(inst.getName())) {
                return inst;
            }
        }
        throw new AssertionError("no %" + name + " in @" + function.getName());
    }

    /* every direct call, casts looked through, to the named function anywhere in the module */
    public static List<CallInst> callsTo(IRModule module, String callee) {
        List<CallInst> calls = new ArrayList<>();
        for (Function function : module.getFunctions()) {
            for (Instruction inst : function.instructions()) {
                if (inst instanceof CallInst call) {
                    Function target = CallClassifier.resolveCallee(call);
                    if (target != null && target.getName().equals(callee)) {
                        calls.add(call);
                    }
                }
            }
        }
        return calls;
    }

    public static long countGlobals(IRModule module, String prefix) {
        return module.getGlobalVariables().stream()
                .filter(g -> g.getName().startsWith(prefix))
                .count();
    }
}
