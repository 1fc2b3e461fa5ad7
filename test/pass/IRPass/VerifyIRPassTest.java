package pass.IRPass;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static util.IRTestHelper.lines;
import static util.IRTestHelper.load;
import static util.IRTestHelper.named;
import static util.IRTestHelper.parse;

import exception.CompileException;
import ir.Builder;
import ir.IRModule;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import util.llvm.LLVMIRLoader;
import util.llvm.LLVMParseException;
import util.llvm.LoaderConfig;

/** Tests for {@link VerifyIRPass}. */
@RunWith(JUnit4.class)
public class VerifyIRPassTest {
    private final VerifyIRPass verifier = new VerifyIRPass();

    @Test
    public void wellFormedModulesPass() {
        assertThat(verifier.run(load("undefined_call.ll"))).isFalse();
        assertThat(verifier.run(load("two_functions.ll"))).isFalse();
        assertThat(verifier.run(load("debug_info.ll"))).isFalse();
    }

    @Test
    public void loopWithPhiPasses() {
        IRModule module = parse(lines(
                "define i32 @sum(i32 %n) {",
                "entry:",
                "  br label %loop",
                "loop:",
                "  %i = phi i32 [ 0, %entry ], [ %next, %loop ]",
                "  %next = add i32 %i, 1",
                "  %done = icmp sge i32 %next, %n",
                "  br i1 %done, label %exit, label %loop",
                "exit:",
                "  ret i32 %next",
                "}"));

        verifier.run(module);
    }

    @Test
    public void switchTargetsPass() {
        IRModule module = parse(lines(
                "define i32 @pick(i32 %x) {",
                "entry:",
                "  switch i32 %x, label %other [",
                "    i32 0, label %zero",
                "    i32 1, label %one",
                "  ]",
                "zero:",
                "  ret i32 10",
                "one:",
                "  ret i32 11",
                "other:",
                "  ret i32 12",
                "}"));

        verifier.run(module);
    }

    @Test
    public void operandErasedFromBlock() {
        IRModule module = load("undefined_call.ll");
        Instruction r = named(module.getFunction("f"), "r");
        r._getINode().removeSelf();

        CompileException e = assertThrows(CompileException.class, () -> verifier.run(module));

        assertThat(e).hasMessageThat().contains("not in any block");
    }

    @Test
    public void blockWithoutTerminator() {
        IRModule module = new IRModule("built");
        Function f = module.addFunction("f", FunctionType.get(IntegerType.getI32(), List.of(), false));
        BasicBlock entry = f.appendBasicBlock("entry");
        Builder builder = new Builder(module);
        builder.positionAtEnd(entry);
        ConstantInt one = ConstantInt.get(IntegerType.getI32(), 1);
        builder.buildBinary(Opcode.ADD, one, one, "x");

        CompileException e = assertThrows(CompileException.class, () -> verifier.run(module));

        assertThat(e).hasMessageThat().contains("Block without terminator");
    }

    @Test
    public void callMissingDebugLocation() {
        IRModule module = parse(lines(
                "declare i32 @a()",
                "declare i32 @b()",
                "",
                "define i32 @main() !dbg !2 {",
                "entry:",
                "  %x = call i32 @a(), !dbg !3",
                "  %y = call i32 @b()",
                "  ret i32 %y",
                "}",
                "",
                "!0 = distinct !DICompileUnit(language: DW_LANG_C99, file: !1)",
                "!1 = !DIFile(filename: \"a.c\", directory: \"/tmp\")",
                "!2 = distinct !DISubprogram(name: \"main\", scope: !1, file: !1, line: 3, unit: !0)",
                "!3 = !DILocation(line: 4, column: 3, scope: !2)"));

        CompileException e = assertThrows(CompileException.class, () -> verifier.run(module));

        assertThat(e).hasMessageThat().contains("!dbg");
        assertThat(e).hasMessageThat().contains("@b");
    }

    @Test
    public void returnTypeMismatchFailsOnLoad() {
        String text = lines(
                "define i32 @main() {",
                "entry:",
                "  ret i64 0",
                "}");

        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(text, "bad", LoaderConfig.testConfig()));

        assertThat(e).hasMessageThat().contains("return type");
    }

    @Test
    public void branchOnNonBoolean() {
        IRModule module = parse(lines(
                "define void @f(i32 %c) {",
                "entry:",
                "  ret void",
                "}"));
        Function f = module.getFunction("f");
        BasicBlock entry = f.getEntryBlock();
        entry.getTerminator().eraseFromParent();
        BasicBlock next = f.appendBasicBlock("next");
        // the builder refuses a non-i1 condition, so the branch is made directly
        entry.addInstruction(new BranchInst(f.getParam(0), next, next));
        Builder builder = new Builder(module);
        builder.positionAtEnd(next);
        builder.buildRetVoid();

        CompileException e = assertThrows(CompileException.class, () -> verifier.run(module));

        assertThat(e).hasMessageThat().contains("i1");
    }
}
