package util.llvm;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static util.IRTestHelper.instructions;
import static util.IRTestHelper.lines;
import static util.IRTestHelper.named;

import ir.IRModule;
import ir.type.IntegerType;
import ir.type.StructType;
import ir.value.Argument;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Opcode;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.BinOperator;
import ir.value.instructions.CallInst;
import ir.value.instructions.GEPInst;
import ir.value.instructions.Phi;
import ir.value.instructions.SwitchInst;
import java.io.IOException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LLVMIRLoader}. */
@RunWith(JUnit4.class)
public class LLVMIRLoaderTest {

    private static final String FEATURES = lines(
            "; ModuleID = 'features.c'",
            "source_filename = \"features.c\"",
            "target datalayout = \"e-m:e-i64:64-f80:128-n8:16:32:64-S128\"",
            "target triple = \"x86_64-pc-linux-gnu\"",
            "",
            "%struct.point = type { i32, i32 }",
            "",
            "@origin = dso_local global %struct.point zeroinitializer, align 4",
            "@.str = private unnamed_addr constant [3 x i8] c\"hi\\00\", align 1",
            "@counter = internal global i32 0, section \".data.counter\", align 4",
            "",
            "declare i32 @puts(i8*)",
            "",
            "define dso_local noundef i32 @main(i32 noundef %argc) #0 {",
            "entry:",
            "  %p = alloca %struct.point, align 4",
            "  %y = getelementptr inbounds %struct.point, %struct.point* %p, i32 0, i32 1",
            "  store i32 %argc, i32* %y, align 4",
            "  %0 = load i32, i32* %y, align 4",
            "  %inc = add nsw i32 %0, 1",
            "  %cmp = icmp sgt i32 %inc, 1",
            "  br i1 %cmp, label %then, label %done",
            "then:",
            "  %call = call i32 @puts(i8* getelementptr inbounds ([3 x i8], [3 x i8]* @.str, i64 0, i64 0))",
            "  switch i32 %0, label %done [",
            "    i32 2, label %done",
            "  ]",
            "done:",
            "  %r = phi i32 [ 0, %entry ], [ 1, %then ], [ 1, %then ]",
            "  ret i32 %r",
            "}",
            "",
            "attributes #0 = { noinline nounwind }");

    @Test
    public void parsesCommonConstructs() throws LLVMParseException {
        IRModule module = LLVMIRLoader.parseFromString(FEATURES, "features");

        assertThat(module.getName()).isEqualTo("features");
        assertThat(module.getTargetTriple()).isEqualTo("x86_64-pc-linux-gnu");
        assertThat(module.getSourceFilename()).isEqualTo("features.c");
        assertThat(module.getNamedStruct("struct.point")).isNotNull();

        GlobalVariable str = module.getGlobalVariable(".str");
        assertThat(str.isConst()).isTrue();
        assertThat(str.isPrivate()).isTrue();

        Function main = module.getFunction("main");
        assertThat(main.getReturnType()).isEqualTo(IntegerType.getI32());
        assertThat(main.getBlocks().getNumNode()).isEqualTo(3);
        assertThat(named(main, "call")).isInstanceOf(CallInst.class);
        assertThat(named(main, "r")).isInstanceOf(Phi.class);
        assertThat(instructions(main).stream().anyMatch(i -> i instanceof SwitchInst)).isTrue();
        assertThat(module.getFunction("puts").isDeclaration()).isTrue();
    }

    @Test
    public void keepsAttributesAndOperandDetails() throws LLVMParseException {
        IRModule module = LLVMIRLoader.parseFromString(FEATURES, "features");
        Function main = module.getFunction("main");
        StructType point = module.getNamedStruct("struct.point");

        assertThat(module.getNamedStructs()).containsExactly(point);
        assertThat(module.getGlobalVariable("counter").getTrailers()).isEqualTo("section \".data.counter\"");
        assertThat(main.getRetAttributes()).isEqualTo("noundef");
        assertThat(main.getFnAttributes()).isEqualTo("#0");

        Argument argc = main.getArguments().get(0);
        assertThat(argc.getIndex()).isEqualTo(0);
        assertThat(argc.getAttributes()).isEqualTo("noundef");

        assertThat(((AllocaInst) named(main, "p")).getAllocatedType()).isEqualTo(point);
        GEPInst y = (GEPInst) named(main, "y");
        assertThat(y.isInBounds()).isTrue();
        assertThat(y.getIndices()).hasSize(2);
        assertThat(((BinOperator) named(main, "inc")).getFlags()).isEqualTo("nsw");

        Phi r = (Phi) named(main, "r");
        assertThat(((ConstantInt) r.getIncomingValue(1)).getValue()).isEqualTo(1L);
        ConstantExpr str = (ConstantExpr) ((CallInst) named(main, "call")).getArg(0);
        assertThat(str.getOpcode()).isEqualTo(Opcode.GETELEMENTPTR);
    }

    @Test
    public void numberedValuesGetNames() throws LLVMParseException {
        IRModule module = LLVMIRLoader.parseFromString(FEATURES, "features");

        assertThat(named(module.getFunction("main"), "_0").getType()).isEqualTo(IntegerType.getI32());
    }

    @Test
    public void printedModuleParsesToSameText() throws LLVMParseException {
        String printed = LLVMIRLoader.parseFromString(FEATURES, "features").toLLVM();

        String reprinted = LLVMIRLoader.parseFromString(printed, "features").toLLVM();

        assertThat(reprinted).isEqualTo(printed);
        assertThat(printed).contains("attributes #0 = { noinline nounwind }");
        assertThat(printed).contains("@.str = private unnamed_addr constant [3 x i8] c\"hi\\00\", align 1");
    }

    @Test
    public void quotedNamesKeepTheirSymbol() throws LLVMParseException {
        String text = lines(
                "declare i32 @\"weird.name\"()",
                "declare i32 @\"has space\"()");

        String printed = LLVMIRLoader.parseFromString(text, "quoted").toLLVM();
        IRModule again = LLVMIRLoader.parseFromString(printed, "quoted");

        assertThat(printed).contains("@weird.name()");
        assertThat(printed).contains("@\"has space\"()");
        assertThat(again.getFunction("weird.name")).isNotNull();
        assertThat(again.getFunction("has space")).isNotNull();
    }

    @Test
    public void syntaxErrorReportsLine() {
        String text = lines(
                "define i32 @main() {",
                "entry:",
                "  %x = add i32 1,",
                "  ret i32 %x",
                "}");

        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(text, "broken"));

        assertThat(e.getLineNumber()).isAnyOf(3, 4);
        assertThat(e).hasMessageThat().startsWith("Syntax error");
    }

    @Test
    public void collectModeReportsEveryError() {
        String text = lines(
                "define i32 @f() {",
                "entry:",
                "  ret i32 ?",
                "}",
                "",
                "define i32 @g() {",
                "entry:",
                "  ret i32 ?",
                "}");
        LoaderConfig config = LoaderConfig.defaultConfig()
                .setErrorHandling(LoaderConfig.ErrorHandling.COLLECT);

        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(text, "broken", config));

        assertThat(e.getErrors()).isNotEmpty();
        assertThat(e.getLineNumber()).isEqualTo(3);
    }

    @Test
    public void collectModeStopsAtMaxErrors() {
        String text = lines(
                "define i32 @f() {",
                "entry:",
                "  ret i32 ?",
                "}",
                "",
                "define i32 @g() {",
                "entry:",
                "  ret i32 ?",
                "}");
        LoaderConfig config = LoaderConfig.defaultConfig()
                .setErrorHandling(LoaderConfig.ErrorHandling.COLLECT)
                .setMaxErrors(1);

        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(text, "broken", config));

        assertThat(e.getErrors()).hasSize(1);
        assertThat(e.getLineNumber()).isEqualTo(3);
        assertThrows(IllegalArgumentException.class, () -> LoaderConfig.defaultConfig().setMaxErrors(0));
    }

    @Test
    public void undefinedValueIsSemanticError() {
        String text = lines(
                "define i32 @main() {",
                "entry:",
                "  %x = add i32 %nope, 1",
                "  ret i32 %x",
                "}");

        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(text, "broken"));

        assertThat(e).hasMessageThat().contains("Invalid IR");
        assertThat(e).hasMessageThat().contains("%nope");
    }

    @Test
    public void loadsResource() throws IOException, LLVMParseException {
        IRModule module = LLVMIRLoader.loadFromResource("ir/undefined_call.ll", LoaderConfig.testConfig());

        assertThat(module.getName()).isEqualTo("undefined_call");
        assertThat(module.getFunction("f")).isNotNull();
    }

    @Test
    public void missingResource() {
        IOException e = assertThrows(IOException.class,
                () -> LLVMIRLoader.loadFromResource("ir/does_not_exist.ll"));

        assertThat(e).hasMessageThat().contains("does_not_exist.ll");
    }

    @Test
    public void missingFile() {
        assertThrows(IOException.class, () -> LLVMIRLoader.loadFromFile("/nonexistent/input.ll"));
    }
}
