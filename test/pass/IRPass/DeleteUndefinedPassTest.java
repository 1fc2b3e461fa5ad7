package pass.IRPass;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static util.IRTestHelper.callsTo;
import static util.IRTestHelper.countGlobals;
import static util.IRTestHelper.instructions;
import static util.IRTestHelper.lines;
import static util.IRTestHelper.load;
import static util.IRTestHelper.named;
import static util.IRTestHelper.parse;

import exception.CompileException;
import ir.IRModule;
import ir.debug.DILocation;
import ir.type.IntegerType;
import ir.type.StructType;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.MetadataValue;
import ir.value.constants.Constant;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantZeroInitializer;
import ir.value.instructions.CallInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.IRPass.undef.NondetValueManager;

/** Tests for {@link DeleteUndefinedPass}. */
@RunWith(JUnit4.class)
public class DeleteUndefinedPassTest {
    private ByteArrayOutputStream diagnostics;

    @Before
    public void setUp() {
        diagnostics = new ByteArrayOutputStream();
    }

    private DeleteUndefinedPass symbolic() {
        return new DeleteUndefinedPass(false, false, "main", stream());
    }

    private DeleteUndefinedPass zero() {
        return new DeleteUndefinedPass(true, false, "main", stream());
    }

    private PrintStream stream() {
        return new PrintStream(diagnostics, true, StandardCharsets.UTF_8);
    }

    private List<String> diagnosticLines() {
        String text = diagnostics.toString(StandardCharsets.UTF_8);
        return Arrays.stream(text.split("\\R")).filter(l -> !l.isEmpty()).collect(Collectors.toList());
    }

    @Test
    public void zeroModeReplacesUsesWithZero() {
        IRModule module = load("undefined_call.ll");

        assertThat(zero().run(module)).isTrue();

        assertThat(callsTo(module, "undefined_fn")).isEmpty();
        Instruction add = named(module.getFunction("f"), "s");
        assertThat(add.getOperand(0)).isInstanceOf(ConstantInt.class);
        assertThat(((ConstantInt) add.getOperand(0)).getValue()).isEqualTo(0);
        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(0);
        assertThat(module.getFunction(NondetValueManager.MAKE_SYMBOLIC)).isNull();
        assertThat(diagnosticLines())
                .containsExactly(
                        "delete-undefined: removed calls to 'undefined_fn' (function is undefined, retval set to 0)");
    }

    @Test
    public void symbolicModeLoadsFromCellInitializedInMain() {
        IRModule module = load("undefined_call.ll");

        assertThat(symbolic().run(module)).isTrue();

        assertThat(callsTo(module, "undefined_fn")).isEmpty();
        GlobalVariable cell = module.getGlobalVariable(NondetValueManager.CELL_NAME);
        assertThat(cell).isNotNull();
        assertThat(cell.isPrivate()).isTrue();
        assertThat(cell.getValueType()).isEqualTo(IntegerType.getI32());
        assertThat(cell.getInitializer().getReference()).isEqualTo("0");

        List<Instruction> mainBody = instructions(module.getFunction("main"));
        assertThat(mainBody.get(0)).isInstanceOf(CastInst.class);
        assertThat(((CastInst) mainBody.get(0)).getValue()).isSameInstanceAs(cell);
        assertThat(mainBody.get(1)).isInstanceOf(CallInst.class);
        CallInst init = (CallInst) mainBody.get(1);
        assertThat(init.getCalledFunction().getName()).isEqualTo(NondetValueManager.MAKE_SYMBOLIC);
        assertThat(init.getArg(0)).isSameInstanceAs(mainBody.get(0));
        assertThat(init.getArg(1).getType()).isEqualTo(IntegerType.getI64());
        assertThat(((ConstantInt) init.getArg(1)).getValue()).isEqualTo(4);
        assertThat(init.getArg(2)).isInstanceOf(ConstantExpr.class);

        Instruction add = named(module.getFunction("f"), "s");
        assertThat(add.getOperand(0)).isInstanceOf(LoadInst.class);
        assertThat(((LoadInst) add.getOperand(0)).getPointer()).isSameInstanceAs(cell);
        assertThat(diagnosticLines())
                .containsExactly(
                        "delete-undefined: removed calls to 'undefined_fn' (function is undefined, retval made symbolic)");

        new VerifyIRPass().run(module);
    }

    @Test
    public void whitelistedCallIsUntouched() {
        IRModule module = load("malloc_call.ll");
        String before = module.toLLVM();

        assertThat(symbolic().run(module)).isFalse();

        assertThat(module.toLLVM()).isEqualTo(before);
        assertThat(callsTo(module, "malloc")).hasSize(1);
        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(0);
        assertThat(diagnosticLines()).isEmpty();
    }

    @Test
    public void oneCellPerTypeAcrossFunctions() {
        IRModule module = load("two_functions.ll");

        DeleteUndefinedPass pass = symbolic();
        assertThat(pass.run(module)).isTrue();

        assertThat(callsTo(module, "read_sensor")).isEmpty();
        assertThat(callsTo(module, "read_config")).isEmpty();
        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(1);
        assertThat(callsTo(module, NondetValueManager.MAKE_SYMBOLIC)).hasSize(1);
        assertThat(pass.getNondetValueManager().getNumCells()).isEqualTo(1);

        GlobalVariable cell = module.getGlobalVariable(NondetValueManager.CELL_NAME);
        LoadInst fromG = (LoadInst) named(module.getFunction("g"), "nondet");
        LoadInst fromH = (LoadInst) named(module.getFunction("h"), "nondet");
        assertThat(fromG).isNotSameInstanceAs(fromH);
        assertThat(fromG.getPointer()).isSameInstanceAs(cell);
        assertThat(fromH.getPointer()).isSameInstanceAs(cell);
        assertThat(diagnosticLines()).hasSize(2);
    }

    @Test
    public void missingEntryAbortsBeforeAnyChange() {
        IRModule module = load("no_main.ll");
        String before = module.toLLVM();

        CompileException e = assertThrows(CompileException.class, () -> symbolic().run(module));

        assertThat(e).hasMessageThat().contains("'main'");
        assertThat(module.toLLVM()).isEqualTo(before);
        assertThat(callsTo(module, "undefined_fn")).hasSize(1);
    }

    @Test
    public void missingEntryIsFineInZeroMode() {
        IRModule module = load("no_main.ll");

        assertThat(zero().run(module)).isTrue();

        assertThat(callsTo(module, "undefined_fn")).isEmpty();
    }

    @Test
    public void otherEntryName() {
        IRModule module = parse(lines(
                "declare i64 @clock_ticks()",
                "",
                "define void @start() {",
                "entry:",
                "  %t = call i64 @clock_ticks()",
                "  ret void",
                "}"));

        new DeleteUndefinedPass(false, false, "start", stream()).run(module);

        assertThat(callsTo(module, NondetValueManager.MAKE_SYMBOLIC)).hasSize(1);
        assertThat(callsTo(module, NondetValueManager.MAKE_SYMBOLIC).get(0).getFunction().getName())
                .isEqualTo("start");
    }

    @Test
    public void voidCallIsErasedWithoutCell() {
        IRModule module = parse(lines(
                "declare void @log_event(i32)",
                "",
                "define i32 @main() {",
                "entry:",
                "  call void @log_event(i32 1)",
                "  call void @log_event(i32 2)",
                "  ret i32 0",
                "}"));

        assertThat(symbolic().run(module)).isTrue();

        assertThat(callsTo(module, "log_event")).isEmpty();
        assertThat(instructions(module.getFunction("main"))).hasSize(1);
        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(0);
        assertThat(module.getFunction(NondetValueManager.MAKE_SYMBOLIC)).isNull();
        assertThat(diagnosticLines())
                .containsExactly("delete-undefined: removed calls to 'log_event' (function is undefined)");
    }

    @Test
    public void secondRunChangesNothing() {
        IRModule module = load("two_functions.ll");
        symbolic().run(module);
        String afterFirst = module.toLLVM();
        diagnostics.reset();

        assertThat(symbolic().run(module)).isFalse();

        assertThat(module.toLLVM()).isEqualTo(afterFirst);
        assertThat(diagnosticLines()).isEmpty();
    }

    @Test
    public void cellsAreSharedPerTypeWithinOneFunction() {
        IRModule module = parse(lines(
                "target datalayout = \"e-m:e-i64:64-f80:128-n8:16:32:64-S128\"",
                "",
                "declare i32 @a()",
                "declare i32 @b()",
                "declare i64 @c()",
                "",
                "define i64 @main() {",
                "entry:",
                "  %x = call i32 @a()",
                "  %y = call i32 @b()",
                "  %z = call i64 @c()",
                "  %s = add i32 %x, %y",
                "  %w = sext i32 %s to i64",
                "  %r = add i64 %w, %z",
                "  ret i64 %r",
                "}"));

        DeleteUndefinedPass pass = symbolic();
        pass.run(module);

        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(2);
        List<CallInst> inits = callsTo(module, NondetValueManager.MAKE_SYMBOLIC);
        assertThat(inits).hasSize(2);
        // in the order the types were first needed
        assertThat(((ConstantInt) inits.get(0).getArg(1)).getValue()).isEqualTo(4);
        assertThat(((ConstantInt) inits.get(1).getArg(1)).getValue()).isEqualTo(8);

        List<Instruction> body = instructions(module.getFunction("main"));
        long loads = body.stream().filter(i -> i instanceof LoadInst).count();
        assertThat(loads).isEqualTo(3);
        // cast, init, cast, init come before everything else
        assertThat(body.get(1)).isSameInstanceAs(inits.get(0));
        assertThat(body.get(3)).isSameInstanceAs(inits.get(1));

        GlobalVariable i32Cell = pass.getNondetValueManager().getCell(IntegerType.getI32());
        Instruction sum = named(module.getFunction("main"), "s");
        assertThat(((LoadInst) sum.getOperand(0)).getPointer()).isSameInstanceAs(i32Cell);
        assertThat(((LoadInst) sum.getOperand(1)).getPointer()).isSameInstanceAs(i32Cell);
        assertThat(sum.getOperand(0)).isNotSameInstanceAs(sum.getOperand(1));
    }

    @Test
    public void eachSymbolReportedOnce() {
        IRModule module = parse(lines(
                "declare i32 @poll()",
                "",
                "define i32 @main() {",
                "entry:",
                "  %a = call i32 @poll()",
                "  %b = call i32 @poll()",
                "  %c = call i32 @poll()",
                "  ret i32 %c",
                "}"));

        zero().run(module);

        assertThat(diagnosticLines()).hasSize(1);
    }

    @Test
    public void callThroughBitcastIsRemoved() {
        IRModule module = parse(lines(
                "declare i32 @old_style(...)",
                "",
                "define i32 @main() {",
                "entry:",
                "  %r = call i32 bitcast (i32 (...)* @old_style to i32 ()*)()",
                "  ret i32 %r",
                "}"));

        assertThat(zero().run(module)).isTrue();

        assertThat(callsTo(module, "old_style")).isEmpty();
        assertThat(module.getFunction("main").getEntryBlock().getTerminator().getOperand(0).getReference())
                .isEqualTo("0");
    }

    @Test
    public void callsToDefinedFunctionsStay() {
        IRModule module = load("undefined_call.ll");

        zero().run(module);

        assertThat(callsTo(module, "f")).hasSize(1);
    }

    @Test
    public void verifierNamespaceStays() {
        IRModule module = parse(lines(
                "declare i32 @__VERIFIER_nondet_int()",
                "declare void @__VERIFIER_assume(i32)",
                "declare i32 @klee_int(i8*)",
                "",
                "define i32 @main() {",
                "entry:",
                "  %x = call i32 @__VERIFIER_nondet_int()",
                "  call void @__VERIFIER_assume(i32 %x)",
                "  %y = call i32 @klee_int(i8* null)",
                "  ret i32 %y",
                "}"));
        String before = module.toLLVM();

        assertThat(symbolic().run(module)).isFalse();

        assertThat(module.toLLVM()).isEqualTo(before);
    }

    @Test
    public void existingMakeSymbolicDeclarationIsReused() {
        IRModule module = parse(lines(
                "declare void @__VERIFIER_make_symbolic(i8*, i64, i8*)",
                "declare i32 @undefined_fn()",
                "",
                "define i32 @main() {",
                "entry:",
                "  %r = call i32 @undefined_fn()",
                "  ret i32 %r",
                "}"));
        Function declared = module.getFunction(NondetValueManager.MAKE_SYMBOLIC);

        symbolic().run(module);

        List<CallInst> inits = callsTo(module, NondetValueManager.MAKE_SYMBOLIC);
        assertThat(inits).hasSize(1);
        assertThat(inits.get(0).getCalledFunction()).isSameInstanceAs(declared);
    }

    @Test
    public void unsizedResultIsFatal() {
        IRModule module = parse(lines(
                "%struct.handle = type opaque",
                "",
                "declare %struct.handle @open_handle()",
                "",
                "define i32 @main() {",
                "entry:",
                "  %h = call %struct.handle @open_handle()",
                "  ret i32 0",
                "}"));
        String before = module.toLLVM();

        CompileException e = assertThrows(CompileException.class, () -> symbolic().run(module));

        assertThat(e).hasMessageThat().contains("Unsized");
        assertThat(module.toLLVM()).isEqualTo(before);
    }

    @Test
    public void unsizedResultBecomesZeroInitializerInZeroMode() {
        IRModule module = parse(lines(
                "%struct.handle = type opaque",
                "",
                "declare %struct.handle @open_handle()",
                "",
                "define i32 @main() {",
                "entry:",
                "  %h = call %struct.handle @open_handle()",
                "  ret i32 0",
                "}"));

        assertThat(zero().run(module)).isTrue();

        assertThat(callsTo(module, "open_handle")).isEmpty();
        assertThat(diagnosticLines())
                .containsExactly(
                        "delete-undefined: removed calls to 'open_handle' (function is undefined, retval set to 0)");
        StructType handle = module.getNamedStruct("struct.handle");
        assertThat(Constant.getNullValue(handle)).isInstanceOf(ConstantZeroInitializer.class);
        new VerifyIRPass().run(module);
    }

    @Test
    public void pointerArgumentsAreRemovedWithWarning() {
        IRModule module = parse(lines(
                "declare i32 @fill(i8*)",
                "",
                "define i32 @main() {",
                "entry:",
                "  %buf = alloca [16 x i8]",
                "  %p = getelementptr inbounds [16 x i8], [16 x i8]* %buf, i64 0, i64 0",
                "  %n = call i32 @fill(i8* %p)",
                "  ret i32 %n",
                "}"));

        assertThat(zero().run(module)).isTrue();

        assertThat(callsTo(module, "fill")).isEmpty();
    }

    @Test
    public void pointerArgumentsAreRefusedInStrictMode() {
        IRModule module = parse(lines(
                "declare i32 @fill(i8*)",
                "",
                "define i32 @main() {",
                "entry:",
                "  %n = call i32 @fill(i8* null)",
                "  ret i32 %n",
                "}"));
        String before = module.toLLVM();
        DeleteUndefinedPass strict = new DeleteUndefinedPass(false, true, "main", stream());

        CompileException e = assertThrows(CompileException.class, () -> strict.run(module));

        assertThat(e).hasMessageThat().contains("'fill'");
        assertThat(module.toLLVM()).isEqualTo(before);
        assertThat(diagnosticLines()).isEmpty();
    }

    @Test
    public void runOnFunctionAloneSharesOneContext() {
        IRModule module = load("two_functions.ll");
        DeleteUndefinedPass pass = symbolic();

        assertThat(pass.runOnFunction(module.getFunction("g"))).isTrue();
        assertThat(pass.runOnFunction(module.getFunction("h"))).isTrue();
        assertThat(pass.runOnFunction(module.getFunction("main"))).isFalse();

        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(1);
    }

    @Test
    public void runOnFunctionKeepsStatePerModule() {
        IRModule first = load("two_functions.ll");
        IRModule second = load("undefined_call.ll");
        DeleteUndefinedPass pass = symbolic();

        assertThat(pass.runOnFunction(first.getFunction("g"))).isTrue();
        assertThat(pass.runOnFunction(second.getFunction("f"))).isTrue();
        assertThat(pass.runOnFunction(first.getFunction("h"))).isTrue();

        assertThat(countGlobals(first, NondetValueManager.CELL_NAME)).isEqualTo(1);
        assertThat(callsTo(first, NondetValueManager.MAKE_SYMBOLIC)).hasSize(1);
        assertThat(countGlobals(second, NondetValueManager.CELL_NAME)).isEqualTo(1);
        assertThat(diagnosticLines()).hasSize(3);
        new VerifyIRPass().run(first);
        new VerifyIRPass().run(second);
    }

    @Test
    public void initializerCarriesSubprogramLine() {
        IRModule module = load("debug_info.ll");
        Function main = module.getFunction("main");

        assertThat(symbolic().run(module)).isTrue();

        assertThat(callsTo(module, "get_input")).isEmpty();
        assertThat(callsTo(module, "printf")).isEmpty();
        assertThat(countGlobals(module, NondetValueManager.CELL_NAME)).isEqualTo(1);
        List<CallInst> inits = callsTo(module, NondetValueManager.MAKE_SYMBOLIC);
        assertThat(inits).hasSize(1);
        DILocation loc = inits.get(0).getDebugLoc();
        assertThat(loc).isNotNull();
        assertThat(loc.getLine()).isEqualTo(5);
        assertThat(loc.getColumn()).isEqualTo(0);
        assertThat(loc.getScope()).isSameInstanceAs(main.getSubprogram());
        assertThat(loc.getSlot()).isEqualTo(17);
        assertThat(main.getSubprogram().isDistinct()).isTrue();
        assertThat(module.toLLVM()).contains("!17 = !DILocation(line: 5, column: 0, scope: !7)");
        List<CallInst> declares = callsTo(module, "llvm.dbg.declare");
        assertThat(declares).hasSize(1);
        MetadataValue variable = (MetadataValue) declares.get(0).getArg(0);
        assertThat(variable.getWrapped()).isSameInstanceAs(named(main, "n"));

        new VerifyIRPass().run(module);
    }

    @Test
    public void noLocationWithoutDebugInfo() {
        IRModule module = load("undefined_call.ll");

        symbolic().run(module);

        assertThat(callsTo(module, NondetValueManager.MAKE_SYMBOLIC).get(0).getDebugLoc()).isNull();
    }

    @Test
    public void outputParsesAgain() {
        IRModule module = load("debug_info.ll");
        symbolic().run(module);
        String text = module.toLLVM();

        IRModule reparsed = parse(text);

        new VerifyIRPass().run(reparsed);
        assertThat(callsTo(reparsed, NondetValueManager.MAKE_SYMBOLIC)).hasSize(1);
        assertThat(reparsed.getGlobalVariable(NondetValueManager.CELL_NAME)).isNotNull();
    }

    @Test
    public void passTypeFollowsMode() {
        assertThat(symbolic().getType().getName()).isEqualTo("delete-undefined");
        assertThat(zero().getType().getName()).isEqualTo("delete-undefined-nosym");
    }
}
