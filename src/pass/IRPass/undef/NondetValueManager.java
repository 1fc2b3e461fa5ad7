package pass.IRPass.undef;

import exception.CompileException;
import ir.Builder;
import ir.IRModule;
import ir.TargetDataLayout;
import ir.debug.DILocation;
import ir.debug.DISubprogram;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.Function;
import ir.value.GlobalVariable;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantCString;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.instructions.CallInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import util.LoggingManager;
import util.logging.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out unconstrained values of a given type.
 * <p>
 * Every type gets one private zero-initialized global, the cell, which is
 * marked symbolic once by a call
 * {@code __VERIFIER_make_symbolic(i8* cell, size_t bytes, i8* "nondet")}
 * placed at the start of the entry function. A request returns a fresh load
 * of the cell inserted at the requested position.
 * <p>
 * One manager serves one pass run over one module.
 */
public class NondetValueManager {
    private static final Logger log = LoggingManager.getLogger(NondetValueManager.class);

    public static final String MAKE_SYMBOLIC = "__VERIFIER_make_symbolic";
    public static final String CELL_NAME = "nondet_gl_undef";
    public static final String DISPLAY_NAME = "nondet";

    private final IRModule module;
    private final String entryName;

    // types are interned and compare structurally, so equal types share a cell
    private final Map<Type, GlobalVariable> cells = new HashMap<>();

    private Value makeSymbolic;
    private FunctionType makeSymbolicType;
    private Constant displayName;
    private DILocation initLocation;
    // the initializer inserted last; the next one goes right after it
    private CallInst lastInit;

    public NondetValueManager(IRModule module, String entryName) {
        this.module = module;
        this.entryName = entryName;
    }

    /**
     * Returns a new load of the cell for {@code type}, inserted right before
     * {@code insertBefore}. The first request for a type creates the cell and
     * its initializer.
     *
     * @throws CompileException if the type is unsized, or a cell is needed
     *         and the entry function is missing or empty; nothing is changed
     *         in that case
     */
    public LoadInst materialize(Type type, Instruction insertBefore) {
        GlobalVariable cell = cells.get(type);
        if (cell == null) {
            cell = createCell(type);
        }
        Builder builder = new Builder(module);
        builder.positionBefore(insertBefore);
        return builder.buildLoad(cell, DISPLAY_NAME);
    }

    /* checks everything createCell relies on, so a failure leaves the module untouched */
    public void checkCanCreateCell(Type type) {
        if (!type.isSized()) {
            throw CompileException.unsizedType(type.toLLVM());
        }
        Function entry = module.getFunction(entryName);
        if (entry == null) {
            throw CompileException.missingEntry(entryName);
        }
        if (entry.isDeclaration() || entry.getEntryBlock().getFirstInstruction() == null) {
            throw CompileException.emptyEntry(entryName);
        }
    }

    public boolean hasCell(Type type) {
        return cells.containsKey(type);
    }

    public GlobalVariable getCell(Type type) {
        return cells.get(type);
    }

    public int getNumCells() {
        return cells.size();
    }

    private GlobalVariable createCell(Type type) {
        checkCanCreateCell(type);
        Function entry = module.getFunction(entryName);
        TargetDataLayout layout = module.getTargetDataLayout();

        GlobalVariable cell = module.addGlobal(type, module.getUniqueGlobalName(CELL_NAME),
                Constant.getNullValue(type));
        cell.setQualifiers("private");
        cells.put(type, cell);

        long size = layout.getTypeAllocSize(type);
        IntegerType sizeType = layout.getSizeType();

        Builder builder = new Builder(module);
        positionForInit(builder, entry);
        CastInst addr = builder.buildBitCast(cell, PointerType.getBytePtr(), CELL_NAME + ".addr");
        CallInst init = builder.buildCall(getMakeSymbolicType(sizeType), getMakeSymbolic(sizeType),
                List.of(addr, ConstantInt.get(sizeType, size), getDisplayName()), null);
        DILocation loc = getInitLocation(entry);
        if (loc != null) {
            init.setDebugLoc(loc);
        }
        lastInit = init;

        log.debug("created {} for {} ({} bytes)", cell.getReference(), type.toLLVM(), size);
        return cell;
    }

    // initializers stay in creation order, ahead of the entry function's own code
    private void positionForInit(Builder builder, Function entry) {
        if (lastInit != null && lastInit.getParent() != null && lastInit.getNext() != null) {
            builder.positionBefore(lastInit.getNext());
        } else {
            builder.positionBefore(entry.getEntryBlock().getFirstInstruction());
        }
    }

    private FunctionType getMakeSymbolicType(IntegerType sizeType) {
        if (makeSymbolicType == null) {
            PointerType bytePtr = PointerType.getBytePtr();
            makeSymbolicType = FunctionType.get(VoidType.getVoid(), List.of(bytePtr, sizeType, bytePtr));
        }
        return makeSymbolicType;
    }

    /* void __VERIFIER_make_symbolic(void *addr, size_t nbytes, const char *name) */
    private Value getMakeSymbolic(IntegerType sizeType) {
        if (makeSymbolic == null) {
            makeSymbolic = module.getOrInsertFunction(MAKE_SYMBOLIC, getMakeSymbolicType(sizeType));
        }
        return makeSymbolic;
    }

    // one "nondet" string per run, shared by every initializer
    private Constant getDisplayName() {
        if (displayName == null) {
            ConstantCString text = ConstantCString.of(DISPLAY_NAME);
            GlobalVariable str = module.addGlobal(text.getType(),
                    module.getUniqueGlobalName(".str." + DISPLAY_NAME), text);
            str.setQualifiers("private unnamed_addr");
            str.setConst(true);
            str.setAlign(1);
            ConstantInt zero = ConstantInt.get(IntegerType.getI64(), 0);
            displayName = ConstantExpr.getGetElementPtr(text.getType(), str, List.of(zero, zero),
                    true, PointerType.getBytePtr());
        }
        return displayName;
    }

    /* line of the function's subprogram, column 0; null without debug info */
    private DILocation getInitLocation(Function entry) {
        DISubprogram sp = entry.getSubprogram();
        if (sp == null) {
            return null;
        }
        if (initLocation == null || initLocation.getScope() != sp) {
            initLocation = DILocation.get(sp.getLine(), 0, sp);
            module.addMetadata(initLocation);
        }
        return initLocation;
    }
}
