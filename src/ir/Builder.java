package ir;

import java.util.List;

import ir.type.FunctionType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.FCmpInst;
import ir.value.instructions.GEPInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.Phi;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.SelectInst;
import ir.value.instructions.StoreInst;
import ir.value.instructions.SwitchInst;
import ir.value.instructions.UnreachableInst;

/**
 * Creates instructions at an insertion point: the end of a block, or right
 * before an existing instruction.
 */
public class Builder {
    private final IRModule module;
    private BasicBlock currentBlock;
    // null means "append to currentBlock"
    private Instruction insertPoint;

    public Builder(IRModule module) {
        this.module = module;
    }

    public IRModule getModule() {
        return module;
    }

    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.insertPoint = null;
    }

    public void positionBefore(Instruction inst) {
        if (inst.getParent() == null) {
            throw new IllegalStateException("cannot position before a detached instruction");
        }
        this.currentBlock = inst.getParent();
        this.insertPoint = inst;
    }

    private <T extends Instruction> T insertInstruction(T inst) {
        if (currentBlock == null) {
            throw new IllegalStateException("builder has no insertion point");
        }
        if (insertPoint != null) {
            currentBlock.addInstructionBefore(inst, insertPoint);
        } else {
            currentBlock.addInstruction(inst);
        }
        return inst;
    }

    // natural alignment of a type, what memory operations get when the input does not say
    private int alignOf(Type type) {
        return type.isSized() ? module.getTargetDataLayout().getABITypeAlignment(type) : 0;
    }

    // --- 算术/位运算指令 ---
    public BinOperator buildBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        return insertInstruction(new BinOperator(opcode, lhs, rhs, name));
    }

    // --- 比较指令 ---
    public ICmpInst buildICmp(ICmpInst.Predicate pred, Value lhs, Value rhs, String name) {
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("ICmp operands must be of the same type");
        }
        return insertInstruction(new ICmpInst(pred, lhs, rhs, name));
    }

    public FCmpInst buildFCmp(FCmpInst.Predicate pred, Value lhs, Value rhs, String name) {
        if (!lhs.getType().isFloatingPoint()) {
            throw new IllegalArgumentException("FCmp only supports floating point types");
        }
        return insertInstruction(new FCmpInst(pred, lhs, rhs, name));
    }

    // --- 内存操作 ---
    public AllocaInst buildAlloca(Type allocatedType, String name) {
        AllocaInst inst = new AllocaInst(allocatedType, name);
        inst.setAlign(alignOf(allocatedType));
        return insertInstruction(inst);
    }

    public AllocaInst buildAlloca(Type allocatedType, Value arraySize, String name) {
        AllocaInst inst = new AllocaInst(allocatedType, arraySize, name);
        inst.setAlign(alignOf(allocatedType));
        return insertInstruction(inst);
    }

    public LoadInst buildLoad(Value pointer, String name) {
        LoadInst inst = new LoadInst(pointer, name);
        inst.setAlign(alignOf(inst.getType()));
        return insertInstruction(inst);
    }

    public StoreInst buildStore(Value value, Value pointer) {
        StoreInst inst = new StoreInst(value, pointer);
        inst.setAlign(alignOf(value.getType()));
        return insertInstruction(inst);
    }

    public GEPInst buildGEP(Type sourceElementType, Value pointer, List<Value> indices,
                            boolean inBounds, String name) {
        return insertInstruction(new GEPInst(sourceElementType, pointer, indices, inBounds, name));
    }

    // --- 类型转换 ---
    public CastInst buildCast(Opcode op, Value value, Type destType, String name) {
        return insertInstruction(new CastInst(op, value, destType, name));
    }

    public CastInst buildBitCast(Value value, Type destType, String name) {
        return buildCast(Opcode.BITCAST, value, destType, name);
    }

    // --- 控制流 ---
    public BranchInst buildBr(BasicBlock dest) {
        return insertInstruction(new BranchInst(dest));
    }

    public BranchInst buildCondBr(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        if (!condition.getType().isI1()) {
            throw new IllegalArgumentException("branch condition must be i1");
        }
        return insertInstruction(new BranchInst(condition, thenBlock, elseBlock));
    }

    /* cases are added on the returned instruction */
    public SwitchInst buildSwitch(Value condition, BasicBlock defaultDest) {
        return insertInstruction(new SwitchInst(condition, defaultDest));
    }

    public ReturnInst buildRet(Value value) {
        return insertInstruction(new ReturnInst(value));
    }

    public ReturnInst buildRetVoid() {
        return insertInstruction(new ReturnInst());
    }

    public UnreachableInst buildUnreachable() {
        return insertInstruction(new UnreachableInst());
    }

    // --- 其他 ---
    public SelectInst buildSelect(Value cond, Value trueVal, Value falseVal, String name) {
        if (!trueVal.getType().equals(falseVal.getType())) {
            throw new IllegalArgumentException("select arms must have the same type");
        }
        return insertInstruction(new SelectInst(cond, trueVal, falseVal, name));
    }

    public CallInst buildCall(FunctionType type, Value callee, List<Value> args, String name) {
        return insertInstruction(new CallInst(type, callee, args, name));
    }

    public CallInst buildCall(Function function, List<Value> args, String name) {
        return buildCall(function.getFunctionType(), function, args, name);
    }

    public Phi buildPhi(Type type, String name) {
        return insertInstruction(new Phi(type, name));
    }
}
