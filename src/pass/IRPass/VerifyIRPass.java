package pass.IRPass;

import exception.CompileException;
import ir.IRModule;
import ir.value.*;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.SwitchInst;
import pass.IRPassType;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lightweight IR verifier. Checks core invariants of every defined function:
 * - Every block ends with exactly one terminator; PHI nodes are grouped at
 * the top of blocks
 * - Every instruction's node belongs to the block list it is reached from
 * - Branch and switch targets are blocks of the same function, conditions are i1
 * - PHI incoming blocks are predecessors of the PHI block
 * - Use-def tables consistent in both directions
 * - No operand refers to an erased instruction or to one in another function
 * - In a function with debug info, calls either all carry !dbg or none does
 * <p>
 * Never changes the module; a violation throws {@link CompileException}.
 */
public class VerifyIRPass implements Pass.IRPass {
    private final Logger log = LoggingManager.getLogger(VerifyIRPass.class);

    @Override
    public IRPassType getType() {
        return IRPassType.Verify;
    }

    @Override
    public boolean run(IRModule m) {
        for (Function f : m.getFunctions()) {
            if (f.isDeclaration())
                continue;
            verifyFunction(f);
        }
        log.debug("[IRVerifier] module {} ok", m.getName());
        return false;
    }

    private void verifyFunction(Function f) {
        // 0) 函数块列表不为空且 entry 在列表中
        if (f.getEntryBlock() == null) {
            fail("Function has no basic blocks", f, null, null, null);
        }

        // 收集函数内的块集合，便于成员性检查
        Set<BasicBlock> funcBlocks = new HashSet<>();
        for (var bbNodeX : f.getBlocks())
            funcBlocks.add(bbNodeX.getVal());

        // 1) 块结构与终结指令
        Map<BasicBlock, List<BasicBlock>> preds = new HashMap<>();
        for (BasicBlock bb : funcBlocks) {
            preds.put(bb, new ArrayList<>());
        }
        for (var bbNode : f.getBlocks()) {
            BasicBlock bb = bbNode.getVal();

            // 1.0 基本块必须属于该函数
            if (bb._getINode().getParent() != f.getBlocks()) {
                fail("BasicBlock is not in function block list", f, bb, null, null);
            }
            Instruction term = bb.getTerminator();
            if (term == null) {
                fail("Block without terminator", f, bb, bb.getLastInstruction(), null);
            }

            // 1.1 PHI 必须在块顶且连续；终结指令只能出现在块尾
            boolean seenNonPhi = false;
            for (var in = bb.getInstructions().getEntry(); in != null; in = in.getNext()) {
                Instruction I = in.getVal();
                if (I instanceof Phi) {
                    if (seenNonPhi) {
                        fail("PHI appears after non-PHI instruction", f, bb, I, null);
                    }
                } else {
                    seenNonPhi = true;
                }
                if (I.isTerminator() && I != term) {
                    fail("Terminator in the middle of a block", f, bb, I, null);
                }
            }

            // 1.2 分支操作数良构，目标都在本函数内
            for (BasicBlock s : successorsOf(f, bb, term, funcBlocks)) {
                preds.get(s).add(bb);
            }
            if (term instanceof ReturnInst ret) {
                Value rv = ret.getReturnValue();
                boolean ok = rv == null ? f.getReturnType().isVoid() : rv.getType().equals(f.getReturnType());
                if (!ok) {
                    fail("Return value does not match the function's return type", f, bb, ret,
                            f.getReturnType().toLLVM());
                }
            }
        }

        boolean hasDebugInfo = f.getSubprogram() != null;
        Instruction callWithLoc = null;
        Instruction callWithoutLoc = null;

        for (var bbNode : f.getBlocks()) {
            BasicBlock bb = bbNode.getVal();
            for (var in : bb.getInstructions()) {
                Instruction I = in.getVal();
                // 2.1 节点身份一致性
                if (I._getINode() != in) {
                    fail("List node identity mismatch with instruction's own node", f, bb, I, "listNode=" + in);
                }
                // 2.2 节点父指针与列表一致性
                if (I._getINode().getParent() != bb.getInstructions()) {
                    fail("Instruction node parent is not this block's instruction list", f, bb, I, null);
                }

                // 2.3 非 PHI 不允许自引用
                if (!(I instanceof Phi)) {
                    for (int k = 0; k < I.getNumOperands(); k++) {
                        if (I.getOperand(k) == I) {
                            fail("Only PHI nodes may reference their own value", f, bb, I, null);
                        }
                    }
                }

                // 2.4 Use-def 双向一致性
                for (Use u : I.getUses()) {
                    User UU = u.getUser();
                    int idx = u.getOperandIndex();
                    if (idx < 0 || idx >= UU.getNumOperands()) {
                        fail("Use has invalid operand index", f, bb, I, u.toString());
                    }
                    if (u.getUsee() != I) {
                        fail("Use recorded on a value it does not refer to", f, bb, I, u.toString());
                    }
                    if (UU.getOperand(idx) != I) {
                        fail("Use table desynchronized: user operand not equal to usee", f, bb, I, u.toString());
                    }
                    if (UU instanceof Instruction U && U.getParent() == null) {
                        fail("Instruction is used by an instruction that is not in any block", f, bb, I,
                                U.toLLVM());
                    }
                }
                for (int i = 0; i < I.getNumOperands(); i++) {
                    Value op = I.getOperand(i);
                    if (!hasUse(op, I, i)) {
                        fail("Operand missing corresponding Use entry", f, bb, I,
                                "operandIndex=" + i + ", op=" + op.getReference());
                    }
                    // 2.5 悬空引用：操作数是已删除或属于别的函数的指令
                    if (op instanceof Instruction def) {
                        if (def.getParent() == null) {
                            fail("Operand refers to an instruction that is not in any block", f, bb, I,
                                    "operandIndex=" + i);
                        } else if (def.getFunction() != f) {
                            fail("Operand refers to an instruction of another function", f, bb, I,
                                    def.getFunction().getName());
                        }
                    } else if (op instanceof Argument arg && arg.getParent() != f) {
                        fail("Operand refers to an argument of another function", f, bb, I, arg.getReference());
                    }
                }

                // 2.6 PHI 的 incoming block 都必须是该块的前驱
                if (I instanceof Phi phi) {
                    for (int i = 0; i < phi.getNumIncoming(); i++) {
                        BasicBlock inc = phi.getIncomingBlock(i);
                        if (!preds.get(bb).contains(inc)) {
                            fail("PHI incoming block not a predecessor of its block", f, bb, I,
                                    inc != null ? inc.getName() : "null");
                        }
                    }
                }

                if (hasDebugInfo && I instanceof CallInst call && !isIntrinsicCall(call)) {
                    if (call.getDebugLoc() != null) {
                        callWithLoc = call;
                    } else {
                        callWithoutLoc = call;
                    }
                }
            }
        }

        // 3) 调试信息：带 !dbg 的函数里调用要么都有位置要么都没有
        if (callWithLoc != null && callWithoutLoc != null) {
            fail("Call without !dbg location in a function with debug info", f,
                    callWithoutLoc.getParent(), callWithoutLoc, "sibling " + callWithLoc.toLLVM());
        }
    }

    private List<BasicBlock> successorsOf(Function f, BasicBlock bb, Instruction term, Set<BasicBlock> funcBlocks) {
        List<Value> targets = new ArrayList<>();
        if (term instanceof BranchInst br) {
            int n = br.getNumOperands();
            if (n != 1 && n != 3) {
                fail("BranchInst must have 1 (uncond) or 3 (cond) operands", f, bb, br, "numOperands=" + n);
            }
            if (br.isConditional() && !br.getCondition().getType().isI1()) {
                fail("Conditional branch condition must be i1", f, bb, br, br.getCondition().getType().toLLVM());
            }
            targets.addAll(br.getOperands().subList(br.isConditional() ? 1 : 0, n));
        } else if (term instanceof SwitchInst sw) {
            targets.add(sw.getOperand(1));
            for (int i = 3; i < sw.getNumOperands(); i += 2) {
                targets.add(sw.getOperand(i));
            }
        }
        List<BasicBlock> succs = new ArrayList<>();
        for (Value t : targets) {
            if (!(t instanceof BasicBlock target)) {
                fail("Branch target must be a BasicBlock", f, bb, term, t.getReference());
                continue;
            }
            if (!funcBlocks.contains(target)) {
                fail("Branch target not in same function", f, bb, term, target.getName());
            }
            succs.add(target);
        }
        return succs;
    }

    private static boolean hasUse(Value op, User user, int index) {
        for (Use u : op.getUses()) {
            if (u.getUser() == user && u.getOperandIndex() == index) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIntrinsicCall(CallInst call) {
        return call.getCalledValue().stripPointerCasts() instanceof Function callee && callee.isIntrinsic();
    }

    private void fail(String msg, Function f, BasicBlock bb, Instruction I, Object extra) {
        StringBuilder sb = new StringBuilder();
        sb.append("[IRVerifier] ").append(msg).append('\n');
        sb.append("  Function: ").append(f.getName()).append('\n');
        sb.append("  BasicBlock: ").append(bb != null ? bb.getName() : "null").append('\n');
        sb.append("  Instruction: ").append(I != null ? safeText(I) : "null").append('\n');
        if (extra != null)
            sb.append("  Extra: ").append(extra).append('\n');
        log.debug("{}", sb);
        throw CompileException.invalidIR(sb.toString());
    }

    // a broken instruction may not print
    private static String safeText(Instruction I) {
        try {
            return I.toLLVM();
        } catch (RuntimeException e) {
            return I.opCode() + " <unprintable: " + e.getMessage() + ">";
        }
    }
}
