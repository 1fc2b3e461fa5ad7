package ir.value.instructions;

import java.util.LinkedHashMap;
import java.util.Map;

import ir.debug.DILocation;
import ir.debug.Metadata;
import ir.type.Type;
import ir.value.*;
import util.IList.INode;

public abstract class Instruction extends User {
    private final INode<Instruction, BasicBlock> instNode;
    // "dbg", "tbaa", ... in the order they were attached
    private final Map<String, Metadata> attachments;

    public Instruction(Type type, String name) {
        super(type, type.isVoid() ? null : name);
        this.instNode = new INode<>(this);
        this.attachments = new LinkedHashMap<>();
    }

    public abstract Opcode opCode();

    /* the instruction text after "%name = ", without attachments */
    protected abstract String render();

    public INode<Instruction, BasicBlock> _getINode() {
        return instNode;
    }

    public Instruction getNext() {
        return instNode.getNext() != null ? instNode.getNext().getVal() : null;
    }

    /* null while the instruction is not in any block */
    public BasicBlock getParent() {
        return instNode.getParent() != null ? instNode.getParent().getVal() : null;
    }

    public Function getFunction() {
        BasicBlock parent = getParent();
        return parent != null ? parent.getParent() : null;
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    /* metadata */
    public Map<String, Metadata> getAttachments() {
        return attachments;
    }

    public Metadata getMetadata(String kind) {
        return attachments.get(kind);
    }

    public void setMetadata(String kind, Metadata node) {
        if (node == null) {
            attachments.remove(kind);
        } else {
            attachments.put(kind, node);
        }
    }

    public DILocation getDebugLoc() {
        return attachments.get("dbg") instanceof DILocation loc ? loc : null;
    }

    public void setDebugLoc(DILocation loc) {
        setMetadata("dbg", loc);
    }

    /* placement */
    public void insertBefore(Instruction pos) {
        BasicBlock block = pos.getParent();
        if (block == null) {
            throw new IllegalStateException("cannot insert before a detached instruction");
        }
        block.addInstructionBefore(this, pos);
    }

    /**
     * Unlinks the instruction from its block and drops its operand uses.
     *
     * @throws IllegalStateException if the result is still used; callers
     *         redirect uses first
     */
    public void eraseFromParent() {
        if (hasUses()) {
            throw new IllegalStateException("erasing " + getReference()
                    + " which still has " + getUses().size() + " use(s)");
        }
        clearOperands();
        instNode.removeSelf();
    }

    @Override
    public final String toLLVM() {
        StringBuilder sb = new StringBuilder();
        if (!getType().isVoid()) {
            sb.append(getReference()).append(" = ");
        }
        sb.append(render());
        for (var entry : attachments.entrySet()) {
            sb.append(", !").append(entry.getKey()).append(" ").append(entry.getValue().getReference());
        }
        return sb.toString();
    }

    @Override
    public String getHash() {
        StringBuilder sb = new StringBuilder();
        sb.append(opCode().toString());
        for (Value operand : getOperands()) {
            sb.append(operand.hashCode());
        }
        return sb.toString();
    }
}
