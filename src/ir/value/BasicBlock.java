package ir.value;

import ir.type.LabelType;
import ir.value.instructions.Instruction;
import util.IList;
import util.IList.INode;

public class BasicBlock extends Value {
    private final IList<Instruction, BasicBlock> instructions;
    private final INode<BasicBlock, Function> blockNode;

    /* creates the block and appends it to parent; the name must already be unique */
    BasicBlock(String name, Function parent) {
        super(LabelType.getLabel(), name);
        this.instructions = new IList<>(this);
        this.blockNode = new INode<>(this);
        blockNode.insertAtEnd(parent.getBlocks());
    }

    /* getter setter */
    public IList<Instruction, BasicBlock> getInstructions() {
        return instructions;
    }

    public INode<BasicBlock, Function> _getINode() {
        return this.blockNode;
    }

    public BasicBlock getNext() {
        return blockNode.getNext() != null ? blockNode.getNext().getVal() : null;
    }

    public Function getParent() {
        return blockNode.getParent() != null ? blockNode.getParent().getVal() : null;
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction getFirstInstruction() {
        return instructions.getEntry() != null ? instructions.getEntry().getVal() : null;
    }

    public Instruction getLastInstruction() {
        return instructions.getLast() != null ? instructions.getLast().getVal() : null;
    }

    /* the block's terminator, null while the block is still being built */
    public Instruction getTerminator() {
        Instruction last = getLastInstruction();
        return last != null && last.isTerminator() ? last : null;
    }

    public void addInstruction(Instruction inst) {
        nameInstruction(inst);
        inst._getINode().insertAtEnd(instructions);
    }

    public void addInstructionBefore(Instruction inst, Instruction before) {
        if (before.getParent() != this) {
            throw new IllegalArgumentException("insertion point " + before.getReference()
                    + " is not in block " + getName());
        }
        nameInstruction(inst);
        inst._getINode().insertBefore(before._getINode());
    }

    // non-void results need a local name, reserve one in the function's namespace
    private void nameInstruction(Instruction inst) {
        if (inst.getType().isVoid()) {
            inst.setName(null);
            return;
        }
        Function parent = getParent();
        if (parent == null) {
            throw new IllegalStateException("block " + getName() + " is not in a function");
        }
        inst.setName(parent.getUniqueName(inst.getName()));
    }

    @Override
    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteName(getName())).append(":\n");
        for (var node : instructions) {
            sb.append("  ").append(node.getVal().toLLVM()).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String getHash() {
        return "BB" + getName();
    }
}
