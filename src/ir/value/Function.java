package ir.value;

import ir.IRModule;
import ir.debug.DISubprogram;
import ir.debug.Metadata;
import ir.type.FunctionType;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.instructions.Instruction;
import util.IList;
import util.IList.INode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

public class Function extends GlobalValue {
    private static final String INTRINSIC_PREFIX = "llvm.";

    private final ArrayList<Argument> arguments;
    private final IList<BasicBlock, Function> blocks;

    // names of args, blocks and instructions share one namespace
    private final Set<String> usedNames;
    private final Map<String, Integer> nameCounts;

    // "#0", "nounwind", ... after the parameter list
    private String fnAttributes = "";
    // "noundef", "zeroext", ... before the return type
    private String retAttributes = "";
    private final Map<String, Metadata> attachments = new LinkedHashMap<>();

    public Function(IRModule parent, FunctionType type, String name) {
        super(parent, PointerType.get(type), name);
        this.arguments = new ArrayList<>();
        this.usedNames = new HashSet<>();
        this.nameCounts = new java.util.HashMap<>();
        this.blocks = new IList<>(this);

        List<Type> paramTypes = type.getParamTypes();
        for (int i = 0; i < paramTypes.size(); i++) {
            String argName = getUniqueName("arg" + i);
            this.arguments.add(new Argument(paramTypes.get(i), argName, i, this));
        }
    }

    /* getter setter */
    public FunctionType getFunctionType() {
        return (FunctionType) getType().getPointeeType();
    }

    public Type getReturnType() {
        return getFunctionType().getReturnType();
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public Argument getParam(int index) {
        return arguments.get(index);
    }

    public IList<BasicBlock, Function> getBlocks() {
        return blocks;
    }

    public BasicBlock getEntryBlock() {
        return blocks.getEntry() != null ? blocks.getEntry().getVal() : null;
    }

    public BasicBlock appendBasicBlock(String name) {
        return new BasicBlock(getUniqueName(name), this);
    }

    /**
     * A function with no body. Calls to such a function cannot be followed by
     * an analysis that needs to see the callee.
     */
    public boolean isDeclaration() {
        return blocks.getNumNode() == 0;
    }

    public boolean isIntrinsic() {
        return getName().startsWith(INTRINSIC_PREFIX);
    }

    public String getFnAttributes() { return fnAttributes; }
    public void setFnAttributes(String attrs) { this.fnAttributes = attrs == null ? "" : attrs.trim(); }
    public String getRetAttributes() { return retAttributes; }
    public void setRetAttributes(String attrs) { this.retAttributes = attrs == null ? "" : attrs.trim(); }

    public Map<String, Metadata> getAttachments() {
        return attachments;
    }

    public void setMetadata(String kind, Metadata node) {
        if (node == null) {
            attachments.remove(kind);
        } else {
            attachments.put(kind, node);
        }
    }

    /* the debug descriptor, null when the function was compiled without debug info */
    public DISubprogram getSubprogram() {
        return attachments.get("dbg") instanceof DISubprogram sp ? sp : null;
    }

    /* 获得该函数中一个未被命名的变量名 */
    public String getUniqueName(String name) {
        if (name == null || name.isEmpty()) {
            name = "tmp";
        }
        String candidate = name;
        int count = nameCounts.getOrDefault(name, 0);
        while (usedNames.contains(candidate)) {
            count++;
            candidate = name + "." + count;
        }
        nameCounts.put(name, count);
        usedNames.add(candidate);
        return candidate;
    }

    /* rename an argument, e.g. to the name the textual IR gives it */
    public void renameArgument(int index, String name) {
        Argument arg = arguments.get(index);
        usedNames.remove(arg.getName());
        arg.setName(getUniqueName(name));
    }

    /**
     * Iterates over every instruction of the function, block by block.
     * <p>
     * The successor is captured before the current instruction is handed out,
     * so the caller may erase the instruction it was just given. Instructions
     * inserted before the current position are not visited.
     */
    public Iterable<Instruction> instructions() {
        return InstIterator::new;
    }

    private class InstIterator implements Iterator<Instruction> {
        private INode<BasicBlock, Function> blockNode;
        private INode<Instruction, BasicBlock> next;

        InstIterator() {
            this.blockNode = blocks.getEntry();
            this.next = blockNode != null ? blockNode.getVal().getInstructions().getEntry() : null;
            skipEmptyBlocks();
        }

        private void skipEmptyBlocks() {
            while (next == null && blockNode != null) {
                blockNode = blockNode.getNext();
                if (blockNode != null) {
                    next = blockNode.getVal().getInstructions().getEntry();
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Instruction next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            INode<Instruction, BasicBlock> current = next;
            // advance before the caller gets a chance to unlink current
            next = current.getNext();
            skipEmptyBlocks();
            return current.getVal();
        }
    }

    @Override
    public String toLLVM() {
        FunctionType fnType = getFunctionType();
        StringBuilder sb = new StringBuilder();
        sb.append(isDeclaration() ? "declare " : "define ");
        if (!getQualifiers().isEmpty()) {
            sb.append(getQualifiers()).append(" ");
        }
        if (!retAttributes.isEmpty()) {
            sb.append(retAttributes).append(" ");
        }
        sb.append(fnType.getReturnType().toLLVM())
                .append(" ").append(getReference()).append("(");

        String argsStr = arguments.stream()
                .map(arg -> isDeclaration() ? arg.toDeclLLVM() : arg.toLLVM())
                .collect(Collectors.joining(", "));
        if (fnType.isVarArg()) {
            argsStr = argsStr.isEmpty() ? "..." : argsStr + ", ...";
        }
        sb.append(argsStr).append(")");

        if (!fnAttributes.isEmpty()) {
            sb.append(" ").append(fnAttributes);
        }
        for (var entry : attachments.entrySet()) {
            sb.append(" !").append(entry.getKey()).append(" ").append(entry.getValue().getReference());
        }

        if (isDeclaration()) {
            return sb.append("\n").toString();
        }

        sb.append(" {\n");
        for (var node : blocks) {
            sb.append(node.getVal().toLLVM());
        }
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public String getHash() {
        return "FUNC" + getName() + getFunctionType().getHash();
    }
}
