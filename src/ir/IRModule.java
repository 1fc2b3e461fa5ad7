package ir;

import ir.debug.Metadata;
import ir.type.FunctionType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.*;
import ir.value.constants.ConstantExpr;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One translation unit: globals, functions, named types and metadata, in the
 * order they were added. Modules are independent of each other.
 */
public class IRModule {
    private String moduleName;
    private String sourceFilename;
    private String targetTriple;
    private TargetDataLayout targetDataLayout;

    // 维护函数名到函数的映射
    private final Map<String, Function> functions = new LinkedHashMap<>();

    // 维护全局变量名到全局变量的映射
    private final Map<String, GlobalVariable> globalVariables = new LinkedHashMap<>();

    private final Map<String, StructType> namedStructs = new LinkedHashMap<>();

    // numbered metadata nodes by slot
    private final TreeMap<Integer, Metadata> metadata = new TreeMap<>();
    // !llvm.dbg.cu = !{!0}, kept as written
    private final Map<String, String> namedMetadata = new LinkedHashMap<>();
    // $name = comdat any
    private final Map<String, String> comdats = new LinkedHashMap<>();
    // attributes #0 = { ... }, body kept as written
    private final Map<Integer, String> attributeGroups = new TreeMap<>();

    // 提供唯一的全局名称
    private final Map<String, Integer> nameCounts = new HashMap<>();

    public IRModule(String moduleName) {
        this.moduleName = moduleName;
        this.targetDataLayout = TargetDataLayout.getDefault();
    }

    /* getter setter */
    public String getName() { return moduleName; }
    public void setName(String name) { this.moduleName = name; }
    public String getSourceFilename() { return sourceFilename; }
    public void setSourceFilename(String sourceFilename) { this.sourceFilename = sourceFilename; }
    public String getTargetTriple() { return targetTriple; }
    public void setTargetTriple(String targetTriple) { this.targetTriple = targetTriple; }

    public TargetDataLayout getTargetDataLayout() {
        return targetDataLayout;
    }

    public void setDataLayout(String dataLayoutString) {
        this.targetDataLayout = TargetDataLayout.parse(dataLayoutString);
    }

    /* functions */
    public Function addFunction(String name, FunctionType type) {
        if (isNameTaken(name)) {
            throw new IllegalArgumentException("Function '" + name + "' has already been declared.");
        }
        Function newFunc = new Function(this, type, name);
        functions.put(name, newFunc);
        return newFunc;
    }

    /**
     * Returns the function with this name, declaring it if it does not exist.
     * When an existing function has a different signature the result is the
     * function bitcast to the requested type, so the caller always gets a
     * callee of type {@code type*}.
     */
    public Value getOrInsertFunction(String name, FunctionType type) {
        Function existing = functions.get(name);
        if (existing == null) {
            return addFunction(name, type);
        }
        if (existing.getFunctionType().equals(type)) {
            return existing;
        }
        return ConstantExpr.getBitCast(existing, PointerType.get(type));
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(new ArrayList<>(functions.values()));
    }

    /* globals */
    public GlobalVariable addGlobal(Type valueType, String name, Value initializer) {
        if (isNameTaken(name)) {
            throw new IllegalArgumentException("Global '" + name + "' has already been declared.");
        }
        GlobalVariable gv = new GlobalVariable(this, valueType, name, initializer);
        globalVariables.put(name, gv);
        return gv;
    }

    public GlobalVariable getGlobalVariable(String name) {
        return globalVariables.get(name);
    }

    public List<GlobalVariable> getGlobalVariables() {
        return new ArrayList<>(globalVariables.values());
    }

    private boolean isNameTaken(String name) {
        return functions.containsKey(name) || globalVariables.containsKey(name);
    }

    /**
     * Generates a unique name for a global entity (function, global variable, etc.)
     * within this module: "name", "name.1", "name.2", ...
     *
     * @param baseName The base name to make unique.
     * @return A unique name.
     */
    public String getUniqueGlobalName(String baseName) {
        int count = nameCounts.getOrDefault(baseName, 0);
        String uniqueName = baseName;
        while (isNameTaken(uniqueName)) {
            count++;
            uniqueName = baseName + "." + count;
        }
        nameCounts.put(baseName, count);
        return uniqueName;
    }

    /* named struct types */
    public StructType getOrCreateNamedStruct(String name) {
        return namedStructs.computeIfAbsent(name, StructType::createIdentified);
    }

    public StructType getNamedStruct(String name) {
        return namedStructs.get(name);
    }

    public List<StructType> getNamedStructs() {
        return new ArrayList<>(namedStructs.values());
    }

    /* metadata */
    public void registerMetadata(int slot, Metadata node) {
        if (metadata.containsKey(slot)) {
            throw new IllegalArgumentException("metadata !" + slot + " defined twice");
        }
        node.setSlot(slot);
        metadata.put(slot, node);
    }

    /* numbers a node created after loading with the next free slot */
    public Metadata addMetadata(Metadata node) {
        int slot = metadata.isEmpty() ? 0 : metadata.lastKey() + 1;
        registerMetadata(slot, node);
        return node;
    }

    public Metadata getMetadata(int slot) {
        return metadata.get(slot);
    }

    public Map<String, String> getNamedMetadata() {
        return namedMetadata;
    }

    /* comdat name without '$' to its selection kind, "any", "noduplicates", ... */
    public Map<String, String> getComdats() {
        return comdats;
    }

    public Map<Integer, String> getAttributeGroups() {
        return attributeGroups;
    }

    @Override
    public String toString() {
        return toLLVM();
    }

    public String toLLVM() {
        StringBuilder sb = new StringBuilder();

        sb.append("; ModuleID = '").append(moduleName).append("'\n");
        if (sourceFilename != null) {
            sb.append("source_filename = \"").append(sourceFilename).append("\"\n");
        }
        if (!targetDataLayout.getDataLayoutString().isEmpty()) {
            sb.append("target datalayout = \"").append(targetDataLayout.getDataLayoutString()).append("\"\n");
        }
        if (targetTriple != null) {
            sb.append("target triple = \"").append(targetTriple).append("\"\n");
        }
        sb.append("\n");

        if (!comdats.isEmpty()) {
            for (var comdat : comdats.entrySet()) {
                sb.append("$").append(comdat.getKey()).append(" = comdat ").append(comdat.getValue()).append("\n");
            }
            sb.append("\n");
        }

        if (!namedStructs.isEmpty()) {
            for (StructType struct : namedStructs.values()) {
                sb.append(struct.toLLVM()).append(" = type ").append(struct.bodyToLLVM()).append("\n");
            }
            sb.append("\n");
        }

        if (!globalVariables.isEmpty()) {
            for (GlobalVariable global : globalVariables.values()) {
                sb.append(global.toLLVM()).append("\n");
            }
            sb.append("\n");
        }

        for (Function func : functions.values()) {
            sb.append(func.toLLVM()).append("\n");
        }

        for (var group : attributeGroups.entrySet()) {
            sb.append("attributes #").append(group.getKey())
              .append(" = { ").append(group.getValue()).append(" }\n");
        }
        if (!attributeGroups.isEmpty()) {
            sb.append("\n");
        }

        for (var named : namedMetadata.entrySet()) {
            sb.append("!").append(named.getKey()).append(" = ").append(named.getValue()).append("\n");
        }
        for (Metadata node : metadata.values()) {
            sb.append(node.toLLVM()).append("\n");
        }
        return sb.toString();
    }

    public void printToFile(String filename) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(filename))) {
            writer.write(this.toLLVM());
        }
    }
}
