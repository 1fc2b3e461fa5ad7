package frontend.irgen;

import frontend.grammar.LLVMIRBaseVisitor;
import frontend.grammar.LLVMIRParser;
import frontend.grammar.LLVMIRParser.*;
import exception.CompileException;
import ir.Builder;
import ir.IRModule;
import ir.debug.DILocation;
import ir.debug.DISubprogram;
import ir.debug.MDNode;
import ir.debug.Metadata;
import ir.type.*;
import ir.value.*;
import ir.value.constants.*;
import ir.value.instructions.*;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Builds an {@link IRModule} from the parse tree of a {@code .ll} file.
 * <p>
 * Module level entities are handled in dependency order rather than text
 * order: named types, metadata, function and global headers, global
 * initializers, then function bodies. Inside a body every block exists
 * before the first instruction is built, and a local used before its
 * definition gets a placeholder that is replaced once the definition is seen.
 */
public class IRGenerator extends LLVMIRBaseVisitor<Value> {
    private static final Logger logger = LogManager.getLogger(IRGenerator.class);

    // words before the type of a global or function that belong to the linkage part
    private static final Set<String> LINKAGE_WORDS = Set.of(
            "private", "internal", "external", "available_externally", "linkonce",
            "linkonce_odr", "weak", "weak_odr", "common", "appending", "extern_weak",
            "default", "hidden", "protected", "dllimport", "dllexport",
            "dso_local", "dso_preemptable");

    private final IRModule module;
    private final Builder builder;
    private final TypeResolver types = new TypeResolver();

    // per function state
    private Function currentFunction;
    private final Map<String, Value> locals = new HashMap<>();
    private final Map<String, BasicBlock> blocks = new HashMap<>();
    private final Map<String, ForwardRef> forwardRefs = new LinkedHashMap<>();
    private final Map<InstructionContext, String> implicitNames = new HashMap<>();
    // result name of the instruction being built
    private String pendingName;

    private int currentLine;

    /**
     * Semantic error in otherwise well formed input: an undefined name, a type
     * mismatch, an unsupported construct.
     */
    public static class GenerationError extends RuntimeException {
        private final int line;

        public GenerationError(int line, String message, Throwable cause) {
            super(message, cause);
            this.line = line;
        }

        public int getLine() {
            return line;
        }
    }

    public IRGenerator(String moduleName) {
        this.module = new IRModule(moduleName);
        this.builder = new Builder(module);
    }

    public IRModule getModule() {
        return module;
    }

    private GenerationError error(String message) {
        return new GenerationError(currentLine, message, null);
    }

    private void at(ParserRuleContext ctx) {
        currentLine = ctx.getStart().getLine();
    }

    // ==================== 模块 ====================

    @Override
    public Value visitModule_(Module_Context ctx) {
        try {
            generateModule(ctx.entity());
        } catch (IllegalArgumentException | IllegalStateException | CompileException e) {
            throw new GenerationError(currentLine, e.getMessage(), e);
        }
        return null;
    }

    private void generateModule(List<EntityContext> entities) {
        // header and named types, bodies may refer to types defined later
        for (EntityContext entity : entities) {
            if (entity.sourceFilename() != null) {
                module.setSourceFilename(unquote(entity.sourceFilename().StringLit().getText()));
            } else if (entity.targetDef() != null) {
                TargetDefContext target = entity.targetDef();
                at(target);
                String text = unquote(target.StringLit().getText());
                if (target.getChild(1).getText().equals("datalayout")) {
                    module.setDataLayout(text);
                } else {
                    module.setTargetTriple(text);
                }
            } else if (entity.typeDef() != null) {
                module.getOrCreateNamedStruct(symbolName(entity.typeDef().LocalIdent().getText()));
            } else if (entity.comdatDef() != null) {
                ComdatDefContext comdat = entity.comdatDef();
                module.getComdats().put(comdat.ComdatIdent().getText().substring(1),
                        comdat.BareWord(1).getText());
            }
        }
        for (EntityContext entity : entities) {
            if (entity.typeDef() != null) {
                defineNamedType(entity.typeDef());
            }
        }

        declareMetadata(entities.stream()
                .map(EntityContext::metadataDef)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()));

        for (EntityContext entity : entities) {
            if (entity.functionDecl() != null) {
                declareFunction(entity.functionDecl().functionHeader());
            } else if (entity.functionDef() != null) {
                declareFunction(entity.functionDef().functionHeader());
            } else if (entity.globalDef() != null) {
                declareGlobal(entity.globalDef());
            }
        }
        // initializers may point at any global or function
        for (EntityContext entity : entities) {
            if (entity.globalDef() != null && entity.globalDef().value() != null) {
                GlobalDefContext def = entity.globalDef();
                at(def);
                GlobalVariable gv = module.getGlobalVariable(symbolName(def.GlobalIdent().getText()));
                gv.setInitializer(resolveValue(gv.getValueType(), def.value()));
            }
        }

        for (EntityContext entity : entities) {
            if (entity.functionDef() != null) {
                defineFunctionBody(entity.functionDef());
            } else if (entity.attrGroupDef() != null) {
                AttrGroupDefContext group = entity.attrGroupDef();
                String raw = rawText(group);
                String body = raw.substring(raw.indexOf('{') + 1, raw.lastIndexOf('}')).trim();
                module.getAttributeGroups().put(
                        Integer.parseInt(group.AttrGroupId().getText().substring(1)), body);
            } else if (entity.namedMetadataDef() != null) {
                NamedMetadataDefContext named = entity.namedMetadataDef();
                module.getNamedMetadata().put(named.MetaKind().getText().substring(1),
                        rawText(named.mdTuple()));
            }
        }
    }

    private void defineNamedType(TypeDefContext ctx) {
        at(ctx);
        StructType struct = module.getNamedStruct(symbolName(ctx.LocalIdent().getText()));
        if (ctx.type_() == null) {
            return; // opaque
        }
        Type body = types.visit(ctx.type_());
        if (!(body instanceof StructType literal) || !literal.isLiteral()) {
            throw error("only struct bodies are supported in type definitions, got " + body);
        }
        struct.setBody(literal.getElementTypes(), literal.isPacked());
    }

    // ==================== 元数据 ====================

    private void declareMetadata(List<MetadataDefContext> defs) {
        // locations point at scopes, create everything else first
        List<MetadataDefContext> locations = new ArrayList<>();
        for (MetadataDefContext def : defs) {
            at(def);
            MdSpecializedContext specialized = def.mdNode().mdSpecialized();
            String kind = specialized != null ? specialized.MetaKind().getText() : null;
            if ("!DILocation".equals(kind)) {
                locations.add(def);
                continue;
            }
            Metadata node;
            if ("!DISubprogram".equals(kind)) {
                Map<String, String> fields = metadataFields(specialized);
                node = new DISubprogram(unquote(fields.getOrDefault("name", "\"\"")),
                        Integer.parseInt(fields.getOrDefault("line", "0")), rawText(specialized));
            } else {
                node = new MDNode(rawText(def.mdNode()));
            }
            registerMetadata(def, node);
        }
        for (MetadataDefContext def : locations) {
            at(def);
            MdSpecializedContext specialized = def.mdNode().mdSpecialized();
            Map<String, String> fields = metadataFields(specialized);
            String scope = fields.get("scope");
            if (scope == null) {
                throw error("DILocation without scope");
            }
            registerMetadata(def, DILocation.parsed(
                    Integer.parseInt(fields.getOrDefault("line", "0")),
                    Integer.parseInt(fields.getOrDefault("column", "0")),
                    metadataRef(scope), rawText(specialized)));
        }
    }

    private void registerMetadata(MetadataDefContext def, Metadata node) {
        node.setDistinct(def.getChild(2).getText().equals("distinct"));
        module.registerMetadata(Integer.parseInt(def.MetaId().getText().substring(1)), node);
    }

    /* "line: 3, scope: !4" -> {line=3, scope=!4}, first token of each value only */
    private static Map<String, String> metadataFields(MdSpecializedContext ctx) {
        Map<String, String> fields = new HashMap<>();
        for (int i = 0; i < ctx.getChildCount() - 1; i++) {
            if (ctx.getChild(i) instanceof TerminalNode node
                    && node.getSymbol().getType() == LLVMIRParser.LabelDef) {
                String label = node.getText();
                fields.put(label.substring(0, label.length() - 1), ctx.getChild(i + 1).getText());
            }
        }
        return fields;
    }

    private Metadata metadataRef(String metaId) {
        Metadata node = module.getMetadata(Integer.parseInt(metaId.substring(1)));
        if (node == null) {
            throw error("undefined metadata " + metaId);
        }
        return node;
    }

    // ==================== 全局符号 ====================

    private void declareFunction(FunctionHeaderContext ctx) {
        at(ctx);
        Type retType = types.visit(ctx.type_());
        List<ParamContext> params = ctx.paramList() != null ? ctx.paramList().param() : List.of();
        List<Type> paramTypes = new ArrayList<>();
        for (ParamContext param : params) {
            paramTypes.add(types.visit(param.type_()));
        }
        boolean isVarArg = ctx.paramList() != null && hasToken(ctx.paramList(), "...");

        String name = symbolName(ctx.GlobalIdent().getText());
        if (module.getFunction(name) != null || module.getGlobalVariable(name) != null) {
            throw error("redefinition of @" + name);
        }
        Function function = module.addFunction(name, FunctionType.get(retType, paramTypes, isVarArg));

        List<String> linkage = new ArrayList<>();
        List<String> retAttrs = new ArrayList<>();
        for (AttributeContext attr : ctx.attribute()) {
            String text = rawText(attr);
            (LINKAGE_WORDS.contains(text) ? linkage : retAttrs).add(text);
        }
        function.setQualifiers(String.join(" ", linkage));
        function.setRetAttributes(String.join(" ", retAttrs));

        for (int i = 0; i < params.size(); i++) {
            function.getParam(i).setAttributes(joinRaw(params.get(i).attribute()));
        }

        List<String> fnAttrs = new ArrayList<>();
        for (FnTrailerContext trailer : ctx.fnTrailer()) {
            if (trailer instanceof FnAttachmentContext attachment) {
                function.setMetadata(attachment.MetaKind().getText().substring(1),
                        metadataRef(attachment.MetaId().getText()));
            } else {
                fnAttrs.add(rawText(trailer));
            }
        }
        function.setFnAttributes(String.join(" ", fnAttrs));
    }

    private void declareGlobal(GlobalDefContext ctx) {
        at(ctx);
        String name = symbolName(ctx.GlobalIdent().getText());
        if (module.getFunction(name) != null || module.getGlobalVariable(name) != null) {
            throw error("redefinition of @" + name);
        }
        GlobalVariable gv = module.addGlobal(types.visit(ctx.type_()), name, null);
        gv.setQualifiers(joinRaw(ctx.attribute()));
        gv.setConst(hasToken(ctx, "constant"));

        List<String> trailers = new ArrayList<>();
        for (GlobalTrailerContext trailer : ctx.globalTrailer()) {
            if (trailer instanceof GlobalAlignContext align) {
                gv.setAlign(Integer.parseInt(align.IntLit().getText()));
            } else if (trailer instanceof GlobalAttachmentContext attachment) {
                gv.getAttachments().put(attachment.MetaKind().getText().substring(1),
                        metadataRef(attachment.MetaId().getText()));
            } else {
                // drop the leading comma
                trailers.add(rawText(trailer).substring(1).trim());
            }
        }
        gv.setTrailers(String.join(", ", trailers));
    }

    private Value getGlobal(String token, Type expected) {
        String name = symbolName(token);
        Value global = module.getFunction(name);
        if (global == null) {
            global = module.getGlobalVariable(name);
        }
        if (global == null) {
            throw error("use of undefined symbol " + token);
        }
        checkType(token, global, expected);
        return global;
    }

    // ==================== 函数体 ====================

    private void defineFunctionBody(FunctionDefContext ctx) {
        at(ctx);
        currentFunction = module.getFunction(symbolName(ctx.functionHeader().GlobalIdent().getText()));
        locals.clear();
        blocks.clear();
        forwardRefs.clear();
        implicitNames.clear();

        // unnamed arguments, blocks and results share one counter: %0, %1, ...
        int counter = 0;
        List<ParamContext> params = ctx.functionHeader().paramList() != null
                ? ctx.functionHeader().paramList().param() : List.of();
        for (int i = 0; i < params.size(); i++) {
            TerminalNode ident = params.get(i).LocalIdent();
            String key = ident != null ? ident.getText() : "%" + counter;
            if (ident == null || isNumbered(key)) {
                counter = Integer.parseInt(key.substring(1)) + 1;
            }
            currentFunction.renameArgument(i, localName(key));
            defineLocal(key, currentFunction.getParam(i));
        }

        List<BasicBlockContext> blockCtxs = ctx.basicBlock();
        List<BasicBlock> created = new ArrayList<>();
        for (int i = 0; i < blockCtxs.size(); i++) {
            BasicBlockContext blockCtx = blockCtxs.get(i);
            at(blockCtx);
            String key;
            String name;
            if (blockCtx.LabelDef() != null) {
                String label = blockCtx.LabelDef().getText();
                key = "%" + label.substring(0, label.length() - 1);
                name = localName(key);
                if (isNumbered(key)) {
                    counter = Integer.parseInt(key.substring(1)) + 1;
                }
            } else {
                key = "%" + counter++;
                name = i == 0 ? "entry" : localName(key);
            }
            if (blocks.containsKey(key)) {
                throw error("redefinition of block " + key);
            }
            BasicBlock block = currentFunction.appendBasicBlock(name);
            blocks.put(key, block);
            created.add(block);

            for (InstructionContext inst : blockCtx.instruction()) {
                if (inst.LocalIdent() != null) {
                    if (isNumbered(inst.LocalIdent().getText())) {
                        counter = Integer.parseInt(inst.LocalIdent().getText().substring(1)) + 1;
                    }
                } else if (producesValue(inst.instrBody())) {
                    implicitNames.put(inst, "%" + counter++);
                }
            }
        }

        for (int i = 0; i < blockCtxs.size(); i++) {
            builder.positionAtEnd(created.get(i));
            for (InstructionContext inst : blockCtxs.get(i).instruction()) {
                visit(inst);
            }
            visit(blockCtxs.get(i).terminatorInst());
        }

        if (!forwardRefs.isEmpty()) {
            throw error("use of undefined value " + forwardRefs.keySet().iterator().next()
                    + " in @" + currentFunction.getName());
        }
        logger.debug("loaded @{}: {} block(s)", currentFunction.getName(), created.size());
        currentFunction = null;
    }

    private boolean producesValue(InstrBodyContext body) {
        if (body instanceof StoreInstContext) {
            return false;
        }
        if (body instanceof CallInstContext call) {
            return !calleeType(types.visit(call.type_()), List.of()).getReturnType().isVoid();
        }
        return true;
    }

    private void defineLocal(String key, Value value) {
        if (locals.containsKey(key)) {
            throw error("redefinition of " + key);
        }
        locals.put(key, value);
        ForwardRef ref = forwardRefs.remove(key);
        if (ref != null) {
            checkType(key, value, ref.getType());
            ref.replaceAllUsesWith(value);
        }
    }

    private Value getLocal(String key, Type expected) {
        Value value = locals.get(key);
        if (value != null) {
            checkType(key, value, expected);
            return value;
        }
        ForwardRef ref = forwardRefs.computeIfAbsent(key, k -> new ForwardRef(expected, k));
        checkType(key, ref, expected);
        return ref;
    }

    private BasicBlock getBlock(TerminalNode ident) {
        BasicBlock block = blocks.get(ident.getText());
        if (block == null) {
            throw error("use of undefined label " + ident.getText());
        }
        return block;
    }

    private void checkType(String ref, Value value, Type expected) {
        if (!value.getType().equals(expected)) {
            throw error(ref + " has type " + value.getType() + ", expected " + expected);
        }
    }

    // ==================== 指令 ====================

    @Override
    public Value visitInstruction(InstructionContext ctx) {
        at(ctx);
        String key = ctx.LocalIdent() != null ? ctx.LocalIdent().getText() : implicitNames.get(ctx);
        pendingName = key != null ? localName(key) : null;
        Instruction inst = (Instruction) visit(ctx.instrBody());
        attach(inst, ctx.instrAttachment());
        if (key != null) {
            if (inst.getType().isVoid()) {
                throw error("cannot name a void value " + key);
            }
            defineLocal(key, inst);
        }
        return inst;
    }

    @Override
    public Value visitTerminatorInst(TerminatorInstContext ctx) {
        at(ctx);
        pendingName = null;
        Instruction inst = (Instruction) visit(ctx.terminator());
        attach(inst, ctx.instrAttachment());
        return inst;
    }

    private void attach(Instruction inst, List<InstrAttachmentContext> attachments) {
        for (InstrAttachmentContext attachment : attachments) {
            inst.setMetadata(attachment.MetaKind().getText().substring(1),
                    metadataRef(attachment.MetaId().getText()));
        }
    }

    @Override
    public Value visitBinaryInst(BinaryInstContext ctx) {
        Type type = types.visit(ctx.type_());
        BinOperator inst = builder.buildBinary(Opcode.fromKeyword(ctx.binOpcode().getText()),
                resolveValue(type, ctx.value(0)), resolveValue(type, ctx.value(1)), pendingName);
        inst.setFlags(ctx.BareWord().stream().map(ParseTree::getText).collect(Collectors.joining(" ")));
        return inst;
    }

    @Override
    public Value visitIcmpInst(IcmpInstContext ctx) {
        Type type = types.visit(ctx.type_());
        return builder.buildICmp(ICmpInst.Predicate.fromKeyword(ctx.predicate().getText()),
                resolveValue(type, ctx.value(0)), resolveValue(type, ctx.value(1)), pendingName);
    }

    @Override
    public Value visitFcmpInst(FcmpInstContext ctx) {
        Type type = types.visit(ctx.type_());
        FCmpInst inst = builder.buildFCmp(FCmpInst.Predicate.fromKeyword(ctx.predicate().getText()),
                resolveValue(type, ctx.value(0)), resolveValue(type, ctx.value(1)), pendingName);
        inst.setFlags(ctx.BareWord().stream().map(ParseTree::getText).collect(Collectors.joining(" ")));
        return inst;
    }

    @Override
    public Value visitCastInst(CastInstContext ctx) {
        Value value = resolveValue(types.visit(ctx.type_(0)), ctx.value());
        return builder.buildCast(Opcode.fromKeyword(ctx.castOpcode().getText()), value,
                types.visit(ctx.type_(1)), pendingName);
    }

    @Override
    public Value visitAllocaInst(AllocaInstContext ctx) {
        Type allocated = types.visit(ctx.type_(0));
        AllocaInst inst = ctx.value() != null
                ? builder.buildAlloca(allocated, resolveValue(types.visit(ctx.type_(1)), ctx.value()), pendingName)
                : builder.buildAlloca(allocated, pendingName);
        inst.setAlign(ctx.IntLit() != null ? Integer.parseInt(ctx.IntLit().getText()) : 0);
        return inst;
    }

    @Override
    public Value visitLoadInst(LoadInstContext ctx) {
        List<Type_Context> typeCtxs = ctx.type_();
        Type ptrType = types.visit(typeCtxs.get(typeCtxs.size() - 1));
        LoadInst inst = builder.buildLoad(resolveValue(ptrType, ctx.value()), pendingName);
        if (typeCtxs.size() == 2 && !types.visit(typeCtxs.get(0)).equals(inst.getType())) {
            throw error("load of " + types.visit(typeCtxs.get(0)) + " through " + ptrType);
        }
        inst.setVolatile(hasToken(ctx, "volatile"));
        inst.setAlign(ctx.IntLit() != null ? Integer.parseInt(ctx.IntLit().getText()) : 0);
        return inst;
    }

    @Override
    public Value visitStoreInst(StoreInstContext ctx) {
        Value value = resolveValue(types.visit(ctx.type_(0)), ctx.value(0));
        Value pointer = resolveValue(types.visit(ctx.type_(1)), ctx.value(1));
        StoreInst inst = builder.buildStore(value, pointer);
        inst.setVolatile(hasToken(ctx, "volatile"));
        inst.setAlign(ctx.IntLit() != null ? Integer.parseInt(ctx.IntLit().getText()) : 0);
        return inst;
    }

    @Override
    public Value visitGepInst(GepInstContext ctx) {
        GepOperands gep = gepOperands(ctx.type_(), ctx.value());
        return builder.buildGEP(gep.sourceType, gep.pointer, gep.indices,
                hasToken(ctx, "inbounds"), pendingName);
    }

    @Override
    public Value visitSelectInst(SelectInstContext ctx) {
        return builder.buildSelect(
                resolveValue(types.visit(ctx.type_(0)), ctx.value(0)),
                resolveValue(types.visit(ctx.type_(1)), ctx.value(1)),
                resolveValue(types.visit(ctx.type_(2)), ctx.value(2)),
                pendingName);
    }

    @Override
    public Value visitPhiInst(PhiInstContext ctx) {
        Type type = types.visit(ctx.type_());
        Phi phi = builder.buildPhi(type, pendingName);
        for (PhiIncomingContext incoming : ctx.phiIncoming()) {
            phi.addIncoming(resolveValue(type, incoming.value()), getBlock(incoming.LocalIdent()));
        }
        return phi;
    }

    @Override
    public Value visitCallInst(CallInstContext ctx) {
        List<Value> args = new ArrayList<>();
        List<String> argAttrs = new ArrayList<>();
        if (ctx.argList() != null) {
            for (ArgContext arg : ctx.argList().arg()) {
                if (arg instanceof ValueArgContext valueArg) {
                    args.add(resolveValue(types.visit(valueArg.type_()), valueArg.value()));
                    argAttrs.add(joinRaw(valueArg.attribute()));
                } else {
                    MdArgContext md = ((MetadataArgContext) arg).mdArg();
                    if (md instanceof MdValueArgContext wrapped) {
                        args.add(new MetadataValue(resolveValue(types.visit(wrapped.type_()), wrapped.value())));
                    } else {
                        args.add(new MetadataValue(rawText(md)));
                    }
                    argAttrs.add("");
                }
            }
        }

        FunctionType fnType = calleeType(types.visit(ctx.type_()),
                args.stream().map(Value::getType).collect(Collectors.toList()));
        Value callee;
        if (ctx.callee() instanceof AsmCalleeContext asm) {
            callee = new InlineAsm(fnType,
                    asm.BareWord().stream().map(ParseTree::getText).collect(Collectors.joining(" ")),
                    unquote(asm.StringLit(0).getText()), unquote(asm.StringLit(1).getText()));
        } else {
            callee = resolveValue(PointerType.get(fnType), ((ValueCalleeContext) ctx.callee()).value());
        }

        CallInst call = builder.buildCall(fnType, callee, args, pendingName);
        if (ctx.BareWord() != null) {
            call.setTailKind(ctx.BareWord().getText());
        }
        // attributes before the type belong to the return value, after the arguments to the call
        int typeStart = ctx.type_().getStart().getTokenIndex();
        call.setRetAttributes(joinRaw(ctx.attribute().stream()
                .filter(a -> a.getStart().getTokenIndex() < typeStart).collect(Collectors.toList())));
        call.setFnAttributes(joinRaw(ctx.attribute().stream()
                .filter(a -> a.getStart().getTokenIndex() > typeStart).collect(Collectors.toList())));
        for (int i = 0; i < argAttrs.size(); i++) {
            call.setArgAttributes(i, argAttrs.get(i));
        }
        return call;
    }

    /*
     * "call i32 (i8*, ...) @printf" names the full function type,
     * "call i32 @f" only the return type; older output uses a pointer to the function type.
     */
    private FunctionType calleeType(Type written, List<Type> argTypes) {
        if (written instanceof FunctionType fnType) {
            return fnType;
        }
        if (written instanceof PointerType ptr && ptr.getPointeeType() instanceof FunctionType fnType) {
            return fnType;
        }
        return FunctionType.get(written, argTypes);
    }

    // ==================== 终结指令 ====================

    @Override
    public Value visitRetVoid(RetVoidContext ctx) {
        return builder.buildRetVoid();
    }

    @Override
    public Value visitRetValue(RetValueContext ctx) {
        return builder.buildRet(resolveValue(types.visit(ctx.type_()), ctx.value()));
    }

    @Override
    public Value visitBr(BrContext ctx) {
        return builder.buildBr(getBlock(ctx.LocalIdent()));
    }

    @Override
    public Value visitCondBr(CondBrContext ctx) {
        Value cond = resolveValue(types.visit(ctx.type_()), ctx.value());
        return builder.buildCondBr(cond, getBlock(ctx.LocalIdent(0)), getBlock(ctx.LocalIdent(1)));
    }

    @Override
    public Value visitSwitch(SwitchContext ctx) {
        Type type = types.visit(ctx.type_());
        SwitchInst inst = builder.buildSwitch(resolveValue(type, ctx.value()), getBlock(ctx.LocalIdent()));
        for (SwitchCaseContext switchCase : ctx.switchCase()) {
            Value caseValue = resolveValue(types.visit(switchCase.type_()), switchCase.value());
            if (!(caseValue instanceof ConstantInt constant)) {
                throw error("switch case must be an integer constant");
            }
            inst.addCase(constant, getBlock(switchCase.LocalIdent()));
        }
        return inst;
    }

    @Override
    public Value visitUnreachable(UnreachableContext ctx) {
        return builder.buildUnreachable();
    }

    // ==================== 值与常量 ====================

    private Value resolveValue(Type type, ValueContext ctx) {
        if (ctx instanceof LocalValueContext local) {
            if (currentFunction == null) {
                throw error("local value " + local.getText() + " outside of a function");
            }
            return getLocal(local.LocalIdent().getText(), type);
        }
        if (ctx instanceof GlobalValueContext global) {
            return getGlobal(global.GlobalIdent().getText(), type);
        }
        Value constant = resolveConstant(type, ((ConstantValueContext) ctx).constant());
        checkType(ctx.getText(), constant, type);
        return constant;
    }

    private Value resolveConstant(Type type, ConstantContext ctx) {
        if (ctx instanceof IntConstContext intConst) {
            if (!(type instanceof IntegerType intType)) {
                throw error("integer literal " + intConst.getText() + " used as " + type);
            }
            return ConstantInt.get(intType, new BigInteger(intConst.getText()).longValue());
        }
        if (ctx instanceof FloatConstContext floatConst) {
            return new ConstantFloat(floatType(type, floatConst.getText()),
                    Double.parseDouble(floatConst.getText()));
        }
        if (ctx instanceof HexConstContext hexConst) {
            String text = hexConst.getText();
            if ("KLMHR".indexOf(text.charAt(2)) >= 0) {
                throw CompileException.unSupported("floating point literal " + text);
            }
            return new ConstantFloat(floatType(type, text),
                    Double.longBitsToDouble(Long.parseUnsignedLong(text.substring(2), 16)));
        }
        if (ctx instanceof BoolConstContext) {
            return ConstantInt.get(intTypeOf(type, ctx), ctx.getText().equals("true") ? 1 : 0);
        }
        if (ctx instanceof NullConstContext) {
            if (!(type instanceof PointerType ptrType)) {
                throw error("null used as " + type);
            }
            return ConstantPointerNull.get(ptrType);
        }
        if (ctx instanceof UndefConstContext) {
            return UndefValue.get(type);
        }
        if (ctx instanceof ZeroConstContext) {
            return type.isAggregate() ? ConstantZeroInitializer.get(type) : Constant.getNullValue(type);
        }
        if (ctx instanceof StringConstContext string) {
            return new ConstantCString(decodeCString(string.CStringLit().getText()));
        }
        if (ctx instanceof ArrayConstContext array) {
            if (!(type instanceof ArrayType arrayType)) {
                throw error("array constant used as " + type);
            }
            return new ConstantArray(arrayType, typedConstants(array.typedConstant()));
        }
        if (ctx instanceof StructConstContext || ctx instanceof PackedStructConstContext) {
            if (!(type instanceof StructType structType)) {
                throw error("struct constant used as " + type);
            }
            List<TypedConstantContext> fields = ctx instanceof StructConstContext s
                    ? s.typedConstant() : ((PackedStructConstContext) ctx).typedConstant();
            return new ConstantStruct(structType, typedConstants(fields));
        }
        if (ctx instanceof CastConstContext cast) {
            Value value = resolveValue(types.visit(cast.type_(0)), cast.value());
            return ConstantExpr.getCast(Opcode.fromKeyword(cast.castOpcode().getText()),
                    value, types.visit(cast.type_(1)));
        }
        GepConstContext gepConst = (GepConstContext) ctx;
        GepOperands gep = gepOperands(gepConst.type_(), gepConst.value());
        return ConstantExpr.getGetElementPtr(gep.sourceType, gep.pointer, gep.indices,
                hasToken(gepConst, "inbounds"),
                GEPInst.calculateGEPType(gep.sourceType, gep.indices));
    }

    private List<Value> typedConstants(List<TypedConstantContext> ctxs) {
        List<Value> values = new ArrayList<>();
        for (TypedConstantContext typed : ctxs) {
            values.add(resolveValue(types.visit(typed.type_()), typed.value()));
        }
        return values;
    }

    private FloatType floatType(Type type, String literal) {
        if (!(type instanceof FloatType floatType)) {
            throw error("floating point literal " + literal + " used as " + type);
        }
        return floatType;
    }

    private IntegerType intTypeOf(Type type, ParserRuleContext ctx) {
        if (!(type instanceof IntegerType intType)) {
            throw error(ctx.getText() + " used as " + type);
        }
        return intType;
    }

    private record GepOperands(Type sourceType, Value pointer, List<Value> indices) {
    }

    /*
     * getelementptr [explicit source type,] ptr type ptr, index...
     * the source type is left out by older printers
     */
    private GepOperands gepOperands(List<Type_Context> typeCtxs, List<ValueContext> valueCtxs) {
        int offset = typeCtxs.size() - valueCtxs.size();
        Type ptrType = types.visit(typeCtxs.get(offset));
        if (!(ptrType instanceof PointerType ptr)) {
            throw error("getelementptr on non-pointer " + ptrType);
        }
        Type sourceType = offset == 1 ? types.visit(typeCtxs.get(0)) : ptr.getPointeeType();
        if (!sourceType.equals(ptr.getPointeeType())) {
            throw error("getelementptr source type " + sourceType + " does not match " + ptrType);
        }
        Value pointer = resolveValue(ptrType, valueCtxs.get(0));
        List<Value> indices = new ArrayList<>();
        for (int i = 1; i < valueCtxs.size(); i++) {
            indices.add(resolveValue(types.visit(typeCtxs.get(offset + i)), valueCtxs.get(i)));
        }
        return new GepOperands(sourceType, pointer, indices);
    }

    // ==================== 类型 ====================

    private class TypeResolver extends LLVMIRBaseVisitor<Type> {
        @Override
        public Type visitPointerType(PointerTypeContext ctx) {
            return PointerType.get(visit(ctx.type_()));
        }

        @Override
        public Type visitFunctionType(FunctionTypeContext ctx) {
            List<Type> params = new ArrayList<>();
            boolean isVarArg = false;
            if (ctx.typeList() != null) {
                for (Type_Context param : ctx.typeList().type_()) {
                    params.add(visit(param));
                }
                isVarArg = hasToken(ctx.typeList(), "...");
            }
            return FunctionType.get(visit(ctx.type_()), params, isVarArg);
        }

        @Override
        public Type visitIntType(IntTypeContext ctx) {
            return IntegerType.getInteger(Integer.parseInt(ctx.getText().substring(1)));
        }

        @Override
        public Type visitFloatType(FloatTypeContext ctx) {
            return switch (ctx.getText()) {
                case "half" -> FloatType.getHalf();
                case "float" -> FloatType.getFloat();
                default -> FloatType.getDouble();
            };
        }

        @Override
        public Type visitVoidType(VoidTypeContext ctx) {
            return VoidType.getVoid();
        }

        @Override
        public Type visitMetadataType(MetadataTypeContext ctx) {
            return MetadataType.getMetadata();
        }

        @Override
        public Type visitArrayType(ArrayTypeContext ctx) {
            return ArrayType.get(visit(ctx.type_()), Long.parseLong(ctx.IntLit().getText()));
        }

        @Override
        public Type visitStructType(StructTypeContext ctx) {
            return StructType.getLiteral(elementTypes(ctx.typeList()), false);
        }

        @Override
        public Type visitPackedStructType(PackedStructTypeContext ctx) {
            return StructType.getLiteral(elementTypes(ctx.typeList()), true);
        }

        @Override
        public Type visitNamedType(NamedTypeContext ctx) {
            StructType struct = module.getNamedStruct(symbolName(ctx.LocalIdent().getText()));
            if (struct == null) {
                throw error("use of undefined type " + ctx.getText());
            }
            return struct;
        }

        private List<Type> elementTypes(TypeListContext ctx) {
            List<Type> elements = new ArrayList<>();
            if (ctx != null) {
                for (Type_Context element : ctx.type_()) {
                    elements.add(visit(element));
                }
            }
            return elements;
        }
    }

    // ==================== 工具 ====================

    /* stands in for a local that is used before its definition */
    private static final class ForwardRef extends Value {
        ForwardRef(Type type, String key) {
            super(type, key);
        }

        @Override
        public String toLLVM() {
            throw new IllegalStateException("unresolved forward reference " + getName());
        }

        @Override
        public String getHash() {
            return "FWD" + getName();
        }
    }

    /* the input text of a rule, with its original spacing */
    private static String rawText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    private static String joinRaw(List<? extends ParserRuleContext> ctxs) {
        return ctxs.stream().map(IRGenerator::rawText).collect(Collectors.joining(" "));
    }

    private static boolean hasToken(ParserRuleContext ctx, String text) {
        for (int i = 0; i < ctx.getChildCount(); i++) {
            if (ctx.getChild(i) instanceof TerminalNode && ctx.getChild(i).getText().equals(text)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNumbered(String key) {
        return key.length() > 1 && key.substring(1).chars().allMatch(Character::isDigit);
    }

    /* %x -> x, %"a b" -> a b, %7 -> _7 */
    private static String localName(String key) {
        String name = symbolName(key);
        return isNumbered(key) ? "_" + name : name;
    }

    /* strips the sigil and quotes; numbered globals keep their digits behind an underscore */
    private static String symbolName(String token) {
        String name = unquote(token.substring(1));
        if (!name.isEmpty() && name.chars().allMatch(Character::isDigit)) {
            return token.charAt(0) == '%' ? name : "_" + name;
        }
        return name;
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    /* c"abc\00" -> bytes, \XX is a hex escape and \\ a backslash */
    private static byte[] decodeCString(String literal) {
        String body = literal.substring(2, literal.length() - 1);
        java.io.ByteArrayOutputStream out = new java.io.ByteArrayOutputStream();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length() && body.charAt(i + 1) == '\\') {
                out.write('\\');
                i++;
            } else if (c == '\\' && i + 2 < body.length()) {
                out.write(Integer.parseInt(body.substring(i + 1, i + 3), 16));
                i += 2;
            } else {
                byte[] bytes = String.valueOf(c).getBytes(java.nio.charset.StandardCharsets.UTF_8);
                out.write(bytes, 0, bytes.length);
            }
        }
        return out.toByteArray();
    }
}
