package pass;

import exception.CompileException;
import ir.IRModule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import pass.IRPass.VerifyIRPass;
import pass.Pass.IRPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Runs an ordered list of IR passes over a module. A manager holds pass
 * objects, so a new one is made per module run.
 */
public class PassManager {
    public static final String PASSES_PROPERTY = "ir.passes";

    private final List<IRPass> irPipeline = new ArrayList<>();
    // run the verifier after every pass that is not itself the verifier
    private boolean verifyEach;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    /**
     * The pipeline named by the system property, eg: -Dir.passes=delete-undefined,verify,
     * or delete-undefined alone when the property is not set.
     */
    public PassManager() {
        List<String> enabled = loadEnabled(PASSES_PROPERTY);
        if (enabled.isEmpty()) {
            setIRPipeline(IRPassType.DeleteUndefined);
        } else {
            setIRPipeline(enabled);
        }
    }

    public PassManager(IRPassType... types) {
        setIRPipeline(types);
    }

    public PassManager(List<String> passNames) {
        setIRPipeline(passNames);
    }

    /** read “a,b,c” from system property, order kept */
    private static List<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void setVerifyEach(boolean verifyEach) {
        this.verifyEach = verifyEach;
    }

    public boolean isVerifyEach() {
        return verifyEach;
    }

    // 查询工具，当需要获得其他pass作为上下文时通过这个方法得到
    @SuppressWarnings("unchecked")
    public <T extends Pass> T getPass(Class<T> cls) {
        for (Pass p : irPipeline) {
            if (cls.isInstance(p)) {
                return (T) p;
            }
        }
        throw new CompileException("can not get the pass: " + cls.getName());
    }

    public List<IRPassType> getPipeline() {
        return irPipeline.stream().map(IRPass::getType).collect(Collectors.toList());
    }

    /**
     * Runs every pass in order.
     *
     * @return true if some pass changed the module
     * @throws CompileException from a pass, or from the verifier when a pass
     *         left the module broken
     */
    public boolean runIRPasses(IRModule module) {
        boolean changed = false;
        for (IRPass p : irPipeline) {
            log.info("[IR] {} on module {}", p.getType().getName(), module.getName());
            long start = System.nanoTime();
            boolean passChanged = p.run(module);
            log.debug("[IR] {} finished in {} ms, changed={}", p.getType().getName(),
                    (System.nanoTime() - start) / 1_000_000, passChanged);
            changed |= passChanged;

            // 在每个 IR pass 后运行校验，第一时间捕获破坏 IR 的 pass
            if (verifyEach && !(p instanceof VerifyIRPass)) {
                try {
                    new VerifyIRPass().run(module);
                } catch (CompileException ver) {
                    log.error("[IRVerifier] Failed right after pass: {}", p.getType().getName());
                    throw ver;
                }
            }
        }
        return changed;
    }

    /**
     * 追加一个irpass
     */
    public void addIRPass(IRPassType type) {
        irPipeline.add(type.create());
    }

    /**
     * 按顺序整体设置 IR pipeline（会清空重建）
     */
    public void setIRPipeline(IRPassType... types) {
        irPipeline.clear();
        for (IRPassType type : types) {
            addIRPass(type);
        }
    }

    /* names as accepted by IRPassType.fromName; an unknown name fails before anything runs */
    public void setIRPipeline(List<String> passNames) {
        List<IRPassType> types = new ArrayList<>();
        for (String name : passNames) {
            types.add(IRPassType.fromName(name));
        }
        setIRPipeline(types.toArray(new IRPassType[0]));
    }
}
