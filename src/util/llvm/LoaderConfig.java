package util.llvm;

/**
 * LLVM IR 加载器配置
 * <p>
 * Fluent options for {@link LLVMIRLoader}: how syntax errors are reported and
 * whether the loaded module is verified before it is handed out.
 */
public class LoaderConfig {

    /**
     * 错误处理策略
     */
    public enum ErrorHandling {
        STRICT,     // 遇到第一个错误立即抛出异常
        COLLECT     // 收集所有语法错误，最后一起报告
    }

    private ErrorHandling errorHandling = ErrorHandling.STRICT;
    private boolean verifyAfterLoad = false;
    private int maxErrors = 10;

    public static LoaderConfig defaultConfig() {
        return new LoaderConfig();
    }

    /**
     * 测试配置: all syntax errors in one report, module verified after loading
     */
    public static LoaderConfig testConfig() {
        LoaderConfig config = new LoaderConfig();
        config.errorHandling = ErrorHandling.COLLECT;
        config.verifyAfterLoad = true;
        return config;
    }

    public ErrorHandling getErrorHandling() {
        return errorHandling;
    }

    public LoaderConfig setErrorHandling(ErrorHandling errorHandling) {
        this.errorHandling = errorHandling;
        return this;
    }

    public boolean isVerifyAfterLoad() {
        return verifyAfterLoad;
    }

    public LoaderConfig setVerifyAfterLoad(boolean verifyAfterLoad) {
        this.verifyAfterLoad = verifyAfterLoad;
        return this;
    }

    /* COLLECT stops recording after this many errors */
    public int getMaxErrors() {
        return maxErrors;
    }

    public LoaderConfig setMaxErrors(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive");
        }
        this.maxErrors = maxErrors;
        return this;
    }

    public LoaderConfig copy() {
        LoaderConfig copy = new LoaderConfig();
        copy.errorHandling = this.errorHandling;
        copy.verifyAfterLoad = this.verifyAfterLoad;
        copy.maxErrors = this.maxErrors;
        return copy;
    }

    @Override
    public String toString() {
        return "LoaderConfig{" +
                "errorHandling=" + errorHandling +
                ", verifyAfterLoad=" + verifyAfterLoad +
                ", maxErrors=" + maxErrors +
                '}';
    }
}
