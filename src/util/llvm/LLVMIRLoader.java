package util.llvm;

import exception.CompileException;
import frontend.grammar.LLVMIRLexer;
import frontend.grammar.LLVMIRParser;
import frontend.irgen.IRGenerator;
import ir.IRModule;
import pass.IRPass.VerifyIRPass;
import util.LoggingManager;
import util.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * LLVM IR 加载器
 * <p>
 * 将 .ll 文件解析并转换为项目的 IR 对象: the text is parsed with the
 * generated {@link LLVMIRParser} and the tree is turned into an
 * {@link IRModule} by {@link IRGenerator}.
 */
public class LLVMIRLoader {
    private static final Logger logger = LoggingManager.getLogger(LLVMIRLoader.class);

    /**
     * 从文件路径加载单个 .ll 文件
     *
     * @param filePath .ll 文件路径
     * @return 解析后的模块, named after the file
     * @throws IOException 文件读取错误
     * @throws LLVMParseException 解析错误
     */
    public static IRModule loadFromFile(String filePath) throws IOException, LLVMParseException {
        return loadFromFile(filePath, LoaderConfig.defaultConfig());
    }

    public static IRModule loadFromFile(String filePath, LoaderConfig config)
            throws IOException, LLVMParseException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + filePath);
        }
        CharStream input = CharStreams.fromPath(path, StandardCharsets.UTF_8);
        return parse(input, extractModuleName(path.getFileName().toString()), config);
    }

    /**
     * 从 classpath 资源加载 .ll 文件
     *
     * @param resourcePath 资源路径，例如 "ir/scenario_a.ll"
     */
    public static IRModule loadFromResource(String resourcePath) throws IOException, LLVMParseException {
        return loadFromResource(resourcePath, LoaderConfig.defaultConfig());
    }

    public static IRModule loadFromResource(String resourcePath, LoaderConfig config)
            throws IOException, LLVMParseException {
        try (InputStream inputStream = LLVMIRLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            CharStream input = CharStreams.fromStream(inputStream, StandardCharsets.UTF_8);
            String fileName = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
            return parse(input, extractModuleName(fileName), config);
        }
    }

    /**
     * 从字符串内容解析 LLVM IR
     */
    public static IRModule parseFromString(String content, String moduleName) throws LLVMParseException {
        return parseFromString(content, moduleName, LoaderConfig.defaultConfig());
    }

    public static IRModule parseFromString(String content, String moduleName, LoaderConfig config)
            throws LLVMParseException {
        return parse(CharStreams.fromString(content, moduleName), moduleName, config);
    }

    private static IRModule parse(CharStream input, String moduleName, LoaderConfig config)
            throws LLVMParseException {
        String[] sourceLines = input.toString().split("\\R", -1);
        ErrorCollector collector = new ErrorCollector(config, sourceLines);

        LLVMIRLexer lexer = new LLVMIRLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        LLVMIRParser parser = new LLVMIRParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(collector);

        LLVMIRParser.Module_Context tree;
        try {
            tree = parser.module_();
        } catch (ParseCancellationException e) {
            // the collector stopped the parse, its errors are reported below
            tree = null;
        }
        List<LLVMParseException.ParseError> errors = collector.getErrors();
        if (!errors.isEmpty()) {
            if (errors.size() == 1) {
                LLVMParseException.ParseError only = errors.get(0);
                throw LLVMParseException.syntaxError(only.getErrorMessage(), only.getLineNumber(), only.getLine());
            }
            throw new LLVMParseException("Failed to parse " + moduleName, errors);
        }

        IRGenerator generator = new IRGenerator(moduleName);
        try {
            generator.visit(tree);
        } catch (IRGenerator.GenerationError e) {
            throw LLVMParseException.semanticError(e.getMessage(), e.getLine(),
                    lineText(sourceLines, e.getLine()), e);
        }
        IRModule module = generator.getModule();
        logger.debug("loaded module {}: {} function(s), {} global(s)", moduleName,
                module.getFunctions().size(), module.getGlobalVariables().size());

        if (config.isVerifyAfterLoad()) {
            try {
                new VerifyIRPass().run(module);
            } catch (CompileException e) {
                throw new LLVMParseException("Module " + moduleName + " failed verification: "
                        + e.getMessage(), e);
            }
        }
        return module;
    }

    private static String lineText(String[] lines, int lineNumber) {
        return lineNumber >= 1 && lineNumber <= lines.length ? lines[lineNumber - 1] : null;
    }

    /**
     * 从文件名提取模块名称
     */
    private static String extractModuleName(String fileName) {
        if (fileName.endsWith(".ll")) {
            return fileName.substring(0, fileName.length() - 3);
        }
        return fileName;
    }

    /* records lexer and parser errors; STRICT stops at the first, COLLECT at maxErrors */
    private static class ErrorCollector extends BaseErrorListener {
        private final LoaderConfig config;
        private final String[] sourceLines;
        private final List<LLVMParseException.ParseError> errors = new ArrayList<>();

        ErrorCollector(LoaderConfig config, String[] sourceLines) {
            this.config = config;
            this.sourceLines = sourceLines;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new LLVMParseException.ParseError(line, lineText(sourceLines, line),
                    msg + " at column " + charPositionInLine));
            if (config.getErrorHandling() == LoaderConfig.ErrorHandling.STRICT
                    || errors.size() >= config.getMaxErrors()) {
                throw new ParseCancellationException(msg);
            }
        }

        List<LLVMParseException.ParseError> getErrors() {
            return errors;
        }
    }
}
