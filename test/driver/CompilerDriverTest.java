package driver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import exception.CompileException;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CompilerDriver}. */
@RunWith(JUnit4.class)
public class CompilerDriverTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private CompilerDriver driver;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() {
        CompilerDriver.reset();
        Config.reset();
        driver = CompilerDriver.getInstance();
        err = new ByteArrayOutputStream();
    }

    @After
    public void tearDown() {
        CompilerDriver.reset();
        Config.reset();
    }

    private PrintStream errStream() {
        return new PrintStream(err, true, StandardCharsets.UTF_8);
    }

    private File fixture(String name) throws IOException {
        File file = tmp.newFile(name);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("ir/" + name)) {
            Files.copy(in, file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
        return file;
    }

    @Test
    public void defaultsToDeleteUndefined() {
        driver.parseArgs(new String[] {"in.ll"});

        assertThat(driver.getSource()).isEqualTo("in.ll");
        assertThat(driver.getTarget()).isNull();
        assertThat(driver.getPassNames()).containsExactly("delete-undefined");
        assertThat(driver.isVerify()).isFalse();
    }

    @Test
    public void allOptions() {
        driver.parseArgs(new String[] {
            "-delete-undefined-nosym", "-verify", "-strict", "-entry", "start", "-o", "out.ll", "in.ll"});

        assertThat(driver.getPassNames()).containsExactly("delete-undefined-nosym");
        assertThat(driver.isVerify()).isTrue();
        assertThat(driver.getTarget()).isEqualTo("out.ll");
        assertThat(driver.getSource()).isEqualTo("in.ll");
        assertThat(Config.getInstance().isStrict).isTrue();
        assertThat(Config.getInstance().entryName).isEqualTo("start");
    }

    @Test
    public void passList() {
        driver.parseArgs(new String[] {"-passes", "verify,delete-undefined,verify", "in.ll"});

        assertThat(driver.getPassNames())
                .containsExactly("verify", "delete-undefined", "verify")
                .inOrder();
    }

    @Test
    public void unknownPassInList() {
        CompileException e = assertThrows(CompileException.class,
                () -> driver.parseArgs(new String[] {"-passes", "delete-undefined,mem2reg", "in.ll"}));

        assertThat(e).hasMessageThat().contains("mem2reg");
    }

    @Test
    public void noArgs() {
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[0]));
    }

    @Test
    public void unknownFlag() {
        CompileException e = assertThrows(CompileException.class,
                () -> driver.parseArgs(new String[] {"-O2", "in.ll"}));

        assertThat(e).hasMessageThat().contains("-O2");
    }

    @Test
    public void missingOptionValue() {
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[] {"in.ll", "-o"}));
        CompilerDriver.reset();
        assertThrows(CompileException.class,
                () -> CompilerDriver.getInstance().parseArgs(new String[] {"-o", "-verify", "in.ll"}));
    }

    @Test
    public void twoInputs() {
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[] {"a.ll", "b.ll"}));
    }

    @Test
    public void noInput() {
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[] {"-verify"}));
    }

    @Test
    public void rewritesFileToOutput() throws IOException {
        File in = fixture("undefined_call.ll");
        File out = new File(tmp.getRoot(), "out.ll");

        int status = driver.runCommandLine(
                new String[] {"-verify", "-o", out.getPath(), in.getPath()}, errStream());

        assertThat(status).isEqualTo(0);
        String text = Files.readString(out.toPath());
        assertThat(text).contains("@nondet_gl_undef = private global i32 0");
        assertThat(text).contains("call void @__VERIFIER_make_symbolic(");
        assertThat(text).doesNotContain("call i32 @undefined_fn()");
    }

    @Test
    public void nosymOutput() throws IOException {
        File in = fixture("undefined_call.ll");
        File out = new File(tmp.getRoot(), "out.ll");

        int status = driver.runCommandLine(
                new String[] {"-delete-undefined-nosym", "-o", out.getPath(), in.getPath()}, errStream());

        assertThat(status).isEqualTo(0);
        String text = Files.readString(out.toPath());
        assertThat(text).contains("add nsw i32 0, 1");
        assertThat(text).doesNotContain("nondet_gl_undef");
    }

    @Test
    public void missingInputFile() {
        int status = driver.runCommandLine(new String[] {"/nonexistent/in.ll"}, errStream());

        assertThat(status).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("error: ");
    }

    @Test
    public void missingEntryFails() throws IOException {
        File in = fixture("no_main.ll");
        File out = new File(tmp.getRoot(), "out.ll");

        int status = driver.runCommandLine(new String[] {"-o", out.getPath(), in.getPath()}, errStream());

        assertThat(status).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("'main'");
        assertThat(out.exists()).isFalse();
    }

    @Test
    public void badArgsPrintUsage() {
        int status = driver.runCommandLine(new String[0], errStream());

        assertThat(status).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains(CompilerDriver.USAGE);
    }
}
