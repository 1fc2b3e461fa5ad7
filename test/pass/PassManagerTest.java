package pass;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static util.IRTestHelper.callsTo;
import static util.IRTestHelper.load;

import exception.CompileException;
import ir.IRModule;
import java.util.List;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.IRPass.DeleteUndefinedPass;
import pass.IRPass.VerifyIRPass;

/** Tests for {@link PassManager} and {@link IRPassType}. */
@RunWith(JUnit4.class)
public class PassManagerTest {

    @After
    public void clearProperty() {
        System.clearProperty(PassManager.PASSES_PROPERTY);
    }

    @Test
    public void pipelineFromNames() {
        PassManager pm = new PassManager(List.of("delete-undefined-nosym", " Verify "));

        assertThat(pm.getPipeline())
                .containsExactly(IRPassType.DeleteUndefinedNoSym, IRPassType.Verify)
                .inOrder();
    }

    @Test
    public void unknownPassName() {
        CompileException e = assertThrows(CompileException.class,
                () -> new PassManager(List.of("delete-undefined", "inline")));

        assertThat(e).hasMessageThat().contains("inline");
        assertThat(e).hasMessageThat().contains("delete-undefined-nosym");
    }

    @Test
    public void defaultPipeline() {
        System.clearProperty(PassManager.PASSES_PROPERTY);

        assertThat(new PassManager().getPipeline()).containsExactly(IRPassType.DeleteUndefined);
    }

    @Test
    public void pipelineFromProperty() {
        System.setProperty(PassManager.PASSES_PROPERTY, "verify, delete-undefined-nosym,");

        assertThat(new PassManager().getPipeline())
                .containsExactly(IRPassType.Verify, IRPassType.DeleteUndefinedNoSym)
                .inOrder();
    }

    @Test
    public void runReportsChanges() {
        IRModule module = load("undefined_call.ll");
        PassManager pm = new PassManager(IRPassType.DeleteUndefinedNoSym, IRPassType.Verify);

        assertThat(pm.runIRPasses(module)).isTrue();
        assertThat(callsTo(module, "undefined_fn")).isEmpty();

        assertThat(new PassManager(IRPassType.DeleteUndefinedNoSym).runIRPasses(module)).isFalse();
    }

    @Test
    public void getPassByClass() {
        PassManager pm = new PassManager(IRPassType.DeleteUndefinedNoSym, IRPassType.Verify);

        assertThat(pm.getPass(DeleteUndefinedPass.class).isNosym()).isTrue();
        assertThat(pm.getPass(VerifyIRPass.class)).isNotNull();
    }

    @Test
    public void getMissingPass() {
        PassManager pm = new PassManager(IRPassType.Verify);

        assertThrows(CompileException.class, () -> pm.getPass(DeleteUndefinedPass.class));
    }

    @Test
    public void verifyEachRunsAfterPasses() {
        IRModule module = load("undefined_call.ll");
        PassManager pm = new PassManager(IRPassType.DeleteUndefined);
        pm.setVerifyEach(true);

        assertThat(pm.isVerifyEach()).isTrue();
        assertThat(pm.runIRPasses(module)).isTrue();
    }

    @Test
    public void verifyEachCatchesBrokenModule() {
        IRModule module = load("undefined_call.ll");
        // detach an instruction that still has a user
        module.getFunction("f").getEntryBlock().getFirstInstruction()._getINode().removeSelf();
        PassManager pm = new PassManager(IRPassType.DeleteUndefinedNoSym);
        pm.setVerifyEach(true);

        assertThrows(CompileException.class, () -> pm.runIRPasses(module));
    }

    @Test
    public void passNames() {
        assertThat(IRPassType.fromName("DELETE-UNDEFINED")).isEqualTo(IRPassType.DeleteUndefined);
        assertThat(IRPassType.Verify.getName()).isEqualTo("verify");
        assertThat(IRPassType.DeleteUndefined.create()).isInstanceOf(DeleteUndefinedPass.class);
    }
}
