package com.batchjob.generator.codegen.emit;

/**
 * Writes the control flow scaffolding that follows a command in the generated script.
 *
 * A retry gate lets the first failure send one notification and replay the phase; a second
 * failure goes to the global error handler. Literal text is matched by downstream tooling
 * and must stay byte-for-byte stable.
 */
public class ScaffoldEmitter {

    public static final String JOURNAL = " >> %JOURNAL% 2>&1";
    public static final String ERROR_JOURNAL = " 2>> %JOURNAL%";
    public static final String NOTIFY = "call %PF_SCRIPT%\\sendMail.cmd %num_phase% %nom_job%";
    public static final String FAIL_FAST =
            "if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR";
    public static final String FAIL_FAST_GTR_1 =
            "if %errorlevel% GTR 1 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR";

    /**
     * Standard retry scaffold replaying {@code phase} itself.
     */
    public void retry(ScriptWriter out, int phase) {
        retry(out, phase, phase);
    }

    /**
     * Retry scaffold for {@code phase} whose replay jumps to {@code retryTarget}.
     */
    public void retry(ScriptWriter out, int phase, int retryTarget) {
        gate(out, ExitTest.STANDARD, "finSTEP" + phase, retryTarget);
        out.line(":finSTEP" + phase);
        out.blank();
    }

    /**
     * Retry scaffold that tolerates exit code 1.
     */
    public void tolerantRetry(ScriptWriter out, int phase) {
        gate(out, ExitTest.TOLERANT, "finSTEP" + phase, phase);
        out.line(":finSTEP" + phase);
        out.blank();
    }

    /**
     * Gate whose success arm jumps to the intermediate label, which is opened right after.
     */
    public void branchToIntermediate(ScriptWriter out, int phase, int intermediate) {
        gate(out, ExitTest.STANDARD, "STEP" + intermediate, phase);
        out.line(":STEP" + intermediate);
    }

    public void failFast(ScriptWriter out) {
        out.line(FAIL_FAST);
    }

    public void failFastGreaterThanOne(ScriptWriter out) {
        out.line(FAIL_FAST_GTR_1);
    }

    private void gate(ScriptWriter out, ExitTest test, String successLabel, int retryTarget) {
        out.line("if %errorlevel% " + test.success() + " goto " + successLabel);
        out.line("if %errorlevel% " + test.failure()
                + " set ERR=Erreur execution %NOMTRAIT% & set /a nberr = %nberr%+1");
        out.line("if %nberr% EQU 1 " + NOTIFY + " & goto STEP" + retryTarget);
        out.line("if %nberr% GTR 1 goto ERREUR");
    }
}
