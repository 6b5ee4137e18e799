package com.batchjob.generator.codegen;

import java.io.StringReader;

import org.junit.jupiter.api.Test;

import com.batchjob.generator.codegen.exception.FailureKind;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.InvalidConfigurationException;
import com.batchjob.generator.codegen.exception.MalformedBlockException;
import com.batchjob.generator.codegen.model.core.context.GeneratorConfig;
import com.batchjob.generator.codegen.model.core.context.LineEnding;
import com.batchjob.generator.validation.JobScriptValidator;
import com.batchjob.generator.validation.ValidationReport;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ScriptAssembler: exact emission per line category.
 */
class ScriptAssemblerTest {

    private static final String HEAD = """
            JOB01.bat
            JDOE
            Nightly batch
            Loads and sorts customers
            rem #--LOAD-Load data
            """;

    private static final String RETRY_10 = """
            if %errorlevel% EQU 0 goto finSTEP10
            if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & set /a nberr = %nberr%+1
            if %nberr% EQU 1 call %PF_SCRIPT%\\sendMail.cmd %num_phase% %nom_job% & goto STEP10
            if %nberr% GTR 1 goto ERREUR
            :finSTEP10

            """;

    private static final String FAIL_FAST = "if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR\n";

    private final ScriptAssembler assembler = new ScriptAssembler();

    private static GeneratorConfig.GeneratorConfigBuilder config() {
        return GeneratorConfig.builder()
                .date("01/02/2024")
                .user("TESTER");
    }

    private AssembledScript assemble(String source) throws GenerationException {
        return assemble(source, config().build());
    }

    private AssembledScript assemble(String source, GeneratorConfig config) throws GenerationException {
        return assembler.assemble(new StringReader(source), config);
    }

    @Test
    void testPhaseMarkerOutput() throws GenerationException {
        AssembledScript script = assemble(HEAD);

        assertThat(script.getContent()).contains("""
                rem goto STEP000
                :STEP10
                rem ##################################################
                set PHASE=JOB01 - 10 - Load data
                rem ##################################################
                set num_phase=10
                set NOMTRAIT=LOAD
                %PERL% %PF_SKL_PROC%\\skl_infojob.pl "%PHASE%" "%NOMTRAIT%"

                """);
        assertThat(script.getContent()).doesNotContain("set nberr=0");
        assertThat(script.getStats().getPhasesGenerated()).isEqualTo(1);
        assertThat(script.getPhases()).containsExactly(10);
    }

    @Test
    void testPhaseMarkerNamingToolResetsErrorCounter() throws GenerationException {
        AssembledScript script = assemble(HEAD + "rem-TRI-Tri des fichiers sort\n");

        assertThat(script.getContent()).contains("""

                set nberr=0
                :STEP20
                rem ##################################################
                set PHASE=JOB01 - 20 - Tri des fichiers sort
                """);
        assertThat(script.getPhases()).containsExactly(10, 20);
    }

    @Test
    void testLegacyColumnMarkerOpensPhase() throws GenerationException {
        AssembledScript script = assemble("""
                JOB01.bat
                JDOE
                T
                D
                rem -EXTRACT-Extraction phase
                %FM_PROG%\\dbcheck.exe base
                """);

        assertThat(script.getPhases()).containsExactly(10);
        assertThat(script.getContent())
                .contains(":STEP10\n")
                .contains("set PHASE=JOB01 - 10 - Extraction phase\n")
                .contains("set NOMTRAIT=EXTRACT\n")
                .contains("%FM_PROG%\\dbcheck.exe base >> %JOURNAL% 2>&1 \n" + RETRY_10)
                .doesNotContain("goto STEP0\n");

        ValidationReport report = new JobScriptValidator().validate("JOB01.bat", script.getContent());
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    void testStartPhaseIsHonoured() throws GenerationException {
        AssembledScript script = assemble(HEAD + "rem #--NEXT-Second\n", config().startPhase(100).build());

        assertThat(script.getContent()).contains(":STEP100\n").contains(":STEP110\n");
        assertThat(script.getPhases()).containsExactly(100, 110);
    }

    @Test
    void testNegativeStartPhaseIsRejected() {
        assertThatThrownBy(() -> assemble(HEAD, config().startPhase(-10).build()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("-10")
                .extracting(e -> ((GenerationException) e).getKind())
                .isEqualTo(FailureKind.INVALID_CONFIGURATION);
    }

    @Test
    void testGrepToleratesExitCodeOne() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%PF_EXE%\\grep.exe -v x a.txt > b.txt\n");

        assertThat(script.getContent()).contains("""
                %PF_EXE%\\grep.exe -v x a.txt > b.txt 2>> %JOURNAL%
                if %errorlevel% LSS 2 goto finSTEP10
                if %errorlevel% GTR 1 set ERR=Erreur execution %NOMTRAIT% & set /a nberr = %nberr%+1
                if %nberr% EQU 1 call %PF_SCRIPT%\\sendMail.cmd %num_phase% %nom_job% & goto STEP10
                if %nberr% GTR 1 goto ERREUR
                :finSTEP10
                """);
        assertThat(script.getContent())
                .doesNotContain("%errorlevel% EQU 0")
                .doesNotContain("%errorlevel% NEQ 0");
        assertThat(script.getStats().getCommandsProcessed()).isEqualTo(1);
    }

    @Test
    void testDefaultExternalToolGetsStandardRetry() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%PF_EXE%\\sort.exe a.txt -o b.txt\n");

        assertThat(script.getContent()).contains("%PF_EXE%\\sort.exe a.txt -o b.txt 2>> %JOURNAL%\n" + RETRY_10);
    }

    @Test
    void testUnix2dosFailsFast() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%PF_EXE%\\unix2dos.exe out.txt\n");

        assertThat(script.getContent()).contains("%PF_EXE%\\unix2dos.exe out.txt 2>> %JOURNAL%\n" + FAIL_FAST);
    }

    @Test
    void testUniqPairSharesOneIntermediateLabel() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                %PF_EXE%\\uniq.exe a.txt b.txt
                %PF_EXE%\\uniq.exe -d b.txt c.txt
                """);

        assertThat(script.getContent()).contains("""
                %PF_EXE%\\uniq.exe a.txt b.txt 2>> %JOURNAL%
                if %errorlevel% EQU 0 goto STEP15
                if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & set /a nberr = %nberr%+1
                if %nberr% EQU 1 call %PF_SCRIPT%\\sendMail.cmd %num_phase% %nom_job% & goto STEP10
                if %nberr% GTR 1 goto ERREUR
                :STEP15
                %PF_EXE%\\uniq.exe -d b.txt c.txt 2>> %JOURNAL%
                if %errorlevel% EQU 0 goto finSTEP10
                if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & set /a nberr = %nberr%+1
                if %nberr% EQU 1 call %PF_SCRIPT%\\sendMail.cmd %num_phase% %nom_job% & goto STEP15
                if %nberr% GTR 1 goto ERREUR
                :finSTEP10

                """);
        assertThat(script.getContent().split(":STEP15\n", -1)).hasSize(2);
        assertThat(script.getStats().getCommandsProcessed()).isEqualTo(2);
        assertThat(script.getStats().getErrors()).isZero();
    }

    @Test
    void testUniqFollowedByOtherLineKeepsThatLine() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                %PF_EXE%\\uniq.exe a.txt b.txt
                echo done
                """);

        assertThat(script.getContent()).contains("%PF_EXE%\\uniq.exe a.txt b.txt 2>> %JOURNAL%\n" + RETRY_10 + "echo done\n");
        assertThat(script.getContent()).doesNotContain(":STEP15");
    }

    @Test
    void testUniqAtEndOfInputIsMalformed() {
        assertThatThrownBy(() -> assemble(HEAD + "%PF_EXE%\\uniq.exe a.txt b.txt\n"))
                .isInstanceOf(MalformedBlockException.class)
                .extracting(e -> ((GenerationException) e).getKind())
                .isEqualTo(FailureKind.MALFORMED_BLOCK);
    }

    @Test
    void testRetryableManagedCommandIsJournaled() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%FM_PROG%\\dbcheck.exe base\n");

        assertThat(script.getContent()).contains("%FM_PROG%\\dbcheck.exe base >> %JOURNAL% 2>&1 \n" + RETRY_10);
    }

    @Test
    void testPexportIsNotJournaled() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%FM_PROG%\\pexport.exe clients\n");

        assertThat(script.getContent()).contains("%FM_PROG%\\pexport.exe clients\n" + RETRY_10);
    }

    @Test
    void testPimportWithSeparatorFailsFast() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                %FM_PROG%\\pimport.exe clients,full
                %FM_PROG%\\pimport.exe orders
                """);

        assertThat(script.getContent())
                .contains("%FM_PROG%\\pimport.exe clients,full\n" + FAIL_FAST + "\n")
                .contains("%FM_PROG%\\pimport.exe orders\n" + RETRY_10);
    }

    @Test
    void testBalanceTestWithGreaterThanOneCode() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%FM_PROG%\\balance.exe -c 5100 x\n");

        assertThat(script.getContent()).contains("""
                %FM_PROG%\\balance.exe -c 5100 x >> %JOURNAL% 2>&1
                if %errorlevel% GTR 1 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR
                """);
    }

    @Test
    void testBalanceTestWithOtherCodeFailsFast() throws GenerationException {
        AssembledScript script = assemble(HEAD + "%FM_PROG%\\balance.exe -c 4200 x\n");

        assertThat(script.getContent()).contains("%FM_PROG%\\balance.exe -c 4200 x >> %JOURNAL% 2>&1\n" + FAIL_FAST + "\n");
    }

    @Test
    void testFileMoveJournalsSourceAndTarget() throws GenerationException {
        AssembledScript script = assemble(HEAD + "move a.txt b.txt\n");

        assertThat(script.getContent()).contains("""
                rem --------------------------------------------------
                rem Parametres de move
                echo Source :  a.txt >> %JOURNAL% 2>&1
                echo Cible :   b.txt >> %JOURNAL% 2>&1
                rem --------------------------------------------------

                move a.txt b.txt >> %JOURNAL% 2>&1

                """);
    }

    @Test
    void testFileMoveWithoutOperandsIsKeptAsIs() throws GenerationException {
        AssembledScript script = assemble(HEAD + "copy a.txt\n");

        assertThat(script.getContent()).contains("\ncopy a.txt\n").doesNotContain("rem Parametres de copy");
        assertThat(script.getStats().getErrors()).isEqualTo(1);
    }

    @Test
    void testMultiLineLoopGuardsEachBodyCommand() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                for %%f in (*.txt) do (
                rem inner
                %PF_EXE%\\gawk.exe -f x.awk %%f
                )
                """);

        assertThat(script.getContent()).contains("""
                for %%f in (*.txt) do (
                rem inner
                %PF_EXE%\\gawk.exe -f x.awk %%f 2>> %JOURNAL%
                if %errorlevel% GTR 1 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR
                )
                """);
    }

    @Test
    void testSingleLineLoopIsVerbatim() throws GenerationException {
        AssembledScript script = assemble(HEAD + "for %%f in (*.tmp) do echo %%f\necho after\n");

        assertThat(script.getContent()).contains("\nfor %%f in (*.tmp) do echo %%f\necho after\n");
    }

    @Test
    void testUnclosedLoopIsMalformed() {
        assertThatThrownBy(() -> assemble(HEAD + "for %%f in (*.txt) do (\necho %%f\n"))
                .isInstanceOf(MalformedBlockException.class);
    }

    @Test
    void testPassThroughCategories() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                forfiles /p %D% /m *.tmp /d -7 /c "cmd /c del @file"
                del old.txt
                call %PF_SCRIPT%\\purge.cmd
                set X=1
                cd %D%
                """);

        assertThat(script.getContent()).contains("""
                forfiles /p %D% /m *.tmp /d -7 /c "cmd /c del @file" >> %JOURNAL% 2>&1

                del old.txt >> %JOURNAL% 2>&1
                call %PF_SCRIPT%\\purge.cmd
                if %errorlevel% NEQ 0 set ERR=Erreur execution %NOMTRAIT% & goto ERREUR

                set X=1
                cd %D%
                """);
    }

    @Test
    void testNotifierCalls() throws GenerationException {
        AssembledScript script = assemble(HEAD + """
                %PERL% %PF_SCRIPT%\\sendmail.pl ops
                %PERL% %PF_SCRIPT%\\archive.pl
                """);

        assertThat(script.getContent())
                .contains("%PERL% %PF_SCRIPT%\\sendmail.pl ops >> %JOURNAL% 2>&1\n" + RETRY_10)
                .contains("%PERL% %PF_SCRIPT%\\archive.pl >> %JOURNAL% 2>&1\n" + FAIL_FAST + "\n");
    }

    @Test
    void testCommentsPassThroughUnlessStripped() throws GenerationException {
        String source = HEAD + "rem plain note\nrem keep-this-one\n";

        assertThat(assemble(source).getContent()).contains("\nrem plain note\nrem keep-this-one\n");

        String stripped = assemble(source, config().stripComments(true).build()).getContent();
        assertThat(stripped).doesNotContain("rem plain note").contains("\nrem keep-this-one\n");
    }

    @Test
    void testMalformedMarkerDegradesToComment() throws GenerationException {
        AssembledScript script = assemble(HEAD + "rem-ONLYONE\n");

        assertThat(script.getContent()).contains("\nrem-ONLYONE\n");
        assertThat(script.getPhases()).containsExactly(10);
        assertThat(script.getStats().getErrors()).isEqualTo(1);
    }

    @Test
    void testEndToEndExtract() throws GenerationException {
        String source = """
                job.bat
                JDOE
                Daily Extract
                Runs nightly extract
                rem #--EXTRACT-Extraction phase
                %FM_PROG%\\extract.exe
                """;

        AssembledScript script = assemble(source, config().startPhase(10).build());

        assertThat(script.getContent()).containsSubsequence(
                "@echo off\n",
                "rem #-- Nom     : job\n",
                "rem #-- Auteur  : JDOE\n",
                "rem #-- Objet   : Daily Extract\n",
                "rem #--           Runs nightly extract\n",
                "set nom_job=job\n",
                "%PERL% %PF_SKL_PROC%\\skl_debutjob.pl\n",
                ":STEP10\n",
                "set NOMTRAIT=EXTRACT\n",
                "%PERL% %PF_SKL_PROC%\\skl_infojob.pl \"%PHASE%\" \"%NOMTRAIT%\"\n",
                "%FM_PROG%\\extract.exe >> %JOURNAL% 2>&1\n" + FAIL_FAST,
                "set PHASE=99 - Fin du job\n",
                ":ERREUR\n",
                ":FIN\n");
        assertThat(script.getContent()).endsWith(":FIN\n%EXIT% 0\n\n");
        assertThat(script.getContent()).doesNotContain("goto finSTEP10");
        assertThat(script.getStats().getPhasesGenerated()).isEqualTo(1);
        assertThat(script.getStats().getCommandsProcessed()).isEqualTo(1);

        ValidationReport report = new JobScriptValidator().validate("job.bat", script.getContent());
        assertThat(report.isValid()).isTrue();
        assertThat(report.getWarnings()).isEmpty();
    }

    @Test
    void testZeroBodySourceIsComplete() throws GenerationException {
        AssembledScript script = assemble("EMPTY.bat\nJDOE\nTitle\nDescription\n");

        assertThat(script.getStats().getPhasesGenerated()).isZero();
        assertThat(script.getStats().getCommandsProcessed()).isZero();
        assertThat(script.getPhases()).isEmpty();
        assertThat(script.getContent()).startsWith("@echo off\n").endsWith(":FIN\n%EXIT% 0\n\n");
        assertThat(new JobScriptValidator().validate("EMPTY.bat", script.getContent()).isValid()).isTrue();
    }

    @Test
    void testHeaderOnlyJobNameUsesDefaults() throws GenerationException {
        AssembledScript script = assemble("ALONE.bat\n");

        assertThat(script.getContent()).contains("rem #-- Auteur  : UNKNOWN\n");
        assertThat(script.getHeader().getTitle()).isEmpty();
    }

    @Test
    void testLightweightJobSkipsInitialization() throws GenerationException {
        AssembledScript script = assemble("LIGHT.cmd\nJDOE\nT\nD\nrem #--RUN-Run\n");

        assertThat(script.getContent())
                .doesNotContain("skl_debutjob.pl")
                .doesNotContain("set nom_job=")
                .contains("skl_finjob.pl")
                .contains(":STEP10\n");
    }

    @Test
    void testCrlfLineEndings() throws GenerationException {
        String content = assemble(HEAD + "echo x\n", config().lineEnding(LineEnding.CRLF).build()).getContent();

        assertThat(content).contains("\r\n:STEP10\r\n");
        assertThat(content.replace("\r\n", "")).doesNotContain("\n").doesNotContain("\r");
    }

    @Test
    void testIdempotentForSameInputAndMetadata() throws GenerationException {
        String source = HEAD + """
                %PF_EXE%\\uniq.exe a b
                %PF_EXE%\\uniq.exe -d b c
                rem #--NEXT-Next step cat
                %FM_PROG%\\keybuild.exe idx
                move a b
                """;

        assertThat(assemble(source).getContent()).isEqualTo(assemble(source).getContent());
    }

    @Test
    void testLineCountMatchesContent() throws GenerationException {
        AssembledScript script = assemble(HEAD + "echo x\n");

        long newlines = script.getContent().chars().filter(c -> c == '\n').count();
        assertThat(script.getLineCount()).isEqualTo((int) newlines);
    }
}
