package com.batchjob.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.cli.model.GenerateOptions;
import com.batchjob.generator.cli.model.ValidatedGenerateOptions;
import com.batchjob.generator.codegen.GeneratorResult;
import com.batchjob.generator.validation.ValidationReport;

/**
 * Responsible only for printing CLI output for the "generate" and "validate" commands.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Batch Job Generator");
        log.info("=================================================");
        log.info("Input: {}", v.getInputPath());
        log.info("Output: {}", v.getOutputPath());
        log.info("Start Phase: {}", o.getStartPhase() == 0 ? "default" : o.getStartPhase());
        log.info("Encoding: {} (fallback {})", v.getInputCharset(), v.getFallbackCharset());
        log.info("Output Encoding: {}{}", v.getOutputCharset(), o.isCrlf() ? ", CRLF" : "");
        if (o.isStripComments()) {
            log.info("Plain comments: stripped");
        }
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Job: {}", result.getJobName());
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Source Charset: {}", result.getInputCharset());
        log.info("Phases Generated: {}", result.getPhasesGenerated());
        log.info("Commands Processed: {}", result.getCommandsProcessed());
        log.info("Script Lines: {}", result.getScriptLines());
        if (result.getErrors() > 0) {
            log.warn("Degraded Constructs: {}", result.getErrors());
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }

    public void printValidation(ValidationReport report) {
        log.info("");
        log.info("=================================================");
        log.info(report.isValid() ? "VALIDATION PASSED" : "VALIDATION FAILED");
        log.info("=================================================");
        log.info("File: {}", report.getFileName());
        log.info("Lines: {}", report.getLineCount());
        log.info("Phases: {}", report.getPhaseCount());
        log.info("Errorlevel Checks: {}", report.getErrorlevelChecks());
        report.getErrors().forEach(e -> log.error("  {}", e));
        report.getWarnings().forEach(w -> log.warn("  {}", w));
        log.info("=================================================");
    }
}
