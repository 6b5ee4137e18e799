package com.batchjob.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.cli.exception.OptionsValidationException;
import com.batchjob.generator.cli.model.GenerateOptions;
import com.batchjob.generator.cli.model.ValidatedGenerateOptions;
import com.batchjob.generator.cli.output.GenerateResultsPrinter;
import com.batchjob.generator.cli.validation.GenerateOptionsValidator;
import com.batchjob.generator.codegen.GeneratorResult;
import com.batchjob.generator.codegen.JobGenerator;
import com.batchjob.generator.codegen.model.core.context.GeneratorConfig;
import com.batchjob.generator.codegen.model.core.context.LineEnding;
import com.batchjob.generator.logging.LoggingConfigurator;
import com.batchjob.generator.validation.JobScriptValidator;
import com.batchjob.generator.validation.ValidationReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Transforms a job description into a scaffolded batch script."
)
public class GenerateCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            LoggingConfigurator.enableVerbose();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getOptionErrors().forEach(err -> log.error("Invalid option {}: {}", err.getOption(), err.getMessage()));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        GeneratorResult result = new JobGenerator(buildConfig(validated)).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILED;
        }
        printer.printSuccess(result);

        if (options.isValidate()) {
            ValidationReport report = new JobScriptValidator(validated.getOutputCharset(), validated.getFallbackCharset())
                    .validate(result.getOutputPath());
            printer.printValidation(report);
            if (!report.isValid()) {
                return EXIT_FAILED;
            }
        }
        return EXIT_OK;
    }

    private GeneratorConfig buildConfig(ValidatedGenerateOptions v) {
        GeneratorConfig.GeneratorConfigBuilder builder = GeneratorConfig.builder()
                .inputPath(v.getInputPath())
                .outputPath(v.getOutputPath())
                .startPhase(options.getStartPhase())
                .inputCharset(v.getInputCharset())
                .fallbackCharset(v.getFallbackCharset())
                .outputCharset(v.getOutputCharset())
                .lineEnding(options.isCrlf() ? LineEnding.CRLF : LineEnding.LF)
                .stripComments(options.isStripComments())
                .force(options.isForce());
        if (options.getDate() != null) {
            builder.date(options.getDate());
        }
        if (options.getUser() != null) {
            builder.user(options.getUser());
        }
        return builder.build();
    }
}
