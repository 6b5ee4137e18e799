package com.batchjob.generator.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.batchjob.generator.cli.output.GenerateResultsPrinter;
import com.batchjob.generator.validation.JobScriptValidator;
import com.batchjob.generator.validation.ValidationReport;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Checks the structure of a generated job script."
)
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Generated script to check")
    private Path script;

    @Override
    public Integer call() {
        ValidationReport report = new JobScriptValidator().validate(script);
        new GenerateResultsPrinter().printValidation(report);
        return report.isValid() ? GenerateCommand.EXIT_OK : GenerateCommand.EXIT_FAILED;
    }
}
