package com.batchjob.generator.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command; does nothing by itself but list its subcommands.
 */
@Command(
        name = "jobgen",
        mixinStandardHelpOptions = true,
        version = "batch-job-generator 1.0.0",
        description = "Generates scaffolded batch job scripts from line-oriented job descriptions.",
        subcommands = {
                GenerateCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class JobGeneratorCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
