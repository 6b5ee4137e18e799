package com.batchjob.generator;

import com.batchjob.generator.cli.JobGeneratorCommand;

import picocli.CommandLine;

/**
 * Main entry point for the Batch Job Generator.
 * Turns line-oriented job descriptions into scaffolded batch scripts with numbered
 * phases, retry gates and a uniform error trailer.
 */
public class JobGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JobGeneratorCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
