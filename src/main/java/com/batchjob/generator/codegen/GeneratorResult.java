package com.batchjob.generator.codegen;

import java.nio.charset.Charset;
import java.nio.file.Path;

import com.batchjob.generator.codegen.exception.FailureKind;

import lombok.Builder;
import lombok.Data;

/**
 * Result of one job generation run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private FailureKind failureKind;
    private String errorMessage;
    private Path outputPath;

    private String jobName;
    private int phasesGenerated;
    private int commandsProcessed;
    private int errors;
    private int scriptLines;
    private Charset inputCharset;

    public static GeneratorResult failure(FailureKind kind, String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .failureKind(kind)
                .errorMessage(errorMessage)
                .build();
    }
}
