package com.batchjob.generator.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path inputPath;
    Path outputPath;
    Charset inputCharset;
    Charset fallbackCharset;
    Charset outputCharset;
}
