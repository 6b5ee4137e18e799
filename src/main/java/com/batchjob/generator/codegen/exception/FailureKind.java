package com.batchjob.generator.codegen.exception;

/**
 * Fatal failure categories of a generation run.
 */
public enum FailureKind {

    /**
     * Source cannot be opened, read or decoded.
     */
    INPUT_UNAVAILABLE,

    /**
     * Destination cannot be created or written.
     */
    OUTPUT_UNAVAILABLE,

    /**
     * A multi-line construct ran into end of input before it was closed.
     */
    MALFORMED_BLOCK,

    /**
     * The source holds no job file name line.
     */
    MISSING_JOB_NAME,

    /**
     * Run settings are out of range, such as a negative start phase.
     */
    INVALID_CONFIGURATION
}
