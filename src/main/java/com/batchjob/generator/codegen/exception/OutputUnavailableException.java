package com.batchjob.generator.codegen.exception;

public class OutputUnavailableException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public OutputUnavailableException(String message, String sourceName, Throwable cause) {
        super(FailureKind.OUTPUT_UNAVAILABLE, message, sourceName, 0, cause);
    }
}
