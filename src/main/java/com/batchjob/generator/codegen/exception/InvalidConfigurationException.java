package com.batchjob.generator.codegen.exception;

public class InvalidConfigurationException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message, String sourceName) {
        super(FailureKind.INVALID_CONFIGURATION, message, sourceName, 0, null);
    }
}
