package com.batchjob.generator.codegen.exception;

public class InputUnavailableException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public InputUnavailableException(String message, String sourceName, int lineNumber, Throwable cause) {
        super(FailureKind.INPUT_UNAVAILABLE, message, sourceName, lineNumber, cause);
    }

    public InputUnavailableException(String message, String sourceName, Throwable cause) {
        this(message, sourceName, 0, cause);
    }
}
