package com.batchjob.generator.codegen.exception;

import lombok.Getter;

/**
 * Base class for every fatal condition raised while generating a job script.
 * Carries the source name and the last physical line number read, so callers can
 * point the operator at the offending spot.
 */
@Getter
public abstract class GenerationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;
    private final String sourceName;
    private final int lineNumber;

    protected GenerationException(FailureKind kind, String message, String sourceName, int lineNumber, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    /**
     * Message decorated with source and line, suitable for logs and CLI output.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(getMessage());
        if (sourceName != null) {
            sb.append(" [source=").append(sourceName);
            if (lineNumber > 0) {
                sb.append(", line=").append(lineNumber);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
