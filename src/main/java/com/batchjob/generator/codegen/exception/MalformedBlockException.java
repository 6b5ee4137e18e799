package com.batchjob.generator.codegen.exception;

/**
 * Raised when a loop block or a uniq pair hits end of input before it is complete.
 * A truncated block cannot be re-emitted safely, so the whole run is abandoned.
 */
public class MalformedBlockException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public MalformedBlockException(String message, String sourceName, int lineNumber) {
        super(FailureKind.MALFORMED_BLOCK, message, sourceName, lineNumber, null);
    }
}
