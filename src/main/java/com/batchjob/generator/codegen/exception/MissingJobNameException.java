package com.batchjob.generator.codegen.exception;

public class MissingJobNameException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public MissingJobNameException(String sourceName) {
        super(FailureKind.MISSING_JOB_NAME, "Source holds no job file name line", sourceName, 0, null);
    }
}
