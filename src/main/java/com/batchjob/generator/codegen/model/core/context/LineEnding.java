package com.batchjob.generator.codegen.model.core.context;

/**
 * Line terminator used in the generated script.
 */
public enum LineEnding {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }
}
