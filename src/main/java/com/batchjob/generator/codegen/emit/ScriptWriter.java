package com.batchjob.generator.codegen.emit;

import com.batchjob.generator.codegen.model.core.context.LineEnding;

/**
 * In-memory sink for the generated script. Nothing reaches the destination until the
 * whole document has been assembled.
 */
public class ScriptWriter {

    private final StringBuilder buffer = new StringBuilder(8192);
    private final String separator;
    private int lineCount;

    public ScriptWriter(LineEnding lineEnding) {
        this.separator = lineEnding.separator();
    }

    public ScriptWriter line(String text) {
        buffer.append(text).append(separator);
        lineCount++;
        return this;
    }

    public ScriptWriter blank() {
        return line("");
    }

    /**
     * Appends pre-rendered text whose lines are separated by '\n', converting the
     * separators to the configured line ending.
     */
    public ScriptWriter block(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                continue;
            }
            if (c == '\n') {
                buffer.append(separator);
                lineCount++;
            } else {
                buffer.append(c);
            }
        }
        return this;
    }

    public int getLineCount() {
        return lineCount;
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
