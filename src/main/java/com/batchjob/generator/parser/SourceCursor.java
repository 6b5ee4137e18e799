package com.batchjob.generator.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Optional;

import com.batchjob.generator.codegen.exception.InputUnavailableException;
import com.batchjob.generator.codegen.model.input.SourceLine;

/**
 * Forward-only reader over a job description.
 *
 * Blank lines are skipped and every returned line is trimmed. The cursor is owned by the
 * assembler and lent to whichever scanner needs lookahead; a scanner that reads a line it
 * does not consume must hand it back through {@link #pushBack(SourceLine)} so the main loop
 * sees it next.
 */
public class SourceCursor {

    private final BufferedReader reader;
    private final String sourceName;

    private SourceLine pending;
    private int physicalLine = 0;
    private int lastReturnedLine = 0;

    public SourceCursor(Reader reader, String sourceName) {
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        this.sourceName = sourceName;
    }

    /**
     * @return the next non-blank trimmed line, or empty once the source is exhausted
     */
    public Optional<SourceLine> next() throws InputUnavailableException {
        if (pending != null) {
            SourceLine line = pending;
            pending = null;
            lastReturnedLine = line.getLineNumber();
            return Optional.of(line);
        }
        try {
            String raw;
            while ((raw = reader.readLine()) != null) {
                physicalLine++;
                String trimmed = raw.strip();
                if (!trimmed.isEmpty()) {
                    lastReturnedLine = physicalLine;
                    return Optional.of(new SourceLine(trimmed, physicalLine));
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new InputUnavailableException("Read failure: " + e.getMessage(), sourceName, physicalLine, e);
        }
    }

    /**
     * Returns a line obtained from {@link #next()} so that the following call yields it again.
     * Only one line can be pending at a time.
     */
    public void pushBack(SourceLine line) {
        if (pending != null) {
            throw new IllegalStateException("A line is already pending at line " + pending.getLineNumber());
        }
        pending = line;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Physical line number of the most recently returned line, 0 before the first read.
     */
    public int getLastLineNumber() {
        return lastReturnedLine;
    }
}
