package com.batchjob.generator.codegen.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.MalformedBlockException;
import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.parser.SourceCursor;

/**
 * Collects the body of a bracketed loop.
 *
 * An opener whose '(' and ')' counts differ starts a block that ends at the first line
 * consisting of ")" alone. Running out of input first is fatal.
 */
public class LoopBlockScanner {

    public static final String CLOSE_MARKER = ")";

    public LoopBlock scan(SourceLine opener, SourceCursor cursor) throws GenerationException {
        if (isBalanced(opener.getText())) {
            return new LoopBlock(opener, List.of(), null);
        }

        List<SourceLine> body = new ArrayList<>();
        while (true) {
            Optional<SourceLine> next = cursor.next();
            if (next.isEmpty()) {
                throw new MalformedBlockException(
                        "Loop opened at line " + opener.getLineNumber() + " is never closed",
                        cursor.getSourceName(), opener.getLineNumber());
            }
            SourceLine line = next.get();
            if (CLOSE_MARKER.equals(line.getText())) {
                return new LoopBlock(opener, List.copyOf(body), line);
            }
            body.add(line);
        }
    }

    static boolean isBalanced(String text) {
        int open = 0;
        int close = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')') {
                close++;
            }
        }
        return open == close;
    }
}
