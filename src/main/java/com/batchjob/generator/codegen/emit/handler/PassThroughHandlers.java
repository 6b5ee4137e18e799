package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.JOURNAL;

import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScaffoldEmitter;

/**
 * Handlers for categories that need at most one trailing check.
 */
public final class PassThroughHandlers {

    private PassThroughHandlers() {
        // factory methods only
    }

    public static LineHandler verbatim() {
        return (line, scope) -> scope.getOut().line(line.getText());
    }

    /**
     * Output journaled, no failure check.
     */
    public static LineHandler journaled(boolean trailingBlank) {
        return (line, scope) -> {
            scope.getOut().line(line.getText() + JOURNAL);
            if (trailingBlank) {
                scope.getOut().blank();
            }
        };
    }

    /**
     * Line followed by an unconditional abort on failure.
     */
    public static LineHandler guarded(ScaffoldEmitter scaffold) {
        return (line, scope) -> {
            scope.getOut().line(line.getText());
            scaffold.failFast(scope.getOut());
            scope.getOut().blank();
            scope.stats().recordCommand();
        };
    }
}
