package com.batchjob.generator.codegen.emit.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.parser.PhaseMarkerParser;

/**
 * Inert comments, including phase markers whose fields could not be parsed.
 */
public class CommentHandler implements LineHandler {
    private static final Logger log = LoggerFactory.getLogger(CommentHandler.class);

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) {
        String text = line.getText();

        if (PhaseMarkerParser.looksLikeMarker(text)) {
            log.warn("Line {}: phase marker '{}' lacks a treatment or label, kept as a comment",
                    line.getLine().getLineNumber(), text);
            scope.stats().recordError();
        } else if (scope.getContext().getConfig().isStripComments() && PhaseMarkerParser.countHyphens(text) < 2) {
            return;
        }
        scope.getOut().line(text);
    }
}
