package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.JOURNAL;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScriptWriter;

/**
 * move and copy: source and destination are journaled before the command runs.
 */
public class FileMoveHandler implements LineHandler {
    private static final Logger log = LoggerFactory.getLogger(FileMoveHandler.class);

    public static final String SEPARATOR = "rem --------------------------------------------------";

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) {
        ScriptWriter out = scope.getOut();
        String text = line.getText();
        String[] tokens = text.split("\\s+");

        if (tokens.length < 3) {
            log.warn("Line {}: '{}' has no source and destination, written as is",
                    line.getLine().getLineNumber(), text);
            scope.stats().recordError();
            out.line(text);
            return;
        }

        String verb = text.substring(0, 4).strip();
        out.line(SEPARATOR);
        out.line("rem Parametres de " + verb);
        out.line("echo Source :  " + tokens[1] + JOURNAL);
        out.line("echo Cible :   " + tokens[2] + JOURNAL);
        out.line(SEPARATOR);
        out.blank();
        out.line(text + JOURNAL);
        out.blank();

        scope.stats().recordCommand();
    }
}
