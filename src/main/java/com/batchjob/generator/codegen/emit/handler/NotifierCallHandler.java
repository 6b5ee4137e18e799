package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.JOURNAL;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.CommandVocabulary;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScaffoldEmitter;
import com.batchjob.generator.codegen.emit.ScriptWriter;

/**
 * Calls into the messaging engine. Mail sending is retried once, anything else fails fast.
 */
public class NotifierCallHandler implements LineHandler {

    private final ScaffoldEmitter scaffold;

    public NotifierCallHandler(ScaffoldEmitter scaffold) {
        this.scaffold = scaffold;
    }

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) {
        ScriptWriter out = scope.getOut();
        out.line(line.getText() + JOURNAL);
        if (line.getLine().lower().contains(CommandVocabulary.SEND_MAIL)) {
            scaffold.retry(out, scope.phases().previousPhase());
        } else {
            scaffold.failFast(out);
            out.blank();
        }
    }
}
