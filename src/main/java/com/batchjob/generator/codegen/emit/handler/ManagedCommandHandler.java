package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.JOURNAL;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.CommandVocabulary;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScaffoldEmitter;
import com.batchjob.generator.codegen.emit.ScriptWriter;

/**
 * Programs run from the processing root.
 */
public class ManagedCommandHandler implements LineHandler {

    private final ScaffoldEmitter scaffold;

    public ManagedCommandHandler(ScaffoldEmitter scaffold) {
        this.scaffold = scaffold;
    }

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) {
        ScriptWriter out = scope.getOut();
        String text = line.getText();
        int phase = scope.phases().previousPhase();

        switch (line.getManagedFamily()) {
            case RETRYABLE -> {
                if (text.contains(CommandVocabulary.UNJOURNALED_RETRYABLE)) {
                    out.line(text);
                } else {
                    out.line(text + JOURNAL + " ");
                }
                scaffold.retry(out, phase);
            }
            case PIMPORT -> {
                out.line(text);
                if (text.indexOf(',') < 0) {
                    scaffold.retry(out, phase);
                } else {
                    scaffold.failFast(out);
                    out.blank();
                }
            }
            case BALANCE_TEST -> {
                out.line(text + JOURNAL);
                if (hasGreaterThanOneCode(text)) {
                    scaffold.failFastGreaterThanOne(out);
                } else {
                    scaffold.failFast(out);
                    out.blank();
                }
            }
        }
        scope.stats().recordCommand();
    }

    /**
     * Balance tests carry their test code in a fixed column range of the source line.
     */
    static boolean hasGreaterThanOneCode(String text) {
        if (text.length() <= CommandVocabulary.BALANCE_CODE_END) {
            return false;
        }
        String code = text.substring(CommandVocabulary.BALANCE_CODE_START, CommandVocabulary.BALANCE_CODE_END);
        return CommandVocabulary.BALANCE_GTR_CODES.contains(code);
    }
}
