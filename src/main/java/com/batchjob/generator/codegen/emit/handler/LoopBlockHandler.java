package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.ERROR_JOURNAL;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScaffoldEmitter;
import com.batchjob.generator.codegen.emit.ScriptWriter;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.codegen.scan.LoopBlock;
import com.batchjob.generator.codegen.scan.LoopBlockScanner;

/**
 * for loops. Each body command gets its stderr journaled and an abort on exit code above 1.
 */
public class LoopBlockHandler implements LineHandler {

    private final ScaffoldEmitter scaffold;
    private final LoopBlockScanner scanner;

    public LoopBlockHandler(ScaffoldEmitter scaffold, LoopBlockScanner scanner) {
        this.scaffold = scaffold;
        this.scanner = scanner;
    }

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) throws GenerationException {
        LoopBlock block = scanner.scan(line.getLine(), scope.getCursor());
        ScriptWriter out = scope.getOut();

        out.line(block.getOpener().getText());
        if (!block.isMultiLine()) {
            return;
        }
        for (SourceLine inner : block.getBody()) {
            if (inner.lower().startsWith("rem")) {
                out.line(inner.getText());
            } else {
                out.line(inner.getText() + ERROR_JOURNAL);
                scaffold.failFastGreaterThanOne(out);
            }
        }
        out.line(block.getCloser().getText());
    }
}
