package com.batchjob.generator.codegen.emit.handler;

import static com.batchjob.generator.codegen.emit.ScaffoldEmitter.ERROR_JOURNAL;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.ExternalToolFamily;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScaffoldEmitter;
import com.batchjob.generator.codegen.emit.ScriptWriter;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.phase.PhaseAllocator;
import com.batchjob.generator.codegen.scan.PairedLineScanner;

/**
 * Unix-like executables. Stderr is journaled; the scaffold depends on the tool family.
 */
public class ExternalToolHandler implements LineHandler {
    private static final Logger log = LoggerFactory.getLogger(ExternalToolHandler.class);

    private final ScaffoldEmitter scaffold;
    private final PairedLineScanner pairScanner;

    public ExternalToolHandler(ScaffoldEmitter scaffold, PairedLineScanner pairScanner) {
        this.scaffold = scaffold;
        this.pairScanner = pairScanner;
    }

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) throws GenerationException {
        ScriptWriter out = scope.getOut();
        int phase = scope.phases().previousPhase();

        out.line(line.getText() + ERROR_JOURNAL);
        switch (line.getToolFamily()) {
            case GREP -> scaffold.tolerantRetry(out, phase);
            case UNIQ -> handleUniq(line, scope, phase);
            case UNIX2DOS_TOUCH -> scaffold.failFast(out);
            default -> scaffold.retry(out, phase);
        }
        scope.stats().recordCommand();
    }

    private void handleUniq(ClassifiedLine first, EmissionScope scope, int phase) throws GenerationException {
        Optional<ClassifiedLine> partner = pairScanner.scanPartner(first.getLine(), ExternalToolFamily.UNIQ, scope.getCursor());
        if (partner.isEmpty()) {
            scaffold.retry(scope.getOut(), phase);
            return;
        }

        PhaseAllocator phases = scope.phases();
        if (phases.isIntermediateIssued()) {
            log.warn("Intermediate label {} reused by the uniq pair at line {}",
                    phases.current() - PhaseAllocator.INTERMEDIATE_OFFSET, first.getLine().getLineNumber());
            scope.stats().recordError();
        }
        int intermediate = phases.intermediateLabel();

        ScriptWriter out = scope.getOut();
        scaffold.branchToIntermediate(out, phase, intermediate);
        out.line(partner.get().getText() + ERROR_JOURNAL);
        scaffold.retry(out, phase, intermediate);
        scope.stats().recordCommand();
    }
}
