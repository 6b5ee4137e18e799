package com.batchjob.generator.codegen.emit;

import java.util.EnumMap;
import java.util.Map;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.LineCategory;
import com.batchjob.generator.classify.LineClassifier;
import com.batchjob.generator.codegen.emit.handler.CommentHandler;
import com.batchjob.generator.codegen.emit.handler.ExternalToolHandler;
import com.batchjob.generator.codegen.emit.handler.FileMoveHandler;
import com.batchjob.generator.codegen.emit.handler.LoopBlockHandler;
import com.batchjob.generator.codegen.emit.handler.ManagedCommandHandler;
import com.batchjob.generator.codegen.emit.handler.NotifierCallHandler;
import com.batchjob.generator.codegen.emit.handler.PassThroughHandlers;
import com.batchjob.generator.codegen.emit.handler.PhaseMarkerHandler;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.scan.LoopBlockScanner;
import com.batchjob.generator.codegen.scan.PairedLineScanner;

/**
 * Routes each classified line to the handler of its category.
 */
public class LineDispatcher {

    private final Map<LineCategory, LineHandler> handlers = new EnumMap<>(LineCategory.class);

    public LineDispatcher(LineClassifier classifier) {
        this(classifier, new ScaffoldEmitter());
    }

    public LineDispatcher(LineClassifier classifier, ScaffoldEmitter scaffold) {
        handlers.put(LineCategory.PHASE_MARKER, new PhaseMarkerHandler());
        handlers.put(LineCategory.COMMENT, new CommentHandler());
        handlers.put(LineCategory.MANAGED_COMMAND, new ManagedCommandHandler(scaffold));
        handlers.put(LineCategory.EXTERNAL_TOOL_COMMAND,
                new ExternalToolHandler(scaffold, new PairedLineScanner(classifier)));
        handlers.put(LineCategory.FILE_ENUMERATION, PassThroughHandlers.journaled(true));
        handlers.put(LineCategory.LOOP_OPEN, new LoopBlockHandler(scaffold, new LoopBlockScanner()));
        handlers.put(LineCategory.SIMPLE_DIRECTIVE, PassThroughHandlers.verbatim());
        handlers.put(LineCategory.CALL_OR_PATH_LITERAL, PassThroughHandlers.guarded(scaffold));
        handlers.put(LineCategory.FILE_MOVE, new FileMoveHandler());
        handlers.put(LineCategory.FILE_DELETE, PassThroughHandlers.journaled(false));
        handlers.put(LineCategory.NOTIFIER_CALL, new NotifierCallHandler(scaffold));
        handlers.put(LineCategory.OPAQUE, PassThroughHandlers.verbatim());

        for (LineCategory category : LineCategory.values()) {
            if (!handlers.containsKey(category)) {
                throw new IllegalStateException("No handler registered for " + category);
            }
        }
    }

    public void dispatch(ClassifiedLine line, EmissionScope scope) throws GenerationException {
        handlers.get(line.getCategory()).handle(line, scope);
    }
}
