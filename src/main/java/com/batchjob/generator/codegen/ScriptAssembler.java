package com.batchjob.generator.codegen;

import java.io.Reader;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.LineClassifier;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineDispatcher;
import com.batchjob.generator.codegen.emit.ScriptWriter;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.InvalidConfigurationException;
import com.batchjob.generator.codegen.model.core.context.GenerationContext;
import com.batchjob.generator.codegen.model.core.context.GeneratorConfig;
import com.batchjob.generator.codegen.model.input.JobHeader;
import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.codegen.template.ScriptTemplateRenderer;
import com.batchjob.generator.parser.JobHeaderReader;
import com.batchjob.generator.parser.SourceCursor;

/**
 * Turns a job description into a complete batch script.
 *
 * The document is built in order: header, initialization block (skipped for lightweight
 * jobs), one dispatch per body line, trailer. All run state lives in a fresh
 * {@link GenerationContext}, so one assembler can serve concurrent runs.
 */
public class ScriptAssembler {
    private static final Logger log = LoggerFactory.getLogger(ScriptAssembler.class);

    enum State {
        HEADER, INITIALIZATION, BODY, TRAILER, DONE
    }

    private final LineClassifier classifier;
    private final LineDispatcher dispatcher;
    private final ScriptTemplateRenderer renderer;
    private final JobHeaderReader headerReader;

    public ScriptAssembler() {
        this(new LineClassifier(), new ScriptTemplateRenderer());
    }

    public ScriptAssembler(LineClassifier classifier, ScriptTemplateRenderer renderer) {
        this.classifier = classifier;
        this.dispatcher = new LineDispatcher(classifier);
        this.renderer = renderer;
        this.headerReader = new JobHeaderReader();
    }

    public AssembledScript assemble(Reader source, GeneratorConfig config) throws GenerationException {
        if (config.getStartPhase() < 0) {
            throw new InvalidConfigurationException(
                    "Start phase must be >= 0, got " + config.getStartPhase(), config.getSourceName());
        }
        SourceCursor cursor = new SourceCursor(source, config.getSourceName());
        ScriptWriter out = new ScriptWriter(config.getLineEnding());

        GenerationContext context = null;
        State state = State.HEADER;
        while (state != State.DONE) {
            switch (state) {
                case HEADER -> {
                    JobHeader header = headerReader.read(cursor);
                    context = new GenerationContext(config, header);
                    out.block(renderer.renderHeader(header, config));
                    log.debug("Header read for job {} by {}", header.getJobFileName(), header.getAuthor());
                    state = header.isLightweight() ? State.BODY : State.INITIALIZATION;
                }
                case INITIALIZATION -> {
                    out.block(renderer.renderInitialization(context.getHeader()));
                    state = State.BODY;
                }
                case BODY -> {
                    Optional<SourceLine> next = cursor.next();
                    if (next.isEmpty()) {
                        state = State.TRAILER;
                    } else {
                        ClassifiedLine line = classifier.classify(next.get());
                        dispatcher.dispatch(line, new EmissionScope(context, cursor, out));
                    }
                }
                case TRAILER -> {
                    out.block(renderer.renderTrailer());
                    state = State.DONE;
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }

        log.debug("Assembled {}: {}", config.getSourceName(), context.getStats());
        return AssembledScript.builder()
                .content(out.toString())
                .header(context.getHeader())
                .stats(context.getStats())
                .phases(List.copyOf(context.getPhases().getPrimaryPhases()))
                .lineCount(out.getLineCount())
                .build();
    }
}
