package com.batchjob.generator.codegen.emit;

import com.batchjob.generator.codegen.model.core.context.GenerationContext;
import com.batchjob.generator.codegen.model.core.context.GenerationStats;
import com.batchjob.generator.codegen.phase.PhaseAllocator;
import com.batchjob.generator.parser.SourceCursor;

import lombok.NonNull;
import lombok.Value;

/**
 * What a handler gets to work with: the run context, the borrowed source cursor and the output.
 */
@Value
public class EmissionScope {

    @NonNull
    GenerationContext context;

    @NonNull
    SourceCursor cursor;

    @NonNull
    ScriptWriter out;

    public PhaseAllocator phases() {
        return context.getPhases();
    }

    public GenerationStats stats() {
        return context.getStats();
    }
}
