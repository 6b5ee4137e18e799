package com.batchjob.generator.codegen.model.core.context;

import com.batchjob.generator.codegen.model.input.JobHeader;
import com.batchjob.generator.codegen.phase.PhaseAllocator;

import lombok.Getter;
import lombok.NonNull;

/**
 * Mutable state threaded through one generation run. Never shared between runs.
 */
@Getter
public final class GenerationContext {

    @NonNull
    private final GeneratorConfig config;

    @NonNull
    private final JobHeader header;

    @NonNull
    private final PhaseAllocator phases;

    private final GenerationStats stats = new GenerationStats();

    public GenerationContext(@NonNull GeneratorConfig config, @NonNull JobHeader header) {
        this.config = config;
        this.header = header;
        this.phases = new PhaseAllocator(config.getEffectiveStartPhase());
    }

    /**
     * Job file name without extension, used in phase titles.
     */
    public String getJobBaseName() {
        return header.getBaseName();
    }
}
