package com.batchjob.generator.codegen.model.core.context;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters accumulated during one generation run.
 */
@Getter
@ToString
public class GenerationStats {

    private int phasesGenerated;
    private int commandsProcessed;
    private int errors;

    public void recordPhase() {
        phasesGenerated++;
    }

    public void recordCommand() {
        commandsProcessed++;
    }

    /**
     * Counts a construct that was degraded instead of scaffolded.
     */
    public void recordError() {
        errors++;
    }
}
