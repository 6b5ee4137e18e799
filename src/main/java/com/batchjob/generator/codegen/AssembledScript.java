package com.batchjob.generator.codegen;

import java.util.List;

import com.batchjob.generator.codegen.model.core.context.GenerationStats;
import com.batchjob.generator.codegen.model.input.JobHeader;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A fully assembled job script, not yet written anywhere.
 */
@Value
@Builder
public class AssembledScript {

    @NonNull
    String content;

    @NonNull
    JobHeader header;

    @NonNull
    GenerationStats stats;

    @NonNull
    List<Integer> phases;

    int lineCount;
}
