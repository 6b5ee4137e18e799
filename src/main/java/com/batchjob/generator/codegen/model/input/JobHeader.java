package com.batchjob.generator.codegen.model.input;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The four leading lines of a job description.
 */
@Value
@Builder
public class JobHeader {

    /** Extension marking the lightweight job type, which skips the initialization block. */
    public static final String LIGHTWEIGHT_MARKER = ".cmd";

    @NonNull
    String jobFileName;

    @NonNull
    @Builder.Default
    String author = "UNKNOWN";

    @NonNull
    @Builder.Default
    String title = "";

    @NonNull
    @Builder.Default
    String description = "";

    /**
     * Job file name up to its first dot: {@code FMX_EXTRACT.bat} gives {@code FMX_EXTRACT}.
     */
    public String getBaseName() {
        int dot = jobFileName.indexOf('.');
        return dot < 0 ? jobFileName : jobFileName.substring(0, dot);
    }

    public boolean isLightweight() {
        return jobFileName.contains(LIGHTWEIGHT_MARKER);
    }
}
