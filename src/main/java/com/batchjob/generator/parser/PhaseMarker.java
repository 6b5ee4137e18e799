package com.batchjob.generator.parser;

import lombok.NonNull;
import lombok.Value;

/**
 * Fields of a phase marker line such as {@code rem #--EXTRACT-Extraction phase}.
 */
@Value
public class PhaseMarker {

    /** Operation name, becomes NOMTRAIT. */
    @NonNull
    String treatment;

    /** Human readable phase title. */
    @NonNull
    String label;

    /** Marker text after the comment prefix, used for the error counter reset decision. */
    @NonNull
    String body;
}
