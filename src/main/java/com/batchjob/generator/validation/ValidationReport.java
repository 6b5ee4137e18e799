package com.batchjob.generator.validation;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a structural check on a generated job script.
 */
@Value
@Builder
public class ValidationReport {

    String fileName;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    int lineCount;
    int phaseCount;
    int errorlevelChecks;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
