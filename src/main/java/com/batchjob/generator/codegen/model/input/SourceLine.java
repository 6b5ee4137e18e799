package com.batchjob.generator.codegen.model.input;

import java.util.Locale;

import lombok.NonNull;
import lombok.Value;

/**
 * A trimmed, non-blank source line together with its physical line number.
 */
@Value
public class SourceLine {

    @NonNull
    String text;

    int lineNumber;

    public String lower() {
        return text.toLowerCase(Locale.ROOT);
    }
}
