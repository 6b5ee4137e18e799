package com.batchjob.generator.codegen.scan;

import java.util.List;

import com.batchjob.generator.codegen.model.input.SourceLine;

import lombok.NonNull;
import lombok.Value;

/**
 * A loop opening line and, when its parentheses are left open, the body lines up to the
 * closing parenthesis.
 */
@Value
public class LoopBlock {

    @NonNull
    SourceLine opener;

    @NonNull
    List<SourceLine> body;

    /** Null for a single line loop. */
    SourceLine closer;

    public boolean isMultiLine() {
        return closer != null;
    }
}
