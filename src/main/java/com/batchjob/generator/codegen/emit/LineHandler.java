package com.batchjob.generator.codegen.emit;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.codegen.exception.GenerationException;

/**
 * Emission strategy for one line category.
 */
@FunctionalInterface
public interface LineHandler {

    void handle(ClassifiedLine line, EmissionScope scope) throws GenerationException;
}
