package com.batchjob.generator.classify;

import java.util.Optional;

import com.batchjob.generator.codegen.model.input.SourceLine;

/**
 * One step of the ordered classification chain.
 */
public interface ClassificationRule {

    /**
     * Short identifier, used in logs and to pin precedence in tests.
     */
    String name();

    /**
     * @return the classification when this rule matches, empty to let the next rule try
     */
    Optional<ClassifiedLine> classify(SourceLine line);
}
