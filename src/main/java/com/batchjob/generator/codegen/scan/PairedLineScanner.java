package com.batchjob.generator.codegen.scan;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.ExternalToolFamily;
import com.batchjob.generator.classify.LineClassifier;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.MalformedBlockException;
import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.parser.SourceCursor;

/**
 * One line lookahead for commands that may come as a two line unit (a pair of uniq calls).
 *
 * A line that turns out not to be a partner is pushed back onto the cursor, so the main
 * loop classifies and emits it as usual.
 */
public class PairedLineScanner {
    private static final Logger log = LoggerFactory.getLogger(PairedLineScanner.class);

    private final LineClassifier classifier;

    public PairedLineScanner(LineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @return the partner line when the next line belongs to {@code family}, empty otherwise
     * @throws MalformedBlockException when the source ends right after {@code first}
     */
    public Optional<ClassifiedLine> scanPartner(SourceLine first, ExternalToolFamily family, SourceCursor cursor)
            throws GenerationException {
        Optional<SourceLine> next = cursor.next();
        if (next.isEmpty()) {
            throw new MalformedBlockException(
                    "Source ends right after the " + family.name().toLowerCase(Locale.ROOT) + " command, its pair cannot be resolved",
                    cursor.getSourceName(), first.getLineNumber());
        }

        ClassifiedLine candidate = classifier.classify(next.get());
        if (candidate.isToolFamily(family)) {
            log.debug("Lines {} and {} form a {} pair", first.getLineNumber(), candidate.getLine().getLineNumber(), family);
            return Optional.of(candidate);
        }
        cursor.pushBack(next.get());
        return Optional.empty();
    }
}
