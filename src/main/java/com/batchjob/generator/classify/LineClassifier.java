package com.batchjob.generator.classify;

import static com.batchjob.generator.classify.CommandVocabulary.*;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.parser.PhaseMarkerParser;

/**
 * Maps a trimmed source line to its {@link LineCategory}.
 *
 * Rules are tried top to bottom and the first match wins. Keyword prefixes are matched
 * case-insensitively; the %VAR% roots are matched as written. Classification never fails:
 * anything unrecognized is {@link LineCategory#OPAQUE}.
 */
public class LineClassifier {
    private static final Logger log = LoggerFactory.getLogger(LineClassifier.class);

    private final PhaseMarkerParser markerParser;
    private final List<ClassificationRule> rules;

    public LineClassifier() {
        this(new PhaseMarkerParser());
    }

    public LineClassifier(PhaseMarkerParser markerParser) {
        this.markerParser = markerParser;
        this.rules = List.of(
                rule("comment", this::classifyComment),
                rule("managed-command", LineClassifier::classifyManaged),
                rule("external-tool", line -> line.getText().contains(EXTERNAL_TOOL_ROOT)
                        ? ClassifiedLine.externalTool(line, ExternalToolFamily.of(line.getText()))
                        : null),
                rule("file-enumeration", line -> line.lower().contains(FILE_ENUMERATION)
                        ? ClassifiedLine.of(line, LineCategory.FILE_ENUMERATION)
                        : null),
                rule("loop-open", line -> startsWithAny(line.lower(), LOOP_PREFIXES)
                        ? ClassifiedLine.of(line, LineCategory.LOOP_OPEN)
                        : null),
                rule("simple-directive", line -> startsWithAny(line.lower(), SIMPLE_DIRECTIVES)
                        ? ClassifiedLine.of(line, LineCategory.SIMPLE_DIRECTIVE)
                        : null),
                rule("call-or-path", line -> line.lower().startsWith(CALL_KEYWORD) || line.lower().contains(PROGRAM_FILES)
                        ? ClassifiedLine.of(line, LineCategory.CALL_OR_PATH_LITERAL)
                        : null),
                rule("file-move", line -> startsWithAny(line.lower(), FILE_MOVE_VERBS)
                        ? ClassifiedLine.of(line, LineCategory.FILE_MOVE)
                        : null),
                rule("file-delete", line -> line.lower().startsWith(DELETE_KEYWORD)
                        ? ClassifiedLine.of(line, LineCategory.FILE_DELETE)
                        : null),
                rule("notifier-call", line -> line.getText().contains(NOTIFIER_ROOT)
                        ? ClassifiedLine.of(line, LineCategory.NOTIFIER_CALL)
                        : null));
    }

    public ClassifiedLine classify(SourceLine line) {
        for (ClassificationRule rule : rules) {
            Optional<ClassifiedLine> result = rule.classify(line);
            if (result.isPresent()) {
                log.trace("Line {} matched rule {}", line.getLineNumber(), rule.name());
                return result.get();
            }
        }
        return ClassifiedLine.of(line, LineCategory.OPAQUE);
    }

    public List<String> ruleNames() {
        return rules.stream().map(ClassificationRule::name).toList();
    }

    private ClassifiedLine classifyComment(SourceLine line) {
        if (!line.lower().startsWith("rem")) {
            return null;
        }
        return markerParser.parse(line.getText())
                .map(marker -> ClassifiedLine.phaseMarker(line, marker))
                .orElseGet(() -> ClassifiedLine.of(line, LineCategory.COMMENT));
    }

    private static ClassifiedLine classifyManaged(SourceLine line) {
        String text = line.getText();
        if (!text.contains(PROCESSING_ROOT)) {
            return null;
        }
        if (RETRYABLE_COMMANDS.stream().anyMatch(text::contains)) {
            return ClassifiedLine.managed(line, ManagedCommandFamily.RETRYABLE);
        }
        if (text.contains(PIMPORT)) {
            return ClassifiedLine.managed(line, ManagedCommandFamily.PIMPORT);
        }
        return ClassifiedLine.managed(line, ManagedCommandFamily.BALANCE_TEST);
    }

    private static boolean startsWithAny(String lower, List<String> prefixes) {
        return prefixes.stream().anyMatch(lower::startsWith);
    }

    private static ClassificationRule rule(String name, Function<SourceLine, ClassifiedLine> matcher) {
        return new ClassificationRule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<ClassifiedLine> classify(SourceLine line) {
                return Optional.ofNullable(matcher.apply(line));
            }
        };
    }
}
