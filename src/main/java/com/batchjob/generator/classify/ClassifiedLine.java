package com.batchjob.generator.classify;

import java.util.Optional;

import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.parser.PhaseMarker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A source line tagged with its category and, where relevant, its family or marker fields.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassifiedLine {

    @NonNull
    SourceLine line;

    @NonNull
    LineCategory category;

    ManagedCommandFamily managedFamily;
    ExternalToolFamily toolFamily;
    PhaseMarker phaseMarker;

    public static ClassifiedLine of(SourceLine line, LineCategory category) {
        return new ClassifiedLine(line, category, null, null, null);
    }

    public static ClassifiedLine managed(SourceLine line, ManagedCommandFamily family) {
        return new ClassifiedLine(line, LineCategory.MANAGED_COMMAND, family, null, null);
    }

    public static ClassifiedLine externalTool(SourceLine line, ExternalToolFamily family) {
        return new ClassifiedLine(line, LineCategory.EXTERNAL_TOOL_COMMAND, null, family, null);
    }

    public static ClassifiedLine phaseMarker(SourceLine line, PhaseMarker marker) {
        return new ClassifiedLine(line, LineCategory.PHASE_MARKER, null, null, marker);
    }

    public String getText() {
        return line.getText();
    }

    public Optional<PhaseMarker> marker() {
        return Optional.ofNullable(phaseMarker);
    }

    public boolean isToolFamily(ExternalToolFamily family) {
        return category == LineCategory.EXTERNAL_TOOL_COMMAND && toolFamily == family;
    }
}
