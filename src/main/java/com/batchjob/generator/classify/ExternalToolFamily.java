package com.batchjob.generator.classify;

import java.util.List;

import lombok.Getter;

/**
 * Refinement of {@link LineCategory#EXTERNAL_TOOL_COMMAND}. Declaration order is match order.
 */
@Getter
public enum ExternalToolFamily {
    GREP(List.of("grep")),
    UNIQ(List.of("uniq")),
    UNIX2DOS_TOUCH(List.of("unix2dos", "touch")),
    JOIN(List.of("join")),
    SORT(List.of("sort")),
    CAT(List.of("cat")),
    CONVERTER(List.of("sed", "gawk")),
    DEFAULT(List.of());

    private final List<String> markers;

    ExternalToolFamily(List<String> markers) {
        this.markers = markers;
    }

    public static ExternalToolFamily of(String line) {
        for (ExternalToolFamily family : values()) {
            if (family.markers.stream().anyMatch(line::contains)) {
                return family;
            }
        }
        return DEFAULT;
    }
}
