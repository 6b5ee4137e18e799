package com.batchjob.generator.parser;

import java.util.Optional;

/**
 * Splits a phase marker line into its treatment and label fields.
 *
 * Three prefixes are accepted: {@code rem-}, {@code rem #--}, and the legacy column form where
 * the fifth character is a hyphen ({@code rem -TRT-Label}, {@code rem--TRT-Label}). The remainder
 * is split on hyphens; field one is the treatment, field two the label, further fields are
 * ignored. A marker missing either field yields empty, so the line degrades to a plain comment
 * instead of failing.
 */
public class PhaseMarkerParser {

    static final String COMMENT_KEYWORD = "rem";
    private static final String BANNER_PREFIX = " #--";
    private static final int LEGACY_HYPHEN_COLUMN = 4;

    public Optional<PhaseMarker> parse(String line) {
        if (countHyphens(line) < 2) {
            return Optional.empty();
        }
        Optional<String> body = markerBody(line);
        if (body.isEmpty()) {
            return Optional.empty();
        }

        String[] fields = body.get().split("-", -1);
        if (fields.length < 2) {
            return Optional.empty();
        }
        String treatment = fields[0].trim();
        String label = fields[1].trim();
        if (treatment.isEmpty() || label.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PhaseMarker(treatment, label, body.get()));
    }

    /**
     * Whether the line carries a phase marker prefix followed by some text, whether or not
     * its fields parse. Plain banner lines made of hyphens do not count.
     */
    public static boolean looksLikeMarker(String line) {
        return markerBody(line)
                .map(body -> body.chars().anyMatch(c -> c != '-' && !Character.isWhitespace(c)))
                .orElse(false);
    }

    /**
     * Text following the marker prefix, empty when the line has no marker prefix.
     */
    static Optional<String> markerBody(String line) {
        if (line.length() <= COMMENT_KEYWORD.length()
                || !line.regionMatches(true, 0, COMMENT_KEYWORD, 0, COMMENT_KEYWORD.length())) {
            return Optional.empty();
        }
        String rest = line.substring(COMMENT_KEYWORD.length());
        if (rest.startsWith(BANNER_PREFIX)) {
            return Optional.of(rest.substring(BANNER_PREFIX.length()));
        }
        if (line.length() > LEGACY_HYPHEN_COLUMN && line.charAt(LEGACY_HYPHEN_COLUMN) == '-') {
            return Optional.of(line.substring(LEGACY_HYPHEN_COLUMN + 1));
        }
        if (rest.startsWith("-")) {
            return Optional.of(rest.substring(1));
        }
        return Optional.empty();
    }

    public static int countHyphens(String line) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '-') {
                count++;
            }
        }
        return count;
    }
}
