package com.batchjob.generator.validation;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural sanity checks on a generated job script.
 *
 * Checks that the fixed scaffolding is present and that every {@code goto STEP<n>} has a
 * matching {@code :STEP<n>} label. Runtime behaviour of the script is not examined.
 */
public class JobScriptValidator {
    private static final Logger log = LoggerFactory.getLogger(JobScriptValidator.class);

    private static final Map<String, String> REQUIRED_MARKERS = new LinkedHashMap<>();
    static {
        REQUIRED_MARKERS.put("@echo off", "Missing @echo off directive");
        REQUIRED_MARKERS.put("set PHASE=00", "Missing initial phase 00");
        REQUIRED_MARKERS.put("set PHASE=99", "Missing final phase 99");
        REQUIRED_MARKERS.put("skl_debutjob.pl", "Missing skl_debutjob.pl call");
        REQUIRED_MARKERS.put("skl_finjob.pl", "Missing skl_finjob.pl call");
        REQUIRED_MARKERS.put(":ERREUR", "Missing :ERREUR label");
        REQUIRED_MARKERS.put(":FIN", "Missing :FIN label");
    }

    private static final Pattern STEP_LABEL = Pattern.compile(":STEP(\\d+)");
    private static final Pattern STEP_GOTO = Pattern.compile("goto STEP(\\d+)");

    private final Charset charset;
    private final Charset fallbackCharset;

    public JobScriptValidator() {
        this(StandardCharsets.UTF_8, Charset.forName("windows-1252"));
    }

    public JobScriptValidator(Charset charset, Charset fallbackCharset) {
        this.charset = charset;
        this.fallbackCharset = fallbackCharset;
    }

    public ValidationReport validate(Path file) {
        String content;
        try {
            content = read(file);
        } catch (IOException e) {
            log.warn("Unable to read {}: {}", file, e.getMessage());
            return ValidationReport.builder()
                    .fileName(file.toString())
                    .error("Unable to read file: " + e.getMessage())
                    .build();
        }
        return validate(file.toString(), content);
    }

    public ValidationReport validate(String fileName, String content) {
        ValidationReport.ValidationReportBuilder report = ValidationReport.builder().fileName(fileName);

        REQUIRED_MARKERS.forEach((marker, message) -> {
            if (!content.contains(marker)) {
                report.error(message);
            }
        });

        String[] lines = content.split("\n", -1);
        Set<String> labels = collect(STEP_LABEL, content);
        for (String line : lines) {
            String trimmed = line.strip();
            // commented out jumps are not followed
            if (trimmed.regionMatches(true, 0, "rem", 0, 3)) {
                continue;
            }
            Matcher gotos = STEP_GOTO.matcher(trimmed);
            while (gotos.find()) {
                String target = gotos.group(1);
                if (!labels.contains(target)) {
                    report.warning("goto STEP" + target + " has no matching label");
                }
            }
        }

        return report
                .lineCount(lines.length)
                .phaseCount(labels.size())
                .errorlevelChecks(countOccurrences(content, "errorlevel"))
                .build();
    }

    private String read(Path file) throws IOException {
        try {
            return Files.readString(file, charset);
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid {}, retrying with {}", file, charset, fallbackCharset);
            return Files.readString(file, fallbackCharset);
        }
    }

    private static Set<String> collect(Pattern pattern, String content) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }

    private static int countOccurrences(String content, String token) {
        int count = 0;
        int from = 0;
        while ((from = content.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }
}
