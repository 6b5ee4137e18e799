package com.batchjob.generator.codegen.model.core.context;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for one job generation run.
 *
 * Date and user are caller metadata written into the header; two runs with the same
 * input and the same metadata produce identical scripts.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    public static final int DEFAULT_START_PHASE = 10;
    public static final DateTimeFormatter HEADER_DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    /**
     * Job description to transform. Not needed for in-memory assembly.
     */
    Path inputPath;

    /**
     * Destination script. Not needed for in-memory assembly.
     */
    Path outputPath;

    /**
     * First phase number, 0 meaning {@link #DEFAULT_START_PHASE}.
     */
    @Builder.Default
    int startPhase = 0;

    @NonNull
    @Builder.Default
    String date = LocalDate.now().format(HEADER_DATE_FORMAT);

    @NonNull
    @Builder.Default
    String user = defaultUser();

    @NonNull
    @Builder.Default
    Charset inputCharset = StandardCharsets.UTF_8;

    /**
     * Charset retried once when the source does not decode with {@link #inputCharset}.
     */
    @NonNull
    @Builder.Default
    Charset fallbackCharset = Charset.forName("windows-1252");

    @NonNull
    @Builder.Default
    Charset outputCharset = StandardCharsets.UTF_8;

    @NonNull
    @Builder.Default
    LineEnding lineEnding = LineEnding.LF;

    /**
     * Drop plain comments with fewer than two hyphens, as the legacy generator did.
     */
    boolean stripComments;

    /**
     * Replace an existing destination.
     */
    boolean force;

    public int getEffectiveStartPhase() {
        return startPhase == 0 ? DEFAULT_START_PHASE : startPhase;
    }

    public String getSourceName() {
        return inputPath != null ? inputPath.toString() : "<memory>";
    }

    private static String defaultUser() {
        String user = System.getenv("USERNAME");
        return user == null || user.isBlank() ? "UNKNOWN" : user;
    }
}
