package com.batchjob.generator.codegen.emit.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.CommandVocabulary;
import com.batchjob.generator.codegen.emit.EmissionScope;
import com.batchjob.generator.codegen.emit.LineHandler;
import com.batchjob.generator.codegen.emit.ScriptWriter;
import com.batchjob.generator.parser.PhaseMarker;

/**
 * Opens a new phase: label, diagnostic title, treatment name and info call.
 */
public class PhaseMarkerHandler implements LineHandler {
    private static final Logger log = LoggerFactory.getLogger(PhaseMarkerHandler.class);

    public static final String BANNER = "rem ##################################################";
    public static final String INFO_CALL = "%PERL% %PF_SKL_PROC%\\skl_infojob.pl \"%PHASE%\" \"%NOMTRAIT%\"";

    @Override
    public void handle(ClassifiedLine line, EmissionScope scope) {
        PhaseMarker marker = line.marker()
                .orElseThrow(() -> new IllegalArgumentException("Not a phase marker: " + line.getText()));
        ScriptWriter out = scope.getOut();

        // error counter is only meaningful for phases running retryable commands
        if (needsErrorCounterReset(marker)) {
            out.line("set nberr=0");
        }

        int phase = scope.phases().openPhase();
        out.line(":STEP" + phase);
        out.line(BANNER);
        out.line("set PHASE=" + scope.getContext().getJobBaseName() + " - " + phase + " - " + marker.getLabel());
        out.line(BANNER);
        out.line("set num_phase=" + phase);
        out.line("set NOMTRAIT=" + marker.getTreatment());
        out.line(INFO_CALL);
        out.blank();

        scope.stats().recordPhase();
        log.debug("Phase {} opened for {} ({})", phase, marker.getTreatment(), marker.getLabel());
    }

    static boolean needsErrorCounterReset(PhaseMarker marker) {
        return CommandVocabulary.ERROR_COUNTER_COMMANDS.stream().anyMatch(marker.getBody()::contains);
    }
}
