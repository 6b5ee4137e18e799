package com.batchjob.generator.codegen.scan;

import java.io.StringReader;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.batchjob.generator.classify.ClassifiedLine;
import com.batchjob.generator.classify.ExternalToolFamily;
import com.batchjob.generator.classify.LineClassifier;
import com.batchjob.generator.codegen.exception.GenerationException;
import com.batchjob.generator.codegen.exception.MalformedBlockException;
import com.batchjob.generator.codegen.model.input.SourceLine;
import com.batchjob.generator.parser.SourceCursor;

import static org.assertj.core.api.Assertions.*;

class PairedLineScannerTest {

    private static final SourceLine FIRST = new SourceLine("%PF_EXE%\\uniq.exe a.txt b.txt", 5);

    private final PairedLineScanner scanner = new PairedLineScanner(new LineClassifier());

    @Test
    void testPartnerIsConsumed() throws GenerationException {
        SourceCursor cursor = new SourceCursor(new StringReader("%PF_EXE%\\uniq.exe -d b.txt c.txt\necho next\n"), "t");

        Optional<ClassifiedLine> partner = scanner.scanPartner(FIRST, ExternalToolFamily.UNIQ, cursor);

        assertThat(partner).isPresent();
        assertThat(partner.get().getText()).isEqualTo("%PF_EXE%\\uniq.exe -d b.txt c.txt");
        assertThat(cursor.next().orElseThrow().getText()).isEqualTo("echo next");
    }

    @Test
    void testNonPartnerIsPushedBack() throws GenerationException {
        SourceCursor cursor = new SourceCursor(new StringReader("%PF_EXE%\\sort.exe c.txt\n"), "t");

        Optional<ClassifiedLine> partner = scanner.scanPartner(FIRST, ExternalToolFamily.UNIQ, cursor);

        assertThat(partner).isEmpty();
        assertThat(cursor.next().orElseThrow().getText()).isEqualTo("%PF_EXE%\\sort.exe c.txt");
    }

    @Test
    void testEndOfInputIsMalformed() {
        SourceCursor cursor = new SourceCursor(new StringReader(""), "job.txt");

        assertThatThrownBy(() -> scanner.scanPartner(FIRST, ExternalToolFamily.UNIQ, cursor))
                .isInstanceOf(MalformedBlockException.class)
                .hasMessageContaining("uniq");
    }
}
