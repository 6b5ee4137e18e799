package com.batchjob.generator.codegen.emit.handler;

import org.junit.jupiter.api.Test;

import com.batchjob.generator.parser.PhaseMarker;

import static org.assertj.core.api.Assertions.*;

class HandlerRulesTest {

    @Test
    void testBalanceCodeIsReadFromFixedColumns() {
        assertThat(ManagedCommandHandler.hasGreaterThanOneCode("%FM_PROG%\\balance.exe -c 5100 x")).isTrue();
        assertThat(ManagedCommandHandler.hasGreaterThanOneCode("%FM_PROG%\\balance.exe -c 5102 x")).isTrue();
        assertThat(ManagedCommandHandler.hasGreaterThanOneCode("%FM_PROG%\\balance.exe -c 5103 x")).isFalse();
        assertThat(ManagedCommandHandler.hasGreaterThanOneCode("%FM_PROG%\\balance.exe 5100")).isFalse();
        assertThat(ManagedCommandHandler.hasGreaterThanOneCode("%FM_PROG%\\x.exe")).isFalse();
    }

    @Test
    void testErrorCounterResetDependsOnMarkerBody() {
        assertThat(PhaseMarkerHandler.needsErrorCounterReset(new PhaseMarker("TRI", "Tri", "TRI-Tri sort"))).isTrue();
        assertThat(PhaseMarkerHandler.needsErrorCounterReset(new PhaseMarker("ZIP", "Zip", "ZIP-Archive 7zip"))).isTrue();
        assertThat(PhaseMarkerHandler.needsErrorCounterReset(new PhaseMarker("LOAD", "Load", "LOAD-Load data"))).isFalse();
    }
}
