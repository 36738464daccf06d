package com.healthmonitor.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionTest {

    private static final Instant T1 = Instant.parse("2024-06-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-06-01T11:00:00Z");

    @Test
    void acknowledge_shouldRecordActorAndTime() {
        Resolution acked = Resolution.open().acknowledge("dana", T1);

        assertThat(acked.status()).isEqualTo(ResolutionStatus.ACKNOWLEDGED);
        assertThat(acked.acknowledgedBy()).isEqualTo("dana");
        assertThat(acked.acknowledgedAt()).isEqualTo(T1);
        assertThat(acked.resolvedAt()).isNull();
    }

    @Test
    void resolve_shouldKeepAcknowledgementFields() {
        Resolution resolved = Resolution.open()
            .acknowledge("dana", T1)
            .resolve("lee", "Re-mapped GL account", T2);

        assertThat(resolved.status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolved.acknowledgedBy()).isEqualTo("dana");
        assertThat(resolved.acknowledgedAt()).isEqualTo(T1);
        assertThat(resolved.resolvedBy()).isEqualTo("lee");
        assertThat(resolved.resolvedAt()).isEqualTo(T2);
        assertThat(resolved.notes()).isEqualTo("Re-mapped GL account");
    }

    @Test
    void resolveWithoutAcknowledge_shouldBeAllowed() {
        Resolution resolved = Resolution.open().resolve("lee", null, T2);

        assertThat(resolved.status()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolved.acknowledgedAt()).isNull();
    }

    @Test
    void acknowledgeAfterResolve_shouldOverwriteResolvedFields() {
        Resolution reacked = Resolution.open()
            .resolve("lee", "done", T1)
            .acknowledge("dana", T2);

        assertThat(reacked.status()).isEqualTo(ResolutionStatus.ACKNOWLEDGED);
        assertThat(reacked.resolvedBy()).isNull();
        assertThat(reacked.notes()).isNull();
    }

    @Test
    void reopen_shouldDiscardAllFields() {
        Resolution reopened = Resolution.open()
            .acknowledge("dana", T1)
            .resolve("lee", "done", T2)
            .reopen();

        assertThat(reopened).isEqualTo(Resolution.open());
        assertThat(reopened.isOpen()).isTrue();
        assertThat(reopened.acknowledgedBy()).isNull();
    }
}
