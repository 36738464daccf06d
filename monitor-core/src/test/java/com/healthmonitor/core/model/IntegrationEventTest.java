package com.healthmonitor.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegrationEventTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void create_shouldStartOpenAndUnclassified() {
        IntegrationEvent event = IntegrationEvent.create(
            IntegrationType.GUSTO, "employee.sync", EventStatus.FAILURE, null,
            ErrorDetail.of("Validation failed: employee_id is required but was null", "400"), NOW);

        assertThat(event.id()).isNotNull();
        assertThat(event.timestamp()).isEqualTo(NOW);
        assertThat(event.isFailure()).isTrue();
        assertThat(event.isClassified()).isFalse();
        assertThat(event.resolutionStatus()).isEqualTo(ResolutionStatus.OPEN);
    }

    @Test
    void withClassification_shouldKeepIdentity() {
        IntegrationEvent event = IntegrationEvent.create(
            IntegrationType.PROCORE, "project.sync", EventStatus.FAILURE, null,
            ErrorDetail.of("Entity not found", "404"), NOW);
        ErrorClassification classification = new ErrorClassification(
            ErrorCategory.DATA_STATE_MISMATCH, Severity.MEDIUM, "cause", "fix", null, "impact");

        IntegrationEvent classified = event.withClassification(classification);

        assertThat(classified.id()).isEqualTo(event.id());
        assertThat(classified.classification().affectedData()).isEmpty();
        assertThat(classified.resolution()).isEqualTo(event.resolution());
    }

    @Test
    void wireValues_shouldRoundTripThroughFactories() {
        assertThat(IntegrationType.fromId("stripe_issuing")).isEqualTo(IntegrationType.STRIPE_ISSUING);
        assertThat(ResolutionStatus.fromValue("acknowledged")).isEqualTo(ResolutionStatus.ACKNOWLEDGED);
        assertThat(ErrorCategory.fromValue("data_state_mismatch")).isEqualTo(ErrorCategory.DATA_STATE_MISMATCH);
        assertThatThrownBy(() -> IntegrationType.fromId("salesforce"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("salesforce");
    }
}
