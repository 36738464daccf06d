package com.healthmonitor.engine.coordinator;

import com.healthmonitor.advisory.ClassificationRequest;
import com.healthmonitor.advisory.ErrorClassifier;
import com.healthmonitor.advisory.RuleBasedErrorClassifier;
import com.healthmonitor.core.exception.ClassificationException;
import com.healthmonitor.core.exception.ClassificationPreconditionException;
import com.healthmonitor.core.exception.InvalidEventStateException;
import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.model.ErrorCategory;
import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.ErrorDetail;
import com.healthmonitor.core.model.EventStatus;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.model.IntegrationType;
import com.healthmonitor.core.model.Severity;
import com.healthmonitor.core.test.FailureInjector;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.persistence.InMemoryIntegrationEventRepository;
import com.healthmonitor.engine.service.ClassificationService.ClassificationResult;
import com.healthmonitor.engine.service.ClassificationService.Source;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassificationCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static final ErrorClassification EXTERNAL_RESULT = new ErrorClassification(
        ErrorCategory.DATA_VALIDATION,
        Severity.HIGH,
        "Employee record is missing a tax id.",
        "Add the SSN in Gusto and re-run the sync.",
        List.of("employee"),
        "Payroll for this employee is blocked.");

    private InMemoryIntegrationEventRepository repository;
    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private MonitorMetrics metrics;

    @BeforeEach
    void setUp() {
        repository = new InMemoryIntegrationEventRepository(100);
        executor = Executors.newSingleThreadExecutor();
        registry = new SimpleMeterRegistry();
        metrics = new MonitorMetrics();
        metrics.bindTo(registry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Second classify returns the stored result and never calls the capability again")
    void classify_twice_shouldCallExternalOnce() {
        StubClassifier external = new StubClassifier(FailureInjector.neverFail());
        ClassificationCoordinator coordinator = coordinator(external, Duration.ofSeconds(2));
        IntegrationEvent event = storeFailure("Invalid SSN format", "400");

        ClassificationResult first = coordinator.classify(event.id());
        ClassificationResult second = coordinator.classify(event.id());

        assertThat(first.cached()).isFalse();
        assertThat(first.source()).isEqualTo(Source.EXTERNAL);
        assertThat(first.classification()).isEqualTo(EXTERNAL_RESULT);
        assertThat(second.cached()).isTrue();
        assertThat(second.source()).isEqualTo(Source.CACHE);
        assertThat(second.classification()).isEqualTo(first.classification());
        assertThat(external.injector.getInvocationCount()).isEqualTo(1);
        assertThat(repository.findById(event.id()).orElseThrow().classification()).isEqualTo(EXTERNAL_RESULT);
    }

    @Test
    void classify_whenCapabilityFails_shouldFallBackToRules() {
        StubClassifier external = new StubClassifier(FailureInjector.alwaysFail());
        ClassificationCoordinator coordinator = coordinator(external, Duration.ofSeconds(2));
        IntegrationEvent event = storeFailure("OAuth token expired", "401");

        ClassificationResult result = coordinator.classify(event.id());

        assertThat(result.cached()).isFalse();
        assertThat(result.source()).isEqualTo(Source.FALLBACK);
        assertThat(result.classification().category()).isEqualTo(ErrorCategory.AUTH);
        assertThat(result.classification().severity()).isEqualTo(Severity.HIGH);
        assertThat(result.event().classification()).isEqualTo(result.classification());
    }

    @Test
    void classify_whenCapabilityTimesOut_shouldFallBackToRules() {
        StubClassifier external = new StubClassifier(FailureInjector.slow(Duration.ofSeconds(2)));
        ClassificationCoordinator coordinator = coordinator(external, Duration.ofMillis(100));
        IntegrationEvent event = storeFailure("Authorization declined: spending_limit_exceeded", "card_declined");

        ClassificationResult result = coordinator.classify(event.id());

        assertThat(result.source()).isEqualTo(Source.FALLBACK);
        assertThat(result.classification().category()).isEqualTo(ErrorCategory.SPENDING_CONTROL);
    }

    @Test
    void classify_whenCapabilityUnavailable_shouldNotCallIt() {
        StubClassifier external = new StubClassifier(FailureInjector.neverFail());
        external.available = false;
        ClassificationCoordinator coordinator = coordinator(external, Duration.ofSeconds(2));
        IntegrationEvent event = storeFailure("Something odd happened", "X1");

        ClassificationResult result = coordinator.classify(event.id());

        assertThat(result.source()).isEqualTo(Source.FALLBACK);
        assertThat(result.classification().category()).isEqualTo(ErrorCategory.UNKNOWN);
        assertThat(result.classification().severity()).isEqualTo(Severity.MEDIUM);
        assertThat(external.injector.getInvocationCount()).isZero();
    }

    @Test
    void classify_shouldRecordSourceMetric() {
        ClassificationCoordinator coordinator = coordinator(
            new StubClassifier(FailureInjector.alwaysFail()), Duration.ofSeconds(2));
        IntegrationEvent event = storeFailure("429 Too Many Requests", "429");

        coordinator.classify(event.id());
        coordinator.classify(event.id());

        assertThat(registry.get(MonitorMetrics.CLASSIFICATIONS).tag("source", "fallback").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get(MonitorMetrics.CLASSIFICATIONS).tag("source", "cache").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void classify_unknownEvent_shouldThrowNotFound() {
        ClassificationCoordinator coordinator = coordinator(
            new StubClassifier(FailureInjector.neverFail()), Duration.ofSeconds(2));

        assertThatThrownBy(() -> coordinator.classify(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void classify_successEvent_shouldBeRejected() {
        ClassificationCoordinator coordinator = coordinator(
            new StubClassifier(FailureInjector.neverFail()), Duration.ofSeconds(2));
        IntegrationEvent event = IntegrationEvent.create(
            IntegrationType.GUSTO, "employee.sync", EventStatus.SUCCESS, null, null, NOW);
        repository.append(event);

        assertThatThrownBy(() -> coordinator.classify(event.id()))
            .isInstanceOf(InvalidEventStateException.class);
    }

    @Test
    @DisplayName("A failure without error detail is a caller bug, not a fallback case")
    void classify_failureWithoutError_shouldRaisePrecondition() {
        StubClassifier external = new StubClassifier(FailureInjector.neverFail());
        ClassificationCoordinator coordinator = coordinator(external, Duration.ofSeconds(2));
        IntegrationEvent event = IntegrationEvent.create(
            IntegrationType.GUSTO, "employee.sync", EventStatus.FAILURE, null, null, NOW);
        repository.append(event);

        assertThatThrownBy(() -> coordinator.classify(event.id()))
            .isInstanceOf(ClassificationPreconditionException.class);
        assertThat(external.injector.getInvocationCount()).isZero();
    }

    // ========== Helpers ==========

    private ClassificationCoordinator coordinator(ErrorClassifier external, Duration timeout) {
        return new ClassificationCoordinator(
            repository, external, new RuleBasedErrorClassifier(), executor, timeout, metrics);
    }

    private IntegrationEvent storeFailure(String message, String code) {
        IntegrationEvent event = IntegrationEvent.create(
            IntegrationType.GUSTO, "employee.sync", EventStatus.FAILURE, null, ErrorDetail.of(message, code), NOW);
        repository.append(event);
        return event;
    }

    private static class StubClassifier implements ErrorClassifier {

        private final FailureInjector injector;
        private volatile boolean available = true;

        StubClassifier(FailureInjector injector) {
            this.injector = injector;
        }

        @Override
        public ErrorClassification classify(ClassificationRequest request) {
            return injector.maybeFailOrExecute(
                () -> EXTERNAL_RESULT,
                () -> new ClassificationException("upstream 503"));
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public String name() {
            return "stub";
        }
    }
}
