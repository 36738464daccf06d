package com.healthmonitor.engine.coordinator;

import com.healthmonitor.advisory.ClassificationRequest;
import com.healthmonitor.advisory.ErrorClassifier;
import com.healthmonitor.core.exception.InvalidEventStateException;
import com.healthmonitor.core.exception.NotFoundException;
import com.healthmonitor.core.model.ErrorClassification;
import com.healthmonitor.core.model.IntegrationEvent;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import com.healthmonitor.engine.logging.LoggingContext;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.service.ClassificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cache check, bounded external call, rule-based fallback, attach.
 *
 * The cache check and the attach are separate steps around the external
 * call. Two concurrent calls for the same unclassified event may both reach
 * the external classifier; the repository keeps whichever result is attached
 * first and the later caller receives that one.
 */
public class ClassificationCoordinator implements ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationCoordinator.class);

    private final IntegrationEventRepository eventRepository;
    private final ErrorClassifier externalClassifier;
    private final ErrorClassifier fallbackClassifier;
    private final ExecutorService executor;
    private final Duration timeout;
    private final MonitorMetrics metrics;

    public ClassificationCoordinator(
            IntegrationEventRepository eventRepository,
            ErrorClassifier externalClassifier,
            ErrorClassifier fallbackClassifier,
            ExecutorService executor,
            Duration timeout,
            MonitorMetrics metrics) {
        this.eventRepository = eventRepository;
        this.externalClassifier = externalClassifier;
        this.fallbackClassifier = fallbackClassifier;
        this.executor = executor;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    @Override
    public ClassificationResult classify(UUID eventId) {
        long started = System.nanoTime();
        IntegrationEvent event = eventRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("Event", eventId.toString()));

        try (var ctx = LoggingContext.forEvent(event)) {
            if (!event.isFailure()) {
                throw new InvalidEventStateException(eventId, event.status(), "classify");
            }
            if (event.isClassified()) {
                log.debug("Returning cached classification");
                return record(new ClassificationResult(event, event.classification(), true, Source.CACHE), started);
            }

            ClassificationRequest request = ClassificationRequest.from(event);

            Source source = Source.EXTERNAL;
            ErrorClassification classification = callExternal(request).orElse(null);
            if (classification == null) {
                source = Source.FALLBACK;
                classification = fallbackClassifier.classify(request);
            }

            Optional<IntegrationEvent> stored = eventRepository.attachClassification(eventId, classification);
            if (stored.isEmpty()) {
                log.warn("Event was evicted while being classified; result not stored");
                return record(new ClassificationResult(
                    event.withClassification(classification), classification, false, source), started);
            }

            IntegrationEvent updated = stored.get();
            if (!classification.equals(updated.classification())) {
                log.debug("Another caller classified this event first; keeping its result");
                return record(new ClassificationResult(updated, updated.classification(), true, Source.CACHE), started);
            }

            log.info("Classified as {}/{} via {}",
                classification.category().value(), classification.severity().value(), source.tag());
            return record(new ClassificationResult(updated, classification, false, source), started);
        }
    }

    private Optional<ErrorClassification> callExternal(ClassificationRequest request) {
        if (externalClassifier == null || !externalClassifier.isAvailable()) {
            log.debug("External classifier unavailable, using fallback");
            return Optional.empty();
        }

        Future<ErrorClassification> future = executor.submit(() -> externalClassifier.classify(request));
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Classifier {} timed out after {}ms, using fallback", externalClassifier.name(), timeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Classifier {} failed, using fallback: {}", externalClassifier.name(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for classifier {}, using fallback", externalClassifier.name());
        }
        return Optional.empty();
    }

    private ClassificationResult record(ClassificationResult result, long startedNanos) {
        metrics.classified(
            result.event().integration(),
            result.source().tag(),
            Duration.ofNanos(System.nanoTime() - startedNanos));
        return result;
    }
}
