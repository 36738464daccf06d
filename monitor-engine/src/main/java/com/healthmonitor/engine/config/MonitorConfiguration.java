package com.healthmonitor.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthmonitor.advisory.ErrorClassifier;
import com.healthmonitor.advisory.LlmClassifierSettings;
import com.healthmonitor.advisory.LlmErrorClassifier;
import com.healthmonitor.advisory.RuleBasedErrorClassifier;
import com.healthmonitor.core.repository.IntegrationEventRepository;
import com.healthmonitor.core.repository.SyncExecutionRepository;
import com.healthmonitor.core.repository.SyncInstanceRepository;
import com.healthmonitor.core.repository.SyncPipelineRepository;
import com.healthmonitor.engine.coordinator.ClassificationCoordinator;
import com.healthmonitor.engine.coordinator.EventCoordinator;
import com.healthmonitor.engine.coordinator.HealthCoordinator;
import com.healthmonitor.engine.coordinator.SyncCoordinator;
import com.healthmonitor.engine.metrics.MonitorMetrics;
import com.healthmonitor.engine.persistence.InMemoryIntegrationEventRepository;
import com.healthmonitor.engine.persistence.InMemorySyncExecutionRepository;
import com.healthmonitor.engine.persistence.InMemorySyncInstanceRepository;
import com.healthmonitor.engine.persistence.InMemorySyncPipelineRepository;
import com.healthmonitor.engine.persistence.SyncStoreLock;
import com.healthmonitor.engine.service.ClassificationService;
import com.healthmonitor.engine.service.EventService;
import com.healthmonitor.engine.service.HealthService;
import com.healthmonitor.engine.service.SyncService;
import com.healthmonitor.engine.service.SyncService.GenerateMockDataRequest;
import com.healthmonitor.engine.simulation.DemoEventSimulator;
import com.healthmonitor.engine.sync.PipelineCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Composition root for the monitor: stores, classifiers and services.
 *
 * Every store is a single bean owned by the application context; nothing
 * is held in static state.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfiguration.class);

    // ========== Infrastructure ==========

    @Bean
    public Clock monitorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random monitorRandom() {
        return new Random();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService classifierExecutor() {
        return Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "classifier");
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Stores ==========

    @Bean
    public IntegrationEventRepository integrationEventRepository(MonitorProperties properties) {
        return new InMemoryIntegrationEventRepository(properties.getEvents().getCapacity());
    }

    @Bean
    public SyncPipelineRepository syncPipelineRepository() {
        return new InMemorySyncPipelineRepository(PipelineCatalog::defaultPipelines);
    }

    @Bean
    public SyncInstanceRepository syncInstanceRepository() {
        return new InMemorySyncInstanceRepository();
    }

    @Bean
    public SyncExecutionRepository syncExecutionRepository() {
        return new InMemorySyncExecutionRepository();
    }

    @Bean
    public SyncStoreLock syncStoreLock() {
        return new SyncStoreLock();
    }

    // ========== Classifiers ==========

    @Bean
    public LlmErrorClassifier llmErrorClassifier(MonitorProperties properties, ObjectMapper objectMapper) {
        MonitorProperties.Classifier classifier = properties.getClassifier();
        String apiKey = classifier.isEnabled() ? classifier.getApiKey() : null;
        return new LlmErrorClassifier(
            new LlmClassifierSettings(
                apiKey,
                classifier.getBaseUrl(),
                classifier.getModel(),
                classifier.getTemperature(),
                classifier.getMaxTokens(),
                classifier.getTimeout()),
            objectMapper);
    }

    @Bean
    public RuleBasedErrorClassifier ruleBasedErrorClassifier() {
        return new RuleBasedErrorClassifier();
    }

    // ========== Services ==========

    @Bean
    public EventService eventService(
            IntegrationEventRepository eventRepository,
            MonitorMetrics metrics,
            Clock clock,
            MonitorProperties properties) {
        return new EventCoordinator(
            eventRepository,
            metrics,
            clock,
            properties.getEvents().getDefaultLimit(),
            properties.getEvents().getDefaultPageLimit());
    }

    @Bean
    public ClassificationService classificationService(
            IntegrationEventRepository eventRepository,
            LlmErrorClassifier llmErrorClassifier,
            RuleBasedErrorClassifier ruleBasedErrorClassifier,
            ExecutorService classifierExecutor,
            MonitorProperties properties,
            MonitorMetrics metrics) {
        ErrorClassifier external = llmErrorClassifier;
        if (!external.isAvailable()) {
            log.info("No classifier API key configured; failures will be classified by keyword rules");
        }
        return new ClassificationCoordinator(
            eventRepository,
            external,
            ruleBasedErrorClassifier,
            classifierExecutor,
            properties.getClassifier().getTimeout(),
            metrics);
    }

    @Bean
    public SyncService syncService(
            SyncPipelineRepository pipelineRepository,
            SyncInstanceRepository instanceRepository,
            SyncExecutionRepository executionRepository,
            SyncStoreLock syncStoreLock,
            MonitorMetrics metrics,
            Random random,
            Clock clock) {
        return new SyncCoordinator(
            pipelineRepository, instanceRepository, executionRepository, syncStoreLock, metrics, random, clock);
    }

    @Bean
    public HealthService healthService(
            EventService eventService,
            SyncPipelineRepository pipelineRepository,
            SyncInstanceRepository instanceRepository,
            SyncExecutionRepository executionRepository,
            SyncStoreLock syncStoreLock,
            Clock clock) {
        return new HealthCoordinator(
            eventService, pipelineRepository, instanceRepository, executionRepository, syncStoreLock, clock);
    }

    @Bean
    public DemoEventSimulator demoEventSimulator(
            EventService eventService,
            ObjectMapper objectMapper,
            Random random,
            Clock clock) {
        return new DemoEventSimulator(eventService, objectMapper, random, clock);
    }

    // ========== Startup ==========

    @Bean
    public StartupSeeder startupSeeder(SyncService syncService, MonitorProperties properties) {
        return new StartupSeeder(syncService, properties);
    }

    /**
     * Generates mock sync history once the application is ready, when enabled.
     */
    public static class StartupSeeder {

        private final SyncService syncService;
        private final MonitorProperties properties;

        StartupSeeder(SyncService syncService, MonitorProperties properties) {
            this.syncService = syncService;
            this.properties = properties;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void onApplicationReady() {
            MonitorProperties.Sync sync = properties.getSync();
            if (!sync.isSeedOnStartup()) {
                return;
            }
            syncService.generateMockData(new GenerateMockDataRequest(sync.getSeedClientCount(), true));
        }
    }
}
