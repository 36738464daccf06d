package com.healthmonitor.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds monitor.* from application.yml.
 *
 * <pre>
 * monitor:
 *   events:
 *     capacity: 1000
 *   classifier:
 *     api-key: ${OPENAI_API_KEY:}
 *     timeout: 10s
 *   sync:
 *     seed-on-startup: true
 * </pre>
 */
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    private Events events = new Events();
    private Classifier classifier = new Classifier();
    private Sync sync = new Sync();

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    public static class Events {

        /** Maximum retained events; the oldest is evicted beyond this. */
        private int capacity = 1000;

        /** Page size for plain listings. */
        private int defaultLimit = 50;

        /** Page size for paginated listings. */
        private int defaultPageLimit = 25;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getDefaultPageLimit() {
            return defaultPageLimit;
        }

        public void setDefaultPageLimit(int defaultPageLimit) {
            this.defaultPageLimit = defaultPageLimit;
        }
    }

    public static class Classifier {

        /** Master toggle for the external classifier. Off means rule-based only. */
        private boolean enabled = true;

        /** API key; the external classifier stays unavailable while blank. */
        private String apiKey;

        private String baseUrl = "https://api.openai.com/v1";

        private String model = "gpt-4o-mini";

        /** Upper bound on one external classification call. */
        private Duration timeout = Duration.ofSeconds(10);

        private double temperature = 0.3;

        private int maxTokens = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Sync {

        /** Generate mock sync data when the application starts. */
        private boolean seedOnStartup = false;

        private int seedClientCount = 5;

        public boolean isSeedOnStartup() {
            return seedOnStartup;
        }

        public void setSeedOnStartup(boolean seedOnStartup) {
            this.seedOnStartup = seedOnStartup;
        }

        public int getSeedClientCount() {
            return seedClientCount;
        }

        public void setSeedClientCount(int seedClientCount) {
            this.seedClientCount = seedClientCount;
        }
    }
}
