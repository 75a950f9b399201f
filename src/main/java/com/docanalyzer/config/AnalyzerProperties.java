package com.docanalyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Startup configuration for the analyzer, bound from the {@code analyzer.*} properties.
 * Passed explicitly into the storage, queue, engine and orchestrator beans.
 */
@ConfigurationProperties(prefix = "analyzer")
public record AnalyzerProperties(
        String defaultQuery,
        Long maxUploadBytes,
        Storage storage,
        Queue queue,
        PubSub pubsub,
        Engine engine,
        Job job
) {
    public static final String STANDARD_QUERY = "Analyze this financial document for investment insights";

    public AnalyzerProperties {
        if (defaultQuery == null || defaultQuery.isBlank()) {
            defaultQuery = STANDARD_QUERY;
        }
        if (maxUploadBytes == null) {
            maxUploadBytes = 50L * 1024 * 1024;
        }
        if (storage == null) {
            storage = new Storage(null);
        }
        if (queue == null) {
            queue = new Queue(null, null, null, null);
        }
        if (pubsub == null) {
            pubsub = new PubSub(null, null, null);
        }
        if (engine == null) {
            engine = new Engine(null, null, null, null, null, null, null);
        }
        if (job == null) {
            job = new Job(null, null);
        }
    }

    public static AnalyzerProperties defaults() {
        return new AnalyzerProperties(null, null, null, null, null, null, null);
    }

    public record Storage(String uploadDir) {
        public Storage {
            if (uploadDir == null || uploadDir.isBlank()) {
                uploadDir = "data/uploads";
            }
        }
    }

    public record Queue(String mode, Integer workerThreads, Integer capacity, Long pollTimeoutMs) {
        public Queue {
            if (mode == null || mode.isBlank()) {
                mode = "local";
            }
            if (workerThreads == null || workerThreads < 1) {
                workerThreads = 2;
            }
            if (capacity == null || capacity < 1) {
                capacity = 1000;
            }
            if (pollTimeoutMs == null || pollTimeoutMs < 1) {
                pollTimeoutMs = 500L;
            }
        }
    }

    public record PubSub(String projectId, String topic, String subscription) {
        public PubSub {
            if (projectId == null || projectId.isBlank()) {
                projectId = "local-project";
            }
            if (topic == null || topic.isBlank()) {
                topic = "document-analysis-topic";
            }
            if (subscription == null || subscription.isBlank()) {
                subscription = "document-analysis-sub";
            }
        }
    }

    public record Engine(
            Boolean enabled,
            String projectId,
            String location,
            String model,
            Integer callTimeoutSeconds,
            Integer verifyMaxIterations,
            Integer analyzeMaxIterations
    ) {
        public Engine {
            if (enabled == null) {
                enabled = false;
            }
            if (projectId == null || projectId.isBlank()) {
                projectId = "local-project";
            }
            if (location == null || location.isBlank()) {
                location = "us-central1";
            }
            if (model == null || model.isBlank()) {
                model = "gemini-1.5-flash";
            }
            if (callTimeoutSeconds == null || callTimeoutSeconds < 1) {
                callTimeoutSeconds = 60;
            }
            if (verifyMaxIterations == null || verifyMaxIterations < 1) {
                verifyMaxIterations = 3;
            }
            if (analyzeMaxIterations == null || analyzeMaxIterations < 1) {
                analyzeMaxIterations = 5;
            }
        }
    }

    public record Job(Integer analysisTimeoutSeconds, Integer staleAfterMinutes) {
        public Job {
            if (analysisTimeoutSeconds == null || analysisTimeoutSeconds < 1) {
                analysisTimeoutSeconds = 300;
            }
            if (staleAfterMinutes == null || staleAfterMinutes < 1) {
                staleAfterMinutes = 30;
            }
        }
    }
}
