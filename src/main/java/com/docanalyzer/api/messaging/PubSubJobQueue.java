package com.docanalyzer.api.messaging;

import com.docanalyzer.config.AnalyzerProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.core.ApiFuture;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.TopicName;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Publishes job messages to Google Cloud Pub/Sub.
 * Supports both real Pub/Sub and the local emulator (via PUBSUB_EMULATOR_HOST).
 * Only loads when analyzer.queue.mode=pubsub.
 */
@Service
@ConditionalOnProperty(name = "analyzer.queue.mode", havingValue = "pubsub")
public class PubSubJobQueue implements JobQueue {

    private static final Logger logger = LoggerFactory.getLogger(PubSubJobQueue.class);
    private static final long PUBLISH_TIMEOUT_SECONDS = 10;

    private final String projectId;
    private final String topicName;
    private final ObjectMapper objectMapper;
    private Publisher publisher;

    public PubSubJobQueue(AnalyzerProperties properties, ObjectMapper objectMapper) {
        this.projectId = properties.pubsub().projectId();
        this.topicName = properties.pubsub().topic();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initialize() {
        try {
            TopicName topic = TopicName.of(projectId, topicName);
            // Publisher picks up PUBSUB_EMULATOR_HOST on its own
            this.publisher = Publisher.newBuilder(topic).build();

            String emulatorHost = System.getenv("PUBSUB_EMULATOR_HOST");
            if (emulatorHost != null && !emulatorHost.isEmpty()) {
                logger.info("Using Pub/Sub emulator at: {}", emulatorHost);
            }
            logger.info("Pub/Sub job queue initialized for topic: projects/{}/topics/{}", projectId, topicName);
        } catch (Exception e) {
            logger.error("Failed to initialize Pub/Sub publisher", e);
            throw new IllegalStateException("Failed to initialize Pub/Sub publisher", e);
        }
    }

    @Override
    public void enqueue(JobMessage message) {
        PubsubMessage pubsubMessage;
        try {
            pubsubMessage = PubsubMessage.newBuilder()
                    .setData(ByteString.copyFromUtf8(objectMapper.writeValueAsString(message)))
                    .putAttributes("job_id", message.jobId().toString())
                    .putAttributes("action", "ANALYZE")
                    .build();
        } catch (JsonProcessingException e) {
            throw new QueueUnavailableException("Failed to serialize job message", e);
        }

        try {
            ApiFuture<String> future = publisher.publish(pubsubMessage);
            String messageId = future.get(PUBLISH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            logger.info("Published job {} to Pub/Sub, message ID: {}", message.jobId(), messageId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueUnavailableException("Interrupted while publishing to Pub/Sub", e);
        } catch (Exception e) {
            logger.error("Failed to publish job {} to Pub/Sub", message.jobId(), e);
            throw new QueueUnavailableException("Failed to publish message to Pub/Sub", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (publisher != null) {
            try {
                publisher.shutdown();
                publisher.awaitTermination(5, TimeUnit.SECONDS);
                logger.info("Pub/Sub publisher shut down");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while shutting down Pub/Sub publisher");
            }
        }
    }
}
