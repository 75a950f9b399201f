package com.docanalyzer.processing;

import com.docanalyzer.api.messaging.JobMessage;
import com.docanalyzer.config.AnalyzerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsub.v1.Subscriber;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Pulls job messages from the Pub/Sub subscription and hands them to the orchestrator.
 * Only loads when analyzer.queue.mode=pubsub.
 *
 * <p>Messages are acked once the orchestrator returns, whatever the job outcome.
 * They are nacked only when the orchestrator throws, which means the job store was
 * unreachable and the job is still recoverable by redelivery.
 */
@Service
@ConditionalOnProperty(name = "analyzer.queue.mode", havingValue = "pubsub")
public class PubSubJobWorker {

    private static final Logger logger = LoggerFactory.getLogger(PubSubJobWorker.class);

    private final JobOrchestrator jobOrchestrator;
    private final ObjectMapper objectMapper;
    private final String projectId;
    private final String subscriptionName;
    private Subscriber subscriber;

    public PubSubJobWorker(JobOrchestrator jobOrchestrator, ObjectMapper objectMapper, AnalyzerProperties properties) {
        this.jobOrchestrator = jobOrchestrator;
        this.objectMapper = objectMapper;
        this.projectId = properties.pubsub().projectId();
        this.subscriptionName = properties.pubsub().subscription();
    }

    @PostConstruct
    public void initialize() {
        try {
            logger.info("Initializing Pub/Sub subscriber for: projects/{}/subscriptions/{}", projectId, subscriptionName);

            MessageReceiver receiver = (PubsubMessage message, AckReplyConsumer consumer) -> {
                if (handleMessage(message)) {
                    consumer.ack();
                } else {
                    consumer.nack();
                }
            };

            this.subscriber = Subscriber.newBuilder(ProjectSubscriptionName.of(projectId, subscriptionName), receiver)
                    .build();
            subscriber.startAsync().awaitRunning();
            logger.info("Pub/Sub job worker started and listening for messages");
        } catch (IllegalStateException e) {
            logger.error("Failed to initialize Pub/Sub subscriber", e);
            throw new IllegalStateException("Failed to initialize Pub/Sub job worker", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (subscriber != null) {
            subscriber.stopAsync();
            logger.info("Pub/Sub job worker stopped");
        }
    }

    /**
     * @return true to ack the message, false to have it redelivered
     */
    boolean handleMessage(PubsubMessage message) {
        Optional<UUID> jobId = readJobId(message);
        if (jobId.isEmpty()) {
            // Redelivering a message we cannot read would never succeed.
            logger.error("Dropping message {} without a usable job_id", message.getMessageId());
            return true;
        }

        try {
            ProcessOutcome outcome = jobOrchestrator.process(jobId.get());
            logger.debug("Message {} for job {} finished with outcome {}", message.getMessageId(), jobId.get(), outcome);
            return true;
        } catch (RuntimeException e) {
            logger.error("Failed to process message for job {}, nacking", jobId.get(), e);
            return false;
        }
    }

    private Optional<UUID> readJobId(PubsubMessage message) {
        String jobIdValue = message.getAttributesMap().get("job_id");
        if (jobIdValue == null && !message.getData().isEmpty()) {
            try {
                JobMessage payload = objectMapper.readValue(message.getData().toStringUtf8(), JobMessage.class);
                return Optional.ofNullable(payload.jobId());
            } catch (IOException e) {
                logger.warn("Could not parse message payload: {}", e.getMessage());
                return Optional.empty();
            }
        }
        if (jobIdValue == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(jobIdValue));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid job_id format: {}", jobIdValue);
            return Optional.empty();
        }
    }
}
