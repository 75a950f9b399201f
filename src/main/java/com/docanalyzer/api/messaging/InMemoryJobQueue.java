package com.docanalyzer.api.messaging;

import com.docanalyzer.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process queue used when analyzer.queue.mode=local (the default).
 * A full queue is reported as unavailable rather than blocking the submitter.
 */
@Service
@ConditionalOnProperty(name = "analyzer.queue.mode", havingValue = "local", matchIfMissing = true)
public class InMemoryJobQueue implements PollableJobQueue {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private final BlockingQueue<JobMessage> messages;

    @Autowired
    public InMemoryJobQueue(AnalyzerProperties properties) {
        this(properties.queue().capacity());
    }

    public InMemoryJobQueue(int capacity) {
        this.messages = new LinkedBlockingQueue<>(capacity);
        logger.info("In-memory job queue initialized with capacity {}", capacity);
    }

    @Override
    public void enqueue(JobMessage message) {
        if (!messages.offer(message)) {
            logger.warn("In-memory job queue is full, rejecting job {}", message.jobId());
            throw new QueueUnavailableException("Job queue is full");
        }
        logger.debug("Enqueued job {} (depth={})", message.jobId(), messages.size());
    }

    @Override
    public Optional<JobMessage> dequeue(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return messages.size();
    }
}
