package com.docanalyzer.api.messaging;

import java.time.Duration;
import java.util.Optional;

/**
 * A job queue that workers pull from.
 */
public interface PollableJobQueue extends JobQueue {

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the next message, or empty if none arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<JobMessage> dequeue(Duration timeout) throws InterruptedException;
}
