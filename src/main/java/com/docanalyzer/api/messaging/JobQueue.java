package com.docanalyzer.api.messaging;

/**
 * Submission side of the at-least-once channel between the gateway and the workers.
 * Implementations may publish to Pub/Sub or hand off to an in-process queue.
 */
public interface JobQueue {

    /**
     * Hands a job to the workers.
     *
     * @param message job reference
     * @throws QueueUnavailableException if the message was not accepted
     */
    void enqueue(JobMessage message);
}
