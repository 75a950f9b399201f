package com.docanalyzer.processing;

/**
 * What a single {@code process} invocation did. Every value counts as a successful
 * delivery from the queue's point of view.
 */
public enum ProcessOutcome {
    /** The job finished with a report. */
    COMPLETED,
    /** The job finished with an error message. */
    FAILED,
    /** Nothing done: the job was already claimed or already terminal. */
    SKIPPED,
    /** No job with that id exists. */
    NOT_FOUND
}
