package com.docanalyzer.shared.model;

import java.util.Locale;

/**
 * Lifecycle states of an analysis job. Transitions only move forward:
 * PENDING to PROCESSING to COMPLETED or FAILED. Terminal states are absorbing.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Lower-case form used in API responses.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
