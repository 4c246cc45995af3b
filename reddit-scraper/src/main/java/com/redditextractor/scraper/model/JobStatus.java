package com.redditextractor.scraper.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a scrape job.
 *
 * Legal moves: QUEUED → RUNNING → {SUCCEEDED, FAILED}, QUEUED/RUNNING → CANCELLED.
 * RUNNING → RUNNING is allowed as a progress-only update at a checkpoint.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(RUNNING, SUCCEEDED, FAILED, CANCELLED);
            default -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
