package com.redditextractor.scraper.job;

import com.redditextractor.scraper.model.JobStatus;
import lombok.Getter;

/**
 * A state transition lost a race or was not allowed from the job's current status.
 * Callers re-read the job and decide again.
 */
@Getter
public class JobConflictException extends RuntimeException {

    private final String jobId;
    private final JobStatus actual;

    public JobConflictException(String jobId, JobStatus actual, String message) {
        super(message);
        this.jobId = jobId;
        this.actual = actual;
    }

    public static JobConflictException unexpectedStatus(String jobId, JobStatus expected, JobStatus actual) {
        return new JobConflictException(jobId, actual,
                "Job " + jobId + " is " + actual + ", expected " + expected);
    }

    public static JobConflictException illegalTransition(String jobId, JobStatus from, JobStatus to) {
        return new JobConflictException(jobId, from,
                "Job " + jobId + " cannot move from " + from + " to " + to);
    }
}
