package com.redditextractor.scraper.job;

import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.WebhookDeliveryRecord;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The single shared mutable structure. Callers hold job ids, never references
 * into stored state; every read is an immutable snapshot and every write goes
 * through an atomic per-job update.
 */
public interface JobStore {

    /** Stores a new QUEUED job for the request. */
    Job create(ScrapeRequest request);

    /**
     * @throws JobNotFoundException when unknown or already evicted
     */
    Job get(String id);

    /**
     * Newest first. A null filter lists every job.
     */
    List<Job> list(JobStatus statusFilter);

    /**
     * Atomic compare-and-update. Fails with {@link JobConflictException} when the
     * job is not in {@code expected} or {@code expected -> next} is not a legal move.
     * Otherwise applies the mutator to a builder seeded from the current snapshot
     * and commits it under the new status.
     *
     * Identity, request, creation time and webhook delivery are not writable
     * through the mutator. startedAt and finishedAt are stamped by the store
     * on entering RUNNING and a terminal status. Progress may not go backwards.
     * A move to SUCCEEDED on a job with a pending cancel request commits as
     * CANCELLED instead, without a result.
     *
     * @return the committed snapshot
     */
    Job transition(String id, JobStatus expected, JobStatus next, UnaryOperator<Job.JobBuilder> mutator);

    /**
     * Atomic update of a job's webhook delivery record. Never changes status.
     *
     * @throws IllegalStateException when the job has no webhook
     */
    Job updateDelivery(String id, UnaryOperator<WebhookDeliveryRecord> mutator);

    /**
     * Drops terminal jobs finished before the cutoff whose webhook delivery, if any,
     * is no longer pending.
     *
     * @return number of jobs evicted
     */
    int evictTerminalBefore(Instant cutoff);
}
