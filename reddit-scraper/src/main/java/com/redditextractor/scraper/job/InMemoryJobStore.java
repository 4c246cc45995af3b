package com.redditextractor.scraper.job;

import com.redditextractor.scraper.model.DeliveryState;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.WebhookDeliveryRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Process-local job store. Each update runs inside ConcurrentHashMap.compute,
 * so writes to one job are serialized while readers only ever see whole snapshots.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> NEWEST_FIRST = Comparator
            .comparing(Job::getCreatedAt)
            .thenComparingLong(Job::getSequence)
            .reversed();

    private final Clock clock;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Job create(ScrapeRequest request) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .sequence(sequence.incrementAndGet())
                .status(JobStatus.QUEUED)
                .request(request)
                .createdAt(clock.instant())
                .webhookDelivery(request.getWebhookUrl() == null ? null : WebhookDeliveryRecord.pending(request.getWebhookUrl()))
                .build();
        jobs.put(job.getId(), job);
        log.info("[{}] Job created (webhook={})", job.getId(), job.getWebhookDelivery() != null);
        return job;
    }

    @Override
    public Job get(String id) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return job;
    }

    @Override
    public List<Job> list(JobStatus statusFilter) {
        return jobs.values().stream()
                .filter(job -> statusFilter == null || job.getStatus() == statusFilter)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Job transition(String id, JobStatus expected, JobStatus next, UnaryOperator<Job.JobBuilder> mutator) {
        Job updated = jobs.compute(id, (key, current) -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (current.getStatus() != expected) {
                throw JobConflictException.unexpectedStatus(id, expected, current.getStatus());
            }
            if (!expected.canTransitionTo(next)) {
                throw JobConflictException.illegalTransition(id, expected, next);
            }
            Job candidate = mutator.apply(current.toBuilder()).build();
            if (candidate.getProgress().isBehind(current.getProgress())) {
                throw new IllegalArgumentException("Progress of job " + id + " cannot go backwards");
            }
            if (next == JobStatus.SUCCEEDED && current.isCancelRequested()) {
                return commit(current, cancelledInsteadOfSucceeded(candidate), JobStatus.CANCELLED);
            }
            return commit(current, candidate, next);
        });
        if (expected != updated.getStatus()) {
            log.debug("[{}] {} -> {}", id, expected, updated.getStatus());
        }
        return updated;
    }

    @Override
    public Job updateDelivery(String id, UnaryOperator<WebhookDeliveryRecord> mutator) {
        return jobs.compute(id, (key, current) -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (current.getWebhookDelivery() == null) {
                throw new IllegalStateException("Job " + id + " has no webhook");
            }
            return current.toBuilder()
                    .webhookDelivery(mutator.apply(current.getWebhookDelivery()))
                    .build();
        });
    }

    @Override
    public int evictTerminalBefore(Instant cutoff) {
        int evicted = 0;
        for (Job job : jobs.values()) {
            if (isEvictable(job, cutoff) && jobs.remove(job.getId(), job)) {
                evicted++;
            }
        }
        return evicted;
    }

    private boolean isEvictable(Job job, Instant cutoff) {
        if (!job.isTerminal() || job.getFinishedAt() == null || !job.getFinishedAt().isBefore(cutoff)) {
            return false;
        }
        WebhookDeliveryRecord delivery = job.getWebhookDelivery();
        return delivery == null || delivery.getState() != DeliveryState.PENDING;
    }

    private static Job cancelledInsteadOfSucceeded(Job candidate) {
        return candidate.toBuilder()
                .result(null)
                .error(ScrapeError.of(ScrapeError.JOB_CANCELLED, "Job was cancelled",
                        "Cancel requested before the job finished; results discarded"))
                .build();
    }

    /**
     * Applies the mutator's changes but keeps the fields the store owns.
     */
    private Job commit(Job current, Job candidate, JobStatus next) {
        Instant now = clock.instant();
        Instant startedAt = current.getStartedAt();
        if (startedAt == null && next == JobStatus.RUNNING) {
            startedAt = now;
        }
        Instant finishedAt = current.getFinishedAt();
        if (finishedAt == null && next.isTerminal()) {
            finishedAt = now;
        }
        return candidate.toBuilder()
                .id(current.getId())
                .sequence(current.getSequence())
                .status(next)
                .request(current.getRequest())
                .createdAt(current.getCreatedAt())
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .cancelRequested(current.isCancelRequested() || candidate.isCancelRequested())
                .webhookDelivery(current.getWebhookDelivery())
                .build();
    }
}
