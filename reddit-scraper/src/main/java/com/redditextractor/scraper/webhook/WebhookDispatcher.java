package com.redditextractor.scraper.webhook;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.job.JobNotFoundException;
import com.redditextractor.scraper.job.JobStore;
import com.redditextractor.scraper.model.DeliveryAttempt;
import com.redditextractor.scraper.model.DeliveryState;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.WebhookDeliveryRecord;
import com.redditextractor.scraper.service.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers terminal job payloads on the webhook scheduler, independent of the worker slots.
 *
 * Each job has one chain of attempts: an attempt schedules the next one only after
 * it has been recorded, and the in-flight set rejects any overlapping attempt for
 * the same job. Delivery only ever writes the job's delivery record, never its status.
 */
@Component
@Slf4j
public class WebhookDispatcher {

    private final JobStore jobStore;
    private final WebhookSender sender;
    private final WebhookPayloadFactory payloadFactory;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public WebhookDispatcher(JobStore jobStore,
                             WebhookSender sender,
                             WebhookPayloadFactory payloadFactory,
                             TaskScheduler scheduler,
                             Clock clock,
                             ScraperProperties properties) {
        this.jobStore = jobStore;
        this.sender = sender;
        this.payloadFactory = payloadFactory;
        this.scheduler = scheduler;
        this.clock = clock;
        this.retryPolicy = RetryPolicy.from(properties.getWebhook().getRetry());
    }

    /**
     * Queues delivery for a terminal job snapshot. No-op for jobs without a webhook
     * or whose delivery already finished.
     */
    public void dispatch(Job job) {
        WebhookDeliveryRecord delivery = job.getWebhookDelivery();
        if (delivery == null || delivery.isTerminal()) return;
        if (!job.isTerminal()) {
            throw new IllegalArgumentException("Job " + job.getId() + " is still " + job.getStatus());
        }

        byte[] payload;
        try {
            payload = payloadFactory.build(job);
        } catch (RuntimeException e) {
            log.error("[{}] Could not build webhook payload: {}", job.getId(), e.getMessage(), e);
            jobStore.updateDelivery(job.getId(), r -> r.toBuilder()
                    .state(DeliveryState.EXHAUSTED)
                    .nextAttemptAt(null)
                    .build());
            return;
        }

        log.info("[{}] Queuing webhook delivery to {}", job.getId(), delivery.getUrl());
        schedule(job.getId(), payload, clock.instant());
    }

    private void schedule(String jobId, byte[] payload, Instant at) {
        scheduler.schedule(() -> attempt(jobId, payload), at);
    }

    void attempt(String jobId, byte[] payload) {
        if (!inFlight.add(jobId)) {
            log.warn("[{}] Webhook attempt already in flight, dropping duplicate", jobId);
            return;
        }

        Instant retryAt = null;
        try {
            retryAt = deliverOnce(jobId, payload);
        } catch (JobNotFoundException e) {
            log.warn("[{}] Job evicted before webhook delivery finished", jobId);
        } catch (RuntimeException e) {
            log.error("[{}] Webhook attempt crashed: {}", jobId, e.getMessage(), e);
            giveUp(jobId);
        } finally {
            inFlight.remove(jobId);
        }

        if (retryAt != null) {
            schedule(jobId, payload, retryAt);
        }
    }

    private void giveUp(String jobId) {
        try {
            jobStore.updateDelivery(jobId, r -> r.isTerminal() ? r : r.toBuilder()
                    .state(DeliveryState.EXHAUSTED)
                    .nextAttemptAt(null)
                    .build());
        } catch (RuntimeException e) {
            log.error("[{}] Could not mark webhook delivery exhausted: {}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Makes one POST and records it.
     *
     * @return when to try again, or null when delivery is finished
     */
    private Instant deliverOnce(String jobId, byte[] payload) {
        WebhookDeliveryRecord record = jobStore.get(jobId).getWebhookDelivery();
        if (record == null || record.isTerminal()) return null;

        int attemptNumber = record.getAttemptCount() + 1;
        Instant attemptedAt = clock.instant();
        DeliveryOutcome outcome = sender.send(record.getUrl(), payload);

        boolean retry = outcome.isRetryable() && retryPolicy.hasAttemptsLeft(attemptNumber);
        Instant nextAttemptAt = retry ? clock.instant().plus(retryPolicy.delayAfter(attemptNumber)) : null;
        DeliveryState state = outcome.isSuccess()
                ? DeliveryState.DELIVERED
                : retry ? DeliveryState.PENDING : DeliveryState.EXHAUSTED;

        DeliveryAttempt attempt = DeliveryAttempt.builder()
                .attemptNumber(attemptNumber)
                .attemptedAt(attemptedAt)
                .outcome(outcome.getKind())
                .httpStatus(outcome.getHttpStatus())
                .errorClass(outcome.getErrorClass())
                .build();

        jobStore.updateDelivery(jobId, r -> r.toBuilder()
                .attempt(attempt)
                .state(state)
                .nextAttemptAt(nextAttemptAt)
                .build());

        switch (state) {
            case DELIVERED -> log.info("[{}] Webhook delivered on attempt {} (HTTP {})",
                    jobId, attemptNumber, outcome.getHttpStatus());
            case PENDING -> log.warn("[{}] Webhook attempt {} failed ({}), retrying at {}",
                    jobId, attemptNumber, outcome.getErrorClass(), nextAttemptAt);
            case EXHAUSTED -> log.error("[{}] Webhook delivery exhausted after {} attempt(s), last error {}",
                    jobId, attemptNumber, outcome.getErrorClass());
        }
        return nextAttemptAt;
    }
}
