package com.redditextractor.scraper.service;

import com.redditextractor.scraper.job.JobConflictException;
import com.redditextractor.scraper.job.JobStore;
import com.redditextractor.scraper.job.ScrapeWorkerPool;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapeResponse;
import com.redditextractor.scraper.webhook.WebhookDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for scrape requests.
 *
 * Requests without a webhook run inline on the caller's thread. Requests with one
 * become QUEUED jobs picked up by the worker pool.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScrapeService {

    private final ScrapeRequestValidator validator;
    private final ScrapeRunner runner;
    private final JobStore jobStore;
    private final ScrapeWorkerPool workerPool;
    private final WebhookDispatcher webhookDispatcher;

    /**
     * Runs the whole scrape before returning.
     *
     * @throws ValidationException when the request is rejected
     */
    public ScrapeResponse scrapeNow(ScrapeRequest request) {
        validator.validate(request);
        String runId = "sync-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[{}] Inline scrape: {}", runId, describe(request));
        ScrapeOutcome outcome = runner.run(runId, request, ScrapeCheckpoint.NONE);
        return ScrapeResponses.fromOutcome(request, outcome);
    }

    /**
     * Queues the request as a background job.
     *
     * @throws ValidationException when the request is rejected
     */
    public Job submit(ScrapeRequest request) {
        validator.validate(request);
        Job job = jobStore.create(request);
        log.info("[{}] Queued: {}", job.getId(), describe(request));
        workerPool.signal();
        return job;
    }

    public Job getJob(String id) {
        return jobStore.get(id);
    }

    public List<Job> listJobs(JobStatus status) {
        return jobStore.list(status);
    }

    /**
     * A queued job is cancelled at once. A running job is flagged and stops at its
     * next checkpoint, so the returned snapshot is still RUNNING.
     *
     * @throws JobConflictException when the job is already terminal
     */
    public Job cancel(String id) {
        while (true) {
            Job job = jobStore.get(id);
            try {
                switch (job.getStatus()) {
                    case QUEUED -> {
                        Job cancelled = jobStore.transition(id, JobStatus.QUEUED, JobStatus.CANCELLED,
                                b -> b.error(ScrapeError.of(ScrapeError.JOB_CANCELLED, "Job was cancelled",
                                        "Cancelled before it started")));
                        log.info("[{}] Cancelled while queued", id);
                        if (cancelled.getWebhookDelivery() != null) {
                            webhookDispatcher.dispatch(cancelled);
                        }
                        return cancelled;
                    }
                    case RUNNING -> {
                        Job flagged = jobStore.transition(id, JobStatus.RUNNING, JobStatus.RUNNING,
                                b -> b.cancelRequested(true));
                        log.info("[{}] Cancellation requested, stopping at next checkpoint", id);
                        return flagged;
                    }
                    default -> throw new JobConflictException(id, job.getStatus(),
                            "Job " + id + " already finished with status " + job.getStatus());
                }
            } catch (JobConflictException e) {
                if (jobStore.get(id).isTerminal()) {
                    throw e;
                }
                log.debug("[{}] Status changed during cancel, retrying: {}", id, e.getMessage());
            }
        }
    }

    /**
     * Counts per status plus the number of queued or running jobs.
     */
    public Map<String, Object> summary() {
        List<Job> jobs = jobStore.list(null);
        Map<JobStatus, Long> counts = jobs.stream()
                .collect(Collectors.groupingBy(Job::getStatus, Collectors.counting()));

        Map<String, Long> breakdown = Arrays.stream(JobStatus.values())
                .collect(Collectors.toMap(Enum::name, s -> counts.getOrDefault(s, 0L),
                        (a, b) -> a, LinkedHashMap::new));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalJobs", jobs.size());
        summary.put("statusBreakdown", breakdown);
        summary.put("activeJobs", counts.getOrDefault(JobStatus.QUEUED, 0L) + counts.getOrDefault(JobStatus.RUNNING, 0L));
        return summary;
    }

    private String describe(ScrapeRequest request) {
        String target = request.getStartUrls() != null
                ? request.getStartUrls().size() + " url(s)"
                : "search '" + request.getSearchTerm() + "'";
        return target + ", maxItems=" + request.getMaxItems() + ", format=" + request.getOutputFormat();
    }
}
