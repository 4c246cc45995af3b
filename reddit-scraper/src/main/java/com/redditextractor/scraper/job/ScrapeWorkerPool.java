package com.redditextractor.scraper.job;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobProgress;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.service.ScrapeCheckpoint;
import com.redditextractor.scraper.service.ScrapeOutcome;
import com.redditextractor.scraper.service.ScrapeRunner;
import com.redditextractor.scraper.webhook.WebhookDispatcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of worker slots, each a long-running loop on the worker executor.
 *
 * A free slot claims the oldest QUEUED job through the store's QUEUED → RUNNING
 * transition; losing the race to another slot or to a cancel just moves on to the
 * next candidate. The claimed job runs to a terminal status on that slot, then its
 * webhook (if any) is handed to the dispatcher. Idle slots park on a semaphore
 * that {@link #signal()} releases and that also times out, so a missed signal
 * only costs one poll interval.
 */
@Component
@Slf4j
public class ScrapeWorkerPool {

    private final JobStore jobStore;
    private final ScrapeRunner runner;
    private final WebhookDispatcher webhookDispatcher;
    private final ThreadPoolTaskExecutor executor;
    private final ScraperProperties.Worker config;

    private final Semaphore wakeups = new Semaphore(0);
    private volatile boolean running;

    public ScrapeWorkerPool(JobStore jobStore,
                            ScrapeRunner runner,
                            WebhookDispatcher webhookDispatcher,
                            @Qualifier("scrapeWorkerExecutor") ThreadPoolTaskExecutor executor,
                            ScraperProperties properties) {
        this.jobStore = jobStore;
        this.runner = runner;
        this.webhookDispatcher = webhookDispatcher;
        this.executor = executor;
        this.config = properties.getWorker();
    }

    @PostConstruct
    public void start() {
        running = true;
        for (int slot = 1; slot <= config.getMaxConcurrentJobs(); slot++) {
            int id = slot;
            executor.execute(() -> slotLoop(id));
        }
        log.info("Worker pool started with {} slot(s)", config.getMaxConcurrentJobs());
    }

    @PreDestroy
    public void stop() {
        running = false;
        wakeups.release(config.getMaxConcurrentJobs());
        log.info("Worker pool stopping");
    }

    /** Wakes one idle slot; called after a job is queued. */
    public void signal() {
        wakeups.release();
    }

    private void slotLoop(int slot) {
        log.debug("Worker slot {} up", slot);
        while (running) {
            Optional<Job> claimed = claimNext();
            if (claimed.isPresent()) {
                execute(claimed.get());
                continue;
            }
            try {
                wakeups.tryAcquire(config.getIdlePollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("Worker slot {} down", slot);
    }

    /**
     * Oldest queued job this slot managed to move to RUNNING, if any.
     */
    Optional<Job> claimNext() {
        List<Job> queued = jobStore.list(JobStatus.QUEUED).stream()
                .sorted(Comparator.comparingLong(Job::getSequence))
                .toList();
        for (Job candidate : queued) {
            try {
                Job job = jobStore.transition(candidate.getId(), JobStatus.QUEUED, JobStatus.RUNNING, b -> b);
                log.info("[{}] Claimed by {}", job.getId(), Thread.currentThread().getName());
                return Optional.of(job);
            } catch (JobConflictException | JobNotFoundException e) {
                log.debug("[{}] Lost claim: {}", candidate.getId(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /**
     * Runs a claimed job to a terminal status. Never throws.
     */
    void execute(Job job) {
        String id = job.getId();
        Job terminal;
        try {
            ScrapeOutcome outcome = runner.run(id, job.getRequest(), checkpoint(id));
            terminal = complete(id, outcome);
        } catch (RuntimeException e) {
            log.error("[{}] Worker failed outside the scrape loop: {}", id, e.getMessage(), e);
            terminal = failSafely(id, e);
        }
        if (terminal == null) return;

        log.info("[{}] Job {} ({} items, {} errors)", id, terminal.getStatus(),
                terminal.getResult() == null ? 0 : terminal.getResult().getItemsReturned(),
                terminal.getErrors().size());
        if (terminal.getWebhookDelivery() != null) {
            try {
                webhookDispatcher.dispatch(terminal);
            } catch (RuntimeException e) {
                log.error("[{}] Could not queue webhook delivery: {}", id, e.getMessage(), e);
            }
        }
    }

    /**
     * Writes progress and errors at each page boundary. Returns false once a cancel
     * has been requested, or when the job is no longer ours.
     */
    private ScrapeCheckpoint checkpoint(String id) {
        return (JobProgress progress, List<ScrapeError> newErrors) -> {
            try {
                Job updated = jobStore.transition(id, JobStatus.RUNNING, JobStatus.RUNNING,
                        b -> b.progress(progress).errors(newErrors));
                return !updated.isCancelRequested();
            } catch (JobConflictException | JobNotFoundException e) {
                log.warn("[{}] Checkpoint rejected, stopping: {}", id, e.getMessage());
                return false;
            }
        };
    }

    private Job complete(String id, ScrapeOutcome outcome) {
        JobStatus next = outcome.getStatus();
        return jobStore.transition(id, JobStatus.RUNNING, next, b -> {
            b.clearErrors().errors(outcome.getErrors());
            if (next == JobStatus.CANCELLED) {
                b.error(ScrapeError.of(ScrapeError.JOB_CANCELLED, "Job was cancelled",
                        "Stopped after " + outcome.getPagesProcessed() + " page(s); partial results discarded"));
            }
            return b.result(next == JobStatus.SUCCEEDED ? outcome.getResult() : null);
        });
    }

    private Job failSafely(String id, RuntimeException cause) {
        try {
            return jobStore.transition(id, JobStatus.RUNNING, JobStatus.FAILED, b -> b.error(ScrapeError.fatal(
                    ScrapeError.INTERNAL_ERROR, "Unexpected worker error",
                    cause.getClass().getSimpleName() + ": " + cause.getMessage())));
        } catch (RuntimeException e) {
            log.error("[{}] Could not record worker failure: {}", id, e.getMessage());
            return null;
        }
    }
}
