package com.redditextractor.scraper.scheduler;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.job.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Evicts finished jobs once they are older than the retention window.
 *
 * Default: every hour, keeping 24 hours of history. Jobs still waiting on a
 * webhook retry are kept until delivery ends.
 *
 * Override with reddit-scraper.jobs.retention and reddit-scraper.jobs.cleanup-interval-ms.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobRetentionSweeper {

    private final JobStore jobStore;
    private final ScraperProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${reddit-scraper.jobs.cleanup-interval-ms:3600000}",
            initialDelayString = "${reddit-scraper.jobs.cleanup-interval-ms:3600000}")
    public void sweep() {
        try {
            int evicted = evictExpired();
            if (evicted > 0) {
                log.info("Evicted {} finished job(s) older than {}", evicted, properties.getJobs().getRetention());
            }
        } catch (Exception e) {
            log.error("Job retention sweep failed: {}", e.getMessage(), e);
        }
    }

    public int evictExpired() {
        Instant cutoff = clock.instant().minus(properties.getJobs().getRetention());
        return jobStore.evictTerminalBefore(cutoff);
    }
}
