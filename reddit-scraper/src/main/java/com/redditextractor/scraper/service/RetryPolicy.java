package com.redditextractor.scraper.service;

import com.redditextractor.scraper.config.ScraperProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * The page-fetch loop drives it through a Resilience4j {@link Retry} (blocking, per page).
 * The webhook dispatcher only asks it for delays and attempt budget, since delivery
 * retries are scheduled rather than slept on.
 */
@Getter
public class RetryPolicy {

    private final int maxAttempts;
    private final IntervalFunction backoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                initialBackoff.toMillis(), multiplier, maxBackoff.toMillis());
    }

    public static RetryPolicy from(ScraperProperties.Retry config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoff(),
                config.getMultiplier(), config.getMaxBackoff());
    }

    /**
     * A fresh Resilience4j retry that only retries on the given exception type;
     * anything else is rethrown on the first failure.
     */
    public Retry newRetry(String name, Class<? extends Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnException(retryOn::isInstance)
                .build();
        return Retry.of(name, config);
    }

    /** Delay to wait after the given number of failed attempts (1-based). */
    public Duration delayAfter(int failedAttempts) {
        return Duration.ofMillis(backoff.apply(failedAttempts));
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }
}
