package com.redditextractor.scraper.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools and shared infrastructure.
 *
 * Worker slots and webhook deliveries run on separate pools.
 */
@Configuration
@Slf4j
public class ScraperConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per worker slot; each slot loop lives for the whole application.
     */
    @Bean(name = "scrapeWorkerExecutor")
    public ThreadPoolTaskExecutor scrapeWorkerExecutor(ScraperProperties properties) {
        int slots = properties.getWorker().getMaxConcurrentJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("scrape-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Worker slot rejected, pool already has {} slots", slots));
        return executor;
    }

    /**
     * Runs webhook attempts and their delayed retries. Also picks up @Scheduled tasks.
     */
    @Bean(name = "webhookScheduler")
    public ThreadPoolTaskScheduler webhookScheduler(ScraperProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getWebhook().getMaxConcurrentDeliveries());
        scheduler.setThreadNamePrefix("webhook-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Webhook task failed: {}", t.getMessage(), t));
        return scheduler;
    }
}
