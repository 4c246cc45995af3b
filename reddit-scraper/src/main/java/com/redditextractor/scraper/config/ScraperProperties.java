package com.redditextractor.scraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "reddit-scraper")
@Data
public class ScraperProperties {

    private Worker worker = new Worker();
    private Fetch fetch = new Fetch();
    private Webhook webhook = new Webhook();
    private Jobs jobs = new Jobs();

    @Data
    public static class Worker {
        private int maxConcurrentJobs = 4;
        private Duration idlePollInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class Fetch {
        private String baseUrl = "https://www.reddit.com";
        private String userAgent = "RedditExtractor/1.0";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private long rateLimitDelayMs = 1000;
        private int maxPostsPerPage = 100;
        private int maxCommentsPerPage = 100;
        private Proxy proxy = new Proxy();
        private Retry retry = new Retry(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));

        @Data
        public static class Proxy {
            private String host;
            private int port;
            private String username;
            private String password;
            // Echoes the caller's public IP; used by the proxy connectivity check
            private String checkUrl = "https://httpbin.org/ip";

            public boolean isConfigured() {
                return host != null && !host.isBlank() && port > 0;
            }
        }
    }

    @Data
    public static class Webhook {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxConcurrentDeliveries = 4;
        private String userAgent = "RedditExtractor-Webhook/1.0";
        private Retry retry = new Retry(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));
    }

    @Data
    public static class Jobs {
        /** Terminal jobs older than this are evicted */
        private Duration retention = Duration.ofHours(24);
        private long cleanupIntervalMs = 3_600_000;
    }

    /**
     * Bounded exponential backoff shared by page fetches and webhook delivery.
     * maxAttempts counts the first try.
     */
    @Data
    public static class Retry {
        private int maxAttempts;
        private Duration initialBackoff;
        private double multiplier;
        private Duration maxBackoff;

        public Retry() {
            this(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));
        }

        public Retry(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
            this.maxAttempts = maxAttempts;
            this.initialBackoff = initialBackoff;
            this.multiplier = multiplier;
            this.maxBackoff = maxBackoff;
        }
    }
}
