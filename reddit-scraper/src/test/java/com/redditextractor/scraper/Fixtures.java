package com.redditextractor.scraper;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.ScrapeRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private Fixtures() {
    }

    public static List<RedditPost> posts(String prefix, int count) {
        List<RedditPost> posts = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            posts.add(post(prefix + i, NOW.minus(Duration.ofMinutes(i))));
        }
        return posts;
    }

    public static RedditPost post(String id, Instant createdAt) {
        return RedditPost.builder()
                .id(id)
                .title("Post " + id)
                .content("Body of " + id)
                .author("author_" + id)
                .subreddit("java")
                .permalink("https://www.reddit.com/r/java/comments/" + id + "/")
                .url("https://www.reddit.com/r/java/comments/" + id + "/")
                .score(10)
                .numComments(2)
                .createdAt(createdAt)
                .build();
    }

    public static RedditComment comment(String id, Instant createdAt) {
        return RedditComment.builder()
                .id(id)
                .author("commenter_" + id)
                .body("Comment " + id)
                .subreddit("java")
                .postTitle("Post title")
                .createdAt(createdAt)
                .build();
    }

    public static ScrapeRequest search(String term, int maxItems) {
        return ScrapeRequest.builder()
                .searchTerm(term)
                .maxItems(maxItems)
                .build();
    }

    /** Properties with millisecond backoffs and no politeness delay. */
    public static ScraperProperties fastProperties() {
        ScraperProperties properties = new ScraperProperties();
        properties.getFetch().setRateLimitDelayMs(0);
        properties.getFetch().setRetry(new ScraperProperties.Retry(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(5)));
        properties.getWebhook().setRetry(new ScraperProperties.Retry(3, Duration.ofMillis(1), 2.0, Duration.ofMillis(5)));
        properties.getWorker().setMaxConcurrentJobs(2);
        properties.getWorker().setIdlePollInterval(Duration.ofMillis(20));
        return properties;
    }
}
