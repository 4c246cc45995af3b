package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result set. Each collection keeps remote fetch order.
 *
 * totalItems counts every record seen (filtered or past the ceiling included),
 * itemsReturned only those kept. itemsReturned never exceeds maxItems.
 */
@Value
@Builder
public class ScrapeResult {

    public static final ScrapeResult EMPTY = ScrapeResult.builder().build();

    @Singular List<RedditPost> posts;
    @Singular List<RedditComment> comments;
    @Singular List<RedditUser> users;
    @Singular List<RedditCommunity> communities;

    int totalItems;
    int itemsReturned;
}
