package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single comment. Comment trees are flattened depth-first by the gateway;
 * depth keeps the nesting level (0 = top level).
 */
@Value
@Builder
public class RedditComment implements ScrapedRecord {

    String id;
    String parentId;
    String author;
    String body;
    String subreddit;
    String permalink;
    String postTitle;
    int score;
    int depth;
    boolean nsfw;
    Instant createdAt;

    @Override
    public RecordCategory getCategory() {
        return RecordCategory.COMMENTS;
    }
}
