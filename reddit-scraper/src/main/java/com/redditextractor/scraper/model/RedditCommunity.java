package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RedditCommunity implements ScrapedRecord {

    String name;
    String title;
    String description;
    String url;
    long subscribers;
    boolean nsfw;
    Instant createdAt;

    @Override
    public RecordCategory getCategory() {
        return RecordCategory.COMMUNITIES;
    }
}
