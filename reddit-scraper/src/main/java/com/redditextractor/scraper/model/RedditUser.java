package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class RedditUser implements ScrapedRecord {

    String username;
    String profileUrl;

    /** author | commenter | profile */
    String role;

    int linkKarma;
    int commentKarma;
    boolean nsfw;
    Instant createdAt;

    @Override
    public RecordCategory getCategory() {
        return RecordCategory.USERS;
    }
}
