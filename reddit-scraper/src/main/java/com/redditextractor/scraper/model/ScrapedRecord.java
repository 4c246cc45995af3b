package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Common view over every record type the Fetch Gateway returns.
 * The aggregator only needs these three facts to filter and bucket a record.
 */
public interface ScrapedRecord {

    @JsonIgnore
    RecordCategory getCategory();

    /** Creation time on the remote platform, null when the platform doesn't expose one. */
    Instant getCreatedAt();

    boolean isNsfw();
}
