package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ResultMetadata {

    int totalItems;
    int itemsReturned;
    ScrapeRequest requestParams;
    Instant scrapedAt;

    /** Seconds with two decimals and an "s" suffix, e.g. "3.14s" */
    String executionTime;
}
