package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.ScrapedRecord;

import java.util.List;

/**
 * One page of records plus the cursor for the next one; nextCursor is null when done.
 */
public record FetchPage(List<ScrapedRecord> records, String nextCursor) {

    public FetchPage {
        records = List.copyOf(records);
    }

    public static FetchPage last(List<? extends ScrapedRecord> records) {
        return new FetchPage(List.copyOf(records), null);
    }

    public static FetchPage of(List<? extends ScrapedRecord> records, String nextCursor) {
        return new FetchPage(List.copyOf(records), nextCursor);
    }

    public boolean isLast() {
        return nextCursor == null || nextCursor.isBlank();
    }
}
