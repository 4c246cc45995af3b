package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.RecordCategory;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapedRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Per-record predicate built from a request's date and NSFW settings.
 *
 * filterByDate and postDateLimit compose: a record must be newer than both cutoffs,
 * so the later of the two wins. Only posts and comments are dated content;
 * users and communities are never dropped by date.
 */
public class RecordFilter {

    private static final Map<String, Duration> WINDOWS = Map.of(
            "hour", Duration.ofHours(1),
            "day", Duration.ofDays(1),
            "week", Duration.ofDays(7),
            "month", Duration.ofDays(30),
            "year", Duration.ofDays(365));

    private final Instant cutoff;
    private final boolean includeNsfw;

    RecordFilter(Instant cutoff, boolean includeNsfw) {
        this.cutoff = cutoff;
        this.includeNsfw = includeNsfw;
    }

    /**
     * @param now reference point for relative windows like "week"
     */
    public static RecordFilter from(ScrapeRequest request, Instant now) {
        Instant windowCutoff = null;
        Duration window = request.getFilterByDate() == null ? null : WINDOWS.get(request.getFilterByDate());
        if (window != null) {
            windowCutoff = now.minus(window);
        }
        return new RecordFilter(later(windowCutoff, request.getPostDateLimitInstant()), request.isIncludeNSFW());
    }

    public static RecordFilter acceptAll() {
        return new RecordFilter(null, true);
    }

    public boolean accepts(ScrapedRecord record) {
        if (!includeNsfw && record.isNsfw()) return false;
        if (cutoff != null && isDated(record) && record.getCreatedAt() != null
                && record.getCreatedAt().isBefore(cutoff)) {
            return false;
        }
        return true;
    }

    private static boolean isDated(ScrapedRecord record) {
        return record.getCategory() == RecordCategory.POSTS || record.getCategory() == RecordCategory.COMMENTS;
    }

    Instant getCutoff() {
        return cutoff;
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
