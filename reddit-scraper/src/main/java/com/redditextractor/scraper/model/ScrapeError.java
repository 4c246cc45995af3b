package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * A classified error entry as it appears in job state and response envelopes.
 * fatal marks the entry that ended a job; transient entries accumulate.
 */
@Value
@Builder
public class ScrapeError {

    public static final String JOB_FAILED = "JOB_FAILED";
    public static final String JOB_CANCELLED = "JOB_CANCELLED";
    public static final String NO_PAGES_FETCHED = "NO_PAGES_FETCHED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    String code;
    String message;
    String details;

    @JsonIgnore
    boolean fatal;

    public static ScrapeError of(String code, String message, String details) {
        return ScrapeError.builder().code(code).message(message).details(details).build();
    }

    public static ScrapeError fatal(String code, String message, String details) {
        return ScrapeError.builder().code(code).message(message).details(details).fatal(true).build();
    }
}
