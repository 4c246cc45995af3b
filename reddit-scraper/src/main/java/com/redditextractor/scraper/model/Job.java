package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a scrape job. The job store hands these out and swaps
 * them atomically; nobody mutates a job in place.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {

    String id;

    /** Creation order inside the store, used to break createdAt ties */
    @JsonIgnore
    long sequence;

    JobStatus status;
    ScrapeRequest request;

    @Builder.Default JobProgress progress = JobProgress.NONE;

    /** Only set on SUCCEEDED */
    ScrapeResult result;

    @Singular
    @JsonInclude(JsonInclude.Include.ALWAYS)
    List<ScrapeError> errors;

    Instant createdAt;
    Instant startedAt;
    Instant finishedAt;

    /** Set by cancel() on a running job; observed by the worker at the next checkpoint */
    boolean cancelRequested;

    /** Null when the request has no webhook */
    WebhookDeliveryRecord webhookDelivery;

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
