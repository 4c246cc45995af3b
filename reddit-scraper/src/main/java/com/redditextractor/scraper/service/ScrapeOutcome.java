package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * How one run of the scrape loop ended. status is always terminal.
 * result is null unless the run succeeded; errors holds every entry in the order recorded.
 */
@Value
@Builder
public class ScrapeOutcome {

    JobStatus status;
    ScrapeResult result;
    @Singular List<ScrapeError> errors;
    int pagesProcessed;
    Instant startedAt;
    Instant finishedAt;

    public boolean isSucceeded() {
        return status == JobStatus.SUCCEEDED;
    }
}
