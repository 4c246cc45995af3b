package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.JobProgress;
import com.redditextractor.scraper.model.ScrapeError;

import java.util.List;

/**
 * Called by the scrape loop at every page boundary.
 */
@FunctionalInterface
public interface ScrapeCheckpoint {

    /** For inline scrapes: nothing to persist, never cancelled. */
    ScrapeCheckpoint NONE = (progress, newErrors) -> true;

    /**
     * @param progress  counters after the page just processed
     * @param newErrors errors recorded since the previous checkpoint, in order
     * @return false to stop paging; the run then ends as cancelled
     */
    boolean onPage(JobProgress progress, List<ScrapeError> newErrors);
}
