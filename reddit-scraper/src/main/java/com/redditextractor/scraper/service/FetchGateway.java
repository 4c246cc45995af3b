package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.RecordCategory;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.TargetResource;

/**
 * Retrieves one page of remote records per call. Stateless between calls.
 */
public interface FetchGateway {

    /**
     * @param resource what to read from
     * @param category which record type to read
     * @param cursor   null for the first page, otherwise the previous page's nextCursor
     * @param pageSize requested page size, already clamped to the configured maximum
     * @param request  sort order and time filter are taken from here
     * @throws TransientFetchException for failures worth retrying
     * @throws FatalFetchException     for failures that should abort the job
     */
    FetchPage fetchPage(TargetResource resource, RecordCategory category, String cursor,
                        int pageSize, ScrapeRequest request);

    /**
     * Whether the gateway can produce the given category for the resource at all.
     * Unsupported combinations are skipped without a remote call.
     */
    boolean supports(TargetResource resource, RecordCategory category);
}
