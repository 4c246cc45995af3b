package com.redditextractor.scraper.service;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.RecordCategory;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.TargetResource;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The paginated fetch loop shared by inline scrapes and background jobs.
 *
 * For each target and each requested category the loop pages through the
 * Fetch Gateway until the gateway runs out of pages, the per-target page limit
 * is hit, or the aggregator saturates. A page is retried on transient errors;
 * once its attempts are spent the rest of that stream is skipped. A fatal error
 * ends the run as FAILED. The run only fails for skipped pages when none succeeded.
 *
 * Nothing escapes run(): unexpected exceptions become an INTERNAL_ERROR outcome.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeRunner {

    private final FetchGateway gateway;
    private final RedditUrlParser urlParser;
    private final ScraperProperties properties;
    private final Clock clock;

    public ScrapeOutcome run(String runId, ScrapeRequest request, ScrapeCheckpoint checkpoint) {
        Instant startedAt = clock.instant();
        RunState state = new RunState(runId, request, startedAt);

        try {
            for (FetchStream stream : plan(request)) {
                if (!drain(stream, state, checkpoint)) {
                    log.info("[{}] Cancelled after {} pages", runId, state.pagesProcessed);
                    return state.finish(JobStatus.CANCELLED, clock.instant());
                }
                if (state.aggregator.isSaturated()) {
                    log.debug("[{}] maxItems={} reached, stopping pagination", runId, request.getMaxItems());
                    break;
                }
            }
        } catch (FatalFetchException e) {
            log.error("[{}] Fatal fetch error: {}", runId, e.getMessage());
            state.errors.add(e.toError(state.location));
            return state.finish(JobStatus.FAILED, clock.instant());
        } catch (RuntimeException e) {
            log.error("[{}] Scrape loop crashed: {}", runId, e.getMessage(), e);
            state.errors.add(ScrapeError.fatal(ScrapeError.INTERNAL_ERROR,
                    "Unexpected error during scrape", e.getClass().getSimpleName() + ": " + e.getMessage()));
            return state.finish(JobStatus.FAILED, clock.instant());
        }

        if (state.pagesProcessed == 0 && state.skippedStreams > 0) {
            log.error("[{}] Every page failed, no data fetched", runId);
            state.errors.add(ScrapeError.fatal(ScrapeError.NO_PAGES_FETCHED,
                    "No pages could be fetched", state.skippedStreams + " stream(s) skipped after retries"));
            return state.finish(JobStatus.FAILED, clock.instant());
        }

        log.info("[{}] Scrape finished: {} pages, {} items kept of {} seen",
                runId, state.pagesProcessed, state.aggregator.getItemsReturned(), state.aggregator.getTotalItems());
        return state.finish(JobStatus.SUCCEEDED, clock.instant());
    }

    // ── Loop ─────────────────────────────────────────────────────────────────

    /**
     * Pages through one stream. Returns false when the checkpoint asked to stop.
     */
    private boolean drain(FetchStream stream, RunState state, ScrapeCheckpoint checkpoint) {
        String cursor = null;
        int page = 0;

        while (page < stream.pageLimit && !state.aggregator.isSaturated()) {
            page++;
            state.location = stream + " page " + page;
            final String pageCursor = cursor;

            FetchPage result;
            try {
                result = state.retry.executeSupplier(() -> gateway.fetchPage(
                        stream.resource, stream.category, pageCursor, stream.pageSize, state.request));
            } catch (TransientFetchException e) {
                log.warn("[{}] Skipping rest of {} after {} attempts: {}",
                        state.runId, state.location, state.retry.getRetryConfig().getMaxAttempts(), e.getMessage());
                state.skippedStreams++;
                return checkpoint.onPage(state.aggregator.progress(state.pagesProcessed), state.drainErrors());
            }

            state.pagesProcessed++;
            int kept = state.aggregator.accept(result.records());
            log.debug("[{}] {}: {} records, {} kept, {} total returned",
                    state.runId, state.location, result.records().size(), kept, state.aggregator.getItemsReturned());

            if (!checkpoint.onPage(state.aggregator.progress(state.pagesProcessed), state.drainErrors())) {
                return false;
            }
            if (result.isLast()) break;
            cursor = result.nextCursor();
        }
        return true;
    }

    /**
     * Resource × category streams in fetch order, honouring the request's
     * category flags and the gateway's capabilities.
     */
    List<FetchStream> plan(ScrapeRequest request) {
        ScraperProperties.Fetch fetch = properties.getFetch();
        int postPageSize = Math.min(request.getPostsPerPage(), fetch.getMaxPostsPerPage());
        int commentPageSize = Math.min(request.getCommentsPerPage(), fetch.getMaxCommentsPerPage());

        List<FetchStream> streams = new ArrayList<>();
        for (TargetResource resource : urlParser.resolve(request)) {
            int pageLimit = switch (resource.getType()) {
                case USER -> request.getUserPagesLimit();
                case SUBREDDIT -> request.getCommunityPagesLimit();
                default -> Integer.MAX_VALUE;
            };
            boolean userTarget = resource.getType() == TargetResource.Type.USER;
            boolean subredditTarget = resource.getType() == TargetResource.Type.SUBREDDIT;

            if (request.isSearchForPosts()
                    && !(userTarget && request.isSkipUserPosts())
                    && !(subredditTarget && request.isSkipCommunity())) {
                add(streams, resource, RecordCategory.POSTS, postPageSize, pageLimit);
            }
            if (request.isSearchForComments() && !request.isSkipComments()) {
                add(streams, resource, RecordCategory.COMMENTS, commentPageSize, pageLimit);
            }
            if (request.isSearchForUsers()) {
                add(streams, resource, RecordCategory.USERS, postPageSize, pageLimit);
            }
            if (request.isSearchForCommunities() && !request.isSkipCommunity()) {
                add(streams, resource, RecordCategory.COMMUNITIES, postPageSize, pageLimit);
            }
        }
        return streams;
    }

    private void add(List<FetchStream> streams, TargetResource resource, RecordCategory category, int pageSize, int pageLimit) {
        if (gateway.supports(resource, category)) {
            streams.add(new FetchStream(resource, category, pageSize, pageLimit));
        }
    }

    record FetchStream(TargetResource resource, RecordCategory category, int pageSize, int pageLimit) {
        @Override
        public String toString() {
            return resource + " " + category.name().toLowerCase();
        }
    }

    // ── Per-run state ────────────────────────────────────────────────────────

    private class RunState {
        final String runId;
        final ScrapeRequest request;
        final Instant startedAt;
        final ResultAggregator aggregator;
        final Retry retry;
        final List<ScrapeError> errors = new ArrayList<>();
        int reported;
        int pagesProcessed;
        int skippedStreams;
        String location = "";

        RunState(String runId, ScrapeRequest request, Instant startedAt) {
            this.runId = runId;
            this.request = request;
            this.startedAt = startedAt;
            this.aggregator = new ResultAggregator(request.getMaxItems(), RecordFilter.from(request, startedAt));
            this.retry = RetryPolicy.from(properties.getFetch().getRetry())
                    .newRetry("fetch-" + runId, TransientFetchException.class);

            // one entry per failed attempt: onRetry for those followed by another try, onError for the last
            retry.getEventPublisher()
                    .onRetry(event -> recordAttemptFailure(event.getLastThrowable(), event.getNumberOfRetryAttempts()))
                    .onError(event -> recordAttemptFailure(event.getLastThrowable(), event.getNumberOfRetryAttempts()));
        }

        private void recordAttemptFailure(Throwable failure, int attempt) {
            if (failure instanceof FetchException fe) {
                log.warn("[{}] {} attempt {} failed ({}): {}", runId, location, attempt, fe.getType(), fe.getMessage());
                errors.add(fe.toError(location + ", attempt " + attempt));
            }
        }

        List<ScrapeError> drainErrors() {
            List<ScrapeError> fresh = List.copyOf(errors.subList(reported, errors.size()));
            reported = errors.size();
            return fresh;
        }

        ScrapeOutcome finish(JobStatus status, Instant finishedAt) {
            return ScrapeOutcome.builder()
                    .status(status)
                    .result(status == JobStatus.SUCCEEDED ? aggregator.snapshot() : null)
                    .errors(errors)
                    .pagesProcessed(pagesProcessed)
                    .startedAt(startedAt)
                    .finishedAt(finishedAt)
                    .build();
        }
    }
}
