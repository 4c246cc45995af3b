package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapeResponse;
import com.redditextractor.scraper.model.ScrapeResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the response envelope. Inline responses and webhook payloads go through
 * here so both carry the same schema.
 */
public final class ScrapeResponses {

    private ScrapeResponses() {
    }

    public static ScrapeResponse fromOutcome(ScrapeRequest request, ScrapeOutcome outcome) {
        return ScrapeResponse.builder()
                .success(outcome.isSucceeded())
                .data(outcome.getResult())
                .metadata(metadata(request, outcome.getResult(), outcome.getStartedAt(), outcome.getFinishedAt()))
                .errors(failureErrors(outcome.getStatus(), outcome.getErrors()))
                .build();
    }

    /**
     * Envelope for a terminal job. FAILED and CANCELLED jobs always carry at
     * least one error explaining why.
     */
    public static ScrapeResponse fromJob(Job job) {
        boolean succeeded = job.getStatus() == JobStatus.SUCCEEDED;
        ScrapeResult result = succeeded ? job.getResult() : null;
        return ScrapeResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .success(succeeded)
                .data(result)
                .metadata(metadata(job.getRequest(), result, job.getStartedAt(), job.getFinishedAt()))
                .errors(failureErrors(job.getStatus(), job.getErrors()))
                .completedAt(job.getFinishedAt())
                .build();
    }

    /** Error-only envelope for requests rejected before running. */
    public static ScrapeResponse rejected(ScrapeRequest request, List<ScrapeError> errors) {
        return ScrapeResponse.builder()
                .success(false)
                .metadata(ResultMetadata.builder()
                        .requestParams(request)
                        .executionTime(executionTime(Duration.ZERO))
                        .build())
                .errors(errors)
                .build();
    }

    public static ResultMetadata metadata(ScrapeRequest request, ScrapeResult result, Instant startedAt, Instant finishedAt) {
        Duration elapsed = startedAt != null && finishedAt != null
                ? Duration.between(startedAt, finishedAt)
                : Duration.ZERO;
        return ResultMetadata.builder()
                .totalItems(result == null ? 0 : result.getTotalItems())
                .itemsReturned(result == null ? 0 : result.getItemsReturned())
                .requestParams(request)
                .scrapedAt(finishedAt)
                .executionTime(executionTime(elapsed))
                .build();
    }

    static String executionTime(Duration elapsed) {
        return String.format(Locale.ROOT, "%.2fs", elapsed.toMillis() / 1000.0);
    }

    private static List<ScrapeError> failureErrors(JobStatus status, List<ScrapeError> errors) {
        if (status == JobStatus.FAILED && errors.isEmpty()) {
            return List.of(ScrapeError.of(ScrapeError.JOB_FAILED, "Job failed", null));
        }
        if (status == JobStatus.CANCELLED
                && errors.stream().noneMatch(e -> ScrapeError.JOB_CANCELLED.equals(e.getCode()))) {
            return append(errors, ScrapeError.of(ScrapeError.JOB_CANCELLED, "Job was cancelled", null));
        }
        return errors;
    }

    private static List<ScrapeError> append(List<ScrapeError> errors, ScrapeError extra) {
        List<ScrapeError> all = new ArrayList<>(errors);
        all.add(extra);
        return all;
    }
}
