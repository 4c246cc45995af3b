package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Response envelope shared by synchronous responses and webhook payloads.
 * jobId, status, completedAt and formattedData are only present on job payloads.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"jobId", "status", "success", "data", "metadata", "errors", "completedAt", "formattedData"})
public class ScrapeResponse {

    String jobId;
    JobStatus status;

    boolean success;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonIgnoreProperties({"totalItems", "itemsReturned"})
    ScrapeResult data;

    ResultMetadata metadata;

    @Singular
    @JsonInclude(JsonInclude.Include.ALWAYS)
    List<ScrapeError> errors;

    Instant completedAt;
    FormattedData formattedData;

    @Value
    public static class FormattedData {
        OutputFormat format;
        String contentType;
        String data;
    }
}
