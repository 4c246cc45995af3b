package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Immutable snapshot of the parameters a caller submitted.
 * Field names match the public API (camelCase JSON), defaults match the validator.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrapeRequest {

    // ── Sources (mutually exclusive) ────────────────────────────────────────
    List<String> startUrls;
    String searchTerm;

    // ── What to collect ─────────────────────────────────────────────────────
    @Builder.Default boolean searchForPosts = true;
    @Builder.Default boolean searchForComments = true;
    @Builder.Default boolean searchForUsers = false;
    @Builder.Default boolean searchForCommunities = false;
    @Builder.Default boolean skipComments = false;
    @Builder.Default boolean skipUserPosts = false;
    @Builder.Default boolean skipCommunity = false;
    @Builder.Default boolean includeNSFW = false;

    // ── Ordering and filters ────────────────────────────────────────────────
    @Builder.Default String sortSearch = "hot";

    /** hour | day | week | month | year | all */
    @Builder.Default String filterByDate = "all";

    /** ISO 8601 date ("2024-01-01") or date-time ("2024-01-01T00:00:00Z") */
    String postDateLimit;

    // ── Limits ──────────────────────────────────────────────────────────────
    @Builder.Default int maxItems = 100;
    @Builder.Default int postsPerPage = 25;
    @Builder.Default int commentsPerPage = 20;
    @Builder.Default int communityPagesLimit = 1;
    @Builder.Default int userPagesLimit = 1;

    // ── Delivery ────────────────────────────────────────────────────────────
    String webhookUrl;
    @Builder.Default OutputFormat outputFormat = OutputFormat.JSON;

    @JsonIgnore
    public boolean isAsync() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    /**
     * postDateLimit as an instant. Plain dates and offset-less date-times are read as UTC.
     *
     * @throws DateTimeParseException when the value is neither form
     */
    @JsonIgnore
    public Instant getPostDateLimitInstant() {
        if (postDateLimit == null || postDateLimit.isBlank()) return null;
        String value = postDateLimit.trim();
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        try {
            return OffsetDateTime.parse(value.replace("Z", "+00:00")).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
