package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.redditextractor.scraper.service.ValidationException.INVALID_PARAMS;

/**
 * Rejects malformed requests before they reach the scrape loop. Collects every
 * problem instead of stopping at the first one.
 *
 * startUrls together with searchTerm is a conflict, not a precedence question.
 */
@Component
@RequiredArgsConstructor
public class ScrapeRequestValidator {

    static final Set<String> SORT_OPTIONS = Set.of("hot", "new", "top", "rising", "relevance");
    static final Set<String> DATE_FILTERS = Set.of("hour", "day", "week", "month", "year", "all");

    private final RedditUrlParser urlParser;

    public void validate(ScrapeRequest request) {
        List<ScrapeError> errors = new ArrayList<>();

        boolean hasUrls = request.getStartUrls() != null && !request.getStartUrls().isEmpty();
        boolean hasSearch = request.getSearchTerm() != null;

        if (hasUrls && hasSearch) {
            errors.add(invalid("startUrls and searchTerm are mutually exclusive",
                    "Provide either startUrls or searchTerm, not both"));
        } else if (!hasUrls && !hasSearch) {
            errors.add(invalid("Either startUrls or searchTerm is required",
                    "You must provide either startUrls array or searchTerm string"));
        }

        if (hasUrls) {
            for (String url : request.getStartUrls()) {
                if (!urlParser.isRedditUrl(url)) {
                    errors.add(invalid("Invalid Reddit URL: " + url,
                            "URLs must be valid Reddit URLs (reddit.com or old.reddit.com)"));
                }
            }
        }

        if (hasSearch) {
            String term = request.getSearchTerm();
            if (term.isBlank()) {
                errors.add(invalid("searchTerm cannot be empty", "Provide a non-empty search term"));
            } else if (term.length() > 500) {
                errors.add(invalid("searchTerm too long", "Search term must be 500 characters or less"));
            }
        }

        if (!SORT_OPTIONS.contains(request.getSortSearch())) {
            errors.add(invalid("Invalid sortSearch value: " + request.getSortSearch(),
                    "Valid options: hot, new, top, rising, relevance"));
        }
        if (!DATE_FILTERS.contains(request.getFilterByDate())) {
            errors.add(invalid("Invalid filterByDate value: " + request.getFilterByDate(),
                    "Valid options: hour, day, week, month, year, all"));
        }

        if (request.getWebhookUrl() != null
                && !(request.getWebhookUrl().startsWith("http://") || request.getWebhookUrl().startsWith("https://"))) {
            errors.add(invalid("webhookUrl must be a valid HTTP/HTTPS URL",
                    "Invalid URL: " + request.getWebhookUrl()));
        }

        if (request.getOutputFormat() == null) {
            errors.add(invalid("Invalid outputFormat", "Valid options: json, csv, rss, xml"));
        }

        checkRange(errors, "maxItems", request.getMaxItems(), 1, 10_000);
        checkRange(errors, "postsPerPage", request.getPostsPerPage(), 1, 100);
        checkRange(errors, "commentsPerPage", request.getCommentsPerPage(), 1, 100);
        checkRange(errors, "communityPagesLimit", request.getCommunityPagesLimit(), 1, 50);
        checkRange(errors, "userPagesLimit", request.getUserPagesLimit(), 1, 50);

        if (request.getPostDateLimit() != null) {
            try {
                request.getPostDateLimitInstant();
            } catch (DateTimeParseException e) {
                errors.add(invalid("Invalid postDateLimit format",
                        "Must be ISO 8601 date string (e.g., '2024-01-01' or '2024-01-01T00:00:00Z')"));
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void checkRange(List<ScrapeError> errors, String name, int value, int min, int max) {
        if (value < min || value > max) {
            errors.add(invalid(name + " must be between " + min + " and " + max, "Received value: " + value));
        }
    }

    private ScrapeError invalid(String message, String details) {
        return ScrapeError.of(INVALID_PARAMS, message, details);
    }
}
