package com.redditextractor.scraper.webhook;

import lombok.Builder;
import lombok.Value;

/**
 * Reachability of a webhook URL. Any HTTP response counts as reachable,
 * whatever its status.
 */
@Value
@Builder
public class WebhookTestResult {

    boolean success;
    boolean reachable;
    Integer statusCode;
    Long responseTimeMs;
    String error;
}
