package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Delivery history of one job's webhook. Attempts are strictly ordered;
 * nextAttemptAt is null once the record is terminal.
 */
@Value
@Builder(toBuilder = true)
public class WebhookDeliveryRecord {

    String url;
    @Builder.Default DeliveryState state = DeliveryState.PENDING;
    @Singular List<DeliveryAttempt> attempts;
    Instant nextAttemptAt;

    public static WebhookDeliveryRecord pending(String url) {
        return WebhookDeliveryRecord.builder().url(url).build();
    }

    public boolean isTerminal() {
        return state != DeliveryState.PENDING;
    }

    public int getAttemptCount() {
        return attempts.size();
    }
}
