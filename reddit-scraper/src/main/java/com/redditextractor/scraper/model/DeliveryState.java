package com.redditextractor.scraper.model;

public enum DeliveryState {
    PENDING,
    DELIVERED,
    /** Retries used up or a non-retryable response. Terminal. */
    EXHAUSTED
}
