package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One webhook POST. httpStatus is null when no response arrived,
 * errorClass is null on success.
 */
@Value
@Builder
public class DeliveryAttempt {

    public enum Outcome { SUCCESS, RETRYABLE_FAILURE, NON_RETRYABLE_FAILURE }

    int attemptNumber;
    Instant attemptedAt;
    Outcome outcome;
    Integer httpStatus;
    String errorClass;
}
