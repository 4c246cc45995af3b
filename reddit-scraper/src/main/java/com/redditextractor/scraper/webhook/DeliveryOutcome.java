package com.redditextractor.scraper.webhook;

import com.redditextractor.scraper.model.DeliveryAttempt;
import lombok.Value;

/**
 * Classified result of one webhook POST. httpStatus is null when no response came back.
 */
@Value
public class DeliveryOutcome {

    DeliveryAttempt.Outcome kind;
    Integer httpStatus;
    String errorClass;

    public static DeliveryOutcome success(int httpStatus) {
        return new DeliveryOutcome(DeliveryAttempt.Outcome.SUCCESS, httpStatus, null);
    }

    public static DeliveryOutcome retryable(Integer httpStatus, String errorClass) {
        return new DeliveryOutcome(DeliveryAttempt.Outcome.RETRYABLE_FAILURE, httpStatus, errorClass);
    }

    public static DeliveryOutcome nonRetryable(Integer httpStatus, String errorClass) {
        return new DeliveryOutcome(DeliveryAttempt.Outcome.NON_RETRYABLE_FAILURE, httpStatus, errorClass);
    }

    public boolean isSuccess() {
        return kind == DeliveryAttempt.Outcome.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == DeliveryAttempt.Outcome.RETRYABLE_FAILURE;
    }
}
