package com.redditextractor.scraper.service;

/**
 * Rate limiting, network trouble, timeouts. Retried at page granularity.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(FetchErrorType type, String message) {
        this(type, message, null);
    }

    public TransientFetchException(FetchErrorType type, String message, Throwable cause) {
        super(type, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
