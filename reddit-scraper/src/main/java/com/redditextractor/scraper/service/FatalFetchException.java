package com.redditextractor.scraper.service;

/**
 * Blocked without a proxy fallback, or the resource doesn't exist. Aborts the job.
 */
public class FatalFetchException extends FetchException {

    public FatalFetchException(FetchErrorType type, String message) {
        this(type, message, null);
    }

    public FatalFetchException(FetchErrorType type, String message, Throwable cause) {
        super(type, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
