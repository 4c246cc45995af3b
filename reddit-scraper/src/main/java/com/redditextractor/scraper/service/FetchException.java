package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.ScrapeError;
import lombok.Getter;

/**
 * Base of the Fetch Gateway's classified failures.
 */
@Getter
public abstract class FetchException extends RuntimeException {

    private final FetchErrorType type;

    protected FetchException(FetchErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public abstract boolean isTransient();

    public ScrapeError toError(String details) {
        return isTransient()
                ? ScrapeError.of(type.name(), getMessage(), details)
                : ScrapeError.fatal(type.name(), getMessage(), details);
    }
}
