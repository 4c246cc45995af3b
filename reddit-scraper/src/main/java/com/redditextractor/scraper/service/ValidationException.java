package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.ScrapeError;
import lombok.Getter;

import java.util.List;

/**
 * A request was rejected before any job was created.
 */
@Getter
public class ValidationException extends RuntimeException {

    public static final String INVALID_PARAMS = "INVALID_PARAMS";

    private final List<ScrapeError> errors;

    public ValidationException(List<ScrapeError> errors) {
        super("Parameter validation failed");
        this.errors = List.copyOf(errors);
    }
}
