package com.redditextractor.scraper.service;

/**
 * Classification the Fetch Gateway attaches to every failure.
 */
public enum FetchErrorType {
    RATE_LIMITED,
    BLOCKED,
    NOT_FOUND,
    NETWORK,
    TIMEOUT,
    PROXY,
    UNKNOWN
}
