package com.redditextractor.scraper.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a request sent through the configured proxy. proxy is host:port only,
 * credentials are never echoed.
 */
@Value
@Builder
public class ProxyCheckResult {

    boolean success;
    boolean proxyConfigured;
    String proxy;
    String currentIp;
    Integer httpStatus;
    String message;
    String error;
    Instant timestamp;
}
