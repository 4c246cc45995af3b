package com.redditextractor.scraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OutputFormat {
    @JsonProperty("json") JSON("application/json"),
    @JsonProperty("csv") CSV("text/csv"),
    @JsonProperty("rss") RSS("application/rss+xml"),
    @JsonProperty("xml") XML("application/xml");

    private final String contentType;

    OutputFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
