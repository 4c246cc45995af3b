package com.redditextractor.scraper.model;

/** The four collections a result set is split into. */
public enum RecordCategory {
    POSTS, COMMENTS, USERS, COMMUNITIES
}
