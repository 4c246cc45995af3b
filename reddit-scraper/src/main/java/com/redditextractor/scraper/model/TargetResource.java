package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

/**
 * What the Fetch Gateway is pointed at: a subreddit, a user, a single post
 * or a global search.
 */
@Value
@Builder
public class TargetResource {

    public enum Type { SUBREDDIT, USER, POST, SEARCH }

    Type type;

    /** Subreddit name, username or search query depending on type */
    String name;

    /** Only for POST: the owning subreddit */
    String subreddit;

    /** Only for POST */
    String postId;

    /** Original URL, null for searches */
    String url;

    public static TargetResource search(String query) {
        return TargetResource.builder().type(Type.SEARCH).name(query).build();
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUBREDDIT -> "r/" + name;
            case USER -> "u/" + name;
            case POST -> "r/" + subreddit + "/comments/" + postId;
            case SEARCH -> "search:" + name;
        };
    }
}
