package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Normalised submission.
 *
 * content is the self text for text posts, empty for link posts.
 */
@Value
@Builder
public class RedditPost implements ScrapedRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    String id;
    String permalink;
    String url;

    // ── Content ─────────────────────────────────────────────────────────────
    String title;
    String content;
    String author;
    String subreddit;
    String domain;

    /** Full-size image when the post is an image post or carries a preview */
    String imageUrl;
    String thumbnailUrl;

    // ── Engagement ──────────────────────────────────────────────────────────
    int score;
    int numComments;

    // ── Flags ───────────────────────────────────────────────────────────────
    boolean nsfw;
    boolean pinned;

    Instant createdAt;

    @Override
    public RecordCategory getCategory() {
        return RecordCategory.POSTS;
    }
}
