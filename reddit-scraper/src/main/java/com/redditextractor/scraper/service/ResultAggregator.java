package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.JobProgress;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditCommunity;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.RedditUser;
import com.redditextractor.scraper.model.ScrapeResult;
import com.redditextractor.scraper.model.ScrapedRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates paginated records into four ordered collections under one global
 * maxItems ceiling.
 *
 * Every offered record counts as seen. Records failing the filter are dropped.
 * Once the ceiling is full, the next record that would have been kept marks the
 * aggregator saturated: the rest of that page is dropped and the caller stops paging.
 * A page offered while the ceiling is already full saturates the aggregator once it
 * has been read, whatever the filter made of it, so at most one page is fetched
 * past a full ceiling.
 *
 * Not thread-safe; owned by the single worker running the job.
 */
public class ResultAggregator {

    private final int maxItems;
    private final RecordFilter filter;

    private final List<RedditPost> posts = new ArrayList<>();
    private final List<RedditComment> comments = new ArrayList<>();
    private final List<RedditUser> users = new ArrayList<>();
    private final List<RedditCommunity> communities = new ArrayList<>();

    private int totalItems;
    private int itemsReturned;
    private boolean saturated;

    public ResultAggregator(int maxItems, RecordFilter filter) {
        if (maxItems < 1) {
            throw new IllegalArgumentException("maxItems must be positive, got " + maxItems);
        }
        this.maxItems = maxItems;
        this.filter = filter;
    }

    /**
     * Feed one page in fetch order.
     *
     * @return number of records kept from this page
     */
    public int accept(List<? extends ScrapedRecord> page) {
        boolean fullBeforePage = itemsReturned >= maxItems;
        int kept = 0;
        for (ScrapedRecord record : page) {
            totalItems++;
            if (saturated || !filter.accepts(record)) continue;
            if (itemsReturned >= maxItems) {
                saturated = true;
                continue;
            }
            add(record);
            itemsReturned++;
            kept++;
        }
        if (fullBeforePage) {
            saturated = true;
        }
        return kept;
    }

    /** True once the caller should stop paging. */
    public boolean isSaturated() {
        return saturated;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public int getItemsReturned() {
        return itemsReturned;
    }

    public JobProgress progress(int pagesProcessed) {
        return JobProgress.builder()
                .pagesProcessed(pagesProcessed)
                .postsFetched(posts.size())
                .commentsFetched(comments.size())
                .usersFetched(users.size())
                .communitiesFetched(communities.size())
                .itemsSeen(totalItems)
                .build();
    }

    public ScrapeResult snapshot() {
        return ScrapeResult.builder()
                .posts(posts)
                .comments(comments)
                .users(users)
                .communities(communities)
                .totalItems(totalItems)
                .itemsReturned(itemsReturned)
                .build();
    }

    private void add(ScrapedRecord record) {
        switch (record.getCategory()) {
            case POSTS -> posts.add((RedditPost) record);
            case COMMENTS -> comments.add((RedditComment) record);
            case USERS -> users.add((RedditUser) record);
            case COMMUNITIES -> communities.add((RedditCommunity) record);
        }
    }
}
