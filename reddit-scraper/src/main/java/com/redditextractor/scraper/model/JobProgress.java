package com.redditextractor.scraper.model;

import lombok.Builder;
import lombok.Value;

/**
 * Progress counters written at every checkpoint. All counters only grow.
 */
@Value
@Builder(toBuilder = true)
public class JobProgress {

    public static final JobProgress NONE = JobProgress.builder().build();

    int pagesProcessed;
    int postsFetched;
    int commentsFetched;
    int usersFetched;
    int communitiesFetched;

    /** Records seen, including those filtered out or past the ceiling */
    int itemsSeen;

    public int getItemsFetched() {
        return postsFetched + commentsFetched + usersFetched + communitiesFetched;
    }

    public boolean isBehind(JobProgress other) {
        return pagesProcessed < other.pagesProcessed
                || postsFetched < other.postsFetched
                || commentsFetched < other.commentsFetched
                || usersFetched < other.usersFetched
                || communitiesFetched < other.communitiesFetched
                || itemsSeen < other.itemsSeen;
    }
}
