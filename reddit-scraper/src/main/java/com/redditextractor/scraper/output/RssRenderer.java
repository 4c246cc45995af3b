package com.redditextractor.scraper.output;

import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndCategoryImpl;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndContentImpl;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndEntryImpl;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndFeedImpl;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedOutput;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * RSS 2.0 feed of the first 50 posts. Feed dates come from metadata.scrapedAt
 * and item dates from the posts, never from the wall clock.
 */
@Component
public class RssRenderer implements ResultRenderer {

    static final int MAX_ITEMS = 50;
    private static final int MAX_DESCRIPTION = 500;

    @Override
    public OutputFormat format() {
        return OutputFormat.RSS;
    }

    @Override
    public byte[] render(ScrapeResult result, ResultMetadata metadata) {
        SyndFeed feed = new SyndFeedImpl();
        feed.setFeedType("rss_2.0");
        feed.setTitle("Reddit Extractor Results");
        feed.setLink("https://www.reddit.com");
        feed.setDescription(result.getPosts().size() + " posts scraped");
        feed.setEncoding(StandardCharsets.UTF_8.name());
        if (metadata != null && metadata.getScrapedAt() != null) {
            feed.setPublishedDate(toDate(metadata.getScrapedAt()));
        }

        List<SyndEntry> entries = new ArrayList<>();
        for (RedditPost post : result.getPosts().stream().limit(MAX_ITEMS).toList()) {
            entries.add(toEntry(post));
        }
        feed.setEntries(entries);

        try {
            return new SyndFeedOutput().outputString(feed).getBytes(StandardCharsets.UTF_8);
        } catch (FeedException e) {
            throw new IllegalStateException("RSS render failed", e);
        }
    }

    private SyndEntry toEntry(RedditPost post) {
        SyndEntry entry = new SyndEntryImpl();
        entry.setTitle(post.getTitle());
        entry.setLink(post.getPermalink());
        entry.setUri(post.getPermalink());
        if (post.getAuthor() != null) {
            entry.setAuthor(post.getAuthor());
        }
        if (post.getCreatedAt() != null) {
            entry.setPublishedDate(toDate(post.getCreatedAt()));
        }

        String text = post.getContent() == null || post.getContent().isBlank() ? post.getUrl() : post.getContent();
        if (text != null) {
            SyndContent description = new SyndContentImpl();
            description.setType("text/plain");
            description.setValue(text.length() <= MAX_DESCRIPTION ? text : text.substring(0, MAX_DESCRIPTION));
            entry.setDescription(description);
        }

        if (post.getSubreddit() != null) {
            SyndCategory category = new SyndCategoryImpl();
            category.setName("r/" + post.getSubreddit());
            entry.setCategories(List.of(category));
        }
        return entry;
    }

    private static Date toDate(Instant instant) {
        return Date.from(instant);
    }
}
