package com.redditextractor.scraper.output;

import com.opencsv.CSVWriter;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditCommunity;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.RedditUser;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * One CSV document with a section per non-empty category, in the order
 * posts, comments, users, communities. Each section has its own header row;
 * sections are separated by a blank line.
 *
 * Line breaks inside text are flattened to spaces and long bodies are cut at 500 chars.
 */
@Component
public class CsvRenderer implements ResultRenderer {

    static final int MAX_TEXT = 500;

    private static final String[] POST_HEADERS = {
            "id", "title", "author", "subreddit", "score", "num_comments",
            "created_at", "url", "permalink", "domain", "nsfw", "pinned", "content"
    };
    private static final String[] COMMENT_HEADERS = {
            "id", "parent_id", "author", "subreddit", "score", "depth",
            "created_at", "permalink", "post_title", "body"
    };
    private static final String[] USER_HEADERS = {
            "username", "role", "link_karma", "comment_karma", "created_at", "profile_url"
    };
    private static final String[] COMMUNITY_HEADERS = {
            "name", "title", "subscribers", "nsfw", "created_at", "url", "description"
    };

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public byte[] render(ScrapeResult result, ResultMetadata metadata) {
        StringWriter out = new StringWriter();

        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            List<Runnable> sections = new ArrayList<>();
            addSection(sections, writer, POST_HEADERS, result.getPosts(), this::toRow);
            addSection(sections, writer, COMMENT_HEADERS, result.getComments(), this::toRow);
            addSection(sections, writer, USER_HEADERS, result.getUsers(), this::toRow);
            addSection(sections, writer, COMMUNITY_HEADERS, result.getCommunities(), this::toRow);

            if (sections.isEmpty()) {
                writer.writeNext(POST_HEADERS);
            }
            for (int i = 0; i < sections.size(); i++) {
                if (i > 0) {
                    writer.flush();
                    out.write(CSVWriter.DEFAULT_LINE_END);
                }
                sections.get(i).run();
            }
            writer.flush();

        } catch (IOException e) {
            throw new UncheckedIOException("CSV render failed", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private <T> void addSection(List<Runnable> sections, CSVWriter writer, String[] headers,
                                List<T> records, Function<T, String[]> toRow) {
        if (records.isEmpty()) return;
        sections.add(() -> {
            writer.writeNext(headers);
            for (T record : records) {
                writer.writeNext(toRow.apply(record));
            }
        });
    }

    private String[] toRow(RedditPost p) {
        return new String[]{
                str(p.getId()),
                flat(p.getTitle()),
                str(p.getAuthor()),
                str(p.getSubreddit()),
                str(p.getScore()),
                str(p.getNumComments()),
                str(p.getCreatedAt()),
                str(p.getUrl()),
                str(p.getPermalink()),
                str(p.getDomain()),
                str(p.isNsfw()),
                str(p.isPinned()),
                truncate(flat(p.getContent()))
        };
    }

    private String[] toRow(RedditComment c) {
        return new String[]{
                str(c.getId()),
                str(c.getParentId()),
                str(c.getAuthor()),
                str(c.getSubreddit()),
                str(c.getScore()),
                str(c.getDepth()),
                str(c.getCreatedAt()),
                str(c.getPermalink()),
                flat(c.getPostTitle()),
                truncate(flat(c.getBody()))
        };
    }

    private String[] toRow(RedditUser u) {
        return new String[]{
                str(u.getUsername()),
                str(u.getRole()),
                str(u.getLinkKarma()),
                str(u.getCommentKarma()),
                str(u.getCreatedAt()),
                str(u.getProfileUrl())
        };
    }

    private String[] toRow(RedditCommunity c) {
        return new String[]{
                str(c.getName()),
                flat(c.getTitle()),
                str(c.getSubscribers()),
                str(c.isNsfw()),
                str(c.getCreatedAt()),
                str(c.getUrl()),
                truncate(flat(c.getDescription()))
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private String flat(String text) {
        return text == null ? "" : text.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    private String truncate(String text) {
        return text.length() <= MAX_TEXT ? text : text.substring(0, MAX_TEXT);
    }
}
