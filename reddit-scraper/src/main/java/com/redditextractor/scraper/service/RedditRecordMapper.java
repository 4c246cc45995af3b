package com.redditextractor.scraper.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditCommunity;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.RedditUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps Reddit's listing JSON ("kind"/"data" things) to the normalised record types.
 *
 * Thing kinds: t1 = comment, t2 = account, t3 = link (post), t5 = subreddit.
 */
@Component
@Slf4j
public class RedditRecordMapper {

    private static final String REDDIT = "https://www.reddit.com";

    public RedditPost toPost(JsonNode data) {
        String imageUrl = null;
        if ("image".equals(text(data, "post_hint"))) {
            imageUrl = text(data, "url");
        } else if (data.path("preview").path("images").isArray() && data.path("preview").path("images").size() > 0) {
            imageUrl = emptyToNull(data.path("preview").path("images").get(0).path("source").path("url").asText(""));
        }

        String thumbnail = text(data, "thumbnail");
        if (thumbnail != null && Set.of("self", "default", "nsfw", "spoiler").contains(thumbnail)) {
            thumbnail = null;
        }

        return RedditPost.builder()
                .id(text(data, "id"))
                .permalink(absolute(text(data, "permalink")))
                .url(text(data, "url"))
                .title(data.path("title").asText(""))
                .content(data.path("selftext").asText(""))
                .author(text(data, "author"))
                .subreddit(text(data, "subreddit"))
                .domain(text(data, "domain"))
                .imageUrl(imageUrl)
                .thumbnailUrl(thumbnail)
                .score(data.path("score").asInt(0))
                .numComments(data.path("num_comments").asInt(0))
                .nsfw(data.path("over_18").asBoolean(false))
                .pinned(data.path("pinned").asBoolean(false) || data.path("stickied").asBoolean(false))
                .createdAt(epoch(data.path("created_utc")))
                .build();
    }

    public RedditComment toComment(JsonNode data, String postTitle, int depth) {
        return RedditComment.builder()
                .id(text(data, "id"))
                .parentId(text(data, "parent_id"))
                .author(text(data, "author"))
                .body(data.path("body").asText(""))
                .subreddit(text(data, "subreddit"))
                .permalink(absolute(text(data, "permalink")))
                .postTitle(postTitle != null ? postTitle : text(data, "link_title"))
                .score(data.path("score").asInt(0))
                .depth(depth)
                .nsfw(data.path("over_18").asBoolean(false))
                .createdAt(epoch(data.path("created_utc")))
                .build();
    }

    public RedditUser toUser(JsonNode data) {
        String name = text(data, "name");
        return RedditUser.builder()
                .username(name)
                .profileUrl(profileUrl(name))
                .role("profile")
                .linkKarma(data.path("link_karma").asInt(0))
                .commentKarma(data.path("comment_karma").asInt(0))
                .nsfw(data.path("subreddit").path("over_18").asBoolean(false))
                .createdAt(epoch(data.path("created_utc")))
                .build();
    }

    public RedditCommunity toCommunity(JsonNode data) {
        return RedditCommunity.builder()
                .name(text(data, "display_name"))
                .title(text(data, "title"))
                .description(data.path("public_description").asText(""))
                .url(absolute(text(data, "url")))
                .subscribers(data.path("subscribers").asLong(0))
                .nsfw(data.path("over18").asBoolean(false))
                .createdAt(epoch(data.path("created_utc")))
                .build();
    }

    /**
     * Flatten a comment tree depth-first, keeping only t1 things.
     * "more" stubs are skipped; expanding them would cost one request each.
     */
    public List<RedditComment> flattenComments(JsonNode children, String postTitle) {
        List<RedditComment> out = new ArrayList<>();
        collectComments(children, postTitle, 0, out);
        return out;
    }

    /**
     * Distinct users appearing in a thread: the post author first, then commenters
     * in thread order. Deleted accounts are skipped.
     */
    public List<RedditUser> participants(RedditPost post, List<RedditComment> comments) {
        Set<String> seen = new LinkedHashSet<>();
        List<RedditUser> users = new ArrayList<>();
        if (isRealUser(post.getAuthor()) && seen.add(post.getAuthor())) {
            users.add(participant(post.getAuthor(), "author"));
        }
        for (RedditComment c : comments) {
            if (isRealUser(c.getAuthor()) && seen.add(c.getAuthor())) {
                users.add(participant(c.getAuthor(), "commenter"));
            }
        }
        return users;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void collectComments(JsonNode children, String postTitle, int depth, List<RedditComment> out) {
        if (children == null || !children.isArray()) return;
        for (JsonNode child : children) {
            if (!"t1".equals(child.path("kind").asText())) continue;
            JsonNode data = child.path("data");
            out.add(toComment(data, postTitle, depth));
            JsonNode replies = data.path("replies");
            if (replies.isObject()) {
                collectComments(replies.path("data").path("children"), postTitle, depth + 1, out);
            }
        }
    }

    private RedditUser participant(String username, String role) {
        return RedditUser.builder()
                .username(username)
                .profileUrl(profileUrl(username))
                .role(role)
                .build();
    }

    private boolean isRealUser(String author) {
        return author != null && !author.isBlank() && !"[deleted]".equals(author);
    }

    private String profileUrl(String username) {
        return username == null ? null : REDDIT + "/user/" + username;
    }

    private Instant epoch(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        double seconds = node.asDouble(0);
        if (seconds <= 0) return null;
        return Instant.ofEpochSecond((long) seconds);
    }

    private String absolute(String path) {
        if (path == null) return null;
        return path.startsWith("/") ? REDDIT + path : path;
    }

    private String text(JsonNode data, String field) {
        JsonNode node = data.path(field);
        return node.isMissingNode() || node.isNull() ? null : emptyToNull(node.asText());
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
