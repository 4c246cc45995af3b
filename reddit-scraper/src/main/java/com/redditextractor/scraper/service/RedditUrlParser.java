package com.redditextractor.scraper.service;

import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.TargetResource;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns reddit.com / old.reddit.com URLs into fetch targets.
 *
 * Recognised paths:
 *   /r/{sub}, /r/{sub}/hot|new|top|rising
 *   /user/{name}, /user/{name}/submitted|comments|overview, /u/{name}
 *   /r/{sub}/comments/{id}/...
 */
@Component
public class RedditUrlParser {

    private static final Pattern HOST = Pattern.compile("^(www\\.|old\\.)?reddit\\.com$");
    private static final Pattern SUBREDDIT = Pattern.compile("^r/([^/]+)(/(hot|new|top|rising))?$");
    private static final Pattern USER = Pattern.compile("^(?:user|u)/([^/]+)(/(submitted|comments|overview))?$");
    private static final Pattern POST = Pattern.compile("^r/([^/]+)/comments/([^/]+)(/.*)?$");

    public Optional<TargetResource> parse(String url) {
        if (url == null || url.isBlank()) return Optional.empty();

        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (uri.getScheme() == null || !uri.getScheme().matches("https?")) return Optional.empty();
        if (uri.getHost() == null || !HOST.matcher(uri.getHost().toLowerCase()).matches()) return Optional.empty();

        String path = uri.getPath() == null ? "" : uri.getPath().replaceAll("^/+|/+$", "");
        String cleanUrl = uri.getScheme() + "://" + uri.getHost() + uri.getPath();

        Matcher m = POST.matcher(path);
        if (m.matches()) {
            return Optional.of(TargetResource.builder()
                    .type(TargetResource.Type.POST)
                    .subreddit(m.group(1))
                    .name(m.group(2))
                    .postId(m.group(2))
                    .url(cleanUrl)
                    .build());
        }

        m = SUBREDDIT.matcher(path);
        if (m.matches()) {
            return Optional.of(TargetResource.builder()
                    .type(TargetResource.Type.SUBREDDIT)
                    .name(m.group(1))
                    .url(cleanUrl)
                    .build());
        }

        m = USER.matcher(path);
        if (m.matches()) {
            return Optional.of(TargetResource.builder()
                    .type(TargetResource.Type.USER)
                    .name(m.group(1))
                    .url(cleanUrl)
                    .build());
        }

        return Optional.empty();
    }

    public boolean isRedditUrl(String url) {
        return parse(url).isPresent();
    }

    /**
     * Targets for a validated request, in the order the caller listed them.
     * Unparseable URLs are dropped; the validator rejects them before this point.
     */
    public List<TargetResource> resolve(ScrapeRequest request) {
        List<TargetResource> targets = new ArrayList<>();
        if (request.getStartUrls() != null) {
            for (String url : request.getStartUrls()) {
                parse(url).ifPresent(targets::add);
            }
        } else if (request.getSearchTerm() != null && !request.getSearchTerm().isBlank()) {
            targets.add(TargetResource.search(request.getSearchTerm().trim()));
        }
        return targets;
    }
}
