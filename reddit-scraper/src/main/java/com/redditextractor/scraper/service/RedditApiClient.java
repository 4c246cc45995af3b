package com.redditextractor.scraper.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.model.RecordCategory;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapedRecord;
import com.redditextractor.scraper.model.TargetResource;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.CredentialsProvider;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fetch Gateway over Reddit's public .json endpoints.
 *
 * Rate limiting: Reddit throttles unauthenticated clients aggressively, so a
 * configurable delay is applied before every call (default 1 second).
 * Failures are classified, never retried here; the scrape loop owns retries.
 */
@Service
@Slf4j
public class RedditApiClient implements FetchGateway {

    private static final Set<String> LISTING_SORTS = Set.of("hot", "new", "top", "rising");
    private static final Set<String> SEARCH_SORTS = Set.of("relevance", "hot", "top", "new");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RedditRecordMapper mapper;
    private final ScraperProperties.Fetch config;

    @Autowired
    public RedditApiClient(RestTemplateBuilder builder,
                           ObjectMapper objectMapper,
                           RedditRecordMapper mapper,
                           ScraperProperties properties) {
        this(buildRestTemplate(builder, properties.getFetch()), objectMapper, mapper, properties);
    }

    public RedditApiClient(RestTemplate restTemplate,
                           ObjectMapper objectMapper,
                           RedditRecordMapper mapper,
                           ScraperProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.config = properties.getFetch();
    }

    @Override
    public boolean supports(TargetResource resource, RecordCategory category) {
        return switch (category) {
            case POSTS -> true;
            case COMMENTS -> resource.getType() != TargetResource.Type.SEARCH;
            case USERS -> resource.getType() == TargetResource.Type.USER
                    || resource.getType() == TargetResource.Type.POST;
            case COMMUNITIES -> resource.getType() == TargetResource.Type.SUBREDDIT
                    || resource.getType() == TargetResource.Type.SEARCH;
        };
    }

    @Override
    public FetchPage fetchPage(TargetResource resource, RecordCategory category, String cursor,
                               int pageSize, ScrapeRequest request) {
        if (!supports(resource, category)) {
            return FetchPage.last(List.of());
        }
        return switch (category) {
            case POSTS -> fetchPosts(resource, cursor, pageSize, request);
            case COMMENTS -> fetchComments(resource, cursor, pageSize, request);
            case USERS -> fetchUsers(resource);
            case COMMUNITIES -> fetchCommunities(resource, cursor, pageSize);
        };
    }

    /**
     * Sends one request through the configured proxy to the check URL and reports
     * the IP the far side saw. Never throws.
     */
    public ProxyCheckResult checkProxy() {
        ScraperProperties.Fetch.Proxy proxy = config.getProxy();
        ProxyCheckResult.ProxyCheckResultBuilder result = ProxyCheckResult.builder()
                .proxyConfigured(proxy.isConfigured())
                .timestamp(Instant.now());
        if (!proxy.isConfigured()) {
            return result.success(false).message("No proxy configured").build();
        }
        String route = proxy.getHost() + ":" + proxy.getPort();
        result.proxy(route);
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(URI.create(proxy.getCheckUrl()), String.class);
            String body = response.getBody();
            String ip = body == null || body.isBlank() ? "unknown" : objectMapper.readTree(body).path("origin").asText("unknown");
            log.info("Proxy check via {} succeeded, outbound IP {}", route, ip);
            return result.success(true)
                    .httpStatus(response.getStatusCode().value())
                    .currentIp(ip)
                    .build();
        } catch (HttpStatusCodeException e) {
            log.warn("Proxy check via {} got HTTP {}", route, e.getStatusCode().value());
            return result.success(false)
                    .httpStatus(e.getStatusCode().value())
                    .error("HTTP " + e.getStatusCode().value() + " from " + proxy.getCheckUrl())
                    .build();
        } catch (RestClientException | JsonProcessingException | IllegalArgumentException e) {
            log.warn("Proxy check via {} failed: {}", route, e.getMessage());
            return result.success(false).error(e.getMessage()).build();
        }
    }

    // ── Categories ────────────────────────────────────────────────────────────

    private FetchPage fetchPosts(TargetResource resource, String cursor, int pageSize, ScrapeRequest request) {
        String sort = request.getSortSearch();
        return switch (resource.getType()) {
            case SUBREDDIT -> listing(url("/r/" + resource.getName() + "/" + listingSort(sort) + ".json")
                    .queryParam("t", request.getFilterByDate()), cursor, pageSize, this::postsOf);
            case USER -> listing(url("/user/" + resource.getName() + "/submitted.json")
                    .queryParam("sort", listingSort(sort))
                    .queryParam("t", request.getFilterByDate()), cursor, pageSize, this::postsOf);
            case SEARCH -> listing(url("/search.json")
                    .queryParam("q", resource.getName())
                    .queryParam("sort", searchSort(sort))
                    .queryParam("t", request.getFilterByDate())
                    .queryParam("type", "link"), cursor, pageSize, this::postsOf);
            case POST -> {
                JsonNode thread = thread(resource, pageSize);
                yield FetchPage.last(List.of(threadPost(thread)));
            }
        };
    }

    private FetchPage fetchComments(TargetResource resource, String cursor, int pageSize, ScrapeRequest request) {
        return switch (resource.getType()) {
            case SUBREDDIT -> listing(url("/r/" + resource.getName() + "/comments.json"),
                    cursor, pageSize, this::commentsOf);
            case USER -> listing(url("/user/" + resource.getName() + "/comments.json")
                    .queryParam("sort", listingSort(request.getSortSearch())), cursor, pageSize, this::commentsOf);
            case POST -> {
                JsonNode thread = thread(resource, pageSize);
                RedditPost post = threadPost(thread);
                List<RedditComment> comments = mapper.flattenComments(
                        thread.path(1).path("data").path("children"), post.getTitle());
                yield FetchPage.last(comments);
            }
            case SEARCH -> FetchPage.last(List.of());
        };
    }

    private FetchPage fetchUsers(TargetResource resource) {
        if (resource.getType() == TargetResource.Type.USER) {
            JsonNode about = get(url("/user/" + resource.getName() + "/about.json").build().encode().toUri());
            return FetchPage.last(List.of(mapper.toUser(about.path("data"))));
        }
        JsonNode thread = thread(resource, config.getMaxCommentsPerPage());
        RedditPost post = threadPost(thread);
        List<RedditComment> comments = mapper.flattenComments(
                thread.path(1).path("data").path("children"), post.getTitle());
        return FetchPage.last(mapper.participants(post, comments));
    }

    private FetchPage fetchCommunities(TargetResource resource, String cursor, int pageSize) {
        if (resource.getType() == TargetResource.Type.SUBREDDIT) {
            JsonNode about = get(url("/r/" + resource.getName() + "/about.json").build().encode().toUri());
            return FetchPage.last(List.of(mapper.toCommunity(about.path("data"))));
        }
        return listing(url("/subreddits/search.json").queryParam("q", resource.getName()),
                cursor, pageSize, children -> {
                    List<ScrapedRecord> out = new ArrayList<>();
                    children.forEach(c -> out.add(mapper.toCommunity(c.path("data"))));
                    return out;
                });
    }

    // ── Listing plumbing ─────────────────────────────────────────────────────

    private interface ChildMapper {
        List<ScrapedRecord> map(JsonNode children);
    }

    private FetchPage listing(UriComponentsBuilder url, String cursor, int pageSize, ChildMapper childMapper) {
        url.queryParam("limit", pageSize).queryParam("raw_json", 1);
        if (cursor != null) {
            url.queryParam("after", cursor);
        }
        JsonNode root = get(url.build().encode().toUri());
        JsonNode data = root.path("data");
        List<ScrapedRecord> records = childMapper.map(data.path("children"));
        String after = data.path("after").isTextual() ? data.path("after").asText() : null;
        return FetchPage.of(records, records.isEmpty() ? null : after);
    }

    private List<ScrapedRecord> postsOf(JsonNode children) {
        List<ScrapedRecord> out = new ArrayList<>();
        for (JsonNode child : children) {
            if ("t3".equals(child.path("kind").asText())) {
                out.add(mapper.toPost(child.path("data")));
            }
        }
        return out;
    }

    private List<ScrapedRecord> commentsOf(JsonNode children) {
        List<ScrapedRecord> out = new ArrayList<>();
        for (JsonNode child : children) {
            if ("t1".equals(child.path("kind").asText())) {
                out.add(mapper.toComment(child.path("data"), null, 0));
            }
        }
        return out;
    }

    private JsonNode thread(TargetResource resource, int commentLimit) {
        URI uri = url("/r/" + resource.getSubreddit() + "/comments/" + resource.getPostId() + ".json")
                .queryParam("limit", commentLimit)
                .queryParam("raw_json", 1)
                .build().encode().toUri();
        JsonNode thread = get(uri);
        if (!thread.isArray() || thread.size() < 2) {
            throw new FatalFetchException(FetchErrorType.NOT_FOUND, "Unexpected post data structure for " + resource);
        }
        return thread;
    }

    private RedditPost threadPost(JsonNode thread) {
        JsonNode children = thread.path(0).path("data").path("children");
        if (!children.isArray() || children.isEmpty()) {
            throw new FatalFetchException(FetchErrorType.NOT_FOUND, "Post listing is empty");
        }
        return mapper.toPost(children.get(0).path("data"));
    }

    private UriComponentsBuilder url(String path) {
        return UriComponentsBuilder.fromHttpUrl(config.getBaseUrl() + path);
    }

    // ── HTTP ─────────────────────────────────────────────────────────────────

    private JsonNode get(URI uri) {
        log.debug("Calling Reddit: {}", uri);
        applyRateLimit();
        try {
            String body = restTemplate.getForObject(uri, String.class);
            if (body == null || body.isBlank()) {
                throw new TransientFetchException(FetchErrorType.NETWORK, "Empty response body from " + uri.getPath());
            }
            return objectMapper.readTree(body);
        } catch (HttpStatusCodeException e) {
            throw classify(e.getStatusCode().value(), uri);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TransientFetchException(FetchErrorType.TIMEOUT, "Timed out calling " + uri.getPath(), e);
            }
            throw new TransientFetchException(FetchErrorType.NETWORK, "I/O error calling " + uri.getPath() + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            // Reddit serves an HTML interstitial when it soft-blocks a client
            throw new TransientFetchException(FetchErrorType.BLOCKED, "Non-JSON response from " + uri.getPath(), e);
        }
    }

    private FetchException classify(int status, URI uri) {
        String path = uri.getPath();
        if (status == 429) {
            log.warn("Rate limited (429) by Reddit on {}", path);
            return new TransientFetchException(FetchErrorType.RATE_LIMITED, "Rate limited by Reddit (HTTP 429)");
        }
        if (status == 403) {
            if (config.getProxy().isConfigured()) {
                return new TransientFetchException(FetchErrorType.BLOCKED, "Blocked by Reddit (HTTP 403), retrying via proxy");
            }
            return new FatalFetchException(FetchErrorType.BLOCKED, "Blocked by Reddit (HTTP 403) and no proxy configured");
        }
        if (status == 404) {
            return new FatalFetchException(FetchErrorType.NOT_FOUND, "Resource not found: " + path);
        }
        if (status == 407) {
            return new TransientFetchException(FetchErrorType.PROXY, "Proxy authentication failed (HTTP 407)");
        }
        if (status >= 500) {
            return new TransientFetchException(FetchErrorType.NETWORK, "Reddit returned HTTP " + status);
        }
        return new FatalFetchException(FetchErrorType.UNKNOWN, "Reddit returned HTTP " + status + " for " + path);
    }

    private String listingSort(String sort) {
        return LISTING_SORTS.contains(sort) ? sort : "hot";
    }

    private String searchSort(String sort) {
        return SEARCH_SORTS.contains(sort) ? sort : "relevance";
    }

    private void applyRateLimit() {
        sleepMs(config.getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static RestTemplate buildRestTemplate(RestTemplateBuilder builder, ScraperProperties.Fetch config) {
        return builder
                .requestFactory(() -> requestFactory(config))
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();
    }

    /**
     * Proxy credentials are answered by the client when the proxy challenges,
     * which also covers the CONNECT tunnel used for https targets.
     */
    static ClientHttpRequestFactory requestFactory(ScraperProperties.Fetch config) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(config.getConnectTimeout()))
                .setSocketTimeout(Timeout.of(config.getReadTimeout()))
                .build();
        HttpClientBuilder client = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(config.getReadTimeout()))
                        .build());

        ScraperProperties.Fetch.Proxy proxy = config.getProxy();
        if (proxy.isConfigured()) {
            client.setProxy(new HttpHost(proxy.getHost(), proxy.getPort()));
            CredentialsProvider credentials = proxyCredentials(proxy);
            if (credentials != null) {
                client.setDefaultCredentialsProvider(credentials);
            }
        }
        return new HttpComponentsClientHttpRequestFactory(client.build());
    }

    /**
     * Credentials scoped to the proxy host, or null when no username is set.
     */
    static CredentialsProvider proxyCredentials(ScraperProperties.Fetch.Proxy proxy) {
        if (!StringUtils.hasText(proxy.getUsername())) {
            return null;
        }
        String password = proxy.getPassword() == null ? "" : proxy.getPassword();
        BasicCredentialsProvider provider = new BasicCredentialsProvider();
        provider.setCredentials(new AuthScope(proxy.getHost(), proxy.getPort()),
                new UsernamePasswordCredentials(proxy.getUsername(), password.toCharArray()));
        return provider;
    }
}
