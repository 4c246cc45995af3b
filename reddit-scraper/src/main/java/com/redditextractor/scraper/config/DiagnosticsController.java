package com.redditextractor.scraper.config;

import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.service.ProxyCheckResult;
import com.redditextractor.scraper.service.RedditApiClient;
import com.redditextractor.scraper.service.ValidationException;
import com.redditextractor.scraper.webhook.WebhookSender;
import com.redditextractor.scraper.webhook.WebhookTestResult;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Connectivity checks for the outbound routes: the Reddit proxy and webhook targets.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class DiagnosticsController {

    private final RedditApiClient redditApiClient;
    private final WebhookSender webhookSender;

    /**
     * GET /test-proxy
     *
     * 200 when the check URL answered through the proxy or no proxy is configured
     * (success false in that case), 500 when the configured proxy failed.
     */
    @GetMapping("/test-proxy")
    public ResponseEntity<ProxyCheckResult> testProxy() {
        ProxyCheckResult result = redditApiClient.checkProxy();
        if (result.isProxyConfigured() && !result.isSuccess()) {
            return ResponseEntity.internalServerError().body(result);
        }
        return ResponseEntity.ok(result);
    }

    /**
     * POST /api/webhooks/test  {"webhookUrl": "https://..."}
     *
     * Sends a test payload. An unreachable URL is still a 200 with reachable=false.
     */
    @PostMapping("/api/webhooks/test")
    public ResponseEntity<?> testWebhook(@RequestBody WebhookTestRequest request) {
        String url = request.getWebhookUrl();
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "errors", List.of(
                    ScrapeError.of(ValidationException.INVALID_PARAMS, "webhookUrl must be a valid HTTP/HTTPS URL",
                            "Invalid URL: " + url))));
        }
        WebhookTestResult result = webhookSender.test(url);
        log.info("Webhook test for {}: reachable={}, status={}", url, result.isReachable(), result.getStatusCode());
        return ResponseEntity.ok(result);
    }

    @Data
    public static class WebhookTestRequest {
        private String webhookUrl;
    }
}
