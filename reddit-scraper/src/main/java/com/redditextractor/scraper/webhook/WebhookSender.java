package com.redditextractor.scraper.webhook;

import com.redditextractor.scraper.config.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performs a single webhook POST and classifies what happened. Never throws;
 * the dispatcher decides about retries.
 *
 * 2xx: delivered. 5xx, 429, timeouts, connection failures: retryable.
 * Any other status: not retryable.
 */
@Component
@Slf4j
public class WebhookSender {

    private final RestTemplate restTemplate;

    @Autowired
    public WebhookSender(RestTemplateBuilder builder, ScraperProperties properties) {
        this(buildRestTemplate(builder, properties.getWebhook()));
    }

    public WebhookSender(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public DeliveryOutcome send(String url, byte[] payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<Void> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.POST, new HttpEntity<>(payload, headers), Void.class);
            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                return DeliveryOutcome.success(status);
            }
            return DeliveryOutcome.nonRetryable(status, "HTTP_" + status);

        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status >= 500 || status == 429) {
                return DeliveryOutcome.retryable(status, "HTTP_" + status);
            }
            return DeliveryOutcome.nonRetryable(status, "HTTP_" + status);

        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                return DeliveryOutcome.retryable(null, "TIMEOUT");
            }
            return DeliveryOutcome.retryable(null, "CONNECTION_ERROR");

        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Webhook POST to {} failed permanently: {}", url, e.getMessage());
            return DeliveryOutcome.nonRetryable(null, e.getClass().getSimpleName());
        }
    }

    /**
     * POSTs a small test payload to check that a webhook URL answers. Any HTTP
     * status means reachable. Never throws.
     */
    public WebhookTestResult test(String url) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("test", true);
        payload.put("message", "RedditExtractor webhook test");
        payload.put("timestamp", Instant.now().toString());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        long started = System.nanoTime();
        try {
            ResponseEntity<Void> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.POST, new HttpEntity<>(payload, headers), Void.class);
            return reachable(response.getStatusCode().value(), started);

        } catch (HttpStatusCodeException e) {
            return reachable(e.getStatusCode().value(), started);

        } catch (ResourceAccessException e) {
            String error = e.getCause() instanceof SocketTimeoutException
                    ? "Webhook URL timeout"
                    : "Cannot connect to webhook URL";
            log.info("Webhook test for {} failed: {}", url, e.getMessage());
            return WebhookTestResult.builder().success(false).reachable(false).error(error).build();

        } catch (RestClientException | IllegalArgumentException e) {
            log.info("Webhook test for {} failed: {}", url, e.getMessage());
            return WebhookTestResult.builder().success(false).reachable(false).error(e.getMessage()).build();
        }
    }

    private static WebhookTestResult reachable(int status, long startedNanos) {
        return WebhookTestResult.builder()
                .success(true)
                .reachable(true)
                .statusCode(status)
                .responseTimeMs(Duration.ofNanos(System.nanoTime() - startedNanos).toMillis())
                .build();
    }

    private static RestTemplate buildRestTemplate(RestTemplateBuilder builder, ScraperProperties.Webhook config) {
        return builder
                .requestFactory(() -> {
                    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
                    factory.setConnectTimeout((int) config.getTimeout().toMillis());
                    factory.setReadTimeout((int) config.getTimeout().toMillis());
                    return factory;
                })
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();
    }
}
