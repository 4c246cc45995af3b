package com.redditextractor.scraper.webhook;

import com.redditextractor.scraper.config.ScraperProperties;
import com.redditextractor.scraper.model.DeliveryAttempt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookSenderTest {

    private static final String HOOK = "https://hooks.example.com/in";
    private static final byte[] PAYLOAD = "{\"success\":true}".getBytes(StandardCharsets.UTF_8);

    private MockRestServiceServer server;
    private WebhookSender sender;

    @BeforeEach
    void setUp() {
        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        sender = new WebhookSender(new RestTemplateBuilder(customizer), new ScraperProperties());
        server = customizer.getServer();
    }

    @Test
    void postsJsonWithWebhookUserAgent() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("User-Agent", "RedditExtractor-Webhook/1.0"))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(content().bytes(PAYLOAD))
                .andRespond(withSuccess());

        DeliveryOutcome outcome = sender.send(HOOK, PAYLOAD);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getHttpStatus()).isEqualTo(200);
        server.verify();
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 429})
    void serverErrorsAndThrottling_areRetryable(int status) {
        server.expect(requestTo(HOOK)).andRespond(withStatus(HttpStatus.valueOf(status)));

        DeliveryOutcome outcome = sender.send(HOOK, PAYLOAD);

        assertThat(outcome.getKind()).isEqualTo(DeliveryAttempt.Outcome.RETRYABLE_FAILURE);
        assertThat(outcome.getHttpStatus()).isEqualTo(status);
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 404, 410})
    void otherClientErrors_areNotRetryable(int status) {
        server.expect(requestTo(HOOK)).andRespond(withStatus(HttpStatus.valueOf(status)));

        DeliveryOutcome outcome = sender.send(HOOK, PAYLOAD);

        assertThat(outcome.getKind()).isEqualTo(DeliveryAttempt.Outcome.NON_RETRYABLE_FAILURE);
        assertThat(outcome.getErrorClass()).isEqualTo("HTTP_" + status);
    }

    @Test
    void timeout_isRetryableWithoutStatus() {
        server.expect(requestTo(HOOK)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        DeliveryOutcome outcome = sender.send(HOOK, PAYLOAD);

        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.getHttpStatus()).isNull();
        assertThat(outcome.getErrorClass()).isEqualTo("TIMEOUT");
    }

    @Test
    void connectionFailure_isRetryable() {
        server.expect(requestTo(HOOK)).andRespond(withException(new IOException("Connection refused")));

        DeliveryOutcome outcome = sender.send(HOOK, PAYLOAD);

        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.getErrorClass()).isEqualTo("CONNECTION_ERROR");
    }

    @Test
    void test_postsTestPayloadAndReportsReachable() {
        server.expect(requestTo(HOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"test\":true,\"message\":\"RedditExtractor webhook test\"}"))
                .andRespond(withSuccess());

        WebhookTestResult result = sender.test(HOOK);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isReachable()).isTrue();
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(result.getResponseTimeMs()).isNotNull().isNotNegative();
        server.verify();
    }

    @Test
    void test_errorStatusStillCountsAsReachable() {
        server.expect(requestTo(HOOK)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        WebhookTestResult result = sender.test(HOOK);

        assertThat(result.isReachable()).isTrue();
        assertThat(result.getStatusCode()).isEqualTo(500);
    }

    @Test
    void test_timeoutIsUnreachable() {
        server.expect(requestTo(HOOK)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        WebhookTestResult result = sender.test(HOOK);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isReachable()).isFalse();
        assertThat(result.getStatusCode()).isNull();
        assertThat(result.getError()).isEqualTo("Webhook URL timeout");
    }

    @Test
    void test_connectionFailureIsUnreachable() {
        server.expect(requestTo(HOOK)).andRespond(withException(new IOException("Connection refused")));

        WebhookTestResult result = sender.test(HOOK);

        assertThat(result.isReachable()).isFalse();
        assertThat(result.getError()).isEqualTo("Cannot connect to webhook URL");
    }
}
