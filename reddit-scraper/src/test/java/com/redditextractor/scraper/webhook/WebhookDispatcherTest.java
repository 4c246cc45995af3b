package com.redditextractor.scraper.webhook;

import com.redditextractor.scraper.job.InMemoryJobStore;
import com.redditextractor.scraper.model.DeliveryAttempt;
import com.redditextractor.scraper.model.DeliveryState;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.WebhookDeliveryRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static com.redditextractor.scraper.Fixtures.fastProperties;
import static com.redditextractor.scraper.Fixtures.search;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookDispatcherTest {

    private static final String HOOK = "https://hooks.example.com/in";
    private static final byte[] PAYLOAD = "{\"success\":true}".getBytes(StandardCharsets.UTF_8);

    private InMemoryJobStore store;
    private WebhookSender sender;
    private WebhookPayloadFactory payloadFactory;
    private ThreadPoolTaskScheduler scheduler;
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore(Clock.systemUTC());
        sender = mock(WebhookSender.class);
        payloadFactory = mock(WebhookPayloadFactory.class);
        when(payloadFactory.build(any())).thenReturn(PAYLOAD);

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.initialize();

        dispatcher = new WebhookDispatcher(store, sender, payloadFactory, scheduler, Clock.systemUTC(), fastProperties());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Job terminalJob(JobStatus status) {
        Job job = store.create(search("java", 10).toBuilder().webhookUrl(HOOK).build());
        store.transition(job.getId(), JobStatus.QUEUED, JobStatus.RUNNING, b -> b);
        return store.transition(job.getId(), JobStatus.RUNNING, status, b -> b);
    }

    private WebhookDeliveryRecord awaitSettled(String jobId) {
        await().atMost(Duration.ofSeconds(5))
                .until(() -> store.get(jobId).getWebhookDelivery().isTerminal());
        return store.get(jobId).getWebhookDelivery();
    }

    @Test
    void serverErrorEveryTime_exhaustsAtAttemptCapAndLeavesJobStatusAlone() {
        when(sender.send(anyString(), any())).thenReturn(DeliveryOutcome.retryable(500, "HTTP_500"));
        Job job = terminalJob(JobStatus.SUCCEEDED);

        dispatcher.dispatch(job);
        WebhookDeliveryRecord record = awaitSettled(job.getId());

        assertThat(record.getState()).isEqualTo(DeliveryState.EXHAUSTED);
        assertThat(record.getAttempts()).hasSize(3);
        assertThat(record.getAttempts()).extracting(DeliveryAttempt::getAttemptNumber).containsExactly(1, 2, 3);
        assertThat(record.getAttempts()).extracting(DeliveryAttempt::getHttpStatus).containsOnly(500);
        assertThat(record.getNextAttemptAt()).isNull();
        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(store.get(job.getId()).getFinishedAt()).isEqualTo(job.getFinishedAt());
        verify(sender, times(3)).send(eq(HOOK), eq(PAYLOAD));
    }

    @Test
    void failedJob_withExhaustedDelivery_staysFailed() {
        when(sender.send(anyString(), any())).thenReturn(DeliveryOutcome.retryable(null, "CONNECTION_ERROR"));
        Job job = terminalJob(JobStatus.FAILED);

        dispatcher.dispatch(job);
        awaitSettled(job.getId());

        assertThat(store.get(job.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void clientError_exhaustsImmediately() {
        when(sender.send(anyString(), any())).thenReturn(DeliveryOutcome.nonRetryable(400, "HTTP_400"));
        Job job = terminalJob(JobStatus.SUCCEEDED);

        dispatcher.dispatch(job);
        WebhookDeliveryRecord record = awaitSettled(job.getId());

        assertThat(record.getState()).isEqualTo(DeliveryState.EXHAUSTED);
        assertThat(record.getAttempts()).singleElement()
                .extracting(DeliveryAttempt::getOutcome).isEqualTo(DeliveryAttempt.Outcome.NON_RETRYABLE_FAILURE);
        verify(sender, times(1)).send(anyString(), any());
    }

    @Test
    void unexpectedSenderFailure_exhaustsSoTheJobCanBeEvicted() {
        when(sender.send(anyString(), any())).thenThrow(new IllegalStateException("boom"));
        Job job = terminalJob(JobStatus.SUCCEEDED);

        dispatcher.dispatch(job);
        WebhookDeliveryRecord record = awaitSettled(job.getId());

        assertThat(record.getState()).isEqualTo(DeliveryState.EXHAUSTED);
        assertThat(record.getNextAttemptAt()).isNull();
        verify(sender, times(1)).send(anyString(), any());
        assertThat(store.evictTerminalBefore(Instant.now().plusSeconds(60))).isEqualTo(1);
    }

    @Test
    void retryThenSuccess_isDelivered() {
        when(sender.send(anyString(), any()))
                .thenReturn(DeliveryOutcome.retryable(503, "HTTP_503"))
                .thenReturn(DeliveryOutcome.success(204));
        Job job = terminalJob(JobStatus.SUCCEEDED);

        dispatcher.dispatch(job);
        WebhookDeliveryRecord record = awaitSettled(job.getId());

        assertThat(record.getState()).isEqualTo(DeliveryState.DELIVERED);
        assertThat(record.getAttempts()).extracting(DeliveryAttempt::getOutcome)
                .containsExactly(DeliveryAttempt.Outcome.RETRYABLE_FAILURE, DeliveryAttempt.Outcome.SUCCESS);
    }

    @Test
    void attemptsForOneJob_neverOverlap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(sender.send(anyString(), any())).thenAnswer(inv -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return DeliveryOutcome.retryable(500, "HTTP_500");
        });
        Job job = terminalJob(JobStatus.SUCCEEDED);

        dispatcher.dispatch(job);
        dispatcher.attempt(job.getId(), PAYLOAD);
        awaitSettled(job.getId());

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(store.get(job.getId()).getWebhookDelivery().getAttemptCount()).isLessThanOrEqualTo(3);
    }

    @Test
    void jobWithoutWebhook_isIgnored() {
        Job job = store.create(search("java", 10));
        store.transition(job.getId(), JobStatus.QUEUED, JobStatus.RUNNING, b -> b);
        Job done = store.transition(job.getId(), JobStatus.RUNNING, JobStatus.SUCCEEDED, b -> b);

        dispatcher.dispatch(done);

        verify(payloadFactory, never()).build(any());
        verify(sender, never()).send(anyString(), any());
    }
}
