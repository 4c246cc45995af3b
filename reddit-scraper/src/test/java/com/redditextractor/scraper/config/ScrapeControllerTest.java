package com.redditextractor.scraper.config;

import com.redditextractor.scraper.job.JobConflictException;
import com.redditextractor.scraper.job.JobNotFoundException;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapeResponse;
import com.redditextractor.scraper.model.ScrapeResult;
import com.redditextractor.scraper.output.OutputFormatter;
import com.redditextractor.scraper.service.ScrapeService;
import com.redditextractor.scraper.service.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.redditextractor.scraper.Fixtures.NOW;
import static com.redditextractor.scraper.Fixtures.posts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ScrapeControllerTest {

    @Mock
    private ScrapeService scrapeService;

    @Mock
    private OutputFormatter outputFormatter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ScrapeController(scrapeService, outputFormatter)).build();
    }

    private static ScrapeResponse succeeded() {
        ScrapeResult result = ScrapeResult.builder().posts(posts("a", 2)).totalItems(2).itemsReturned(2).build();
        return ScrapeResponse.builder()
                .success(true)
                .data(result)
                .metadata(ResultMetadata.builder().totalItems(2).itemsReturned(2).scrapedAt(NOW).executionTime("0.42s").build())
                .build();
    }

    @Nested
    class Scrape {

        @Test
        void withoutWebhook_returnsEnvelope() throws Exception {
            when(scrapeService.scrapeNow(any())).thenReturn(succeeded());

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":\"java\",\"maxItems\":2}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.posts", hasSize(2)))
                    .andExpect(jsonPath("$.data.totalItems").doesNotExist())
                    .andExpect(jsonPath("$.metadata.executionTime").value("0.42s"))
                    .andExpect(jsonPath("$.errors", hasSize(0)));

            ArgumentCaptor<ScrapeRequest> captor = ArgumentCaptor.forClass(ScrapeRequest.class);
            verify(scrapeService).scrapeNow(captor.capture());
            assertThat(captor.getValue().getSearchTerm()).isEqualTo("java");
            assertThat(captor.getValue().getMaxItems()).isEqualTo(2);
            assertThat(captor.getValue().getPostsPerPage()).isEqualTo(25);
        }

        @Test
        void csvFormat_returnsRenderedDocument() throws Exception {
            when(scrapeService.scrapeNow(any())).thenReturn(succeeded());
            when(outputFormatter.render(any(), any(), eq(OutputFormat.CSV)))
                    .thenReturn("\"id\",\"title\"\n".getBytes(StandardCharsets.UTF_8));

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":\"java\",\"outputFormat\":\"csv\"}"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentType("text/csv"))
                    .andExpect(content().string("\"id\",\"title\"\n"));
        }

        @Test
        void failedInlineScrape_is500WithEnvelope() throws Exception {
            when(scrapeService.scrapeNow(any())).thenReturn(ScrapeResponse.builder()
                    .success(false)
                    .error(ScrapeError.of("BLOCKED", "Blocked by Reddit (HTTP 403) and no proxy configured", null))
                    .build());

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":\"java\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.data").isEmpty())
                    .andExpect(jsonPath("$.errors[0].code").value("BLOCKED"));
        }

        @Test
        void withWebhook_queuesAndReturns202() throws Exception {
            when(scrapeService.submit(any())).thenReturn(Job.builder()
                    .id("job-1")
                    .status(JobStatus.QUEUED)
                    .createdAt(NOW)
                    .build());

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":\"java\",\"webhookUrl\":\"https://hooks.example.com/in\"}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.jobId").value("job-1"))
                    .andExpect(jsonPath("$.status").value("QUEUED"))
                    .andExpect(jsonPath("$.statusUrl").value("/api/jobs/job-1"));
        }

        @Test
        void invalidRequest_is400WithEveryError() throws Exception {
            when(scrapeService.scrapeNow(any())).thenThrow(new ValidationException(List.of(
                    ScrapeError.of(ValidationException.INVALID_PARAMS, "Either startUrls or searchTerm is required", null),
                    ScrapeError.of(ValidationException.INVALID_PARAMS, "maxItems must be between 1 and 10000", null))));

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"maxItems\":0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.errors", hasSize(2)))
                    .andExpect(jsonPath("$.errors[0].code").value("INVALID_PARAMS"))
                    .andExpect(jsonPath("$.metadata.requestParams.maxItems").value(0));
        }

        @Test
        void malformedBody_is400() throws Exception {
            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors[0].message").value("Malformed request body"));
        }

        @Test
        void unexpectedFailure_is500() throws Exception {
            when(scrapeService.scrapeNow(any())).thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(post("/api/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON)
                            .content("{\"searchTerm\":\"java\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.errors[0].code").value("INTERNAL_ERROR"))
                    .andExpect(jsonPath("$.errors[0].details").value("boom"));
        }
    }

    @Nested
    class Jobs {

        @Test
        void list_filtersByStatusCaseInsensitively() throws Exception {
            when(scrapeService.listJobs(JobStatus.RUNNING)).thenReturn(List.of(
                    Job.builder().id("job-2").status(JobStatus.RUNNING).createdAt(NOW).build()));

            mockMvc.perform(get("/api/jobs").param("status", "running").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(1))
                    .andExpect(jsonPath("$.jobs[0].id").value("job-2"));
        }

        @Test
        void list_unknownStatus_is400() throws Exception {
            mockMvc.perform(get("/api/jobs").param("status", "paused").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors[0].code").value("INVALID_PARAMS"));
        }

        @Test
        void get_unknownJob_is404() throws Exception {
            when(scrapeService.getJob("missing")).thenThrow(new JobNotFoundException("missing"));

            mockMvc.perform(get("/api/jobs/missing").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.errors[0].code").value("JOB_NOT_FOUND"));
        }

        @Test
        void cancel_finishedJob_is409() throws Exception {
            when(scrapeService.cancel("job-3")).thenThrow(
                    new JobConflictException("job-3", JobStatus.SUCCEEDED, "Job job-3 already finished with status SUCCEEDED"));

            mockMvc.perform(delete("/api/jobs/job-3").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.errors[0].code").value("JOB_CONFLICT"));
        }

        @Test
        void cancel_queuedJob_returnsCancelledSnapshot() throws Exception {
            when(scrapeService.cancel("job-4")).thenReturn(
                    Job.builder().id("job-4").status(JobStatus.CANCELLED).createdAt(NOW).finishedAt(NOW).build());

            mockMvc.perform(delete("/api/jobs/job-4").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("CANCELLED"));
        }

        @Test
        void summary() throws Exception {
            when(scrapeService.summary()).thenReturn(Map.of("totalJobs", 3, "activeJobs", 1L));

            mockMvc.perform(get("/api/jobs/summary").accept(MediaType.APPLICATION_JSON))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalJobs").value(3))
                    .andExpect(jsonPath("$.activeJobs").value(1));
        }
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/health").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("reddit-extractor"));
    }
}
