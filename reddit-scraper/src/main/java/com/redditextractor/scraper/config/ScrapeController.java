package com.redditextractor.scraper.config;

import com.redditextractor.scraper.job.JobConflictException;
import com.redditextractor.scraper.job.JobNotFoundException;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ScrapeError;
import com.redditextractor.scraper.model.ScrapeRequest;
import com.redditextractor.scraper.model.ScrapeResponse;
import com.redditextractor.scraper.output.OutputFormatter;
import com.redditextractor.scraper.service.ScrapeResponses;
import com.redditextractor.scraper.service.ScrapeService;
import com.redditextractor.scraper.service.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeService scrapeService;
    private final OutputFormatter outputFormatter;

    // ── Scrape ────────────────────────────────────────────────────────────────

    /**
     * Run a scrape.
     *
     * POST /api/scrape
     *
     * Without webhookUrl the scrape runs inline and the body is the result envelope
     * (or the rendered CSV/RSS/XML document). With webhookUrl a job is queued and
     * 202 comes back with its id; the outcome is POSTed to the webhook later.
     */
    @PostMapping("/api/scrape")
    public ResponseEntity<?> scrape(@RequestBody ScrapeRequest request) {
        try {
            if (request.isAsync()) {
                Job job = scrapeService.submit(request);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", true);
                body.put("jobId", job.getId());
                body.put("status", job.getStatus());
                body.put("statusUrl", "/api/jobs/" + job.getId());
                body.put("message", "Job queued, results will be delivered to the webhook");
                return ResponseEntity.accepted().body(body);
            }

            ScrapeResponse response = scrapeService.scrapeNow(request);
            if (!response.isSuccess()) {
                return ResponseEntity.internalServerError().body(response);
            }
            OutputFormat format = request.getOutputFormat();
            if (format == OutputFormat.JSON) {
                return ResponseEntity.ok(response);
            }
            byte[] body = outputFormatter.render(response.getData(), response.getMetadata(), format);
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(format.contentType()))
                    .body(body);

        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(ScrapeResponses.rejected(request, e.getErrors()));
        } catch (Exception e) {
            log.error("Scrape request failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(ScrapeResponses.rejected(request,
                    List.of(ScrapeError.of(ScrapeError.INTERNAL_ERROR, "Internal server error", e.getMessage()))));
        }
    }

    // ── Jobs ──────────────────────────────────────────────────────────────────

    /**
     * GET /api/jobs?status=RUNNING
     *
     * Newest first; status is optional and case-insensitive.
     */
    @GetMapping("/api/jobs")
    public ResponseEntity<?> listJobs(@RequestParam(required = false) String status) {
        JobStatus filter;
        try {
            filter = status == null || status.isBlank() ? null : JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(ValidationException.INVALID_PARAMS, "Unknown job status: " + status));
        }
        List<Job> jobs = scrapeService.listJobs(filter);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", jobs.size());
        body.put("jobs", jobs);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/api/jobs/summary")
    public ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(scrapeService.summary());
    }

    @GetMapping("/api/jobs/{id}")
    public ResponseEntity<?> getJob(@PathVariable String id) {
        try {
            return ResponseEntity.ok(scrapeService.getJob(id));
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("JOB_NOT_FOUND", e.getMessage()));
        }
    }

    /**
     * Cancel a job.
     *
     * DELETE /api/jobs/{id}
     *
     * Queued jobs are cancelled immediately; running jobs stop at the next page boundary.
     */
    @DeleteMapping("/api/jobs/{id}")
    public ResponseEntity<?> cancelJob(@PathVariable String id) {
        try {
            return ResponseEntity.ok(scrapeService.cancel(id));
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("JOB_NOT_FOUND", e.getMessage()));
        } catch (JobConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(error("JOB_CONFLICT", e.getMessage()));
        } catch (Exception e) {
            log.error("Cancel failed for job {}: {}", id, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(error(ScrapeError.INTERNAL_ERROR, e.getMessage()));
        }
    }

    // ── Health ────────────────────────────────────────────────────────────────

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().toString(),
                "service", "reddit-extractor"
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ScrapeResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ScrapeResponse.builder()
                .success(false)
                .error(ScrapeError.of(ValidationException.INVALID_PARAMS, "Malformed request body",
                        e.getMostSpecificCause().getMessage()))
                .build());
    }

    private Map<String, Object> error(String code, String message) {
        return Map.of("success", false, "errors", List.of(ScrapeError.of(code, message, null)));
    }
}
