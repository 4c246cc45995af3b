package com.redditextractor.scraper.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditextractor.scraper.model.Job;
import com.redditextractor.scraper.model.JobStatus;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ScrapeResponse;
import com.redditextractor.scraper.output.OutputFormatter;
import com.redditextractor.scraper.service.ScrapeResponses;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Serializes a terminal job snapshot into the webhook body. The payload is built
 * once per job and reused for every retry, so all attempts carry identical bytes.
 */
@Component
@RequiredArgsConstructor
public class WebhookPayloadFactory {

    private final ObjectMapper objectMapper;
    private final OutputFormatter outputFormatter;

    public byte[] build(Job job) {
        if (!job.isTerminal()) {
            throw new IllegalArgumentException("Job " + job.getId() + " is not terminal: " + job.getStatus());
        }
        ScrapeResponse response = ScrapeResponses.fromJob(job);

        OutputFormat format = job.getRequest().getOutputFormat();
        if (job.getStatus() == JobStatus.SUCCEEDED && format != null && format != OutputFormat.JSON) {
            byte[] rendered = outputFormatter.render(response.getData(), response.getMetadata(), format);
            response = response.toBuilder()
                    .formattedData(new ScrapeResponse.FormattedData(
                            format, format.contentType(), new String(rendered, StandardCharsets.UTF_8)))
                    .build();
        }

        try {
            return objectMapper.writeValueAsBytes(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize webhook payload for job " + job.getId(), e);
        }
    }
}
