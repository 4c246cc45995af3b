package com.redditextractor.scraper.output;

import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a result set to the renderer for the requested encoding.
 * Used for inline response bodies and webhook formattedData alike.
 */
@Component
@Slf4j
public class OutputFormatter {

    private final Map<OutputFormat, ResultRenderer> renderers = new EnumMap<>(OutputFormat.class);

    public OutputFormatter(List<ResultRenderer> renderers) {
        for (ResultRenderer renderer : renderers) {
            this.renderers.put(renderer.format(), renderer);
        }
    }

    public byte[] render(ScrapeResult result, ResultMetadata metadata, OutputFormat format) {
        ResultRenderer renderer = renderers.get(format);
        if (renderer == null) {
            throw new IllegalArgumentException("No renderer for output format " + format);
        }
        byte[] body = renderer.render(result == null ? ScrapeResult.EMPTY : result, metadata);
        log.debug("Rendered {} bytes as {}", body.length, format);
        return body;
    }
}
