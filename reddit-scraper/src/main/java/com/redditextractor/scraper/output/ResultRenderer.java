package com.redditextractor.scraper.output;

import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;

/**
 * Encodes an aggregated result set. Implementations must be deterministic:
 * equal inputs give byte-identical output.
 */
public interface ResultRenderer {

    OutputFormat format();

    byte[] render(ScrapeResult result, ResultMetadata metadata);
}
