package com.redditextractor.scraper.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The data object alone: {posts, comments, users, communities}.
 */
@Component
@RequiredArgsConstructor
public class JsonRenderer implements ResultRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public byte[] render(ScrapeResult result, ResultMetadata metadata) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("posts", result.getPosts());
        data.put("comments", result.getComments());
        data.put("users", result.getUsers());
        data.put("communities", result.getCommunities());
        try {
            return objectMapper.writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON render failed", e);
        }
    }
}
