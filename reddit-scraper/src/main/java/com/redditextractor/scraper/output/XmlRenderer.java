package com.redditextractor.scraper.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.redditextractor.scraper.model.OutputFormat;
import com.redditextractor.scraper.model.RedditComment;
import com.redditextractor.scraper.model.RedditCommunity;
import com.redditextractor.scraper.model.RedditPost;
import com.redditextractor.scraper.model.RedditUser;
import com.redditextractor.scraper.model.ResultMetadata;
import com.redditextractor.scraper.model.ScrapeResult;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * XML document rooted at {@code <redditData>}, with the metadata block first and
 * one wrapper element per category.
 */
@Component
public class XmlRenderer implements ResultRenderer {

    private final XmlMapper xmlMapper = XmlMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
            .build();

    @Override
    public OutputFormat format() {
        return OutputFormat.XML;
    }

    @Override
    public byte[] render(ScrapeResult result, ResultMetadata metadata) {
        RedditData document = new RedditData(metadata, result.getPosts(), result.getComments(),
                result.getUsers(), result.getCommunities());
        try {
            return xmlMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("XML render failed", e);
        }
    }

    @Value
    @JacksonXmlRootElement(localName = "redditData")
    static class RedditData {

        ResultMetadata metadata;

        @JacksonXmlElementWrapper(localName = "posts")
        @JacksonXmlProperty(localName = "post")
        List<RedditPost> posts;

        @JacksonXmlElementWrapper(localName = "comments")
        @JacksonXmlProperty(localName = "comment")
        List<RedditComment> comments;

        @JacksonXmlElementWrapper(localName = "users")
        @JacksonXmlProperty(localName = "user")
        List<RedditUser> users;

        @JacksonXmlElementWrapper(localName = "communities")
        @JacksonXmlProperty(localName = "community")
        List<RedditCommunity> communities;
    }
}
