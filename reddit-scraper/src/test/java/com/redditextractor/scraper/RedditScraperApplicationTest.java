package com.redditextractor.scraper;

import com.redditextractor.scraper.config.DiagnosticsController;
import com.redditextractor.scraper.config.ScrapeController;
import com.redditextractor.scraper.job.ScrapeWorkerPool;
import com.redditextractor.scraper.output.OutputFormatter;
import com.redditextractor.scraper.service.FetchGateway;
import com.redditextractor.scraper.service.RedditApiClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RedditScraperApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(ScrapeController.class)).isNotNull();
        assertThat(context.getBean(DiagnosticsController.class)).isNotNull();
        assertThat(context.getBean(ScrapeWorkerPool.class)).isNotNull();
        assertThat(context.getBean(FetchGateway.class)).isInstanceOf(RedditApiClient.class);
        assertThat(context.getBean(OutputFormatter.class)).isNotNull();
    }
}
