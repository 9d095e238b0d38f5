package app.skyscraper.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scraper.jobs")
public record ScraperJobProps(
        Integer workerThreads,
        Integer queueCapacity,
        Integer maxJobs,
        Duration retention,
        Duration webhookTimeout
) {
}
