package app.skyscraper.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scraper.fetch")
public record FetchProps(
        String userAgent,
        Duration defaultTimeout,
        Duration maxTimeout,
        Integer maxBodyBytes,
        Boolean browserHeadless
) {
}
