package app.skyscraper.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scraper.compliance")
public record ComplianceProps(
        Duration timeout
) {
}
