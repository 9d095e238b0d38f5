package app.skyscraper.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.scraper.extraction")
public record ExtractionProps(
        Integer maxContentChars
) {
}
