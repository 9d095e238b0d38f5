package app.skyscraper.scraper.provider.gemini;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.scraper.gemini")
public record GeminiProps(
        String baseUrl,
        String apiKey,
        String model,
        Integer maxOutputTokens,
        Duration timeout
) {
}
