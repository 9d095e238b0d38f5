package app.skyscraper.scraper.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateScrapeJobRequest(
        @NotBlank @Size(max = 2048) String url,
        @NotBlank @Size(max = 2000) String instruction,
        String format,
        @Size(max = 2048) String webhookUrl,
        @Min(1) @Max(120) Integer timeout,
        Boolean structuredExtraction,
        Boolean strictSchema,
        Boolean antiDetection,
        String renderMode
) {
}
