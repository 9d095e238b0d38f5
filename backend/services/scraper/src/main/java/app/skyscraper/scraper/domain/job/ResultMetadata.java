package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.parse.NormalizedDocument;

import java.time.Instant;

public record ResultMetadata(
        String url,
        String finalUrl,
        int httpStatus,
        String instruction,
        NormalizedDocument.ContentStats stats,
        String extractionMethod,
        long fetchMs,
        long extractionMs,
        long processingMs,
        Instant timestamp
) {
}
