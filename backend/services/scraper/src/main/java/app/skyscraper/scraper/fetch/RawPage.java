package app.skyscraper.scraper.fetch;

public record RawPage(
        String requestedUrl,
        String finalUrl,
        int httpStatus,
        String contentType,
        String body
) {
}
