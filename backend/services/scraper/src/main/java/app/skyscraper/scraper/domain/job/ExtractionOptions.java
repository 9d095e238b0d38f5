package app.skyscraper.scraper.domain.job;

public record ExtractionOptions(
        boolean structuredExtraction,
        boolean strictSchema,
        boolean antiDetection
) {

    public static ExtractionOptions defaults() {
        return new ExtractionOptions(false, false, false);
    }
}
