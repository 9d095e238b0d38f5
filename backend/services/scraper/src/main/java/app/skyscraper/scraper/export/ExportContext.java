package app.skyscraper.scraper.export;

import java.time.Instant;

/**
 * Job details that exports may reference besides the extracted data.
 */
public record ExportContext(
        String sourceUrl,
        String title,
        String instruction,
        Instant generatedAt
) {

    public static ExportContext empty() {
        return new ExportContext("", "", "", Instant.EPOCH);
    }
}
