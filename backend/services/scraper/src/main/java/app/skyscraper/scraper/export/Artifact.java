package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;

public record Artifact(
        ExportFormat format,
        String contentType,
        String fileName,
        String content
) {
}
