package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.export.Artifact;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.parse.NormalizedDocument;

import java.util.Map;

public record ScrapeResult(
        NormalizedDocument document,
        ExtractionResult extraction,
        Map<ExportFormat, Artifact> exports,
        ResultMetadata metadata
) {
}
