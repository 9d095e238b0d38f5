package app.skyscraper.scraper.controller.dto;

import app.skyscraper.scraper.domain.job.ResultMetadata;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.export.Artifact;
import app.skyscraper.scraper.parse.NormalizedDocument;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record ScrapeResultResponse(
        NormalizedDocument document,
        JsonNode extraction,
        Map<ExportFormat, Artifact> exports,
        ResultMetadata metadata
) {
}
