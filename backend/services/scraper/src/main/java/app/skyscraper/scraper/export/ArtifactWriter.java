package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;

public interface ArtifactWriter {
    ExportFormat format();

    String write(ExtractionResult result, ExportContext context);
}
