package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.extraction.result.ExtractionResults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class JsonArtifactWriter implements ArtifactWriter {

    private final ObjectMapper objectMapper;

    public JsonArtifactWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.json;
    }

    @Override
    public String write(ExtractionResult result, ExportContext context) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ExtractionResults.toEnvelope(result));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render JSON export", ex);
        }
    }

    public ExtractionResult read(String json) {
        try {
            return ExtractionResults.fromEnvelope(objectMapper.readTree(json));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Export is not valid JSON", ex);
        }
    }
}
