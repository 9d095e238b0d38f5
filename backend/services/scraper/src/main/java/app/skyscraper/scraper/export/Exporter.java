package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class Exporter {

    private final Map<ExportFormat, ArtifactWriter> writers = new EnumMap<>(ExportFormat.class);
    private final JsonArtifactWriter jsonWriter;

    public Exporter(List<ArtifactWriter> writers, JsonArtifactWriter jsonWriter) {
        for (ArtifactWriter writer : writers) {
            this.writers.put(writer.format(), writer);
        }
        this.jsonWriter = jsonWriter;
    }

    public Artifact render(ExtractionResult result, ExportFormat format) {
        return render(result, format, ExportContext.empty(), null);
    }

    public Artifact render(ExtractionResult result, ExportFormat format, ExportContext context, UUID jobId) {
        ArtifactWriter writer = writers.get(format);
        if (writer == null) {
            throw new ExportUnsupportedException(format == null ? null : format.name());
        }
        String content = writer.write(result, context);
        return new Artifact(format, format.contentType(), fileName(jobId, format), content);
    }

    public ExtractionResult readJson(String json) {
        return jsonWriter.read(json);
    }

    static String fileName(UUID jobId, ExportFormat format) {
        String base = jobId == null ? "scrape" : "scrape-" + jobId;
        return base + "." + format.extension();
    }
}
