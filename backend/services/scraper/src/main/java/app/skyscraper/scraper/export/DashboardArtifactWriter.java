package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.extraction.result.ExtractionResults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a standalone Streamlit script. Every slot is filled with a JSON string literal,
 * which Python reads as an ordinary string. Slots are substituted in a single pass, so slot
 * markers inside substituted values stay literal text.
 */
@Component
public class DashboardArtifactWriter implements ArtifactWriter {

    static final String TEMPLATE_PATH = "templates/dashboard.py.tmpl";
    static final String DEFAULT_TITLE = "SkyScraper extraction";

    private static final Pattern SLOT = Pattern.compile("\\{\\{(TITLE|SOURCE_URL|GENERATED_AT|DATA_JSON)}}");

    private final ObjectMapper objectMapper;
    private final String template;

    public DashboardArtifactWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.template = loadTemplate();
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.dashboard;
    }

    @Override
    public String write(ExtractionResult result, ExportContext context) {
        ExportContext ctx = context == null ? ExportContext.empty() : context;
        String title = ctx.title() == null || ctx.title().isBlank() ? DEFAULT_TITLE : ctx.title();
        try {
            String data = objectMapper.writeValueAsString(ExtractionResults.toEnvelope(result));
            Map<String, String> slots = Map.of(
                    "TITLE", literal(title),
                    "SOURCE_URL", literal(ctx.sourceUrl() == null ? "" : ctx.sourceUrl()),
                    "GENERATED_AT", literal(String.valueOf(ctx.generatedAt())),
                    "DATA_JSON", literal(data)
            );
            return fill(slots);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render dashboard export", ex);
        }
    }

    private String fill(Map<String, String> slots) {
        Matcher matcher = SLOT.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(slots.get(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String literal(String value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(TEMPLATE_PATH).getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Dashboard template missing: " + TEMPLATE_PATH, ex);
        }
    }
}
