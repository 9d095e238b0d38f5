package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fallback when the reasoning service answered with text that holds no parsable payload.
 */
public record UnstructuredResult(String rawText, String note, EntityInsights insights) implements ExtractionResult {

    public static final String TYPE = "unstructured";
    public static final String RAW_FIELD = "ai_extracted_content";
    public static final String NOTE_FIELD = "note";
    public static final String FLAG_FIELD = "structured_parse_failed";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public JsonNode data() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(RAW_FIELD, rawText == null ? "" : rawText);
        node.put(NOTE_FIELD, note);
        node.put(FLAG_FIELD, true);
        return node;
    }

    @Override
    public boolean structuredParseFailed() {
        return true;
    }

    @Override
    public UnstructuredResult withInsights(EntityInsights insights) {
        return new UnstructuredResult(rawText, note, insights);
    }
}
