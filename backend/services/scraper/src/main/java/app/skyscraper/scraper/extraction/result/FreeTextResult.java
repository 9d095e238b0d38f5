package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;

public record FreeTextResult(JsonNode data, EntityInsights insights) implements ExtractionResult {

    public static final String TYPE = "free_text";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public FreeTextResult withInsights(EntityInsights insights) {
        return new FreeTextResult(data, insights);
    }
}
