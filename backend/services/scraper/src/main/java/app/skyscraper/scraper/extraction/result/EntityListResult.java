package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload whose every value is a list of scalars, e.g. {@code {"emails": [...], "phones": [...]}}.
 */
public record EntityListResult(ObjectNode data, EntityInsights insights) implements ExtractionResult {

    public static final String TYPE = "entity_list";

    @Override
    public String type() {
        return TYPE;
    }

    public Map<String, List<String>> groups() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        data.fields().forEachRemaining(entry -> {
            List<String> values = new ArrayList<>();
            for (JsonNode value : entry.getValue()) {
                values.add(value.asText());
            }
            groups.put(entry.getKey(), values);
        });
        return groups;
    }

    @Override
    public EntityListResult withInsights(EntityInsights insights) {
        return new EntityListResult(data, insights);
    }
}
