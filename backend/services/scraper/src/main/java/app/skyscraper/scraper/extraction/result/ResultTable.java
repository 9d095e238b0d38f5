package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * An array of objects found in a result payload. {@code name} is the dotted path of the
 * array and {@code columns} the union of row keys in first-seen order.
 */
public record ResultTable(
        String name,
        List<String> columns,
        List<Map<String, JsonNode>> rows
) {
}
