package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classification of parsed payloads and the JSON envelope shared by exports and job
 * responses: {@code {"type": ..., "data": ..., "entities": ..., "confidence": ...}}.
 */
public final class ExtractionResults {

    public static final String TYPE_FIELD = "type";
    public static final String DATA_FIELD = "data";
    public static final String ENTITIES_FIELD = "entities";
    public static final String CONFIDENCE_FIELD = "confidence";

    private ExtractionResults() {
    }

    public static ExtractionResult classify(JsonNode payload, EntityInsights insights) {
        if (payload instanceof ObjectNode object) {
            if (!findTables(object).isEmpty()) {
                return new TabularResult(object, insights);
            }
            if (isEntityList(object)) {
                return new EntityListResult(object, insights);
            }
        }
        return new FreeTextResult(payload == null ? JsonNodeFactory.instance.nullNode() : payload, insights);
    }

    public static List<ResultTable> findTables(JsonNode root) {
        List<ResultTable> tables = new ArrayList<>();
        collectTables(root, "", tables);
        return tables;
    }

    private static void collectTables(JsonNode node, String path, List<ResultTable> tables) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
            JsonNode value = field.getValue();
            if (isRowArray(value)) {
                tables.add(toTable(fieldPath, (ArrayNode) value));
            } else if (value.isObject()) {
                collectTables(value, fieldPath, tables);
            }
        }
    }

    private static boolean isRowArray(JsonNode value) {
        if (!value.isArray() || value.isEmpty()) {
            return false;
        }
        for (JsonNode element : value) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static ResultTable toTable(String name, ArrayNode array) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, JsonNode>> rows = new ArrayList<>();
        for (JsonNode element : array) {
            Map<String, JsonNode> row = new LinkedHashMap<>();
            element.fields().forEachRemaining(cell -> {
                columns.add(cell.getKey());
                row.put(cell.getKey(), cell.getValue());
            });
            rows.add(row);
        }
        return new ResultTable(name, List.copyOf(columns), rows);
    }

    private static boolean isEntityList(ObjectNode object) {
        if (object.isEmpty()) {
            return false;
        }
        boolean anyValue = false;
        Iterator<JsonNode> values = object.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (!value.isArray()) {
                return false;
            }
            for (JsonNode element : value) {
                if (element.isContainerNode()) {
                    return false;
                }
                anyValue = true;
            }
        }
        return anyValue;
    }

    public static ObjectNode toEnvelope(ExtractionResult result) {
        ObjectNode envelope = JsonNodeFactory.instance.objectNode();
        envelope.put(TYPE_FIELD, result.type());
        envelope.set(DATA_FIELD, result.data());
        EntityInsights insights = result.insights();
        if (insights != null) {
            ObjectNode entities = envelope.putObject(ENTITIES_FIELD);
            insights.entities().forEach((category, values) -> {
                ArrayNode array = entities.putArray(category);
                values.forEach(array::add);
            });
            envelope.put(CONFIDENCE_FIELD, insights.confidence());
        }
        return envelope;
    }

    public static ExtractionResult fromEnvelope(JsonNode envelope) {
        if (envelope == null || !envelope.isObject()) {
            throw new IllegalArgumentException("Extraction envelope must be a JSON object");
        }
        String type = envelope.path(TYPE_FIELD).asText("");
        JsonNode data = envelope.path(DATA_FIELD);
        EntityInsights insights = readInsights(envelope);
        return switch (type) {
            case TabularResult.TYPE -> new TabularResult(requireObject(data, type), insights);
            case EntityListResult.TYPE -> new EntityListResult(requireObject(data, type), insights);
            case FreeTextResult.TYPE -> new FreeTextResult(data.isMissingNode() ? JsonNodeFactory.instance.nullNode() : data, insights);
            case UnstructuredResult.TYPE -> new UnstructuredResult(
                    data.path(UnstructuredResult.RAW_FIELD).asText(""),
                    data.path(UnstructuredResult.NOTE_FIELD).asText(null),
                    insights
            );
            default -> throw new IllegalArgumentException("Unknown extraction result type: " + type);
        };
    }

    private static ObjectNode requireObject(JsonNode data, String type) {
        if (data instanceof ObjectNode object) {
            return object;
        }
        throw new IllegalArgumentException("Result of type " + type + " requires object data");
    }

    private static EntityInsights readInsights(JsonNode envelope) {
        JsonNode entitiesNode = envelope.path(ENTITIES_FIELD);
        JsonNode confidenceNode = envelope.path(CONFIDENCE_FIELD);
        if (!entitiesNode.isObject() && !confidenceNode.isNumber()) {
            return null;
        }
        Map<String, List<String>> entities = new LinkedHashMap<>();
        entitiesNode.fields().forEachRemaining(entry -> {
            List<String> values = new ArrayList<>();
            entry.getValue().forEach(value -> values.add(value.asText()));
            entities.put(entry.getKey(), values);
        });
        return new EntityInsights(entities, confidenceNode.asDouble(0.0));
    }
}
