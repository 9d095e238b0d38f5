package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionResultsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void findsNestedTablesWithDottedNames() throws Exception {
        JsonNode payload = json("""
                {"store": {"products": [{"name": "A", "price": 1}, {"name": "B", "stock": 3}]},
                 "tags": ["x", "y"]}
                """);

        List<ResultTable> tables = ExtractionResults.findTables(payload);

        assertThat(tables).hasSize(1);
        assertThat(tables.get(0).name()).isEqualTo("store.products");
        assertThat(tables.get(0).columns()).containsExactly("name", "price", "stock");
        assertThat(ExtractionResults.classify(payload, null)).isInstanceOf(TabularResult.class);
    }

    @Test
    void classifiesByShape() throws Exception {
        assertThat(ExtractionResults.classify(json("{\"emails\": [\"a@b.io\"], \"phones\": []}"), null))
                .isInstanceOf(EntityListResult.class);
        assertThat(ExtractionResults.classify(json("{\"summary\": \"text\", \"points\": [\"a\"]}"), null))
                .isInstanceOf(FreeTextResult.class);
        assertThat(ExtractionResults.classify(json("{\"emails\": []}"), null))
                .isInstanceOf(FreeTextResult.class);
        assertThat(ExtractionResults.classify(json("{\"mixed\": [{\"a\": 1}, 2]}"), null))
                .isInstanceOf(FreeTextResult.class);
    }

    @Test
    void envelopeRoundTripsEveryVariant() throws Exception {
        EntityInsights insights = new EntityInsights(Map.of("emails", List.of("a@b.io")), 0.8);
        List<ExtractionResult> results = List.of(
                ExtractionResults.classify(json("{\"rows\": [{\"a\": 1}]}"), insights),
                ExtractionResults.classify(json("{\"emails\": [\"a@b.io\"]}"), null),
                ExtractionResults.classify(json("{\"summary\": \"s\"}"), null),
                new UnstructuredResult("raw answer", "AI response could not be parsed as JSON", insights)
        );

        for (ExtractionResult result : results) {
            JsonNode envelope = ExtractionResults.toEnvelope(result);
            JsonNode reparsed = objectMapper.readTree(objectMapper.writeValueAsString(envelope));

            assertThat(ExtractionResults.fromEnvelope(reparsed)).isEqualTo(result);
        }
    }

    @Test
    void envelopeCarriesInsightsOnlyWhenPresent() throws Exception {
        JsonNode plain = ExtractionResults.toEnvelope(ExtractionResults.classify(json("{\"summary\": \"s\"}"), null));

        assertThat(plain.path("type").asText()).isEqualTo(FreeTextResult.TYPE);
        assertThat(plain.has("entities")).isFalse();
        assertThat(plain.has("confidence")).isFalse();
    }

    @Test
    void rejectsMalformedEnvelope() throws Exception {
        assertThatThrownBy(() -> ExtractionResults.fromEnvelope(json("[1]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExtractionResults.fromEnvelope(json("{\"type\": \"poem\", \"data\": {}}")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExtractionResults.fromEnvelope(json("{\"type\": \"tabular\", \"data\": 3}")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
