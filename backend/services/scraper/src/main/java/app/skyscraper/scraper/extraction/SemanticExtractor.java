package app.skyscraper.scraper.extraction;

import app.skyscraper.scraper.domain.job.ExtractionOptions;
import app.skyscraper.scraper.extraction.result.EntityInsights;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.extraction.result.ExtractionResults;
import app.skyscraper.scraper.extraction.result.UnstructuredResult;
import app.skyscraper.scraper.parse.NormalizedDocument;
import app.skyscraper.scraper.pipeline.ExtractionFailedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns page text and a free-text instruction into an {@link ExtractionResult}. An answer
 * without a parsable payload degrades to {@link UnstructuredResult}; only a failing
 * reasoning service aborts the job.
 */
@Service
public class SemanticExtractor {

    private static final Logger log = LoggerFactory.getLogger(SemanticExtractor.class);

    static final String UNPARSABLE_NOTE = "AI response could not be parsed as JSON";
    static final String NOT_OBJECT_NOTE = "AI response was not a JSON object";
    static final double PARSED_CONFIDENCE = 0.8;
    static final double DEGRADED_CONFIDENCE = 0.2;

    private final ReasoningService reasoningService;
    private final ExtractionPromptBuilder promptBuilder;
    private final ExtractionResponseParser responseParser;
    private final EntityDetector entityDetector;

    public SemanticExtractor(ReasoningService reasoningService,
                             ExtractionPromptBuilder promptBuilder,
                             ExtractionResponseParser responseParser,
                             EntityDetector entityDetector) {
        this.reasoningService = reasoningService;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.entityDetector = entityDetector;
    }

    public String provider() {
        return reasoningService.provider();
    }

    public ExtractionResult extract(NormalizedDocument document, String instruction, ExtractionOptions options) {
        ExtractionOptions effective = options == null ? ExtractionOptions.defaults() : options;
        String prompt = promptBuilder.build(document, instruction, effective);

        String answer;
        try {
            answer = reasoningService.complete(prompt);
        } catch (ExtractionFailedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ExtractionFailedException(
                    "Reasoning service " + reasoningService.provider() + " failed: " + describe(ex), ex);
        }

        Optional<JsonNode> payload = responseParser.parse(answer);
        if (payload.isEmpty()) {
            log.info("Extraction answer not parsable, falling back to raw text url={} chars={}",
                    document.url(), answer == null ? 0 : answer.length());
            return withInsights(new UnstructuredResult(answer, UNPARSABLE_NOTE, null), null, document, effective);
        }

        JsonNode node = payload.get();
        if (effective.strictSchema() && !node.isObject()) {
            return withInsights(new UnstructuredResult(answer, NOT_OBJECT_NOTE, null), null, document, effective);
        }
        ObjectNode data;
        if (node.isObject()) {
            data = (ObjectNode) node;
        } else {
            data = JsonNodeFactory.instance.objectNode();
            data.set("items", node);
        }

        LiftedInsights lifted = effective.structuredExtraction() ? liftInsights(data) : null;
        ExtractionResult result = ExtractionResults.classify(data, null);
        return withInsights(result, lifted, document, effective);
    }

    private ExtractionResult withInsights(ExtractionResult result,
                                          LiftedInsights lifted,
                                          NormalizedDocument document,
                                          ExtractionOptions options) {
        if (!options.structuredExtraction()) {
            return result;
        }
        Map<String, List<String>> entities = lifted == null || lifted.entities().isEmpty()
                ? entityDetector.detect(document.text())
                : lifted.entities();
        double confidence;
        if (lifted != null && lifted.confidence() != null) {
            confidence = lifted.confidence();
        } else {
            confidence = result.structuredParseFailed() ? DEGRADED_CONFIDENCE : PARSED_CONFIDENCE;
        }
        return result.withInsights(new EntityInsights(entities, confidence));
    }

    /**
     * Moves a model-supplied {@code entities} object and {@code confidence} number out of
     * the payload.
     */
    private LiftedInsights liftInsights(ObjectNode data) {
        Map<String, List<String>> entities = new LinkedHashMap<>();
        JsonNode entitiesNode = data.get("entities");
        if (entitiesNode != null && entitiesNode.isObject()) {
            entitiesNode.fields().forEachRemaining(entry -> {
                List<String> values = new ArrayList<>();
                if (entry.getValue().isArray()) {
                    entry.getValue().forEach(value -> values.add(value.isValueNode() ? value.asText() : value.toString()));
                } else if (!entry.getValue().isNull()) {
                    values.add(entry.getValue().asText());
                }
                entities.put(entry.getKey(), values);
            });
            data.remove("entities");
        }
        Double confidence = null;
        JsonNode confidenceNode = data.get("confidence");
        if (confidenceNode != null && confidenceNode.isNumber()) {
            double value = confidenceNode.asDouble();
            if (value >= 0.0 && value <= 1.0) {
                confidence = value;
            }
            data.remove("confidence");
        }
        return new LiftedInsights(entities, confidence);
    }

    private String describe(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }

    private record LiftedInsights(Map<String, List<String>> entities, Double confidence) {
    }
}
