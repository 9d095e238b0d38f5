package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Instruction-shaped output of the semantic extraction stage. The variant records how the
 * payload is shaped so exporters can handle every case.
 */
public sealed interface ExtractionResult
        permits TabularResult, EntityListResult, FreeTextResult, UnstructuredResult {

    /**
     * Variant name used in the JSON envelope.
     */
    String type();

    /**
     * The payload as structured data.
     */
    JsonNode data();

    /**
     * Entity breakdown and confidence, present only when structured extraction was requested.
     */
    EntityInsights insights();

    ExtractionResult withInsights(EntityInsights insights);

    default boolean structuredParseFailed() {
        return false;
    }
}
