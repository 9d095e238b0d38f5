package app.skyscraper.scraper.extraction.result;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public record TabularResult(ObjectNode data, EntityInsights insights) implements ExtractionResult {

    public static final String TYPE = "tabular";

    @Override
    public String type() {
        return TYPE;
    }

    public List<ResultTable> tables() {
        return ExtractionResults.findTables(data);
    }

    @Override
    public TabularResult withInsights(EntityInsights insights) {
        return new TabularResult(data, insights);
    }
}
