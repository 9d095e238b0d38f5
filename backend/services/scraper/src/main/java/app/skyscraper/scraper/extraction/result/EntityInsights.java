package app.skyscraper.scraper.extraction.result;

import java.util.List;
import java.util.Map;

public record EntityInsights(
        Map<String, List<String>> entities,
        double confidence
) {
}
