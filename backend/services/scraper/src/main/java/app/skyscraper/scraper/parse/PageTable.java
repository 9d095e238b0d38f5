package app.skyscraper.scraper.parse;

import java.util.List;

public record PageTable(List<String> headers, List<List<String>> rows) {
}
