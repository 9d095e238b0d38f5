package app.skyscraper.scraper.parse;

import java.util.List;

public record PageList(String type, List<String> items) {
}
