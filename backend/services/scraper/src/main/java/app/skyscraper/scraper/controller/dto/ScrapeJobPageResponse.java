package app.skyscraper.scraper.controller.dto;

import java.util.List;

public record ScrapeJobPageResponse(
        List<ScrapeJobResponse> items,
        int limit,
        int offset,
        long total
) {
}
