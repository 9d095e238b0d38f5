package app.skyscraper.scraper.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestScrapeResponse(
        boolean success,
        ScrapeResultResponse data,
        String error
) {

    public static TestScrapeResponse success(ScrapeResultResponse data) {
        return new TestScrapeResponse(true, data, null);
    }

    public static TestScrapeResponse failure(String error) {
        return new TestScrapeResponse(false, null, error);
    }
}
