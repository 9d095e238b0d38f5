package app.skyscraper.scraper.controller.dto;

import app.skyscraper.scraper.domain.type.JobStatus;

import java.util.UUID;

public record SubmitScrapeJobResponse(
        UUID jobId,
        JobStatus status,
        String message
) {
}
