package app.skyscraper.scraper.controller.dto;

import app.skyscraper.scraper.domain.job.JobStats;

import java.time.Instant;
import java.util.List;

public record ServiceStatusResponse(
        String service,
        String version,
        String status,
        List<String> features,
        JobStats jobs,
        Instant timestamp
) {
}
