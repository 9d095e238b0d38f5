package app.skyscraper.scraper.controller.dto;

import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.domain.job.JobError;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.JobStatus;
import app.skyscraper.scraper.domain.type.RenderMode;

import java.time.Instant;
import java.util.UUID;

public record ScrapeJobResponse(
        UUID jobId,
        JobStatus status,
        String url,
        String instruction,
        ExportFormat format,
        RenderMode renderMode,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        ComplianceVerdict compliance,
        ScrapeResultResponse result,
        JobError error
) {
}
