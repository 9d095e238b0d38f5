package app.skyscraper.scraper.service;

import app.skyscraper.scraper.controller.dto.ScrapeJobResponse;
import app.skyscraper.scraper.controller.dto.ScrapeResultResponse;
import app.skyscraper.scraper.domain.job.ScrapeJob;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.job.ScrapeResult;
import app.skyscraper.scraper.extraction.result.ExtractionResults;
import org.springframework.stereotype.Component;

/**
 * Shape shared by the status endpoint and webhook deliveries.
 */
@Component
public class ScrapeJobResponseMapper {

    public ScrapeJobResponse toResponse(ScrapeJob job) {
        ScrapeJobInput input = job.input();
        return new ScrapeJobResponse(
                job.jobId(),
                job.status(),
                input.url(),
                input.instruction(),
                input.format(),
                input.effectiveRenderMode(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.compliance(),
                job.result() == null ? null : toResultResponse(job.result()),
                job.error()
        );
    }

    public ScrapeResultResponse toResultResponse(ScrapeResult result) {
        return new ScrapeResultResponse(
                result.document(),
                ExtractionResults.toEnvelope(result.extraction()),
                result.exports(),
                result.metadata()
        );
    }
}
