package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.domain.type.JobStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a scrape job. Every transition returns a new snapshot, so a
 * reader always holds a consistent record.
 * <p>
 * Status only moves {@code queued -> running -> completed | failed}; {@code result} is set
 * only when completed and {@code error} only when failed.
 */
public record ScrapeJob(
        UUID jobId,
        JobStatus status,
        ScrapeJobInput input,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        ComplianceVerdict compliance,
        ScrapeResult result,
        JobError error
) {

    public static ScrapeJob queued(UUID jobId, ScrapeJobInput input, Instant createdAt) {
        return new ScrapeJob(jobId, JobStatus.queued, input, createdAt, null, null, null, null, null);
    }

    public ScrapeJob start(Instant now) {
        requireTransition(JobStatus.running, "start");
        return new ScrapeJob(jobId, JobStatus.running, input, createdAt, now, null, compliance, null, null);
    }

    public ScrapeJob withCompliance(ComplianceVerdict verdict) {
        if (status != JobStatus.running) {
            throw new IllegalJobTransitionException(jobId, status, "record a compliance verdict");
        }
        return new ScrapeJob(jobId, status, input, createdAt, startedAt, null, verdict, null, null);
    }

    public ScrapeJob complete(ScrapeResult result, Instant now) {
        requireTransition(JobStatus.completed, "complete");
        return new ScrapeJob(jobId, JobStatus.completed, input, createdAt, startedAt, now, compliance, result, null);
    }

    public ScrapeJob fail(JobError error, Instant now) {
        requireTransition(JobStatus.failed, "fail");
        return new ScrapeJob(jobId, JobStatus.failed, input, createdAt, startedAt, now, compliance, null, error);
    }

    private void requireTransition(JobStatus next, String attempted) {
        if (!status.canMoveTo(next)) {
            throw new IllegalJobTransitionException(jobId, status, attempted);
        }
    }
}
