package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.domain.type.JobStatus;

import java.util.UUID;

public class IllegalJobTransitionException extends IllegalStateException {

    public IllegalJobTransitionException(UUID jobId, JobStatus from, String attempted) {
        super("Job " + jobId + " cannot " + attempted + " from status " + from);
    }
}
