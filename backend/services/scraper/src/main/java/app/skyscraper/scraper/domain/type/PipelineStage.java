package app.skyscraper.scraper.domain.type;

/**
 * Where a job failed. {@code dispatch} covers jobs that never reached the pipeline, such as
 * submissions the job executor refused.
 */
public enum PipelineStage {
    dispatch,
    compliance,
    fetch,
    parse,
    extract,
    export
}
