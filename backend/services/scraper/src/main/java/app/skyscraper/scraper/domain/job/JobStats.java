package app.skyscraper.scraper.domain.job;

public record JobStats(
        long queued,
        long running,
        long completed,
        long failed,
        long total
) {
}
