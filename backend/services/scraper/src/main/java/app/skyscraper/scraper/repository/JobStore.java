package app.skyscraper.scraper.repository;

import app.skyscraper.scraper.domain.job.ScrapeJob;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

public interface JobStore {
    Optional<ScrapeJob> get(UUID jobId);

    void put(ScrapeJob job);

    /**
     * Replaces the stored snapshot with {@code change.apply(current)} atomically.
     *
     * @throws java.util.NoSuchElementException when the job is not stored
     */
    ScrapeJob update(UUID jobId, UnaryOperator<ScrapeJob> change);

    /**
     * Jobs ordered newest first.
     */
    List<ScrapeJob> list(int limit, int offset);

    List<ScrapeJob> all();

    boolean remove(UUID jobId);

    int size();
}
