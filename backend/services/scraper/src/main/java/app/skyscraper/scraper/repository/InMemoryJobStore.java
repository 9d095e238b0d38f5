package app.skyscraper.scraper.repository;

import app.skyscraper.scraper.domain.job.ScrapeJob;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry entry) -> entry.job().createdAt())
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final ConcurrentMap<UUID, Entry> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<ScrapeJob> get(UUID jobId) {
        Entry entry = jobs.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.job());
    }

    @Override
    public void put(ScrapeJob job) {
        long seq = sequence.incrementAndGet();
        jobs.compute(job.jobId(), (id, existing) ->
                new Entry(job, existing == null ? seq : existing.sequence()));
    }

    @Override
    public ScrapeJob update(UUID jobId, UnaryOperator<ScrapeJob> change) {
        Entry updated = jobs.computeIfPresent(jobId, (id, existing) ->
                new Entry(change.apply(existing.job()), existing.sequence()));
        if (updated == null) {
            throw new NoSuchElementException("Job not found: " + jobId);
        }
        return updated.job();
    }

    @Override
    public List<ScrapeJob> list(int limit, int offset) {
        return jobs.values().stream()
                .sorted(NEWEST_FIRST)
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .map(Entry::job)
                .toList();
    }

    @Override
    public List<ScrapeJob> all() {
        return jobs.values().stream()
                .sorted(NEWEST_FIRST)
                .map(Entry::job)
                .toList();
    }

    @Override
    public boolean remove(UUID jobId) {
        return jobs.remove(jobId) != null;
    }

    @Override
    public int size() {
        return jobs.size();
    }

    private record Entry(ScrapeJob job, long sequence) {
    }
}
