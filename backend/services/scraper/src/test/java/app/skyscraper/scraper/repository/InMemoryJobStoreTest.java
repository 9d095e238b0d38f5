package app.skyscraper.scraper.repository;

import app.skyscraper.scraper.domain.job.ExtractionOptions;
import app.skyscraper.scraper.domain.job.ScrapeJob;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.JobStatus;
import app.skyscraper.scraper.domain.type.RenderMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    private static ScrapeJob job(Instant createdAt) {
        ScrapeJobInput input = new ScrapeJobInput("https://example.com", "x", ExportFormat.json, null,
                Duration.ofSeconds(30), RenderMode.direct, ExtractionOptions.defaults());
        return ScrapeJob.queued(UUID.randomUUID(), input, createdAt);
    }

    @Test
    void listsNewestFirstWithPaging() {
        ScrapeJob oldest = job(T0);
        ScrapeJob middle = job(T0.plusSeconds(1));
        ScrapeJob newest = job(T0.plusSeconds(2));
        ScrapeJob sameInstant = job(T0.plusSeconds(2));
        store.put(oldest);
        store.put(newest);
        store.put(middle);
        store.put(sameInstant);

        assertThat(store.list(10, 0)).extracting(ScrapeJob::jobId)
                .containsExactly(sameInstant.jobId(), newest.jobId(), middle.jobId(), oldest.jobId());
        assertThat(store.list(2, 1)).extracting(ScrapeJob::jobId)
                .containsExactly(newest.jobId(), middle.jobId());
        assertThat(store.list(5, 10)).isEmpty();
    }

    @Test
    void updateReplacesSnapshotAndUnknownIdFails() {
        ScrapeJob queued = job(T0);
        store.put(queued);

        ScrapeJob running = store.update(queued.jobId(), current -> current.start(T0.plusSeconds(1)));

        assertThat(running.status()).isEqualTo(JobStatus.running);
        assertThat(store.get(queued.jobId())).contains(running);
        assertThatThrownBy(() -> store.update(UUID.randomUUID(), current -> current))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void failedUpdateKeepsPreviousSnapshot() {
        ScrapeJob queued = job(T0);
        store.put(queued);

        assertThatThrownBy(() -> store.update(queued.jobId(), current -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(store.get(queued.jobId())).contains(queued);
    }

    @Test
    void removeAndSize() {
        ScrapeJob a = job(T0);
        store.put(a);
        store.put(job(T0));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.remove(a.jobId())).isTrue();
        assertThat(store.remove(a.jobId())).isFalse();
        assertThat(store.get(a.jobId())).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void concurrentTransitionsAllowOnlyOneWinner() throws Exception {
        ScrapeJob queued = job(T0);
        store.put(queued);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                outcomes.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.update(queued.jobId(), current -> current.start(Instant.now()));
                        return true;
                    } catch (IllegalStateException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
