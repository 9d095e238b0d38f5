package app.skyscraper.scraper.service;

import app.skyscraper.scraper.config.ScraperJobProps;
import app.skyscraper.scraper.domain.job.JobError;
import app.skyscraper.scraper.domain.job.JobStats;
import app.skyscraper.scraper.domain.job.ScrapeJob;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.job.ScrapeResult;
import app.skyscraper.scraper.domain.type.JobStatus;
import app.skyscraper.scraper.domain.type.PipelineStage;
import app.skyscraper.scraper.pipeline.PipelineStageException;
import app.skyscraper.scraper.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;

/**
 * Owns the job table: creates jobs, runs their pipeline on the job executor and records
 * every status transition. Terminal jobs leave the table only through retention.
 */
@Service
public class ScrapeJobManager {

    private static final Logger log = LoggerFactory.getLogger(ScrapeJobManager.class);

    static final int DEFAULT_MAX_JOBS = 1000;
    static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final JobStore jobStore;
    private final ScrapePipeline pipeline;
    private final WebhookNotifier webhookNotifier;
    private final ScrapeJobMetrics metrics;
    private final Executor executor;
    private final int maxJobs;
    private final Duration retention;
    private final ConcurrentMap<UUID, CompletableFuture<ScrapeJob>> completions = new ConcurrentHashMap<>();

    public ScrapeJobManager(JobStore jobStore,
                            ScrapePipeline pipeline,
                            WebhookNotifier webhookNotifier,
                            ScrapeJobMetrics metrics,
                            @Qualifier("scrapeJobExecutor") Executor executor,
                            ScraperJobProps props) {
        this.jobStore = jobStore;
        this.pipeline = pipeline;
        this.webhookNotifier = webhookNotifier;
        this.metrics = metrics;
        this.executor = executor;
        this.maxJobs = props.maxJobs() == null ? DEFAULT_MAX_JOBS : Math.max(props.maxJobs(), 1);
        this.retention = props.retention() == null ? DEFAULT_RETENTION : props.retention();
    }

    public ScrapeJob submit(ScrapeJobInput input) {
        ScrapeJob job = ScrapeJob.queued(UUID.randomUUID(), input, Instant.now());
        completions.put(job.jobId(), new CompletableFuture<>());
        jobStore.put(job);
        metrics.jobSubmitted();
        log.info("Scrape job queued jobId={} url={} format={}", job.jobId(), input.url(), input.format());
        enforceCapacity();

        try {
            executor.execute(() -> runSafely(job.jobId()));
        } catch (RejectedExecutionException ex) {
            log.warn("Scrape job executor rejected jobId={}", job.jobId());
            ScrapeJob started = jobStore.update(job.jobId(), current -> current.start(Instant.now()));
            finish(started, current -> current.fail(
                    new JobError(PipelineStage.dispatch, "Job executor rejected the job"), Instant.now()));
        }
        return job;
    }

    /**
     * Runs the pipeline for a queued job on the calling thread.
     *
     * @throws app.skyscraper.scraper.domain.job.IllegalJobTransitionException when the job is not queued
     * @throws NoSuchElementException when the job is unknown
     */
    public ScrapeJob run(UUID jobId) {
        ScrapeJob started = jobStore.update(jobId, job -> job.start(Instant.now()));
        log.info("Scrape job started jobId={}", jobId);
        try {
            ScrapeResult result = pipeline.execute(jobId, started.input(),
                    verdict -> jobStore.update(jobId, job -> job.withCompliance(verdict)));
            return finish(started, job -> job.complete(result, Instant.now()));
        } catch (PipelineStageException ex) {
            log.warn("Scrape job failed jobId={} stage={} error={}", jobId, ex.getStage(), ex.getMessage());
            return finish(started, job -> job.fail(new JobError(ex.getStage(), ex.getMessage()), Instant.now()));
        }
    }

    private void runSafely(UUID jobId) {
        try {
            run(jobId);
        } catch (RuntimeException ex) {
            log.error("Scrape job crashed jobId={} error={}", jobId, ScrapePipeline.summarizeError(ex), ex);
        }
    }

    private ScrapeJob finish(ScrapeJob started, UnaryOperator<ScrapeJob> transition) {
        ScrapeJob finished = jobStore.update(started.jobId(), transition);
        Duration duration = Duration.between(started.startedAt(), finished.completedAt());
        if (finished.status() == JobStatus.completed) {
            metrics.jobCompleted(duration);
            log.info("Scrape job completed jobId={} durationMs={}", finished.jobId(), duration.toMillis());
        } else {
            metrics.jobFailed(finished.error() == null ? null : finished.error().stage(), duration);
        }
        CompletableFuture<ScrapeJob> completion = completions.remove(finished.jobId());
        if (completion != null) {
            completion.complete(finished);
        }
        webhookNotifier.deliver(finished);
        return finished;
    }

    public Optional<ScrapeJob> getStatus(UUID jobId) {
        return jobStore.get(jobId);
    }

    public List<ScrapeJob> list(int limit, int offset) {
        return jobStore.list(limit, offset);
    }

    public int size() {
        return jobStore.size();
    }

    public JobStats stats() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        List<ScrapeJob> jobs = jobStore.all();
        for (ScrapeJob job : jobs) {
            counts.merge(job.status(), 1L, Long::sum);
        }
        return new JobStats(
                counts.getOrDefault(JobStatus.queued, 0L),
                counts.getOrDefault(JobStatus.running, 0L),
                counts.getOrDefault(JobStatus.completed, 0L),
                counts.getOrDefault(JobStatus.failed, 0L),
                jobs.size()
        );
    }

    /**
     * Waits until the job reaches a terminal state or the timeout elapses, then returns the
     * latest snapshot.
     */
    public Optional<ScrapeJob> awaitCompletion(UUID jobId, Duration timeout) {
        Optional<ScrapeJob> current = jobStore.get(jobId);
        if (current.isEmpty() || current.get().status().isTerminal()) {
            return current;
        }
        CompletableFuture<ScrapeJob> completion = completions.get(jobId);
        if (completion == null) {
            return jobStore.get(jobId);
        }
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            return jobStore.get(jobId);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return jobStore.get(jobId);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Job completion failed: " + jobId, ex.getCause());
        }
    }

    /**
     * Removes terminal jobs that completed more than the retention period before {@code now}.
     */
    public int evictExpired(Instant now) {
        Instant cutoff = now.minus(retention);
        int evicted = 0;
        for (ScrapeJob job : jobStore.all()) {
            if (job.status().isTerminal() && job.completedAt() != null && job.completedAt().isBefore(cutoff)) {
                if (jobStore.remove(job.jobId())) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            metrics.jobsEvicted(evicted);
            log.info("Evicted expired scrape jobs count={} remaining={}", evicted, jobStore.size());
        }
        return evicted;
    }

    /**
     * Keeps the table at its capacity by dropping the oldest terminal jobs. Queued and
     * running jobs are never evicted, so the table may exceed capacity while they are pending.
     */
    int enforceCapacity() {
        int excess = jobStore.size() - maxJobs;
        if (excess <= 0) {
            return 0;
        }
        List<ScrapeJob> oldestTerminal = jobStore.all().stream()
                .filter(job -> job.status().isTerminal())
                .sorted(Comparator.comparing(ScrapeJob::completedAt))
                .limit(excess)
                .toList();
        int evicted = 0;
        for (ScrapeJob job : oldestTerminal) {
            if (jobStore.remove(job.jobId())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            metrics.jobsEvicted(evicted);
            log.info("Evicted scrape jobs over capacity count={} maxJobs={}", evicted, maxJobs);
        }
        return evicted;
    }
}
