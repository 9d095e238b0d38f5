package app.skyscraper.scraper.service;

import app.skyscraper.scraper.domain.type.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ScrapeJobMetrics {

    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter completed;

    public ScrapeJobMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.submitted = Counter.builder("scraper.jobs.submitted")
                .description("Scrape jobs accepted")
                .register(registry);
        this.completed = Counter.builder("scraper.jobs.completed")
                .description("Scrape jobs finished successfully")
                .register(registry);
    }

    public void jobSubmitted() {
        submitted.increment();
    }

    public void jobCompleted(Duration duration) {
        completed.increment();
        timer("completed").record(duration);
    }

    public void jobFailed(PipelineStage stage, Duration duration) {
        Counter.builder("scraper.jobs.failed")
                .description("Scrape jobs that failed, by stage")
                .tag("stage", stage == null ? "unknown" : stage.name())
                .register(registry)
                .increment();
        timer("failed").record(duration);
    }

    public void jobsEvicted(int count) {
        if (count > 0) {
            registry.counter("scraper.jobs.evicted").increment(count);
        }
    }

    private Timer timer(String outcome) {
        return Timer.builder("scraper.jobs.duration")
                .description("Time from job start to its terminal state")
                .tag("outcome", outcome)
                .register(registry);
    }
}
