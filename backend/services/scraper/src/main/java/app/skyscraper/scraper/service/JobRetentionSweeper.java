package app.skyscraper.scraper.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class JobRetentionSweeper {

    private final ScrapeJobManager jobManager;

    public JobRetentionSweeper(ScrapeJobManager jobManager) {
        this.jobManager = jobManager;
    }

    @Scheduled(fixedDelayString = "${app.scraper.jobs.sweep-interval-ms:60000}")
    public void sweep() {
        jobManager.evictExpired(Instant.now());
    }
}
