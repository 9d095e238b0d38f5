package app.skyscraper.scraper.controller;

import app.skyscraper.scraper.controller.dto.ServiceStatusResponse;
import app.skyscraper.scraper.domain.job.JobStats;
import app.skyscraper.scraper.service.ScrapeJobService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
public class StatusController {

    static final List<String> FEATURES = List.of(
            "ai_extraction",
            "structured_parsing",
            "robots_compliance",
            "browser_rendering",
            "export_json",
            "export_csv",
            "export_xml",
            "export_dashboard",
            "webhooks"
    );

    private final ScrapeJobService jobService;
    private final String serviceName;
    private final String version;

    public StatusController(ScrapeJobService jobService,
                            @Value("${spring.application.name:skyscraper}") String serviceName,
                            @Value("${app.version:1.0.0}") String version) {
        this.jobService = jobService;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/")
    public ServiceStatusResponse root() {
        return status();
    }

    @GetMapping("/health")
    public ServiceStatusResponse health() {
        return status();
    }

    @GetMapping("/api/stats")
    public JobStats stats() {
        return jobService.stats();
    }

    private ServiceStatusResponse status() {
        return new ServiceStatusResponse(serviceName, version, "healthy", FEATURES, jobService.stats(), Instant.now());
    }
}
