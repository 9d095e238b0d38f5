package app.skyscraper.scraper.controller;

import app.skyscraper.scraper.controller.dto.CreateScrapeJobRequest;
import app.skyscraper.scraper.controller.dto.ScrapeJobPageResponse;
import app.skyscraper.scraper.controller.dto.ScrapeJobResponse;
import app.skyscraper.scraper.controller.dto.SubmitScrapeJobResponse;
import app.skyscraper.scraper.controller.dto.TestScrapeResponse;
import app.skyscraper.scraper.service.ScrapeJobService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ScrapeJobController {

    private final ScrapeJobService jobService;

    public ScrapeJobController(ScrapeJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping("/scrape")
    public SubmitScrapeJobResponse scrape(@Valid @RequestBody CreateScrapeJobRequest request) {
        return jobService.submit(request);
    }

    @GetMapping("/jobs/{jobId}")
    public ScrapeJobResponse getJob(@PathVariable UUID jobId) {
        return jobService.getJob(jobId);
    }

    @GetMapping("/jobs")
    public ScrapeJobPageResponse list(@RequestParam(defaultValue = "20") int limit,
                                      @RequestParam(defaultValue = "0") int offset) {
        return jobService.listJobs(limit, offset);
    }

    @PostMapping("/test-scrape")
    public TestScrapeResponse testScrape(@RequestParam String url,
                                         @RequestParam(required = false) String instruction) {
        return jobService.testScrape(url, instruction);
    }
}
