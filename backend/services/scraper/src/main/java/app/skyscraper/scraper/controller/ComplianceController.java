package app.skyscraper.scraper.controller;

import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.service.ScrapeJobService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ComplianceController {

    private final ScrapeJobService jobService;

    public ComplianceController(ScrapeJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping("/api/compliance")
    public ComplianceVerdict check(@RequestParam String url) {
        return jobService.checkCompliance(url);
    }
}
