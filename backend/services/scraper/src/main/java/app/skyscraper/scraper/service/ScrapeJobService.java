package app.skyscraper.scraper.service;

import app.skyscraper.scraper.compliance.ComplianceChecker;
import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.controller.dto.CreateScrapeJobRequest;
import app.skyscraper.scraper.controller.dto.ScrapeJobPageResponse;
import app.skyscraper.scraper.controller.dto.ScrapeJobResponse;
import app.skyscraper.scraper.controller.dto.SubmitScrapeJobResponse;
import app.skyscraper.scraper.controller.dto.TestScrapeResponse;
import app.skyscraper.scraper.domain.job.ExtractionOptions;
import app.skyscraper.scraper.domain.job.JobStats;
import app.skyscraper.scraper.domain.job.ScrapeJob;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.job.ScrapeResult;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.RenderMode;
import app.skyscraper.scraper.export.ExportUnsupportedException;
import app.skyscraper.scraper.pipeline.PipelineStageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Request boundary of the job API: validates input, maps results and translates domain
 * errors into HTTP statuses.
 */
@Service
public class ScrapeJobService {

    private static final Logger log = LoggerFactory.getLogger(ScrapeJobService.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 30;
    static final int MIN_TIMEOUT_SECONDS = 1;
    static final int MAX_TIMEOUT_SECONDS = 120;
    static final Duration TEST_SCRAPE_TIMEOUT = Duration.ofSeconds(15);
    static final int MAX_PAGE_SIZE = 100;

    private final ScrapeJobManager jobManager;
    private final ScrapePipeline pipeline;
    private final ComplianceChecker complianceChecker;
    private final ScrapeJobResponseMapper responseMapper;

    public ScrapeJobService(ScrapeJobManager jobManager,
                            ScrapePipeline pipeline,
                            ComplianceChecker complianceChecker,
                            ScrapeJobResponseMapper responseMapper) {
        this.jobManager = jobManager;
        this.pipeline = pipeline;
        this.complianceChecker = complianceChecker;
        this.responseMapper = responseMapper;
    }

    public SubmitScrapeJobResponse submit(CreateScrapeJobRequest request) {
        ScrapeJobInput input = toInput(request);
        ScrapeJob job = jobManager.submit(input);
        return new SubmitScrapeJobResponse(job.jobId(), job.status(), "Scraping job started successfully");
    }

    public ScrapeJobResponse getJob(UUID jobId) {
        ScrapeJob job = jobManager.getStatus(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found"));
        return responseMapper.toResponse(job);
    }

    public ScrapeJobPageResponse listJobs(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        List<ScrapeJobResponse> items = jobManager.list(limit, offset).stream()
                .map(responseMapper::toResponse)
                .toList();
        return new ScrapeJobPageResponse(items, limit, offset, jobManager.size());
    }

    public JobStats stats() {
        return jobManager.stats();
    }

    public ComplianceVerdict checkCompliance(String url) {
        return complianceChecker.check(requireHttpUrl(url));
    }

    /**
     * Runs the whole pipeline on the calling thread without creating a job.
     */
    public TestScrapeResponse testScrape(String url, String instruction) {
        String target = requireHttpUrl(url);
        String resolvedInstruction = instruction == null || instruction.isBlank()
                ? "Extract the main content"
                : instruction.trim();
        ScrapeJobInput input = new ScrapeJobInput(
                target,
                resolvedInstruction,
                ExportFormat.json,
                null,
                TEST_SCRAPE_TIMEOUT,
                RenderMode.direct,
                ExtractionOptions.defaults()
        );
        try {
            ScrapeResult result = pipeline.execute(null, input, verdict -> {
            });
            return TestScrapeResponse.success(responseMapper.toResultResponse(result));
        } catch (PipelineStageException ex) {
            log.info("Test scrape failed url={} stage={} error={}", target, ex.getStage(), ex.getMessage());
            return TestScrapeResponse.failure(ex.getStage() + ": " + ex.getMessage());
        }
    }

    ScrapeJobInput toInput(CreateScrapeJobRequest request) {
        String url = requireHttpUrl(request.url());
        if (request.instruction() == null || request.instruction().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "instruction is required");
        }
        ExportFormat format;
        try {
            format = ExportFormat.parse(request.format());
        } catch (ExportUnsupportedException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        String webhookUrl = request.webhookUrl() == null || request.webhookUrl().isBlank()
                ? null
                : requireHttpUrl(request.webhookUrl());
        ExtractionOptions options = new ExtractionOptions(
                Boolean.TRUE.equals(request.structuredExtraction()),
                Boolean.TRUE.equals(request.strictSchema()),
                Boolean.TRUE.equals(request.antiDetection())
        );
        return new ScrapeJobInput(
                url,
                request.instruction().trim(),
                format,
                webhookUrl,
                resolveTimeout(request.timeout()),
                parseRenderMode(request.renderMode()),
                options
        );
    }

    static Duration resolveTimeout(Integer seconds) {
        if (seconds == null) {
            return Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        }
        if (seconds < MIN_TIMEOUT_SECONDS || seconds > MAX_TIMEOUT_SECONDS) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "timeout must be between " + MIN_TIMEOUT_SECONDS + " and " + MAX_TIMEOUT_SECONDS + " seconds");
        }
        return Duration.ofSeconds(seconds);
    }

    static RenderMode parseRenderMode(String raw) {
        if (raw == null || raw.isBlank()) {
            return RenderMode.direct;
        }
        try {
            return RenderMode.valueOf(raw.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported render mode: " + raw.trim());
        }
    }

    static String requireHttpUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "url is required");
        }
        String trimmed = raw.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "url must be an absolute http(s) URL");
            }
        } catch (URISyntaxException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "url is malformed", ex);
        }
        return trimmed;
    }
}
