package app.skyscraper.scraper.service;

import app.skyscraper.scraper.compliance.ComplianceChecker;
import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.domain.job.ResultMetadata;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.job.ScrapeResult;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.PipelineStage;
import app.skyscraper.scraper.export.Artifact;
import app.skyscraper.scraper.export.ExportContext;
import app.skyscraper.scraper.export.Exporter;
import app.skyscraper.scraper.extraction.SemanticExtractor;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.fetch.PageFetcher;
import app.skyscraper.scraper.fetch.RawPage;
import app.skyscraper.scraper.parse.NormalizedDocument;
import app.skyscraper.scraper.parse.StructuralExtractor;
import app.skyscraper.scraper.pipeline.ComplianceDeniedException;
import app.skyscraper.scraper.pipeline.PipelineStageException;
import app.skyscraper.scraper.pipeline.StageFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs the stages of one scrape in order: compliance, fetch, parse, extract, export.
 * Every failure leaves as a {@link PipelineStageException} naming the stage it came from.
 */
@Service
public class ScrapePipeline {

    private static final Logger log = LoggerFactory.getLogger(ScrapePipeline.class);
    private static final int MAX_REASON_LENGTH = 200;

    private final ComplianceChecker complianceChecker;
    private final PageFetcher pageFetcher;
    private final StructuralExtractor structuralExtractor;
    private final SemanticExtractor semanticExtractor;
    private final Exporter exporter;

    public ScrapePipeline(ComplianceChecker complianceChecker,
                          PageFetcher pageFetcher,
                          StructuralExtractor structuralExtractor,
                          SemanticExtractor semanticExtractor,
                          Exporter exporter) {
        this.complianceChecker = complianceChecker;
        this.pageFetcher = pageFetcher;
        this.structuralExtractor = structuralExtractor;
        this.semanticExtractor = semanticExtractor;
        this.exporter = exporter;
    }

    public ScrapeResult execute(UUID jobId, ScrapeJobInput input, Consumer<ComplianceVerdict> onVerdict) {
        long startedNanos = System.nanoTime();

        ComplianceVerdict verdict = stage(PipelineStage.compliance, () -> complianceChecker.check(input.url()));
        onVerdict.accept(verdict);
        if (!verdict.allowed()) {
            throw new ComplianceDeniedException(verdict);
        }

        long fetchStarted = System.nanoTime();
        RawPage page = stage(PipelineStage.fetch, () -> pageFetcher.fetch(
                input.url(),
                input.timeout(),
                input.effectiveRenderMode(),
                input.options() != null && input.options().antiDetection()
        ));
        long fetchMs = elapsedMs(fetchStarted);

        NormalizedDocument document = stage(PipelineStage.parse, () -> structuralExtractor.parse(page));

        long extractionStarted = System.nanoTime();
        ExtractionResult extraction = stage(PipelineStage.extract,
                () -> semanticExtractor.extract(document, input.instruction(), input.options()));
        long extractionMs = elapsedMs(extractionStarted);

        Instant timestamp = Instant.now();
        ExportContext context = new ExportContext(document.url(), document.title(), input.instruction(), timestamp);
        Map<ExportFormat, Artifact> exports = stage(PipelineStage.export, () -> render(jobId, input.format(), extraction, context));

        ResultMetadata metadata = new ResultMetadata(
                input.url(),
                page.finalUrl(),
                page.httpStatus(),
                input.instruction(),
                document.stats(),
                "ai:" + semanticExtractor.provider(),
                fetchMs,
                extractionMs,
                elapsedMs(startedNanos),
                timestamp
        );
        log.debug("Scrape pipeline finished jobId={} type={} fetchMs={} extractionMs={}",
                jobId, extraction.type(), fetchMs, extractionMs);
        return new ScrapeResult(document, extraction, exports, metadata);
    }

    private Map<ExportFormat, Artifact> render(UUID jobId, ExportFormat requested, ExtractionResult extraction, ExportContext context) {
        ExportFormat format = requested == null ? ExportFormat.json : requested;
        Map<ExportFormat, Artifact> exports = new LinkedHashMap<>();
        exports.put(format, exporter.render(extraction, format, context, jobId));
        if (format != ExportFormat.json) {
            exports.put(ExportFormat.json, exporter.render(extraction, ExportFormat.json, context, jobId));
        }
        return exports;
    }

    private static <T> T stage(PipelineStage stage, Supplier<T> body) {
        try {
            return body.get();
        } catch (PipelineStageException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StageFailedException(stage, summarizeError(ex), ex);
        }
    }

    static String summarizeError(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            return root.getClass().getSimpleName();
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= MAX_REASON_LENGTH ? trimmed : trimmed.substring(0, MAX_REASON_LENGTH) + "...";
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
