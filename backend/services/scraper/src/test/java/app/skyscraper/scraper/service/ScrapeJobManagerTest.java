package app.skyscraper.scraper.service;

import app.skyscraper.scraper.compliance.ComplianceChecker;
import app.skyscraper.scraper.config.ComplianceProps;
import app.skyscraper.scraper.config.ExtractionProps;
import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.config.ScraperJobProps;
import app.skyscraper.scraper.domain.job.ExtractionOptions;
import app.skyscraper.scraper.domain.job.IllegalJobTransitionException;
import app.skyscraper.scraper.domain.job.JobStats;
import app.skyscraper.scraper.domain.job.ScrapeJob;
import app.skyscraper.scraper.domain.job.ScrapeJobInput;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.JobStatus;
import app.skyscraper.scraper.domain.type.PipelineStage;
import app.skyscraper.scraper.domain.type.RenderMode;
import app.skyscraper.scraper.export.CsvArtifactWriter;
import app.skyscraper.scraper.export.DashboardArtifactWriter;
import app.skyscraper.scraper.export.Exporter;
import app.skyscraper.scraper.export.JsonArtifactWriter;
import app.skyscraper.scraper.export.XmlArtifactWriter;
import app.skyscraper.scraper.extraction.EntityDetector;
import app.skyscraper.scraper.extraction.ExtractionPromptBuilder;
import app.skyscraper.scraper.extraction.ExtractionResponseParser;
import app.skyscraper.scraper.extraction.SemanticExtractor;
import app.skyscraper.scraper.extraction.StubReasoningService;
import app.skyscraper.scraper.extraction.result.TabularResult;
import app.skyscraper.scraper.fetch.DirectPageLoader;
import app.skyscraper.scraper.fetch.PageFetcher;
import app.skyscraper.scraper.fetch.PageLoader;
import app.skyscraper.scraper.fetch.RawPage;
import app.skyscraper.scraper.parse.StructuralExtractor;
import app.skyscraper.scraper.pipeline.FetchFailedException;
import app.skyscraper.scraper.repository.InMemoryJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.endsWith;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScrapeJobManagerTest {

    private static final String PRODUCT_PAGE = """
            <html><head><title>Lamp Shop</title></head><body>
              <h1>Lamps</h1>
              <table><tr><th>Name</th><th>Price</th></tr><tr><td>Desk lamp</td><td>$19.99</td></tr></table>
            </body></html>
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DirectPageLoader robotsLoader = mock(DirectPageLoader.class);
    private final FakePageLoader pageLoader = new FakePageLoader();
    private final WebhookNotifier webhookNotifier = mock(WebhookNotifier.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        when(robotsLoader.load(endsWith("/robots.txt"), any(), anyBoolean()))
                .thenThrow(new FetchFailedException("HTTP 404", 404, null));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private ScrapePipeline pipeline() {
        JsonArtifactWriter jsonWriter = new JsonArtifactWriter(objectMapper);
        Exporter exporter = new Exporter(
                List.of(jsonWriter, new CsvArtifactWriter(), new XmlArtifactWriter(), new DashboardArtifactWriter(objectMapper)),
                jsonWriter
        );
        SemanticExtractor semanticExtractor = new SemanticExtractor(
                new StubReasoningService(),
                new ExtractionPromptBuilder(new ExtractionProps(null)),
                new ExtractionResponseParser(objectMapper),
                new EntityDetector()
        );
        return new ScrapePipeline(
                new ComplianceChecker(robotsLoader, new ComplianceProps(null)),
                new PageFetcher(List.of(pageLoader), new FetchProps(null, null, null, null, null)),
                new StructuralExtractor(),
                semanticExtractor,
                exporter
        );
    }

    private ScrapeJobManager manager(Executor executor, int maxJobs) {
        return new ScrapeJobManager(
                new InMemoryJobStore(),
                pipeline(),
                webhookNotifier,
                new ScrapeJobMetrics(meterRegistry),
                executor,
                new ScraperJobProps(null, null, maxJobs, Duration.ofHours(24), null)
        );
    }

    private static ScrapeJobInput input(String instruction, ExportFormat format) {
        return new ScrapeJobInput("https://shop.example.com/lamps", instruction, format, "https://hooks.example.com/done",
                Duration.ofSeconds(30), RenderMode.direct, ExtractionOptions.defaults());
    }

    private static List<CSVRecord> csv(String content) throws Exception {
        return CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
                .parse(new StringReader(content)).getRecords();
    }

    @Test
    void productScrapeCompletesWithTabularResult() throws Exception {
        pageLoader.page = PRODUCT_PAGE;
        ScrapeJobManager manager = manager(Runnable::run, 1000);

        ScrapeJob submitted = manager.submit(input("Extract product names and prices", ExportFormat.csv));
        ScrapeJob job = manager.getStatus(submitted.jobId()).orElseThrow();

        assertThat(submitted.status()).isEqualTo(JobStatus.queued);
        assertThat(job.status()).isEqualTo(JobStatus.completed);
        assertThat(job.error()).isNull();
        assertThat(job.compliance().allowed()).isTrue();
        assertThat(job.result().document().title()).isEqualTo("Lamp Shop");
        assertThat(job.result().document().tables()).hasSize(1);
        assertThat(job.result().extraction()).isInstanceOf(TabularResult.class);
        assertThat(job.result().exports()).containsKeys(ExportFormat.csv, ExportFormat.json);
        assertThat(job.result().metadata().httpStatus()).isEqualTo(200);
        assertThat(job.result().metadata().extractionMethod()).isEqualTo("ai:stub");

        List<CSVRecord> rows = csv(job.result().exports().get(ExportFormat.csv).content());
        assertThat(rows).isNotEmpty();
        assertThat(rows).allSatisfy(row -> {
            assertThat(row.get("name")).isNotBlank();
            assertThat(row.get("price")).isNotBlank();
        });
        verify(webhookNotifier).deliver(argThat(notified -> notified.status() == JobStatus.completed));
        assertThat(meterRegistry.get("scraper.jobs.completed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void blanketDisallowFailsAtComplianceWithoutFetching() {
        doReturn(new RawPage("https://shop.example.com/robots.txt", "https://shop.example.com/robots.txt",
                200, "text/plain", "User-agent: *\nDisallow: /\n"))
                .when(robotsLoader).load(endsWith("/robots.txt"), any(), anyBoolean());
        ScrapeJobManager manager = manager(Runnable::run, 1000);

        ScrapeJob job = manager.getStatus(manager.submit(input("Extract product prices", ExportFormat.json)).jobId())
                .orElseThrow();

        assertThat(job.status()).isEqualTo(JobStatus.failed);
        assertThat(job.error().stage()).isEqualTo(PipelineStage.compliance);
        assertThat(job.result()).isNull();
        assertThat(job.compliance().allowed()).isFalse();
        assertThat(pageLoader.calls.get()).isZero();
        verify(webhookNotifier).deliver(argThat(notified -> notified.status() == JobStatus.failed));
    }

    @Test
    void textualResultExportsSingleCsvRow() throws Exception {
        pageLoader.page = "<html><body><p>About our company.</p></body></html>";
        ScrapeJobManager manager = manager(Runnable::run, 1000);

        ScrapeJob job = manager.getStatus(manager.submit(input("Summarize the page", ExportFormat.csv)).jobId())
                .orElseThrow();

        List<CSVRecord> rows = csv(job.result().exports().get(ExportFormat.csv).content());
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).isMapped("summary")).isTrue();
        assertThat(rows.get(0).get("key_points")).startsWith("[");
    }

    @Test
    void unknownJobIsNotFound() {
        ScrapeJobManager manager = manager(Runnable::run, 1000);

        assertThat(manager.getStatus(UUID.randomUUID())).isEmpty();
        assertThat(manager.awaitCompletion(UUID.randomUUID(), Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void fetchFailureIsRecordedAgainstFetchStage() {
        pageLoader.failure = new FetchFailedException("HTTP 503 fetching https://shop.example.com/lamps", 503, null);
        ScrapeJobManager manager = manager(Runnable::run, 1000);

        ScrapeJob job = manager.getStatus(manager.submit(input("prices", ExportFormat.json)).jobId()).orElseThrow();

        assertThat(job.status()).isEqualTo(JobStatus.failed);
        assertThat(job.error().stage()).isEqualTo(PipelineStage.fetch);
        assertThat(job.error().reason()).contains("503");
        assertThat(meterRegistry.get("scraper.jobs.failed").tag("stage", "fetch").counter().count()).isEqualTo(1.0);
    }

    @Test
    void finishedJobCannotRunAgain() {
        pageLoader.page = PRODUCT_PAGE;
        ScrapeJobManager manager = manager(Runnable::run, 1000);
        ScrapeJob job = manager.submit(input("prices", ExportFormat.json));

        assertThatThrownBy(() -> manager.run(job.jobId())).isInstanceOf(IllegalJobTransitionException.class);
        assertThat(manager.getStatus(job.jobId()).orElseThrow().status()).isEqualTo(JobStatus.completed);
    }

    @Test
    void awaitCompletionWaitsForWorkerThread() {
        pageLoader.page = PRODUCT_PAGE;
        pool = Executors.newSingleThreadExecutor();
        ScrapeJobManager manager = manager(pool, 1000);

        ScrapeJob job = manager.submit(input("prices", ExportFormat.xml));
        ScrapeJob finished = manager.awaitCompletion(job.jobId(), Duration.ofSeconds(10)).orElseThrow();

        assertThat(finished.status()).isEqualTo(JobStatus.completed);
        assertThat(finished.result().exports().get(ExportFormat.xml).content()).contains("<extraction>");
    }

    @Test
    void rejectedJobIsFailedImmediately() {
        Executor rejecting = runnable -> {
            throw new RejectedExecutionException("full");
        };
        ScrapeJobManager manager = manager(rejecting, 1000);

        ScrapeJob job = manager.getStatus(manager.submit(input("prices", ExportFormat.json)).jobId()).orElseThrow();

        assertThat(job.status()).isEqualTo(JobStatus.failed);
        assertThat(job.error().stage()).isEqualTo(PipelineStage.dispatch);
        assertThat(job.error().reason()).contains("rejected");
        assertThat(job.compliance()).isNull();
    }

    @Test
    void statsCountJobsByState() {
        pageLoader.page = PRODUCT_PAGE;
        ScrapeJobManager manager = manager(runnable -> {
        }, 1000);
        ScrapeJob first = manager.submit(input("prices", ExportFormat.json));
        manager.submit(input("prices", ExportFormat.json));
        manager.run(first.jobId());

        JobStats stats = manager.stats();

        assertThat(stats.completed()).isEqualTo(1);
        assertThat(stats.queued()).isEqualTo(1);
        assertThat(stats.failed()).isZero();
        assertThat(stats.total()).isEqualTo(2);
        assertThat(manager.list(10, 0)).hasSize(2);
    }

    @Test
    void retentionEvictsOnlyExpiredTerminalJobs() {
        pageLoader.page = PRODUCT_PAGE;
        ScrapeJobManager manager = manager(runnable -> {
        }, 1000);
        ScrapeJob done = manager.submit(input("prices", ExportFormat.json));
        ScrapeJob pending = manager.submit(input("prices", ExportFormat.json));
        manager.run(done.jobId());

        assertThat(manager.evictExpired(Instant.now())).isZero();
        int evicted = manager.evictExpired(Instant.now().plus(Duration.ofHours(25)));

        assertThat(evicted).isEqualTo(1);
        assertThat(manager.getStatus(done.jobId())).isEmpty();
        assertThat(manager.getStatus(pending.jobId())).isPresent();
    }

    @Test
    void capacityEvictsOldestTerminalJobsOnly() {
        pageLoader.page = PRODUCT_PAGE;
        ScrapeJobManager manager = manager(runnable -> {
        }, 1);
        ScrapeJob first = manager.submit(input("prices", ExportFormat.json));
        manager.run(first.jobId());

        ScrapeJob second = manager.submit(input("prices", ExportFormat.json));
        assertThat(manager.getStatus(first.jobId())).isEmpty();

        ScrapeJob third = manager.submit(input("prices", ExportFormat.json));
        assertThat(manager.getStatus(second.jobId())).isPresent();
        assertThat(manager.getStatus(third.jobId())).isPresent();
        verify(webhookNotifier, never()).deliver(argThat(job -> job.jobId().equals(second.jobId())));
    }

    static final class FakePageLoader implements PageLoader {

        private final AtomicInteger calls = new AtomicInteger();
        private volatile String page = "<html><body></body></html>";
        private volatile RuntimeException failure;

        @Override
        public RenderMode mode() {
            return RenderMode.direct;
        }

        @Override
        public RawPage load(String url, Duration timeout, boolean antiDetection) {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return new RawPage(url, url, 200, "text/html", page);
        }
    }
}
