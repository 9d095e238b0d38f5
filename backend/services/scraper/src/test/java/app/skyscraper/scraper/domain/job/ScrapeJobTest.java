package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.JobStatus;
import app.skyscraper.scraper.domain.type.PipelineStage;
import app.skyscraper.scraper.domain.type.RenderMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeJobTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static ScrapeJobInput input(ExtractionOptions options, RenderMode mode) {
        return new ScrapeJobInput("https://example.com", "summarize", ExportFormat.json, null,
                Duration.ofSeconds(30), mode, options);
    }

    @Test
    void followsQueuedRunningFailedPath() {
        ScrapeJob queued = ScrapeJob.queued(UUID.randomUUID(), input(ExtractionOptions.defaults(), null), T0);
        ScrapeJob running = queued.start(T0.plusSeconds(1))
                .withCompliance(ComplianceVerdict.allow("ok", null));
        ScrapeJob failed = running.fail(new JobError(PipelineStage.fetch, "HTTP 500"), T0.plusSeconds(2));

        assertThat(queued.status()).isEqualTo(JobStatus.queued);
        assertThat(queued.result()).isNull();
        assertThat(queued.error()).isNull();
        assertThat(running.status()).isEqualTo(JobStatus.running);
        assertThat(running.completedAt()).isNull();
        assertThat(failed.status()).isEqualTo(JobStatus.failed);
        assertThat(failed.error().stage()).isEqualTo(PipelineStage.fetch);
        assertThat(failed.result()).isNull();
        assertThat(failed.compliance().allowed()).isTrue();
        assertThat(failed.completedAt()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void rejectsIllegalTransitions() {
        ScrapeJob queued = ScrapeJob.queued(UUID.randomUUID(), input(ExtractionOptions.defaults(), null), T0);
        ScrapeJob failed = queued.start(T0).fail(new JobError(PipelineStage.extract, "down"), T0);

        assertThatThrownBy(() -> queued.complete(null, T0)).isInstanceOf(IllegalJobTransitionException.class);
        assertThatThrownBy(() -> queued.withCompliance(ComplianceVerdict.allow("ok", null)))
                .isInstanceOf(IllegalJobTransitionException.class);
        assertThatThrownBy(() -> failed.start(T0)).isInstanceOf(IllegalJobTransitionException.class);
        assertThatThrownBy(() -> failed.fail(new JobError(PipelineStage.extract, "again"), T0))
                .isInstanceOf(IllegalJobTransitionException.class);
    }

    @Test
    void antiDetectionForcesBrowserRendering() {
        assertThat(input(ExtractionOptions.defaults(), null).effectiveRenderMode()).isEqualTo(RenderMode.direct);
        assertThat(input(ExtractionOptions.defaults(), RenderMode.browser).effectiveRenderMode()).isEqualTo(RenderMode.browser);
        assertThat(input(new ExtractionOptions(false, false, true), RenderMode.direct).effectiveRenderMode())
                .isEqualTo(RenderMode.browser);
    }
}
