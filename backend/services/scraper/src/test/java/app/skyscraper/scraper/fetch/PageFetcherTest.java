package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.domain.type.RenderMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherTest {

    private final RecordingLoader direct = new RecordingLoader(RenderMode.direct);
    private final RecordingLoader browser = new RecordingLoader(RenderMode.browser);

    @Test
    void defaultsToDirectAndClampsTimeout() {
        PageFetcher fetcher = new PageFetcher(List.of(direct, browser),
                new FetchProps(null, Duration.ofSeconds(30), Duration.ofSeconds(120), null, null));

        fetcher.fetch("https://example.com", null, null);
        fetcher.fetch("https://example.com", Duration.ofSeconds(500), RenderMode.direct);
        fetcher.fetch("https://example.com", Duration.ofSeconds(7), RenderMode.direct);

        assertThat(direct.timeouts).containsExactly(
                Duration.ofSeconds(30), Duration.ofSeconds(120), Duration.ofSeconds(7));
        assertThat(browser.timeouts).isEmpty();
    }

    @Test
    void antiDetectionAlwaysUsesBrowser() {
        PageFetcher fetcher = new PageFetcher(List.of(direct, browser), new FetchProps(null, null, null, null, null));

        RawPage page = fetcher.fetch("https://example.com", Duration.ofSeconds(5), RenderMode.direct, true);

        assertThat(page.body()).isEqualTo("browser");
        assertThat(browser.antiDetection).containsExactly(true);
        assertThat(direct.timeouts).isEmpty();
    }

    @Test
    void missingLoaderIsReported() {
        PageFetcher fetcher = new PageFetcher(List.of(direct), new FetchProps(null, null, null, null, null));

        assertThatThrownBy(() -> fetcher.fetch("https://example.com", null, RenderMode.browser))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("browser");
    }

    private static final class RecordingLoader implements PageLoader {
        private final RenderMode mode;
        private final List<Duration> timeouts = new ArrayList<>();
        private final List<Boolean> antiDetection = new ArrayList<>();

        RecordingLoader(RenderMode mode) {
            this.mode = mode;
        }

        @Override
        public RenderMode mode() {
            return mode;
        }

        @Override
        public RawPage load(String url, Duration timeout, boolean antiDetection) {
            timeouts.add(timeout);
            this.antiDetection.add(antiDetection);
            return new RawPage(url, url, 200, "text/html", mode.name());
        }
    }
}
