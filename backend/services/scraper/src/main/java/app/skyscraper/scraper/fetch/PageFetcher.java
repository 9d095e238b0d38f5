package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.domain.type.RenderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches raw page content with the loader that matches the requested render mode.
 * Failures surface as {@link app.skyscraper.scraper.pipeline.FetchFailedException} and are
 * never retried here.
 */
@Component
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final Duration MAX_TIMEOUT = Duration.ofSeconds(120);

    private final Map<RenderMode, PageLoader> loaders = new EnumMap<>(RenderMode.class);
    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    public PageFetcher(List<PageLoader> loaders, FetchProps props) {
        for (PageLoader loader : loaders) {
            this.loaders.putIfAbsent(loader.mode(), loader);
        }
        this.defaultTimeout = props.defaultTimeout() == null ? DEFAULT_TIMEOUT : props.defaultTimeout();
        this.maxTimeout = props.maxTimeout() == null ? MAX_TIMEOUT : props.maxTimeout();
    }

    public RawPage fetch(String url, Duration timeout, RenderMode renderMode) {
        return fetch(url, timeout, renderMode, false);
    }

    public RawPage fetch(String url, Duration timeout, RenderMode renderMode, boolean antiDetection) {
        RenderMode mode = antiDetection ? RenderMode.browser : (renderMode == null ? RenderMode.direct : renderMode);
        PageLoader loader = loaders.get(mode);
        if (loader == null) {
            throw new IllegalStateException("No page loader for render mode " + mode);
        }
        long startedAt = System.nanoTime();
        RawPage page = loader.load(url, resolveTimeout(timeout), antiDetection);
        log.info("Fetched url={} finalUrl={} status={} mode={} bytes={} tookMs={}",
                url,
                page.finalUrl(),
                page.httpStatus(),
                mode,
                page.body() == null ? 0 : page.body().length(),
                (System.nanoTime() - startedAt) / 1_000_000L);
        return page;
    }

    Duration resolveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return defaultTimeout;
        }
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }
}
