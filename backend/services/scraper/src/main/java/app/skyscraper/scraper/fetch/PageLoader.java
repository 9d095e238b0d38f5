package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.domain.type.RenderMode;

import java.time.Duration;

public interface PageLoader {
    RenderMode mode();

    /**
     * Loads the page, following redirects.
     *
     * @throws app.skyscraper.scraper.pipeline.FetchFailedException on network errors,
     *         timeouts, renderer crashes and non-2xx responses
     */
    RawPage load(String url, Duration timeout, boolean antiDetection);
}
