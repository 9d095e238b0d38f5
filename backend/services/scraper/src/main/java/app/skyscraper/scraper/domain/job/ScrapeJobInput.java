package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.domain.type.RenderMode;

import java.time.Duration;

public record ScrapeJobInput(
        String url,
        String instruction,
        ExportFormat format,
        String webhookUrl,
        Duration timeout,
        RenderMode renderMode,
        ExtractionOptions options
) {

    /**
     * Render mode the fetch stage uses; anti-detection always needs the browser.
     */
    public RenderMode effectiveRenderMode() {
        if (options != null && options.antiDetection()) {
            return RenderMode.browser;
        }
        return renderMode == null ? RenderMode.direct : renderMode;
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
