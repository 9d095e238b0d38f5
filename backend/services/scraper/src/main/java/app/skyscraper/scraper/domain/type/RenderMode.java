package app.skyscraper.scraper.domain.type;

/**
 * How a page is retrieved: {@code direct} issues a plain HTTP request and never runs page
 * scripts, {@code browser} loads the page in a headless browser so script-generated
 * content is present in the markup.
 */
public enum RenderMode {
    direct,
    browser
}
