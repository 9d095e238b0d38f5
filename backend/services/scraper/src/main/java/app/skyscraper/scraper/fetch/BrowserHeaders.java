package app.skyscraper.scraper.fetch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request headers of a desktop Chrome session, sent with every page request so servers
 * treat the scraper like an ordinary browser.
 */
final class BrowserHeaders {

    static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    private BrowserHeaders() {
    }

    static Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Upgrade-Insecure-Requests", "1");
        return headers;
    }

    static String userAgent(String configured) {
        return (configured == null || configured.isBlank()) ? DEFAULT_USER_AGENT : configured;
    }
}
