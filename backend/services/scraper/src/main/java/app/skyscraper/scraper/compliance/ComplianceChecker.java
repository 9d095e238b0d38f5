package app.skyscraper.scraper.compliance;

import app.skyscraper.scraper.config.ComplianceProps;
import app.skyscraper.scraper.fetch.DirectPageLoader;
import app.skyscraper.scraper.fetch.RawPage;
import app.skyscraper.scraper.pipeline.FetchFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

/**
 * Reads the site's robots.txt and denies crawling only on a blanket disallow. A missing
 * or unreachable policy document counts as permission.
 */
@Component
public class ComplianceChecker {

    private static final Logger log = LoggerFactory.getLogger(ComplianceChecker.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final DirectPageLoader loader;
    private final Duration timeout;

    public ComplianceChecker(DirectPageLoader loader, ComplianceProps props) {
        this.loader = loader;
        this.timeout = props.timeout() == null ? DEFAULT_TIMEOUT : props.timeout();
    }

    public ComplianceVerdict check(String url) {
        String policyUrl = policyUrl(url);
        if (policyUrl == null) {
            return ComplianceVerdict.allow("Target URL has no scheme or host, policy not checked", null);
        }

        try {
            RawPage policy = loader.load(policyUrl, timeout, false);
            if (RobotsPolicy.hasBlanketDisallow(policy.body())) {
                log.info("Crawling disallowed url={} policy={}", url, policyUrl);
                return ComplianceVerdict.deny("robots.txt disallows crawling the entire site", policyUrl);
            }
            return ComplianceVerdict.allow("robots.txt does not block the site", policyUrl);
        } catch (FetchFailedException ex) {
            Integer status = ex.getHttpStatus();
            if (status != null && (status == 404 || status == 410)) {
                return ComplianceVerdict.allow("No robots.txt published", policyUrl);
            }
            log.warn("Policy fetch failed, proceeding url={} policy={} error={}", url, policyUrl, ex.getMessage());
            return ComplianceVerdict.allow("robots.txt could not be retrieved: " + ex.getMessage(), policyUrl);
        }
    }

    static String policyUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            return new URI(uri.getScheme(), null, uri.getHost(), uri.getPort(), "/robots.txt", null, null).toString();
        } catch (URISyntaxException ex) {
            return null;
        }
    }
}
