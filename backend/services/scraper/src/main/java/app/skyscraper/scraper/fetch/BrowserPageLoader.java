package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.domain.type.RenderMode;
import app.skyscraper.scraper.pipeline.FetchFailedException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Renders pages in headless Chromium. A Playwright instance is not thread safe, so every
 * load owns its own driver, browser and context.
 */
@Component
public class BrowserPageLoader implements PageLoader {

    private static final Logger log = LoggerFactory.getLogger(BrowserPageLoader.class);

    private static final List<String> STEALTH_ARGS = List.of(
            "--disable-blink-features=AutomationControlled",
            "--no-first-run",
            "--no-default-browser-check"
    );

    private static final String STEALTH_SCRIPT = """
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
            Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
            window.chrome = window.chrome || { runtime: {} };
            """;

    private final String userAgent;
    private final boolean headless;

    public BrowserPageLoader(FetchProps props) {
        this.userAgent = BrowserHeaders.userAgent(props.userAgent());
        this.headless = props.browserHeadless() == null || props.browserHeadless();
    }

    @Override
    public RenderMode mode() {
        return RenderMode.browser;
    }

    @Override
    public RawPage load(String url, Duration timeout, boolean antiDetection) {
        double timeoutMs = timeout.toMillis();
        BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions().setHeadless(headless);
        if (antiDetection) {
            launchOptions.setArgs(STEALTH_ARGS);
        }
        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(launchOptions);
             BrowserContext context = browser.newContext(contextOptions(antiDetection))) {
            if (antiDetection) {
                context.addInitScript(STEALTH_SCRIPT);
            }
            Page page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(timeoutMs));
            waitForNetworkIdleBestEffort(page, url, timeoutMs);

            int status = response == null ? 200 : response.status();
            if (status < 200 || status >= 300) {
                throw new FetchFailedException("HTTP " + status + " rendering " + url, status, null);
            }
            String contentType = response == null ? null : response.headers().get("content-type");
            return new RawPage(url, page.url(), status, contentType, page.content());
        } catch (TimeoutError ex) {
            throw new FetchFailedException("Timed out after " + timeout.toMillis() + " ms rendering " + url, ex);
        } catch (PlaywrightException ex) {
            throw new FetchFailedException("Browser rendering failed for " + url + ": " + firstLine(ex.getMessage()), ex);
        }
    }

    private Browser.NewContextOptions contextOptions(boolean antiDetection) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        if (antiDetection) {
            options.setUserAgent(userAgent)
                    .setExtraHTTPHeaders(BrowserHeaders.headers())
                    .setLocale("en-US")
                    .setViewportSize(1366, 768);
        }
        return options;
    }

    private void waitForNetworkIdleBestEffort(Page page, String url, double timeoutMs) {
        try {
            // long-polling pages never go idle
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(timeoutMs));
        } catch (TimeoutError ex) {
            log.debug("Network idle wait timed out url={}", url);
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int idx = message.indexOf('\n');
        return idx < 0 ? message : message.substring(0, idx);
    }
}
