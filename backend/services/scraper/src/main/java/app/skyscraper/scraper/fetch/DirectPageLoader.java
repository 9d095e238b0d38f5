package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.domain.type.RenderMode;
import app.skyscraper.scraper.pipeline.FetchFailedException;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

@Component
public class DirectPageLoader implements PageLoader {

    private static final int DEFAULT_MAX_BODY_BYTES = 5 * 1024 * 1024;

    private final String userAgent;
    private final int maxBodyBytes;

    public DirectPageLoader(FetchProps props) {
        this.userAgent = BrowserHeaders.userAgent(props.userAgent());
        this.maxBodyBytes = props.maxBodyBytes() == null ? DEFAULT_MAX_BODY_BYTES : props.maxBodyBytes();
    }

    @Override
    public RenderMode mode() {
        return RenderMode.direct;
    }

    @Override
    public RawPage load(String url, Duration timeout, boolean antiDetection) {
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .headers(BrowserHeaders.headers())
                    .timeout(Math.toIntExact(timeout.toMillis()))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize(maxBodyBytes)
                    .method(Connection.Method.GET)
                    .execute();
        } catch (SocketTimeoutException ex) {
            throw new FetchFailedException("Timed out after " + timeout.toMillis() + " ms fetching " + url, ex);
        } catch (IOException | IllegalArgumentException ex) {
            throw new FetchFailedException("Failed to fetch " + url + ": " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FetchFailedException("HTTP " + status + " fetching " + url, status, null);
        }
        String body;
        try {
            body = response.body();
        } catch (RuntimeException ex) {
            throw new FetchFailedException("Failed to read body of " + url + ": " + ex.getMessage(), status, ex);
        }
        return new RawPage(url, response.url().toString(), status, response.contentType(), body);
    }
}
