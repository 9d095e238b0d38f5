package app.skyscraper.scraper.fetch;

import app.skyscraper.scraper.config.FetchProps;
import app.skyscraper.scraper.pipeline.FetchFailedException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectPageLoaderTest {

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> seenUserAgent = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page", exchange -> {
            seenUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            respond(exchange, 200, "<html><head><title>Hello</title></head><body>Hi</body></html>");
        });
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", baseUrl + "/page");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/missing", exchange -> respond(exchange, 404, "nope"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private final DirectPageLoader loader = new DirectPageLoader(new FetchProps(null, null, null, null, null));

    @Test
    void loadsPageWithBrowserLikeUserAgent() {
        RawPage page = loader.load(baseUrl + "/page", Duration.ofSeconds(5), false);

        assertThat(page.httpStatus()).isEqualTo(200);
        assertThat(page.body()).contains("<title>Hello</title>");
        assertThat(page.contentType()).startsWith("text/html");
        assertThat(seenUserAgent.get()).contains("Mozilla/5.0");
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() {
        RawPage page = loader.load(baseUrl + "/moved", Duration.ofSeconds(5), false);

        assertThat(page.requestedUrl()).isEqualTo(baseUrl + "/moved");
        assertThat(page.finalUrl()).isEqualTo(baseUrl + "/page");
    }

    @Test
    void nonSuccessStatusFailsWithStatus() {
        assertThatThrownBy(() -> loader.load(baseUrl + "/missing", Duration.ofSeconds(5), false))
                .isInstanceOfSatisfying(FetchFailedException.class,
                        ex -> assertThat(ex.getHttpStatus()).isEqualTo(404));
    }

    @Test
    void unreachableHostFailsWithoutStatus() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        assertThatThrownBy(() -> loader.load("http://127.0.0.1:" + closedPort + "/page", Duration.ofSeconds(2), false))
                .isInstanceOfSatisfying(FetchFailedException.class,
                        ex -> assertThat(ex.getHttpStatus()).isNull());
    }
}
