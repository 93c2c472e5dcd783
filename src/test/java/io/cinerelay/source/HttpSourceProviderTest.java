package io.cinerelay.source;

import com.sun.net.httpserver.HttpServer;
import io.cinerelay.error.TransferNetworkException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpSourceProviderTest {

    private static final byte[] PAYLOAD = "movie bytes".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private final HttpSourceProvider provider = new HttpSourceProvider();

    @BeforeEach
    void setup() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/movie.mp4", exchange -> {
            exchange.sendResponseHeaders(200, PAYLOAD.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(PAYLOAD);
            }
        });
        server.createContext("/missing", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void cleanup() {
        server.stop(0);
    }

    @Test
    void shouldSupportHttpSchemesOnly() {
        assertTrue(provider.supports(URI.create("http://example.com/a")));
        assertTrue(provider.supports(URI.create("HTTPS://example.com/a")));
        assertFalse(provider.supports(URI.create("file:///tmp/a")));
    }

    @Test
    void shouldExposeBodyAndDeclaredLength() throws Exception {
        try (SourceConnection connection = provider.open(url("/movie.mp4"), Duration.ofSeconds(10))) {
            assertEquals(PAYLOAD.length, connection.contentLength());
            assertArrayEquals(PAYLOAD, connection.body().readAllBytes());
        }
    }

    @Test
    void shouldFailOnErrorStatus() {
        TransferNetworkException e = assertThrows(TransferNetworkException.class,
                () -> provider.open(url("/missing"), Duration.ofSeconds(10)));
        assertTrue(e.getMessage().contains("HTTP 404"));
    }

    private URI url(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }
}
