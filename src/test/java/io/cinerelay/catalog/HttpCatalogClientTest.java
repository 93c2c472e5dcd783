package io.cinerelay.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.cinerelay.error.CatalogException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpCatalogClientTest {

    private final Map<String, String> responses = new ConcurrentHashMap<>();
    private volatile String lastQuery;
    private HttpServer server;

    @BeforeEach
    void setup() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/movie", this::handle);
        server.start();
    }

    @AfterEach
    void cleanup() {
        server.stop(0);
    }

    @Test
    void searchShouldReturnAtMostTenEntries() throws Exception {
        StringBuilder data = new StringBuilder("[");
        for (int i = 0; i < 15; i++) {
            if (i > 0) {
                data.append(',');
            }
            data.append("{\"title\":\"Movie ").append(i).append("\",\"link\":\"https://cat/m").append(i)
                    .append("\",\"rating\":\"7.").append(i % 10).append("\",\"image\":\"https://img/").append(i).append("\"}");
        }
        data.append(']');
        responses.put("cinesubz-search", envelope(data.toString()));

        List<CatalogEntry> entries = client("secret").search("the matrix");

        assertEquals(CatalogClient.MAX_RESULTS, entries.size());
        assertEquals(new CatalogEntry("Movie 0", "https://cat/m0", "7.0", "https://img/0"), entries.get(0));
        assertTrue(lastQuery.contains("q=the+matrix"), lastQuery);
        assertTrue(lastQuery.contains("apikey=secret"), lastQuery);
    }

    @Test
    void shouldParseDetailsAndSources() throws Exception {
        responses.put("cinesubz-info", envelope("{\"title\":\"Inception\",\"year\":\"2010\",\"rating\":\"8.8\","
                + "\"duration\":\"148 min\",\"tag\":\"English\",\"directors\":\"Director: Christopher Nolan\","
                + "\"image\":\"https://img/i\",\"downloads\":[{\"quality\":\"720p\",\"size\":\"1.2 GB\",\"link\":\"https://cat/d/720\"}]}"));
        responses.put("cinesubz-download", envelope("{\"size\":\"1.2 GB\",\"download\":["
                + "{\"name\":\"gdrive\",\"url\":\"https://files/a.mp4\"},{\"name\":\"pix\",\"url\":\"\"}]}"));

        HttpCatalogClient client = client("secret");
        MovieDetails details = client.getDetails("https://cat/inception");
        DownloadSources sources = client.getSources(details.downloads().get(0).link());

        assertEquals("Inception", details.title());
        assertEquals("2010", details.year());
        assertEquals(new DownloadOption("720p", "1.2 GB", "https://cat/d/720"), details.downloads().get(0));
        assertEquals("1.2 GB", sources.size());
        assertEquals(1, sources.links().size());
        assertEquals(Optional.of(new SourceLink("gdrive", URI.create("https://files/a.mp4"))), sources.byName("GDRIVE"));
    }

    @Test
    void unsuccessfulEnvelopeShouldFail() {
        responses.put("cinesubz-info", "{\"status\":false,\"data\":null}");

        assertThrows(CatalogException.class, () -> client("secret").getDetails("https://cat/x"));
    }

    @Test
    void httpErrorShouldFail() {
        CatalogException e = assertThrows(CatalogException.class, () -> client("secret").getSources("https://cat/none"));
        assertTrue(e.getMessage().contains("HTTP 404"));
    }

    @Test
    void missingApiKeyShouldFailWithoutRequest() {
        HttpCatalogClient client = new HttpCatalogClient(baseUrl(), Optional.empty(), new ObjectMapper());

        assertThrows(CatalogException.class, () -> client.search("x"));
        assertNull(lastQuery);
    }

    private HttpCatalogClient client(String key) {
        return new HttpCatalogClient(baseUrl(), Optional.of(key), new ObjectMapper());
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/movie/";
    }

    private void handle(HttpExchange exchange) throws IOException {
        String endpoint = exchange.getRequestURI().getPath().substring("/movie/".length());
        lastQuery = exchange.getRequestURI().getRawQuery();
        String body = responses.get(endpoint);
        if (body == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String envelope(String data) {
        return "{\"status\":true,\"data\":" + data + "}";
    }
}
