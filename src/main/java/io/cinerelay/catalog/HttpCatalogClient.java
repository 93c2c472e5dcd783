package io.cinerelay.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.error.CatalogException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Catalog client for the cinesubz endpoints. Every response is wrapped as {@code {"status": bool, "data": ...}}.
 */
@ApplicationScoped
public class HttpCatalogClient implements CatalogClient {

    private static final Logger LOG = Logger.getLogger(HttpCatalogClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Optional<String> apiKey;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    @Inject
    public HttpCatalogClient(
            @ConfigProperty(name = "catalog.base-url", defaultValue = "https://api-dark-shan-yt.koyeb.app/movie") String baseUrl,
            @ConfigProperty(name = "catalog.api-key") Optional<String> apiKey,
            ObjectMapper mapper
    ) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey.filter(k -> !k.isBlank());
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<CatalogEntry> search(String query) throws CatalogException {
        if (query == null || query.isBlank()) {
            throw new CatalogException("Search query cannot be empty");
        }
        JsonNode data = fetch("cinesubz-search", "q", query);
        if (!data.isArray()) {
            return List.of();
        }
        List<CatalogEntry> entries = new ArrayList<>();
        for (JsonNode node : data) {
            if (entries.size() == MAX_RESULTS) {
                break;
            }
            String link = text(node, "link");
            if (link.isEmpty()) {
                continue;
            }
            entries.add(new CatalogEntry(text(node, "title"), link, text(node, "rating"), text(node, "image")));
        }
        LOG.debugf("Search '%s' returned %d entries", query, entries.size());
        return entries;
    }

    @Override
    public MovieDetails getDetails(String link) throws CatalogException {
        JsonNode data = fetch("cinesubz-info", "url", link);

        List<DownloadOption> downloads = new ArrayList<>();
        for (JsonNode node : data.path("downloads")) {
            downloads.add(new DownloadOption(text(node, "quality"), text(node, "size"), text(node, "link")));
        }
        String title = text(data, "title");
        if (title.isEmpty()) {
            throw new CatalogException("Movie details without a title for " + link);
        }
        return new MovieDetails(
                title,
                text(data, "year"),
                text(data, "rating"),
                text(data, "duration"),
                text(data, "tag"),
                text(data, "directors"),
                text(data, "image"),
                downloads
        );
    }

    @Override
    public DownloadSources getSources(String downloadLink) throws CatalogException {
        JsonNode data = fetch("cinesubz-download", "url", downloadLink);

        List<SourceLink> links = new ArrayList<>();
        for (JsonNode node : data.path("download")) {
            String url = text(node, "url");
            if (url.isEmpty()) {
                continue;
            }
            try {
                links.add(new SourceLink(text(node, "name"), URI.create(url)));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Skipping malformed source URL %s", url);
            }
        }
        return new DownloadSources(text(data, "size"), links);
    }

    private JsonNode fetch(String endpoint, String param, String value) throws CatalogException {
        String key = apiKey.orElseThrow(() -> new CatalogException("catalog.api-key is not configured"));
        URI uri = URI.create(baseUrl + "/" + endpoint
                + "?" + param + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)
                + "&apikey=" + URLEncoder.encode(key, StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CatalogException("Catalog request " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException("Catalog request " + endpoint + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new CatalogException("Catalog request " + endpoint + " returned HTTP " + response.statusCode());
        }

        JsonNode root;
        try {
            root = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new CatalogException("Catalog response from " + endpoint + " is not valid JSON", e);
        }
        if (root == null || !root.path("status").asBoolean(false) || !root.hasNonNull("data")) {
            throw new CatalogException("Catalog request " + endpoint + " was unsuccessful");
        }
        return root.get("data");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
