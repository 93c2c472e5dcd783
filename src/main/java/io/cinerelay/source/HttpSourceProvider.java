package io.cinerelay.source;

import io.cinerelay.error.TransferCancelledException;
import io.cinerelay.error.TransferException;
import io.cinerelay.error.TransferNetworkException;
import io.cinerelay.error.TransferTimeoutException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Source provider for http:// and https:// payload URLs.
 */
@ApplicationScoped
public class HttpSourceProvider implements SourceProvider {

    private static final Logger LOG = Logger.getLogger(HttpSourceProvider.class);

    private final HttpClient httpClient;

    public HttpSourceProvider() {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean supports(URI url) {
        String scheme = url.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    @Override
    public SourceConnection open(URI url, Duration timeout) throws TransferException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(url)
                .header("User-Agent", "Mozilla/5.0 (compatible; cine-relay)")
                .GET()
                .timeout(timeout)
                .build();

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new TransferTimeoutException("Download timed out connecting to " + url.getHost(), e);
        } catch (IOException e) {
            throw new TransferNetworkException("Download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException();
        }

        if (response.statusCode() / 100 != 2) {
            new SourceConnection(response.body(), 0).close();
            throw new TransferNetworkException("Download failed: HTTP " + response.statusCode() + " from " + url.getHost());
        }

        long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
        LOG.debugf("Opened %s (content length %d)", url, contentLength);
        return new SourceConnection(response.body(), contentLength);
    }
}
