package io.cinerelay.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cinerelay.domain.DestinationMetadata;
import io.cinerelay.error.AuthExpiredException;
import io.cinerelay.error.TransferException;
import io.cinerelay.error.TransferSinkException;
import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Uploads to the YouTube Data API using the resumable upload protocol:
 * one session request carrying the metadata, then the payload as {@code Content-Range} chunks.
 * A {@code 308} answer means "continue from the acknowledged range", {@code 200/201} carries the video resource.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class YouTubeSink implements Sink {

    private static final Logger LOG = Logger.getLogger(YouTubeSink.class);

    private static final Pattern RANGE = Pattern.compile("bytes=(\\d+)-(\\d+)");
    private static final int RESUME_INCOMPLETE = 308;

    private final URI uploadUrl;
    private final CredentialProvider credentials;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    @Inject
    public YouTubeSink(
            @ConfigProperty(name = "sink.youtube.upload-url",
                    defaultValue = "https://www.googleapis.com/upload/youtube/v3/videos") String uploadUrl,
            CredentialProvider credentials,
            ObjectMapper mapper
    ) {
        this.uploadUrl = URI.create(uploadUrl);
        this.credentials = credentials;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Override
    public String upload(UploadSource source, DestinationMetadata metadata) throws TransferException {
        if (source.size() <= 0) {
            throw new TransferSinkException("Nothing to upload: staged file is empty");
        }

        String token = credentials.accessToken();
        URI session = startSession(token, source.size(), metadata);
        LOG.debugf("Opened upload session for %s (%d bytes)", metadata.title(), source.size());

        long offset = 0;
        while (offset < source.size()) {
            int length = (int) Math.min(source.chunkSize(), source.size() - offset);
            HttpResponse<String> response = putChunk(session, token, source, offset, length);

            int status = response.statusCode();
            if (status == 200 || status == 201) {
                return videoId(response.body());
            }
            if (status != RESUME_INCOMPLETE) {
                throw failure(status, response.body());
            }
            offset = nextOffset(response);
        }
        throw new TransferSinkException("Upload session ended without a video resource");
    }

    private URI startSession(String token, long size, DestinationMetadata metadata) throws TransferException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(uploadUrl + "?uploadType=resumable&part=snippet,status"))
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json; charset=UTF-8")
                .header("X-Upload-Content-Length", String.valueOf(size))
                .header("X-Upload-Content-Type", "video/*")
                .POST(HttpRequest.BodyPublishers.ofString(videoResource(metadata)))
                .build();

        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            throw failure(response.statusCode(), response.body());
        }
        return response.headers().firstValue("Location")
                .map(URI::create)
                .orElseThrow(() -> new TransferSinkException("Upload session response has no Location header"));
    }

    private HttpResponse<String> putChunk(URI session, String token, UploadSource source, long offset, int length)
            throws TransferException {
        long last = offset + length - 1;
        HttpRequest request = HttpRequest.newBuilder()
                .uri(session)
                .header("Authorization", "Bearer " + token)
                .header("Content-Range", "bytes " + offset + "-" + last + "/" + source.size())
                .PUT(HttpRequest.BodyPublishers.fromPublisher(
                        HttpRequest.BodyPublishers.ofInputStream(() -> openChunk(source, offset, length)),
                        length))
                .build();
        return send(request);
    }

    private static InputStream openChunk(UploadSource source, long offset, int length) {
        try {
            return source.openChunk(offset, length);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private HttpResponse<String> send(HttpRequest request) throws TransferSinkException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransferSinkException("YouTube upload failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferSinkException("YouTube upload interrupted", e);
        }
    }

    private String videoResource(DestinationMetadata metadata) throws TransferSinkException {
        ObjectNode resource = mapper.createObjectNode();
        ObjectNode snippet = resource.putObject("snippet");
        snippet.put("title", metadata.title());
        snippet.put("description", metadata.description());
        metadata.tags().forEach(snippet.putArray("tags")::add);
        snippet.put("categoryId", metadata.categoryId());
        ObjectNode status = resource.putObject("status");
        status.put("privacyStatus", metadata.privacyStatus());
        status.put("selfDeclaredMadeForKids", false);
        try {
            return mapper.writeValueAsString(resource);
        } catch (IOException e) {
            throw new TransferSinkException("Cannot encode video metadata", e);
        }
    }

    private String videoId(String body) throws TransferSinkException {
        try {
            String id = mapper.readTree(body).path("id").asText("");
            if (id.isBlank()) {
                throw new TransferSinkException("Upload finished but response has no video id");
            }
            LOG.infof("YouTube upload successful, video id %s", id);
            return id;
        } catch (IOException e) {
            throw new TransferSinkException("Unreadable upload response: " + e.getMessage(), e);
        }
    }

    private static long nextOffset(HttpResponse<String> response) {
        return response.headers().firstValue("Range")
                .map(RANGE::matcher)
                .filter(Matcher::matches)
                .map(m -> Long.parseLong(m.group(2)) + 1)
                .orElse(0L);
    }

    private TransferException failure(int status, String body) {
        String message = errorMessage(body);
        if (status == 401 || message.contains("invalid_grant") || message.contains("Token has been expired")) {
            LOG.warnf("YouTube rejected the upload credential: %s", message);
            return new AuthExpiredException(message);
        }
        return new TransferSinkException("YouTube upload failed: HTTP " + status + " " + message);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode error = mapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            String message = error.path("message").asText("");
            if (!message.isBlank()) {
                return message;
            }
        } catch (IOException e) {
            LOG.debugf("Error body is not JSON: %s", e.getMessage());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
