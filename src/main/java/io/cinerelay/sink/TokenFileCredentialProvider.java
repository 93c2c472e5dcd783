package io.cinerelay.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.error.AuthExpiredException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Reads the OAuth token stored by the external auth flow ({@code youtube_token.json} in the data dir).
 */
@ApplicationScoped
public class TokenFileCredentialProvider implements CredentialProvider {

    private static final Logger LOG = Logger.getLogger(TokenFileCredentialProvider.class);

    static final String TOKEN_FILE = "youtube_token.json";

    private final Path tokenPath;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Inject
    public TokenFileCredentialProvider(
            @ConfigProperty(name = "relay.data.dir", defaultValue = "data") String dataDir,
            ObjectMapper mapper
    ) {
        this(Paths.get(dataDir).resolve(TOKEN_FILE), mapper, Clock.systemUTC());
    }

    public TokenFileCredentialProvider(Path tokenPath, ObjectMapper mapper, Clock clock) {
        this.tokenPath = tokenPath;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public String accessToken() throws AuthExpiredException {
        JsonNode token;
        try {
            token = mapper.readTree(tokenPath.toFile());
        } catch (IOException e) {
            LOG.warnf("Cannot read upload token %s: %s", tokenPath, e.getMessage());
            throw new AuthExpiredException("no usable token at " + tokenPath);
        }

        String accessToken = token.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new AuthExpiredException("token file has no access_token");
        }

        long expiry = token.path("expiry_date").asLong(0);
        if (expiry > 0 && expiry <= clock.millis()) {
            throw new AuthExpiredException("Token has been expired");
        }
        return accessToken;
    }
}
