package io.cinerelay.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cinerelay.TestFiles;
import io.cinerelay.error.AuthExpiredException;
import io.cinerelay.error.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenFileCredentialProviderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private Path dir;
    private Path tokenFile;
    private TokenFileCredentialProvider provider;

    @BeforeEach
    void setup() throws IOException {
        dir = Files.createTempDirectory("test-token-");
        tokenFile = dir.resolve(TokenFileCredentialProvider.TOKEN_FILE);
        provider = new TokenFileCredentialProvider(tokenFile, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(dir);
    }

    @Test
    void shouldReturnValidToken() throws Exception {
        Files.writeString(tokenFile, "{\"access_token\":\"ya29.abc\",\"expiry_date\":"
                + NOW.plusSeconds(3600).toEpochMilli() + "}");

        assertEquals("ya29.abc", provider.accessToken());
    }

    @Test
    void shouldRejectExpiredToken() throws Exception {
        Files.writeString(tokenFile, "{\"access_token\":\"ya29.abc\",\"expiry_date\":"
                + NOW.minusSeconds(1).toEpochMilli() + "}");

        AuthExpiredException e = assertThrows(AuthExpiredException.class, provider::accessToken);
        assertEquals(ErrorKind.AUTH_EXPIRED, e.kind());
        assertTrue(e.getMessage().contains("re-authenticate"));
    }

    @Test
    void shouldRejectMissingOrEmptyToken() throws Exception {
        assertThrows(AuthExpiredException.class, provider::accessToken);

        Files.writeString(tokenFile, "{\"refresh_token\":\"r\"}");
        assertThrows(AuthExpiredException.class, provider::accessToken);
    }
}
