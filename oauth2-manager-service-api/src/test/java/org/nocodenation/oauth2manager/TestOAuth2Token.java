package org.nocodenation.oauth2manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for OAuth2Token
 */
public class TestOAuth2Token {

    private static final String TEST_ACCESS_TOKEN = "test-access-token";
    private static final String TEST_REFRESH_TOKEN = "test-refresh-token";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private OAuth2Token token;

    @BeforeEach
    public void setUp() {
        token = new OAuth2Token();
    }

    @Test
    public void testDefaultConstructor() {
        assertNull(token.getAccessToken());
        assertNull(token.getRefreshToken());
        assertNull(token.getExpiresAt());
        assertNull(token.getScope());
        assertEquals("Bearer", token.getTokenType());
    }

    @Test
    public void testTokenTypeResetsToBearer() {
        token.setTokenType("MAC");
        assertEquals("MAC", token.getTokenType());

        token.setTokenType(null);
        assertEquals("Bearer", token.getTokenType());

        token.setTokenType("  ");
        assertEquals("Bearer", token.getTokenType());
    }

    @Test
    public void testCopyConstructor() {
        OAuth2Token original = new OAuth2Token(TEST_ACCESS_TOKEN, TEST_REFRESH_TOKEN, NOW, "Bearer", "read");
        OAuth2Token copy = new OAuth2Token(original);

        assertEquals(TEST_ACCESS_TOKEN, copy.getAccessToken());
        assertEquals(TEST_REFRESH_TOKEN, copy.getRefreshToken());
        assertEquals(NOW, copy.getExpiresAt());
        assertEquals("read", copy.getScope());

        // Changing the copy must not touch the original
        copy.setAccessToken("other");
        assertEquals(TEST_ACCESS_TOKEN, original.getAccessToken());
    }

    @Test
    public void testTokenWithoutExpiryNeverExpires() {
        token.setAccessToken(TEST_ACCESS_TOKEN);
        assertFalse(token.isExpired(Instant.MAX.minusSeconds(1), Duration.ZERO));
    }

    @Test
    public void testIsExpired() {
        token.setExpiresAt(NOW.plusSeconds(60));

        assertFalse(token.isExpired(NOW, Duration.ZERO));
        assertFalse(token.isExpired(NOW.plusSeconds(59), Duration.ZERO));
        // A token is expired from its expiry instant on
        assertTrue(token.isExpired(NOW.plusSeconds(60), Duration.ZERO));
        assertTrue(token.isExpired(NOW.plusSeconds(61), Duration.ZERO));
    }

    @Test
    public void testIsExpiredWithLeeway() {
        token.setExpiresAt(NOW.plusSeconds(60));

        assertFalse(token.isExpired(NOW, Duration.ofSeconds(30)));
        assertTrue(token.isExpired(NOW.plusSeconds(30), Duration.ofSeconds(30)));
    }

    @Test
    public void testHasRefreshToken() {
        assertFalse(token.hasRefreshToken());
        token.setRefreshToken("");
        assertFalse(token.hasRefreshToken());
        token.setRefreshToken(TEST_REFRESH_TOKEN);
        assertTrue(token.hasRefreshToken());
    }

    @Test
    public void testAuthorizationHeaderValue() {
        token.setAccessToken(TEST_ACCESS_TOKEN);
        assertEquals("Bearer test-access-token", token.getAuthorizationHeaderValue());
    }

    @Test
    public void testToStringDoesNotExposeSecrets() {
        OAuth2Token full = new OAuth2Token(TEST_ACCESS_TOKEN, TEST_REFRESH_TOKEN, NOW, null, "read");
        String text = full.toString();

        assertFalse(text.contains(TEST_ACCESS_TOKEN));
        assertFalse(text.contains(TEST_REFRESH_TOKEN));
        assertTrue(text.contains("hasRefreshToken=true"));
    }
}
