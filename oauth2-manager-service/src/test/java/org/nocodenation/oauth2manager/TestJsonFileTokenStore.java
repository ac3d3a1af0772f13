package org.nocodenation.oauth2manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests persistence of the token set to a JSON file.
 */
public class TestJsonFileTokenStore {

    private static final Instant EXPIRES_AT = Instant.parse("2024-05-01T13:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    public void testRoundTrip() {
        Path file = tempDir.resolve("tokens.json");
        JsonFileTokenStore store = new JsonFileTokenStore(file);
        store.save("salesforce", new OAuth2Token("tok1", "ref1", EXPIRES_AT, "Bearer", "api"));
        store.save("slack", new OAuth2Token("tok2", null, null, "bot", null));

        JsonFileTokenStore reloaded = new JsonFileTokenStore(file);
        reloaded.load();

        OAuth2Token salesforce = reloaded.get("salesforce").orElseThrow();
        assertEquals("tok1", salesforce.getAccessToken());
        assertEquals("ref1", salesforce.getRefreshToken());
        assertEquals(EXPIRES_AT, salesforce.getExpiresAt());
        assertEquals("Bearer", salesforce.getTokenType());
        assertEquals("api", salesforce.getScope());

        OAuth2Token slack = reloaded.get("slack").orElseThrow();
        assertEquals("tok2", slack.getAccessToken());
        assertNull(slack.getRefreshToken());
        assertNull(slack.getExpiresAt());
        assertEquals("bot", slack.getTokenType());
        assertNull(slack.getScope());
    }

    @Test
    public void testFileFormat() throws Exception {
        Path file = tempDir.resolve("tokens.json");
        JsonFileTokenStore store = new JsonFileTokenStore(file);
        store.save("hubspot", new OAuth2Token("tok1", null, EXPIRES_AT, null, "contacts"));

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        JsonNode entry = root.get("hubspot");
        assertEquals("tok1", entry.get("access_token").asText());
        assertTrue(entry.get("refresh_token").isNull());
        assertEquals("2024-05-01T13:00:00Z", entry.get("expires_at").asText());
        assertEquals("Bearer", entry.get("token_type").asText());
        assertEquals("contacts", entry.get("scope").asText());
        assertFalse(Files.exists(tempDir.resolve("tokens.json.tmp")), "Temporary file should be moved away");
    }

    @Test
    public void testDeletePersists() {
        Path file = tempDir.resolve("tokens.json");
        JsonFileTokenStore store = new JsonFileTokenStore(file);
        store.save("slack", new OAuth2Token("tok1", null, null, null, null));

        assertTrue(store.delete("slack"));
        assertFalse(store.delete("slack"), "Deleting twice should report nothing removed");

        JsonFileTokenStore reloaded = new JsonFileTokenStore(file);
        reloaded.load();
        assertTrue(reloaded.getServiceNames().isEmpty());
    }

    @Test
    public void testMissingFileLoadsEmpty() {
        JsonFileTokenStore store = new JsonFileTokenStore(tempDir.resolve("absent.json"));
        store.load();

        assertTrue(store.getServiceNames().isEmpty());
        assertEquals(0, store.getPersistenceFailureCount());
    }

    @Test
    public void testCorruptFileLoadsEmpty() throws Exception {
        Path file = tempDir.resolve("tokens.json");
        Files.write(file, "{not json".getBytes(StandardCharsets.UTF_8));

        List<PersistenceException> failures = new ArrayList<>();
        JsonFileTokenStore store = new JsonFileTokenStore(file);
        store.setPersistenceFailureListener(failures::add);
        store.load();

        assertTrue(store.getServiceNames().isEmpty());
        assertEquals(1, store.getPersistenceFailureCount());
        assertEquals(1, failures.size());
    }

    @Test
    public void testEntriesWithoutAccessTokenAreSkipped() throws Exception {
        Path file = tempDir.resolve("tokens.json");
        Files.write(file, ("{\"slack\": {\"refresh_token\": \"ref\"},"
                + " \"hubspot\": {\"access_token\": \"tok\", \"expires_at\": null}}").getBytes(StandardCharsets.UTF_8));

        JsonFileTokenStore store = new JsonFileTokenStore(file);
        store.load();

        assertFalse(store.get("slack").isPresent());
        assertTrue(store.get("hubspot").isPresent());
        assertEquals("Bearer", store.get("hubspot").get().getTokenType());
    }

    /**
     * Expiry times written without an offset are read in the store's local zone.
     */
    @Test
    public void testLocalDateTimeExpiry() throws Exception {
        Path file = tempDir.resolve("tokens.json");
        Files.write(file, "{\"calendly\": {\"access_token\": \"tok\", \"expires_at\": \"2024-05-01T15:00:00.123456\"}}"
                .getBytes(StandardCharsets.UTF_8));

        JsonFileTokenStore store = new JsonFileTokenStore(file, ZoneOffset.ofHours(2));
        store.load();

        assertEquals(Instant.parse("2024-05-01T13:00:00.123456Z"), store.get("calendly").get().getExpiresAt());
    }

    @Test
    public void testParseExpiresAtFormats() {
        JsonFileTokenStore store = new JsonFileTokenStore(null, ZoneOffset.UTC);

        assertEquals(EXPIRES_AT, store.parseExpiresAt("2024-05-01T13:00:00Z"));
        assertEquals(EXPIRES_AT, store.parseExpiresAt("2024-05-01T15:00:00+02:00"));
        assertEquals(EXPIRES_AT, store.parseExpiresAt("2024-05-01T13:00:00"));
        assertNull(store.parseExpiresAt("tomorrow"));
    }

    @Test
    public void testWriteFailureIsReportedNotThrown() throws Exception {
        // The target's parent is a regular file, so the write cannot succeed
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, new byte[0]);
        List<PersistenceException> failures = new ArrayList<>();

        JsonFileTokenStore store = new JsonFileTokenStore(blocker.resolve("tokens.json"));
        store.setPersistenceFailureListener(failures::add);
        store.save("slack", new OAuth2Token("tok1", null, null, null, null));

        assertEquals(1, store.getPersistenceFailureCount());
        assertEquals(1, failures.size());
        // The in-memory token set is still updated
        assertEquals("tok1", store.get("slack").orElseThrow().getAccessToken());
    }

    @Test
    public void testInMemoryStore() {
        JsonFileTokenStore store = new JsonFileTokenStore(null);
        store.save("slack", new OAuth2Token("tok1", null, null, null, null));
        store.load();

        assertTrue(store.getServiceNames().isEmpty(), "Loading an in-memory store yields nothing");
        assertEquals(0, store.getPersistenceFailureCount());
    }
}
