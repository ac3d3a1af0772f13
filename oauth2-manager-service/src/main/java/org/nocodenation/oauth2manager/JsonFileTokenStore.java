package org.nocodenation.oauth2manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TokenStore} that persists the token set to a JSON file.
 * <p>
 * The file is a JSON object mapping each service name to
 * <pre>
 * {"access_token": "...", "refresh_token": "...", "expires_at": "2024-01-01T00:00:00Z",
 *  "token_type": "Bearer", "scope": "..."}
 * </pre>
 * where {@code refresh_token}, {@code expires_at} and {@code scope} may be null. Every change
 * rewrites the whole file through a temporary sibling that is then moved over the target, so
 * readers never see a partial write. Write failures are logged, counted and passed to the
 * {@link PersistenceFailureListener}; they are never thrown.
 * <p>
 * A store created without a path keeps tokens in memory only.
 */
public class JsonFileTokenStore implements TokenStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileTokenStore.class);

    private final Map<String, OAuth2Token> tokens = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong persistenceFailureCount = new AtomicLong();
    private final Object writeLock = new Object();
    private final Path path;
    private final ZoneId localZone;

    private volatile PersistenceFailureListener persistenceFailureListener = exception -> { };

    /**
     * Creates a store backed by a file.
     *
     * @param path the token file, or null to keep tokens in memory only
     */
    public JsonFileTokenStore(Path path) {
        this(path, ZoneId.systemDefault());
    }

    /**
     * Creates a store backed by a file.
     *
     * @param path the token file, or null to keep tokens in memory only
     * @param localZone the zone of expiry times written without an offset
     */
    public JsonFileTokenStore(Path path, ZoneId localZone) {
        this.path = path;
        this.localZone = localZone;
    }

    public Path getPath() {
        return path;
    }

    public void setPersistenceFailureListener(PersistenceFailureListener persistenceFailureListener) {
        this.persistenceFailureListener = persistenceFailureListener == null ? exception -> { } : persistenceFailureListener;
    }

    /**
     * Gets the number of failed reads and writes since this store was created.
     *
     * @return the failure count
     */
    public long getPersistenceFailureCount() {
        return persistenceFailureCount.get();
    }

    @Override
    public void load() {
        synchronized (writeLock) {
            tokens.clear();
            if (path == null || !Files.exists(path)) {
                LOGGER.debug("No persisted tokens at {}", path);
                return;
            }

            JsonNode root;
            try {
                root = objectMapper.readTree(path.toFile());
            } catch (IOException e) {
                reportFailure(new PersistenceException("Failed to read token file " + path, e));
                return;
            }

            if (root == null || !root.isObject()) {
                reportFailure(new PersistenceException("Token file " + path + " does not contain a JSON object", null));
                return;
            }

            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                OAuth2Token token = readToken(field.getKey(), field.getValue());
                if (token != null) {
                    tokens.put(field.getKey(), token);
                }
            }
            LOGGER.info("Loaded {} persisted tokens from {}", tokens.size(), path);
        }
    }

    @Override
    public Optional<OAuth2Token> get(String serviceName) {
        return serviceName == null ? Optional.empty() : Optional.ofNullable(tokens.get(serviceName));
    }

    @Override
    public void save(String serviceName, OAuth2Token token) {
        synchronized (writeLock) {
            tokens.put(serviceName, token);
            persist();
        }
    }

    @Override
    public boolean delete(String serviceName) {
        synchronized (writeLock) {
            boolean removed = tokens.remove(serviceName) != null;
            persist();
            return removed;
        }
    }

    @Override
    public Set<String> getServiceNames() {
        return new LinkedHashSet<>(new TreeMap<>(tokens).keySet());
    }

    private OAuth2Token readToken(String serviceName, JsonNode node) {
        if (node == null || !node.isObject()) {
            LOGGER.warn("Skipping persisted token for service {}: entry is not a JSON object", serviceName);
            return null;
        }
        String accessToken = textOrNull(node, "access_token");
        if (accessToken == null || accessToken.isEmpty()) {
            LOGGER.warn("Skipping persisted token for service {}: no access_token", serviceName);
            return null;
        }

        Instant expiresAt = null;
        String expiresAtText = textOrNull(node, "expires_at");
        if (expiresAtText != null && !expiresAtText.isEmpty()) {
            expiresAt = parseExpiresAt(expiresAtText);
            if (expiresAt == null) {
                LOGGER.warn("Skipping persisted token for service {}: unreadable expires_at", serviceName);
                return null;
            }
        }

        return new OAuth2Token(accessToken, textOrNull(node, "refresh_token"), expiresAt,
                textOrNull(node, "token_type"), textOrNull(node, "scope"));
    }

    /**
     * Parses an ISO-8601 expiry: an instant, a date-time with offset, or a local date-time in
     * {@link #localZone}.
     */
    Instant parseExpiresAt(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            LOGGER.trace("expires_at {} is not an instant", text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            LOGGER.trace("expires_at {} has no offset", text);
        }
        try {
            return LocalDateTime.parse(text).atZone(localZone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void persist() {
        if (path == null) {
            return;
        }

        ObjectNode root = objectMapper.createObjectNode();
        new TreeMap<>(tokens).forEach((serviceName, token) -> {
            ObjectNode node = root.putObject(serviceName);
            node.put("access_token", token.getAccessToken());
            node.put("refresh_token", token.getRefreshToken());
            node.put("expires_at", token.getExpiresAt() == null ? null : token.getExpiresAt().toString());
            node.put("token_type", token.getTokenType());
            node.put("scope", token.getScope());
        });

        Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(tempPath, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root));
            try {
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.debug("Persisted {} tokens to {}", tokens.size(), path);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            reportFailure(new PersistenceException("Failed to write token file " + path, e));
        }
    }

    private void reportFailure(PersistenceException exception) {
        persistenceFailureCount.incrementAndGet();
        LOGGER.warn("{}: {}", exception.getMessage(),
                exception.getCause() == null ? "invalid content" : exception.getCause().toString());
        try {
            persistenceFailureListener.onPersistenceFailure(exception);
        } catch (RuntimeException e) {
            LOGGER.error("Persistence failure listener failed", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
