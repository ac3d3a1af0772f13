package org.nocodenation.oauth2manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages OAuth 2.0 authorization code flows with PKCE and the resulting tokens for any
 * number of independently configured services.
 * <p>
 * For each service the manager:
 * <ol>
 *   <li>Builds authorization URLs, remembering the PKCE code verifier under the generated state</li>
 *   <li>Exchanges the authorization code from the callback for a token, after checking the state</li>
 *   <li>Stores the token and persists it through the {@link TokenStore}</li>
 *   <li>Refreshes the token when it is requested after it expired</li>
 *   <li>Revokes the token locally on request</li>
 * </ol>
 * <p>
 * Token access is serialized per service. When several threads find the same expired token,
 * only the first refreshes it; the others wait for that attempt and share its outcome, whether
 * it succeeded or failed. Callers always
 * receive copies of the stored token.
 */
public class OAuth2Manager implements OAuth2TokenProvider, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(OAuth2Manager.class);

    private final ConcurrentHashMap<String, ReentrantLock> tokenLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Optional<OAuth2Token>>> refreshAttempts = new ConcurrentHashMap<>();

    private final ServiceConfigRegistry serviceConfigRegistry;
    private final TokenStore tokenStore;
    private final PkceChallengeCache pkceChallengeCache;
    private final TokenEndpointClient tokenEndpointClient;
    private final Clock clock;
    private final Duration expiryLeeway;

    /**
     * Creates a manager from its collaborators. The token store is expected to be loaded.
     *
     * @param serviceConfigRegistry the registered service configurations
     * @param tokenStore the token store
     * @param pkceChallengeCache the cache of pending authorizations
     * @param tokenEndpointClient the token endpoint client
     * @param clock the clock used for token expiry
     * @param expiryLeeway how long before their expiry tokens are treated as expired
     */
    public OAuth2Manager(ServiceConfigRegistry serviceConfigRegistry, TokenStore tokenStore,
                         PkceChallengeCache pkceChallengeCache, TokenEndpointClient tokenEndpointClient,
                         Clock clock, Duration expiryLeeway) {
        this.serviceConfigRegistry = serviceConfigRegistry;
        this.tokenStore = tokenStore;
        this.pkceChallengeCache = pkceChallengeCache;
        this.tokenEndpointClient = tokenEndpointClient;
        this.clock = clock;
        this.expiryLeeway = expiryLeeway;
    }

    /**
     * Creates a manager with a JSON token file, loads the persisted tokens and starts the
     * sweep of expired pending authorizations.
     *
     * @param settings the manager settings
     * @param serviceConfigRegistry the registered service configurations
     * @return the started manager
     */
    public static OAuth2Manager create(OAuth2ManagerSettings settings, ServiceConfigRegistry serviceConfigRegistry) {
        Clock clock = Clock.systemUTC();

        JsonFileTokenStore tokenStore = new JsonFileTokenStore(settings.getTokenStorePath());
        tokenStore.load();

        PkceChallengeCache pkceChallengeCache = new PkceChallengeCache(settings.getPkceTimeToLive(),
                settings.getPkceSweepInterval(), clock);
        pkceChallengeCache.start();

        TokenEndpointClient tokenEndpointClient = new TokenEndpointClient(settings.getConnectTimeout(),
                settings.getResponseTimeout());

        LOGGER.info("OAuth2 manager created with {}", settings);
        return new OAuth2Manager(serviceConfigRegistry, tokenStore, pkceChallengeCache, tokenEndpointClient,
                clock, settings.getExpiryLeeway());
    }

    public ServiceConfigRegistry getServiceConfigRegistry() {
        return serviceConfigRegistry;
    }

    /**
     * Starts an authorization with a freshly generated state.
     *
     * @param serviceName the service to authorize
     * @return the authorization URL and its state
     * @throws ConfigurationException if the service is not registered
     */
    public AuthorizationRequest generateAuthorizationUrl(String serviceName) throws ConfigurationException {
        return generateAuthorizationUrl(serviceName, null);
    }

    /**
     * Starts an authorization.
     * <p>
     * A new PKCE code verifier is generated and kept under the state until the callback
     * for that state is exchanged or the pending authorization expires.
     *
     * @param serviceName the service to authorize
     * @param state the state to send, or null to generate one
     * @return the authorization URL and its state
     * @throws ConfigurationException if the service is not registered
     */
    public AuthorizationRequest generateAuthorizationUrl(String serviceName, String state) throws ConfigurationException {
        ServiceConfig config = serviceConfigRegistry.get(serviceName);

        if (state == null || state.isEmpty()) {
            state = PkceUtils.generateState();
        }
        PkceUtils.PkceValues pkceValues = PkceUtils.generatePkceValues();
        pkceChallengeCache.put(serviceName, state, pkceValues.getCodeVerifier());

        String url = OAuth2AuthorizationUrlBuilder.buildAuthorizationUrl(config, state, pkceValues.getCodeChallenge());
        LOGGER.debug("Authorization started for service {}", serviceName);
        return new AuthorizationRequest(serviceName, url, state);
    }

    /**
     * Exchanges a validated authorization callback for a token.
     *
     * @param callback the callback
     * @return a copy of the stored token
     * @throws ConfigurationException if the service is not registered
     * @throws StateMismatchException if the state is unknown, already used or expired
     * @throws TokenExchangeException if the token endpoint request fails
     * @see #exchangeCodeForToken(String, String, String)
     */
    public OAuth2Token completeAuthorization(AuthorizationCallback callback)
            throws ConfigurationException, StateMismatchException, TokenExchangeException {
        return exchangeCodeForToken(callback.getServiceName(), callback.getCode(), callback.getState());
    }

    /**
     * Exchanges an authorization code for a token.
     * <p>
     * The pending authorization for the state is consumed before the token request is sent,
     * so a state can be exchanged at most once. A failed exchange leaves the service's token
     * unchanged.
     *
     * @param serviceName the service named by the callback
     * @param code the authorization code
     * @param state the state returned by the authorization server
     * @return a copy of the stored token
     * @throws ConfigurationException if the service is not registered
     * @throws StateMismatchException if the state is unknown, already used or expired
     * @throws TokenExchangeException if the token endpoint request fails
     */
    public OAuth2Token exchangeCodeForToken(String serviceName, String code, String state)
            throws ConfigurationException, StateMismatchException, TokenExchangeException {
        ServiceConfig config = serviceConfigRegistry.get(serviceName);
        String codeVerifier = pkceChallengeCache.takeAndRemove(serviceName, state);

        TokenResponse response;
        try {
            response = tokenEndpointClient.exchangeAuthorizationCode(config, code, codeVerifier);
        } catch (TokenRequestException e) {
            LOGGER.error("Error exchanging authorization code for service {}: {}", serviceName, e.getMessage());
            throw new TokenExchangeException(e.getReason(),
                    "Error exchanging authorization code for " + serviceName + ": " + e.getMessage(), e);
        }

        OAuth2Token token = new OAuth2Token(response.getAccessToken(), response.getRefreshToken(),
                expiresAt(response), response.getTokenType(), response.getScope());

        ReentrantLock tokenLock = getTokenLock(serviceName);
        tokenLock.lock();
        try {
            tokenStore.save(serviceName, token);
        } finally {
            tokenLock.unlock();
        }

        LOGGER.info("Access token acquired for service {}", serviceName);
        return new OAuth2Token(token);
    }

    /**
     * Refreshes the token of a service with its refresh token.
     * <p>
     * On success the access token and expiry are replaced; the refresh token is replaced
     * only if the server issued a new one. On failure the stored token is left in place.
     *
     * @param serviceName the service name
     * @return a copy of the refreshed token
     * @throws ConfigurationException if the service is not registered
     * @throws RefreshException if there is no token or refresh token, or the request fails
     */
    public OAuth2Token refreshToken(String serviceName) throws ConfigurationException, RefreshException {
        ReentrantLock tokenLock = getTokenLock(serviceName);
        tokenLock.lock();
        try {
            return new OAuth2Token(refreshLocked(serviceName));
        } finally {
            tokenLock.unlock();
        }
    }

    private OAuth2Token refreshLocked(String serviceName) throws ConfigurationException, RefreshException {
        ServiceConfig config = serviceConfigRegistry.get(serviceName);

        OAuth2Token currentToken = tokenStore.get(serviceName)
                .orElseThrow(() -> new RefreshException(FailureReason.NO_TOKEN, "No token available for " + serviceName));
        if (!currentToken.hasRefreshToken()) {
            throw new RefreshException(FailureReason.NO_REFRESH_TOKEN, "No refresh token available for " + serviceName);
        }

        LOGGER.debug("Refreshing access token for service {}", serviceName);
        TokenResponse response;
        try {
            response = tokenEndpointClient.refresh(config, currentToken.getRefreshToken());
        } catch (TokenRequestException e) {
            throw new RefreshException(e.getReason(),
                    "Error refreshing token for " + serviceName + ": " + e.getMessage(), e);
        }

        OAuth2Token refreshed = new OAuth2Token(currentToken);
        refreshed.setAccessToken(response.getAccessToken());
        refreshed.setExpiresAt(expiresAt(response));
        if (response.getRefreshToken() != null) {
            refreshed.setRefreshToken(response.getRefreshToken());
        }
        tokenStore.save(serviceName, refreshed);

        LOGGER.info("Access token refreshed for service {}", serviceName);
        return refreshed;
    }

    /**
     * Gets a valid token for a service, refreshing an expired one first.
     * <p>
     * A failed refresh is logged and reported as no token; the expired token stays stored.
     * Callers arriving while a refresh of the service is in flight take that refresh's result.
     *
     * @param serviceName the service name
     * @return a copy of the valid token, or empty if the service has none
     */
    @Override
    public Optional<OAuth2Token> getValidToken(String serviceName) {
        Optional<OAuth2Token> token = tokenStore.get(serviceName);
        if (token.isEmpty()) {
            LOGGER.debug("No access token available for service {}. Authorization required", serviceName);
            return Optional.empty();
        }
        if (!isExpired(token.get())) {
            return Optional.of(new OAuth2Token(token.get()));
        }

        CompletableFuture<Optional<OAuth2Token>> attempt = new CompletableFuture<>();
        CompletableFuture<Optional<OAuth2Token>> inFlight = refreshAttempts.putIfAbsent(serviceName, attempt);
        if (inFlight != null) {
            return awaitRefresh(serviceName, inFlight);
        }

        Optional<OAuth2Token> result = Optional.empty();
        ReentrantLock tokenLock = getTokenLock(serviceName);
        tokenLock.lock();
        try {
            // another caller may have refreshed or revoked while we waited
            token = tokenStore.get(serviceName);
            if (token.isEmpty()) {
                return result;
            }
            if (!isExpired(token.get())) {
                result = token;
                return Optional.of(new OAuth2Token(token.get()));
            }

            LOGGER.debug("Token refresh needed for service {}", serviceName);
            result = Optional.of(refreshLocked(serviceName));
            return Optional.of(new OAuth2Token(result.get()));
        } catch (ConfigurationException | RefreshException e) {
            LOGGER.warn("Failed to refresh token for service {}: {}", serviceName, e.getMessage());
            return Optional.empty();
        } finally {
            refreshAttempts.remove(serviceName, attempt);
            attempt.complete(result);
            tokenLock.unlock();
        }
    }

    /**
     * Waits for the refresh attempt another caller started and takes its outcome.
     */
    private Optional<OAuth2Token> awaitRefresh(String serviceName, CompletableFuture<Optional<OAuth2Token>> attempt) {
        try {
            return attempt.get().map(OAuth2Token::new);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for token refresh of service {}", serviceName);
            return Optional.empty();
        } catch (ExecutionException e) {
            LOGGER.warn("Token refresh of service {} failed: {}", serviceName, e.getCause().toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean isAuthenticated(String serviceName) {
        return getValidToken(serviceName).isPresent();
    }

    /**
     * Reports where a service stands in the authorization lifecycle without refreshing.
     *
     * @param serviceName the service name
     * @return the authentication state
     */
    public AuthenticationState getAuthenticationState(String serviceName) {
        Optional<OAuth2Token> token = tokenStore.get(serviceName);
        if (token.isPresent()) {
            return isExpired(token.get()) ? AuthenticationState.AUTHENTICATED_EXPIRED : AuthenticationState.AUTHENTICATED_VALID;
        }
        return pkceChallengeCache.hasPending(serviceName)
                ? AuthenticationState.AUTHORIZATION_PENDING
                : AuthenticationState.UNAUTHENTICATED;
    }

    /**
     * Removes the token of a service. Nothing is sent to the authorization server. Revoking
     * a service without a token does nothing.
     *
     * @param serviceName the service name
     * @return true if a token was removed
     */
    public boolean revoke(String serviceName) {
        ReentrantLock tokenLock = getTokenLock(serviceName);
        tokenLock.lock();
        try {
            boolean removed = tokenStore.delete(serviceName);
            if (removed) {
                LOGGER.info("Token revoked for service {}", serviceName);
            } else {
                LOGGER.debug("No token to revoke for service {}", serviceName);
            }
            return removed;
        } finally {
            tokenLock.unlock();
        }
    }

    /**
     * Stops the sweep of pending authorizations and closes the HTTP client.
     */
    @Override
    public void close() {
        pkceChallengeCache.close();
        try {
            tokenEndpointClient.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing token endpoint client", e);
        }
        LOGGER.debug("OAuth2 manager closed");
    }

    private boolean isExpired(OAuth2Token token) {
        return token.isExpired(clock.instant(), expiryLeeway);
    }

    private Instant expiresAt(TokenResponse response) {
        return response.getExpiresIn() == null ? null : clock.instant().plusSeconds(response.getExpiresIn());
    }

    /**
     * Gets the lock that serializes token access for a service.
     *
     * @param serviceName the service name
     * @return the lock
     */
    protected ReentrantLock getTokenLock(String serviceName) {
        return tokenLocks.computeIfAbsent(serviceName, name -> new ReentrantLock());
    }
}
