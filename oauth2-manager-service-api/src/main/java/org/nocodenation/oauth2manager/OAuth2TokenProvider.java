package org.nocodenation.oauth2manager;

import java.util.Optional;

/**
 * Provides valid OAuth 2.0 access tokens to integration clients.
 * <p>
 * This is the only contract an integration client needs: it asks for a valid token before
 * every outbound call and attaches it to the request. Implementations refresh expired tokens
 * transparently, so a returned token is never known to be expired.
 */
public interface OAuth2TokenProvider {

    /**
     * Gets a valid token for the service, refreshing it first if it has expired.
     * <p>
     * This method will:
     * <ol>
     *   <li>Return an empty result if no token is on record for the service</li>
     *   <li>Return the current token if it has not expired or has no expiry</li>
     *   <li>Refresh an expired token and return the refreshed one</li>
     *   <li>Return an empty result if the refresh fails; the failure is logged, not thrown</li>
     * </ol>
     *
     * @param serviceName the service to get a token for
     * @return the valid token, or empty if the service is not authenticated
     */
    Optional<OAuth2Token> getValidToken(String serviceName);

    /**
     * Checks whether a valid token is available for the service.
     * <p>
     * Equivalent to {@code getValidToken(serviceName).isPresent()}, which means an expired
     * token triggers a refresh attempt.
     *
     * @param serviceName the service to check
     * @return true if a valid token is available
     */
    boolean isAuthenticated(String serviceName);
}
