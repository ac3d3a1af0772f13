package org.nocodenation.oauth2manager;

/**
 * Capability implemented by every service integration that authenticates through OAuth 2.0.
 * <p>
 * Integrations that do not use OAuth 2.0 simply do not implement it. Registries discover
 * OAuth-capable integrations through this type rather than by probing for methods.
 */
public interface OAuth2Authenticatable {

    /**
     * Gets the service name under which this integration's configuration and token are kept.
     *
     * @return the service name
     */
    String getServiceName();

    /**
     * Starts an authorization for this integration's service.
     *
     * @return the authorization URL and its state
     * @throws ConfigurationException if the service has no registered configuration
     */
    AuthorizationRequest startAuthorization() throws ConfigurationException;

    /**
     * Checks whether this integration currently has a valid token.
     *
     * @return true if authenticated
     */
    boolean isAuthenticated();

    /**
     * Called after an authorization for this service completed, so the integration can
     * rebuild clients bound to the old token.
     */
    default void onAuthorized() {
    }

    /**
     * Called after this service's token was revoked.
     */
    default void onRevoked() {
    }
}
