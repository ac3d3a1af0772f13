package org.nocodenation.oauth2manager;

import java.util.Objects;

/**
 * Immutable OAuth 2.0 client configuration for one service.
 * <p>
 * Holds the client credentials and the authorization server endpoints used for the
 * authorization code flow. The service name is the key under which the configuration,
 * the pending authorizations and the token for that service are stored.
 */
public final class ServiceConfig {

    private final String serviceName;
    private final String clientId;
    private final String clientSecret;
    private final String authorizationUrl;
    private final String tokenUrl;
    private final String redirectUri;
    private final String scope;

    /**
     * Creates a service configuration.
     *
     * @param serviceName The service name, used as the registry key
     * @param clientId The OAuth 2.0 client identifier
     * @param clientSecret The OAuth 2.0 client secret, or null for public clients
     * @param authorizationUrl The authorization endpoint URL
     * @param tokenUrl The token endpoint URL
     * @param redirectUri The redirect URI registered with the authorization server
     * @param scope The requested scope string, or null
     */
    public ServiceConfig(String serviceName, String clientId, String clientSecret, String authorizationUrl,
                         String tokenUrl, String redirectUri, String scope) {
        this.serviceName = requireText(serviceName, "serviceName");
        this.clientId = requireText(clientId, "clientId");
        this.clientSecret = clientSecret;
        this.authorizationUrl = requireText(authorizationUrl, "authorizationUrl");
        this.tokenUrl = requireText(tokenUrl, "tokenUrl");
        this.redirectUri = requireText(redirectUri, "redirectUri");
        this.scope = scope;
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getAuthorizationUrl() {
        return authorizationUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getScope() {
        return scope;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceConfig)) {
            return false;
        }
        ServiceConfig that = (ServiceConfig) o;
        return serviceName.equals(that.serviceName)
                && clientId.equals(that.clientId)
                && Objects.equals(clientSecret, that.clientSecret)
                && authorizationUrl.equals(that.authorizationUrl)
                && tokenUrl.equals(that.tokenUrl)
                && redirectUri.equals(that.redirectUri)
                && Objects.equals(scope, that.scope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceName, clientId, clientSecret, authorizationUrl, tokenUrl, redirectUri, scope);
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "serviceName='" + serviceName + '\'' +
                ", clientId='" + clientId + '\'' +
                ", authorizationUrl='" + authorizationUrl + '\'' +
                ", tokenUrl='" + tokenUrl + '\'' +
                ", redirectUri='" + redirectUri + '\'' +
                ", scope='" + scope + '\'' +
                '}';
    }
}
