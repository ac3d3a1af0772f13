package org.nocodenation.oauth2manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for building OAuth 2.0 authorization URLs.
 * <p>
 * Builds the authorization request for the authorization code flow with PKCE. Every
 * parameter value is URL-encoded.
 */
public final class OAuth2AuthorizationUrlBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OAuth2AuthorizationUrlBuilder.class);

    private OAuth2AuthorizationUrlBuilder() {
    }

    /**
     * Builds a complete OAuth 2.0 authorization URL.
     * <p>
     * The URL carries, in this order:
     * <ul>
     *   <li>response_type - Set to "code" for authorization code flow</li>
     *   <li>client_id - The OAuth client identifier</li>
     *   <li>redirect_uri - Where the authorization server will redirect after user grants permission</li>
     *   <li>scope - The requested access scopes, omitted when the service has none</li>
     *   <li>state - A random value to prevent CSRF attacks</li>
     *   <li>code_challenge - The PKCE code challenge</li>
     *   <li>code_challenge_method - Set to "S256" for SHA-256 hashing</li>
     * </ul>
     * If the configured authorization endpoint already has a query string, the parameters
     * are appended to it.
     *
     * @param config The service configuration
     * @param state The state parameter for CSRF protection
     * @param codeChallenge The PKCE code challenge
     * @return The complete authorization URL
     */
    public static String buildAuthorizationUrl(ServiceConfig config, String state, String codeChallenge) {
        String baseUrl = config.getAuthorizationUrl();
        StringBuilder urlBuilder = new StringBuilder(baseUrl);
        urlBuilder.append(baseUrl.indexOf('?') >= 0 ? '&' : '?');
        urlBuilder.append("response_type=code");
        appendParameter(urlBuilder, "client_id", config.getClientId());
        appendParameter(urlBuilder, "redirect_uri", config.getRedirectUri());

        String scope = config.getScope();
        if (scope != null && !scope.isEmpty()) {
            appendParameter(urlBuilder, "scope", scope);
        }

        appendParameter(urlBuilder, "state", state);
        appendParameter(urlBuilder, "code_challenge", codeChallenge);
        urlBuilder.append("&code_challenge_method=S256");

        LOGGER.debug("Generated authorization URL for service {}", config.getServiceName());
        return urlBuilder.toString();
    }

    private static void appendParameter(StringBuilder urlBuilder, String name, String value) {
        urlBuilder.append('&').append(name).append('=')
                .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
