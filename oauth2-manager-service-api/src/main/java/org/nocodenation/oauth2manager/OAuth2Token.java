package org.nocodenation.oauth2manager;

import java.time.Duration;
import java.time.Instant;

/**
 * Represents the OAuth 2.0 token held for one service.
 * <p>
 * A token carries:
 * <ul>
 *   <li>The access token string presented to the resource server</li>
 *   <li>An optional refresh token used to obtain a new access token</li>
 *   <li>An optional absolute expiry instant</li>
 *   <li>The token type, "Bearer" unless the server says otherwise</li>
 *   <li>The granted scope, when the server reports one</li>
 * </ul>
 * <p>
 * A token without an expiry instant never expires. Tokens are created on a successful
 * authorization code exchange and updated in place when they are refreshed.
 */
public class OAuth2Token {

    /** Token type used when the authorization server does not report one. */
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
    private String tokenType = DEFAULT_TOKEN_TYPE;
    private String scope;

    /**
     * Creates an empty token with the default token type.
     * <p>
     * The access token must be set before the token can be used.
     */
    public OAuth2Token() {
    }

    /**
     * Creates a token with all fields set.
     *
     * @param accessToken The access token string
     * @param refreshToken The refresh token, or null
     * @param expiresAt The absolute expiry instant, or null if the token never expires
     * @param tokenType The token type, or null for "Bearer"
     * @param scope The granted scope, or null
     */
    public OAuth2Token(String accessToken, String refreshToken, Instant expiresAt, String tokenType, String scope) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        setTokenType(tokenType);
        this.scope = scope;
    }

    /**
     * Creates a field-for-field copy of another token.
     *
     * @param other the token to copy
     */
    public OAuth2Token(OAuth2Token other) {
        this(other.accessToken, other.refreshToken, other.expiresAt, other.tokenType, other.scope);
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    /**
     * Gets the refresh token associated with this access token.
     *
     * @return The refresh token string, or null if the server did not issue one
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public void setRefreshToken(String refreshToken) {
        this.refreshToken = refreshToken;
    }

    /**
     * Gets the absolute expiry of the access token.
     *
     * @return the expiry instant, or null if the token never expires
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getTokenType() {
        return tokenType;
    }

    /**
     * Sets the token type. A null or blank value resets it to "Bearer".
     *
     * @param tokenType The token type (e.g., "Bearer")
     */
    public void setTokenType(String tokenType) {
        this.tokenType = tokenType == null || tokenType.isBlank() ? DEFAULT_TOKEN_TYPE : tokenType;
    }

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    /**
     * Checks whether a refresh token is available.
     *
     * @return true if the token carries a non-empty refresh token
     */
    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isEmpty();
    }

    /**
     * Determines whether the token has expired at the given instant.
     * <p>
     * The leeway moves the expiry earlier, so a token with a leeway of 30 seconds is treated
     * as expired 30 seconds before its real expiry. A token without an expiry never expires.
     *
     * @param now the instant to compare against
     * @param leeway how long before the real expiry the token counts as expired
     * @return true if the token is expired at {@code now}
     */
    public boolean isExpired(Instant now, Duration leeway) {
        if (expiresAt == null) {
            return false;
        }
        return !now.plus(leeway).isBefore(expiresAt);
    }

    /**
     * Returns the value for the HTTP Authorization header: "{token_type} {access_token}".
     *
     * @return the Authorization header value
     */
    public String getAuthorizationHeaderValue() {
        return tokenType + " " + accessToken;
    }

    @Override
    public String toString() {
        return "OAuth2Token{" +
                "tokenType='" + tokenType + '\'' +
                ", expiresAt=" + expiresAt +
                ", scope='" + scope + '\'' +
                ", hasRefreshToken=" + hasRefreshToken() +
                '}';
    }
}
