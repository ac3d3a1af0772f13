package org.nocodenation.oauth2manager;

/**
 * The parsed body of a successful token endpoint response.
 */
public class TokenResponse {

    private final String accessToken;
    private final String refreshToken;
    private final Long expiresIn;
    private final String tokenType;
    private final String scope;

    public TokenResponse(String accessToken, String refreshToken, Long expiresIn, String tokenType, String scope) {
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
        this.tokenType = tokenType;
        this.scope = scope;
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Gets the refresh token issued with this response.
     *
     * @return the refresh token, or null if the server did not issue one
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * Gets the access token lifetime.
     *
     * @return the lifetime in seconds, or null if the server did not report one
     */
    public Long getExpiresIn() {
        return expiresIn;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getScope() {
        return scope;
    }
}
