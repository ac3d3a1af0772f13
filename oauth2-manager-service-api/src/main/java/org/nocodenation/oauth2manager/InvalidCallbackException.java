package org.nocodenation.oauth2manager;

/**
 * Thrown when an authorization callback is rejected before it reaches the token exchange.
 * <p>
 * This happens when the authorization server reported an error, or when the callback is
 * missing the code or the state parameter.
 */
public class InvalidCallbackException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final String error;

    public InvalidCallbackException(String message) {
        this(message, null);
    }

    public InvalidCallbackException(String message, String error) {
        super(message);
        this.error = error;
    }

    /**
     * Gets the {@code error} parameter sent by the authorization server.
     *
     * @return the error code, or null if the callback was rejected for missing parameters
     */
    public String getError() {
        return error;
    }
}
