package org.nocodenation.oauth2manager;

/**
 * Thrown when an authorization code could not be exchanged for a token.
 * <p>
 * Authorization codes are single-use, so the exchange is never retried automatically.
 * The service's authentication state is left unchanged.
 */
public class TokenExchangeException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final FailureReason reason;

    public TokenExchangeException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenExchangeException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Tells whether the exchange failed in transport or was rejected by the server.
     *
     * @return the failure reason
     */
    public FailureReason getReason() {
        return reason;
    }
}
