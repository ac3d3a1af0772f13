package org.nocodenation.oauth2manager;

/**
 * Thrown by {@link TokenEndpointClient} when a token request fails. The manager rethrows it
 * as a {@link TokenExchangeException} or a {@link RefreshException}, keeping the reason.
 */
public class TokenRequestException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final FailureReason reason;

    public TokenRequestException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenRequestException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
