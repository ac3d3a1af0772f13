package org.nocodenation.oauth2manager;

/**
 * Thrown when an access token could not be refreshed.
 * <p>
 * The reason distinguishes a missing token, a missing refresh token, a transport failure
 * and a rejection by the authorization server. In every case the caller should treat the
 * service as unauthenticated and run the authorization flow again.
 */
public class RefreshException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final FailureReason reason;

    public RefreshException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RefreshException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
