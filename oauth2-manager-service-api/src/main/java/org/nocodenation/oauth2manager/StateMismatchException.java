package org.nocodenation.oauth2manager;

/**
 * Thrown when an authorization callback carries a state that has no pending authorization.
 * <p>
 * This covers forged states, states that were already used for an exchange and states whose
 * pending authorization has expired. The user has to restart the authorization flow; the
 * exchange must never be retried automatically.
 */
public class StateMismatchException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    public StateMismatchException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
