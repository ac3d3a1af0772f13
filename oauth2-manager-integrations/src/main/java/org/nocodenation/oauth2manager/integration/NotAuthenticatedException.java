package org.nocodenation.oauth2manager.integration;

/**
 * Thrown when an integration is called before its service was authorized, or after its
 * token expired and could not be refreshed.
 */
public class NotAuthenticatedException extends IntegrationException {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    public NotAuthenticatedException(String serviceName) {
        super("No valid OAuth2 token for " + serviceName + ". Please authenticate first.");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
