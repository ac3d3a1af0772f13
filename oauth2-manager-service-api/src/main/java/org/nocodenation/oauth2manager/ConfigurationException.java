package org.nocodenation.oauth2manager;

/**
 * Thrown when an operation names a service that has no registered configuration.
 * <p>
 * This is a caller error and is never retried.
 */
public class ConfigurationException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    private final String serviceName;

    public ConfigurationException(String serviceName) {
        super("Service not registered: " + serviceName);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
