package org.nocodenation.oauth2manager.integration;

/**
 * Thrown when a call from an integration to its service's API fails.
 */
public class IntegrationException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Status code of the failed response, or -1 if no response was received. */
    private final int statusCode;

    public IntegrationException(String message) {
        this(message, -1, null);
    }

    public IntegrationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public IntegrationException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private IntegrationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
