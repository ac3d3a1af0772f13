package org.nocodenation.oauth2manager;

/**
 * Base class for failures raised by the OAuth 2.0 token manager.
 * <p>
 * Subclasses identify the kind of failure callers act on:
 * <ul>
 *   <li>{@link ConfigurationException} - the service was never registered</li>
 *   <li>{@link StateMismatchException} - the state is unknown, already consumed or expired</li>
 *   <li>{@link TokenExchangeException} - the authorization code could not be exchanged</li>
 *   <li>{@link RefreshException} - the access token could not be refreshed</li>
 *   <li>{@link InvalidCallbackException} - the authorization callback was rejected</li>
 *   <li>{@link PersistenceException} - the token file could not be read or written</li>
 * </ul>
 * <p>
 * Each exception carries a message and can optionally wrap the underlying cause, such as
 * a network exception or a JSON parsing exception.
 */
public class OAuth2Exception extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message A description of the error
     */
    public OAuth2Exception(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message A description of the error
     * @param cause The underlying exception that caused this exception to be thrown
     */
    public OAuth2Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
