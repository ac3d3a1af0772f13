package org.nocodenation.oauth2manager;

import java.util.Optional;
import java.util.Set;

/**
 * Keeps the token of every authenticated service, keyed by service name.
 * <p>
 * Implementations persist the full token set after every change. Persistence is best-effort:
 * a failed write never fails the caller.
 */
public interface TokenStore {

    /**
     * Replaces the in-memory token set with the persisted one. A missing or unreadable
     * store yields an empty set.
     */
    void load();

    /**
     * Gets the token of a service.
     *
     * @param serviceName the service name
     * @return the token, or empty if the service has none
     */
    Optional<OAuth2Token> get(String serviceName);

    /**
     * Stores the token of a service, replacing any previous one, and persists the token set.
     *
     * @param serviceName the service name
     * @param token the token
     */
    void save(String serviceName, OAuth2Token token);

    /**
     * Removes the token of a service and persists the token set.
     *
     * @param serviceName the service name
     * @return true if a token was removed
     */
    boolean delete(String serviceName);

    Set<String> getServiceNames();
}
