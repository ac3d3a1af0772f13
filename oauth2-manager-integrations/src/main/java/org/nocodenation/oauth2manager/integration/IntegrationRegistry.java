package org.nocodenation.oauth2manager.integration;

import org.nocodenation.oauth2manager.AuthenticationState;
import org.nocodenation.oauth2manager.AuthorizationCallback;
import org.nocodenation.oauth2manager.ConfigurationException;
import org.nocodenation.oauth2manager.OAuth2Authenticatable;
import org.nocodenation.oauth2manager.OAuth2Exception;
import org.nocodenation.oauth2manager.OAuth2Manager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the OAuth 2.0 capable integrations of an application.
 * <p>
 * Answers questions about all of them at once (authorization URLs, authentication status)
 * and routes authorization results to the integration concerned, so integrations can rebuild
 * clients bound to a token through {@link OAuth2Authenticatable#onAuthorized()} and
 * {@link OAuth2Authenticatable#onRevoked()}.
 */
public class IntegrationRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(IntegrationRegistry.class);

    private final Map<String, OAuth2Authenticatable> integrations = Collections.synchronizedMap(new LinkedHashMap<>());
    private final OAuth2Manager oauth2Manager;

    public IntegrationRegistry(OAuth2Manager oauth2Manager) {
        this.oauth2Manager = oauth2Manager;
    }

    /**
     * Registers an integration under its service name, replacing any integration registered
     * for the same service.
     *
     * @param integration the integration
     */
    public void register(OAuth2Authenticatable integration) {
        integrations.put(integration.getServiceName(), integration);
        LOGGER.debug("Registered integration for service {}", integration.getServiceName());
    }

    public List<OAuth2Authenticatable> getIntegrations() {
        synchronized (integrations) {
            return new ArrayList<>(integrations.values());
        }
    }

    /**
     * Starts an authorization for every registered integration.
     * <p>
     * Services that cannot start one, typically because they have no configuration, are
     * logged and left out.
     *
     * @return authorization URLs by service name, in registration order
     */
    public Map<String, String> getAuthorizationUrls() {
        Map<String, String> urls = new LinkedHashMap<>();
        for (OAuth2Authenticatable integration : getIntegrations()) {
            try {
                urls.put(integration.getServiceName(), integration.startAuthorization().getUrl());
            } catch (ConfigurationException e) {
                LOGGER.error("Failed to get authorization URL for {}: {}", integration.getServiceName(), e.getMessage());
            }
        }
        return urls;
    }

    /**
     * Checks which registered services hold a valid token. Expired tokens are refreshed.
     *
     * @return authentication flags by service name, in registration order
     */
    public Map<String, Boolean> getAuthenticationStatus() {
        Map<String, Boolean> status = new LinkedHashMap<>();
        for (OAuth2Authenticatable integration : getIntegrations()) {
            status.put(integration.getServiceName(), integration.isAuthenticated());
        }
        return status;
    }

    /**
     * Reports the authentication state of every registered service without refreshing.
     *
     * @return states by service name, in registration order
     */
    public Map<String, AuthenticationState> getAuthenticationStates() {
        Map<String, AuthenticationState> states = new LinkedHashMap<>();
        for (OAuth2Authenticatable integration : getIntegrations()) {
            states.put(integration.getServiceName(), oauth2Manager.getAuthenticationState(integration.getServiceName()));
        }
        return states;
    }

    public boolean completeAuthorization(AuthorizationCallback callback) {
        return completeAuthorization(callback.getServiceName(), callback.getCode(), callback.getState());
    }

    /**
     * Exchanges an authorization code and notifies the service's integration.
     *
     * @param serviceName the service named by the callback
     * @param code the authorization code
     * @param state the state returned by the authorization server
     * @return true if the service is now authorized
     */
    public boolean completeAuthorization(String serviceName, String code, String state) {
        try {
            oauth2Manager.exchangeCodeForToken(serviceName, code, state);
        } catch (OAuth2Exception e) {
            LOGGER.error("Failed to complete OAuth2 flow for {}: {}", serviceName, e.getMessage());
            return false;
        }

        OAuth2Authenticatable integration = integrations.get(serviceName);
        if (integration != null) {
            integration.onAuthorized();
        }
        LOGGER.info("Successfully completed OAuth2 flow for {}", serviceName);
        return true;
    }

    /**
     * Revokes a service's token and notifies the service's integration.
     *
     * @param serviceName the service name
     */
    public void revoke(String serviceName) {
        oauth2Manager.revoke(serviceName);
        OAuth2Authenticatable integration = integrations.get(serviceName);
        if (integration != null) {
            integration.onRevoked();
        }
    }
}
