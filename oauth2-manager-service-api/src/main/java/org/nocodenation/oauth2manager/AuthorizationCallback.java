package org.nocodenation.oauth2manager;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * A validated authorization callback: the service it belongs to, the authorization code and
 * the state returned by the authorization server.
 * <p>
 * A redirect handler builds this from the callback's query parameters with
 * {@link #fromParameters(String, Map)}, which rejects:
 * <ul>
 *   <li>Callbacks carrying an {@code error} parameter (the user denied access, or the server failed)</li>
 *   <li>Callbacks without a {@code state} parameter</li>
 *   <li>Callbacks without a {@code code} parameter</li>
 * </ul>
 * Only a callback that passes these checks is handed to the token exchange.
 */
public final class AuthorizationCallback {

    private final String serviceName;
    private final String code;
    private final String state;

    private AuthorizationCallback(String serviceName, String code, String state) {
        this.serviceName = serviceName;
        this.code = code;
        this.state = state;
    }

    /**
     * Validates callback parameters and builds the callback.
     *
     * @param serviceName the service named by the callback route
     * @param params the decoded query parameters of the callback request
     * @return the validated callback
     * @throws InvalidCallbackException if the server reported an error, or code or state is missing
     */
    public static AuthorizationCallback fromParameters(String serviceName, Map<String, String> params)
            throws InvalidCallbackException {
        if (serviceName == null || serviceName.isEmpty()) {
            throw new InvalidCallbackException("Missing service name");
        }

        String error = params.get("error");
        if (error != null && !error.isEmpty()) {
            String errorDescription = params.get("error_description");
            throw new InvalidCallbackException("Authorization failed for " + serviceName + ": " + error
                    + (errorDescription != null ? ": " + errorDescription : ""), error);
        }

        String state = params.get("state");
        if (state == null || state.isEmpty()) {
            throw new InvalidCallbackException("Missing state parameter");
        }

        String code = params.get("code");
        if (code == null || code.isEmpty()) {
            throw new InvalidCallbackException("Missing authorization code");
        }

        return new AuthorizationCallback(serviceName, code, state);
    }

    /**
     * Parses and validates the raw query string of a callback request.
     *
     * @param serviceName the service named by the callback route
     * @param query the query string of the callback request, may be null
     * @return the validated callback
     * @throws InvalidCallbackException if the query cannot be decoded or fails validation
     */
    public static AuthorizationCallback fromQueryString(String serviceName, String query)
            throws InvalidCallbackException {
        return fromParameters(serviceName, parseQueryString(query));
    }

    /**
     * Parses a raw query string into decoded parameters. The first value of a repeated
     * parameter wins.
     *
     * @param query The query string portion of the URI (after the '?'), may be null
     * @return A map of parameter names to their values
     * @throws InvalidCallbackException if the query contains a malformed percent escape
     */
    public static Map<String, String> parseQueryString(String query) throws InvalidCallbackException {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }

        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                params.putIfAbsent(decode(pair.substring(0, idx)), decode(pair.substring(idx + 1)));
            }
        }
        return params;
    }

    private static String decode(String component) throws InvalidCallbackException {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidCallbackException("Malformed callback query: " + e.getMessage());
        }
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getCode() {
        return code;
    }

    public String getState() {
        return state;
    }
}
