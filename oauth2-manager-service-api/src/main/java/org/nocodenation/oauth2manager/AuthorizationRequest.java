package org.nocodenation.oauth2manager;

/**
 * The result of starting an authorization: the URL to send the resource owner to and
 * the state that the authorization server will send back with the code.
 */
public final class AuthorizationRequest {

    private final String serviceName;
    private final String url;
    private final String state;

    public AuthorizationRequest(String serviceName, String url, String state) {
        this.serviceName = serviceName;
        this.url = url;
        this.state = state;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * Gets the fully query-encoded authorization URL.
     *
     * @return the authorization URL
     */
    public String getUrl() {
        return url;
    }

    public String getState() {
        return state;
    }

    @Override
    public String toString() {
        return "AuthorizationRequest{serviceName='" + serviceName + "', url='" + url + "'}";
    }
}
