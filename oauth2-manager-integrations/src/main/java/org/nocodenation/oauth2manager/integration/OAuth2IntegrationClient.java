package org.nocodenation.oauth2manager.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.nocodenation.oauth2manager.AuthorizationRequest;
import org.nocodenation.oauth2manager.ConfigurationException;
import org.nocodenation.oauth2manager.OAuth2Authenticatable;
import org.nocodenation.oauth2manager.OAuth2Manager;
import org.nocodenation.oauth2manager.OAuth2ManagerSettings;
import org.nocodenation.oauth2manager.OAuth2Token;
import org.nocodenation.oauth2manager.TokenEndpointClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base class of integrations that call a service's API with the service's OAuth 2.0 token.
 * <p>
 * Every request gets a valid token from the {@link OAuth2Manager} first, refreshing it if it
 * expired, and carries it in the {@code Authorization} header. Without a valid token the call
 * fails with {@link NotAuthenticatedException} before anything is sent. JSON responses are
 * returned as a {@link JsonNode}; other bodies as a text node.
 */
public abstract class OAuth2IntegrationClient implements OAuth2Authenticatable, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(OAuth2IntegrationClient.class);

    protected final ObjectMapper objectMapper = new ObjectMapper();

    private final String serviceName;
    private final OAuth2Manager oauth2Manager;
    private final CloseableHttpClient httpClient;

    /**
     * Creates a client with the default connect and response timeouts of
     * {@link OAuth2ManagerSettings}.
     */
    protected OAuth2IntegrationClient(String serviceName, OAuth2Manager oauth2Manager) {
        this(serviceName, oauth2Manager, OAuth2ManagerSettings.DEFAULT_CONNECT_TIMEOUT,
                OAuth2ManagerSettings.DEFAULT_RESPONSE_TIMEOUT);
    }

    protected OAuth2IntegrationClient(String serviceName, OAuth2Manager oauth2Manager,
                                      Duration connectTimeout, Duration responseTimeout) {
        this(serviceName, oauth2Manager, TokenEndpointClient.createHttpClient(connectTimeout, responseTimeout));
    }

    protected OAuth2IntegrationClient(String serviceName, OAuth2Manager oauth2Manager, CloseableHttpClient httpClient) {
        this.serviceName = serviceName;
        this.oauth2Manager = oauth2Manager;
        this.httpClient = httpClient;
    }

    @Override
    public String getServiceName() {
        return serviceName;
    }

    @Override
    public AuthorizationRequest startAuthorization() throws ConfigurationException {
        return oauth2Manager.generateAuthorizationUrl(serviceName);
    }

    @Override
    public boolean isAuthenticated() {
        return oauth2Manager.isAuthenticated(serviceName);
    }

    protected JsonNode get(String url) throws IntegrationException {
        return execute(new HttpGet(url));
    }

    protected JsonNode post(String url, JsonNode body) throws IntegrationException {
        HttpPost request = new HttpPost(url);
        if (body != null) {
            request.setEntity(jsonEntity(body));
        }
        return execute(request);
    }

    protected JsonNode patch(String url, JsonNode body) throws IntegrationException {
        HttpPatch request = new HttpPatch(url);
        request.setEntity(jsonEntity(body));
        return execute(request);
    }

    protected JsonNode delete(String url) throws IntegrationException {
        return execute(new HttpDelete(url));
    }

    /**
     * Sends an authenticated request.
     *
     * @param request the request; its Authorization header is replaced
     * @return the response body
     * @throws NotAuthenticatedException if the service has no valid token
     * @throws IntegrationException if the request fails or the response status is not 2xx
     */
    protected JsonNode execute(ClassicHttpRequest request) throws IntegrationException {
        OAuth2Token token = oauth2Manager.getValidToken(serviceName)
                .orElseThrow(() -> new NotAuthenticatedException(serviceName));

        request.setHeader(HttpHeaders.AUTHORIZATION, token.getAuthorizationHeaderValue());
        if (!request.containsHeader(HttpHeaders.ACCEPT)) {
            request.setHeader(HttpHeaders.ACCEPT, "application/json");
        }

        String target = request.getMethod() + " " + request.getRequestUri();
        LOGGER.debug("Calling {} for service {}", target, serviceName);
        try {
            return httpClient.execute(request, response -> {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);

                if (statusCode < 200 || statusCode >= 300) {
                    throw new IOException(new IntegrationException(
                            serviceName + " request " + target + " failed with status code " + statusCode, statusCode));
                }
                if (body.isEmpty()) {
                    return NullNode.getInstance();
                }

                ContentType contentType = ContentType.parseLenient(entity.getContentType());
                if (contentType != null && ContentType.APPLICATION_JSON.isSameMimeType(contentType)) {
                    return objectMapper.readTree(body);
                }
                return TextNode.valueOf(body);
            });
        } catch (IOException e) {
            if (e.getCause() instanceof IntegrationException) {
                IntegrationException failure = (IntegrationException) e.getCause();
                LOGGER.error(failure.getMessage());
                throw failure;
            }
            LOGGER.error("OAuth2 API request {} failed for {}: {}", target, serviceName, e.toString());
            throw new IntegrationException(serviceName + " request " + target + " failed: " + e.getMessage(), e);
        }
    }

    private StringEntity jsonEntity(JsonNode body) throws IntegrationException {
        try {
            return new StringEntity(objectMapper.writeValueAsString(body), ContentType.APPLICATION_JSON);
        } catch (JsonProcessingException e) {
            throw new IntegrationException("Cannot serialize request body for " + serviceName, e);
        }
    }

    protected OAuth2Manager getOAuth2Manager() {
        return oauth2Manager;
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
