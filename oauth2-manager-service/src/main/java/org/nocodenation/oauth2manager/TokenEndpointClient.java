package org.nocodenation.oauth2manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends token requests to OAuth 2.0 token endpoints.
 * <p>
 * Requests are form-encoded POSTs that ask for a JSON response. Any 2xx status is a success;
 * the body must then be a JSON object carrying at least an {@code access_token}. Failures are
 * reported as {@link TokenRequestException} with reason {@link FailureReason#TRANSPORT} when the
 * server could not be reached in time, or {@link FailureReason#PROTOCOL} when it answered with
 * an error status or an unusable body.
 */
public class TokenEndpointClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenEndpointClient.class);

    // ten years
    static final long MAX_EXPIRES_IN_SECONDS = Duration.ofDays(3650).getSeconds();

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Creates a client with its own connection pool.
     *
     * @param connectTimeout the connect timeout
     * @param responseTimeout the maximum wait for response data
     */
    public TokenEndpointClient(Duration connectTimeout, Duration responseTimeout) {
        this(createHttpClient(connectTimeout, responseTimeout));
    }

    TokenEndpointClient(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Creates a pooled HTTP client bounded by the given timeouts, without automatic retries.
     *
     * @param connectTimeout the connect timeout
     * @param responseTimeout the maximum wait for response data
     * @return the client
     */
    public static CloseableHttpClient createHttpClient(Duration connectTimeout, Duration responseTimeout) {
        return HttpClientBuilder.create()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
                        .build())
                .disableAutomaticRetries()
                .build();
    }

    /**
     * Exchanges an authorization code for a token.
     *
     * @param config the service configuration
     * @param code the authorization code from the callback
     * @param codeVerifier the PKCE code verifier stored for the callback's state
     * @return the token response
     * @throws TokenRequestException if the request fails
     */
    public TokenResponse exchangeAuthorizationCode(ServiceConfig config, String code, String codeVerifier)
            throws TokenRequestException {
        List<NameValuePair> params = new ArrayList<>();
        params.add(new BasicNameValuePair("grant_type", "authorization_code"));
        addClientCredentials(params, config);
        params.add(new BasicNameValuePair("code", code));
        params.add(new BasicNameValuePair("redirect_uri", config.getRedirectUri()));
        params.add(new BasicNameValuePair("code_verifier", codeVerifier));
        return executeTokenRequest(config, params);
    }

    /**
     * Obtains a new access token with a refresh token.
     *
     * @param config the service configuration
     * @param refreshToken the refresh token
     * @return the token response
     * @throws TokenRequestException if the request fails
     */
    public TokenResponse refresh(ServiceConfig config, String refreshToken) throws TokenRequestException {
        List<NameValuePair> params = new ArrayList<>();
        params.add(new BasicNameValuePair("grant_type", "refresh_token"));
        addClientCredentials(params, config);
        params.add(new BasicNameValuePair("refresh_token", refreshToken));
        return executeTokenRequest(config, params);
    }

    private static void addClientCredentials(List<NameValuePair> params, ServiceConfig config) {
        params.add(new BasicNameValuePair("client_id", config.getClientId()));
        String clientSecret = config.getClientSecret();
        if (clientSecret != null && !clientSecret.isEmpty()) {
            params.add(new BasicNameValuePair("client_secret", clientSecret));
        }
    }

    /**
     * Executes a token request against the service's token endpoint.
     *
     * @param config the service configuration
     * @param params the form parameters
     * @return the parsed token response
     * @throws TokenRequestException if the request fails in transport or is rejected
     */
    protected TokenResponse executeTokenRequest(ServiceConfig config, List<NameValuePair> params)
            throws TokenRequestException {
        String tokenUrl = config.getTokenUrl();
        LOGGER.debug("Executing token request for service {} to {}", config.getServiceName(), tokenUrl);

        HttpPost tokenRequest = new HttpPost(tokenUrl);
        tokenRequest.setHeader(HttpHeaders.ACCEPT, "application/json");
        tokenRequest.setEntity(new UrlEncodedFormEntity(params, StandardCharsets.UTF_8));

        try {
            return httpClient.execute(tokenRequest, response -> {
                int statusCode = response.getCode();
                LOGGER.debug("Token response status for service {}: {}", config.getServiceName(), statusCode);

                HttpEntity entity = response.getEntity();
                String responseBody;
                try {
                    responseBody = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
                } catch (ParseException e) {
                    throw new IOException(new TokenRequestException(FailureReason.PROTOCOL,
                            "Error reading token response: " + e.getMessage(), e));
                }

                if (statusCode < 200 || statusCode >= 300) {
                    String error = extractError(responseBody);
                    LOGGER.error("Token request for service {} failed: status={}, error={}",
                            config.getServiceName(), statusCode, error);
                    throw new IOException(new TokenRequestException(FailureReason.PROTOCOL,
                            "Token request failed with status code " + statusCode
                                    + (error != null ? " (" + error + ")" : "")));
                }

                try {
                    return parseTokenResponse(responseBody);
                } catch (TokenRequestException e) {
                    throw new IOException(e);
                }
            });
        } catch (IOException e) {
            if (e.getCause() instanceof TokenRequestException) {
                throw (TokenRequestException) e.getCause();
            }
            LOGGER.error("Error executing token request for service {}: {}", config.getServiceName(), e.toString());
            throw new TokenRequestException(FailureReason.TRANSPORT,
                    "Error executing token request: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON token response.
     *
     * @param tokenResponse the response body
     * @return the token response
     * @throws TokenRequestException if the body is not a JSON object, has no access_token or has an
     *         expires_in that is not a number between zero and ten years
     */
    protected TokenResponse parseTokenResponse(String tokenResponse) throws TokenRequestException {
        JsonNode jsonNode;
        try {
            jsonNode = objectMapper.readTree(tokenResponse);
        } catch (JsonProcessingException e) {
            throw new TokenRequestException(FailureReason.PROTOCOL, "Malformed token response: " + e.getOriginalMessage(), e);
        }

        if (jsonNode == null || !jsonNode.isObject()) {
            throw new TokenRequestException(FailureReason.PROTOCOL, "Token response is not a JSON object");
        }

        String accessToken = textOrNull(jsonNode, "access_token");
        if (accessToken == null || accessToken.isEmpty()) {
            throw new TokenRequestException(FailureReason.PROTOCOL, "Token response missing access_token field");
        }

        JsonNode expiresInNode = jsonNode.get("expires_in");
        Long expiresIn = null;
        if (expiresInNode != null && !expiresInNode.isNull()) {
            if (!expiresInNode.canConvertToLong() && !expiresInNode.isTextual()) {
                throw new TokenRequestException(FailureReason.PROTOCOL, "Token response has invalid expires_in");
            }
            try {
                expiresIn = expiresInNode.isTextual() ? Long.valueOf(expiresInNode.asText().trim()) : expiresInNode.asLong();
            } catch (NumberFormatException e) {
                throw new TokenRequestException(FailureReason.PROTOCOL, "Token response has invalid expires_in", e);
            }
            if (expiresIn < 0 || expiresIn > MAX_EXPIRES_IN_SECONDS) {
                throw new TokenRequestException(FailureReason.PROTOCOL, "Token response has out of range expires_in " + expiresIn);
            }
        }

        String refreshToken = textOrNull(jsonNode, "refresh_token");
        String tokenType = textOrNull(jsonNode, "token_type");
        String scope = textOrNull(jsonNode, "scope");

        LOGGER.debug("Parsed token response: expires_in={}, has_refresh_token={}", expiresIn, refreshToken != null);
        return new TokenResponse(accessToken, refreshToken, expiresIn, tokenType, scope);
    }

    private String extractError(String responseBody) {
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            return node != null && node.isObject() ? textOrNull(node, "error") : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
