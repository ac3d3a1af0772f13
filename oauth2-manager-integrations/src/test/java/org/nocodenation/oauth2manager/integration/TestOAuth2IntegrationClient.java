package org.nocodenation.oauth2manager.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.nocodenation.oauth2manager.AuthorizationRequest;
import org.nocodenation.oauth2manager.OAuth2Manager;
import org.nocodenation.oauth2manager.OAuth2Token;

import java.time.Duration;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests authenticated API calls of an integration against a WireMock API.
 */
public class TestOAuth2IntegrationClient {

    /**
     * Minimal ticketing integration used to drive the base class.
     */
    static class TicketingClient extends OAuth2IntegrationClient {
        private final String baseUrl;

        TicketingClient(OAuth2Manager manager, String baseUrl) {
            super("zendesk", manager);
            this.baseUrl = baseUrl;
        }

        TicketingClient(OAuth2Manager manager, String baseUrl, Duration responseTimeout) {
            super("zendesk", manager, Duration.ofSeconds(2), responseTimeout);
            this.baseUrl = baseUrl;
        }

        JsonNode getTickets() throws IntegrationException {
            return get(baseUrl + "/api/v2/tickets.json");
        }

        JsonNode createTicket(JsonNode ticket) throws IntegrationException {
            return post(baseUrl + "/api/v2/tickets.json", ticket);
        }

        JsonNode status() throws IntegrationException {
            return get(baseUrl + "/status");
        }
    }

    private WireMockServer wireMockServer;
    private OAuth2Manager manager;
    private TicketingClient client;

    @BeforeEach
    public void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        manager = mock(OAuth2Manager.class);
        client = new TicketingClient(manager, wireMockServer.baseUrl());
    }

    @AfterEach
    public void tearDown() throws Exception {
        client.close();
        wireMockServer.stop();
    }

    private void authenticated(String accessToken) {
        when(manager.getValidToken("zendesk"))
                .thenReturn(Optional.of(new OAuth2Token(accessToken, null, null, "Bearer", null)));
    }

    @Test
    public void testRequestCarriesAuthorizationHeader() throws Exception {
        authenticated("tok1");
        wireMockServer.stubFor(get(urlEqualTo("/api/v2/tickets.json"))
                .willReturn(okJson("{\"tickets\":[{\"id\":1}]}")));

        JsonNode result = client.getTickets();

        assertEquals(1, result.get("tickets").get(0).get("id").asInt());
        wireMockServer.verify(getRequestedFor(urlEqualTo("/api/v2/tickets.json"))
                .withHeader("Authorization", equalTo("Bearer tok1"))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testPostSendsJsonBody() throws Exception {
        authenticated("tok1");
        wireMockServer.stubFor(post(urlEqualTo("/api/v2/tickets.json"))
                .willReturn(okJson("{\"ticket\":{\"id\":7}}")));

        JsonNode ticket = client.objectMapper.createObjectNode().put("subject", "Help");
        JsonNode result = client.createTicket(ticket);

        assertEquals(7, result.get("ticket").get("id").asInt());
        wireMockServer.verify(postRequestedFor(urlEqualTo("/api/v2/tickets.json"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(equalToJson("{\"subject\":\"Help\"}")));
    }

    @Test
    public void testTextResponse() throws Exception {
        authenticated("tok1");
        wireMockServer.stubFor(get(urlEqualTo("/status"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "text/plain").withBody("ok")));

        assertEquals("ok", client.status().asText());
    }

    @Test
    public void testNotAuthenticated() {
        when(manager.getValidToken("zendesk")).thenReturn(Optional.empty());

        NotAuthenticatedException e = assertThrows(NotAuthenticatedException.class, () -> client.getTickets());
        assertEquals("zendesk", e.getServiceName());
        assertTrue(wireMockServer.findAll(anyRequestedFor(anyUrl())).isEmpty(), "No request should be sent");
    }

    @Test
    public void testErrorStatus() {
        authenticated("tok1");
        wireMockServer.stubFor(get(urlEqualTo("/api/v2/tickets.json"))
                .willReturn(aResponse().withStatus(403).withBody("{\"error\":\"Forbidden\"}")));

        IntegrationException e = assertThrows(IntegrationException.class, () -> client.getTickets());
        assertEquals(403, e.getStatusCode());
    }

    /**
     * Each call asks the manager for a valid token, so a refreshed token is picked up.
     */
    @Test
    public void testTokenIsFetchedForEveryCall() throws Exception {
        when(manager.getValidToken("zendesk"))
                .thenReturn(Optional.of(new OAuth2Token("tok1", null, null, null, null)))
                .thenReturn(Optional.of(new OAuth2Token("tok2", null, null, null, null)));
        wireMockServer.stubFor(get(urlEqualTo("/api/v2/tickets.json")).willReturn(okJson("{}")));

        client.getTickets();
        client.getTickets();

        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/api/v2/tickets.json"))
                .withHeader("Authorization", equalTo("Bearer tok1")));
        wireMockServer.verify(1, getRequestedFor(urlEqualTo("/api/v2/tickets.json"))
                .withHeader("Authorization", equalTo("Bearer tok2")));
    }

    @Test
    public void testAuthenticatableDelegatesToManager() throws Exception {
        AuthorizationRequest request = new AuthorizationRequest("zendesk", "https://acme.zendesk.com/auth", "s1");
        when(manager.generateAuthorizationUrl("zendesk")).thenReturn(request);
        when(manager.isAuthenticated("zendesk")).thenReturn(true);

        assertEquals("zendesk", client.getServiceName());
        assertSame(request, client.startAuthorization());
        assertTrue(client.isAuthenticated());
    }

    @Test
    public void testSlowResponseTimesOut() throws Exception {
        authenticated("tok1");
        wireMockServer.stubFor(get(urlEqualTo("/api/v2/tickets.json"))
                .willReturn(okJson("{\"tickets\":[]}").withFixedDelay(2000)));

        try (TicketingClient impatient = new TicketingClient(manager, wireMockServer.baseUrl(), Duration.ofMillis(300))) {
            IntegrationException e = assertThrows(IntegrationException.class, impatient::getTickets);
            assertEquals(-1, e.getStatusCode());
        }
    }
}
