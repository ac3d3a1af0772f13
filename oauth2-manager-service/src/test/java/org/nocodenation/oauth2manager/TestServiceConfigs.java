package org.nocodenation.oauth2manager;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the built-in endpoint definitions of the supported services.
 */
public class TestServiceConfigs {

    private static final String CLIENT_ID = "client-id";
    private static final String CLIENT_SECRET = "client-secret";
    private static final String REDIRECT_URI = "http://localhost:8000/oauth/callback";

    @Test
    public void testSalesforce() {
        ServiceConfig production = ServiceConfigs.salesforce(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, false);
        assertEquals("salesforce", production.getServiceName());
        assertEquals("https://login.salesforce.com/services/oauth2/authorize", production.getAuthorizationUrl());
        assertEquals("https://login.salesforce.com/services/oauth2/token", production.getTokenUrl());
        assertEquals("api refresh_token offline_access", production.getScope());

        ServiceConfig sandbox = ServiceConfigs.salesforce(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, true);
        assertEquals("https://test.salesforce.com/services/oauth2/authorize", sandbox.getAuthorizationUrl());
        assertEquals("https://test.salesforce.com/services/oauth2/token", sandbox.getTokenUrl());
    }

    @Test
    public void testShopify() {
        ServiceConfig config = ServiceConfigs.shopify(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, "acme.myshopify.com");

        assertEquals("https://acme.myshopify.com/admin/oauth/authorize", config.getAuthorizationUrl());
        assertEquals("https://acme.myshopify.com/admin/oauth/access_token", config.getTokenUrl());
        assertEquals("read_orders,write_orders,read_products,write_products,read_customers,write_customers",
                config.getScope());
        assertThrows(IllegalArgumentException.class,
                () -> ServiceConfigs.shopify(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, null));
    }

    @Test
    public void testHubspot() {
        ServiceConfig config = ServiceConfigs.hubspot(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI);

        assertEquals("https://app.hubspot.com/oauth/authorize", config.getAuthorizationUrl());
        assertEquals("https://api.hubapi.com/oauth/v1/token", config.getTokenUrl());
        assertEquals("contacts,crm.objects.contacts.read,crm.objects.contacts.write", config.getScope());
    }

    @Test
    public void testSlack() {
        ServiceConfig config = ServiceConfigs.slack(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI);

        assertEquals("https://slack.com/oauth/v2/authorize", config.getAuthorizationUrl());
        assertEquals("https://slack.com/api/oauth.v2.access", config.getTokenUrl());
        assertEquals("chat:write,channels:read,files:write", config.getScope());
    }

    @Test
    public void testCalendly() {
        ServiceConfig config = ServiceConfigs.calendly(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI);

        assertEquals("https://auth.calendly.com/oauth/authorize", config.getAuthorizationUrl());
        assertEquals("https://auth.calendly.com/oauth/token", config.getTokenUrl());
        assertEquals("default", config.getScope());
    }

    @Test
    public void testZendesk() {
        ServiceConfig config = ServiceConfigs.zendesk(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, "acme");

        assertEquals("zendesk", config.getServiceName());
        assertEquals("https://acme.zendesk.com/oauth/authorizations/new", config.getAuthorizationUrl());
        assertEquals("https://acme.zendesk.com/oauth/tokens", config.getTokenUrl());
        assertEquals("read write", config.getScope());
        assertThrows(IllegalArgumentException.class,
                () -> ServiceConfigs.zendesk(CLIENT_ID, CLIENT_SECRET, REDIRECT_URI, " "));
    }

    @Test
    public void testFromServiceName() {
        assertEquals(SupportedService.SLACK, SupportedService.fromServiceName("Slack").orElseThrow());
        assertFalse(SupportedService.fromServiceName("erp").isPresent());
        assertFalse(SupportedService.fromServiceName(null).isPresent());
        assertTrue(SupportedService.ZENDESK.isHostSpecific());
        assertFalse(SupportedService.HUBSPOT.isHostSpecific());
    }
}
