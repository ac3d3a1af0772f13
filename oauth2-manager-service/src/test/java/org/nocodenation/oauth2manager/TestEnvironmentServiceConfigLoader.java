package org.nocodenation.oauth2manager;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TestEnvironmentServiceConfigLoader {

    @Test
    public void testOnlyServicesWithCredentialsAreConfigured() {
        Map<String, String> env = new HashMap<>();
        env.put("HUBSPOT_CLIENT_ID", "hub-id");
        env.put("HUBSPOT_CLIENT_SECRET", "hub-secret");
        env.put("SLACK_CLIENT_ID", "slack-id");
        // no SLACK_CLIENT_SECRET

        List<ServiceConfig> configs = new EnvironmentServiceConfigLoader(env).loadConfigs();

        assertEquals(1, configs.size());
        assertEquals("hubspot", configs.get(0).getServiceName());
        assertEquals("hub-id", configs.get(0).getClientId());
        assertEquals("http://localhost:8000/oauth/callback/hubspot", configs.get(0).getRedirectUri());
    }

    @Test
    public void testHostSpecificServicesNeedTheirHost() {
        Map<String, String> env = new HashMap<>();
        env.put("SHOPIFY_CLIENT_ID", "shop-id");
        env.put("SHOPIFY_CLIENT_SECRET", "shop-secret");
        env.put("ZENDESK_CLIENT_ID", "zd-id");
        env.put("ZENDESK_CLIENT_SECRET", "zd-secret");
        env.put("ZENDESK_SUBDOMAIN", "acme");

        List<ServiceConfig> configs = new EnvironmentServiceConfigLoader(env).loadConfigs();

        assertEquals(1, configs.size(), "Shopify without a shop domain should be skipped");
        assertEquals("https://acme.zendesk.com/oauth/tokens", configs.get(0).getTokenUrl());
    }

    @Test
    public void testAllServices() {
        Map<String, String> env = new HashMap<>();
        for (SupportedService service : SupportedService.values()) {
            env.put(service.name() + "_CLIENT_ID", "id");
            env.put(service.name() + "_CLIENT_SECRET", "secret");
        }
        env.put("SALESFORCE_SANDBOX", "TRUE");
        env.put("SHOPIFY_SHOP_DOMAIN", "acme.myshopify.com");
        env.put("ZENDESK_SUBDOMAIN", "acme");
        env.put("OAUTH_REDIRECT_URI", "https://app.example.com/oauth/callback/");

        ServiceConfigRegistry registry = new ServiceConfigRegistry();
        int registered = new EnvironmentServiceConfigLoader(env).registerAll(registry);

        assertEquals(6, registered);
        assertEquals(Arrays.asList("salesforce", "shopify", "hubspot", "slack", "calendly", "zendesk"),
                registry.getServiceNames());

        List<String> redirectUris = new EnvironmentServiceConfigLoader(env).loadConfigs().stream()
                .map(ServiceConfig::getRedirectUri)
                .collect(Collectors.toList());
        assertEquals("https://app.example.com/oauth/callback/salesforce", redirectUris.get(0));
    }

    @Test
    public void testSalesforceSandboxFlag() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("SALESFORCE_CLIENT_ID", "sf-id");
        env.put("SALESFORCE_CLIENT_SECRET", "sf-secret");
        env.put("SALESFORCE_SANDBOX", "true");

        ServiceConfigRegistry registry = new ServiceConfigRegistry();
        new EnvironmentServiceConfigLoader(env).registerAll(registry);

        assertTrue(registry.get("salesforce").getAuthorizationUrl().startsWith("https://test.salesforce.com/"));

        env.put("SALESFORCE_SANDBOX", "yes");
        assertTrue(new EnvironmentServiceConfigLoader(env).loadConfigs().get(0).getAuthorizationUrl()
                .startsWith("https://login.salesforce.com/"));
    }
}
