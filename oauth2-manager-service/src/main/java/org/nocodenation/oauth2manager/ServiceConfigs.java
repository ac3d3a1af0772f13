package org.nocodenation.oauth2manager;

/**
 * Builds {@link ServiceConfig}s for the {@link SupportedService}s with their default scopes.
 */
public final class ServiceConfigs {

    private ServiceConfigs() {
    }

    /**
     * Builds a Salesforce configuration.
     *
     * @param sandbox true to authorize against test.salesforce.com instead of login.salesforce.com
     */
    public static ServiceConfig salesforce(String clientId, String clientSecret, String redirectUri, boolean sandbox) {
        return build(SupportedService.SALESFORCE, sandbox ? "test.salesforce.com" : "login.salesforce.com",
                clientId, clientSecret, redirectUri);
    }

    /**
     * Builds a Shopify configuration.
     *
     * @param shopDomain the shop's domain, e.g. "example.myshopify.com"
     */
    public static ServiceConfig shopify(String clientId, String clientSecret, String redirectUri, String shopDomain) {
        return build(SupportedService.SHOPIFY, shopDomain, clientId, clientSecret, redirectUri);
    }

    public static ServiceConfig hubspot(String clientId, String clientSecret, String redirectUri) {
        return build(SupportedService.HUBSPOT, null, clientId, clientSecret, redirectUri);
    }

    public static ServiceConfig slack(String clientId, String clientSecret, String redirectUri) {
        return build(SupportedService.SLACK, null, clientId, clientSecret, redirectUri);
    }

    public static ServiceConfig calendly(String clientId, String clientSecret, String redirectUri) {
        return build(SupportedService.CALENDLY, null, clientId, clientSecret, redirectUri);
    }

    /**
     * Builds a Zendesk configuration.
     *
     * @param subdomain the account's subdomain, e.g. "example" for example.zendesk.com
     */
    public static ServiceConfig zendesk(String clientId, String clientSecret, String redirectUri, String subdomain) {
        if (subdomain == null || subdomain.isBlank()) {
            throw new IllegalArgumentException("A subdomain is required for service zendesk");
        }
        return build(SupportedService.ZENDESK, subdomain.trim() + ".zendesk.com", clientId, clientSecret, redirectUri);
    }

    private static ServiceConfig build(SupportedService service, String host, String clientId, String clientSecret,
                                       String redirectUri) {
        return new ServiceConfig(service.getServiceName(), clientId, clientSecret,
                service.getAuthorizationEndpoint(host), service.getTokenEndpoint(host), redirectUri,
                service.getDefaultScope());
    }
}
