package org.nocodenation.oauth2manager;

import java.util.Locale;
import java.util.Optional;

/**
 * Services with built-in OAuth 2.0 endpoint definitions.
 * <p>
 * Endpoints of services hosted per tenant contain a {@code {host}} placeholder that is
 * replaced with the tenant's host name.
 */
public enum SupportedService {
    SALESFORCE("salesforce",
            "https://{host}/services/oauth2/authorize",
            "https://{host}/services/oauth2/token",
            "api refresh_token offline_access"),

    SHOPIFY("shopify",
            "https://{host}/admin/oauth/authorize",
            "https://{host}/admin/oauth/access_token",
            "read_orders,write_orders,read_products,write_products,read_customers,write_customers"),

    HUBSPOT("hubspot",
            "https://app.hubspot.com/oauth/authorize",
            "https://api.hubapi.com/oauth/v1/token",
            "contacts,crm.objects.contacts.read,crm.objects.contacts.write"),

    SLACK("slack",
            "https://slack.com/oauth/v2/authorize",
            "https://slack.com/api/oauth.v2.access",
            "chat:write,channels:read,files:write"),

    CALENDLY("calendly",
            "https://auth.calendly.com/oauth/authorize",
            "https://auth.calendly.com/oauth/token",
            "default"),

    ZENDESK("zendesk",
            "https://{host}/oauth/authorizations/new",
            "https://{host}/oauth/tokens",
            "read write");

    private static final String HOST_PLACEHOLDER = "{host}";

    private final String serviceName;
    private final String authorizationEndpoint;
    private final String tokenEndpoint;
    private final String defaultScope;

    SupportedService(String serviceName, String authorizationEndpoint, String tokenEndpoint, String defaultScope) {
        this.serviceName = serviceName;
        this.authorizationEndpoint = authorizationEndpoint;
        this.tokenEndpoint = tokenEndpoint;
        this.defaultScope = defaultScope;
    }

    /**
     * Finds a supported service by its service name.
     *
     * @param serviceName the service name, e.g. "salesforce"
     * @return the service, or empty if it has no built-in definition
     */
    public static Optional<SupportedService> fromServiceName(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        String normalized = serviceName.trim().toLowerCase(Locale.ROOT);
        for (SupportedService service : values()) {
            if (service.serviceName.equals(normalized)) {
                return Optional.of(service);
            }
        }
        return Optional.empty();
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getDefaultScope() {
        return defaultScope;
    }

    public boolean isHostSpecific() {
        return authorizationEndpoint.contains(HOST_PLACEHOLDER);
    }

    public String getAuthorizationEndpoint(String host) {
        return resolve(authorizationEndpoint, host);
    }

    public String getTokenEndpoint(String host) {
        return resolve(tokenEndpoint, host);
    }

    private String resolve(String endpoint, String host) {
        if (!endpoint.contains(HOST_PLACEHOLDER)) {
            return endpoint;
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("A host is required for service " + serviceName);
        }
        return endpoint.replace(HOST_PLACEHOLDER, host.trim());
    }
}
