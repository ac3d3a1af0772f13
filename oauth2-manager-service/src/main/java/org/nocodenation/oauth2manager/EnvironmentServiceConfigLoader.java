package org.nocodenation.oauth2manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the configurations of the {@link SupportedService}s from environment variables.
 * <p>
 * A service is configured when both {@code <SERVICE>_CLIENT_ID} and {@code <SERVICE>_CLIENT_SECRET}
 * are set. Shopify additionally needs {@code SHOPIFY_SHOP_DOMAIN} and Zendesk
 * {@code ZENDESK_SUBDOMAIN}; {@code SALESFORCE_SANDBOX=true} selects the Salesforce sandbox.
 * Each service's redirect URI is {@code OAUTH_REDIRECT_URI} (default
 * {@value #DEFAULT_REDIRECT_URI}) followed by {@code /<service>}.
 */
public class EnvironmentServiceConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentServiceConfigLoader.class);

    public static final String REDIRECT_URI = "OAUTH_REDIRECT_URI";
    public static final String DEFAULT_REDIRECT_URI = "http://localhost:8000/oauth/callback";

    private final Map<String, String> env;

    /**
     * Creates a loader.
     *
     * @param env the environment, usually {@link System#getenv()}
     */
    public EnvironmentServiceConfigLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Builds the configuration of every service whose credentials are present.
     *
     * @return the configurations, in {@link SupportedService} order
     */
    public List<ServiceConfig> loadConfigs() {
        String redirectBase = valueOf(REDIRECT_URI);
        if (redirectBase == null) {
            redirectBase = DEFAULT_REDIRECT_URI;
        }
        if (redirectBase.endsWith("/")) {
            redirectBase = redirectBase.substring(0, redirectBase.length() - 1);
        }

        List<ServiceConfig> configs = new ArrayList<>();
        for (SupportedService service : SupportedService.values()) {
            String prefix = service.name();
            String clientId = valueOf(prefix + "_CLIENT_ID");
            String clientSecret = valueOf(prefix + "_CLIENT_SECRET");
            if (clientId == null || clientSecret == null) {
                LOGGER.debug("No credentials for service {}, skipping", service.getServiceName());
                continue;
            }

            String redirectUri = redirectBase + "/" + service.getServiceName();
            ServiceConfig config = buildConfig(service, clientId, clientSecret, redirectUri);
            if (config != null) {
                configs.add(config);
            }
        }
        return configs;
    }

    /**
     * Registers every configured service.
     *
     * @param registry the registry to fill
     * @return the number of services registered
     */
    public int registerAll(ServiceConfigRegistry registry) {
        List<ServiceConfig> configs = loadConfigs();
        configs.forEach(registry::register);
        LOGGER.info("Registered {} OAuth2 services from the environment", configs.size());
        return configs.size();
    }

    private ServiceConfig buildConfig(SupportedService service, String clientId, String clientSecret, String redirectUri) {
        switch (service) {
            case SALESFORCE:
                String sandbox = valueOf("SALESFORCE_SANDBOX");
                return ServiceConfigs.salesforce(clientId, clientSecret, redirectUri,
                        sandbox != null && sandbox.toLowerCase(Locale.ROOT).equals("true"));
            case SHOPIFY:
                String shopDomain = valueOf("SHOPIFY_SHOP_DOMAIN");
                if (shopDomain == null) {
                    LOGGER.warn("SHOPIFY_SHOP_DOMAIN is not set, skipping service shopify");
                    return null;
                }
                return ServiceConfigs.shopify(clientId, clientSecret, redirectUri, shopDomain);
            case HUBSPOT:
                return ServiceConfigs.hubspot(clientId, clientSecret, redirectUri);
            case SLACK:
                return ServiceConfigs.slack(clientId, clientSecret, redirectUri);
            case CALENDLY:
                return ServiceConfigs.calendly(clientId, clientSecret, redirectUri);
            case ZENDESK:
                String subdomain = valueOf("ZENDESK_SUBDOMAIN");
                if (subdomain == null) {
                    LOGGER.warn("ZENDESK_SUBDOMAIN is not set, skipping service zendesk");
                    return null;
                }
                return ServiceConfigs.zendesk(clientId, clientSecret, redirectUri, subdomain);
            default:
                throw new IllegalStateException("Unhandled service " + service);
        }
    }

    private String valueOf(String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
