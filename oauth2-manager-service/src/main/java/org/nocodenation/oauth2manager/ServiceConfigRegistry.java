package org.nocodenation.oauth2manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the OAuth 2.0 configuration of every registered service.
 * <p>
 * Configurations are registered once per service at startup. Registering a service again
 * replaces its configuration.
 */
public class ServiceConfigRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceConfigRegistry.class);

    private final Map<String, ServiceConfig> configs = new ConcurrentHashMap<>();

    // registration order, for listings
    private final List<String> serviceNames = new CopyOnWriteArrayList<>();

    /**
     * Stores the configuration for a service, replacing any previous one.
     *
     * @param serviceName the service name
     * @param config the configuration
     */
    public void register(String serviceName, ServiceConfig config) {
        if (configs.put(serviceName, config) == null) {
            serviceNames.add(serviceName);
            LOGGER.debug("Registered OAuth2 configuration for service {}", serviceName);
        } else {
            LOGGER.debug("Replaced OAuth2 configuration for service {}", serviceName);
        }
    }

    /**
     * Stores the configuration under its own service name.
     *
     * @param config the configuration
     */
    public void register(ServiceConfig config) {
        register(config.getServiceName(), config);
    }

    /**
     * Gets the configuration of a service.
     *
     * @param serviceName the service name
     * @return the configuration
     * @throws ConfigurationException if the service was never registered
     */
    public ServiceConfig get(String serviceName) throws ConfigurationException {
        ServiceConfig config = serviceName == null ? null : configs.get(serviceName);
        if (config == null) {
            throw new ConfigurationException(serviceName);
        }
        return config;
    }

    public boolean contains(String serviceName) {
        return serviceName != null && configs.containsKey(serviceName);
    }

    /**
     * Lists the registered services in registration order.
     *
     * @return the service names
     */
    public List<String> getServiceNames() {
        return new ArrayList<>(serviceNames);
    }
}
