package org.nocodenation.oauth2manager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class TestServiceConfigRegistry {

    private ServiceConfigRegistry registry;

    @BeforeEach
    public void setUp() {
        registry = new ServiceConfigRegistry();
    }

    private static ServiceConfig config(String serviceName, String clientId) {
        return new ServiceConfig(serviceName, clientId, "secret", "https://auth.example.com/authorize",
                "https://auth.example.com/token", "http://localhost/callback", "read");
    }

    @Test
    public void testRegisterAndGet() throws Exception {
        ServiceConfig config = config("slack", "id-1");
        registry.register(config);

        assertSame(config, registry.get("slack"));
        assertTrue(registry.contains("slack"));
    }

    @Test
    public void testUnknownServiceThrows() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.get("unknown"));
        assertEquals("unknown", e.getServiceName());
        assertThrows(ConfigurationException.class, () -> registry.get(null));
        assertFalse(registry.contains(null));
    }

    @Test
    public void testRegisterOverwrites() throws Exception {
        registry.register(config("slack", "id-1"));
        registry.register(config("slack", "id-2"));

        assertEquals("id-2", registry.get("slack").getClientId());
        assertEquals(1, registry.getServiceNames().size());
    }

    @Test
    public void testServiceNamesInRegistrationOrder() {
        registry.register(config("zendesk", "a"));
        registry.register(config("calendly", "b"));
        registry.register("alias", config("hubspot", "c"));

        assertEquals(Arrays.asList("zendesk", "calendly", "alias"), registry.getServiceNames());
    }
}
