package org.nocodenation.oauth2manager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Settings of an {@link OAuth2Manager}.
 * <p>
 * Built with {@link #builder()}, or read from environment variables with
 * {@link #fromEnvironment(Map)}:
 * <ul>
 *   <li>{@value #TOKEN_STORE} - token file path, default {@value #DEFAULT_TOKEN_STORE}</li>
 *   <li>{@value #CONNECT_TIMEOUT_SECONDS} - token endpoint connect timeout, default 10</li>
 *   <li>{@value #RESPONSE_TIMEOUT_SECONDS} - token endpoint response timeout, default 30</li>
 *   <li>{@value #PKCE_TTL_SECONDS} - lifetime of a pending authorization, default 600</li>
 *   <li>{@value #PKCE_SWEEP_SECONDS} - interval of the expired authorization sweep, default 60</li>
 *   <li>{@value #EXPIRY_LEEWAY_SECONDS} - how early tokens count as expired, default 0</li>
 * </ul>
 */
public final class OAuth2ManagerSettings {

    public static final String TOKEN_STORE = "OAUTH2_TOKEN_STORE";
    public static final String CONNECT_TIMEOUT_SECONDS = "OAUTH2_CONNECT_TIMEOUT_SECONDS";
    public static final String RESPONSE_TIMEOUT_SECONDS = "OAUTH2_RESPONSE_TIMEOUT_SECONDS";
    public static final String PKCE_TTL_SECONDS = "OAUTH2_PKCE_TTL_SECONDS";
    public static final String PKCE_SWEEP_SECONDS = "OAUTH2_PKCE_SWEEP_SECONDS";
    public static final String EXPIRY_LEEWAY_SECONDS = "OAUTH2_EXPIRY_LEEWAY_SECONDS";

    public static final String DEFAULT_TOKEN_STORE = ".oauth_tokens.json";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(30);

    private final Path tokenStorePath;
    private final Duration connectTimeout;
    private final Duration responseTimeout;
    private final Duration pkceTimeToLive;
    private final Duration pkceSweepInterval;
    private final Duration expiryLeeway;

    private OAuth2ManagerSettings(Builder builder) {
        this.tokenStorePath = builder.tokenStorePath;
        this.connectTimeout = requirePositive(builder.connectTimeout, "connectTimeout");
        this.responseTimeout = requirePositive(builder.responseTimeout, "responseTimeout");
        this.pkceTimeToLive = requirePositive(builder.pkceTimeToLive, "pkceTimeToLive");
        this.pkceSweepInterval = requirePositive(builder.pkceSweepInterval, "pkceSweepInterval");
        if (builder.expiryLeeway == null || builder.expiryLeeway.isNegative()) {
            throw new IllegalArgumentException("expiryLeeway must not be negative");
        }
        this.expiryLeeway = builder.expiryLeeway;
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from environment variables. Unset variables keep their defaults.
     *
     * @param env the environment, usually {@link System#getenv()}
     * @return the settings
     * @throws IllegalArgumentException if a numeric variable is not a valid number of seconds
     */
    public static OAuth2ManagerSettings fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String tokenStore = env.get(TOKEN_STORE);
        if (tokenStore != null && !tokenStore.isBlank()) {
            builder.tokenStorePath(Paths.get(tokenStore.trim()));
        }
        readSeconds(env, CONNECT_TIMEOUT_SECONDS, builder::connectTimeout);
        readSeconds(env, RESPONSE_TIMEOUT_SECONDS, builder::responseTimeout);
        readSeconds(env, PKCE_TTL_SECONDS, builder::pkceTimeToLive);
        readSeconds(env, PKCE_SWEEP_SECONDS, builder::pkceSweepInterval);
        readSeconds(env, EXPIRY_LEEWAY_SECONDS, builder::expiryLeeway);
        return builder.build();
    }

    private static void readSeconds(Map<String, String> env, String name, Consumer<Duration> setter) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return;
        }
        try {
            setter.accept(Duration.ofSeconds(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number of seconds, got '" + value + "'", e);
        }
    }

    /**
     * Gets the token file path.
     *
     * @return the path, or null if tokens are kept in memory only
     */
    public Path getTokenStorePath() {
        return tokenStorePath;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public Duration getPkceTimeToLive() {
        return pkceTimeToLive;
    }

    public Duration getPkceSweepInterval() {
        return pkceSweepInterval;
    }

    public Duration getExpiryLeeway() {
        return expiryLeeway;
    }

    @Override
    public String toString() {
        return "OAuth2ManagerSettings{" +
                "tokenStorePath=" + tokenStorePath +
                ", connectTimeout=" + connectTimeout +
                ", responseTimeout=" + responseTimeout +
                ", pkceTimeToLive=" + pkceTimeToLive +
                ", pkceSweepInterval=" + pkceSweepInterval +
                ", expiryLeeway=" + expiryLeeway +
                '}';
    }

    public static final class Builder {
        private Path tokenStorePath = Paths.get(DEFAULT_TOKEN_STORE);
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
        private Duration pkceTimeToLive = Duration.ofMinutes(10);
        private Duration pkceSweepInterval = Duration.ofSeconds(60);
        private Duration expiryLeeway = Duration.ZERO;

        private Builder() {
        }

        /**
         * Sets the token file path; null keeps tokens in memory only.
         */
        public Builder tokenStorePath(Path tokenStorePath) {
            this.tokenStorePath = tokenStorePath;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder responseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public Builder pkceTimeToLive(Duration pkceTimeToLive) {
            this.pkceTimeToLive = pkceTimeToLive;
            return this;
        }

        public Builder pkceSweepInterval(Duration pkceSweepInterval) {
            this.pkceSweepInterval = pkceSweepInterval;
            return this;
        }

        public Builder expiryLeeway(Duration expiryLeeway) {
            this.expiryLeeway = expiryLeeway;
            return this;
        }

        public OAuth2ManagerSettings build() {
            return new OAuth2ManagerSettings(this);
        }
    }
}
