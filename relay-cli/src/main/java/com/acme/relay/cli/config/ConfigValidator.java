package com.acme.relay.cli.config;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.ConfigurationException;

import java.util.regex.Pattern;

/** Startup checks on the relay settings. The first violation is reported. */
public final class ConfigValidator {

    static final Pattern ENDPOINT_ID = Pattern.compile("^\\d{10,15}@c\\.us$");

    private ConfigValidator() {
    }

    public static void validate(RelayConfig config) {
        requireEndpoint("RELAY_ENDPOINT_A", config.getEndpointA());
        requireEndpoint("RELAY_ENDPOINT_B", config.getEndpointB());
        if (config.getEndpointA().equals(config.getEndpointB())) {
            throw new ConfigurationException("RELAY_ENDPOINT_A and RELAY_ENDPOINT_B must be different");
        }
        if (config.getRetryAttempts() < 0) {
            throw new ConfigurationException("RELAY_RETRY_ATTEMPTS must not be negative");
        }
        if (config.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("RELAY_BACKOFF_MULTIPLIER must be at least 1.0");
        }
        if (config.getMaxReconnectAttempts() < 1) {
            throw new ConfigurationException("RELAY_MAX_RECONNECT_ATTEMPTS must be at least 1");
        }
        if (config.getRetryDelay().isNegative() || config.getMaxDelay().compareTo(config.getRetryDelay()) < 0) {
            throw new ConfigurationException("RELAY_MAX_DELAY_MS must not be below RELAY_RETRY_DELAY_MS");
        }
        if (config.getReadyTimeout().isNegative() || config.getReadyTimeout().isZero()) {
            throw new ConfigurationException("RELAY_READY_TIMEOUT_MS must be positive");
        }
    }

    private static void requireEndpoint(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(key + " is required");
        }
        if (!ENDPOINT_ID.matcher(value).matches()) {
            throw new ConfigurationException(
                    key + " has invalid format: " + value + " (expected digits followed by @c.us)");
        }
    }
}
