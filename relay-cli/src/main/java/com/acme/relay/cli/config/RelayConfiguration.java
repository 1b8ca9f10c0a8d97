package com.acme.relay.cli.config;

import com.acme.relay.config.RelayConfig;
import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Relay settings read from a {@code .env} file and the process environment. Environment
 * variables win over the file; anything unset keeps the {@link RelayConfig} default.
 */
public class RelayConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(RelayConfiguration.class);

    public static final String DEFAULT_TRANSPORT = "loopback";

    private final Dotenv dotenv;

    public RelayConfiguration(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /**
     * @param directory where to look for {@code .env}; null for the working directory
     */
    public static RelayConfiguration load(Path directory) {
        try {
            DotenvBuilder builder = Dotenv.configure().ignoreIfMissing();
            if (directory != null) {
                builder.directory(directory.toString());
            }
            Dotenv dotenv = builder.load();
            logger.info("Configuration loaded successfully");
            return new RelayConfiguration(dotenv);
        } catch (Exception e) {
            logger.warn("Failed to load .env file", e);
            throw new IllegalStateException("Failed to initialize configuration", e);
        }
    }

    String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    long getLong(String key, long defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    double getDouble(String key, double defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid number value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private Duration getMillis(String key, Duration defaultValue) {
        return Duration.ofMillis(getLong(key, defaultValue.toMillis()));
    }

    public String getTransportName() {
        return get("RELAY_TRANSPORT", DEFAULT_TRANSPORT);
    }

    /** Builds the relay settings; validation is left to {@link ConfigValidator}. */
    public RelayConfig toRelayConfig() {
        RelayConfig defaults = new RelayConfig();
        RelayConfig config = new RelayConfig();

        // Endpoints
        config.setEndpointA(get("RELAY_ENDPOINT_A", null));
        config.setEndpointB(get("RELAY_ENDPOINT_B", null));
        config.setPrefixA(get("RELAY_PREFIX_A", defaults.getPrefixA()));
        config.setPrefixB(get("RELAY_PREFIX_B", defaults.getPrefixB()));

        // Retry
        config.setRetryAttempts(getInt("RELAY_RETRY_ATTEMPTS", defaults.getRetryAttempts()));
        config.setRetryDelay(getMillis("RELAY_RETRY_DELAY_MS", defaults.getRetryDelay()));
        config.setMaxDelay(getMillis("RELAY_MAX_DELAY_MS", defaults.getMaxDelay()));
        config.setBackoffMultiplier(getDouble("RELAY_BACKOFF_MULTIPLIER", defaults.getBackoffMultiplier()));
        config.setRateLimitDelay(getMillis("RELAY_RATE_LIMIT_DELAY_MS", defaults.getRateLimitDelay()));

        // Session
        config.setMaxReconnectAttempts(
                getInt("RELAY_MAX_RECONNECT_ATTEMPTS", defaults.getMaxReconnectAttempts()));
        config.setReadyTimeout(getMillis("RELAY_READY_TIMEOUT_MS", defaults.getReadyTimeout()));
        config.setSessionDirectory(
                Path.of(get("RELAY_SESSION_DIR", defaults.getSessionDirectory().toString())));

        // Housekeeping
        config.setStateFile(Path.of(get("RELAY_STATE_FILE", defaults.getStateFile().toString())));
        config.setMemoryThresholdMb(getLong("RELAY_MEMORY_THRESHOLD_MB", defaults.getMemoryThresholdMb()));
        return config;
    }
}
