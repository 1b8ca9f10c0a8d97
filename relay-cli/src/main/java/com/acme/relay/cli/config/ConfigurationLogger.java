package com.acme.relay.cli.config;

import com.acme.relay.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the effective settings once at startup. Endpoint ids are masked. */
public final class ConfigurationLogger {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLogger.class);

    private ConfigurationLogger() {
    }

    public static void log(RelayConfig config, String transportName) {
        logger.info("Relay configuration loaded:");
        logger.info("  transport={}", transportName);
        logger.info("  endpointA={} prefixA=\"{}\"", mask(config.getEndpointA()), config.getPrefixA());
        logger.info("  endpointB={} prefixB=\"{}\"", mask(config.getEndpointB()), config.getPrefixB());
        logger.info("  retryAttempts={} retryDelay={}ms maxDelay={}ms backoffMultiplier={}",
                config.getRetryAttempts(), config.getRetryDelay().toMillis(),
                config.getMaxDelay().toMillis(), config.getBackoffMultiplier());
        logger.info("  rateLimitDelay={}ms maxReconnectAttempts={} readyTimeout={}ms",
                config.getRateLimitDelay().toMillis(), config.getMaxReconnectAttempts(),
                config.getReadyTimeout().toMillis());
        logger.info("  stateFile={} sessionDirectory={} memoryThreshold={}MB",
                config.getStateFile(), config.getSessionDirectory(), config.getMemoryThresholdMb());
    }

    /** Keeps the last four digits of the number and the domain. */
    static String mask(String endpoint) {
        if (endpoint == null) {
            return "<unset>";
        }
        int at = endpoint.indexOf('@');
        String number = at < 0 ? endpoint : endpoint.substring(0, at);
        String domain = at < 0 ? "" : endpoint.substring(at);
        if (number.length() <= 4) {
            return endpoint;
        }
        return "*".repeat(number.length() - 4) + number.substring(number.length() - 4) + domain;
    }
}
