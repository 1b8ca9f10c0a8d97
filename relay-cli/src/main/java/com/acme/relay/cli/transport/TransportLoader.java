package com.acme.relay.cli.transport;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.ConfigurationException;
import com.acme.relay.spi.MessagingTransport;
import com.acme.relay.spi.MessagingTransportProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/** Finds a {@link MessagingTransportProvider} on the classpath by name. */
public final class TransportLoader {
    private static final Logger logger = LoggerFactory.getLogger(TransportLoader.class);

    private TransportLoader() {
    }

    public static MessagingTransport load(String name, RelayConfig config) {
        List<String> available = new ArrayList<>();
        for (MessagingTransportProvider provider : ServiceLoader.load(MessagingTransportProvider.class)) {
            if (provider.name().equalsIgnoreCase(name)) {
                logger.info("Using messaging transport: {} ({})", provider.name(), provider.getClass().getName());
                return provider.create(config);
            }
            available.add(provider.name());
        }
        throw new ConfigurationException(
                "unknown RELAY_TRANSPORT \"" + name + "\", available: " + available);
    }
}
