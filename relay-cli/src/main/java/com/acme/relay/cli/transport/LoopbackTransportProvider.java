package com.acme.relay.cli.transport;

import com.acme.relay.config.RelayConfig;
import com.acme.relay.spi.MessagingTransport;
import com.acme.relay.spi.MessagingTransportProvider;

/** Registers {@link LoopbackTransport} under the name {@code loopback}, wired to stdin/stdout. */
public class LoopbackTransportProvider implements MessagingTransportProvider {

    @Override
    public String name() {
        return "loopback";
    }

    @Override
    public MessagingTransport create(RelayConfig config) {
        return new LoopbackTransport(System.in, System.out);
    }
}
