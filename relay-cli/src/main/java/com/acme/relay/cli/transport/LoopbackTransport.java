package com.acme.relay.cli.transport;

import com.acme.relay.spi.InboundMessage;
import com.acme.relay.spi.MediaPayload;
import com.acme.relay.spi.MessageContent;
import com.acme.relay.spi.MessagingTransport;
import com.acme.relay.spi.SendOptions;
import com.acme.relay.spi.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Console transport for dry runs. Each input line {@code <sender> <text>} is an inbound message;
 * a text starting with {@code [media]} is a media message whose caption is the rest of the line.
 * Outbound messages are printed as {@code -> <destination>: <text>}.
 */
public class LoopbackTransport implements MessagingTransport {
    private static final Logger logger = LoggerFactory.getLogger(LoopbackTransport.class);

    static final String MEDIA_MARKER = "[media]";
    static final MediaPayload PLACEHOLDER_MEDIA =
            new MediaPayload("text/plain", "bG9vcGJhY2s=", "loopback.txt");

    private final InputStream input;
    private final PrintStream output;
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Thread reader;
    private volatile boolean destroyed;

    public LoopbackTransport(InputStream input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    @Override
    public synchronized void initialize() {
        if (destroyed) {
            throw new IllegalStateException("Loopback transport already destroyed");
        }
        listeners.forEach(TransportListener::onAuthenticated);
        listeners.forEach(TransportListener::onReady);
        if (reader == null) {
            reader = new Thread(this::readLoop, "loopback-reader");
            reader.setDaemon(true);
            reader.start();
        }
    }

    @Override
    public synchronized void destroy() {
        destroyed = true;
        if (reader != null) {
            reader.interrupt();
            reader = null;
        }
    }

    @Override
    public void send(String destination, MessageContent content, SendOptions options) {
        if (destroyed) {
            throw new IllegalStateException("Loopback transport unavailable");
        }
        if (content instanceof MessageContent.Text text) {
            output.println("-> " + destination + ": " + text.body());
        } else if (content instanceof MessageContent.Media media) {
            output.println("-> " + destination + ": <" + media.payload().mimeType() + "> "
                    + options.captionValue().orElse(""));
        }
        output.flush();
    }

    @Override
    public Optional<MediaPayload> downloadMedia(InboundMessage message) {
        return Optional.of(PLACEHOLDER_MEDIA);
    }

    private void readLoop() {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (!destroyed && (line = in.readLine()) != null) {
                processLine(line);
            }
        } catch (IOException e) {
            logger.error("Loopback input failed", e);
        }
        if (!destroyed) {
            logger.info("Loopback input closed");
            listeners.forEach(l -> l.onDisconnected("input closed"));
        }
    }

    /** Parses one input line and hands the message to the listeners; blank or malformed lines are skipped. */
    void processLine(String line) {
        String trimmed = line.trim();
        int space = trimmed.indexOf(' ');
        if (trimmed.isEmpty() || space < 0) {
            logger.warn("Ignoring loopback line without text: \"{}\"", line);
            return;
        }
        String sender = trimmed.substring(0, space);
        String text = trimmed.substring(space + 1).trim();
        String id = UUID.randomUUID().toString();
        InboundMessage message = text.startsWith(MEDIA_MARKER)
                ? InboundMessage.media(id, sender, text.substring(MEDIA_MARKER.length()).trim())
                : InboundMessage.text(id, sender, text);
        for (TransportListener listener : listeners) {
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                logger.error("Listener failed on loopback message id={}", id, e);
            }
        }
    }
}
