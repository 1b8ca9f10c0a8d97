package com.acme.relay.cli.commands;

import com.acme.relay.RelayContext;
import com.acme.relay.cli.config.ConfigValidator;
import com.acme.relay.cli.config.ConfigurationLogger;
import com.acme.relay.cli.config.RelayConfiguration;
import com.acme.relay.cli.shutdown.ExitTerminator;
import com.acme.relay.cli.transport.TransportLoader;
import com.acme.relay.config.RelayConfig;
import com.acme.relay.core.ConfigurationException;
import com.acme.relay.endpoint.PairedEndpointDirectory;
import com.acme.relay.scheduler.ExecutorScheduler;
import com.acme.relay.shutdown.ShutdownHandler;
import com.acme.relay.spi.MessagingTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Start relaying messages between the two configured endpoints")
public class RunCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-e", "--env-dir"}, description = "Directory containing the .env file (default: working directory)")
    private Path envDir;

    @Option(names = {"-t", "--transport"}, description = "Messaging transport to use (default: RELAY_TRANSPORT or loopback)")
    private String transport;

    @Override
    public Integer call() throws Exception {
        logger.info("Starting message relay...");

        RelayConfiguration configuration = RelayConfiguration.load(envDir);
        RelayConfig config = configuration.toRelayConfig();
        String transportName = transport != null ? transport : configuration.getTransportName();
        MessagingTransport session;
        try {
            ConfigValidator.validate(config);
            ConfigurationLogger.log(config, transportName);
            session = TransportLoader.load(transportName, config);
        } catch (ConfigurationException e) {
            logger.error("Failed to start relay: {}", e.getMessage());
            return ShutdownHandler.EXIT_FATAL;
        }

        ExitTerminator terminator = new ExitTerminator();
        RelayContext context = RelayContext.create(
                config,
                session,
                PairedEndpointDirectory.from(config),
                new ExecutorScheduler(),
                terminator);
        ShutdownHandler shutdownHandler = context.getShutdownHandler();

        context.getCounters().load();
        context.getCounters().startAutoSave(config.getAutoSaveInterval());
        context.getMemoryMonitor().start();

        installProcessHooks(shutdownHandler, terminator);

        try {
            context.getSupervisor().initialize();
        } catch (RuntimeException e) {
            // the supervisor is FAILED by now and its listener has started the shutdown
            logger.error("Failed to initialize messaging session: {}", e.getMessage(), e);
            return terminator.awaitExit();
        }

        logger.info("Waiting for messaging session to become ready (timeout={}ms)...",
                config.getReadyTimeout().toMillis());
        if (!context.getSupervisor().awaitReady(config.getReadyTimeout())) {
            logger.error("Messaging session did not become ready (state={})", context.getSupervisor().getState());
            shutdownHandler.shutdown(ShutdownHandler.EXIT_FATAL);
            return terminator.awaitExit();
        }

        context.getRelayService().start();
        logger.info("Message relay is running endpointA={} endpointB={}",
                config.getEndpointA(), config.getEndpointB());
        return terminator.awaitExit();
    }

    private static void installProcessHooks(ShutdownHandler shutdownHandler, ExitTerminator terminator) {
        Thread.setDefaultUncaughtExceptionHandler((thread, e) -> {
            logger.error("Uncaught exception on thread {}", thread.getName(), e);
            shutdownHandler.shutdown(ShutdownHandler.EXIT_FATAL);
        });
        Thread hook = new Thread(() -> {
            logger.info("Received termination signal");
            shutdownHandler.shutdown(ShutdownHandler.EXIT_OK);
        }, "relay-shutdown-hook");
        terminator.setShutdownHook(hook);
        Runtime.getRuntime().addShutdownHook(hook);
    }
}
