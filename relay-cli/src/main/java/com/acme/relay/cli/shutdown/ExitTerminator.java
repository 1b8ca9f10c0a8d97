package com.acme.relay.cli.shutdown;

import com.acme.relay.shutdown.ProcessTerminator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.function.IntConsumer;

/**
 * Ends the JVM with the exit code of the shutdown sequence. On the shutdown hook thread the JVM is
 * already exiting and {@code System.exit} would block forever, so only the code is recorded there.
 */
public class ExitTerminator implements ProcessTerminator {
    private static final Logger logger = LoggerFactory.getLogger(ExitTerminator.class);

    private final IntConsumer exit;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Thread shutdownHook;
    private volatile int exitCode;

    public ExitTerminator() {
        this(System::exit);
    }

    ExitTerminator(IntConsumer exit) {
        this.exit = exit;
    }

    public void setShutdownHook(Thread shutdownHook) {
        this.shutdownHook = shutdownHook;
    }

    @Override
    public void terminate(int exitCode) {
        this.exitCode = exitCode;
        terminated.countDown();
        if (Thread.currentThread() == shutdownHook) {
            logger.info("Shutdown hook finished (exitCode={})", exitCode);
            return;
        }
        logger.info("Exiting with code {}", exitCode);
        exit.accept(exitCode);
    }

    /** Blocks until {@link #terminate(int)} ran and returns its exit code. */
    public int awaitExit() throws InterruptedException {
        terminated.await();
        return exitCode;
    }
}
