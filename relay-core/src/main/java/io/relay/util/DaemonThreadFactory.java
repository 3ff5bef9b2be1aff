package io.relay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the relay background components: delivery workers, pollers,
 * purge schedulers and inbound processors.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, ... and are daemon threads,
 * so an application that forgets to close its {@link io.relay.Relay} still exits. A task
 * that dies with an uncaught exception is logged against its thread name.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, error) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + thread.getName(), error);

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix cannot be empty");
        }
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return thread;
    }
}
