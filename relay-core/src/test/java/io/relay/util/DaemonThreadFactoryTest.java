package io.relay.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNamedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("relay-delivery-");

        Thread thread = factory.newThread(() -> {
        });

        assertTrue(thread.isDaemon());
        assertEquals("relay-delivery-1", thread.getName());
    }

    @Test
    void numbersThreadsPerFactory() {
        DaemonThreadFactory pollers = new DaemonThreadFactory("relay-poller-");
        DaemonThreadFactory purgers = new DaemonThreadFactory("relay-purge-");

        pollers.newThread(() -> {
        });
        Thread second = pollers.newThread(() -> {
        });
        Thread first = purgers.newThread(() -> {
        });

        assertEquals("relay-poller-2", second.getName());
        assertEquals("relay-purge-1", first.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () ->
                new DaemonThreadFactory(null));
    }

    @Test
    void emptyPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () ->
                new DaemonThreadFactory(""));
    }

    @Test
    void installsUncaughtExceptionHandler() {
        Thread thread = new DaemonThreadFactory("relay-incoming-").newThread(() -> {
        });

        assertNotSame(thread.getThreadGroup(), thread.getUncaughtExceptionHandler());
        thread.getUncaughtExceptionHandler().uncaughtException(thread, new IllegalStateException("boom"));
    }
}
