package com.redhat.cdsync.engine.store;

import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;

/**
 * A lazy, unbounded sequence of change events for one kind. {@link #hasNext()} blocks until an event arrives
 * and only returns false once the stream has been closed, by the caller or by the server.
 */
public interface WatchStream extends Iterator<WatchEvent>, AutoCloseable {

    Optional<WatchEvent> poll(Duration timeout) throws InterruptedException;

    boolean isClosed();

    @Override
    void close();
}
