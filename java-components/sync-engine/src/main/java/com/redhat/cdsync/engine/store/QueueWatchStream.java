package com.redhat.cdsync.engine.store;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

class QueueWatchStream implements WatchStream {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final Runnable onClose;
    private volatile boolean closed;
    private Object next;

    QueueWatchStream(Runnable onClose) {
        this.onClose = onClose;
    }

    void publish(WatchEvent event) {
        if (!closed) {
            queue.add(event);
        }
    }

    /**
     * Called by the producing side when the underlying watch has terminated.
     */
    void end() {
        closed = true;
        queue.add(END);
    }

    @Override
    public synchronized boolean hasNext() {
        if (next == null) {
            try {
                next = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return next != END;
    }

    @Override
    public synchronized WatchEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        WatchEvent event = (WatchEvent) next;
        next = null;
        return event;
    }

    @Override
    public synchronized Optional<WatchEvent> poll(Duration timeout) throws InterruptedException {
        Object item = next;
        if (item == null) {
            item = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (item == null) {
            return Optional.empty();
        }
        if (item == END) {
            next = END;
            return Optional.empty();
        }
        next = null;
        return Optional.of((WatchEvent) item);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.run();
            queue.add(END);
        }
    }
}
