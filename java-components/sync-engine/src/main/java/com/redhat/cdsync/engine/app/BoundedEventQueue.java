package com.redhat.cdsync.engine.app;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;

/**
 * A small FIFO that drops its oldest entry when full, so a burst of events never blocks the producer.
 */
final class BoundedEventQueue<T> {

    private final int capacity;
    private final Deque<T> items = new ArrayDeque<>();
    private long dropped;

    BoundedEventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * @return the entry that was dropped to make room, or null
     */
    synchronized T offer(T item) {
        T evicted = null;
        if (items.size() == capacity) {
            evicted = items.pollFirst();
            dropped++;
        }
        items.addLast(item);
        return evicted;
    }

    synchronized T poll() {
        return items.pollFirst();
    }

    synchronized boolean anyMatch(Predicate<? super T> predicate) {
        for (var i : items) {
            if (predicate.test(i)) {
                return true;
            }
        }
        return false;
    }

    synchronized boolean isEmpty() {
        return items.isEmpty();
    }

    synchronized int size() {
        return items.size();
    }

    synchronized long dropped() {
        return dropped;
    }
}
