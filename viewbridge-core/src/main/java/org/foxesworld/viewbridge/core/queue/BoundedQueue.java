// FILE: BoundedQueue.java
package org.foxesworld.viewbridge.core.queue;

// Author: Calista Verner

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Fixed-capacity FIFO mailbox with a fixed overflow policy.
 *
 * <p>Storage is a ring (head/tail/count) allocated once. Every operation runs under the
 * queue's own monitor, so producers on caller threads and the draining owner thread
 * may touch the same queue concurrently.</p>
 *
 * <p>{@link #drain(Consumer)} empties the queue under the lock, then hands the entries
 * to the consumer outside of it. The owner thread drains input this way on every tick.</p>
 */
public abstract class BoundedQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(BoundedQueue.class);

    private final Object lock = new Object();
    private final Object[] ring;

    private int head;   // next write
    private int tail;   // oldest entry
    private int count;
    private long dropped;

    protected BoundedQueue(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        this.ring = new Object[capacity];
    }

    public abstract OverflowPolicy policy();

    /**
     * Enqueue an entry.
     *
     * @return true if the entry is now queued, false if it was dropped
     */
    public final boolean offer(T item) {
        return offerIf(null, item);
    }

    /**
     * Enqueue an entry if {@code admit} still holds. The condition is evaluated under the
     * queue lock, so an owner that invalidates it and then calls {@link #clear()} never
     * sees the entry survive.
     *
     * @param admit checked under the lock; null admits unconditionally
     * @return true if the entry is now queued
     */
    public final boolean offerIf(BooleanSupplier admit, T item) {
        if (item == null) throw new IllegalArgumentException("null entries are not allowed");
        synchronized (lock) {
            if (admit != null && !admit.getAsBoolean()) return false;
            if (count == ring.length) {
                if (policy() == OverflowPolicy.REJECT_NEWEST) {
                    dropped++;
                    if (log.isTraceEnabled()) log.trace("queue full (cap={}), rejected newest entry", ring.length);
                    return false;
                }
                ring[tail] = null;
                tail = (tail + 1) % ring.length;
                count--;
                dropped++;
            }
            ring[head] = item;
            head = (head + 1) % ring.length;
            count++;
            return true;
        }
    }

    /** Pop the oldest entry, or null when empty. */
    @SuppressWarnings("unchecked")
    public final T poll() {
        synchronized (lock) {
            if (count == 0) return null;
            T item = (T) ring[tail];
            ring[tail] = null;
            tail = (tail + 1) % ring.length;
            count--;
            return item;
        }
    }

    /**
     * Remove every queued entry in insertion order and pass each one to {@code sink}.
     *
     * @return number of entries drained
     */
    public final int drain(Consumer<? super T> sink) {
        List<T> batch = takeAll();
        for (T item : batch) sink.accept(item);
        return batch.size();
    }

    /** Remove and return every queued entry, oldest first. */
    @SuppressWarnings("unchecked")
    public final List<T> takeAll() {
        synchronized (lock) {
            if (count == 0) return Collections.emptyList();
            List<T> out = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                int idx = (tail + i) % ring.length;
                out.add((T) ring[idx]);
                ring[idx] = null;
            }
            head = tail = count = 0;
            return out;
        }
    }

    public final void clear() {
        synchronized (lock) {
            java.util.Arrays.fill(ring, null);
            head = tail = count = 0;
        }
    }

    public final int size() {
        synchronized (lock) { return count; }
    }

    public final boolean isEmpty() {
        return size() == 0;
    }

    public final int capacity() {
        return ring.length;
    }

    /** Entries lost to the overflow policy since creation. */
    public final long dropped() {
        synchronized (lock) { return dropped; }
    }
}
