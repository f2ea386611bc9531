package org.foxesworld.viewbridge.core.queue;

/**
 * Output mailbox: keeps a trailing window of the most recent {@code capacity} entries.
 */
public final class EvictOldestRing<T> extends BoundedQueue<T> {

    public EvictOldestRing(int capacity) {
        super(capacity);
    }

    @Override
    public OverflowPolicy policy() {
        return OverflowPolicy.EVICT_OLDEST;
    }
}
