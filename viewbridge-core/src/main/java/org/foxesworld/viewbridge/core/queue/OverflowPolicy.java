package org.foxesworld.viewbridge.core.queue;

/**
 * What a {@link BoundedQueue} does when an entry arrives while it is full.
 */
public enum OverflowPolicy {

    /** Keep what is queued, drop the incoming entry. */
    REJECT_NEWEST,

    /** Discard the oldest queued entry to admit the incoming one. */
    EVICT_OLDEST
}
