package org.foxesworld.viewbridge.core.queue;

/**
 * Input mailbox: once full, new entries are silently dropped until the queue is drained.
 */
public final class RejectNewestQueue<T> extends BoundedQueue<T> {

    public RejectNewestQueue(int capacity) {
        super(capacity);
    }

    @Override
    public OverflowPolicy policy() {
        return OverflowPolicy.REJECT_NEWEST;
    }
}
