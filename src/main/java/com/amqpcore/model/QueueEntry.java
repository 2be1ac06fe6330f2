package com.amqpcore.model;

import com.amqpcore.store.StoredMessage;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One placement of a stored message in a queue.
 */
public class QueueEntry {
    public static final long NO_EXPIRY = Long.MAX_VALUE;

    private final long seq;
    private final StoredMessage storedMessage;
    private final long enqueuedAt;
    private final long expiresAt;
    private volatile boolean redelivered;
    private final AtomicBoolean removed = new AtomicBoolean(false);

    public QueueEntry(long seq, StoredMessage storedMessage, long enqueuedAt, long expiresAt) {
        this.seq = seq;
        this.storedMessage = storedMessage;
        this.enqueuedAt = enqueuedAt;
        this.expiresAt = expiresAt;
    }

    public long getSeq() {
        return seq;
    }

    public StoredMessage getStoredMessage() {
        return storedMessage;
    }

    public Message getMessage() {
        return storedMessage.getMessage();
    }

    public long getEnqueuedAt() {
        return enqueuedAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(long now) {
        return expiresAt != NO_EXPIRY && now >= expiresAt;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public void markRedelivered() {
        this.redelivered = true;
    }

    public boolean isRemoved() {
        return removed.get();
    }

    /**
     * Claims the right to drop this entry's message reference. Only the first caller wins.
     */
    public boolean markRemoved() {
        return removed.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return String.format("QueueEntry{seq=%d, message=%d, redelivered=%s}",
                seq, storedMessage.getId(), redelivered);
    }
}
