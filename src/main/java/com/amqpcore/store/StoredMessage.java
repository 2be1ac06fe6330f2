package com.amqpcore.store;

import com.amqpcore.model.Message;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A message held by the {@link MessageStore}, shared by every queue entry that references it.
 */
public final class StoredMessage {
    private final long id;
    private final Message message;
    private final AtomicInteger refCount;
    private volatile boolean persisted;

    StoredMessage(long id, Message message, int initialReferences) {
        this.id = id;
        this.message = message;
        this.refCount = new AtomicInteger(initialReferences);
    }

    public long getId() {
        return id;
    }

    public Message getMessage() {
        return message;
    }

    public int getRefCount() {
        return refCount.get();
    }

    int incrementRefs() {
        return refCount.incrementAndGet();
    }

    int decrementRefs() {
        return refCount.decrementAndGet();
    }

    /**
     * True once a durable copy of this message has been written.
     */
    public boolean isPersisted() {
        return persisted;
    }

    public void markPersisted() {
        this.persisted = true;
    }

    @Override
    public String toString() {
        return String.format("StoredMessage{id=%d, refs=%d, persisted=%s}", id, refCount.get(), persisted);
    }
}
