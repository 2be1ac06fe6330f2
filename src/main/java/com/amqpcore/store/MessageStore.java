package com.amqpcore.store;

import com.amqpcore.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference-counted message bodies for one virtual host. A message routed to N queues is stored
 * once and referenced N times; it is dropped when the last reference is released.
 *
 * <p>{@link #add(Message)} hands back a message holding one reference owned by the caller, so a
 * publish can enqueue it into every target queue and then release its own reference. A message
 * that ended up in no queue is discarded at that point.
 */
public class MessageStore {
    private static final Logger logger = LoggerFactory.getLogger(MessageStore.class);

    private final String virtualHost;
    private final ConcurrentMap<Long, StoredMessage> messages = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private volatile ReleaseListener releaseListener;

    public MessageStore(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public StoredMessage add(Message message) {
        StoredMessage stored = new StoredMessage(nextId.getAndIncrement(), message, 1);
        messages.put(stored.getId(), stored);
        logger.debug("Stored message {} in vhost '{}'", stored.getId(), virtualHost);
        return stored;
    }

    /**
     * Re-creates a message read back from durable storage under its original id. Like
     * {@link #add(Message)} the caller owns one reference. Calling it twice for the same id
     * returns the existing entry with an extra reference.
     */
    public StoredMessage restore(long id, Message message) {
        nextId.accumulateAndGet(id + 1, Math::max);
        StoredMessage existing = messages.get(id);
        if (existing != null) {
            existing.incrementRefs();
            return existing;
        }
        StoredMessage stored = new StoredMessage(id, message, 1);
        stored.markPersisted();
        messages.put(id, stored);
        return stored;
    }

    public void retain(StoredMessage stored) {
        stored.incrementRefs();
    }

    /**
     * Drops one reference. When none remain the message is removed and the release listener
     * is told, so a durable copy can be deleted.
     */
    public void release(StoredMessage stored) {
        int remaining = stored.decrementRefs();
        if (remaining == 0) {
            messages.remove(stored.getId());
            logger.debug("Released message {} in vhost '{}'", stored.getId(), virtualHost);
            ReleaseListener listener = releaseListener;
            if (listener != null) {
                listener.released(stored);
            }
        } else if (remaining < 0) {
            throw new IllegalStateException("Message " + stored.getId() + " released more often than retained");
        }
    }

    public StoredMessage get(long id) {
        return messages.get(id);
    }

    public int size() {
        return messages.size();
    }

    public long peekNextId() {
        return nextId.get();
    }

    public void setReleaseListener(ReleaseListener releaseListener) {
        this.releaseListener = releaseListener;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    @FunctionalInterface
    public interface ReleaseListener {
        void released(StoredMessage message);
    }
}
