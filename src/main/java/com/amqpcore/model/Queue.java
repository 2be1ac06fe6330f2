package com.amqpcore.model;

import com.amqpcore.amqp.ChannelException;
import com.amqpcore.store.StoredMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A named, ordered container of message references.
 *
 * <p>Ready entries wait in FIFO order; entries handed to an explicit-ack consumer move to the
 * acquired set until they are settled. Every state change happens under the queue's own lock, which
 * callers may also hold across several operations (see {@link #getLock()}).
 *
 * <p>The queue only tracks references. Retaining and releasing the stored message is the caller's job,
 * so entries returned by {@link #purge()}, {@link #drain()}, {@link #removeExpired(long)} and friends
 * must be released by whoever receives them.
 */
public class Queue {
    private final String name;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final Map<String, Object> arguments;
    private final QueueArguments queueArguments;
    private final String ownerConnectionId;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueueEntry> ready = new ArrayDeque<>();
    private final Map<Long, QueueEntry> acquired = new LinkedHashMap<>();
    private final AtomicInteger consumerCount = new AtomicInteger();
    private long nextSeq = 1;
    private volatile long lastActivity;
    private volatile boolean hadConsumers;
    private volatile boolean deleted;

    public Queue(String name, boolean durable, boolean exclusive, boolean autoDelete) {
        this(name, durable, exclusive, autoDelete, null, null, 0);
    }

    public Queue(String name, boolean durable, boolean exclusive, boolean autoDelete,
                 Map<String, Object> arguments, String ownerConnectionId, long now) {
        this.name = name;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.arguments = arguments != null
            ? Collections.unmodifiableMap(new HashMap<>(arguments))
            : Collections.emptyMap();
        this.queueArguments = QueueArguments.fromMap(this.arguments);
        this.ownerConnectionId = exclusive ? ownerConnectionId : null;
        this.lastActivity = now;
    }

    public String getName() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public QueueArguments getQueueArguments() {
        return queueArguments;
    }

    public String getOwnerConnectionId() {
        return ownerConnectionId;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    /**
     * @throws ChannelException RESOURCE_LOCKED when the queue is exclusive to another connection
     */
    public void checkAccess(String connectionId) {
        if (exclusive && ownerConnectionId != null && !ownerConnectionId.equals(connectionId)) {
            throw ChannelException.resourceLocked("cannot obtain exclusive access to locked queue '"
                    + name + "'");
        }
    }

    public boolean isEquivalent(boolean otherDurable, boolean otherExclusive, boolean otherAutoDelete,
                                Map<String, Object> otherArguments) {
        return durable == otherDurable
            && exclusive == otherExclusive
            && autoDelete == otherAutoDelete
            && Arguments.equivalent(arguments, otherArguments);
    }

    /**
     * Appends a message reference to the tail of the ready set.
     */
    public QueueEntry enqueue(StoredMessage message, long now) {
        lock.lock();
        try {
            QueueEntry entry = new QueueEntry(nextSeq++, message, now, computeExpiry(message.getMessage(), now));
            ready.addLast(entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-inserts an entry read back from durable storage, keeping its sequence number.
     * Entries must be restored in sequence order.
     */
    public QueueEntry restore(long seq, StoredMessage message, long now) {
        lock.lock();
        try {
            QueueEntry entry = new QueueEntry(seq, message, now, computeExpiry(message.getMessage(), now));
            ready.addLast(entry);
            nextSeq = Math.max(nextSeq, seq + 1);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    private long computeExpiry(Message message, long now) {
        long expiresAt = QueueEntry.NO_EXPIRY;
        if (queueArguments.hasTTL()) {
            expiresAt = expiryAfter(now, queueArguments.getMessageTtl());
        }
        long messageTtl = message.getExpirationMillis();
        if (messageTtl >= 0) {
            expiresAt = Math.min(expiresAt, expiryAfter(now, messageTtl));
        }
        return expiresAt;
    }

    /**
     * {@code now + ttl}, saturating at {@link QueueEntry#NO_EXPIRY}.
     */
    static long expiryAfter(long now, long ttl) {
        return ttl >= QueueEntry.NO_EXPIRY - now ? QueueEntry.NO_EXPIRY : now + ttl;
    }

    /**
     * Removes and returns the first live ready entry. Expired entries found on the way are removed
     * and added to {@code expiredOut}.
     */
    public QueueEntry pollReady(long now, List<QueueEntry> expiredOut) {
        lock.lock();
        try {
            QueueEntry entry;
            while ((entry = ready.pollFirst()) != null) {
                if (entry.isExpired(now)) {
                    expiredOut.add(entry);
                    continue;
                }
                return entry;
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasReady() {
        lock.lock();
        try {
            return !ready.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an entry as delivered to an explicit-ack consumer or getter.
     */
    public void acquire(QueueEntry entry) {
        lock.lock();
        try {
            acquired.put(entry.getSeq(), entry);
        } finally {
            lock.unlock();
        }
    }

    public boolean removeAcquired(QueueEntry entry) {
        lock.lock();
        try {
            return acquired.remove(entry.getSeq()) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns acquired entries to the head of the ready set in their original relative order,
     * flagged as redelivered. Entries that are no longer acquired are skipped.
     *
     * @return the number of entries requeued
     */
    public int requeue(Collection<QueueEntry> entries) {
        lock.lock();
        try {
            List<QueueEntry> toRequeue = new ArrayList<>(entries.size());
            for (QueueEntry entry : entries) {
                if (acquired.remove(entry.getSeq()) != null && !entry.isRemoved()) {
                    toRequeue.add(entry);
                }
            }
            toRequeue.sort(Comparator.comparingLong(QueueEntry::getSeq).reversed());
            for (QueueEntry entry : toRequeue) {
                entry.markRedelivered();
                ready.addFirst(entry);
            }
            return toRequeue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired ready entry, wherever it sits in the queue.
     */
    public List<QueueEntry> removeExpired(long now) {
        lock.lock();
        try {
            List<QueueEntry> expired = new ArrayList<>();
            Iterator<QueueEntry> it = ready.iterator();
            while (it.hasNext()) {
                QueueEntry entry = it.next();
                if (entry.isExpired(now)) {
                    it.remove();
                    expired.add(entry);
                }
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all ready entries. Acquired entries are left to their consumers.
     */
    public List<QueueEntry> purge() {
        lock.lock();
        try {
            List<QueueEntry> purged = new ArrayList<>(ready);
            ready.clear();
            return purged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the queue deleted and removes every ready and acquired entry.
     */
    public List<QueueEntry> drain() {
        lock.lock();
        try {
            deleted = true;
            List<QueueEntry> drained = new ArrayList<>(ready);
            drained.addAll(acquired.values());
            ready.clear();
            acquired.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFull() {
        if (!queueArguments.hasMaxLength()) {
            return false;
        }
        lock.lock();
        try {
            return ready.size() >= queueArguments.getMaxLength();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when more ready entries are held than {@code x-max-length} allows.
     */
    public boolean isOverLimit() {
        if (!queueArguments.hasMaxLength()) {
            return false;
        }
        lock.lock();
        try {
            return ready.size() > queueArguments.getMaxLength();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a broker-wide length limit to a queue declared without {@code x-max-length}.
     */
    public void applyDefaultMaxLength(int maxLength) {
        if (maxLength > 0 && !queueArguments.hasMaxLength()) {
            queueArguments.setMaxLength(maxLength);
        }
    }

    public QueueEntry removeHead() {
        lock.lock();
        try {
            return ready.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of ready messages; acquired messages are not counted.
     */
    public int messageCount() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of ready messages that are still alive at {@code now}.
     */
    public int messageCount(long now) {
        lock.lock();
        try {
            int live = 0;
            for (QueueEntry entry : ready) {
                if (!entry.isExpired(now)) {
                    live++;
                }
            }
            return live;
        } finally {
            lock.unlock();
        }
    }

    public int unackedCount() {
        lock.lock();
        try {
            return acquired.size();
        } finally {
            lock.unlock();
        }
    }

    public List<QueueEntry> readySnapshot() {
        lock.lock();
        try {
            return new ArrayList<>(ready);
        } finally {
            lock.unlock();
        }
    }

    public int consumerCount() {
        return consumerCount.get();
    }

    public void consumerAdded() {
        consumerCount.incrementAndGet();
        hadConsumers = true;
    }

    public int consumerRemoved() {
        return consumerCount.decrementAndGet();
    }

    public boolean hadConsumers() {
        return hadConsumers;
    }

    public void touch(long now) {
        this.lastActivity = now;
    }

    public long getLastActivity() {
        return lastActivity;
    }

    /**
     * True when an {@code x-expires} lease is set, the queue has no consumers and it has been
     * idle for at least the lease.
     */
    public boolean isLeaseExpired(long now) {
        return queueArguments.hasExpiry()
            && consumerCount.get() == 0
            && now - lastActivity >= queueArguments.getExpires();
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public String toString() {
        return String.format("Queue{name='%s', durable=%s, exclusive=%s, autoDelete=%s, ready=%d, unacked=%d}",
                name, durable, exclusive, autoDelete, messageCount(), unackedCount());
    }
}
