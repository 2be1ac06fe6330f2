package com.amqpcore.consumer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A push subscription of one channel to one queue.
 */
public class Consumer {
    private final String tag;
    private final String queueName;
    private final DeliveryChannel channel;
    private final boolean noAck;
    private final boolean exclusive;
    private final int prefetch;
    private final Map<String, Object> arguments;
    private final AtomicInteger unacked = new AtomicInteger();
    private volatile ConsumerState state = ConsumerState.REGISTERED;

    public Consumer(String tag, String queueName, DeliveryChannel channel, boolean noAck,
                    boolean exclusive, int prefetch, Map<String, Object> arguments) {
        this.tag = tag;
        this.queueName = queueName;
        this.channel = channel;
        this.noAck = noAck;
        this.exclusive = exclusive;
        this.prefetch = prefetch;
        this.arguments = arguments != null
            ? Collections.unmodifiableMap(new HashMap<>(arguments))
            : Collections.emptyMap();
    }

    public String getTag() {
        return tag;
    }

    public String getQueueName() {
        return queueName;
    }

    public DeliveryChannel getChannel() {
        return channel;
    }

    public boolean isNoAck() {
        return noAck;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    /**
     * Maximum unacknowledged deliveries; 0 means unlimited.
     */
    public int getPrefetch() {
        return prefetch;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public ConsumerState getState() {
        return state;
    }

    public boolean isActive() {
        return state == ConsumerState.ACTIVE;
    }

    synchronized void activate() {
        if (state == ConsumerState.REGISTERED) {
            state = ConsumerState.ACTIVE;
        }
    }

    /**
     * @return true if this call moved the consumer to CANCELLED
     */
    synchronized boolean cancel() {
        if (state == ConsumerState.CANCELLED) {
            return false;
        }
        state = ConsumerState.CANCELLED;
        return true;
    }

    public int getUnackedCount() {
        return unacked.get();
    }

    public void deliveryAcquired() {
        unacked.incrementAndGet();
    }

    public void deliverySettled() {
        unacked.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    /**
     * Active, on an open channel, and below both its own and the channel's prefetch limit.
     */
    public boolean canAcceptDelivery() {
        if (state != ConsumerState.ACTIVE || !channel.isOpen()) {
            return false;
        }
        if (noAck) {
            return true;
        }
        if (prefetch > 0 && unacked.get() >= prefetch) {
            return false;
        }
        return channel.hasCapacity();
    }

    @Override
    public String toString() {
        return String.format("Consumer{tag='%s', queue='%s', noAck=%s, exclusive=%s, prefetch=%d, state=%s}",
                tag, queueName, noAck, exclusive, prefetch, state);
    }
}
