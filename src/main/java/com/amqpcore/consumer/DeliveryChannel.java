package com.amqpcore.consumer;

import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueEntry;

/**
 * The channel side of a push delivery, as seen by the dispatcher.
 */
public interface DeliveryChannel {

    boolean isOpen();

    /**
     * False when a channel-wide prefetch limit is reached.
     */
    boolean hasCapacity();

    /**
     * Hands a ready entry to a consumer of this channel. Called with the queue lock held;
     * the entry has already been removed from the ready set.
     */
    void deliver(Consumer consumer, Queue queue, QueueEntry entry);

    /**
     * The broker cancelled the consumer, typically because its queue was deleted.
     */
    void consumerCancelled(Consumer consumer);
}
