package com.amqpcore.ack;

import com.amqpcore.consumer.Consumer;
import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueEntry;

/**
 * A delivery awaiting acknowledgement. The consumer is null for messages fetched with basic.get.
 */
public final class UnackedDelivery {
    private final long deliveryTag;
    private final Queue queue;
    private final QueueEntry entry;
    private final Consumer consumer;
    private final boolean redelivered;

    public UnackedDelivery(long deliveryTag, Queue queue, QueueEntry entry, Consumer consumer, boolean redelivered) {
        this.deliveryTag = deliveryTag;
        this.queue = queue;
        this.entry = entry;
        this.consumer = consumer;
        this.redelivered = redelivered;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public Queue getQueue() {
        return queue;
    }

    public QueueEntry getEntry() {
        return entry;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    @Override
    public String toString() {
        return String.format("UnackedDelivery{tag=%d, queue='%s', entry=%d}",
                deliveryTag, queue.getName(), entry.getSeq());
    }
}
