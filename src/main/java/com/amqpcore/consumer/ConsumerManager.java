package com.amqpcore.consumer;

import com.amqpcore.amqp.ChannelException;
import com.amqpcore.model.Queue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Push consumers of one virtual host, grouped per queue with a round-robin cursor each.
 */
public class ConsumerManager {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerManager.class);

    private final ConcurrentMap<String, QueueConsumers> queueConsumers = new ConcurrentHashMap<>();

    /**
     * Attaches a consumer to a queue. It stays REGISTERED, and so receives nothing, until
     * {@link #activate(Consumer)} is called.
     *
     * @throws ChannelException ACCESS_REFUSED when the queue has an exclusive consumer, or when an
     *                          exclusive consumer is requested on a queue that already has consumers
     */
    public void register(Queue queue, Consumer consumer) {
        QueueConsumers group = queueConsumers.computeIfAbsent(queue.getName(), k -> new QueueConsumers());
        synchronized (group) {
            for (Consumer existing : group.consumers) {
                if (existing.isExclusive()) {
                    throw ChannelException.accessRefused("queue '" + queue.getName()
                            + "' in exclusive use");
                }
            }
            if (consumer.isExclusive() && !group.consumers.isEmpty()) {
                throw ChannelException.accessRefused("cannot obtain exclusive access to queue '"
                        + queue.getName() + "', it already has consumers");
            }
            group.consumers.add(consumer);
            queue.consumerAdded();
        }
        logger.debug("Registered {}", consumer);
    }

    public void activate(Consumer consumer) {
        consumer.activate();
    }

    /**
     * Detaches a consumer and moves it to CANCELLED.
     *
     * @return false when the consumer was already cancelled
     */
    public boolean cancel(Queue queue, Consumer consumer) {
        if (!consumer.cancel()) {
            return false;
        }
        QueueConsumers group = queueConsumers.get(consumer.getQueueName());
        if (group != null) {
            synchronized (group) {
                if (group.consumers.remove(consumer) && queue != null) {
                    queue.consumerRemoved();
                }
            }
        }
        logger.debug("Cancelled {}", consumer);
        return true;
    }

    /**
     * Detaches every consumer of a deleted queue.
     *
     * @return the consumers that were still active
     */
    public List<Consumer> removeQueue(String queueName) {
        QueueConsumers group = queueConsumers.remove(queueName);
        if (group == null) {
            return Collections.emptyList();
        }
        List<Consumer> cancelled = new ArrayList<>();
        synchronized (group) {
            for (Consumer consumer : group.consumers) {
                if (consumer.cancel()) {
                    cancelled.add(consumer);
                }
            }
            group.consumers.clear();
        }
        return cancelled;
    }

    /**
     * Picks the next consumer of the queue able to take a delivery, advancing the cursor past it.
     * Returns null when nobody can take one.
     */
    public Consumer nextEligible(String queueName) {
        QueueConsumers group = queueConsumers.get(queueName);
        if (group == null) {
            return null;
        }
        synchronized (group) {
            int size = group.consumers.size();
            for (int i = 0; i < size; i++) {
                int index = (group.cursor + i) % size;
                Consumer candidate = group.consumers.get(index);
                if (candidate.canAcceptDelivery()) {
                    group.cursor = (index + 1) % size;
                    return candidate;
                }
            }
            return null;
        }
    }

    public List<Consumer> consumersOf(String queueName) {
        QueueConsumers group = queueConsumers.get(queueName);
        if (group == null) {
            return Collections.emptyList();
        }
        synchronized (group) {
            return new ArrayList<>(group.consumers);
        }
    }

    public boolean hasActiveConsumer(String queueName) {
        for (Consumer consumer : consumersOf(queueName)) {
            if (consumer.isActive() && consumer.getChannel().isOpen()) {
                return true;
            }
        }
        return false;
    }

    public int consumerCount(String queueName) {
        return consumersOf(queueName).size();
    }

    private static final class QueueConsumers {
        private final List<Consumer> consumers = new ArrayList<>();
        private int cursor;
    }
}
