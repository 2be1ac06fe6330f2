package com.amqpcore.consumer;

import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves ready entries from a queue to its consumers.
 *
 * <p>A pass runs in the calling thread under the queue lock and keeps handing the head entry to the
 * next eligible consumer until the queue has nothing live left or no consumer can take more.
 * Expired entries met on the way are passed to the {@link ExpiredEntryHandler} once the lock
 * has been released.
 */
public class DeliveryDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);

    private final ConsumerManager consumerManager;
    private final Clock clock;
    private final ExpiredEntryHandler expiredEntryHandler;

    public DeliveryDispatcher(ConsumerManager consumerManager, Clock clock, ExpiredEntryHandler expiredEntryHandler) {
        this.consumerManager = consumerManager;
        this.clock = clock;
        this.expiredEntryHandler = expiredEntryHandler;
    }

    /**
     * @return the number of entries delivered
     */
    public int dispatch(Queue queue) {
        if (queue.isDeleted()) {
            return 0;
        }
        List<QueueEntry> expired = new ArrayList<>();
        int delivered = 0;

        queue.getLock().lock();
        try {
            long now = clock.millis();
            while (queue.hasReady()) {
                Consumer consumer = consumerManager.nextEligible(queue.getName());
                if (consumer == null) {
                    break;
                }
                QueueEntry entry = queue.pollReady(now, expired);
                if (entry == null) {
                    break;
                }
                consumer.getChannel().deliver(consumer, queue, entry);
                delivered++;
            }
        } finally {
            queue.getLock().unlock();
        }

        if (delivered > 0) {
            logger.debug("Dispatched {} message(s) from queue '{}'", delivered, queue.getName());
        }
        if (!expired.isEmpty()) {
            expiredEntryHandler.expired(queue, expired);
        }
        return delivered;
    }

    /**
     * Receives entries found dead during a dispatch pass.
     */
    @FunctionalInterface
    public interface ExpiredEntryHandler {
        void expired(Queue queue, List<QueueEntry> entries);
    }
}
