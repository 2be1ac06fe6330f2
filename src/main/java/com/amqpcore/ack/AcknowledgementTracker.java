package com.amqpcore.ack;

import com.amqpcore.amqp.ChannelException;
import com.amqpcore.consumer.Consumer;
import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Per-channel ledger of deliveries awaiting acknowledgement, ordered by delivery tag.
 *
 * <p>Tags start at 1, increase by one per delivery and are never reused on the channel. The tracker
 * only edits its own map; returning entries to their queues is left to the caller so that no queue
 * lock is ever taken while this tracker's monitor is held.
 */
public class AcknowledgementTracker {
    private final NavigableMap<Long, UnackedDelivery> pending = new TreeMap<>();
    private long lastTag = 0;

    /**
     * Allocates the next delivery tag without recording anything, used for auto-ack deliveries.
     */
    public synchronized long nextTag() {
        return ++lastTag;
    }

    public synchronized UnackedDelivery record(Queue queue, QueueEntry entry, Consumer consumer) {
        long tag = ++lastTag;
        UnackedDelivery delivery = new UnackedDelivery(tag, queue, entry, consumer, entry.isRedelivered());
        pending.put(tag, delivery);
        return delivery;
    }

    /**
     * Settles one delivery, or with {@code multiple} every pending delivery up to and including
     * {@code deliveryTag}. Tag 0 with {@code multiple} settles everything pending.
     *
     * @throws ChannelException PRECONDITION_FAILED for an unknown or already settled tag
     */
    public synchronized List<UnackedDelivery> ack(long deliveryTag, boolean multiple) {
        return take(deliveryTag, multiple);
    }

    /**
     * Negative acknowledgement; same tag rules as {@link #ack(long, boolean)}.
     */
    public synchronized List<UnackedDelivery> nack(long deliveryTag, boolean multiple) {
        return take(deliveryTag, multiple);
    }

    /**
     * basic.reject has no multiple flag.
     */
    public synchronized UnackedDelivery reject(long deliveryTag) {
        return take(deliveryTag, false).get(0);
    }

    /**
     * Removes and returns every pending delivery in tag order.
     */
    public synchronized List<UnackedDelivery> drainAll() {
        if (pending.isEmpty()) {
            return Collections.emptyList();
        }
        List<UnackedDelivery> all = new ArrayList<>(pending.values());
        pending.clear();
        return all;
    }

    public synchronized boolean isPending(long deliveryTag) {
        return pending.containsKey(deliveryTag);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized List<Long> pendingTags() {
        return new ArrayList<>(pending.keySet());
    }

    private List<UnackedDelivery> take(long deliveryTag, boolean multiple) {
        if (multiple && deliveryTag == 0) {
            return drainAll();
        }
        if (!pending.containsKey(deliveryTag)) {
            throw ChannelException.preconditionFailed("unknown delivery tag " + deliveryTag);
        }
        if (!multiple) {
            return Collections.singletonList(pending.remove(deliveryTag));
        }
        NavigableMap<Long, UnackedDelivery> upTo = pending.headMap(deliveryTag, true);
        List<UnackedDelivery> taken = new ArrayList<>(upTo.values());
        upTo.clear();
        return taken;
    }
}
