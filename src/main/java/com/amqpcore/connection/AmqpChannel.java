package com.amqpcore.connection;

import com.amqpcore.ack.AcknowledgementTracker;
import com.amqpcore.ack.UnackedDelivery;
import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.AmqpException;
import com.amqpcore.amqp.ChannelException;
import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.confirms.ConfirmOutcome;
import com.amqpcore.confirms.PublisherConfirms;
import com.amqpcore.consumer.Consumer;
import com.amqpcore.consumer.DeliveryChannel;
import com.amqpcore.model.Exchange;
import com.amqpcore.model.Message;
import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueEntry;
import com.amqpcore.server.PublishResult;
import com.amqpcore.server.VirtualHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * One channel of a connection: a sequential command stream against the connection's virtual host.
 *
 * <p>Commands are plain method calls. Everything the broker sends back asynchronously (deliveries,
 * returns, confirms, cancellations, the close itself) is queued as a {@link ChannelEvent} for the codec
 * layer to drain. A protocol error raised by a command closes the channel, or the whole connection for
 * a hard error, before it is rethrown to the caller.
 */
public class AmqpChannel implements DeliveryChannel {
    private static final Logger logger = LoggerFactory.getLogger(AmqpChannel.class);

    private final int channelNumber;
    private final AmqpConnection connection;
    private final VirtualHost vhost;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final ConcurrentMap<String, Consumer> consumers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Queue> consumerQueues = new ConcurrentHashMap<>();
    private final AcknowledgementTracker tracker = new AcknowledgementTracker();
    private final PublisherConfirms confirms = new PublisherConfirms();
    private final BlockingQueue<ChannelEvent> events = new LinkedBlockingQueue<>();
    private volatile int prefetchCount;
    private volatile int globalPrefetchCount = 0;

    public AmqpChannel(int channelNumber, AmqpConnection connection, VirtualHost vhost) {
        this.channelNumber = channelNumber;
        this.connection = connection;
        this.vhost = vhost;
        this.prefetchCount = vhost.getConfig().getDefaultPrefetch();
        this.confirms.setConfirmListener(new PublisherConfirms.ConfirmListener() {
            @Override
            public void onAck(long seqNo, boolean multiple) {
                emit(new ChannelEvent.PublishAck(channelNumber, seqNo, multiple));
            }

            @Override
            public void onNack(long seqNo, boolean multiple) {
                emit(new ChannelEvent.PublishNack(channelNumber, seqNo, multiple));
            }
        });
    }

    // ===== Exchange class =====

    public Exchange exchangeDeclare(String exchange, String type) {
        return exchangeDeclare(exchange, type, false, false, false, false, null);
    }

    public Exchange exchangeDeclare(String exchange, String type, boolean passive, boolean durable,
                                    boolean autoDelete, boolean internal, Map<String, Object> arguments) {
        logger.debug("Exchange Declare: name={}, type={}, passive={}, durable={}", exchange, type, passive, durable);
        return guard(() -> vhost.declareExchange(exchange, type, passive, durable, autoDelete, internal, arguments));
    }

    public void exchangeDelete(String exchange, boolean ifUnused) {
        logger.debug("Exchange Delete: name={}, ifUnused={}", exchange, ifUnused);
        run(() -> vhost.deleteExchange(exchange, ifUnused));
    }

    public void exchangeBind(String destination, String source, String routingKey, Map<String, Object> arguments) {
        logger.debug("Exchange Bind: destination={}, source={}, routingKey={}", destination, source, routingKey);
        run(() -> vhost.bindExchange(destination, source, routingKey, arguments));
    }

    public void exchangeUnbind(String destination, String source, String routingKey, Map<String, Object> arguments) {
        logger.debug("Exchange Unbind: destination={}, source={}, routingKey={}", destination, source, routingKey);
        run(() -> vhost.unbindExchange(destination, source, routingKey, arguments));
    }

    // ===== Queue class =====

    /**
     * Declares a server-named, exclusive, auto-delete queue.
     */
    public QueueDeclareResult queueDeclare() {
        return queueDeclare("", false, false, true, true, null);
    }

    public QueueDeclareResult queueDeclare(String queue, boolean durable, boolean exclusive, boolean autoDelete,
                                           Map<String, Object> arguments) {
        return queueDeclare(queue, false, durable, exclusive, autoDelete, arguments);
    }

    public QueueDeclareResult queueDeclare(String queue, boolean passive, boolean durable, boolean exclusive,
                                           boolean autoDelete, Map<String, Object> arguments) {
        logger.debug("Queue Declare: name={}, passive={}, durable={}, exclusive={}, autoDelete={}",
                queue, passive, durable, exclusive, autoDelete);
        return guard(() -> vhost.declareQueue(connection.getId(), queue, passive, durable, exclusive, autoDelete,
                arguments));
    }

    public QueueDeclareResult queueDeclarePassive(String queue) {
        return queueDeclare(queue, true, false, false, false, null);
    }

    public void queueBind(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        logger.debug("Queue Bind: queue={}, exchange={}, routingKey={}", queue, exchange, routingKey);
        run(() -> vhost.bindQueue(connection.getId(), queue, exchange, routingKey, arguments));
    }

    public void queueBind(String queue, String exchange, String routingKey) {
        queueBind(queue, exchange, routingKey, null);
    }

    public void queueUnbind(String queue, String exchange, String routingKey, Map<String, Object> arguments) {
        logger.debug("Queue Unbind: queue={}, exchange={}, routingKey={}", queue, exchange, routingKey);
        run(() -> vhost.unbindQueue(connection.getId(), queue, exchange, routingKey, arguments));
    }

    /**
     * @return the number of messages purged
     */
    public int queuePurge(String queue) {
        logger.debug("Queue Purge: queue={}", queue);
        return guard(() -> vhost.purgeQueue(connection.getId(), queue));
    }

    /**
     * @return the number of messages the queue held
     */
    public int queueDelete(String queue, boolean ifUnused, boolean ifEmpty) {
        logger.debug("Queue Delete: name={}, ifUnused={}, ifEmpty={}", queue, ifUnused, ifEmpty);
        return guard(() -> vhost.deleteQueue(connection.getId(), queue, ifUnused, ifEmpty));
    }

    // ===== Basic class =====

    /**
     * Sets the prefetch limit. Non-global limits apply to consumers created afterwards; a global
     * limit caps the unacknowledged deliveries of the whole channel.
     */
    public void basicQos(int prefetch, boolean global) {
        run(() -> {
            if (prefetch < 0) {
                throw ChannelException.preconditionFailed("prefetch count must not be negative: " + prefetch);
            }
            logger.debug("Basic QoS: prefetchCount={}, global={}", prefetch, global);
            if (global) {
                globalPrefetchCount = prefetch;
            } else {
                prefetchCount = prefetch;
            }
            dispatchConsumedQueues(Collections.emptySet());
        });
    }

    public String basicConsume(String queue, boolean noAck) {
        return basicConsume(queue, "", noAck, false, null);
    }

    /**
     * Subscribes to a queue. {@code ConsumeOk} is queued before the first {@code Deliver} of the new consumer.
     *
     * @return the consumer tag, generated when {@code consumerTag} is empty
     */
    public String basicConsume(String queue, String consumerTag, boolean noAck, boolean exclusive,
                               Map<String, Object> arguments) {
        return guard(() -> {
            String tag = consumerTag == null || consumerTag.isEmpty()
                ? AmqpConstants.GENERATED_CONSUMER_TAG_PREFIX + UUID.randomUUID()
                : consumerTag;
            if (consumers.containsKey(tag)) {
                throw ConnectionException.notAllowed("attempt to reuse consumer tag '" + tag + "'");
            }
            Consumer consumer = new Consumer(tag, queue, this, noAck, exclusive, prefetchCount, arguments);
            Queue consumed = vhost.registerConsumer(connection.getId(), consumer);
            consumers.put(tag, consumer);
            consumerQueues.put(tag, consumed);
            emit(new ChannelEvent.ConsumeOk(channelNumber, tag));
            logger.debug("Basic Consume: queue={}, consumerTag={}, noAck={}, exclusive={}",
                    queue, tag, noAck, exclusive);
            vhost.activateConsumer(consumer);
            return tag;
        });
    }

    public void basicCancel(String consumerTag) {
        run(() -> {
            Consumer consumer = consumers.remove(consumerTag);
            consumerQueues.remove(consumerTag);
            emit(new ChannelEvent.CancelOk(channelNumber, consumerTag));
            if (consumer != null) {
                vhost.cancelConsumer(consumer);
                logger.debug("Basic Cancel: consumerTag={}", consumerTag);
            }
        });
    }

    public PublishResult basicPublish(String exchange, String routingKey, Message message) {
        return basicPublish(exchange, routingKey, false, false, message);
    }

    /**
     * Publishes a message. Returns and confirms are queued as events: a {@code Return} for a mandatory
     * message that reached no queue or an immediate message no consumer could take, then, in confirm
     * mode, the {@code PublishAck} or {@code PublishNack}.
     */
    public PublishResult basicPublish(String exchange, String routingKey, boolean mandatory, boolean immediate,
                                      Message message) {
        return guard(() -> {
            long seqNo = confirms.isConfirmMode() ? confirms.nextPublishSeqNo() : 0;
            PublishResult result = vhost.publish(exchange, routingKey, mandatory, immediate, message);
            if (result.isUnroutable() && mandatory) {
                emit(new ChannelEvent.Return(channelNumber, AmqpConstants.REPLY_NO_ROUTE, "NO_ROUTE",
                        exchange, routingKey, message));
            } else if (result.isNoConsumers()) {
                emit(new ChannelEvent.Return(channelNumber, AmqpConstants.REPLY_NO_CONSUMERS, "NO_CONSUMERS",
                        exchange, routingKey, message));
            }
            if (seqNo > 0) {
                if (result.shouldNack()) {
                    confirms.nack(seqNo);
                } else {
                    confirms.ack(seqNo);
                }
            }
            return result;
        });
    }

    /**
     * Fetches one message without subscribing.
     *
     * @return the message, or null when the queue has no ready message
     */
    public GetResponse basicGet(String queue, boolean noAck) {
        return guard(() -> {
            Queue source = vhost.queueForAccess(connection.getId(), queue);
            long now = vhost.getClock().millis();
            List<QueueEntry> expired = new ArrayList<>();
            QueueEntry entry;
            long deliveryTag = 0;
            int remaining;

            source.getLock().lock();
            try {
                entry = source.pollReady(now, expired);
                if (entry != null) {
                    if (noAck) {
                        deliveryTag = tracker.nextTag();
                    } else {
                        source.acquire(entry);
                        deliveryTag = tracker.record(source, entry, null).getDeliveryTag();
                    }
                }
                remaining = source.messageCount(now);
            } finally {
                source.getLock().unlock();
            }
            source.touch(now);

            if (!expired.isEmpty()) {
                vhost.deadLetter(source, expired, VirtualHost.REASON_EXPIRED);
            }
            if (entry == null) {
                logger.debug("Basic Get: queue '{}' empty", queue);
                return null;
            }
            GetResponse response = new GetResponse(deliveryTag, entry.isRedelivered(), remaining, entry.getMessage());
            if (noAck) {
                vhost.discard(source, entry);
            }
            return response;
        });
    }

    public void basicAck(long deliveryTag, boolean multiple) {
        run(() -> {
            List<UnackedDelivery> settled = tracker.ack(deliveryTag, multiple);
            Set<Queue> touched = new LinkedHashSet<>();
            for (UnackedDelivery delivery : settled) {
                vhost.settle(delivery.getQueue(), delivery.getEntry());
                settledBy(delivery);
                touched.add(delivery.getQueue());
            }
            logger.debug("Basic Ack: deliveryTag={}, multiple={}, settled={}", deliveryTag, multiple, settled.size());
            dispatchConsumedQueues(touched);
        });
    }

    /**
     * Rejects a single delivery.
     */
    public void basicReject(long deliveryTag, boolean requeue) {
        run(() -> settleNegatively(Collections.singletonList(tracker.reject(deliveryTag)), requeue));
    }

    public void basicNack(long deliveryTag, boolean multiple, boolean requeue) {
        run(() -> settleNegatively(tracker.nack(deliveryTag, multiple), requeue));
    }

    /**
     * Returns every unacknowledged delivery of the channel to its queue.
     */
    public void basicRecover(boolean requeue) {
        run(() -> {
            if (!requeue) {
                throw new ConnectionException(ErrorCode.NOT_IMPLEMENTED, "basic.recover with requeue=false");
            }
            settleNegatively(tracker.drainAll(), true);
        });
    }

    private void settleNegatively(List<UnackedDelivery> deliveries, boolean requeue) {
        Map<Queue, List<QueueEntry>> byQueue = groupByQueue(deliveries);
        for (UnackedDelivery delivery : deliveries) {
            settledBy(delivery);
        }
        for (Map.Entry<Queue, List<QueueEntry>> group : byQueue.entrySet()) {
            if (requeue) {
                vhost.requeue(group.getKey(), group.getValue());
            } else {
                vhost.reject(group.getKey(), group.getValue());
            }
        }
        dispatchConsumedQueues(byQueue.keySet());
    }

    private static Map<Queue, List<QueueEntry>> groupByQueue(Collection<UnackedDelivery> deliveries) {
        Map<Queue, List<QueueEntry>> byQueue = new LinkedHashMap<>();
        for (UnackedDelivery delivery : deliveries) {
            byQueue.computeIfAbsent(delivery.getQueue(), q -> new ArrayList<>()).add(delivery.getEntry());
        }
        return byQueue;
    }

    private static void settledBy(UnackedDelivery delivery) {
        if (delivery.getConsumer() != null) {
            delivery.getConsumer().deliverySettled();
        }
    }

    /**
     * Settling frees prefetch room on this channel, so the queues it consumes from get a dispatch pass
     * along with the queues the settled entries came from.
     */
    private void dispatchConsumedQueues(Collection<Queue> touched) {
        Set<Queue> toDispatch = new LinkedHashSet<>(touched);
        toDispatch.addAll(consumerQueues.values());
        for (Queue queue : toDispatch) {
            vhost.dispatch(queue);
        }
    }

    // ===== Confirm class =====

    public void confirmSelect() {
        run(() -> {
            confirms.enableConfirmMode();
            logger.debug("Confirm Select on channel {}", channelNumber);
        });
    }

    /**
     * Waits until every publish since {@link #confirmSelect()} has been acked or nacked.
     *
     * @throws IllegalStateException if the channel is not in confirm mode
     * @throws InterruptedException  if interrupted while waiting
     */
    public ConfirmOutcome waitForConfirms(long timeoutMs) throws InterruptedException {
        if (!confirms.isConfirmMode()) {
            throw new IllegalStateException("Channel " + channelNumber + " is not in confirm mode");
        }
        return confirms.waitForConfirms(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public long getNextPublishSeqNo() {
        return confirms.isConfirmMode() ? confirms.getNextPublishSeqNo() : 0;
    }

    // ===== Events =====

    private void emit(ChannelEvent event) {
        events.offer(event);
    }

    public ChannelEvent pollEvent() {
        return events.poll();
    }

    public ChannelEvent pollEvent(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    public List<ChannelEvent> drainEvents() {
        List<ChannelEvent> drained = new ArrayList<>();
        events.drainTo(drained);
        return drained;
    }

    // ===== DeliveryChannel =====

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public boolean hasCapacity() {
        int limit = globalPrefetchCount;
        return limit == 0 || tracker.size() < limit;
    }

    @Override
    public void deliver(Consumer consumer, Queue queue, QueueEntry entry) {
        long deliveryTag;
        if (consumer.isNoAck()) {
            deliveryTag = tracker.nextTag();
        } else {
            queue.acquire(entry);
            deliveryTag = tracker.record(queue, entry, consumer).getDeliveryTag();
            consumer.deliveryAcquired();
        }
        emit(new ChannelEvent.Deliver(channelNumber, consumer.getTag(), deliveryTag, entry.isRedelivered(),
                queue.getName(), entry.getMessage()));
        if (consumer.isNoAck()) {
            vhost.discard(queue, entry);
        }
    }

    @Override
    public void consumerCancelled(Consumer consumer) {
        if (consumers.remove(consumer.getTag(), consumer)) {
            consumerQueues.remove(consumer.getTag());
            emit(new ChannelEvent.ConsumerCancelled(channelNumber, consumer.getTag()));
            logger.debug("Consumer {} on channel {} cancelled by the broker", consumer.getTag(), channelNumber);
        }
    }

    // ===== Closing =====

    /**
     * Client-initiated close with reply code 200.
     */
    public void close() {
        closeInternal(AmqpConstants.REPLY_SUCCESS, "OK", false);
    }

    void closeByConnection(int replyCode, String replyText) {
        closeInternal(replyCode, replyText, true);
    }

    /**
     * Cancels the consumers, requeues every unacknowledged delivery with the redelivered flag, nacks
     * outstanding confirms and queues the {@code ChannelClosed} event.
     */
    private void closeInternal(int replyCode, String replyText, boolean connectionClosed) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        List<Queue> consumed = new ArrayList<>(consumerQueues.values());
        for (Consumer consumer : new ArrayList<>(consumers.values())) {
            vhost.cancelConsumer(consumer);
        }
        consumers.clear();
        consumerQueues.clear();

        // a dispatch pass that picked one of our consumers before the cancel still holds the queue lock
        for (Queue queue : consumed) {
            queue.getLock().lock();
            queue.getLock().unlock();
        }

        List<UnackedDelivery> pending = tracker.drainAll();
        for (Map.Entry<Queue, List<QueueEntry>> group : groupByQueue(pending).entrySet()) {
            vhost.requeue(group.getKey(), group.getValue());
        }
        confirms.nackOutstanding();

        emit(new ChannelEvent.ChannelClosed(channelNumber, replyCode, replyText, connectionClosed));
        connection.channelClosed(this);
        if (replyCode == AmqpConstants.REPLY_SUCCESS) {
            logger.debug("Channel {} closed, requeued {} delivery(ies)", channelNumber, pending.size());
        } else {
            logger.info("Channel {} closed: {} {}, requeued {} delivery(ies)", channelNumber, replyCode, replyText,
                    pending.size());
        }
    }

    // ===== Error handling =====

    private void ensureOpen() {
        if (!open.get()) {
            throw new ChannelException(ErrorCode.CHANNEL_ERROR, "channel " + channelNumber + " is closed");
        }
    }

    private void run(Runnable command) {
        guard(() -> {
            command.run();
            return null;
        });
    }

    private <T> T guard(Supplier<T> command) {
        ensureOpen();
        try {
            return command.get();
        } catch (AmqpException e) {
            handleError(e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Internal error on channel {}", channelNumber, e);
            ConnectionException internal = new ConnectionException(ErrorCode.INTERNAL_ERROR,
                    String.valueOf(e.getMessage()), e);
            handleError(internal);
            throw internal;
        }
    }

    private void handleError(AmqpException e) {
        if (e.getErrorCode().isHardError()) {
            connection.closeOnError(e);
        } else {
            logger.warn("Channel {} error: {}", channelNumber, e.getReplyText());
            closeInternal(e.getReplyCode(), e.getReplyText(), false);
        }
    }

    public int getChannelNumber() {
        return channelNumber;
    }

    public AmqpConnection getConnection() {
        return connection;
    }

    public int getPrefetchCount() {
        return prefetchCount;
    }

    public int getGlobalPrefetchCount() {
        return globalPrefetchCount;
    }

    public int getUnackedCount() {
        return tracker.size();
    }

    public boolean isConfirmMode() {
        return confirms.isConfirmMode();
    }

    public Map<String, Consumer> getConsumers() {
        return Collections.unmodifiableMap(consumers);
    }

    @Override
    public String toString() {
        return String.format("AmqpChannel{number=%d, connection=%s, open=%s, consumers=%d, unacked=%d}",
                channelNumber, connection.getId(), open.get(), consumers.size(), tracker.size());
    }
}
