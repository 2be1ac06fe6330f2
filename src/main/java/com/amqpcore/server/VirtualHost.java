package com.amqpcore.server;

import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.ChannelException;
import com.amqpcore.binding.BindingTable;
import com.amqpcore.config.BrokerConfig;
import com.amqpcore.connection.QueueDeclareResult;
import com.amqpcore.consumer.Consumer;
import com.amqpcore.consumer.ConsumerManager;
import com.amqpcore.consumer.DeliveryDispatcher;
import com.amqpcore.exchange.ExchangeTypeRegistry;
import com.amqpcore.exchange.HeadersMatcher;
import com.amqpcore.exchange.MessageRouter;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import com.amqpcore.model.Message;
import com.amqpcore.model.Queue;
import com.amqpcore.model.QueueArguments;
import com.amqpcore.model.QueueEntry;
import com.amqpcore.persistence.PersistenceException;
import com.amqpcore.persistence.PersistenceManager;
import com.amqpcore.store.MessageStore;
import com.amqpcore.store.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One isolated namespace of exchanges, queues and bindings, with its own message store,
 * consumers and dispatcher.
 *
 * <p>Declares, binds, unbinds and deletes are serialized by the topology lock. Publishing does not
 * take it: routing reads the concurrent registries and only the target queues' locks are taken.
 * The topology lock may be held while taking a queue lock, never the other way round.
 */
public class VirtualHost implements MessageRouter.Topology {
    private static final Logger logger = LoggerFactory.getLogger(VirtualHost.class);

    public static final String REASON_EXPIRED = "expired";
    public static final String REASON_REJECTED = "rejected";
    public static final String REASON_MAXLEN = "maxlen";

    private final String name;
    private final BrokerConfig config;
    private final Clock clock;
    private final PersistenceManager persistence;
    private final ExchangeTypeRegistry typeRegistry;

    private final ConcurrentMap<String, Exchange> exchanges = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Queue> queues = new ConcurrentHashMap<>();
    private final BindingTable bindingTable = new BindingTable();
    private final MessageStore messageStore;
    private final ConsumerManager consumerManager = new ConsumerManager();
    private final DeliveryDispatcher dispatcher;
    private final MessageRouter router;
    private final ReentrantLock topologyLock = new ReentrantLock();

    public VirtualHost(String name, BrokerConfig config, Clock clock, PersistenceManager persistence,
                       ExchangeTypeRegistry typeRegistry) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.persistence = persistence;
        this.typeRegistry = typeRegistry;
        this.messageStore = new MessageStore(name);
        this.messageStore.setReleaseListener(this::messageReleased);
        this.dispatcher = new DeliveryDispatcher(consumerManager, clock,
                (queue, entries) -> deadLetter(queue, entries, REASON_EXPIRED));
        this.router = new MessageRouter(this, bindingTable, typeRegistry);

        declarePredefined(AmqpConstants.DEFAULT_EXCHANGE, Exchange.Type.DIRECT);
        declarePredefined("amq.direct", Exchange.Type.DIRECT);
        declarePredefined("amq.fanout", Exchange.Type.FANOUT);
        declarePredefined("amq.topic", Exchange.Type.TOPIC);
        declarePredefined("amq.headers", Exchange.Type.HEADERS);
        declarePredefined("amq.match", Exchange.Type.HEADERS);
    }

    private void declarePredefined(String exchangeName, Exchange.Type type) {
        exchanges.put(exchangeName, new Exchange(exchangeName, type, true, false, false));
    }

    // ===== Exchanges =====

    /**
     * exchange.declare
     *
     * @throws ChannelException NOT_FOUND for a passive declare of a missing exchange, ACCESS_REFUSED for
     *                          the default exchange or a new {@code amq.} name, PRECONDITION_FAILED when
     *                          the exchange exists with different attributes
     * @throws com.amqpcore.amqp.ConnectionException COMMAND_INVALID for an unknown type
     */
    public Exchange declareExchange(String exchangeName, String type, boolean passive, boolean durable,
                                    boolean autoDelete, boolean internal, Map<String, Object> arguments) {
        if (passive) {
            return requireExchange(exchangeName);
        }
        if (exchangeName.isEmpty()) {
            throw ChannelException.accessRefused("operation not permitted on the default exchange");
        }
        typeRegistry.lookup(type);

        topologyLock.lock();
        try {
            Exchange existing = exchanges.get(exchangeName);
            if (existing != null) {
                if (!existing.isEquivalent(type, durable, autoDelete, internal, arguments)) {
                    throw ChannelException.preconditionFailed("inequivalent arg for exchange '" + exchangeName
                            + "' in vhost '" + name + "': received " + describe(type, durable, autoDelete, internal, arguments)
                            + " but current is " + describe(existing.getTypeName(), existing.isDurable(),
                                existing.isAutoDelete(), existing.isInternal(), existing.getArguments()));
                }
                return existing;
            }
            if (exchangeName.startsWith(AmqpConstants.RESERVED_PREFIX)) {
                throw ChannelException.accessRefused("exchange name '" + exchangeName
                        + "' contains reserved prefix '" + AmqpConstants.RESERVED_PREFIX + "*'");
            }

            Exchange exchange = new Exchange(exchangeName, type, durable, autoDelete, internal, arguments);
            if (durable && persistence != null) {
                persistence.saveExchange(name, exchange);
            }
            exchanges.put(exchangeName, exchange);
            logger.info("Declared exchange '{}' of type '{}' in vhost '{}'", exchangeName, exchange.getTypeName(), name);
            return exchange;
        } finally {
            topologyLock.unlock();
        }
    }

    /**
     * exchange.delete
     */
    public void deleteExchange(String exchangeName, boolean ifUnused) {
        if (exchangeName.isEmpty() || exchangeName.startsWith(AmqpConstants.RESERVED_PREFIX)) {
            throw ChannelException.accessRefused("cannot delete predeclared exchange '" + exchangeName + "'");
        }
        topologyLock.lock();
        try {
            Exchange exchange = requireExchange(exchangeName);
            if (ifUnused && bindingTable.hasBindings(exchangeName)) {
                throw ChannelException.preconditionFailed("exchange '" + exchangeName + "' in vhost '" + name + "' in use");
            }
            removeExchange(exchange);
        } finally {
            topologyLock.unlock();
        }
    }

    private void removeExchange(Exchange exchange) {
        if (exchange.isDurable() && persistence != null) {
            persistence.deleteExchange(name, exchange.getName());
        }
        if (!exchanges.remove(exchange.getName(), exchange)) {
            return;
        }
        bindingTable.removeSource(exchange.getName());
        List<Binding> inbound = bindingTable.removeDestination(Binding.DestinationKind.EXCHANGE, exchange.getName());
        logger.info("Deleted exchange '{}' in vhost '{}'", exchange.getName(), name);
        for (Binding binding : inbound) {
            maybeAutoDeleteExchange(binding.getSource());
        }
    }

    private void maybeAutoDeleteExchange(String exchangeName) {
        Exchange exchange = exchanges.get(exchangeName);
        if (exchange != null && exchange.isAutoDelete() && exchange.isEverBound()
                && !bindingTable.hasBindings(exchangeName)) {
            logger.info("Auto-deleting exchange '{}' in vhost '{}'", exchangeName, name);
            removeExchange(exchange);
        }
    }

    /**
     * exchange.bind: routes messages arriving at {@code source} on to {@code destination}.
     */
    public void bindExchange(String destination, String source, String routingKey, Map<String, Object> arguments) {
        topologyLock.lock();
        try {
            Exchange destinationExchange = requireExchange(destination);
            Exchange sourceExchange = requireExchange(source);
            validateBindingArguments(sourceExchange, arguments);
            Binding binding = Binding.toExchange(source, destination, routingKey, arguments);
            addBinding(binding, sourceExchange, sourceExchange.isDurable() && destinationExchange.isDurable());
        } finally {
            topologyLock.unlock();
        }
    }

    public void unbindExchange(String destination, String source, String routingKey, Map<String, Object> arguments) {
        topologyLock.lock();
        try {
            requireExchange(destination);
            requireExchange(source);
            removeBinding(Binding.toExchange(source, destination, routingKey, arguments));
        } finally {
            topologyLock.unlock();
        }
    }

    // ===== Queues =====

    /**
     * queue.declare. An empty name asks for a generated {@code amq.gen-} name.
     *
     * @throws ChannelException NOT_FOUND for a passive declare of a missing queue, RESOURCE_LOCKED for
     *                          another connection's exclusive queue, PRECONDITION_FAILED for different
     *                          attributes or invalid arguments, ACCESS_REFUSED for a new {@code amq.} name
     */
    public QueueDeclareResult declareQueue(String connectionId, String queueName, boolean passive, boolean durable,
                                           boolean exclusive, boolean autoDelete, Map<String, Object> arguments) {
        long now = clock.millis();
        if (passive) {
            Queue queue = requireQueue(queueName);
            queue.checkAccess(connectionId);
            queue.touch(now);
            return declareResult(queue);
        }

        boolean generated = queueName == null || queueName.isEmpty();
        String actualName = generated ? AmqpConstants.GENERATED_QUEUE_PREFIX + UUID.randomUUID() : queueName;

        topologyLock.lock();
        try {
            Queue existing = queues.get(actualName);
            if (existing != null) {
                existing.checkAccess(connectionId);
                if (!existing.isEquivalent(durable, exclusive, autoDelete, arguments)) {
                    throw ChannelException.preconditionFailed("inequivalent arg for queue '" + actualName
                            + "' in vhost '" + name + "': received durable=" + durable + ", exclusive=" + exclusive
                            + ", auto_delete=" + autoDelete + ", args=" + arguments
                            + " but current is durable=" + existing.isDurable() + ", exclusive=" + existing.isExclusive()
                            + ", auto_delete=" + existing.isAutoDelete() + ", args=" + existing.getArguments());
                }
                existing.touch(now);
                return declareResult(existing);
            }
            if (!generated && actualName.startsWith(AmqpConstants.RESERVED_PREFIX)) {
                throw ChannelException.accessRefused("queue name '" + actualName
                        + "' contains reserved prefix '" + AmqpConstants.RESERVED_PREFIX + "*'");
            }

            Queue queue = new Queue(actualName, durable, exclusive, autoDelete, arguments, connectionId, now);
            queue.applyDefaultMaxLength(config.getDefaultQueueMaxLength());
            if (isPersistent(queue)) {
                persistence.saveQueue(name, queue);
            }
            queues.put(actualName, queue);
            logger.info("Declared queue '{}' in vhost '{}' (durable={}, exclusive={}, autoDelete={}, args={})",
                    actualName, name, durable, exclusive, autoDelete, queue.getQueueArguments());
            return declareResult(queue);
        } finally {
            topologyLock.unlock();
        }
    }

    private QueueDeclareResult declareResult(Queue queue) {
        expireMessages(queue, clock.millis());
        return new QueueDeclareResult(queue.getName(), queue.messageCount(), queue.consumerCount());
    }

    public void bindQueue(String connectionId, String queueName, String exchangeName, String routingKey,
                          Map<String, Object> arguments) {
        topologyLock.lock();
        try {
            Queue queue = requireQueue(queueName);
            queue.checkAccess(connectionId);
            Exchange exchange = requireExchange(exchangeName);
            validateBindingArguments(exchange, arguments);
            Binding binding = Binding.toQueue(exchangeName, queueName, routingKey, arguments);
            addBinding(binding, exchange, exchange.isDurable() && isPersistent(queue));
            queue.touch(clock.millis());
        } finally {
            topologyLock.unlock();
        }
    }

    public void unbindQueue(String connectionId, String queueName, String exchangeName, String routingKey,
                            Map<String, Object> arguments) {
        topologyLock.lock();
        try {
            Queue queue = requireQueue(queueName);
            queue.checkAccess(connectionId);
            requireExchange(exchangeName);
            removeBinding(Binding.toQueue(exchangeName, queueName, routingKey, arguments));
        } finally {
            topologyLock.unlock();
        }
    }

    private void addBinding(Binding binding, Exchange source, boolean durable) {
        if (!bindingTable.bind(binding)) {
            return;
        }
        if (durable && persistence != null) {
            try {
                persistence.saveBinding(name, binding);
            } catch (PersistenceException e) {
                bindingTable.unbind(binding);
                throw e;
            }
        }
        source.markBound();
    }

    private void removeBinding(Binding binding) {
        bindingTable.unbind(binding);
        if (persistence != null) {
            persistence.deleteBinding(name, binding);
        }
        maybeAutoDeleteExchange(binding.getSource());
    }

    private static void validateBindingArguments(Exchange exchange, Map<String, Object> arguments) {
        if (exchange.getType() == Exchange.Type.HEADERS && arguments != null
                && arguments.containsKey(HeadersMatcher.X_MATCH)) {
            String mode = HeadersMatcher.matchMode(arguments);
            if (!HeadersMatcher.MATCH_ALL.equals(mode) && !HeadersMatcher.MATCH_ANY.equals(mode)) {
                throw ChannelException.preconditionFailed("invalid x-match field value '" + mode
                        + "'; expected all or any");
            }
        }
    }

    /**
     * queue.purge: removes ready messages; deliveries awaiting acknowledgement are left alone.
     *
     * @return the number of messages removed
     */
    public int purgeQueue(String connectionId, String queueName) {
        Queue queue = queueForAccess(connectionId, queueName);
        List<QueueEntry> purged = queue.purge();
        for (QueueEntry entry : purged) {
            discard(queue, entry);
        }
        logger.info("Purged {} message(s) from queue '{}' in vhost '{}'", purged.size(), queueName, name);
        return purged.size();
    }

    /**
     * queue.delete
     *
     * @return the number of ready messages the queue held
     */
    public int deleteQueue(String connectionId, String queueName, boolean ifUnused, boolean ifEmpty) {
        topologyLock.lock();
        try {
            Queue queue = requireQueue(queueName);
            queue.checkAccess(connectionId);
            if (ifUnused && queue.consumerCount() > 0) {
                throw ChannelException.preconditionFailed("queue '" + queueName + "' in vhost '" + name + "' in use");
            }
            if (ifEmpty && queue.messageCount() > 0) {
                throw ChannelException.preconditionFailed("queue '" + queueName + "' in vhost '" + name + "' not empty");
            }
            int messageCount = queue.messageCount();
            removeQueue(queue);
            return messageCount;
        } finally {
            topologyLock.unlock();
        }
    }

    /**
     * Deletes a queue: its bindings go, its consumers get a broker-side cancel, and every message it held,
     * ready or unacknowledged, is dropped.
     */
    private void removeQueue(Queue queue) {
        if (queues.get(queue.getName()) != queue) {
            return;
        }
        if (isPersistent(queue)) {
            persistence.deleteQueue(name, queue.getName());
        }
        queues.remove(queue.getName(), queue);
        List<Binding> bindings = bindingTable.removeDestination(Binding.DestinationKind.QUEUE, queue.getName());

        for (Consumer consumer : consumerManager.removeQueue(queue.getName())) {
            consumer.getChannel().consumerCancelled(consumer);
        }

        List<QueueEntry> entries = queue.drain();
        for (QueueEntry entry : entries) {
            discard(queue, entry);
        }
        logger.info("Deleted queue '{}' in vhost '{}', dropped {} message(s)", queue.getName(), name, entries.size());

        for (Binding binding : bindings) {
            maybeAutoDeleteExchange(binding.getSource());
        }
    }

    /**
     * Removes every exclusive queue owned by a closing connection.
     */
    public void deleteExclusiveQueues(String connectionId) {
        topologyLock.lock();
        try {
            for (Queue queue : new ArrayList<>(queues.values())) {
                if (queue.isExclusive() && connectionId.equals(queue.getOwnerConnectionId())) {
                    removeQueue(queue);
                }
            }
        } finally {
            topologyLock.unlock();
        }
    }

    /**
     * Looks a queue up for a channel operation.
     *
     * @throws ChannelException NOT_FOUND or RESOURCE_LOCKED
     */
    public Queue queueForAccess(String connectionId, String queueName) {
        Queue queue = requireQueue(queueName);
        queue.checkAccess(connectionId);
        return queue;
    }

    // ===== Consumers =====

    /**
     * Attaches a consumer to its queue. The consumer stays inactive until
     * {@link #activateConsumer(Consumer)}, so the caller can confirm the registration first.
     *
     * @return the queue consumed from
     */
    public Queue registerConsumer(String connectionId, Consumer consumer) {
        topologyLock.lock();
        try {
            Queue queue = queueForAccess(connectionId, consumer.getQueueName());
            consumerManager.register(queue, consumer);
            queue.touch(clock.millis());
            return queue;
        } finally {
            topologyLock.unlock();
        }
    }

    public void activateConsumer(Consumer consumer) {
        consumerManager.activate(consumer);
        Queue queue = queues.get(consumer.getQueueName());
        if (queue != null) {
            dispatcher.dispatch(queue);
        }
    }

    /**
     * Detaches a consumer. An auto-delete queue losing its last consumer is deleted.
     */
    public void cancelConsumer(Consumer consumer) {
        Queue queue = queues.get(consumer.getQueueName());
        if (!consumerManager.cancel(queue, consumer) || queue == null) {
            return;
        }
        if (queue.consumerCount() == 0) {
            // the x-expires lease runs from the moment the queue became unused
            queue.touch(clock.millis());
        }
        if (queue.isAutoDelete() && queue.hadConsumers() && queue.consumerCount() == 0) {
            topologyLock.lock();
            try {
                if (queue.consumerCount() == 0) {
                    logger.info("Auto-deleting queue '{}' in vhost '{}' after its last consumer left", queue.getName(), name);
                    removeQueue(queue);
                }
            } finally {
                topologyLock.unlock();
            }
        }
    }

    // ===== Publishing =====

    /**
     * Routes and enqueues one message.
     *
     * @throws ChannelException NOT_FOUND for a missing exchange, ACCESS_REFUSED for an internal one
     */
    public PublishResult publish(String exchangeName, String routingKey, boolean mandatory, boolean immediate,
                                 Message message) {
        Exchange exchange = requireExchange(exchangeName);
        if (exchange.isInternal()) {
            throw ChannelException.accessRefused("cannot publish to internal exchange '" + exchangeName
                    + "' in vhost '" + name + "'");
        }
        Message stamped = message.toBuilder().exchange(exchangeName).routingKey(routingKey).build();

        List<Queue> targets = resolve(router.route(exchange, routingKey, stamped.getHeaders()));
        if (targets.isEmpty()) {
            logger.debug("Message to exchange '{}' with key '{}' is unroutable (mandatory={})",
                    exchangeName, routingKey, mandatory);
            return PublishResult.unroutable();
        }
        if (immediate && !hasActiveConsumer(targets)) {
            return PublishResult.noConsumers(targets.size());
        }
        return enqueue(targets, stamped);
    }

    private boolean hasActiveConsumer(List<Queue> targets) {
        for (Queue queue : targets) {
            if (consumerManager.hasActiveConsumer(queue.getName())) {
                return true;
            }
        }
        return false;
    }

    private List<Queue> resolve(Collection<String> queueNames) {
        List<Queue> targets = new ArrayList<>(queueNames.size());
        for (String queueName : queueNames) {
            Queue queue = queues.get(queueName);
            if (queue != null) {
                targets.add(queue);
            }
        }
        return targets;
    }

    private PublishResult enqueue(List<Queue> targets, Message message) {
        long now = clock.millis();
        int enqueued = 0;
        int refused = 0;
        boolean persistenceFailed = false;
        List<Queue> toDispatch = new ArrayList<>(targets.size());
        Map<Queue, List<QueueEntry>> dropped = new LinkedHashMap<>();
        List<Queue> refusedToDeadLetter = new ArrayList<>();

        StoredMessage stored = messageStore.add(message);
        try {
            for (Queue queue : targets) {
                if (queue.isDeleted()) {
                    continue;
                }
                QueueArguments.Overflow overflow = queue.getQueueArguments().getOverflow();
                queue.getLock().lock();
                try {
                    if (overflow != QueueArguments.Overflow.DROP_HEAD && queue.isFull()) {
                        refused++;
                        if (overflow == QueueArguments.Overflow.REJECT_PUBLISH_DLX) {
                            refusedToDeadLetter.add(queue);
                        }
                        continue;
                    }
                    messageStore.retain(stored);
                    QueueEntry entry = queue.enqueue(stored, now);
                    if (isPersistent(queue) && message.isPersistent()) {
                        try {
                            persistEntry(queue, stored, entry);
                        } catch (PersistenceException e) {
                            persistenceFailed = true;
                        }
                    }
                    while (queue.isOverLimit()) {
                        dropped.computeIfAbsent(queue, q -> new ArrayList<>()).add(queue.removeHead());
                    }
                } finally {
                    queue.getLock().unlock();
                }
                enqueued++;
                toDispatch.add(queue);
            }
        } finally {
            messageStore.release(stored);
        }

        for (Map.Entry<Queue, List<QueueEntry>> drop : dropped.entrySet()) {
            deadLetter(drop.getKey(), drop.getValue(), REASON_MAXLEN);
        }
        for (Queue queue : refusedToDeadLetter) {
            deadLetterMessage(queue, message, REASON_MAXLEN, now);
        }
        for (Queue queue : toDispatch) {
            dispatcher.dispatch(queue);
        }
        return new PublishResult(targets.size(), enqueued, refused, persistenceFailed, 0);
    }

    private void persistEntry(Queue queue, StoredMessage stored, QueueEntry entry) {
        if (!stored.isPersisted()) {
            persistence.saveMessage(name, stored.getId(), stored.getMessage());
            stored.markPersisted();
        }
        persistence.saveQueueEntry(name, queue.getName(), entry.getSeq(), stored.getId());
    }

    // ===== Settlement =====

    /**
     * Permanently removes an acknowledged entry.
     */
    public void settle(Queue queue, QueueEntry entry) {
        queue.removeAcquired(entry);
        discard(queue, entry);
    }

    /**
     * Returns acquired entries to the head of their queue and runs a dispatch pass. Entries of a queue
     * that has been deleted meanwhile are dropped.
     */
    public void requeue(Queue queue, List<QueueEntry> entries) {
        if (queue.isDeleted()) {
            for (QueueEntry entry : entries) {
                discard(queue, entry);
            }
            return;
        }
        queue.requeue(entries);
        dispatcher.dispatch(queue);
    }

    /**
     * Rejected without requeue: dead-lettered if the queue has a dead letter exchange, dropped otherwise.
     */
    public void reject(Queue queue, List<QueueEntry> entries) {
        for (QueueEntry entry : entries) {
            queue.removeAcquired(entry);
        }
        deadLetter(queue, entries, REASON_REJECTED);
    }

    /**
     * Drops one message reference of a queue, removing its durable copy when this was the last one.
     * Safe to call more than once for the same entry.
     */
    public void discard(Queue queue, QueueEntry entry) {
        if (!entry.markRemoved()) {
            return;
        }
        StoredMessage stored = entry.getStoredMessage();
        if (isPersistent(queue) && !queue.isDeleted() && stored.isPersisted()) {
            try {
                persistence.deleteQueueEntry(name, queue.getName(), entry.getSeq());
            } catch (PersistenceException e) {
                logger.warn("Entry {} of queue '{}' stays on disk and will be redelivered after a restart",
                        entry.getSeq(), queue.getName());
            }
        }
        messageStore.release(stored);
    }

    private void messageReleased(StoredMessage stored) {
        if (stored.isPersisted() && persistence != null) {
            try {
                persistence.deleteMessage(name, stored.getId());
            } catch (PersistenceException e) {
                logger.warn("Message {} stays on disk until the next recovery removes it", stored.getId());
            }
        }
    }

    public int dispatch(Queue queue) {
        return dispatcher.dispatch(queue);
    }

    // ===== Dead lettering =====

    public void deadLetter(Queue queue, List<QueueEntry> entries, String reason) {
        long now = clock.millis();
        for (QueueEntry entry : entries) {
            if (entry.isRemoved()) {
                continue;
            }
            try {
                deadLetterMessage(queue, entry.getMessage(), reason, now);
            } finally {
                discard(queue, entry);
            }
        }
    }

    private void deadLetterMessage(Queue queue, Message message, String reason, long now) {
        QueueArguments queueArguments = queue.getQueueArguments();
        if (!queueArguments.hasDLX()) {
            logger.debug("Dropping {} message from queue '{}'", reason, queue.getName());
            return;
        }
        Exchange deadLetterExchange = exchanges.get(queueArguments.getDeadLetterExchange());
        if (deadLetterExchange == null) {
            logger.warn("Dead letter exchange '{}' of queue '{}' does not exist, dropping {} message",
                    queueArguments.getDeadLetterExchange(), queue.getName(), reason);
            return;
        }

        String routingKey = queueArguments.getDeadLetterRoutingKey() != null
            ? queueArguments.getDeadLetterRoutingKey()
            : message.getRoutingKey();
        Message dead = DeadLetters.withDeath(message, queue.getName(), reason, now)
            .exchange(deadLetterExchange.getName())
            .routingKey(routingKey)
            .build();

        Set<String> queueNames = router.route(deadLetterExchange, routingKey, dead.getHeaders());
        queueNames.removeIf(target -> DeadLetters.isCycle(dead, target));
        List<Queue> targets = resolve(queueNames);
        if (targets.isEmpty()) {
            logger.debug("Dead-lettered message from queue '{}' is unroutable", queue.getName());
            return;
        }
        enqueue(targets, dead);
        logger.debug("Dead-lettered {} message from queue '{}' via '{}'", reason, queue.getName(),
                deadLetterExchange.getName());
    }

    // ===== Housekeeping =====

    /**
     * Sweeps expired messages out of every queue and deletes queues whose lease ran out.
     */
    public void runHousekeeping() {
        long now = clock.millis();
        for (Queue queue : queues.values()) {
            expireMessages(queue, now);
        }

        topologyLock.lock();
        try {
            for (Queue queue : new ArrayList<>(queues.values())) {
                if (queue.isLeaseExpired(now)) {
                    logger.info("Queue '{}' in vhost '{}' unused for {} ms, deleting", queue.getName(), name,
                            queue.getQueueArguments().getExpires());
                    removeQueue(queue);
                }
            }
        } finally {
            topologyLock.unlock();
        }
    }

    private void expireMessages(Queue queue, long now) {
        List<QueueEntry> expired = queue.removeExpired(now);
        if (!expired.isEmpty()) {
            logger.debug("Expired {} message(s) in queue '{}'", expired.size(), queue.getName());
            deadLetter(queue, expired, REASON_EXPIRED);
        }
    }

    // ===== Recovery =====

    /**
     * Rebuilds durable exchanges, queues, bindings and persistent messages from storage.
     */
    public void recover() {
        if (persistence == null) {
            return;
        }
        long now = clock.millis();
        topologyLock.lock();
        try {
            for (Exchange exchange : persistence.loadExchanges(name)) {
                if (!typeRegistry.isRegistered(exchange.getTypeName())) {
                    logger.warn("Skipping exchange '{}' of unknown type '{}'", exchange.getName(), exchange.getTypeName());
                    continue;
                }
                exchanges.putIfAbsent(exchange.getName(), exchange);
            }

            for (PersistenceManager.QueueData data : persistence.loadQueues(name)) {
                Queue queue = new Queue(data.name, true, false, data.autoDelete, data.arguments, null, now);
                queue.applyDefaultMaxLength(config.getDefaultQueueMaxLength());
                queues.putIfAbsent(data.name, queue);
            }

            for (Binding binding : persistence.loadBindings(name)) {
                Exchange source = exchanges.get(binding.getSource());
                boolean destinationExists = binding.isToQueue()
                    ? queues.containsKey(binding.getDestination())
                    : exchanges.containsKey(binding.getDestination());
                if (source != null && destinationExists) {
                    bindingTable.bind(binding);
                    source.markBound();
                }
            }

            int restored = 0;
            for (PersistenceManager.EntryData data : persistence.loadQueueEntries(name)) {
                Queue queue = queues.get(data.queueName);
                StoredMessage stored = messageStore.restore(data.messageId, data.message);
                if (queue == null) {
                    messageStore.release(stored);
                    continue;
                }
                queue.restore(data.seq, stored, now);
                restored++;
            }
            persistence.deleteOrphanMessages(name);

            logger.info("Recovered vhost '{}': {} exchanges, {} queues, {} bindings, {} messages",
                    name, exchanges.size(), queues.size(), bindingTable.size(), restored);
        } finally {
            topologyLock.unlock();
        }
    }

    private boolean isPersistent(Queue queue) {
        return persistence != null && queue.isDurable() && !queue.isExclusive();
    }

    // ===== Lookups =====

    private Exchange requireExchange(String exchangeName) {
        Exchange exchange = exchanges.get(exchangeName);
        if (exchange == null) {
            throw ChannelException.notFound("no exchange '" + exchangeName + "' in vhost '" + name + "'");
        }
        return exchange;
    }

    private Queue requireQueue(String queueName) {
        Queue queue = queueName != null ? queues.get(queueName) : null;
        if (queue == null) {
            throw ChannelException.notFound("no queue '" + queueName + "' in vhost '" + name + "'");
        }
        return queue;
    }

    private static String describe(String type, boolean durable, boolean autoDelete, boolean internal,
                                   Map<String, Object> arguments) {
        return "type=" + type + ", durable=" + durable + ", auto_delete=" + autoDelete + ", internal=" + internal
            + ", args=" + (arguments != null ? arguments : Collections.emptyMap());
    }

    @Override
    public Exchange findExchange(String exchangeName) {
        return exchanges.get(exchangeName);
    }

    @Override
    public boolean queueExists(String queueName) {
        return queues.containsKey(queueName);
    }

    public Queue getQueue(String queueName) {
        return queues.get(queueName);
    }

    public Map<String, Queue> getQueues() {
        return Collections.unmodifiableMap(new HashMap<>(queues));
    }

    public Map<String, Exchange> getExchanges() {
        return Collections.unmodifiableMap(new HashMap<>(exchanges));
    }

    public String getName() {
        return name;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public BindingTable getBindingTable() {
        return bindingTable;
    }

    public MessageStore getMessageStore() {
        return messageStore;
    }

    public ConsumerManager getConsumerManager() {
        return consumerManager;
    }

    @Override
    public String toString() {
        return String.format("VirtualHost{name='%s', exchanges=%d, queues=%d, bindings=%d}",
                name, exchanges.size(), queues.size(), bindingTable.size());
    }
}
