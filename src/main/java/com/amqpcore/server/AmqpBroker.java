package com.amqpcore.server;

import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.config.BrokerConfig;
import com.amqpcore.connection.AmqpConnection;
import com.amqpcore.exchange.ConsistentHashRouting;
import com.amqpcore.exchange.ExchangeTypeRegistry;
import com.amqpcore.persistence.DatabaseManager;
import com.amqpcore.persistence.PersistenceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Top-level broker: the virtual hosts, their shared persistence and the housekeeping scheduler.
 */
public class AmqpBroker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AmqpBroker.class);

    private final BrokerConfig config;
    private final Clock clock;
    private final DatabaseManager databaseManager;
    private final PersistenceManager persistenceManager;
    private final ExchangeTypeRegistry typeRegistry = new ExchangeTypeRegistry();
    private final ConcurrentMap<String, VirtualHost> virtualHosts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AmqpConnection> connections = new ConcurrentHashMap<>();
    private final AtomicLong connectionCounter = new AtomicLong(0);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ScheduledExecutorService housekeepingScheduler;

    /**
     * Creates a broker that owns its database pool when persistence is enabled.
     */
    public AmqpBroker(BrokerConfig config) {
        this(config, Clock.systemUTC(), config.isPersistenceEnabled() ? new DatabaseManager(config) : null);
    }

    /**
     * Creates a broker around an externally managed persistence layer; {@code persistenceManager}
     * may be null for a purely in-memory broker.
     */
    public AmqpBroker(BrokerConfig config, PersistenceManager persistenceManager, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.databaseManager = null;
        this.persistenceManager = persistenceManager;
        init();
    }

    private AmqpBroker(BrokerConfig config, Clock clock, DatabaseManager databaseManager) {
        this.config = config;
        this.clock = clock;
        this.databaseManager = databaseManager;
        this.persistenceManager = databaseManager != null ? new PersistenceManager(databaseManager) : null;
        init();
    }

    private void init() {
        typeRegistry.register(ConsistentHashRouting.TYPE_NAME, new ConsistentHashRouting());
        createVirtualHost(config.getDefaultVirtualHost());
        logger.info("AMQP broker initialized (persistence={}, default vhost='{}')",
                persistenceManager != null, config.getDefaultVirtualHost());
    }

    public VirtualHost createVirtualHost(String name) {
        return virtualHosts.computeIfAbsent(name, n -> {
            logger.info("Created virtual host '{}'", n);
            return new VirtualHost(n, config, clock, persistenceManager, typeRegistry);
        });
    }

    public VirtualHost getVirtualHost(String name) {
        return virtualHosts.get(name);
    }

    public Collection<VirtualHost> getVirtualHosts() {
        return Collections.unmodifiableCollection(virtualHosts.values());
    }

    /**
     * Recovers durable state of every persisted virtual host and starts the housekeeping timer.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (persistenceManager != null) {
            Set<String> persisted = persistenceManager.loadVirtualHosts();
            for (String name : persisted) {
                createVirtualHost(name);
            }
            for (VirtualHost vhost : virtualHosts.values()) {
                vhost.recover();
            }
        }

        long interval = config.getHousekeepingIntervalMs();
        if (interval > 0) {
            housekeepingScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "Broker-Housekeeping");
                t.setDaemon(true);
                return t;
            });
            housekeepingScheduler.scheduleWithFixedDelay(this::runHousekeeping, interval, interval,
                    TimeUnit.MILLISECONDS);
        }
        logger.info("AMQP broker started with {} virtual host(s)", virtualHosts.size());
    }

    /**
     * One housekeeping round: TTL sweep and lease expiry in every virtual host, then heartbeat checks.
     * A failing virtual host does not stop the others.
     */
    public void runHousekeeping() {
        for (VirtualHost vhost : virtualHosts.values()) {
            try {
                vhost.runHousekeeping();
            } catch (RuntimeException e) {
                logger.error("Housekeeping failed for vhost '{}'", vhost.getName(), e);
            }
        }
        long now = clock.millis();
        for (AmqpConnection connection : new ArrayList<>(connections.values())) {
            connection.checkHeartbeat(now);
        }
    }

    /**
     * Opens a connection to a virtual host.
     *
     * @throws ConnectionException NOT_ALLOWED for an unknown virtual host
     */
    public AmqpConnection openConnection(String vhostName) {
        VirtualHost vhost = virtualHosts.get(vhostName);
        if (vhost == null) {
            throw ConnectionException.notAllowed("vhost '" + vhostName + "' not found");
        }
        String id = "conn-" + connectionCounter.incrementAndGet();
        AmqpConnection connection = new AmqpConnection(id, this, vhost);
        connections.put(id, connection);
        logger.debug("Opened connection {} to vhost '{}'", id, vhostName);
        return connection;
    }

    public AmqpConnection openConnection() {
        return openConnection(config.getDefaultVirtualHost());
    }

    public void connectionClosed(AmqpConnection connection) {
        connections.remove(connection.getId(), connection);
    }

    public Collection<AmqpConnection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    /**
     * Stops housekeeping, force-closes every connection and releases the database pool if this
     * broker created it.
     */
    public void stop() {
        ScheduledExecutorService scheduler = housekeepingScheduler;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            housekeepingScheduler = null;
        }
        for (AmqpConnection connection : new ArrayList<>(connections.values())) {
            connection.protocolViolation(ErrorCode.CONNECTION_FORCED, "broker shutdown");
        }
        if (databaseManager != null) {
            databaseManager.close();
        }
        started.set(false);
        logger.info("AMQP broker stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStarted() {
        return started.get();
    }

    public BrokerConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public ExchangeTypeRegistry getTypeRegistry() {
        return typeRegistry;
    }

    public PersistenceManager getPersistenceManager() {
        return persistenceManager;
    }
}
