package com.amqpcore.config;

import com.amqpcore.amqp.AmqpConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Broker configuration.
 * Built-in defaults are overridden by {@code broker.properties} on the classpath, then by environment
 * variables, then by the setters.
 */
public class BrokerConfig {
    private static final Logger logger = LoggerFactory.getLogger(BrokerConfig.class);

    public static final String PROPERTIES_RESOURCE = "broker.properties";

    // Persistence configuration
    private boolean persistenceEnabled = true;
    private String databaseUrl = "jdbc:h2:mem:amqpcore;DB_CLOSE_DELAY=-1;MODE=PostgreSQL";
    private String databaseUser = "sa";
    private String databasePassword = "";
    private int databasePoolSize = 10;

    // Virtual hosts
    private String defaultVirtualHost = AmqpConstants.DEFAULT_VHOST;

    // Housekeeping (TTL sweep, queue leases)
    private long housekeepingIntervalMs = 1000;

    // Queue and channel defaults
    private int defaultQueueMaxLength = 0; // 0 = unlimited
    private int channelMax = AmqpConstants.DEFAULT_CHANNEL_MAX;
    private int defaultPrefetch = 0; // 0 = unlimited

    public BrokerConfig() {
    }

    /**
     * Defaults, then {@code broker.properties} from the classpath, then the process environment.
     */
    public static BrokerConfig load() {
        BrokerConfig config = new BrokerConfig();
        try (InputStream in = BrokerConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                config.loadFromProperties(properties);
                logger.info("Loaded configuration from {}", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
        config.loadFromEnvironment(System.getenv());
        return config;
    }

    /**
     * Load configuration from environment variables.
     */
    public void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("AMQP_DB_URL")) {
            databaseUrl = env.get("AMQP_DB_URL");
        }
        if (env.containsKey("AMQP_DB_USER")) {
            databaseUser = env.get("AMQP_DB_USER");
        }
        if (env.containsKey("AMQP_DB_PASSWORD")) {
            databasePassword = env.get("AMQP_DB_PASSWORD");
        }
        if (env.containsKey("AMQP_HOUSEKEEPING_INTERVAL_MS")) {
            housekeepingIntervalMs = parseLong("AMQP_HOUSEKEEPING_INTERVAL_MS", env.get("AMQP_HOUSEKEEPING_INTERVAL_MS"));
        }
        if (env.containsKey("AMQP_DEFAULT_VHOST")) {
            defaultVirtualHost = env.get("AMQP_DEFAULT_VHOST");
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("persistence.enabled")) {
            persistenceEnabled = Boolean.parseBoolean(properties.getProperty("persistence.enabled"));
        }
        if (properties.containsKey("db.url")) {
            databaseUrl = properties.getProperty("db.url");
        }
        if (properties.containsKey("db.user")) {
            databaseUser = properties.getProperty("db.user");
        }
        if (properties.containsKey("db.password")) {
            databasePassword = properties.getProperty("db.password");
        }
        if (properties.containsKey("db.pool.size")) {
            databasePoolSize = parseInt("db.pool.size", properties.getProperty("db.pool.size"));
        }
        if (properties.containsKey("vhost.default")) {
            defaultVirtualHost = properties.getProperty("vhost.default");
        }
        if (properties.containsKey("housekeeping.interval.ms")) {
            housekeepingIntervalMs = parseLong("housekeeping.interval.ms", properties.getProperty("housekeeping.interval.ms"));
        }
        if (properties.containsKey("queue.max.length.default")) {
            defaultQueueMaxLength = parseInt("queue.max.length.default", properties.getProperty("queue.max.length.default"));
        }
        if (properties.containsKey("channel.max")) {
            channelMax = parseInt("channel.max", properties.getProperty("channel.max"));
        }
        if (properties.containsKey("consumer.prefetch.default")) {
            defaultPrefetch = parseInt("consumer.prefetch.default", properties.getProperty("consumer.prefetch.default"));
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for '" + key + "': " + value, e);
        }
    }

    /**
     * Export configuration as a map. The database password is left out.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("persistenceEnabled", persistenceEnabled);
        map.put("databaseUrl", databaseUrl);
        map.put("databaseUser", databaseUser);
        map.put("databasePoolSize", databasePoolSize);
        map.put("defaultVirtualHost", defaultVirtualHost);
        map.put("housekeepingIntervalMs", housekeepingIntervalMs);
        map.put("defaultQueueMaxLength", defaultQueueMaxLength);
        map.put("channelMax", channelMax);
        map.put("defaultPrefetch", defaultPrefetch);
        return map;
    }

    // Getters and setters
    public boolean isPersistenceEnabled() {
        return persistenceEnabled;
    }

    public void setPersistenceEnabled(boolean persistenceEnabled) {
        this.persistenceEnabled = persistenceEnabled;
    }

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public void setDatabaseUrl(String databaseUrl) {
        this.databaseUrl = databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public void setDatabaseUser(String databaseUser) {
        this.databaseUser = databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public void setDatabasePassword(String databasePassword) {
        this.databasePassword = databasePassword;
    }

    public int getDatabasePoolSize() {
        return databasePoolSize;
    }

    public void setDatabasePoolSize(int databasePoolSize) {
        this.databasePoolSize = databasePoolSize;
    }

    public String getDefaultVirtualHost() {
        return defaultVirtualHost;
    }

    public void setDefaultVirtualHost(String defaultVirtualHost) {
        this.defaultVirtualHost = defaultVirtualHost;
    }

    public long getHousekeepingIntervalMs() {
        return housekeepingIntervalMs;
    }

    public void setHousekeepingIntervalMs(long housekeepingIntervalMs) {
        this.housekeepingIntervalMs = housekeepingIntervalMs;
    }

    public int getDefaultQueueMaxLength() {
        return defaultQueueMaxLength;
    }

    public void setDefaultQueueMaxLength(int defaultQueueMaxLength) {
        this.defaultQueueMaxLength = defaultQueueMaxLength;
    }

    public int getChannelMax() {
        return channelMax;
    }

    public void setChannelMax(int channelMax) {
        this.channelMax = channelMax;
    }

    public int getDefaultPrefetch() {
        return defaultPrefetch;
    }

    public void setDefaultPrefetch(int defaultPrefetch) {
        this.defaultPrefetch = defaultPrefetch;
    }
}
