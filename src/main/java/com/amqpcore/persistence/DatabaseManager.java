package com.amqpcore.persistence;

import com.amqpcore.config.BrokerConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for the broker's durable state. The SQL is kept to what both
 * PostgreSQL and H2 (in PostgreSQL mode) accept.
 */
public class DatabaseManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private final HikariDataSource dataSource;

    public DatabaseManager(BrokerConfig config) {
        this(config.getDatabaseUrl(), config.getDatabaseUser(), config.getDatabasePassword(),
             config.getDatabasePoolSize());
    }

    public DatabaseManager(String jdbcUrl, String username, String password, int poolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(Math.min(2, poolSize));
        config.setIdleTimeout(300000);
        config.setConnectionTimeout(20000);
        config.setPoolName("amqpcore-db");

        this.dataSource = new HikariDataSource(config);

        initializeSchema();
        logger.info("Database manager initialized for {}", jdbcUrl);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    private void initializeSchema() {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS exchanges (
                    vhost VARCHAR(255) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    exchange_type VARCHAR(100) NOT NULL,
                    durable BOOLEAN NOT NULL,
                    auto_delete BOOLEAN NOT NULL,
                    internal BOOLEAN NOT NULL,
                    arguments TEXT,
                    PRIMARY KEY (vhost, name)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS queues (
                    vhost VARCHAR(255) NOT NULL,
                    name VARCHAR(255) NOT NULL,
                    auto_delete BOOLEAN NOT NULL,
                    arguments TEXT,
                    PRIMARY KEY (vhost, name)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS bindings (
                    vhost VARCHAR(255) NOT NULL,
                    source VARCHAR(255) NOT NULL,
                    destination VARCHAR(255) NOT NULL,
                    destination_kind VARCHAR(16) NOT NULL,
                    routing_key VARCHAR(255) NOT NULL,
                    arguments VARCHAR(4096) NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS messages (
                    vhost VARCHAR(255) NOT NULL,
                    id BIGINT NOT NULL,
                    exchange_name VARCHAR(255),
                    routing_key VARCHAR(255),
                    content_type VARCHAR(255),
                    content_encoding VARCHAR(255),
                    headers TEXT,
                    delivery_mode SMALLINT,
                    priority SMALLINT,
                    correlation_id VARCHAR(255),
                    reply_to VARCHAR(255),
                    expiration VARCHAR(255),
                    message_id VARCHAR(255),
                    msg_timestamp BIGINT,
                    message_type VARCHAR(255),
                    user_id VARCHAR(255),
                    app_id VARCHAR(255),
                    cluster_id VARCHAR(255),
                    body BYTEA,
                    PRIMARY KEY (vhost, id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS queue_entries (
                    vhost VARCHAR(255) NOT NULL,
                    queue_name VARCHAR(255) NOT NULL,
                    seq BIGINT NOT NULL,
                    message_id BIGINT NOT NULL,
                    PRIMARY KEY (vhost, queue_name, seq),
                    FOREIGN KEY (vhost, queue_name) REFERENCES queues(vhost, name) ON DELETE CASCADE
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_bindings_vhost_source ON bindings(vhost, source)
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_queue_entries_message ON queue_entries(vhost, message_id)
                """);

            logger.info("Database schema initialized");

        } catch (SQLException e) {
            logger.error("Failed to initialize database schema", e);
            throw new PersistenceException("Database initialization failed", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            logger.info("Database connection pool closed");
        }
    }
}
