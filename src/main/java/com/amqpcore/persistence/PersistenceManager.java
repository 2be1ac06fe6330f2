package com.amqpcore.persistence;

import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import com.amqpcore.model.Message;
import com.amqpcore.model.Queue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes durable exchanges, queues, bindings and persistent messages.
 *
 * <p>A persistent message is stored once in {@code messages}; each durable queue holding it has a
 * row in {@code queue_entries} carrying the entry sequence number, so recovery can rebuild queue
 * order. Every failure surfaces as a {@link PersistenceException}.
 */
public class PersistenceManager {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);

    private static final TypeReference<Map<String, Object>> TABLE_TYPE = new TypeReference<>() {
    };

    private final DatabaseManager databaseManager;
    private final ObjectMapper objectMapper;

    public PersistenceManager(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
        // sorted keys make equal tables serialize to equal text, bindings are matched on it
        this.objectMapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    // ===== Exchanges =====

    public void saveExchange(String vhost, Exchange exchange) {
        inTransaction("save exchange '" + exchange.getName() + "'", conn -> {
            try (PreparedStatement delete = conn.prepareStatement(
                    "DELETE FROM exchanges WHERE vhost = ? AND name = ?");
                 PreparedStatement insert = conn.prepareStatement("""
                    INSERT INTO exchanges (vhost, name, exchange_type, durable, auto_delete, internal, arguments)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """)) {
                delete.setString(1, vhost);
                delete.setString(2, exchange.getName());
                delete.executeUpdate();

                insert.setString(1, vhost);
                insert.setString(2, exchange.getName());
                insert.setString(3, exchange.getTypeName());
                insert.setBoolean(4, exchange.isDurable());
                insert.setBoolean(5, exchange.isAutoDelete());
                insert.setBoolean(6, exchange.isInternal());
                insert.setString(7, toJson(exchange.getArguments()));
                insert.executeUpdate();
            }
        });
        logger.debug("Saved exchange: {} in vhost: {}", exchange.getName(), vhost);
    }

    /**
     * Deletes an exchange and every binding it takes part in.
     */
    public void deleteExchange(String vhost, String name) {
        inTransaction("delete exchange '" + name + "'", conn -> {
            try (PreparedStatement bindings = conn.prepareStatement("""
                    DELETE FROM bindings WHERE vhost = ?
                      AND (source = ? OR (destination = ? AND destination_kind = 'EXCHANGE'))
                    """);
                 PreparedStatement exchange = conn.prepareStatement(
                    "DELETE FROM exchanges WHERE vhost = ? AND name = ?")) {
                bindings.setString(1, vhost);
                bindings.setString(2, name);
                bindings.setString(3, name);
                bindings.executeUpdate();

                exchange.setString(1, vhost);
                exchange.setString(2, name);
                exchange.executeUpdate();
            }
        });
        logger.debug("Deleted exchange: {} in vhost: {}", name, vhost);
    }

    public List<Exchange> loadExchanges(String vhost) {
        String sql = """
            SELECT name, exchange_type, durable, auto_delete, internal, arguments
            FROM exchanges WHERE vhost = ? ORDER BY name
            """;
        List<Exchange> exchanges = new ArrayList<>();

        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, vhost);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    exchanges.add(new Exchange(
                        rs.getString("name"),
                        rs.getString("exchange_type"),
                        rs.getBoolean("durable"),
                        rs.getBoolean("auto_delete"),
                        rs.getBoolean("internal"),
                        fromJson(rs.getString("arguments"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load exchanges of vhost '" + vhost + "'", e);
        }

        logger.info("Loaded {} durable exchanges from vhost: {}", exchanges.size(), vhost);
        return exchanges;
    }

    // ===== Queues =====

    public void saveQueue(String vhost, Queue queue) {
        inTransaction("save queue '" + queue.getName() + "'", conn -> {
            try (PreparedStatement delete = conn.prepareStatement(
                    "DELETE FROM queues WHERE vhost = ? AND name = ?");
                 PreparedStatement insert = conn.prepareStatement(
                    "INSERT INTO queues (vhost, name, auto_delete, arguments) VALUES (?, ?, ?, ?)")) {
                delete.setString(1, vhost);
                delete.setString(2, queue.getName());
                delete.executeUpdate();

                insert.setString(1, vhost);
                insert.setString(2, queue.getName());
                insert.setBoolean(3, queue.isAutoDelete());
                insert.setString(4, toJson(queue.getArguments()));
                insert.executeUpdate();
            }
        });
        logger.debug("Saved queue: {} in vhost: {}", queue.getName(), vhost);
    }

    /**
     * Deletes a queue, its entries and the bindings pointing at it.
     */
    public void deleteQueue(String vhost, String name) {
        inTransaction("delete queue '" + name + "'", conn -> {
            try (PreparedStatement bindings = conn.prepareStatement(
                    "DELETE FROM bindings WHERE vhost = ? AND destination = ? AND destination_kind = 'QUEUE'");
                 PreparedStatement entries = conn.prepareStatement(
                    "DELETE FROM queue_entries WHERE vhost = ? AND queue_name = ?");
                 PreparedStatement queue = conn.prepareStatement(
                    "DELETE FROM queues WHERE vhost = ? AND name = ?")) {
                bindings.setString(1, vhost);
                bindings.setString(2, name);
                bindings.executeUpdate();

                entries.setString(1, vhost);
                entries.setString(2, name);
                entries.executeUpdate();

                queue.setString(1, vhost);
                queue.setString(2, name);
                queue.executeUpdate();
            }
        });
        logger.debug("Deleted queue: {} in vhost: {}", name, vhost);
    }

    public List<QueueData> loadQueues(String vhost) {
        String sql = "SELECT name, auto_delete, arguments FROM queues WHERE vhost = ? ORDER BY name";
        List<QueueData> queues = new ArrayList<>();

        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, vhost);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    queues.add(new QueueData(
                        rs.getString("name"),
                        rs.getBoolean("auto_delete"),
                        fromJson(rs.getString("arguments"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load queues of vhost '" + vhost + "'", e);
        }

        logger.info("Loaded {} durable queues from vhost: {}", queues.size(), vhost);
        return queues;
    }

    // ===== Bindings =====

    public void saveBinding(String vhost, Binding binding) {
        String sql = """
            INSERT INTO bindings (vhost, source, destination, destination_kind, routing_key, arguments)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        execute("save " + binding, sql, stmt -> {
            stmt.setString(1, vhost);
            stmt.setString(2, binding.getSource());
            stmt.setString(3, binding.getDestination());
            stmt.setString(4, binding.getDestinationKind().name());
            stmt.setString(5, binding.getRoutingKey());
            stmt.setString(6, toJson(binding.getArguments()));
        });
    }

    public void deleteBinding(String vhost, Binding binding) {
        String sql = """
            DELETE FROM bindings WHERE vhost = ? AND source = ? AND destination = ?
              AND destination_kind = ? AND routing_key = ? AND arguments = ?
            """;
        execute("delete " + binding, sql, stmt -> {
            stmt.setString(1, vhost);
            stmt.setString(2, binding.getSource());
            stmt.setString(3, binding.getDestination());
            stmt.setString(4, binding.getDestinationKind().name());
            stmt.setString(5, binding.getRoutingKey());
            stmt.setString(6, toJson(binding.getArguments()));
        });
    }

    public List<Binding> loadBindings(String vhost) {
        String sql = """
            SELECT source, destination, destination_kind, routing_key, arguments
            FROM bindings WHERE vhost = ?
            """;
        List<Binding> bindings = new ArrayList<>();

        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, vhost);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    bindings.add(new Binding(
                        rs.getString("source"),
                        rs.getString("destination"),
                        Binding.DestinationKind.valueOf(rs.getString("destination_kind")),
                        rs.getString("routing_key"),
                        fromJson(rs.getString("arguments"))));
                }
            }
        } catch (SQLException e) {
            throw failure("load bindings of vhost '" + vhost + "'", e);
        }

        logger.info("Loaded {} durable bindings from vhost: {}", bindings.size(), vhost);
        return bindings;
    }

    // ===== Messages =====

    public void saveMessage(String vhost, long id, Message message) {
        String sql = """
            INSERT INTO messages (vhost, id, exchange_name, routing_key, content_type, content_encoding,
                                  headers, delivery_mode, priority, correlation_id, reply_to,
                                  expiration, message_id, msg_timestamp, message_type, user_id, app_id,
                                  cluster_id, body)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        execute("save message " + id, sql, stmt -> {
            stmt.setString(1, vhost);
            stmt.setLong(2, id);
            stmt.setString(3, message.getExchange());
            stmt.setString(4, message.getRoutingKey());
            stmt.setString(5, message.getContentType());
            stmt.setString(6, message.getContentEncoding());
            stmt.setString(7, message.getHeaders().isEmpty() ? null : toJson(message.getHeaders()));
            stmt.setShort(8, message.getDeliveryMode());
            stmt.setShort(9, message.getPriority());
            stmt.setString(10, message.getCorrelationId());
            stmt.setString(11, message.getReplyTo());
            stmt.setString(12, message.getExpiration());
            stmt.setString(13, message.getMessageId());
            stmt.setLong(14, message.getTimestamp());
            stmt.setString(15, message.getType());
            stmt.setString(16, message.getUserId());
            stmt.setString(17, message.getAppId());
            stmt.setString(18, message.getClusterId());
            stmt.setBytes(19, message.getBody());
        });
        logger.debug("Saved message {} in vhost: {}", id, vhost);
    }

    public void deleteMessage(String vhost, long id) {
        execute("delete message " + id, "DELETE FROM messages WHERE vhost = ? AND id = ?", stmt -> {
            stmt.setString(1, vhost);
            stmt.setLong(2, id);
        });
    }

    public void saveQueueEntry(String vhost, String queueName, long seq, long messageId) {
        String sql = "INSERT INTO queue_entries (vhost, queue_name, seq, message_id) VALUES (?, ?, ?, ?)";
        execute("save entry " + seq + " of queue '" + queueName + "'", sql, stmt -> {
            stmt.setString(1, vhost);
            stmt.setString(2, queueName);
            stmt.setLong(3, seq);
            stmt.setLong(4, messageId);
        });
    }

    public void deleteQueueEntry(String vhost, String queueName, long seq) {
        String sql = "DELETE FROM queue_entries WHERE vhost = ? AND queue_name = ? AND seq = ?";
        execute("delete entry " + seq + " of queue '" + queueName + "'", sql, stmt -> {
            stmt.setString(1, vhost);
            stmt.setString(2, queueName);
            stmt.setLong(3, seq);
        });
    }

    /**
     * Loads every queue entry of the vhost joined with its message, ordered by queue and sequence.
     */
    public List<EntryData> loadQueueEntries(String vhost) {
        String sql = """
            SELECT e.queue_name, e.seq, m.*
            FROM queue_entries e
            JOIN messages m ON m.vhost = e.vhost AND m.id = e.message_id
            WHERE e.vhost = ?
            ORDER BY e.queue_name, e.seq
            """;
        List<EntryData> entries = new ArrayList<>();

        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, vhost);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new EntryData(
                        rs.getString("queue_name"),
                        rs.getLong("seq"),
                        rs.getLong("id"),
                        readMessage(rs)));
                }
            }
        } catch (SQLException e) {
            throw failure("load messages of vhost '" + vhost + "'", e);
        }

        logger.info("Loaded {} persistent queue entries from vhost: {}", entries.size(), vhost);
        return entries;
    }

    /**
     * Deletes message rows no queue entry refers to.
     *
     * @return the number of rows deleted
     */
    public int deleteOrphanMessages(String vhost) {
        String sql = """
            DELETE FROM messages WHERE vhost = ? AND NOT EXISTS (
                SELECT 1 FROM queue_entries e WHERE e.vhost = messages.vhost AND e.message_id = messages.id)
            """;
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, vhost);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                logger.info("Deleted {} orphaned messages from vhost: {}", deleted, vhost);
            }
            return deleted;
        } catch (SQLException e) {
            throw failure("delete orphaned messages of vhost '" + vhost + "'", e);
        }
    }

    /**
     * Every vhost that owns at least one durable exchange or queue.
     */
    public Set<String> loadVirtualHosts() {
        String sql = "SELECT vhost FROM exchanges UNION SELECT vhost FROM queues";
        Set<String> vhosts = new LinkedHashSet<>();

        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                vhosts.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw failure("load virtual hosts", e);
        }
        return vhosts;
    }

    private Message readMessage(ResultSet rs) throws SQLException {
        Message.Builder builder = Message.builder()
            .exchange(rs.getString("exchange_name"))
            .routingKey(rs.getString("routing_key"))
            .contentType(rs.getString("content_type"))
            .contentEncoding(rs.getString("content_encoding"))
            .headers(fromJson(rs.getString("headers")))
            .correlationId(rs.getString("correlation_id"))
            .replyTo(rs.getString("reply_to"))
            .expiration(rs.getString("expiration"))
            .messageId(rs.getString("message_id"))
            .timestamp(rs.getLong("msg_timestamp"))
            .type(rs.getString("message_type"))
            .userId(rs.getString("user_id"))
            .appId(rs.getString("app_id"))
            .clusterId(rs.getString("cluster_id"))
            .body(rs.getBytes("body"));

        short deliveryMode = rs.getShort("delivery_mode");
        if (!rs.wasNull()) {
            builder.deliveryMode(deliveryMode);
        }
        short priority = rs.getShort("priority");
        if (!rs.wasNull()) {
            builder.priority(priority);
        }
        return builder.build();
    }

    // ===== JDBC plumbing =====

    private void execute(String what, String sql, StatementBinder binder) {
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure(what, e);
        }
    }

    private void inTransaction(String what, TransactionWork work) {
        try (Connection conn = databaseManager.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw failure(what, e);
        }
    }

    private PersistenceException failure(String what, SQLException e) {
        logger.error("Failed to {}", what, e);
        return new PersistenceException("Failed to " + what, e);
    }

    String toJson(Map<String, Object> table) {
        if (table == null || table.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(table);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize field table " + table.keySet(), e);
        }
    }

    Map<String, Object> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, TABLE_TYPE);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot parse field table: " + json, e);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @FunctionalInterface
    private interface TransactionWork {
        void run(Connection conn) throws SQLException;
    }

    public static class QueueData {
        public final String name;
        public final boolean autoDelete;
        public final Map<String, Object> arguments;

        public QueueData(String name, boolean autoDelete, Map<String, Object> arguments) {
            this.name = name;
            this.autoDelete = autoDelete;
            this.arguments = arguments;
        }
    }

    public static class EntryData {
        public final String queueName;
        public final long seq;
        public final long messageId;
        public final Message message;

        public EntryData(String queueName, long seq, long messageId, Message message) {
            this.queueName = queueName;
            this.seq = seq;
            this.messageId = messageId;
            this.message = message;
        }
    }
}
