package com.amqpcore.model;

import com.amqpcore.amqp.AmqpConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A published message: opaque body plus the basic content properties.
 * Instances are immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public final class Message {
    private final String exchange;
    private final String routingKey;
    private final String contentType;
    private final String contentEncoding;
    private final Map<String, Object> headers;
    private final short deliveryMode;
    private final short priority;
    private final String correlationId;
    private final String replyTo;
    private final String expiration;
    private final String messageId;
    private final long timestamp;
    private final String type;
    private final String userId;
    private final String appId;
    private final String clusterId;
    private final byte[] body;

    private Message(Builder builder) {
        this.exchange = builder.exchange != null ? builder.exchange : "";
        this.routingKey = builder.routingKey != null ? builder.routingKey : "";
        this.contentType = builder.contentType;
        this.contentEncoding = builder.contentEncoding;
        this.headers = builder.headers == null || builder.headers.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.deliveryMode = builder.deliveryMode;
        this.priority = builder.priority;
        this.correlationId = builder.correlationId;
        this.replyTo = builder.replyTo;
        this.expiration = builder.expiration;
        this.messageId = builder.messageId;
        this.timestamp = builder.timestamp;
        this.type = builder.type;
        this.userId = builder.userId;
        this.appId = builder.appId;
        this.clusterId = builder.clusterId;
        this.body = builder.body != null ? builder.body.clone() : new byte[0];
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Message of(byte[] body) {
        return builder().body(body).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.exchange = exchange;
        builder.routingKey = routingKey;
        builder.contentType = contentType;
        builder.contentEncoding = contentEncoding;
        builder.headers = new LinkedHashMap<>(headers);
        builder.deliveryMode = deliveryMode;
        builder.priority = priority;
        builder.correlationId = correlationId;
        builder.replyTo = replyTo;
        builder.expiration = expiration;
        builder.messageId = messageId;
        builder.timestamp = timestamp;
        builder.type = type;
        builder.userId = userId;
        builder.appId = appId;
        builder.clusterId = clusterId;
        builder.body = body;
        return builder;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public short getDeliveryMode() {
        return deliveryMode;
    }

    public boolean isPersistent() {
        return deliveryMode == AmqpConstants.DELIVERY_MODE_PERSISTENT;
    }

    public short getPriority() {
        return priority;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public String getExpiration() {
        return expiration;
    }

    /**
     * Per-message TTL in milliseconds, or -1 when the expiration property is absent or malformed.
     */
    public long getExpirationMillis() {
        if (expiration == null || expiration.isEmpty()) {
            return -1;
        }
        try {
            long ttl = Long.parseLong(expiration.trim());
            return ttl < 0 ? -1 : ttl;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public String getMessageId() {
        return messageId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getType() {
        return type;
    }

    public String getUserId() {
        return userId;
    }

    public String getAppId() {
        return appId;
    }

    public String getClusterId() {
        return clusterId;
    }

    /**
     * Returns a copy of the body.
     */
    public byte[] getBody() {
        return body.clone();
    }

    public int getBodySize() {
        return body.length;
    }

    @Override
    public String toString() {
        return String.format("Message{exchange='%s', routingKey='%s', contentType='%s', deliveryMode=%d, bodySize=%d}",
                exchange, routingKey, contentType, deliveryMode, body.length);
    }

    public static final class Builder {
        private String exchange;
        private String routingKey;
        private String contentType;
        private String contentEncoding;
        private Map<String, Object> headers;
        private short deliveryMode = AmqpConstants.DELIVERY_MODE_TRANSIENT;
        private short priority = 0;
        private String correlationId;
        private String replyTo;
        private String expiration;
        private String messageId;
        private long timestamp;
        private String type;
        private String userId;
        private String appId;
        private String clusterId;
        private byte[] body;

        private Builder() {
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers != null ? new LinkedHashMap<>(headers) : null;
            return this;
        }

        public Builder header(String name, Object value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(name, value);
            return this;
        }

        public Builder deliveryMode(short deliveryMode) {
            if (deliveryMode != AmqpConstants.DELIVERY_MODE_TRANSIENT
                    && deliveryMode != AmqpConstants.DELIVERY_MODE_PERSISTENT) {
                throw new IllegalArgumentException("Invalid delivery mode: " + deliveryMode);
            }
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder persistent() {
            return deliveryMode(AmqpConstants.DELIVERY_MODE_PERSISTENT);
        }

        public Builder priority(int priority) {
            if (priority < 0 || priority > AmqpConstants.MAX_PRIORITY) {
                throw new IllegalArgumentException("Priority must be between 0 and "
                        + AmqpConstants.MAX_PRIORITY + ": " + priority);
            }
            this.priority = (short) priority;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder expiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder clusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Message build() {
            return new Message(this);
        }
    }
}
