package com.amqpcore.model;

import com.amqpcore.amqp.ChannelException;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Typed view of the {@code x-} queue arguments the broker interprets. Unknown arguments are kept
 * in the raw table but otherwise ignored.
 */
public class QueueArguments {
    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String EXPIRES = "x-expires";
    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String MAX_LENGTH = "x-max-length";
    public static final String OVERFLOW = "x-overflow";

    private String deadLetterExchange;
    private String deadLetterRoutingKey;
    private Long messageTtl;  // in milliseconds
    private Long expires;  // queue lease in milliseconds
    private Integer maxLength;  // max number of ready messages
    private Overflow overflow = Overflow.DROP_HEAD;

    public QueueArguments() {
    }

    /**
     * Parses declare arguments, rejecting values of the wrong type or range.
     *
     * @throws ChannelException PRECONDITION_FAILED for an invalid argument
     */
    public static QueueArguments fromMap(Map<String, Object> args) {
        QueueArguments queueArgs = new QueueArguments();
        if (args == null) {
            return queueArgs;
        }

        if (args.containsKey(DEAD_LETTER_EXCHANGE)) {
            queueArgs.setDeadLetterExchange(stringArgument(args, DEAD_LETTER_EXCHANGE));
        }
        if (args.containsKey(DEAD_LETTER_ROUTING_KEY)) {
            queueArgs.setDeadLetterRoutingKey(stringArgument(args, DEAD_LETTER_ROUTING_KEY));
        }
        if (args.containsKey(MESSAGE_TTL)) {
            queueArgs.setMessageTtl(longArgument(args, MESSAGE_TTL, 0));
        }
        if (args.containsKey(EXPIRES)) {
            queueArgs.setExpires(longArgument(args, EXPIRES, 1));
        }
        if (args.containsKey(MAX_LENGTH)) {
            queueArgs.setMaxLength((int) Math.min(Integer.MAX_VALUE, longArgument(args, MAX_LENGTH, 0)));
        }
        if (args.containsKey(OVERFLOW)) {
            String value = stringArgument(args, OVERFLOW);
            Overflow overflow = Overflow.fromValue(value);
            if (overflow == null) {
                throw ChannelException.preconditionFailed("invalid arg '" + OVERFLOW + "' value '" + value + "'");
            }
            queueArgs.setOverflow(overflow);
        }
        if (queueArgs.deadLetterRoutingKey != null && queueArgs.deadLetterExchange == null) {
            throw ChannelException.preconditionFailed(DEAD_LETTER_ROUTING_KEY + " requires " + DEAD_LETTER_EXCHANGE);
        }

        return queueArgs;
    }

    private static String stringArgument(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        throw ChannelException.preconditionFailed("invalid arg '" + key + "' for type " + typeOf(value));
    }

    private static long longArgument(Map<String, Object> args, String key, long minimum) {
        Object value = args.get(key);
        if (!(value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)) {
            throw ChannelException.preconditionFailed("invalid arg '" + key + "' for type " + typeOf(value));
        }
        long longValue = ((Number) value).longValue();
        if (longValue < minimum) {
            throw ChannelException.preconditionFailed("invalid arg '" + key + "' value " + longValue);
        }
        return longValue;
    }

    private static String typeOf(Object value) {
        return value == null ? "void" : value.getClass().getSimpleName();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();

        if (deadLetterExchange != null) {
            map.put(DEAD_LETTER_EXCHANGE, deadLetterExchange);
        }
        if (deadLetterRoutingKey != null) {
            map.put(DEAD_LETTER_ROUTING_KEY, deadLetterRoutingKey);
        }
        if (messageTtl != null) {
            map.put(MESSAGE_TTL, messageTtl);
        }
        if (expires != null) {
            map.put(EXPIRES, expires);
        }
        if (maxLength != null) {
            map.put(MAX_LENGTH, maxLength);
        }
        if (overflow != Overflow.DROP_HEAD) {
            map.put(OVERFLOW, overflow.getValue());
        }

        return map;
    }

    public String getDeadLetterExchange() {
        return deadLetterExchange;
    }

    public void setDeadLetterExchange(String deadLetterExchange) {
        this.deadLetterExchange = deadLetterExchange;
    }

    public String getDeadLetterRoutingKey() {
        return deadLetterRoutingKey;
    }

    public void setDeadLetterRoutingKey(String deadLetterRoutingKey) {
        this.deadLetterRoutingKey = deadLetterRoutingKey;
    }

    public Long getMessageTtl() {
        return messageTtl;
    }

    public void setMessageTtl(Long messageTtl) {
        this.messageTtl = messageTtl;
    }

    public Long getExpires() {
        return expires;
    }

    public void setExpires(Long expires) {
        this.expires = expires;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(Integer maxLength) {
        this.maxLength = maxLength;
    }

    public Overflow getOverflow() {
        return overflow;
    }

    public void setOverflow(Overflow overflow) {
        this.overflow = overflow;
    }

    public boolean hasDLX() {
        return deadLetterExchange != null;
    }

    public boolean hasTTL() {
        return messageTtl != null;
    }

    public boolean hasExpiry() {
        return expires != null;
    }

    public boolean hasMaxLength() {
        return maxLength != null;
    }

    public enum Overflow {
        DROP_HEAD("drop-head"),
        REJECT_PUBLISH("reject-publish"),
        REJECT_PUBLISH_DLX("reject-publish-dlx");

        private final String value;

        Overflow(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static Overflow fromValue(String value) {
            for (Overflow overflow : values()) {
                if (overflow.value.equals(value)) {
                    return overflow;
                }
            }
            return null;
        }
    }

    @Override
    public String toString() {
        return "QueueArguments" + toMap();
    }
}
