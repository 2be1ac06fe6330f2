package com.amqpcore.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * An exchange declaration. Routing state lives in the binding table; routing behaviour is
 * looked up by type name in the {@link com.amqpcore.exchange.ExchangeTypeRegistry}.
 */
public class Exchange {
    public static final String ALTERNATE_EXCHANGE_ARGUMENT = "alternate-exchange";

    private final String name;
    private final Type type;
    private final String typeName;
    private final boolean durable;
    private final boolean autoDelete;
    private final boolean internal;
    private final Map<String, Object> arguments;
    private volatile boolean everBound;

    public Exchange(String name, String typeName, boolean durable, boolean autoDelete,
                    boolean internal, Map<String, Object> arguments) {
        this.name = name;
        this.typeName = typeName.toLowerCase(Locale.ROOT);
        this.type = Type.fromName(this.typeName);
        this.durable = durable;
        this.autoDelete = autoDelete;
        this.internal = internal;
        this.arguments = arguments != null
            ? Collections.unmodifiableMap(new HashMap<>(arguments))
            : Collections.emptyMap();
    }

    public Exchange(String name, Type type, boolean durable, boolean autoDelete, boolean internal) {
        this(name, type.getTypeName(), durable, autoDelete, internal, null);
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    /**
     * The declared type name, e.g. {@code "topic"} or {@code "x-consistent-hash"}.
     */
    public String getTypeName() {
        return typeName;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isAutoDelete() {
        return autoDelete;
    }

    public boolean isInternal() {
        return internal;
    }

    public boolean isDefault() {
        return name.isEmpty();
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    public String getAlternateExchange() {
        Object value = arguments.get(ALTERNATE_EXCHANGE_ARGUMENT);
        return value != null ? value.toString() : null;
    }

    public boolean hasAlternateExchange() {
        String alternate = getAlternateExchange();
        return alternate != null && !alternate.isEmpty();
    }

    public boolean isEverBound() {
        return everBound;
    }

    public void markBound() {
        this.everBound = true;
    }

    /**
     * True when a redeclaration with these attributes is equivalent to this exchange.
     */
    public boolean isEquivalent(String otherTypeName, boolean otherDurable, boolean otherAutoDelete,
                                boolean otherInternal, Map<String, Object> otherArguments) {
        return typeName.equalsIgnoreCase(otherTypeName)
            && durable == otherDurable
            && autoDelete == otherAutoDelete
            && internal == otherInternal
            && Arguments.equivalent(arguments, otherArguments);
    }

    public enum Type {
        DIRECT("direct"),
        FANOUT("fanout"),
        TOPIC("topic"),
        HEADERS("headers"),
        CUSTOM(null);

        private final String typeName;

        Type(String typeName) {
            this.typeName = typeName;
        }

        public String getTypeName() {
            return typeName;
        }

        public static Type fromName(String name) {
            for (Type type : values()) {
                if (type.typeName != null && type.typeName.equalsIgnoreCase(name)) {
                    return type;
                }
            }
            return CUSTOM;
        }
    }

    @Override
    public String toString() {
        return String.format("Exchange{name='%s', type=%s, durable=%s, autoDelete=%s, internal=%s, AE='%s'}",
                name, typeName, durable, autoDelete, internal, getAlternateExchange());
    }
}
