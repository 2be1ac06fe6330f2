package com.amqpcore.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A routing rule from a source exchange to a queue or, for exchange-to-exchange bindings,
 * to another exchange. Two bindings are equal when source, destination, destination kind,
 * routing key and arguments all match.
 */
public final class Binding {
    private final String source;
    private final String destination;
    private final DestinationKind destinationKind;
    private final String routingKey;
    private final Map<String, Object> arguments;

    public Binding(String source, String destination, DestinationKind destinationKind,
                   String routingKey, Map<String, Object> arguments) {
        this.source = Objects.requireNonNull(source, "source");
        this.destination = Objects.requireNonNull(destination, "destination");
        this.destinationKind = Objects.requireNonNull(destinationKind, "destinationKind");
        this.routingKey = routingKey != null ? routingKey : "";
        this.arguments = arguments != null && !arguments.isEmpty()
            ? Collections.unmodifiableMap(new HashMap<>(arguments))
            : Collections.emptyMap();
    }

    public static Binding toQueue(String exchange, String queue, String routingKey, Map<String, Object> arguments) {
        return new Binding(exchange, queue, DestinationKind.QUEUE, routingKey, arguments);
    }

    public static Binding toExchange(String source, String destination, String routingKey,
                                     Map<String, Object> arguments) {
        return new Binding(source, destination, DestinationKind.EXCHANGE, routingKey, arguments);
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }

    public DestinationKind getDestinationKind() {
        return destinationKind;
    }

    public boolean isToQueue() {
        return destinationKind == DestinationKind.QUEUE;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding that = (Binding) o;
        return source.equals(that.source)
            && destination.equals(that.destination)
            && destinationKind == that.destinationKind
            && routingKey.equals(that.routingKey)
            && Arguments.equivalent(arguments, that.arguments);
    }

    @Override
    public int hashCode() {
        // arguments are left out: equivalent tables may differ in numeric width
        return Objects.hash(source, destination, destinationKind, routingKey);
    }

    @Override
    public String toString() {
        return String.format("Binding{source='%s', destination='%s', kind=%s, routingKey='%s', args=%s}",
                source, destination, destinationKind, routingKey, arguments);
    }

    public enum DestinationKind {
        QUEUE,
        EXCHANGE
    }
}
