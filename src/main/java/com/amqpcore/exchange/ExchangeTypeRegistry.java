package com.amqpcore.exchange;

import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps exchange type names to their routing functions. The four standard types are always
 * present; extension types such as {@code x-consistent-hash} are added with {@link #register}.
 */
public class ExchangeTypeRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeTypeRegistry.class);

    public static final RoutingFunction DIRECT = (exchange, bindings, routingKey, headers) -> {
        List<Binding> result = new ArrayList<>();
        for (Binding binding : bindings) {
            if (binding.getRoutingKey().equals(routingKey)) {
                result.add(binding);
            }
        }
        return result;
    };

    public static final RoutingFunction FANOUT = (exchange, bindings, routingKey, headers) ->
        new ArrayList<>(bindings);

    public static final RoutingFunction TOPIC = (exchange, bindings, routingKey, headers) -> {
        List<Binding> result = new ArrayList<>();
        for (Binding binding : bindings) {
            if (TopicMatcher.matches(binding.getRoutingKey(), routingKey)) {
                result.add(binding);
            }
        }
        return result;
    };

    public static final RoutingFunction HEADERS = (exchange, bindings, routingKey, headers) -> {
        List<Binding> result = new ArrayList<>();
        for (Binding binding : bindings) {
            if (HeadersMatcher.matches(binding.getArguments(), headers)) {
                result.add(binding);
            }
        }
        return result;
    };

    private final ConcurrentMap<String, RoutingFunction> types = new ConcurrentHashMap<>();

    public ExchangeTypeRegistry() {
        types.put(Exchange.Type.DIRECT.getTypeName(), DIRECT);
        types.put(Exchange.Type.FANOUT.getTypeName(), FANOUT);
        types.put(Exchange.Type.TOPIC.getTypeName(), TOPIC);
        types.put(Exchange.Type.HEADERS.getTypeName(), HEADERS);
    }

    /**
     * Registers an extension exchange type.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public void register(String typeName, RoutingFunction routingFunction) {
        String key = typeName.toLowerCase(Locale.ROOT);
        if (types.putIfAbsent(key, routingFunction) != null) {
            throw new IllegalArgumentException("Exchange type already registered: " + typeName);
        }
        logger.info("Registered exchange type '{}'", key);
    }

    public boolean isRegistered(String typeName) {
        return typeName != null && types.containsKey(typeName.toLowerCase(Locale.ROOT));
    }

    /**
     * @throws ConnectionException COMMAND_INVALID for an unknown type
     */
    public RoutingFunction lookup(String typeName) {
        RoutingFunction routingFunction = typeName != null ? types.get(typeName.toLowerCase(Locale.ROOT)) : null;
        if (routingFunction == null) {
            throw ConnectionException.commandInvalid("unknown exchange type '" + typeName + "'");
        }
        return routingFunction;
    }

    public Set<String> typeNames() {
        return Collections.unmodifiableSet(new TreeSet<>(types.keySet()));
    }
}
