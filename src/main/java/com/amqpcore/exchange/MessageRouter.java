package com.amqpcore.exchange;

import com.amqpcore.binding.BindingTable;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a publish to the set of destination queue names.
 *
 * <p>Exchange-to-exchange bindings are followed transitively, visiting each exchange at most once per
 * publish so binding cycles terminate. The default exchange routes to the queue named by the routing
 * key. An exchange that matches nothing hands the message to its alternate exchange, if it has one.
 */
public class MessageRouter {
    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final Topology topology;
    private final BindingTable bindingTable;
    private final ExchangeTypeRegistry typeRegistry;

    public MessageRouter(Topology topology, BindingTable bindingTable, ExchangeTypeRegistry typeRegistry) {
        this.topology = topology;
        this.bindingTable = bindingTable;
        this.typeRegistry = typeRegistry;
    }

    /**
     * @return destination queue names in routing order, empty when unroutable
     */
    public Set<String> route(Exchange exchange, String routingKey, Map<String, Object> headers) {
        Set<String> queues = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        routeInto(exchange, routingKey, headers != null ? headers : Collections.emptyMap(), visited, queues);
        logger.debug("Routed key '{}' via exchange '{}' to {}", routingKey, exchange.getName(), queues);
        return queues;
    }

    /**
     * @return true when this exchange, directly or through the exchanges it feeds, reached a queue
     */
    private boolean routeInto(Exchange exchange, String routingKey, Map<String, Object> headers,
                              Set<String> visited, Set<String> queues) {
        if (!visited.add(exchange.getName())) {
            return false;
        }

        if (exchange.isDefault()) {
            if (topology.queueExists(routingKey)) {
                queues.add(routingKey);
                return true;
            }
            return false;
        }

        RoutingFunction routingFunction = typeRegistry.lookup(exchange.getTypeName());
        List<Binding> matched = routingFunction.route(exchange, bindingTable.bindingsFor(exchange.getName()),
                routingKey, headers);

        boolean routed = false;
        for (Binding binding : matched) {
            if (binding.isToQueue()) {
                queues.add(binding.getDestination());
                routed = true;
            } else {
                Exchange destination = topology.findExchange(binding.getDestination());
                if (destination != null && routeInto(destination, routingKey, headers, visited, queues)) {
                    routed = true;
                }
            }
        }

        if (!routed && exchange.hasAlternateExchange()) {
            Exchange alternate = topology.findExchange(exchange.getAlternateExchange());
            if (alternate != null) {
                return routeInto(alternate, routingKey, headers, visited, queues);
            }
            logger.warn("Alternate exchange '{}' of exchange '{}' does not exist",
                    exchange.getAlternateExchange(), exchange.getName());
        }
        return routed;
    }

    /**
     * Read access to the entities of a virtual host.
     */
    public interface Topology {
        Exchange findExchange(String name);

        boolean queueExists(String name);
    }
}
