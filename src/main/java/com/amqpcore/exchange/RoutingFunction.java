package com.amqpcore.exchange;

import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Routing behaviour of one exchange type. Implementations are stateless with respect to the
 * binding table: they receive the source exchange's current bindings and pick the matching ones.
 */
@FunctionalInterface
public interface RoutingFunction {

    /**
     * @param exchange   the exchange being routed through
     * @param bindings   every binding whose source is {@code exchange}
     * @param routingKey the publish routing key
     * @param headers    the message headers, never null
     * @return the matching bindings, possibly empty
     */
    List<Binding> route(Exchange exchange, Collection<Binding> bindings, String routingKey,
                        Map<String, Object> headers);
}
