package com.amqpcore.exchange;

import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consistent hash exchange type: each message goes to exactly one binding, picked by hashing the
 * routing key onto a ring of virtual nodes. The binding key carries the weight, either as
 * {@code "10"} or {@code "weight:10"}; anything else counts as 1.
 */
public class ConsistentHashRouting implements RoutingFunction {
    public static final String TYPE_NAME = "x-consistent-hash";

    private static final int VIRTUAL_NODES = 100; // per unit of weight

    // one ring per exchange, rebuilt when its bindings change
    private final ConcurrentMap<String, Ring> rings = new ConcurrentHashMap<>();

    @Override
    public List<Binding> route(Exchange exchange, Collection<Binding> bindings, String routingKey,
                               Map<String, Object> headers) {
        if (bindings.isEmpty()) {
            rings.remove(exchange.getName());
            return Collections.emptyList();
        }

        Set<Binding> current = new HashSet<>(bindings);
        Ring ring = rings.compute(exchange.getName(), (name, existing) ->
            existing != null && existing.bindings.equals(current) ? existing : new Ring(current));

        Map.Entry<Long, Binding> entry = ring.nodes.ceilingEntry(hash(routingKey));
        if (entry == null) {
            // wrap around
            entry = ring.nodes.firstEntry();
        }
        return Collections.singletonList(entry.getValue());
    }

    /**
     * Number of ring positions each destination holds for the given exchange. Empty until the
     * exchange has routed a message.
     */
    public Map<String, Integer> getDistribution(String exchangeName) {
        Ring ring = rings.get(exchangeName);
        if (ring == null) {
            return Collections.emptyMap();
        }
        Map<String, Integer> stats = new ConcurrentHashMap<>();
        for (Binding binding : ring.nodes.values()) {
            stats.merge(binding.getDestination(), 1, Integer::sum);
        }
        return stats;
    }

    static int extractWeight(String routingKey) {
        if (routingKey == null || routingKey.isEmpty()) {
            return 1;
        }
        try {
            int weight = routingKey.startsWith("weight:")
                ? Integer.parseInt(routingKey.substring(7))
                : Integer.parseInt(routingKey);
            return Math.max(weight, 1);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    /**
     * MD5 based hash, first 8 bytes of the digest.
     */
    static long hash(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(key.getBytes(StandardCharsets.UTF_8));

            long hash = 0;
            for (int i = 0; i < 8 && i < digest.length; i++) {
                hash = (hash << 8) | (digest[i] & 0xFF);
            }
            return hash;
        } catch (NoSuchAlgorithmException e) {
            // MD5 is mandatory on every JRE
            return key.hashCode();
        }
    }

    private static final class Ring {
        private final Set<Binding> bindings;
        private final TreeMap<Long, Binding> nodes = new TreeMap<>();

        private Ring(Set<Binding> bindings) {
            this.bindings = bindings;
            List<Binding> ordered = new ArrayList<>(bindings);
            // deterministic ring regardless of set iteration order
            ordered.sort((a, b) -> (a.getDestination() + a.getRoutingKey())
                    .compareTo(b.getDestination() + b.getRoutingKey()));
            for (Binding binding : ordered) {
                int virtualNodes = VIRTUAL_NODES * extractWeight(binding.getRoutingKey());
                for (int i = 0; i < virtualNodes; i++) {
                    nodes.putIfAbsent(hash(binding.getDestinationKind() + ":" + binding.getDestination() + ":" + i), binding);
                }
            }
        }
    }
}
