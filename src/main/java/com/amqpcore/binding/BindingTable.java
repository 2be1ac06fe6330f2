package com.amqpcore.binding;

import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.ChannelException;
import com.amqpcore.model.Binding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * All bindings of one virtual host, indexed by source exchange.
 *
 * <p>Reads are lock free so routing never waits on topology changes. Writers are expected to be
 * serialized by the virtual host's topology lock; the table itself only guarantees that each
 * individual call is atomic.
 */
public class BindingTable {
    private static final Logger logger = LoggerFactory.getLogger(BindingTable.class);

    private final ConcurrentMap<String, Set<Binding>> bySource = new ConcurrentHashMap<>();

    /**
     * Adds a binding.
     *
     * @return false when an identical binding already exists
     * @throws ChannelException ACCESS_REFUSED when either end is the default exchange
     */
    public boolean bind(Binding binding) {
        checkNotDefault(binding);
        boolean added = bySource.computeIfAbsent(binding.getSource(), k -> new CopyOnWriteArraySet<>()).add(binding);
        if (added) {
            logger.debug("Added {}", binding);
        }
        return added;
    }

    /**
     * Removes a binding.
     *
     * @throws ChannelException NOT_FOUND when no identical binding exists
     */
    public void unbind(Binding binding) {
        checkNotDefault(binding);
        Set<Binding> bindings = bySource.get(binding.getSource());
        if (bindings == null || !bindings.remove(binding)) {
            throw ChannelException.notFound("no binding '" + binding.getRoutingKey() + "' between exchange '"
                    + binding.getSource() + "' and " + describe(binding));
        }
        if (bindings.isEmpty()) {
            bySource.remove(binding.getSource(), bindings);
        }
        logger.debug("Removed {}", binding);
    }

    public boolean contains(Binding binding) {
        Set<Binding> bindings = bySource.get(binding.getSource());
        return bindings != null && bindings.contains(binding);
    }

    public List<Binding> bindingsFor(String source) {
        Set<Binding> bindings = bySource.get(source);
        return bindings != null ? new ArrayList<>(bindings) : Collections.emptyList();
    }

    public List<Binding> bindingsTo(Binding.DestinationKind kind, String destination) {
        List<Binding> result = new ArrayList<>();
        for (Set<Binding> bindings : bySource.values()) {
            for (Binding binding : bindings) {
                if (binding.getDestinationKind() == kind && binding.getDestination().equals(destination)) {
                    result.add(binding);
                }
            }
        }
        return result;
    }

    /**
     * Removes every binding pointing at a deleted queue or exchange.
     *
     * @return the removed bindings
     */
    public List<Binding> removeDestination(Binding.DestinationKind kind, String destination) {
        List<Binding> removed = bindingsTo(kind, destination);
        for (Binding binding : removed) {
            Set<Binding> bindings = bySource.get(binding.getSource());
            if (bindings != null) {
                bindings.remove(binding);
                if (bindings.isEmpty()) {
                    bySource.remove(binding.getSource(), bindings);
                }
            }
        }
        return removed;
    }

    /**
     * Removes every binding whose source is a deleted exchange.
     *
     * @return the removed bindings
     */
    public List<Binding> removeSource(String source) {
        Set<Binding> removed = bySource.remove(source);
        return removed != null ? new ArrayList<>(removed) : Collections.emptyList();
    }

    public boolean hasBindings(String source) {
        Set<Binding> bindings = bySource.get(source);
        return bindings != null && !bindings.isEmpty();
    }

    public List<Binding> all() {
        List<Binding> result = new ArrayList<>();
        for (Set<Binding> bindings : bySource.values()) {
            result.addAll(bindings);
        }
        return result;
    }

    public int size() {
        int size = 0;
        for (Set<Binding> bindings : bySource.values()) {
            size += bindings.size();
        }
        return size;
    }

    private static void checkNotDefault(Binding binding) {
        if (AmqpConstants.DEFAULT_EXCHANGE.equals(binding.getSource())) {
            throw ChannelException.accessRefused("operation not permitted on the default exchange");
        }
        if (!binding.isToQueue() && AmqpConstants.DEFAULT_EXCHANGE.equals(binding.getDestination())) {
            throw ChannelException.accessRefused("operation not permitted on the default exchange");
        }
    }

    private static String describe(Binding binding) {
        return (binding.isToQueue() ? "queue '" : "exchange '") + binding.getDestination() + "'";
    }
}
