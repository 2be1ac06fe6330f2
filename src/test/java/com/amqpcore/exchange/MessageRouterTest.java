package com.amqpcore.exchange;

import com.amqpcore.binding.BindingTable;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Message Router Tests")
class MessageRouterTest {

    private final Map<String, Exchange> exchanges = new HashMap<>();
    private final Set<String> queues = new HashSet<>();
    private BindingTable bindingTable;
    private MessageRouter router;

    @BeforeEach
    void setUp() {
        bindingTable = new BindingTable();
        MessageRouter.Topology topology = new MessageRouter.Topology() {
            @Override
            public Exchange findExchange(String name) {
                return exchanges.get(name);
            }

            @Override
            public boolean queueExists(String name) {
                return queues.contains(name);
            }
        };
        router = new MessageRouter(topology, bindingTable, new ExchangeTypeRegistry());
        exchanges.put("", new Exchange("", Exchange.Type.DIRECT, true, false, false));
    }

    private Exchange exchange(String name, Exchange.Type type, Map<String, Object> args) {
        Exchange exchange = new Exchange(name, type.getTypeName(), false, false, false, args);
        exchanges.put(name, exchange);
        return exchange;
    }

    @Test
    @DisplayName("Default exchange routes to the queue named by the key")
    void testDefaultExchange() {
        queues.add("tasks");

        assertThat(router.route(exchanges.get(""), "tasks", null)).containsExactly("tasks");
        assertThat(router.route(exchanges.get(""), "missing", null)).isEmpty();
    }

    @Test
    @DisplayName("Topic exchange routes to every matching queue once")
    void testTopicFanIn() {
        Exchange topic = exchange("events", Exchange.Type.TOPIC, null);
        bindingTable.bind(Binding.toQueue("events", "all", "#", null));
        bindingTable.bind(Binding.toQueue("events", "orders", "order.*", null));
        bindingTable.bind(Binding.toQueue("events", "all", "order.created", null));

        assertThat(router.route(topic, "order.created", null)).containsExactlyInAnyOrder("all", "orders");
        assertThat(router.route(topic, "user.created", null)).containsExactly("all");
    }

    @Test
    @DisplayName("Exchange-to-exchange bindings are followed and cycles terminate")
    void testExchangeChainsAndCycles() {
        Exchange a = exchange("a", Exchange.Type.FANOUT, null);
        exchange("b", Exchange.Type.FANOUT, null);
        bindingTable.bind(Binding.toExchange("a", "b", "", null));
        bindingTable.bind(Binding.toExchange("b", "a", "", null));
        bindingTable.bind(Binding.toQueue("b", "qb", "", null));

        assertThat(router.route(a, "k", null)).containsExactly("qb");
    }

    @Test
    @DisplayName("Unroutable messages go to the alternate exchange")
    void testAlternateExchange() {
        Map<String, Object> args = new HashMap<>();
        args.put(Exchange.ALTERNATE_EXCHANGE_ARGUMENT, "unrouted");
        Exchange primary = exchange("primary", Exchange.Type.DIRECT, args);
        exchange("unrouted", Exchange.Type.FANOUT, null);
        bindingTable.bind(Binding.toQueue("primary", "known", "known", null));
        bindingTable.bind(Binding.toQueue("unrouted", "leftovers", "", null));

        assertThat(router.route(primary, "known", null)).containsExactly("known");
        assertThat(router.route(primary, "other", null)).containsExactly("leftovers");
    }

    @Test
    @DisplayName("The alternate exchange is skipped when the exchange matched a queue already reached")
    void testAlternateExchangeNotUsedWhenMatched() {
        Map<String, Object> args = new HashMap<>();
        args.put(Exchange.ALTERNATE_EXCHANGE_ARGUMENT, "ae");
        Exchange e1 = exchange("e1", Exchange.Type.FANOUT, null);
        exchange("e2", Exchange.Type.DIRECT, args);
        exchange("ae", Exchange.Type.FANOUT, null);
        bindingTable.bind(Binding.toQueue("e1", "q", "", null));
        bindingTable.bind(Binding.toExchange("e1", "e2", "", null));
        bindingTable.bind(Binding.toQueue("e2", "q", "k", null));
        bindingTable.bind(Binding.toQueue("ae", "ae-queue", "", null));

        assertThat(router.route(e1, "k", null)).containsExactly("q");
        assertThat(router.route(e1, "other", null)).containsExactlyInAnyOrder("q", "ae-queue");
    }

    @Test
    @DisplayName("A missing alternate exchange leaves the message unroutable")
    void testMissingAlternateExchange() {
        Map<String, Object> args = new HashMap<>();
        args.put(Exchange.ALTERNATE_EXCHANGE_ARGUMENT, "gone");
        Exchange primary = exchange("primary", Exchange.Type.DIRECT, args);

        assertThat(router.route(primary, "k", null)).isEmpty();
    }

    @Test
    @DisplayName("Headers exchange matches on message headers")
    void testHeaders() {
        Exchange headers = exchange("match", Exchange.Type.HEADERS, null);
        Map<String, Object> bindArgs = new HashMap<>();
        bindArgs.put(HeadersMatcher.X_MATCH, "all");
        bindArgs.put("format", "pdf");
        bindingTable.bind(Binding.toQueue("match", "pdfs", "", bindArgs));

        assertThat(router.route(headers, "", Map.of("format", "pdf"))).containsExactly("pdfs");
        assertThat(router.route(headers, "", Map.of("format", "zip"))).isEmpty();
    }
}
