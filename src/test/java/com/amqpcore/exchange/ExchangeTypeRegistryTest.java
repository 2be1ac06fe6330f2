package com.amqpcore.exchange;

import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Exchange Type Registry Tests")
class ExchangeTypeRegistryTest {

    private ExchangeTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ExchangeTypeRegistry();
    }

    @Test
    @DisplayName("Standard types are always registered")
    void testStandardTypes() {
        assertThat(registry.typeNames()).containsExactly("direct", "fanout", "headers", "topic");
        assertThat(registry.isRegistered("TOPIC")).isTrue();
        assertThat(registry.isRegistered(null)).isFalse();
    }

    @Test
    @DisplayName("Extension types can be registered once")
    void testRegisterExtension() {
        RoutingFunction none = (exchange, bindings, key, headers) -> Collections.emptyList();
        registry.register("x-none", none);

        assertThat(registry.lookup("x-none")).isSameAs(none);
        assertThatThrownBy(() -> registry.register("X-NONE", none))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unknown type is a COMMAND_INVALID connection error")
    void testUnknownType() {
        assertThatThrownBy(() -> registry.lookup("x-unknown"))
            .isInstanceOf(ConnectionException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.COMMAND_INVALID);
    }

    @Test
    @DisplayName("Direct routing matches the exact key only")
    void testDirect() {
        Exchange exchange = new Exchange("logs", Exchange.Type.DIRECT, false, false, false);
        Binding error = Binding.toQueue("logs", "q1", "error", null);
        Binding info = Binding.toQueue("logs", "q2", "info", null);

        List<Binding> matched = ExchangeTypeRegistry.DIRECT.route(exchange, List.of(error, info), "error",
                Collections.emptyMap());

        assertThat(matched).containsExactly(error);
    }

    @Test
    @DisplayName("Fanout routing ignores the key")
    void testFanout() {
        Exchange exchange = new Exchange("all", Exchange.Type.FANOUT, false, false, false);
        Binding a = Binding.toQueue("all", "a", "x", null);
        Binding b = Binding.toQueue("all", "b", "", null);

        assertThat(ExchangeTypeRegistry.FANOUT.route(exchange, List.of(a, b), "anything", Collections.emptyMap()))
            .containsExactlyInAnyOrder(a, b);
    }
}
