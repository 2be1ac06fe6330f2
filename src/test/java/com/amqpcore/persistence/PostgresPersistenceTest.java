package com.amqpcore.persistence;

import com.amqpcore.AbstractPostgresTest;
import com.amqpcore.model.Binding;
import com.amqpcore.model.Exchange;
import com.amqpcore.model.Message;
import com.amqpcore.model.Queue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PostgreSQL Persistence Tests")
class PostgresPersistenceTest extends AbstractPostgresTest {

    @Test
    @DisplayName("Topology and messages round-trip through PostgreSQL")
    void testRoundTrip() {
        PersistenceManager persistence = new PersistenceManager(getDatabaseManager());
        String vhost = "pg-" + UUID.randomUUID();

        persistence.saveExchange(vhost, new Exchange("orders", Exchange.Type.TOPIC, true, false, false));
        persistence.saveQueue(vhost, new Queue("jobs", true, false, false));
        Binding binding = Binding.toQueue("orders", "jobs", "order.*", Map.of("x-priority", 1));
        persistence.saveBinding(vhost, binding);
        persistence.saveMessage(vhost, 1, Message.builder().persistent()
                .body("payload".getBytes(StandardCharsets.UTF_8)).build());
        persistence.saveQueueEntry(vhost, "jobs", 1, 1);

        assertThat(persistence.loadExchanges(vhost)).extracting(Exchange::getName).containsExactly("orders");
        assertThat(persistence.loadBindings(vhost)).containsExactly(binding);
        List<PersistenceManager.EntryData> entries = persistence.loadQueueEntries(vhost);
        assertThat(entries).hasSize(1);
        assertThat(new String(entries.get(0).message.getBody(), StandardCharsets.UTF_8)).isEqualTo("payload");

        persistence.deleteBinding(vhost, binding);
        persistence.deleteQueue(vhost, "jobs");
        assertThat(persistence.loadBindings(vhost)).isEmpty();
        assertThat(persistence.deleteOrphanMessages(vhost)).isEqualTo(1);
    }
}
