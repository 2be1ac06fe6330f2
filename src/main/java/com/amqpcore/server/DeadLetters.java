package com.amqpcore.server;

import com.amqpcore.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@code x-death} history carried by dead-lettered messages.
 */
final class DeadLetters {
    static final String X_DEATH = "x-death";
    static final String X_FIRST_DEATH_QUEUE = "x-first-death-queue";
    static final String X_FIRST_DEATH_REASON = "x-first-death-reason";
    static final String X_FIRST_DEATH_EXCHANGE = "x-first-death-exchange";

    static final String QUEUE = "queue";
    static final String REASON = "reason";
    static final String COUNT = "count";
    static final String EXCHANGE = "exchange";
    static final String ROUTING_KEYS = "routing-keys";
    static final String TIME = "time";
    static final String ORIGINAL_EXPIRATION = "original-expiration";

    private DeadLetters() {
    }

    /**
     * Copies the message with one more death recorded. A death from the same queue for the same reason
     * increments that entry's count and moves it to the front; otherwise a new entry is prepended.
     * The per-message expiration is removed so the copy does not expire again in its next queue.
     */
    static Message.Builder withDeath(Message message, String queueName, String reason, long now) {
        List<Map<String, Object>> deaths = deathsOf(message);

        Map<String, Object> death = null;
        for (Map<String, Object> existing : deaths) {
            if (queueName.equals(existing.get(QUEUE)) && reason.equals(existing.get(REASON))) {
                death = existing;
                break;
            }
        }
        if (death != null) {
            deaths.remove(death);
            death.put(COUNT, countOf(death) + 1);
        } else {
            death = new LinkedHashMap<>();
            death.put(QUEUE, queueName);
            death.put(REASON, reason);
            death.put(COUNT, 1L);
            death.put(EXCHANGE, message.getExchange());
            death.put(ROUTING_KEYS, Collections.singletonList(message.getRoutingKey()));
            if (message.getExpiration() != null) {
                death.put(ORIGINAL_EXPIRATION, message.getExpiration());
            }
        }
        death.put(TIME, now / 1000);
        deaths.add(0, death);

        Message.Builder builder = message.toBuilder()
            .expiration(null)
            .header(X_DEATH, deaths);
        if (!message.getHeaders().containsKey(X_FIRST_DEATH_QUEUE)) {
            builder.header(X_FIRST_DEATH_QUEUE, queueName)
                .header(X_FIRST_DEATH_REASON, reason)
                .header(X_FIRST_DEATH_EXCHANGE, message.getExchange());
        }
        return builder;
    }

    /**
     * True when dead-lettering into {@code queueName} would close a loop that no client ever
     * interrupted: the queue already appears in the history and none of the deaths was a rejection.
     */
    static boolean isCycle(Message message, String queueName) {
        boolean seen = false;
        for (Map<String, Object> death : deathsOf(message)) {
            if (VirtualHost.REASON_REJECTED.equals(death.get(REASON))) {
                return false;
            }
            if (queueName.equals(death.get(QUEUE))) {
                seen = true;
            }
        }
        return seen;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> deathsOf(Message message) {
        List<Map<String, Object>> deaths = new ArrayList<>();
        Object header = message.getHeaders().get(X_DEATH);
        if (header instanceof List) {
            for (Object item : (List<Object>) header) {
                if (item instanceof Map) {
                    deaths.add(new LinkedHashMap<>((Map<String, Object>) item));
                }
            }
        }
        return deaths;
    }

    private static long countOf(Map<String, Object> death) {
        Object count = death.get(COUNT);
        return count instanceof Number ? ((Number) count).longValue() : 0L;
    }
}
