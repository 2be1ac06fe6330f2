package com.amqpcore.connection;

import com.amqpcore.MutableClock;
import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.ChannelException;
import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.config.BrokerConfig;
import com.amqpcore.confirms.ConfirmOutcome;
import com.amqpcore.model.Message;
import com.amqpcore.model.QueueArguments;
import com.amqpcore.server.AmqpBroker;
import com.amqpcore.server.PublishResult;
import com.amqpcore.server.VirtualHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AMQP Channel Tests")
class AmqpChannelTest {

    private MutableClock clock;
    private AmqpBroker broker;
    private VirtualHost vhost;
    private AmqpConnection connection;
    private AmqpChannel channel;

    @BeforeEach
    void setUp() {
        BrokerConfig config = new BrokerConfig();
        config.setPersistenceEnabled(false);
        clock = new MutableClock(1000);
        broker = new AmqpBroker(config, null, clock);
        vhost = broker.getVirtualHost(config.getDefaultVirtualHost());
        connection = broker.openConnection();
        channel = connection.openChannel(1);
    }

    @AfterEach
    void tearDown() {
        broker.stop();
    }

    private static Message text(String body) {
        return Message.of(body.getBytes(StandardCharsets.UTF_8));
    }

    private static String body(Message message) {
        return new String(message.getBody(), StandardCharsets.UTF_8);
    }

    private static List<ChannelEvent.Deliver> deliveries(List<ChannelEvent> events) {
        List<ChannelEvent.Deliver> result = new ArrayList<>();
        for (ChannelEvent event : events) {
            if (event instanceof ChannelEvent.Deliver) {
                result.add((ChannelEvent.Deliver) event);
            }
        }
        return result;
    }

    private static List<String> bodies(List<ChannelEvent.Deliver> deliveries) {
        List<String> result = new ArrayList<>();
        for (ChannelEvent.Deliver deliver : deliveries) {
            result.add(body(deliver.getMessage()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> deaths(Message message) {
        return (List<Map<String, Object>>) message.getHeaders().get("x-death");
    }

    private void declareDeadLetterTarget() {
        channel.exchangeDeclare("dlx", "fanout");
        channel.queueDeclare("dead", false, false, false, null);
        channel.queueBind("dead", "dlx", "");
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("Fanout delivers one stored copy to every bound queue")
        void testFanoutCopies() {
            channel.exchangeDeclare("logs", "fanout");
            channel.queueDeclare("q1", false, false, false, null);
            channel.queueDeclare("q2", false, false, false, null);
            channel.queueBind("q1", "logs", "");
            channel.queueBind("q2", "logs", "");

            PublishResult result = channel.basicPublish("logs", "ignored", text("hello"));

            assertThat(result.getEnqueued()).isEqualTo(2);
            assertThat(vhost.getMessageStore().size()).isEqualTo(1);

            GetResponse first = channel.basicGet("q1", true);
            GetResponse second = channel.basicGet("q2", true);
            assertThat(body(first.getMessage())).isEqualTo("hello");
            assertThat(body(second.getMessage())).isEqualTo("hello");
            assertThat(first.getExchange()).isEqualTo("logs");
            assertThat(first.getRoutingKey()).isEqualTo("ignored");
            assertThat(vhost.getMessageStore().size()).isZero();
        }

        @Test
        @DisplayName("Default exchange routes by queue name")
        void testDefaultExchange() {
            channel.queueDeclare("tasks", false, false, false, null);

            channel.basicPublish("", "tasks", text("job"));

            assertThat(channel.queueDeclarePassive("tasks").getMessageCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Mandatory unroutable publish is returned with 312")
        void testMandatoryReturn() {
            PublishResult result = channel.basicPublish("amq.direct", "nowhere", true, false, text("lost"));

            assertThat(result.isUnroutable()).isTrue();
            ChannelEvent event = channel.pollEvent();
            assertThat(event).isInstanceOf(ChannelEvent.Return.class);
            ChannelEvent.Return returned = (ChannelEvent.Return) event;
            assertThat(returned.getReplyCode()).isEqualTo(AmqpConstants.REPLY_NO_ROUTE);
            assertThat(returned.getReplyText()).isEqualTo("NO_ROUTE");
            assertThat(body(returned.getMessage())).isEqualTo("lost");
        }

        @Test
        @DisplayName("Non-mandatory unroutable publish is dropped silently")
        void testSilentDrop() {
            channel.basicPublish("amq.direct", "nowhere", text("lost"));

            assertThat(channel.drainEvents()).isEmpty();
            assertThat(vhost.getMessageStore().size()).isZero();
        }

        @Test
        @DisplayName("Immediate publish without consumers is returned with 313 and not enqueued")
        void testImmediateReturn() {
            channel.queueDeclare("idle", false, false, false, null);

            PublishResult result = channel.basicPublish("", "idle", false, true, text("now"));

            assertThat(result.isNoConsumers()).isTrue();
            ChannelEvent.Return returned = (ChannelEvent.Return) channel.pollEvent();
            assertThat(returned.getReplyCode()).isEqualTo(AmqpConstants.REPLY_NO_CONSUMERS);
            assertThat(channel.queueDeclarePassive("idle").getMessageCount()).isZero();
        }

        @Test
        @DisplayName("Publishing to a missing exchange closes the channel with NOT_FOUND")
        void testMissingExchange() {
            assertThatThrownBy(() -> channel.basicPublish("missing", "k", text("x")))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_FOUND);

            assertThat(channel.isOpen()).isFalse();
            assertThat(connection.isOpen()).isTrue();
            assertThatThrownBy(() -> channel.basicPublish("", "q", text("x")))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CHANNEL_ERROR);
        }
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        @DisplayName("Redeclaring with the same attributes is idempotent")
        void testIdempotentDeclare() {
            channel.queueDeclare("orders", false, false, false, Map.of(QueueArguments.MAX_LENGTH, 10));
            channel.basicPublish("", "orders", text("o1"));

            QueueDeclareResult again = channel.queueDeclare("orders", false, false, false,
                    Map.of(QueueArguments.MAX_LENGTH, 10L));

            assertThat(again.getQueueName()).isEqualTo("orders");
            assertThat(again.getMessageCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Redeclaring with different attributes is PRECONDITION_FAILED")
        void testConflictingDeclare() {
            channel.queueDeclare("orders", false, false, false, null);

            assertThatThrownBy(() -> channel.queueDeclare("orders", true, false, false, null))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRECONDITION_FAILED);
            assertThat(channel.isOpen()).isFalse();
            ChannelEvent.ChannelClosed closed = (ChannelEvent.ChannelClosed) channel.drainEvents().get(0);
            assertThat(closed.getReplyCode()).isEqualTo(AmqpConstants.REPLY_PRECONDITION_FAILED);
        }

        @Test
        @DisplayName("Exchange redeclared with another type is PRECONDITION_FAILED")
        void testConflictingExchange() {
            channel.exchangeDeclare("events", "topic");

            assertThatThrownBy(() -> channel.exchangeDeclare("events", "fanout"))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRECONDITION_FAILED);
        }

        @Test
        @DisplayName("The amq. prefix is reserved")
        void testReservedPrefix() {
            assertThatThrownBy(() -> channel.queueDeclare("amq.mine", false, false, false, null))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ACCESS_REFUSED);

            AmqpChannel other = connection.openChannel(2);
            assertThatThrownBy(() -> other.exchangeDeclare("amq.mine", "direct"))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ACCESS_REFUSED);
        }

        @Test
        @DisplayName("An empty name declares a server-named queue")
        void testServerNamedQueue() {
            QueueDeclareResult result = channel.queueDeclare();

            assertThat(result.getQueueName()).startsWith(AmqpConstants.GENERATED_QUEUE_PREFIX);
            assertThat(vhost.getQueue(result.getQueueName()).isExclusive()).isTrue();
        }

        @Test
        @DisplayName("Passive declare of a missing queue is NOT_FOUND")
        void testPassiveMissing() {
            assertThatThrownBy(() -> channel.queueDeclarePassive("ghost"))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("Unknown exchange type closes the connection with COMMAND_INVALID")
        void testUnknownExchangeType() {
            assertThatThrownBy(() -> channel.exchangeDeclare("odd", "x-unknown"))
                .isInstanceOf(ConnectionException.class);

            assertThat(connection.isOpen()).isFalse();
            assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_COMMAND_INVALID);
        }

        @Test
        @DisplayName("Purge removes ready messages only")
        void testPurge() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("a"));
            channel.basicPublish("", "q", text("b"));
            channel.basicPublish("", "q", text("c"));
            channel.basicGet("q", false);

            assertThat(channel.queuePurge("q")).isEqualTo(2);
            assertThat(channel.getUnackedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Delete if-empty refuses a queue holding messages")
        void testDeleteIfEmpty() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("a"));

            assertThatThrownBy(() -> channel.queueDelete("q", false, true))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRECONDITION_FAILED);
            assertThat(vhost.getQueue("q")).isNotNull();
        }
    }

    @Nested
    @DisplayName("Queue lifetimes")
    class LifetimeTests {

        @Test
        @DisplayName("Exclusive queues are locked to their connection and deleted with it")
        void testExclusiveQueue() {
            channel.queueDeclare("private", false, true, false, null);

            AmqpConnection other = broker.openConnection();
            AmqpChannel otherChannel = other.openChannel(1);
            assertThatThrownBy(() -> otherChannel.queueDeclarePassive("private"))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.RESOURCE_LOCKED);

            connection.close();

            assertThat(vhost.getQueue("private")).isNull();
            assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_SUCCESS);
        }

        @Test
        @DisplayName("Auto-delete queue goes away with its last consumer")
        void testAutoDelete() {
            channel.queueDeclare("temp", false, false, true, null);
            String tag = channel.basicConsume("temp", true);

            assertThat(vhost.getQueue("temp")).isNotNull();
            channel.basicCancel(tag);

            assertThat(vhost.getQueue("temp")).isNull();
        }

        @Test
        @DisplayName("Auto-delete queue that never had a consumer stays")
        void testAutoDeleteWithoutConsumers() {
            channel.queueDeclare("temp", false, false, true, null);

            broker.runHousekeeping();

            assertThat(vhost.getQueue("temp")).isNotNull();
        }

        @Test
        @DisplayName("A queue lease expires after the idle period")
        void testLeaseExpiry() {
            channel.queueDeclare("lease", false, false, false, Map.of(QueueArguments.EXPIRES, 1000));

            clock.advance(999);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNotNull();

            clock.advance(500);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNull();
        }

        @Test
        @DisplayName("A queue lease counts from the moment its last consumer left")
        void testLeaseAfterLastConsumer() {
            channel.queueDeclare("lease", false, false, false, Map.of(QueueArguments.EXPIRES, 1000));
            String tag = channel.basicConsume("lease", true);

            clock.advance(5000);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNotNull();

            channel.basicCancel(tag);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNotNull();

            clock.advance(999);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNotNull();

            clock.advance(1);
            broker.runHousekeeping();
            assertThat(vhost.getQueue("lease")).isNull();
        }

        @Test
        @DisplayName("Deleting a consumed queue cancels its consumers")
        void testDeleteCancelsConsumers() {
            channel.queueDeclare("q", false, false, false, null);
            String tag = channel.basicConsume("q", false);
            channel.drainEvents();

            AmqpChannel admin = connection.openChannel(2);
            admin.queueDelete("q", false, false);

            ChannelEvent event = channel.pollEvent();
            assertThat(event).isInstanceOf(ChannelEvent.ConsumerCancelled.class);
            assertThat(((ChannelEvent.ConsumerCancelled) event).getConsumerTag()).isEqualTo(tag);
            assertThat(channel.getConsumers()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Expiry and dead lettering")
    class DeadLetterTests {

        @Test
        @DisplayName("Messages past the queue TTL are dead-lettered with reason expired")
        void testTtlDeadLetter() {
            declareDeadLetterTarget();
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.MESSAGE_TTL, 500);
            args.put(QueueArguments.DEAD_LETTER_EXCHANGE, "dlx");
            channel.queueDeclare("short", false, false, false, args);
            channel.basicPublish("", "short", text("stale"));

            clock.advance(600);
            broker.runHousekeeping();

            assertThat(channel.queueDeclarePassive("short").getMessageCount()).isZero();
            GetResponse dead = channel.basicGet("dead", true);
            assertThat(body(dead.getMessage())).isEqualTo("stale");
            assertThat(dead.getExchange()).isEqualTo("dlx");
            assertThat(dead.getRoutingKey()).isEqualTo("short");
            List<Map<String, Object>> deaths = deaths(dead.getMessage());
            assertThat(deaths).hasSize(1);
            assertThat(deaths.get(0))
                .containsEntry("queue", "short")
                .containsEntry("reason", "expired")
                .containsEntry("count", 1L)
                .containsEntry("exchange", "");
            assertThat(dead.getMessage().getHeaders()).containsEntry("x-first-death-reason", "expired");
        }

        @Test
        @DisplayName("Expired messages are never handed out")
        void testExpiredNotDelivered() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", Message.builder().expiration("100")
                    .body("late".getBytes(StandardCharsets.UTF_8)).build());

            clock.advance(150);

            assertThat(channel.basicGet("q", true)).isNull();
        }

        @Test
        @DisplayName("Expired messages leave the message count before any sweep runs")
        void testTtlCountWithoutSweep() {
            declareDeadLetterTarget();
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.MESSAGE_TTL, 500);
            args.put(QueueArguments.DEAD_LETTER_EXCHANGE, "dlx");
            channel.queueDeclare("short", false, false, false, args);
            channel.basicPublish("", "short", text("stale"));

            clock.advance(600);

            assertThat(channel.queueDeclarePassive("short").getMessageCount()).isZero();
            assertThat(body(channel.basicGet("dead", true).getMessage())).isEqualTo("stale");
        }

        @Test
        @DisplayName("basic.get reports only live messages as remaining")
        void testGetRemainingSkipsExpired() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("live"));
            channel.basicPublish("", "q", Message.builder().expiration("100")
                    .body("late".getBytes(StandardCharsets.UTF_8)).build());

            clock.advance(150);
            GetResponse response = channel.basicGet("q", true);

            assertThat(body(response.getMessage())).isEqualTo("live");
            assertThat(response.getMessageCount()).isZero();
        }

        @Test
        @DisplayName("A very large expiration never expires")
        void testHugeExpiration() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", Message.builder().expiration(String.valueOf(Long.MAX_VALUE))
                    .body("forever".getBytes(StandardCharsets.UTF_8)).build());

            clock.advance(60000);
            broker.runHousekeeping();

            GetResponse response = channel.basicGet("q", true);
            assertThat(response).isNotNull();
            assertThat(body(response.getMessage())).isEqualTo("forever");
        }

        @Test
        @DisplayName("Rejected messages are dead-lettered with reason rejected")
        void testRejectDeadLetter() {
            declareDeadLetterTarget();
            channel.queueDeclare("work", false, false, false,
                    Map.of(QueueArguments.DEAD_LETTER_EXCHANGE, "dlx"));
            channel.basicPublish("", "work", text("bad"));

            GetResponse response = channel.basicGet("work", false);
            channel.basicReject(response.getDeliveryTag(), false);

            GetResponse dead = channel.basicGet("dead", true);
            assertThat(body(dead.getMessage())).isEqualTo("bad");
            assertThat(deaths(dead.getMessage()).get(0)).containsEntry("reason", "rejected");
            assertThat(channel.queueDeclarePassive("work").getMessageCount()).isZero();
        }

        @Test
        @DisplayName("Dead-letter routing key override")
        void testDeadLetterRoutingKey() {
            channel.queueDeclare("parking", false, false, false, null);
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.DEAD_LETTER_EXCHANGE, "");
            args.put(QueueArguments.DEAD_LETTER_ROUTING_KEY, "parking");
            channel.queueDeclare("work", false, false, false, args);
            channel.basicPublish("", "work", text("x"));

            channel.basicNack(channel.basicGet("work", false).getDeliveryTag(), false, false);

            assertThat(channel.basicGet("parking", true).getRoutingKey()).isEqualTo("parking");
        }

        @Test
        @DisplayName("A message expiring back into its own queue is dropped instead of looping")
        void testDeadLetterCycle() {
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.MESSAGE_TTL, 100);
            args.put(QueueArguments.DEAD_LETTER_EXCHANGE, "");
            channel.queueDeclare("loop", false, false, false, args);
            channel.basicPublish("", "loop", text("round"));

            clock.advance(200);
            broker.runHousekeeping();

            assertThat(channel.queueDeclarePassive("loop").getMessageCount()).isZero();
            assertThat(vhost.getMessageStore().size()).isZero();
        }

        @Test
        @DisplayName("Drop-head overflow dead-letters the oldest message with reason maxlen")
        void testDropHead() {
            declareDeadLetterTarget();
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.MAX_LENGTH, 2);
            args.put(QueueArguments.DEAD_LETTER_EXCHANGE, "dlx");
            channel.queueDeclare("bounded", false, false, false, args);

            channel.basicPublish("", "bounded", text("m1"));
            channel.basicPublish("", "bounded", text("m2"));
            channel.basicPublish("", "bounded", text("m3"));

            assertThat(channel.queueDeclarePassive("bounded").getMessageCount()).isEqualTo(2);
            GetResponse dead = channel.basicGet("dead", true);
            assertThat(body(dead.getMessage())).isEqualTo("m1");
            assertThat(deaths(dead.getMessage()).get(0)).containsEntry("reason", "maxlen");
            assertThat(body(channel.basicGet("bounded", true).getMessage())).isEqualTo("m2");
        }
    }

    @Nested
    @DisplayName("Consumers and acknowledgements")
    class ConsumerTests {

        @Test
        @DisplayName("ConsumeOk precedes the first delivery")
        void testConsumeOkFirst() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("waiting"));

            String tag = channel.basicConsume("q", true);

            List<ChannelEvent> events = channel.drainEvents();
            assertThat(events).hasSize(2);
            assertThat(events.get(0)).isInstanceOf(ChannelEvent.ConsumeOk.class);
            assertThat(((ChannelEvent.ConsumeOk) events.get(0)).getConsumerTag()).isEqualTo(tag);
            assertThat(events.get(1)).isInstanceOf(ChannelEvent.Deliver.class);
        }

        @Test
        @DisplayName("Prefetch 1 holds back deliveries until the ack")
        void testPrefetchOne() {
            channel.queueDeclare("q", false, false, false, null);
            for (int i = 1; i <= 5; i++) {
                channel.basicPublish("", "q", text("m" + i));
            }
            channel.basicQos(1, false);

            channel.basicConsume("q", false);
            List<ChannelEvent.Deliver> first = deliveries(channel.drainEvents());
            assertThat(bodies(first)).containsExactly("m1");

            channel.basicAck(first.get(0).getDeliveryTag(), false);
            assertThat(bodies(deliveries(channel.drainEvents()))).containsExactly("m2");
        }

        @Test
        @DisplayName("Prefetch 3 allows three unacknowledged deliveries")
        void testPrefetchThree() {
            channel.queueDeclare("q", false, false, false, null);
            for (int i = 1; i <= 5; i++) {
                channel.basicPublish("", "q", text("m" + i));
            }
            channel.basicQos(3, false);

            channel.basicConsume("q", false);

            assertThat(bodies(deliveries(channel.drainEvents()))).containsExactly("m1", "m2", "m3");
            assertThat(channel.getUnackedCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Two consumers with prefetch 1 and 3 share a queue within their limits")
        void testPrefetchAcrossConsumers() {
            channel.queueDeclare("q", false, false, false, null);
            for (int i = 1; i <= 5; i++) {
                channel.basicPublish("", "q", text("m" + i));
            }
            AmqpChannel other = connection.openChannel(2);

            channel.basicQos(1, false);
            channel.basicConsume("q", false);
            assertThat(channel.getUnackedCount()).isEqualTo(1);

            other.basicQos(3, false);
            other.basicConsume("q", false);
            assertThat(channel.getUnackedCount()).isEqualTo(1);
            assertThat(other.getUnackedCount()).isEqualTo(3);
            assertThat(vhost.getQueue("q").messageCount()).isEqualTo(1);

            List<ChannelEvent.Deliver> first = deliveries(channel.drainEvents());
            assertThat(bodies(first)).containsExactly("m1");
            assertThat(bodies(deliveries(other.drainEvents()))).containsExactly("m2", "m3", "m4");

            channel.basicAck(first.get(0).getDeliveryTag(), false);

            assertThat(bodies(deliveries(channel.drainEvents()))).containsExactly("m5");
            assertThat(deliveries(other.drainEvents())).isEmpty();
            assertThat(channel.getUnackedCount()).isEqualTo(1);
            assertThat(other.getUnackedCount()).isEqualTo(3);
            assertThat(vhost.getQueue("q").messageCount()).isZero();
        }

        @Test
        @DisplayName("Global prefetch caps the whole channel")
        void testGlobalPrefetch() {
            channel.queueDeclare("a", false, false, false, null);
            channel.queueDeclare("b", false, false, false, null);
            for (int i = 0; i < 3; i++) {
                channel.basicPublish("", "a", text("a" + i));
                channel.basicPublish("", "b", text("b" + i));
            }
            channel.basicQos(2, true);

            channel.basicConsume("a", false);
            channel.basicConsume("b", false);

            assertThat(deliveries(channel.drainEvents())).hasSize(2);
        }

        @Test
        @DisplayName("Negative prefetch is PRECONDITION_FAILED")
        void testNegativePrefetch() {
            assertThatThrownBy(() -> channel.basicQos(-1, false))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRECONDITION_FAILED);
        }

        @Test
        @DisplayName("Acknowledging a tag twice is PRECONDITION_FAILED and closes the channel")
        void testDoubleAck() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("once"));
            long tag = channel.basicGet("q", false).getDeliveryTag();
            channel.basicAck(tag, false);

            assertThatThrownBy(() -> channel.basicAck(tag, false))
                .isInstanceOf(ChannelException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.PRECONDITION_FAILED);
            assertThat(channel.isOpen()).isFalse();
            assertThat(connection.isOpen()).isTrue();
        }

        @Test
        @DisplayName("Nack with requeue redelivers in the original order")
        void testNackRequeueOrder() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicConsume("q", false);
            channel.basicPublish("", "q", text("m1"));
            channel.basicPublish("", "q", text("m2"));
            channel.basicPublish("", "q", text("m3"));
            List<ChannelEvent.Deliver> first = deliveries(channel.drainEvents());
            assertThat(first).extracting(ChannelEvent.Deliver::getDeliveryTag).containsExactly(1L, 2L, 3L);

            channel.basicNack(3, true, true);

            List<ChannelEvent.Deliver> again = deliveries(channel.drainEvents());
            assertThat(bodies(again)).containsExactly("m1", "m2", "m3");
            assertThat(again).allMatch(ChannelEvent.Deliver::isRedelivered);
            assertThat(again).extracting(ChannelEvent.Deliver::getDeliveryTag).containsExactly(4L, 5L, 6L);
        }

        @Test
        @DisplayName("Closing a channel requeues its unacknowledged messages as redelivered")
        void testCloseRequeues() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("m1"));
            channel.basicPublish("", "q", text("m2"));
            channel.basicGet("q", false);
            channel.basicGet("q", false);

            channel.close();

            AmqpChannel next = connection.openChannel(2);
            GetResponse response = next.basicGet("q", true);
            assertThat(body(response.getMessage())).isEqualTo("m1");
            assertThat(response.isRedelivered()).isTrue();
            assertThat(response.getMessageCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("basic.get on an empty queue returns nothing")
        void testGetEmpty() {
            channel.queueDeclare("empty", false, false, false, null);

            assertThat(channel.basicGet("empty", false)).isNull();
            assertThat(channel.isOpen()).isTrue();
        }

        @Test
        @DisplayName("Reusing a consumer tag is NOT_ALLOWED and closes the connection")
        void testDuplicateConsumerTag() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicConsume("q", "worker", false, false, null);

            assertThatThrownBy(() -> channel.basicConsume("q", "worker", false, false, null))
                .isInstanceOf(ConnectionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_ALLOWED);
            assertThat(connection.isOpen()).isFalse();
            assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_NOT_ALLOWED);
        }

        @Test
        @DisplayName("Recover without requeue is not implemented")
        void testRecoverWithoutRequeue() {
            assertThatThrownBy(() -> channel.basicRecover(false))
                .isInstanceOf(ConnectionException.class)
                .hasFieldOrPropertyWithValue("errorCode", ErrorCode.NOT_IMPLEMENTED);
            assertThat(connection.isOpen()).isFalse();
        }

        @Test
        @DisplayName("Recover with requeue redelivers everything unacknowledged")
        void testRecover() {
            channel.queueDeclare("q", false, false, false, null);
            channel.basicPublish("", "q", text("m1"));
            channel.basicGet("q", false);

            channel.basicRecover(true);

            assertThat(channel.getUnackedCount()).isZero();
            assertThat(channel.basicGet("q", true).isRedelivered()).isTrue();
        }
    }

    @Nested
    @DisplayName("Publisher confirms")
    class ConfirmTests {

        @Test
        @DisplayName("Routed publishes are acked in sequence")
        void testAcks() throws InterruptedException {
            channel.queueDeclare("q", false, false, false, null);
            channel.confirmSelect();
            assertThat(channel.getNextPublishSeqNo()).isEqualTo(1);

            channel.basicPublish("", "q", text("a"));
            channel.basicPublish("", "q", text("b"));

            List<ChannelEvent> events = channel.drainEvents();
            assertThat(events).extracting(ChannelEvent::getType)
                .containsExactly(ChannelEvent.Type.PUBLISH_ACK, ChannelEvent.Type.PUBLISH_ACK);
            assertThat(channel.waitForConfirms(1000)).isEqualTo(ConfirmOutcome.ALL_ACKED);
        }

        @Test
        @DisplayName("reject-publish overflow nacks the refused publish")
        void testRejectPublishNack() throws InterruptedException {
            Map<String, Object> args = new HashMap<>();
            args.put(QueueArguments.MAX_LENGTH, 1);
            args.put(QueueArguments.OVERFLOW, "reject-publish");
            channel.queueDeclare("bounded", false, false, false, args);
            channel.confirmSelect();

            channel.basicPublish("", "bounded", text("fits"));
            PublishResult refused = channel.basicPublish("", "bounded", text("overflow"));

            assertThat(refused.shouldNack()).isTrue();
            List<ChannelEvent> events = channel.drainEvents();
            assertThat(events).hasSize(2);
            assertThat(((ChannelEvent.PublishAck) events.get(0)).getSeqNo()).isEqualTo(1);
            assertThat(((ChannelEvent.PublishNack) events.get(1)).getSeqNo()).isEqualTo(2);
            assertThat(channel.waitForConfirms(1000)).isEqualTo(ConfirmOutcome.NACKED);
            assertThat(channel.queueDeclarePassive("bounded").getMessageCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Waiting outside confirm mode is an error")
        void testWaitWithoutConfirmMode() {
            assertThatThrownBy(() -> channel.waitForConfirms(10)).isInstanceOf(IllegalStateException.class);
        }
    }
}
