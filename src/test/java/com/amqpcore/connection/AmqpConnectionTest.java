package com.amqpcore.connection;

import com.amqpcore.MutableClock;
import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.config.BrokerConfig;
import com.amqpcore.model.Message;
import com.amqpcore.server.AmqpBroker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AMQP Connection Tests")
class AmqpConnectionTest {

    private MutableClock clock;
    private AmqpBroker broker;
    private AmqpConnection connection;

    @BeforeEach
    void setUp() {
        BrokerConfig config = new BrokerConfig();
        config.setPersistenceEnabled(false);
        config.setChannelMax(3);
        clock = new MutableClock(0);
        broker = new AmqpBroker(config, null, clock);
        connection = broker.openConnection();
    }

    @AfterEach
    void tearDown() {
        broker.stop();
    }

    @Test
    @DisplayName("Channels are numbered from 1 up to channel-max")
    void testOpenChannels() {
        assertThat(connection.openChannel().getChannelNumber()).isEqualTo(1);
        assertThat(connection.openChannel(3).getChannelNumber()).isEqualTo(3);
        assertThat(connection.openChannel().getChannelNumber()).isEqualTo(2);
        assertThat(connection.getOpenChannelCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("A channel number beyond channel-max closes the connection with CHANNEL_ERROR")
    void testChannelOutOfRange() {
        assertThatThrownBy(() -> connection.openChannel(4))
            .isInstanceOf(ConnectionException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CHANNEL_ERROR);

        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_CHANNEL_ERROR);
    }

    @Test
    @DisplayName("Opening a channel twice closes the connection with CHANNEL_ERROR")
    void testChannelReuse() {
        connection.openChannel(1);

        assertThatThrownBy(() -> connection.openChannel(1))
            .isInstanceOf(ConnectionException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CHANNEL_ERROR);
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    @DisplayName("A closed channel number can be opened again")
    void testReopenClosedChannel() {
        connection.openChannel(1).close();

        assertThat(connection.getChannel(1)).isNull();
        assertThat(connection.openChannel(1).isOpen()).isTrue();
    }

    @Test
    @DisplayName("Closing the connection closes its channels and requeues their deliveries")
    void testCloseTearsDownChannels() {
        AmqpChannel channel = connection.openChannel(1);
        channel.queueDeclare("shared", false, false, false, null);
        channel.basicPublish("", "shared", Message.of("m".getBytes(StandardCharsets.UTF_8)));
        channel.basicGet("shared", false);

        connection.close();

        assertThat(channel.isOpen()).isFalse();
        assertThat(broker.getConnections()).isEmpty();
        ChannelEvent.ChannelClosed closed = (ChannelEvent.ChannelClosed) channel.drainEvents().get(0);
        assertThat(closed.isConnectionClosed()).isTrue();
        assertThat(closed.getReplyCode()).isEqualTo(AmqpConstants.REPLY_SUCCESS);

        AmqpChannel other = broker.openConnection().openChannel(1);
        assertThat(other.basicGet("shared", true).isRedelivered()).isTrue();
    }

    @Test
    @DisplayName("A closed connection opens no channels")
    void testOpenAfterClose() {
        connection.close();

        assertThatThrownBy(() -> connection.openChannel()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Two missed heartbeat intervals force the connection closed")
    void testHeartbeatTimeout() {
        connection.setHeartbeatInterval(10);

        assertThat(connection.checkHeartbeat(clock.millis() + 20_000)).isFalse();
        connection.recordHeartbeatReceived();
        clock.advance(20_001);

        broker.runHousekeeping();

        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_CONNECTION_FORCED);
        assertThat(connection.getCloseReplyText()).contains("missed heartbeats");
    }

    @Test
    @DisplayName("Heartbeats disabled never time out")
    void testHeartbeatDisabled() {
        assertThat(connection.checkHeartbeat(Long.MAX_VALUE)).isFalse();
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Protocol violations close the connection with their code")
    void testProtocolViolation() {
        connection.protocolViolation(ErrorCode.FRAME_ERROR, "bad frame end");

        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.getCloseReplyCode()).isEqualTo(AmqpConstants.REPLY_FRAME_ERROR);
        assertThat(connection.getCloseReplyText()).isEqualTo("FRAME_ERROR - bad frame end");
    }
}
