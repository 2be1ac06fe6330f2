package com.amqpcore.connection;

import com.amqpcore.amqp.AmqpConstants;
import com.amqpcore.amqp.AmqpException;
import com.amqpcore.amqp.ConnectionException;
import com.amqpcore.amqp.ErrorCode;
import com.amqpcore.server.AmqpBroker;
import com.amqpcore.server.VirtualHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A client connection bound to one virtual host. Owns its channels and the exclusive queues
 * declared through them.
 */
public class AmqpConnection {
    private static final Logger logger = LoggerFactory.getLogger(AmqpConnection.class);

    private final String id;
    private final AmqpBroker broker;
    private final VirtualHost vhost;
    private final ConcurrentMap<Integer, AmqpChannel> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final int channelMax;

    // Heartbeat tracking
    private volatile int heartbeatInterval = 0; // seconds, 0 = disabled
    private final AtomicLong lastHeartbeatReceived;

    private volatile int closeReplyCode;
    private volatile String closeReplyText;

    public AmqpConnection(String id, AmqpBroker broker, VirtualHost vhost) {
        this.id = id;
        this.broker = broker;
        this.vhost = vhost;
        this.channelMax = vhost.getConfig().getChannelMax();
        this.lastHeartbeatReceived = new AtomicLong(vhost.getClock().millis());
    }

    /**
     * Opens a channel.
     *
     * @throws ConnectionException CHANNEL_ERROR for a number outside 1..channel-max or already in use;
     *                             the connection is closed
     */
    public AmqpChannel openChannel(int channelNumber) {
        ensureOpen();
        if (channelNumber < 1 || channelNumber > channelMax) {
            throw fail(ConnectionException.channelError("channel number " + channelNumber
                    + " outside 1.." + channelMax));
        }
        AmqpChannel channel = new AmqpChannel(channelNumber, this, vhost);
        if (channels.putIfAbsent(channelNumber, channel) != null) {
            throw fail(ConnectionException.channelError("channel " + channelNumber + " already open"));
        }
        logger.debug("Opened channel: {} (total: {}/{})", channelNumber, channels.size(), channelMax);
        return channel;
    }

    /**
     * Opens the lowest free channel number.
     */
    public AmqpChannel openChannel() {
        ensureOpen();
        for (int n = 1; n <= channelMax; n++) {
            if (!channels.containsKey(n)) {
                return openChannel(n);
            }
        }
        throw fail(new ConnectionException(ErrorCode.NOT_ALLOWED, "all " + channelMax + " channels in use"));
    }

    public AmqpChannel getChannel(int channelNumber) {
        return channels.get(channelNumber);
    }

    public void closeChannel(int channelNumber) {
        AmqpChannel channel = channels.get(channelNumber);
        if (channel != null) {
            channel.close();
        }
    }

    void channelClosed(AmqpChannel channel) {
        channels.remove(channel.getChannelNumber(), channel);
    }

    /**
     * Client-initiated close.
     */
    public void close() {
        teardown(AmqpConstants.REPLY_SUCCESS, "OK");
    }

    /**
     * The peer missed its heartbeats; tears the connection down as if the socket had died.
     */
    public void heartbeatTimeout() {
        logger.warn("Connection {} heartbeat timeout", id);
        teardown(AmqpConstants.REPLY_CONNECTION_FORCED, "CONNECTION_FORCED - missed heartbeats from client");
    }

    /**
     * Called by the codec layer when the peer breaks framing or sequencing rules.
     */
    public void protocolViolation(ErrorCode errorCode, String detail) {
        closeOnError(new ConnectionException(errorCode, detail));
    }

    public void closeOnError(AmqpException e) {
        logger.warn("Connection {} closing on error: {}", id, e.getReplyText());
        teardown(e.getReplyCode(), e.getReplyText());
    }

    private ConnectionException fail(ConnectionException e) {
        closeOnError(e);
        return e;
    }

    /**
     * Closes every channel (requeueing their unacknowledged deliveries and cancelling their consumers),
     * then deletes the exclusive queues this connection owns.
     */
    private void teardown(int replyCode, String replyText) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        closeReplyCode = replyCode;
        closeReplyText = replyText;

        for (AmqpChannel channel : new ArrayList<>(channels.values())) {
            channel.closeByConnection(replyCode, replyText);
        }
        channels.clear();
        vhost.deleteExclusiveQueues(id);
        if (broker != null) {
            broker.connectionClosed(this);
        }
        logger.info("Connection {} closed: {} {}", id, replyCode, replyText);
    }

    private void ensureOpen() {
        if (!open.get()) {
            throw new IllegalStateException("Connection " + id + " is closed");
        }
    }

    public void setHeartbeatInterval(int seconds) {
        this.heartbeatInterval = Math.max(0, seconds);
        recordHeartbeatReceived();
    }

    public int getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void recordHeartbeatReceived() {
        lastHeartbeatReceived.set(vhost.getClock().millis());
    }

    /**
     * Closes the connection when nothing was heard from the peer for two heartbeat intervals.
     *
     * @return true if the connection was closed by this check
     */
    public boolean checkHeartbeat(long now) {
        int interval = heartbeatInterval;
        if (interval == 0 || !open.get()) {
            return false;
        }
        long limit = interval * 2000L;
        if (now - lastHeartbeatReceived.get() > limit) {
            heartbeatTimeout();
            return true;
        }
        return false;
    }

    public String getId() {
        return id;
    }

    public VirtualHost getVirtualHost() {
        return vhost;
    }

    public boolean isOpen() {
        return open.get();
    }

    public int getChannelMax() {
        return channelMax;
    }

    public int getOpenChannelCount() {
        return channels.size();
    }

    public Collection<AmqpChannel> getChannels() {
        return Collections.unmodifiableCollection(channels.values());
    }

    /**
     * Reply code the connection was closed with, 0 while it is open.
     */
    public int getCloseReplyCode() {
        return closeReplyCode;
    }

    public String getCloseReplyText() {
        return closeReplyText;
    }

    @Override
    public String toString() {
        return String.format("AmqpConnection{id='%s', vhost='%s', open=%s, channels=%d}",
                id, vhost.getName(), open.get(), channels.size());
    }
}
