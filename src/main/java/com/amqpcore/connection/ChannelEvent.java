package com.amqpcore.connection;

import com.amqpcore.model.Message;

/**
 * Outbound notifications of one channel, consumed in order by the codec layer through
 * {@link AmqpChannel#pollEvent()}.
 */
public abstract class ChannelEvent {

    public enum Type {
        CONSUME_OK,
        CANCEL_OK,
        CONSUMER_CANCELLED,
        DELIVER,
        RETURN,
        PUBLISH_ACK,
        PUBLISH_NACK,
        CHANNEL_CLOSED
    }

    private final int channelNumber;

    protected ChannelEvent(int channelNumber) {
        this.channelNumber = channelNumber;
    }

    public int getChannelNumber() {
        return channelNumber;
    }

    public abstract Type getType();

    /** basic.consume-ok */
    public static final class ConsumeOk extends ChannelEvent {
        private final String consumerTag;

        public ConsumeOk(int channelNumber, String consumerTag) {
            super(channelNumber);
            this.consumerTag = consumerTag;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        @Override
        public Type getType() {
            return Type.CONSUME_OK;
        }

        @Override
        public String toString() {
            return "ConsumeOk{" + consumerTag + "}";
        }
    }

    /** basic.cancel-ok, answering a client cancel. */
    public static final class CancelOk extends ChannelEvent {
        private final String consumerTag;

        public CancelOk(int channelNumber, String consumerTag) {
            super(channelNumber);
            this.consumerTag = consumerTag;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        @Override
        public Type getType() {
            return Type.CANCEL_OK;
        }

        @Override
        public String toString() {
            return "CancelOk{" + consumerTag + "}";
        }
    }

    /** Broker-initiated basic.cancel, sent when the consumer's queue goes away. */
    public static final class ConsumerCancelled extends ChannelEvent {
        private final String consumerTag;

        public ConsumerCancelled(int channelNumber, String consumerTag) {
            super(channelNumber);
            this.consumerTag = consumerTag;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        @Override
        public Type getType() {
            return Type.CONSUMER_CANCELLED;
        }

        @Override
        public String toString() {
            return "ConsumerCancelled{" + consumerTag + "}";
        }
    }

    /** basic.deliver */
    public static final class Deliver extends ChannelEvent {
        private final String consumerTag;
        private final long deliveryTag;
        private final boolean redelivered;
        private final String queueName;
        private final Message message;

        public Deliver(int channelNumber, String consumerTag, long deliveryTag, boolean redelivered,
                       String queueName, Message message) {
            super(channelNumber);
            this.consumerTag = consumerTag;
            this.deliveryTag = deliveryTag;
            this.redelivered = redelivered;
            this.queueName = queueName;
            this.message = message;
        }

        public String getConsumerTag() {
            return consumerTag;
        }

        public long getDeliveryTag() {
            return deliveryTag;
        }

        public boolean isRedelivered() {
            return redelivered;
        }

        public String getQueueName() {
            return queueName;
        }

        public String getExchange() {
            return message.getExchange();
        }

        public String getRoutingKey() {
            return message.getRoutingKey();
        }

        public Message getMessage() {
            return message;
        }

        @Override
        public Type getType() {
            return Type.DELIVER;
        }

        @Override
        public String toString() {
            return String.format("Deliver{consumer='%s', tag=%d, redelivered=%s, queue='%s'}",
                    consumerTag, deliveryTag, redelivered, queueName);
        }
    }

    /** basic.return for mandatory or immediate publishes that could not be placed. */
    public static final class Return extends ChannelEvent {
        private final int replyCode;
        private final String replyText;
        private final String exchange;
        private final String routingKey;
        private final Message message;

        public Return(int channelNumber, int replyCode, String replyText, String exchange,
                      String routingKey, Message message) {
            super(channelNumber);
            this.replyCode = replyCode;
            this.replyText = replyText;
            this.exchange = exchange;
            this.routingKey = routingKey;
            this.message = message;
        }

        public int getReplyCode() {
            return replyCode;
        }

        public String getReplyText() {
            return replyText;
        }

        public String getExchange() {
            return exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public Message getMessage() {
            return message;
        }

        @Override
        public Type getType() {
            return Type.RETURN;
        }

        @Override
        public String toString() {
            return String.format("Return{%d %s, exchange='%s', routingKey='%s'}",
                    replyCode, replyText, exchange, routingKey);
        }
    }

    /** basic.ack from broker to publisher in confirm mode. */
    public static final class PublishAck extends ChannelEvent {
        private final long seqNo;
        private final boolean multiple;

        public PublishAck(int channelNumber, long seqNo, boolean multiple) {
            super(channelNumber);
            this.seqNo = seqNo;
            this.multiple = multiple;
        }

        public long getSeqNo() {
            return seqNo;
        }

        public boolean isMultiple() {
            return multiple;
        }

        @Override
        public Type getType() {
            return Type.PUBLISH_ACK;
        }

        @Override
        public String toString() {
            return "PublishAck{" + seqNo + "}";
        }
    }

    /** basic.nack from broker to publisher in confirm mode. */
    public static final class PublishNack extends ChannelEvent {
        private final long seqNo;
        private final boolean multiple;

        public PublishNack(int channelNumber, long seqNo, boolean multiple) {
            super(channelNumber);
            this.seqNo = seqNo;
            this.multiple = multiple;
        }

        public long getSeqNo() {
            return seqNo;
        }

        public boolean isMultiple() {
            return multiple;
        }

        @Override
        public Type getType() {
            return Type.PUBLISH_NACK;
        }

        @Override
        public String toString() {
            return "PublishNack{" + seqNo + "}";
        }
    }

    /**
     * The channel was closed, by the client or because of an error. For a hard error the codec
     * layer closes the connection with the same code.
     */
    public static final class ChannelClosed extends ChannelEvent {
        private final int replyCode;
        private final String replyText;
        private final boolean connectionClosed;

        public ChannelClosed(int channelNumber, int replyCode, String replyText, boolean connectionClosed) {
            super(channelNumber);
            this.replyCode = replyCode;
            this.replyText = replyText;
            this.connectionClosed = connectionClosed;
        }

        public int getReplyCode() {
            return replyCode;
        }

        public String getReplyText() {
            return replyText;
        }

        public boolean isConnectionClosed() {
            return connectionClosed;
        }

        @Override
        public Type getType() {
            return Type.CHANNEL_CLOSED;
        }

        @Override
        public String toString() {
            return String.format("ChannelClosed{%d %s, connection=%s}", replyCode, replyText, connectionClosed);
        }
    }
}
