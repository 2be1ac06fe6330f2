package com.amqpcore.connection;

import com.amqpcore.model.Message;

/**
 * Result of a successful basic.get.
 */
public final class GetResponse {
    private final long deliveryTag;
    private final boolean redelivered;
    private final int messageCount;
    private final Message message;

    public GetResponse(long deliveryTag, boolean redelivered, int messageCount, Message message) {
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.messageCount = messageCount;
        this.message = message;
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    /**
     * Ready messages left in the queue after this one was taken.
     */
    public int getMessageCount() {
        return messageCount;
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
}
