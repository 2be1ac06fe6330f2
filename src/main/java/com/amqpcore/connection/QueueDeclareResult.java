package com.amqpcore.connection;

/**
 * queue.declare-ok
 */
public final class QueueDeclareResult {
    private final String queueName;
    private final int messageCount;
    private final int consumerCount;

    public QueueDeclareResult(String queueName, int messageCount, int consumerCount) {
        this.queueName = queueName;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    public String getQueueName() {
        return queueName;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public int getConsumerCount() {
        return consumerCount;
    }

    @Override
    public String toString() {
        return String.format("QueueDeclareResult{queue='%s', messages=%d, consumers=%d}",
                queueName, messageCount, consumerCount);
    }
}
