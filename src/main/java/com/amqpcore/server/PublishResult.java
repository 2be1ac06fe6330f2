package com.amqpcore.server;

import com.amqpcore.amqp.AmqpConstants;

/**
 * What happened to one publish inside a virtual host.
 */
public final class PublishResult {
    private final int routedQueues;
    private final int enqueued;
    private final int refused;
    private final boolean persistenceFailed;
    private final int returnCode;

    PublishResult(int routedQueues, int enqueued, int refused, boolean persistenceFailed, int returnCode) {
        this.routedQueues = routedQueues;
        this.enqueued = enqueued;
        this.refused = refused;
        this.persistenceFailed = persistenceFailed;
        this.returnCode = returnCode;
    }

    static PublishResult unroutable() {
        return new PublishResult(0, 0, 0, false, AmqpConstants.REPLY_NO_ROUTE);
    }

    static PublishResult noConsumers(int routedQueues) {
        return new PublishResult(routedQueues, 0, 0, false, AmqpConstants.REPLY_NO_CONSUMERS);
    }

    public int getRoutedQueues() {
        return routedQueues;
    }

    public int getEnqueued() {
        return enqueued;
    }

    public int getRefused() {
        return refused;
    }

    public boolean isPersistenceFailed() {
        return persistenceFailed;
    }

    public boolean isUnroutable() {
        return returnCode == AmqpConstants.REPLY_NO_ROUTE;
    }

    public boolean isNoConsumers() {
        return returnCode == AmqpConstants.REPLY_NO_CONSUMERS;
    }

    /**
     * A confirm-mode publisher gets a nack when every target queue refused the message or a
     * durable write failed.
     */
    public boolean shouldNack() {
        return persistenceFailed || (enqueued == 0 && refused > 0);
    }

    @Override
    public String toString() {
        return String.format("PublishResult{routed=%d, enqueued=%d, refused=%d, persistenceFailed=%s, returnCode=%d}",
                routedQueues, enqueued, refused, persistenceFailed, returnCode);
    }
}
