package com.amqpcore.amqp;

/**
 * Soft error: fatal to the channel it was raised on, the connection stays open.
 */
public class ChannelException extends AmqpException {

    public ChannelException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public static ChannelException preconditionFailed(String detail) {
        return new ChannelException(ErrorCode.PRECONDITION_FAILED, detail);
    }

    public static ChannelException accessRefused(String detail) {
        return new ChannelException(ErrorCode.ACCESS_REFUSED, detail);
    }

    public static ChannelException resourceLocked(String detail) {
        return new ChannelException(ErrorCode.RESOURCE_LOCKED, detail);
    }

    public static ChannelException notFound(String detail) {
        return new ChannelException(ErrorCode.NOT_FOUND, detail);
    }
}
