package com.amqpcore.amqp;

/**
 * Reply codes that terminate a channel or a connection.
 */
public enum ErrorCode {
    ACCESS_REFUSED(AmqpConstants.REPLY_ACCESS_REFUSED, false),
    NOT_FOUND(AmqpConstants.REPLY_NOT_FOUND, false),
    RESOURCE_LOCKED(AmqpConstants.REPLY_RESOURCE_LOCKED, false),
    PRECONDITION_FAILED(AmqpConstants.REPLY_PRECONDITION_FAILED, false),
    CONNECTION_FORCED(AmqpConstants.REPLY_CONNECTION_FORCED, true),
    FRAME_ERROR(AmqpConstants.REPLY_FRAME_ERROR, true),
    COMMAND_INVALID(AmqpConstants.REPLY_COMMAND_INVALID, true),
    CHANNEL_ERROR(AmqpConstants.REPLY_CHANNEL_ERROR, true),
    NOT_ALLOWED(AmqpConstants.REPLY_NOT_ALLOWED, true),
    NOT_IMPLEMENTED(AmqpConstants.REPLY_NOT_IMPLEMENTED, true),
    INTERNAL_ERROR(AmqpConstants.REPLY_INTERNAL_ERROR, true);

    private final int replyCode;
    private final boolean hardError;

    ErrorCode(int replyCode, boolean hardError) {
        this.replyCode = replyCode;
        this.hardError = hardError;
    }

    public int getReplyCode() {
        return replyCode;
    }

    /**
     * Hard errors close the whole connection; soft errors close only the channel.
     */
    public boolean isHardError() {
        return hardError;
    }
}
