package com.amqpcore.amqp;

/**
 * Hard error: the whole connection is closed and every channel on it is torn down.
 */
public class ConnectionException extends AmqpException {

    public ConnectionException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public ConnectionException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }

    public static ConnectionException commandInvalid(String detail) {
        return new ConnectionException(ErrorCode.COMMAND_INVALID, detail);
    }

    public static ConnectionException notAllowed(String detail) {
        return new ConnectionException(ErrorCode.NOT_ALLOWED, detail);
    }

    public static ConnectionException channelError(String detail) {
        return new ConnectionException(ErrorCode.CHANNEL_ERROR, detail);
    }
}
