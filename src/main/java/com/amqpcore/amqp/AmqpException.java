package com.amqpcore.amqp;

/**
 * Base class for protocol-level failures. The reply text follows the broker convention
 * {@code "<CODE_NAME> - <detail>"}.
 */
public abstract class AmqpException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AmqpException(ErrorCode errorCode, String detail) {
        super(errorCode.name() + " - " + detail);
        this.errorCode = errorCode;
    }

    protected AmqpException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.name() + " - " + detail, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getReplyCode() {
        return errorCode.getReplyCode();
    }

    public String getReplyText() {
        return getMessage();
    }
}
