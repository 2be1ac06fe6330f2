package com.amqpcore.amqp;

/**
 * AMQP 0-9-1 reply codes and broker naming constants.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    // ===== AMQP Reply Codes =====
    public static final int REPLY_SUCCESS = 200;
    public static final int REPLY_NO_ROUTE = 312;
    public static final int REPLY_NO_CONSUMERS = 313;
    public static final int REPLY_CONNECTION_FORCED = 320;
    public static final int REPLY_ACCESS_REFUSED = 403;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_RESOURCE_LOCKED = 405;
    public static final int REPLY_PRECONDITION_FAILED = 406;
    public static final int REPLY_FRAME_ERROR = 501;
    public static final int REPLY_COMMAND_INVALID = 503;
    public static final int REPLY_CHANNEL_ERROR = 504;
    public static final int REPLY_NOT_ALLOWED = 530;
    public static final int REPLY_NOT_IMPLEMENTED = 540;
    public static final int REPLY_INTERNAL_ERROR = 541;

    // ===== Delivery Modes =====
    public static final short DELIVERY_MODE_TRANSIENT = 1;
    public static final short DELIVERY_MODE_PERSISTENT = 2;

    // ===== Names =====
    public static final String DEFAULT_EXCHANGE = "";
    public static final String RESERVED_PREFIX = "amq.";
    public static final String GENERATED_QUEUE_PREFIX = "amq.gen-";
    public static final String GENERATED_CONSUMER_TAG_PREFIX = "amq.ctag-";
    public static final String DEFAULT_VHOST = "/";

    // ===== Limits =====
    public static final int MAX_SHORT_STRING_LENGTH = 255;
    public static final short DEFAULT_CHANNEL_MAX = 2047;
    public static final int MAX_PRIORITY = 9;
}
