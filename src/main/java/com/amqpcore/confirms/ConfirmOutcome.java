package com.amqpcore.confirms;

/**
 * Result of waiting for publisher confirms.
 */
public enum ConfirmOutcome {
    /** Every outstanding publish was acked. */
    ALL_ACKED,
    /** Everything settled, at least one publish was nacked. */
    NACKED,
    /** The timeout elapsed with publishes still outstanding. */
    TIMED_OUT
}
