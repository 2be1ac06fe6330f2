package com.amqpcore.consumer;

/**
 * Consumer lifecycle. Transitions only move forward: REGISTERED, ACTIVE, CANCELLED.
 */
public enum ConsumerState {
    REGISTERED,
    ACTIVE,
    CANCELLED
}
