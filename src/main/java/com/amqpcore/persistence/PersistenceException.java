package com.amqpcore.persistence;

/**
 * A durable-state operation failed. Wraps the underlying {@link java.sql.SQLException}.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
