package com.pubannotator.pipeline;

/**
 * A persistence operation failed. Never retried by the persistence layer itself; the coordinator
 * decides whether and how often to retry.
 */
public class PersistenceException extends Exception {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
