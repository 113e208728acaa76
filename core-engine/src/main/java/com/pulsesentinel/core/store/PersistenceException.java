package com.pulsesentinel.core.store;

/**
 * A {@link StateStore} read or write failed. The caller may retry.
 */
public class PersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
