package com.verlumen.chrono.gateway;

/** The feed store failed to persist a feed. */
public final class StorageException extends Exception {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
