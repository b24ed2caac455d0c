package com.verlumen.chrono.collector;

/** A batch could not reach the ingestion boundary at all. Retried locally, never fatal. */
public final class DeliveryException extends Exception {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
