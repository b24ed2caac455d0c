package com.verlumen.chrono.exchanges;

/**
 * A price-shaped exchange message could not be normalized. The feed is dropped; the connection is
 * unaffected.
 */
public final class MessageParseException extends Exception {
    public MessageParseException(String message) {
        super(message);
    }

    public MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
