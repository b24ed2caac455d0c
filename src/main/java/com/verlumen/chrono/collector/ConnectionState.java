package com.verlumen.chrono.collector;

import com.google.common.base.Ascii;

/** Lifecycle of one exchange connection. Only the owning {@link ConnectionManager} changes it. */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    FAILED;

    public String wireName() {
        return Ascii.toLowerCase(name());
    }
}
