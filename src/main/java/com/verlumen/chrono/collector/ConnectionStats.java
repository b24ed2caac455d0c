package com.verlumen.chrono.collector;

import java.time.Duration;
import java.util.Optional;

/** Point-in-time view of one connection. */
public record ConnectionStats(
        String exchange,
        ConnectionState state,
        int reconnectAttempts,
        Duration uptime,
        long feedsParsed,
        long parseFailures,
        Optional<String> lastError) {}
