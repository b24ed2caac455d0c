package com.verlumen.chrono.gateway;

import java.time.Duration;

/**
 * @param maxFutureSkew how far ahead of the gateway clock a feed timestamp may be
 * @param retention how long the in-memory store keeps feeds
 */
public record GatewayConfig(Duration maxFutureSkew, Duration retention) {
    public static GatewayConfig defaults() {
        return new GatewayConfig(Duration.ofMinutes(5), Duration.ofHours(1));
    }
}
