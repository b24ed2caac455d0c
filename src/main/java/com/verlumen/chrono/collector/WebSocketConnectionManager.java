package com.verlumen.chrono.collector;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.chrono.exchanges.ExchangeAdapter;
import com.verlumen.chrono.exchanges.MessageParseException;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * {@link ConnectionManager} over the JDK WebSocket client.
 *
 * <p>Every state transition happens while holding this object's monitor. Each transport attempt is
 * tagged with a generation number; callbacks from an attempt that is no longer current (a socket
 * closed by {@link #disconnect()}, or superseded by a reconnect) are ignored. At most one retry is
 * pending at any time, so an error followed by a close schedules a single reconnect.
 */
final class WebSocketConnectionManager implements ConnectionManager {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    private final ExchangeAdapter adapter;
    private final Consumer<PriceFeed> feedSink;
    private final HttpClient httpClient;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ReconnectBackoff backoff;

    private final AtomicLong feedsParsed = new AtomicLong();
    private final AtomicLong parseFailures = new AtomicLong();
    private volatile String lastError;
    private volatile long generation;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private WebSocket webSocket;
    private ScheduledFuture<?> pendingReconnect;
    private Instant connectedAt;
    private int reconnectAttempts;
    private boolean stopped = true;
    private boolean exhausted;

    @Inject
    WebSocketConnectionManager(
        @Assisted ExchangeAdapter adapter,
        @Assisted Consumer<PriceFeed> feedSink,
        HttpClient httpClient,
        ScheduledExecutorService scheduler,
        Clock clock,
        CollectorConfig config) {
        this.adapter = adapter;
        this.feedSink = feedSink;
        this.httpClient = httpClient;
        this.scheduler = scheduler;
        this.clock = clock;
        this.backoff = config.reconnectBackoff();
    }

    @Override
    public synchronized void connect() {
        if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
            logger.atFine().log("[%s] connect() ignored while %s", adapter.name(), state);
            return;
        }
        stopped = false;
        if (exhausted) {
            logger.atInfo().log("[%s] Restarting after exhausted retries", adapter.name());
            exhausted = false;
            reconnectAttempts = 0;
        }
        cancelPendingReconnect();
        openConnection();
    }

    @Override
    public synchronized void disconnect() {
        stopped = true;
        cancelPendingReconnect();
        generation++;
        if (webSocket != null) {
            WebSocket closing = webSocket;
            webSocket = null;
            closing.sendClose(WebSocket.NORMAL_CLOSURE, "Collector stopping")
                .exceptionally(error -> {
                    logger.atWarning().withCause(error).log("[%s] Error closing WebSocket", adapter.name());
                    closing.abort();
                    return null;
                });
        }
        connectedAt = null;
        transitionTo(ConnectionState.DISCONNECTED);
    }

    @Override
    public synchronized ConnectionState state() {
        return state;
    }

    @Override
    public synchronized ConnectionStats stats() {
        Duration uptime = connectedAt == null
            ? Duration.ZERO
            : Duration.between(connectedAt, clock.instant());
        return new ConnectionStats(
            adapter.name(),
            state,
            reconnectAttempts,
            uptime,
            feedsParsed.get(),
            parseFailures.get(),
            Optional.ofNullable(lastError));
    }

    private void openConnection() {
        transitionTo(ConnectionState.CONNECTING);
        long attempt = ++generation;
        logger.atInfo().log("[%s] Connecting to %s", adapter.name(), adapter.webSocketUri());
        CompletableFuture<WebSocket> futureWs;
        try {
            futureWs = httpClient.newWebSocketBuilder()
                .buildAsync(adapter.webSocketUri(), new Listener(attempt));
        } catch (RuntimeException e) {
            onOpenFailed(attempt, e);
            return;
        }
        futureWs.whenComplete((ws, error) -> {
            if (error != null) {
                onOpenFailed(attempt, error);
            } else {
                onOpened(attempt, ws);
            }
        });
    }

    private synchronized void onOpened(long attempt, WebSocket ws) {
        if (attempt != generation || stopped) {
            logger.atFine().log("[%s] Closing superseded connection", adapter.name());
            ws.abort();
            return;
        }
        webSocket = ws;
        reconnectAttempts = 0;
        connectedAt = clock.instant();
        transitionTo(ConnectionState.CONNECTED);

        String subscription = adapter.buildSubscription();
        logger.atFine().log("[%s] Sending subscription: %s", adapter.name(), subscription);
        ws.sendText(subscription, true).exceptionally(error -> {
            onTransportError(attempt, error);
            return null;
        });
    }

    private synchronized void onOpenFailed(long attempt, Throwable error) {
        if (attempt != generation || stopped) {
            return;
        }
        recordError(error);
        logger.atWarning().withCause(error).log("[%s] Failed to connect", adapter.name());
        transitionTo(ConnectionState.FAILED);
        scheduleReconnect();
    }

    private synchronized void onClosed(long attempt, int statusCode, String reason) {
        if (attempt != generation) {
            return;
        }
        generation++;
        webSocket = null;
        connectedAt = null;
        logger.atInfo().log("[%s] WebSocket closed: %d %s", adapter.name(), statusCode, reason);
        if (stopped) {
            transitionTo(ConnectionState.DISCONNECTED);
            return;
        }
        transitionTo(ConnectionState.RECONNECTING);
        scheduleReconnect();
    }

    private synchronized void onTransportError(long attempt, Throwable error) {
        if (attempt != generation || stopped) {
            return;
        }
        generation++;
        if (webSocket != null) {
            webSocket.abort();
            webSocket = null;
        }
        connectedAt = null;
        recordError(error);
        logger.atWarning().withCause(error).log("[%s] WebSocket error", adapter.name());
        transitionTo(ConnectionState.FAILED);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (stopped || pendingReconnect != null) {
            return;
        }
        if (reconnectAttempts >= backoff.maxAttempts()) {
            exhausted = true;
            transitionTo(ConnectionState.FAILED);
            logger.atSevere().log(
                "[%s] Giving up after %d reconnect attempts; restart required. Last error: %s",
                adapter.name(), reconnectAttempts, lastError);
            return;
        }
        reconnectAttempts++;
        Duration delay = backoff.delayFor(reconnectAttempts);
        logger.atInfo().log("[%s] Reconnect attempt %d/%d in %d ms",
            adapter.name(), reconnectAttempts, backoff.maxAttempts(), delay.toMillis());
        pendingReconnect =
            scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnect() {
        pendingReconnect = null;
        if (stopped) {
            return;
        }
        openConnection();
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void transitionTo(ConnectionState next) {
        if (state == next) {
            return;
        }
        logger.atInfo().log("[%s] %s -> %s", adapter.name(), state, next);
        state = next;
    }

    private void recordError(Throwable error) {
        lastError = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private void handleMessage(long attempt, String message) {
        if (attempt != generation) {
            return;
        }
        try {
            Optional<PriceFeed> feed = adapter.parseMessage(message);
            if (feed.isPresent()) {
                feedsParsed.incrementAndGet();
                logger.atFinest().log("[%s] Parsed %s", adapter.name(), feed.get());
                feedSink.accept(feed.get());
            }
        } catch (MessageParseException e) {
            parseFailures.incrementAndGet();
            lastError = e.getMessage();
            logger.atWarning().withCause(e).log("[%s] Dropping unparseable message: %s", adapter.name(), message);
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final long attempt;
        private final StringBuilder messageBuffer = new StringBuilder();

        Listener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                String message = messageBuffer.toString();
                messageBuffer.setLength(0);
                handleMessage(attempt, message);
            }

            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            onClosed(attempt, statusCode, reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            onTransportError(attempt, error);
        }
    }
}
