package com.verlumen.chrono.collector;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.chrono.http.HttpClient;
import com.verlumen.chrono.http.HttpResponse;
import com.verlumen.chrono.marketdata.IngestBatch;
import com.verlumen.chrono.marketdata.IngestError;
import com.verlumen.chrono.marketdata.IngestResult;
import com.verlumen.chrono.marketdata.PriceFeed;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class BatchForwarderImplTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String WORKER_ID = "worker-coinbase-test";

    @Rule public MockitoRule mockito = MockitoJUnit.rule();

    @Mock @Bind private IngestionClient mockClient;
    @Mock @Bind private ScheduledExecutorService mockScheduler;
    @Mock private ScheduledFuture<Object> mockScheduledFuture;

    @Bind private Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    @Bind private CollectorConfig config = CollectorConfig.builder()
        .setWorkerId(WORKER_ID)
        .setIngestMode(IngestMode.LOCAL)
        .setBatchSize(3)
        .setBatchInterval(Duration.ofSeconds(5))
        .setBufferCeiling(5)
        .setDeliveryBackoff(ReconnectBackoff.create(2))
        .build();

    @Inject private BatchForwarderImpl forwarder;

    @Before
    public void setUp() throws Exception {
        Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
        doReturn(mockScheduledFuture)
            .when(mockScheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        when(mockClient.deliver(any(IngestBatch.class))).thenAnswer(invocation -> {
            IngestBatch batch = invocation.getArgument(0);
            return new IngestResult(IngestResult.Status.SUCCESS, batch.feeds().size(), 0,
                Duration.ofMillis(3), "ok", ImmutableList.of());
        });
    }

    @Test
    public void add_belowBatchSize_armsFlushTimer() {
        // Act
        forwarder.add(feed(1));
        forwarder.add(feed(2));

        // Assert
        verify(mockScheduler, times(1)).schedule(any(Runnable.class), eq(5000L), eq(TimeUnit.MILLISECONDS));
        verify(mockScheduler, never()).execute(any(Runnable.class));
        assertThat(forwarder.stats().buffered()).isEqualTo(2);
    }

    @Test
    public void add_fullBatch_deliversOnScheduler() throws Exception {
        // Arrange
        forwarder.add(feed(1));
        forwarder.add(feed(2));

        // Act
        forwarder.add(feed(3));
        runNextExecution();

        // Assert
        IngestBatch batch = lastDeliveredBatch();
        assertThat(batch.workerId()).isEqualTo(WORKER_ID);
        assertThat(batch.feeds()).containsExactly(feed(1), feed(2), feed(3)).inOrder();
        ForwarderStats stats = forwarder.stats();
        assertThat(stats.batchesSent()).isEqualTo(1);
        assertThat(stats.feedsIngested()).isEqualTo(3);
        assertThat(stats.buffered()).isEqualTo(0);
    }

    @Test
    public void flushTimer_deliversPartialBatch() throws Exception {
        // Arrange
        forwarder.add(feed(1));

        // Act
        runLastScheduled();
        runNextExecution();

        // Assert
        assertThat(lastDeliveredBatch().feeds()).containsExactly(feed(1));
        assertThat(forwarder.stats().feedsIngested()).isEqualTo(1);
    }

    @Test
    public void deliveryFailure_retriesWithBackoffThenDrops() throws Exception {
        // Arrange
        doThrow(new DeliveryException("unreachable")).when(mockClient).deliver(any(IngestBatch.class));
        forwarder.add(feed(1));
        forwarder.add(feed(2));
        forwarder.add(feed(3));

        // Act
        runNextExecution();
        runScheduled(1000L);
        runScheduled(2000L);

        // Assert
        verify(mockClient, times(3)).deliver(any(IngestBatch.class));
        ForwarderStats stats = forwarder.stats();
        assertThat(stats.feedsDropped()).isEqualTo(3);
        assertThat(stats.batchesSent()).isEqualTo(0);
        assertThat(stats.buffered()).isEqualTo(0);
    }

    @Test
    public void rejectedBatch_isCountedAndNotRetried() throws Exception {
        // Arrange
        doReturn(new IngestResult(
            IngestResult.Status.PARTIAL, 2, 1, Duration.ofMillis(5), "2 of 3 price feeds ingested",
            ImmutableList.of(new IngestError(2, "BTC/USD", "Price must be positive"))))
            .when(mockClient).deliver(any(IngestBatch.class));
        forwarder.add(feed(1));
        forwarder.add(feed(2));
        forwarder.add(feed(3));

        // Act
        runNextExecution();

        // Assert
        ForwarderStats stats = forwarder.stats();
        assertThat(stats.feedsIngested()).isEqualTo(2);
        assertThat(stats.feedsRejected()).isEqualTo(1);
        assertThat(stats.feedsDropped()).isEqualTo(0);
        verify(mockClient, times(1)).deliver(any(IngestBatch.class));
    }

    @Test
    public void add_whileInFlight_isSentInNextBatch() throws Exception {
        // Arrange
        forwarder.add(feed(1));
        forwarder.add(feed(2));
        forwarder.add(feed(3));
        forwarder.add(feed(4));

        // Act
        runNextExecution();

        // Assert
        assertThat(lastDeliveredBatch().feeds()).containsExactly(feed(1), feed(2), feed(3)).inOrder();
        assertThat(forwarder.stats().buffered()).isEqualTo(1);
        verify(mockScheduler, times(1)).execute(any(Runnable.class));
    }

    @Test
    public void add_atCeiling_evictsOldestUnsentFeed() throws Exception {
        // Arrange
        for (int i = 1; i <= 5; i++) {
            forwarder.add(feed(i));
        }

        // Act
        forwarder.add(feed(6));
        runNextExecution();
        runLastScheduled();
        runLastExecution();

        // Assert
        assertThat(lastDeliveredBatch().feeds()).containsExactly(feed(5), feed(6)).inOrder();
        assertThat(forwarder.stats().feedsDropped()).isEqualTo(1);
        assertThat(forwarder.stats().feedsIngested()).isEqualTo(5);
    }

    @Test
    public void shutdown_flushesBufferedFeedsSynchronously() throws Exception {
        // Arrange
        forwarder.add(feed(1));
        forwarder.add(feed(2));

        // Act
        forwarder.shutdown();

        // Assert
        assertThat(lastDeliveredBatch().feeds()).containsExactly(feed(1), feed(2)).inOrder();
        assertThat(forwarder.stats().feedsIngested()).isEqualTo(2);
        assertThat(forwarder.stats().buffered()).isEqualTo(0);
        verify(mockScheduledFuture).cancel(false);
    }

    @Test
    public void add_afterShutdown_isDropped() {
        // Arrange
        forwarder.shutdown();

        // Act
        forwarder.add(feed(1));

        // Assert
        assertThat(forwarder.stats().feedsDropped()).isEqualTo(1);
        assertThat(forwarder.stats().buffered()).isEqualTo(0);
    }

    @Test
    public void rateLimitedDelivery_isRetriedNotRejected() throws Exception {
        // Arrange
        HttpClient mockHttpClient = mock(HttpClient.class);
        when(mockHttpClient.postJson(anyString(), anyMap(), anyString()))
            .thenReturn(new HttpResponse(429, "{\"error\":\"Rate limit exceeded\"}"))
            .thenReturn(new HttpResponse(200,
                "{\"status\":\"success\",\"ingested\":3,\"failed\":0,\"latency_ms\":2,\"message\":\"ok\"}"));
        CollectorConfig httpConfig = CollectorConfig.builder()
            .setWorkerId(WORKER_ID)
            .setApiBase("https://api.example.test")
            .setApiKey("secret-key")
            .setBatchSize(3)
            .setBatchInterval(Duration.ofSeconds(5))
            .setBufferCeiling(5)
            .setDeliveryBackoff(ReconnectBackoff.create(2))
            .build();
        BatchForwarderImpl httpForwarder = new BatchForwarderImpl(
            new HttpIngestionClient(mockHttpClient, httpConfig), mockScheduler, clock, httpConfig);
        httpForwarder.add(feed(1));
        httpForwarder.add(feed(2));
        httpForwarder.add(feed(3));

        // Act
        runNextExecution();
        runScheduled(1000L);

        // Assert
        verify(mockHttpClient, times(2)).postJson(anyString(), anyMap(), anyString());
        ForwarderStats stats = httpForwarder.stats();
        assertThat(stats.feedsIngested()).isEqualTo(3);
        assertThat(stats.feedsRejected()).isEqualTo(0);
        assertThat(stats.feedsDropped()).isEqualTo(0);
        assertThat(stats.buffered()).isEqualTo(0);
    }

    @Test
    public void shutdown_duringDelivery_waitsAndSendsOnlyTheRest() throws Exception {
        // Arrange
        CountDownLatch deliveryStarted = new CountDownLatch(1);
        CountDownLatch releaseDelivery = new CountDownLatch(1);
        doAnswer(invocation -> {
            IngestBatch batch = invocation.getArgument(0);
            if (batch.feeds().contains(feed(1))) {
                deliveryStarted.countDown();
                releaseDelivery.await(10, TimeUnit.SECONDS);
            }
            return new IngestResult(IngestResult.Status.SUCCESS, batch.feeds().size(), 0,
                Duration.ofMillis(3), "ok", ImmutableList.of());
        }).when(mockClient).deliver(any(IngestBatch.class));
        forwarder.add(feed(1));
        forwarder.add(feed(2));
        forwarder.add(feed(3));
        forwarder.add(feed(4));
        Thread deliveryThread = new Thread(this::runNextExecution);
        deliveryThread.start();
        assertThat(deliveryStarted.await(10, TimeUnit.SECONDS)).isTrue();

        // Act
        Thread shutdownThread = new Thread(forwarder::shutdown);
        shutdownThread.start();
        while (shutdownThread.getState() != Thread.State.TIMED_WAITING && shutdownThread.isAlive()) {
            Thread.sleep(5);
        }
        releaseDelivery.countDown();
        deliveryThread.join(10_000);
        shutdownThread.join(10_000);

        // Assert
        ArgumentCaptor<IngestBatch> batchCaptor = ArgumentCaptor.forClass(IngestBatch.class);
        verify(mockClient, times(2)).deliver(batchCaptor.capture());
        assertThat(batchCaptor.getAllValues().get(0).feeds()).containsExactly(feed(1), feed(2), feed(3)).inOrder();
        assertThat(batchCaptor.getAllValues().get(1).feeds()).containsExactly(feed(4));
        ForwarderStats stats = forwarder.stats();
        assertThat(stats.batchesSent()).isEqualTo(2);
        assertThat(stats.feedsIngested()).isEqualTo(4);
        assertThat(stats.buffered()).isEqualTo(0);
    }

    private static PriceFeed feed(int price) {
        return PriceFeed.builder()
            .setSymbol("BTC/USD")
            .setPrice(BigDecimal.valueOf(price))
            .setTimestamp(NOW.plusSeconds(price))
            .setSource("coinbase")
            .setWorkerId(WORKER_ID)
            .build();
    }

    private IngestBatch lastDeliveredBatch() throws Exception {
        ArgumentCaptor<IngestBatch> batchCaptor = ArgumentCaptor.forClass(IngestBatch.class);
        verify(mockClient, atLeastOnce()).deliver(batchCaptor.capture());
        return Iterables.getLast(batchCaptor.getAllValues());
    }

    private void runNextExecution() {
        ArgumentCaptor<Runnable> runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(mockScheduler).execute(runnableCaptor.capture());
        runnableCaptor.getValue().run();
    }

    private void runLastExecution() {
        ArgumentCaptor<Runnable> runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(mockScheduler, atLeastOnce()).execute(runnableCaptor.capture());
        Iterables.getLast(runnableCaptor.getAllValues()).run();
    }

    private void runLastScheduled() {
        ArgumentCaptor<Runnable> runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(mockScheduler, atLeastOnce())
            .schedule(runnableCaptor.capture(), anyLong(), any(TimeUnit.class));
        Iterables.getLast(runnableCaptor.getAllValues()).run();
    }

    private void runScheduled(long delayMillis) {
        ArgumentCaptor<Runnable> runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(mockScheduler).schedule(runnableCaptor.capture(), eq(delayMillis), eq(TimeUnit.MILLISECONDS));
        runnableCaptor.getValue().run();
    }
}
