package com.verlumen.chrono.consensus;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.chrono.marketdata.ConsensusRecord;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryConsensusHistoryTest {
    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    public void append_keepsBoundedTailPerSymbol() {
        // Arrange
        InMemoryConsensusHistory history = new InMemoryConsensusHistory();

        // Act
        for (int i = 0; i <= InMemoryConsensusHistory.MAX_RECORDS_PER_SYMBOL; i++) {
            history.append(record("BTC/USD", i));
        }
        history.append(record("ETH/USD", 0));

        // Assert
        ImmutableList<ConsensusRecord> btc = history.records("BTC/USD");
        assertThat(btc).hasSize(InMemoryConsensusHistory.MAX_RECORDS_PER_SYMBOL);
        assertThat(btc.get(0).timestamp()).isEqualTo(START.plusSeconds(1));
        assertThat(history.records("ETH/USD")).hasSize(1);
    }

    private static ConsensusRecord record(String symbol, int second) {
        return ConsensusRecord.builder()
            .setSymbol(symbol)
            .setMedian(BigDecimal.ONE)
            .setMean(BigDecimal.ONE)
            .setTimestamp(START.plusSeconds(second))
            .setSources(ImmutableList.of("coinbase"))
            .build();
    }
}
