package com.flightboard.board.statistics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TierStatistics")
class TierStatisticsTest {

    @Test
    @DisplayName("hit rate is zero without requests")
    void hitRateZeroWithoutRequests() {
        assertThat(TierStatistics.hitRate(0, 0)).isZero();
    }

    @Test
    @DisplayName("hit rate rounds half-up to two decimals")
    void hitRateRounding() {
        assertThat(TierStatistics.hitRate(1, 2)).isEqualTo(33.33);
        assertThat(TierStatistics.hitRate(2, 1)).isEqualTo(66.67);
        assertThat(TierStatistics.hitRate(1, 7)).isEqualTo(12.5);
        assertThat(TierStatistics.hitRate(5, 0)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("combine sums counters and weighs latency by sample count")
    void combine() {
        TierStatistics memory = TierStatistics.builder()
                .hits(3).misses(1).sets(2).totalRequests(4)
                .totalLatencyMs(4.0).sampleCount(4).minLatencyMs(0.5).maxLatencyMs(2.0)
                .currentKeyCount(2).totalBytesStored(100)
                .build();
        TierStatistics distributed = TierStatistics.builder()
                .hits(1).misses(3).sets(2).totalRequests(4)
                .totalLatencyMs(16.0).sampleCount(4).minLatencyMs(1.0).maxLatencyMs(8.0)
                .currentKeyCount(2).totalBytesStored(100)
                .build();

        TierStatistics combined = TierStatistics.combine(memory, distributed);

        assertThat(combined.getHits()).isEqualTo(4);
        assertThat(combined.getMisses()).isEqualTo(4);
        assertThat(combined.getTotalRequests()).isEqualTo(8);
        assertThat(combined.getHitRatePercent()).isEqualTo(50.0);
        assertThat(combined.getAverageLatencyMs()).isEqualTo(2.5);
        assertThat(combined.getMinLatencyMs()).isEqualTo(0.5);
        assertThat(combined.getMaxLatencyMs()).isEqualTo(8.0);
        assertThat(combined.getTotalBytesStored()).isEqualTo(200);
    }

    @Test
    @DisplayName("combine ignores the minimum of a tier without samples")
    void combineIgnoresEmptyTierMinimum() {
        TierStatistics empty = TierStatistics.builder().build();
        TierStatistics used = TierStatistics.builder().sampleCount(1).totalLatencyMs(3.0).minLatencyMs(3.0).build();

        assertThat(TierStatistics.combine(empty, used).getMinLatencyMs()).isEqualTo(3.0);
    }
}
