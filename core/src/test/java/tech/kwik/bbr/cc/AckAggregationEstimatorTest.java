/*
 * Copyright © 2025 Peter Doornbosch
 *
 * This file is part of Kwik BBR, a BBR congestion control implementation in Java.
 *
 * Kwik BBR is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Kwik BBR is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.bbr.cc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AckAggregationEstimatorTest {

    // 1 MB/s
    private static final long BANDWIDTH = 8_000_000;
    private static final long LARGE_CWND = 1_000_000;

    private Instant start;
    private AckAggregationEstimator estimator;

    @BeforeEach
    void initObjectUnderTest() {
        start = Instant.EPOCH;
        estimator = new AckAggregationEstimator(5, 1 << 17, start);
    }

    @Test
    void dataAckedAboveExpectedAmountCountsAsExtra() {
        estimator.update(10_000, false, BANDWIDTH, LARGE_CWND, start);
        estimator.update(10_000, false, BANDWIDTH, LARGE_CWND, start.plusMillis(5));

        // 20.000 bytes acked, 5.000 expected in 5 ms at 1 MB/s
        assertThat(estimator.getExtraAcked(0)).isEqualTo(15_000);
    }

    @Test
    void epochIsRestartedWhenAckRateFallsBelowBandwidth() {
        estimator.update(1_000, false, BANDWIDTH, LARGE_CWND, start);

        estimator.update(500, false, BANDWIDTH, LARGE_CWND, start.plusMillis(100));

        assertThat(estimator.getEpochStart()).isEqualTo(start.plusMillis(100));
        assertThat(estimator.getEpochAcked()).isEqualTo(500);
    }

    @Test
    void epochIsRestartedWhenResetThresholdIsReached() {
        estimator.update(100_000, false, BANDWIDTH, LARGE_CWND, start);

        estimator.update(40_000, false, BANDWIDTH, LARGE_CWND, start);

        assertThat(estimator.getEpochAcked()).isEqualTo(40_000);
    }

    @Test
    void extraIsLimitedByCongestionWindow() {
        estimator.update(10_000, false, BANDWIDTH, 3_000, start);

        assertThat(estimator.getExtraAcked(0)).isEqualTo(3_000);
    }

    @Test
    void sampleWithoutAckedBytesIsIgnored() {
        estimator.update(1_000, false, BANDWIDTH, LARGE_CWND, start);

        estimator.update(0, true, BANDWIDTH, LARGE_CWND, start.plusMillis(100));

        assertThat(estimator.getEpochAcked()).isEqualTo(1_000);
        assertThat(estimator.getEpochStart()).isEqualTo(start);
    }

    @Test
    void slotRotatesAfterWindowOfRounds() {
        estimator.update(1_000, false, BANDWIDTH, LARGE_CWND, start);
        for (int round = 1; round <= 5; round++) {
            estimator.update(100, true, BANDWIDTH, LARGE_CWND, start);
        }

        assertThat(estimator.getSlotIndex()).isEqualTo(1);
        assertThat(estimator.getExtraAcked(0)).isEqualTo(1_400);
        assertThat(estimator.getExtraAcked(1)).isEqualTo(1_500);
    }

    @Test
    void aggregationCwndIsZeroUntilPipeIsFilled() {
        estimator.update(10_000, false, BANDWIDTH, LARGE_CWND, start);

        assertThat(estimator.aggregationCwnd(BANDWIDTH, false)).isEqualTo(0);
        assertThat(estimator.aggregationCwnd(BANDWIDTH, true)).isEqualTo(10_000);
    }

    @Test
    void aggregationCwndIsLimitedToHundredMillisecondsOfData() {
        estimator.update(50_000, false, BANDWIDTH, LARGE_CWND, start);

        // Below the 100.000 bytes that 1 MB/s delivers in 100 ms
        assertThat(estimator.aggregationCwnd(BANDWIDTH, true)).isEqualTo(50_000);
        // 100 ms at 100 kB/s
        assertThat(estimator.aggregationCwnd(800_000, true)).isEqualTo(10_000);
    }

    @Test
    void resetClearsBothSlots() {
        estimator.update(10_000, false, BANDWIDTH, LARGE_CWND, start);

        estimator.reset(start.plusSeconds(1));

        assertThat(estimator.aggregationCwnd(BANDWIDTH, true)).isEqualTo(0);
        assertThat(estimator.getEpochStart()).isEqualTo(start.plusSeconds(1));
    }
}
