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

import tech.kwik.bbr.util.ByteCounts;

import java.time.Duration;
import java.time.Instant;

/**
 * Estimates the degree of ack aggregation: the maximum amount of data acked in excess of what the estimated bandwidth
 * predicts, over a sampling epoch. The maximum is kept over a window of rounds, using two slots that alternate.
 * See https://datatracker.ietf.org/doc/html/draft-cardwell-iccrg-bbr-congestion-control-02#section-4.6.4.5
 */
public class AckAggregationEstimator {

    // Slot age is kept in a 5 bit field in Linux.
    private static final int MAX_SLOT_AGE = 31;
    // Cap the aggregation cwnd at 100 ms worth of data at the estimated bandwidth.
    private static final long MAX_AGGREGATION_DIVISOR = 10;

    private final int windowLength;
    private final long epochResetThreshold;
    private final int extraAckedGain;
    private final long[] extraAcked = new long[2];
    private int slotIndex;
    private int slotAge;
    private Instant epochStart;
    private long epochAcked;

    /**
     * @param windowLength  number of rounds after which a slot is rotated
     * @param epochResetThreshold  bytes acked in an epoch after which the epoch is restarted
     */
    public AckAggregationEstimator(int windowLength, long epochResetThreshold, Instant now) {
        this.windowLength = windowLength;
        this.epochResetThreshold = epochResetThreshold;
        this.extraAckedGain = 1;
        this.epochStart = now;
    }

    private AckAggregationEstimator(AckAggregationEstimator original) {
        windowLength = original.windowLength;
        epochResetThreshold = original.epochResetThreshold;
        extraAckedGain = original.extraAckedGain;
        extraAcked[0] = original.extraAcked[0];
        extraAcked[1] = original.extraAcked[1];
        slotIndex = original.slotIndex;
        slotAge = original.slotAge;
        epochStart = original.epochStart;
        epochAcked = original.epochAcked;
    }

    public void reset(Instant now) {
        epochStart = now;
        slotAge = 0;
        slotIndex = 0;
        epochAcked = 0;
        extraAcked[0] = 0;
        extraAcked[1] = 0;
    }

    /**
     * Starts a new sampling epoch, for example after the connection has been idle.
     */
    public void resetEpoch(Instant now) {
        epochStart = now;
        epochAcked = 0;
    }

    /**
     * @param ackedSacked  bytes (s)acked by the current ack
     * @param roundStart  whether the current ack starts a new round
     * @param bandwidth  current bandwidth estimate in bits per second
     * @param cwnd  current congestion window, which caps the excess
     */
    public void update(long ackedSacked, boolean roundStart, long bandwidth, long cwnd, Instant now) {
        if (extraAckedGain == 0 || ackedSacked <= 0) {
            return;
        }

        if (roundStart) {
            slotAge = Integer.min(MAX_SLOT_AGE, slotAge + 1);
            if (slotAge >= windowLength) {
                slotAge = 0;
                slotIndex = slotIndex == 0? 1: 0;
                extraAcked[slotIndex] = 0;
            }
        }

        long epochNanos = Duration.between(epochStart, now).toNanos();
        long expectedAcked = ByteCounts.bytesAt(bandwidth, epochNanos);

        // Reset the epoch when the ack rate drops below the expected rate, or when the epoch accumulated so much
        // that the expected amount would become unreliable.
        if (epochAcked <= expectedAcked || epochAcked + ackedSacked >= epochResetThreshold) {
            epochAcked = 0;
            epochStart = now;
            expectedAcked = 0;
        }

        epochAcked += ackedSacked;
        long extraAck = Long.min(ByteCounts.saturatingSubtract(epochAcked, expectedAcked), cwnd);
        if (extraAck > extraAcked[slotIndex]) {
            extraAcked[slotIndex] = extraAck;
        }
    }

    /**
     * @param bandwidth  current bandwidth estimate in bits per second
     * @param pipeFilled  whether the full-pipe estimator has decided the pipe is filled
     * @return  number of bytes to add to the target cwnd to compensate for ack aggregation
     */
    public long aggregationCwnd(long bandwidth, boolean pipeFilled) {
        if (extraAckedGain == 0 || !pipeFilled) {
            return 0;
        }
        long maxAggregationBytes = bandwidth / (MAX_AGGREGATION_DIVISOR * 8);
        long aggregationBytes = extraAckedGain * Long.max(extraAcked[0], extraAcked[1]);
        return Long.min(aggregationBytes, maxAggregationBytes);
    }

    public long getExtraAcked(int slot) {
        return extraAcked[slot];
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public long getEpochAcked() {
        return epochAcked;
    }

    public Instant getEpochStart() {
        return epochStart;
    }

    public AckAggregationEstimator copy() {
        return new AckAggregationEstimator(this);
    }
}
