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
package tech.kwik.bbr.cc.impl;

import tech.kwik.bbr.cc.BbrConfig;

import java.time.Duration;


public class BbrConfigImpl implements BbrConfig {

    public static final double DEFAULT_HIGH_GAIN = 2.89;
    public static final int DEFAULT_BANDWIDTH_WINDOW_LENGTH = 10;
    public static final Duration DEFAULT_RTT_WINDOW_LENGTH = Duration.ofSeconds(10);
    public static final Duration DEFAULT_PROBE_RTT_DURATION = Duration.ofMillis(200);
    public static final int DEFAULT_EXTRA_ACKED_WINDOW_LENGTH = 5;
    public static final long DEFAULT_ACK_EPOCH_ACKED_RESET_THRESHOLD = 1 << 17;
    public static final double DEFAULT_DCTCP_G = 0.0625;
    public static final double DEFAULT_DCTCP_ALPHA_ON_INIT = 1.0;
    // Aligns phase randomization with the Linux implementation results.
    public static final long DEFAULT_RANDOM_SEED = 4;
    // See bbr_rate_bytes_per_sec in Linux: pace at ~1% below the estimated bw to drain standing queues.
    public static final double DEFAULT_PACING_MARGIN = 0.01;

    private double highGain = DEFAULT_HIGH_GAIN;
    private int bandwidthWindowLength = DEFAULT_BANDWIDTH_WINDOW_LENGTH;
    private Duration rttWindowLength = DEFAULT_RTT_WINDOW_LENGTH;
    private Duration probeRttDuration = DEFAULT_PROBE_RTT_DURATION;
    private int extraAckedWindowLength = DEFAULT_EXTRA_ACKED_WINDOW_LENGTH;
    private long ackEpochAckedResetThreshold = DEFAULT_ACK_EPOCH_ACKED_RESET_THRESHOLD;
    private double dctcpG = DEFAULT_DCTCP_G;
    private double dctcpAlphaOnInit = DEFAULT_DCTCP_ALPHA_ON_INIT;
    private boolean useEct0 = true;
    private long randomSeed = DEFAULT_RANDOM_SEED;
    private double pacingMargin = DEFAULT_PACING_MARGIN;

    private BbrConfigImpl() {
    }

    @Override
    public double highGain() {
        return highGain;
    }

    @Override
    public int bandwidthWindowLength() {
        return bandwidthWindowLength;
    }

    @Override
    public Duration rttWindowLength() {
        return rttWindowLength;
    }

    @Override
    public Duration probeRttDuration() {
        return probeRttDuration;
    }

    @Override
    public int extraAckedWindowLength() {
        return extraAckedWindowLength;
    }

    @Override
    public long ackEpochAckedResetThreshold() {
        return ackEpochAckedResetThreshold;
    }

    @Override
    public double dctcpG() {
        return dctcpG;
    }

    @Override
    public double dctcpAlphaOnInit() {
        return dctcpAlphaOnInit;
    }

    @Override
    public boolean useEct0() {
        return useEct0;
    }

    @Override
    public long randomSeed() {
        return randomSeed;
    }

    @Override
    public double pacingMargin() {
        return pacingMargin;
    }

    @Override
    public String toString() {
        return "BbrConfig[highGain=" + highGain + ", bwWindow=" + bandwidthWindowLength + ", rttWindow=" + rttWindowLength.toMillis()
                + "ms, probeRtt=" + probeRttDuration.toMillis() + "ms, extraAckedWindow=" + extraAckedWindowLength
                + ", ackEpochResetThreshold=" + ackEpochAckedResetThreshold + ", g=" + dctcpG + ", alpha=" + dctcpAlphaOnInit
                + ", " + (useEct0? "ECT(0)": "ECT(1)") + "]";
    }

    public static class BuilderImpl implements BbrConfig.Builder {

        private final BbrConfigImpl config = new BbrConfigImpl();
        private boolean built;

        @Override
        public BbrConfig build() {
            if (built) {
                throw new IllegalStateException("Builder can only be used once");
            }
            built = true;
            return config;
        }

        @Override
        public Builder highGain(double gain) {
            if (!(gain > 1.0) || Double.isInfinite(gain)) {
                throw new IllegalArgumentException("High gain must be greater than 1");
            }
            config.highGain = gain;
            return this;
        }

        @Override
        public Builder bandwidthWindowLength(int rounds) {
            if (rounds < 1) {
                throw new IllegalArgumentException("Bandwidth window must contain at least one round");
            }
            config.bandwidthWindowLength = rounds;
            return this;
        }

        @Override
        public Builder rttWindowLength(Duration length) {
            if (length == null || length.isNegative() || length.isZero()) {
                throw new IllegalArgumentException("RTT window length must be positive");
            }
            config.rttWindowLength = length;
            return this;
        }

        @Override
        public Builder probeRttDuration(Duration duration) {
            if (duration == null || duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException("ProbeRTT duration must be positive");
            }
            config.probeRttDuration = duration;
            return this;
        }

        @Override
        public Builder extraAckedWindowLength(int rounds) {
            if (rounds < 1) {
                throw new IllegalArgumentException("Extra acked window must contain at least one round");
            }
            config.extraAckedWindowLength = rounds;
            return this;
        }

        @Override
        public Builder ackEpochAckedResetThreshold(long bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("Ack epoch reset threshold must be positive");
            }
            config.ackEpochAckedResetThreshold = bytes;
            return this;
        }

        @Override
        public Builder dctcpG(double g) {
            if (!(g > 0.0 && g < 1.0)) {
                throw new IllegalArgumentException("DCTCP estimation gain must be in (0, 1)");
            }
            config.dctcpG = g;
            return this;
        }

        @Override
        public Builder dctcpAlphaOnInit(double alpha) {
            if (!(alpha >= 0.0 && alpha <= 1.0)) {
                throw new IllegalArgumentException("DCTCP alpha must be in [0, 1]");
            }
            config.dctcpAlphaOnInit = alpha;
            return this;
        }

        @Override
        public Builder useEct0(boolean useEct0) {
            config.useEct0 = useEct0;
            return this;
        }

        @Override
        public Builder randomSeed(long seed) {
            config.randomSeed = seed;
            return this;
        }

        @Override
        public Builder pacingMargin(double margin) {
            if (!(margin >= 0.0 && margin < 1.0)) {
                throw new IllegalArgumentException("Pacing margin must be in [0, 1)");
            }
            config.pacingMargin = margin;
            return this;
        }
    }
}
