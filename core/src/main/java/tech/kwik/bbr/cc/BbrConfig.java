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

import tech.kwik.bbr.cc.impl.BbrConfigImpl;

import java.time.Duration;

/**
 * Tunables of the BBR congestion controller. Values are validated when the configuration is built.
 */
public interface BbrConfig {

    /**
     * @return  gain used in Startup, for both pacing and congestion window
     */
    double highGain();

    /**
     * @return  length of the bottleneck bandwidth max filter window, in packet-timed round trips
     */
    int bandwidthWindowLength();

    /**
     * @return  length of the min RTT filter window
     */
    Duration rttWindowLength();

    /**
     * @return  minimum time spent in ProbeRTT once in-flight has dropped to the minimum window
     */
    Duration probeRttDuration();

    /**
     * @return  window length of the ack aggregation estimator, in round trips
     */
    int extraAckedWindowLength();

    /**
     * @return  number of bytes acked in one sampling epoch after which the epoch is restarted
     */
    long ackEpochAckedResetThreshold();

    /**
     * @return  estimation gain used for updating the DCTCP alpha
     */
    double dctcpG();

    /**
     * @return  initial value of the DCTCP alpha
     */
    double dctcpAlphaOnInit();

    /**
     * @return  whether to use ECT(0) (true) or ECT(1) (false) as ECN codepoint
     */
    boolean useEct0();

    /**
     * @return  seed for the random source that selects the initial ProbeBW phase
     */
    long randomSeed();

    /**
     * @return  fraction by which the pacing rate is reduced below the estimated bandwidth
     */
    double pacingMargin();

    static BbrConfig defaults() {
        return builder().build();
    }

    static Builder builder() {
        return new BbrConfigImpl.BuilderImpl();
    }

    interface Builder {
        BbrConfig build();

        Builder highGain(double gain);

        Builder bandwidthWindowLength(int rounds);

        Builder rttWindowLength(Duration length);

        Builder probeRttDuration(Duration duration);

        Builder extraAckedWindowLength(int rounds);

        Builder ackEpochAckedResetThreshold(long bytes);

        Builder dctcpG(double g);

        Builder dctcpAlphaOnInit(double alpha);

        Builder useEct0(boolean useEct0);

        Builder randomSeed(long seed);

        Builder pacingMargin(double margin);
    }
}
