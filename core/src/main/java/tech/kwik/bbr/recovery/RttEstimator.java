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
package tech.kwik.bbr.recovery;

import tech.kwik.bbr.log.Logger;
import tech.kwik.bbr.socket.SocketState;

import java.time.Duration;
import java.time.Instant;


/**
 * Computes the RTT values of a connection from RTT samples and publishes them in the connection's socket state, where
 * the congestion controller picks them up.
 */
public class RttEstimator {

    private final Logger log;
    private final SocketState socketState;
    private final RttSampleCache sampleCache;
    private final Duration initialRtt;
    private volatile Duration minRtt;
    private volatile Duration smoothedRtt;
    private volatile Duration rttVar;
    private volatile Duration latestRtt;

    public RttEstimator(Logger log, SocketState socketState) {
        this(log, socketState, null);
    }

    /**
     * @param sampleCache  cache that receives every sample, or null
     */
    public RttEstimator(Logger log, SocketState socketState, RttSampleCache sampleCache) {
        this.log = log;
        this.socketState = socketState;
        this.sampleCache = sampleCache;
        // https://www.rfc-editor.org/rfc/rfc6298#section-2.1
        // "Until a round-trip time (RTT) measurement has been made (...) the sender SHOULD set RTO <- 1 second"
        initialRtt = Duration.ofSeconds(1);
    }

    public void addSample(Instant timeReceived, Instant timeSent) {
        if (timeReceived.isBefore(timeSent)) {
            log.error("Receiving negative rtt estimate: sent=" + timeSent + ", received=" + timeReceived);
            return;
        }
        addSample(Duration.between(timeSent, timeReceived), timeReceived);
    }

    public void addSample(Duration rttSample, Instant now) {
        if (rttSample.isNegative()) {
            log.error("Ignoring negative rtt sample: " + rttSample);
            return;
        }
        Duration previousSmoothed = smoothedRtt;

        if (minRtt == null || rttSample.compareTo(minRtt) < 0) {
            minRtt = rttSample;
        }
        latestRtt = rttSample;

        if (smoothedRtt == null) {
            // First time
            smoothedRtt = rttSample;
            rttVar = rttSample.dividedBy(2);
        }
        else {
            // https://www.rfc-editor.org/rfc/rfc6298#section-2.3
            Duration currentRttVar = smoothedRtt.minus(rttSample).abs();
            rttVar = rttVar.multipliedBy(3).plus(currentRttVar).dividedBy(4);
            smoothedRtt = smoothedRtt.multipliedBy(7).plus(rttSample).dividedBy(8);
        }

        socketState.setLastRtt(latestRtt);
        socketState.setMinRtt(minRtt);
        socketState.setSmoothedRtt(smoothedRtt);
        if (sampleCache != null) {
            sampleCache.add(rttSample);
        }

        log.debug("RTT: " + (previousSmoothed != null? previousSmoothed.toNanos() / 1000: "-") + " + "
                + rttSample.toNanos() / 1000 + " -> " + smoothedRtt.toNanos() / 1000 + " us");
        log.getQLog().emitRttMetrics(minRtt, smoothedRtt, latestRtt, now);
    }

    public Duration getSmoothedRtt() {
        if (smoothedRtt == null) {
            return initialRtt;
        }
        else {
            return smoothedRtt;
        }
    }

    public Duration getRttVar() {
        // With an initial rtt-var of half the initial RTT, the initial RTO is 3 times the initial RTT
        if (rttVar == null) {
            return initialRtt.dividedBy(2);
        }
        else {
            return rttVar;
        }
    }

    /**
     * @return  minimum RTT observed so far, or null if there is no sample yet
     */
    public Duration getMinRtt() {
        return minRtt;
    }

    /**
     * @return  latest RTT sample, or null if there is no sample yet
     */
    public Duration getLatestRtt() {
        return latestRtt;
    }
}
