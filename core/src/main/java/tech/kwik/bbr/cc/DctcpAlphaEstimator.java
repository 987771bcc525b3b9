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

import tech.kwik.bbr.socket.EcnCodePoint;
import tech.kwik.bbr.socket.EcnState;
import tech.kwik.bbr.socket.SocketState;

/**
 * DCTCP style estimator of the fraction of traffic that experiences congestion marking, see
 * https://www.rfc-editor.org/rfc/rfc8257#section-3.3
 * Also keeps the receiver side congestion experienced state, which determines how delayed acks must be echoed.
 */
public class DctcpAlphaEstimator {

    // Per-ack cwnd gain adjustment on congestion echo. Tunable: the bounds and step are empirical.
    static final double CWND_GAIN_STEP = 0.1;
    static final double CWND_GAIN_UPPER_BOUND = 2.5;
    static final double CWND_GAIN_LOWER_BOUND = 1.5;

    @FunctionalInterface
    public interface EstimateListener {
        void estimateUpdated(long bytesMarked, long bytesAcked, double alpha);
    }

    private final double g;
    private double alpha;
    private long ackedBytesEcn;
    private long ackedBytesTotal;
    private long nextSeq;
    private boolean nextSeqSet;
    private long priorRcvNxt;
    private boolean priorRcvNxtSet;
    private boolean ceState;
    private boolean delayedAckReserved;
    private boolean initialized;

    /**
     * @param g  estimation gain, in (0, 1)
     * @param initialAlpha  initial alpha, in [0, 1]
     */
    public DctcpAlphaEstimator(double g, double initialAlpha) {
        if (!(g > 0.0 && g < 1.0)) {
            throw new IllegalArgumentException("Estimation gain must be in (0, 1)");
        }
        this.g = g;
        setInitialAlpha(initialAlpha);
    }

    private DctcpAlphaEstimator(DctcpAlphaEstimator original) {
        g = original.g;
        alpha = original.alpha;
        ackedBytesEcn = original.ackedBytesEcn;
        ackedBytesTotal = original.ackedBytesTotal;
        nextSeq = original.nextSeq;
        nextSeqSet = original.nextSeqSet;
        priorRcvNxt = original.priorRcvNxt;
        priorRcvNxtSet = original.priorRcvNxtSet;
        ceState = original.ceState;
        delayedAckReserved = original.delayedAckReserved;
        initialized = original.initialized;
    }

    /**
     * Sets the initial alpha. Only allowed before the estimator has started running.
     * @throws IllegalStateException  when the estimator has already been initialized
     */
    public void setInitialAlpha(double initialAlpha) {
        if (initialized) {
            throw new IllegalStateException("DCTCP has already been initialized");
        }
        if (!(initialAlpha >= 0.0 && initialAlpha <= 1.0)) {
            throw new IllegalArgumentException("Alpha must be in [0, 1]");
        }
        alpha = initialAlpha;
    }

    public void markInitialized() {
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Accounts for newly acknowledged segments and, at the end of an observation window (i.e. when all data that was
     * outstanding at the start of the window is acked), updates alpha.
     * @return  true if the observation window was closed and alpha was updated
     */
    public boolean onPacketsAcked(SocketState socketState, int segmentsAcked, EstimateListener listener) {
        long ackedBytes = (long) segmentsAcked * socketState.getSegmentSize();
        ackedBytesTotal += ackedBytes;
        if (socketState.getEcnState() == EcnState.EceReceived) {
            ackedBytesEcn += ackedBytes;
        }

        if (!nextSeqSet) {
            nextSeq = socketState.getNextTxSequence();
            nextSeqSet = true;
        }
        if (socketState.getLastAckedSeq() >= nextSeq) {
            double markedFraction = 0.0;  // "M" in RFC 8257
            if (ackedBytesTotal > 0) {
                markedFraction = (double) ackedBytesEcn / ackedBytesTotal;
            }
            alpha = (1.0 - g) * alpha + g * markedFraction;
            listener.estimateUpdated(ackedBytesEcn, ackedBytesTotal, alpha);
            reset(socketState);
            return true;
        }
        return false;
    }

    /**
     * @return  the cwnd gain adjusted for an ack that echoed congestion, depending on the codepoint in use
     */
    public double adjustCwndGain(double cwndGain, EcnCodePoint codePoint) {
        if (codePoint == EcnCodePoint.Ect0) {
            return Double.min(CWND_GAIN_UPPER_BOUND, cwndGain + CWND_GAIN_STEP);
        }
        else if (codePoint == EcnCodePoint.Ect1) {
            return Double.max(CWND_GAIN_LOWER_BOUND, cwndGain - CWND_GAIN_STEP);
        }
        else {
            return cwndGain;
        }
    }

    /**
     * Handles the transition to congestion experienced. When a delayed ack is pending, the ack for the data received
     * before the transition is sent first, without congestion echo.
     */
    public void ceEntered(SocketState socketState) {
        if (!ceState && delayedAckReserved && priorRcvNxtSet) {
            socketState.getAckSender().sendEmptyAck(priorRcvNxt, false);
        }
        priorRcvNxtSet = true;
        priorRcvNxt = socketState.getNextRxSequence();
        ceState = true;
        socketState.setEcnState(EcnState.CeReceived);
    }

    /**
     * Handles the transition from congestion experienced. When a delayed ack is pending, the ack for the data received
     * before the transition is sent first, with congestion echo.
     */
    public void ceCleared(SocketState socketState) {
        if (ceState && delayedAckReserved && priorRcvNxtSet) {
            socketState.getAckSender().sendEmptyAck(priorRcvNxt, true);
        }
        priorRcvNxtSet = true;
        priorRcvNxt = socketState.getNextRxSequence();
        ceState = false;

        if (socketState.getEcnState() == EcnState.CeReceived || socketState.getEcnState() == EcnState.SendingEce) {
            socketState.setEcnState(EcnState.Idle);
        }
    }

    public void setDelayedAckReserved(boolean reserved) {
        delayedAckReserved = reserved;
    }

    private void reset(SocketState socketState) {
        nextSeq = socketState.getNextTxSequence();
        ackedBytesEcn = 0;
        ackedBytesTotal = 0;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getG() {
        return g;
    }

    public long getAckedBytesEcn() {
        return ackedBytesEcn;
    }

    public long getAckedBytesTotal() {
        return ackedBytesTotal;
    }

    public long getNextSeq() {
        return nextSeq;
    }

    public boolean isCeState() {
        return ceState;
    }

    public boolean isDelayedAckReserved() {
        return delayedAckReserved;
    }

    public DctcpAlphaEstimator copy() {
        return new DctcpAlphaEstimator(this);
    }
}
