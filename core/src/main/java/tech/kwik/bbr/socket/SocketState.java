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
package tech.kwik.bbr.socket;

import java.time.Duration;

/**
 * Transmission control block: the part of the connection state that is shared between the connection and its
 * congestion controller. Owned by the connection; the congestion controller reads and updates it in place.
 * All byte counts are in bytes, all rates in bits per second. Sequence numbers are unwrapped (64 bit).
 */
public class SocketState {

    public static final int DEFAULT_INITIAL_CWND = 10;

    private final int segmentSize;
    private final int initialCwnd;
    private long cwnd;
    private long ssThresh = Long.MAX_VALUE;
    private long initialSsThresh = Long.MAX_VALUE;
    private long bytesInFlight;
    private long lastAckedSackedBytes;

    private boolean pacing;
    private long pacingRate;
    private long maxPacingRate = Long.MAX_VALUE;

    // null when there is no sample yet
    private Duration minRtt;
    private Duration smoothedRtt;
    private Duration lastRtt;

    private CongestionState congestionState = CongestionState.Open;

    private UseEcn useEcn = UseEcn.Off;
    private EcnMode ecnMode = EcnMode.ClassicEcn;
    private EcnCodePoint ectCodePoint = EcnCodePoint.Ect0;
    private EcnState ecnState = EcnState.Disabled;

    private long nextTxSequence;
    private long lastAckedSeq;
    private long nextRxSequence;
    private long appLimited;

    private AckSender ackSender = (receiveNext, echoCongestion) -> {};

    public SocketState(int segmentSize) {
        this(segmentSize, DEFAULT_INITIAL_CWND);
    }

    /**
     * @param segmentSize  maximum segment size in bytes
     * @param initialCwnd  initial congestion window in segments
     */
    public SocketState(int segmentSize, int initialCwnd) {
        if (segmentSize <= 0 || initialCwnd <= 0) {
            throw new IllegalArgumentException();
        }
        this.segmentSize = segmentSize;
        this.initialCwnd = initialCwnd;
        this.cwnd = (long) segmentSize * initialCwnd;
    }

    public int getSegmentSize() {
        return segmentSize;
    }

    /**
     * @return  initial congestion window in segments
     */
    public int getInitialCwnd() {
        return initialCwnd;
    }

    /**
     * @return  initial congestion window in bytes
     */
    public long getInitialCwndBytes() {
        return (long) initialCwnd * segmentSize;
    }

    public long getCwnd() {
        return cwnd;
    }

    public void setCwnd(long cwnd) {
        this.cwnd = cwnd;
    }

    public long getSsThresh() {
        return ssThresh;
    }

    public void setSsThresh(long ssThresh) {
        this.ssThresh = ssThresh;
    }

    public long getInitialSsThresh() {
        return initialSsThresh;
    }

    public void setInitialSsThresh(long initialSsThresh) {
        this.initialSsThresh = initialSsThresh;
    }

    public long getBytesInFlight() {
        return bytesInFlight;
    }

    public void setBytesInFlight(long bytesInFlight) {
        this.bytesInFlight = bytesInFlight;
    }

    public long getLastAckedSackedBytes() {
        return lastAckedSackedBytes;
    }

    public void setLastAckedSackedBytes(long lastAckedSackedBytes) {
        this.lastAckedSackedBytes = lastAckedSackedBytes;
    }

    public boolean isPacing() {
        return pacing;
    }

    public void setPacing(boolean pacing) {
        this.pacing = pacing;
    }

    public long getPacingRate() {
        return pacingRate;
    }

    public void setPacingRate(long pacingRate) {
        this.pacingRate = pacingRate;
    }

    public long getMaxPacingRate() {
        return maxPacingRate;
    }

    public void setMaxPacingRate(long maxPacingRate) {
        this.maxPacingRate = maxPacingRate;
    }

    public Duration getMinRtt() {
        return minRtt;
    }

    public void setMinRtt(Duration minRtt) {
        this.minRtt = minRtt;
    }

    public Duration getSmoothedRtt() {
        return smoothedRtt;
    }

    public void setSmoothedRtt(Duration smoothedRtt) {
        this.smoothedRtt = smoothedRtt;
    }

    public Duration getLastRtt() {
        return lastRtt;
    }

    public void setLastRtt(Duration lastRtt) {
        this.lastRtt = lastRtt;
    }

    public CongestionState getCongestionState() {
        return congestionState;
    }

    public void setCongestionState(CongestionState congestionState) {
        this.congestionState = congestionState;
    }

    public UseEcn getUseEcn() {
        return useEcn;
    }

    public void setUseEcn(UseEcn useEcn) {
        this.useEcn = useEcn;
    }

    public EcnMode getEcnMode() {
        return ecnMode;
    }

    public void setEcnMode(EcnMode ecnMode) {
        this.ecnMode = ecnMode;
    }

    public EcnCodePoint getEctCodePoint() {
        return ectCodePoint;
    }

    public void setEctCodePoint(EcnCodePoint ectCodePoint) {
        this.ectCodePoint = ectCodePoint;
    }

    public EcnState getEcnState() {
        return ecnState;
    }

    public void setEcnState(EcnState ecnState) {
        this.ecnState = ecnState;
    }

    public long getNextTxSequence() {
        return nextTxSequence;
    }

    public void setNextTxSequence(long nextTxSequence) {
        this.nextTxSequence = nextTxSequence;
    }

    public long getLastAckedSeq() {
        return lastAckedSeq;
    }

    public void setLastAckedSeq(long lastAckedSeq) {
        this.lastAckedSeq = lastAckedSeq;
    }

    public long getNextRxSequence() {
        return nextRxSequence;
    }

    public void setNextRxSequence(long nextRxSequence) {
        this.nextRxSequence = nextRxSequence;
    }

    /**
     * @return  the delivered count up to which the sender is application limited, or 0 when it is not
     */
    public long getAppLimited() {
        return appLimited;
    }

    public void setAppLimited(long appLimited) {
        this.appLimited = appLimited;
    }

    public AckSender getAckSender() {
        return ackSender;
    }

    public void setAckSender(AckSender ackSender) {
        this.ackSender = ackSender;
    }

    @Override
    public String toString() {
        return "cwnd=" + cwnd + ", ssthresh=" + ssThresh + ", inflight=" + bytesInFlight
                + ", pacingRate=" + pacingRate + ", state=" + congestionState;
    }
}
