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

import tech.kwik.bbr.log.Logger;
import tech.kwik.bbr.rate.RateConnection;
import tech.kwik.bbr.rate.RateSample;
import tech.kwik.bbr.socket.CongestionState;
import tech.kwik.bbr.socket.CwndEvent;
import tech.kwik.bbr.socket.EcnCodePoint;
import tech.kwik.bbr.socket.EcnMode;
import tech.kwik.bbr.socket.EcnState;
import tech.kwik.bbr.socket.SocketState;
import tech.kwik.bbr.socket.UseEcn;
import tech.kwik.bbr.util.ByteCounts;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;

/**
 * BBR congestion control, see https://datatracker.ietf.org/doc/html/draft-cardwell-iccrg-bbr-congestion-control-02
 * and the Linux implementation (tcp_bbr.c), combined with a DCTCP style estimate of the fraction of congestion marked
 * traffic (https://www.rfc-editor.org/rfc/rfc8257).
 *
 * The controller builds a model of the path from the rate samples it receives (bottleneck bandwidth and minimum RTT)
 * and derives the pacing rate and congestion window from that model, the current mode and its gains.
 */
public class BbrCongestionController extends AbstractCongestionController {

    // Bandwidth growth below this factor in a round counts as a round without growth.
    private static final double FULL_BANDWIDTH_THRESHOLD = 1.25;
    private static final int FULL_BANDWIDTH_ROUNDS = 3;
    private static final int MIN_PIPE_CWND_SEGMENTS = 4;
    private static final double PROBE_BW_CWND_GAIN = 2.0;

    private final BbrConfig config;
    private final BbrEventListener eventListener;
    private final Random random;
    private final MaxBandwidthFilter maxBandwidthFilter;
    private final MinRttFilter minRttFilter;
    private final PacingGainCycle gainCycle;
    private final AckAggregationEstimator ackAggregation;
    private final DctcpAlphaEstimator ecnEstimator;

    private BbrMode mode = BbrMode.Startup;
    private double pacingGain;
    private double cwndGain;
    private boolean modelInitialized;
    private boolean hasSeenRtt;

    private long delivered;
    private long roundCount;
    private long nextRoundDelivered;
    private boolean roundStart;

    private boolean pipeFilled;
    private long fullBandwidth;
    private int fullBandwidthCount;

    private long priorCwnd;
    private long targetCwnd;
    private long minPipeCwnd;
    private long sendQuantum;
    private boolean packetConservation;
    private boolean idleRestart;

    private Instant probeRttDoneStamp;
    private boolean probeRttRoundDone;

    private double rttJitter;

    public BbrCongestionController(Logger logger) {
        this(logger, Clock.systemUTC(), BbrConfig.defaults(), BbrEventListener.NONE);
    }

    public BbrCongestionController(Logger logger, Clock clock, BbrConfig config, BbrEventListener eventListener) {
        super(logger, clock);
        this.config = Objects.requireNonNull(config);
        this.eventListener = eventListener != null? eventListener: BbrEventListener.NONE;
        Instant now = clock.instant();
        random = new Random(config.randomSeed());
        maxBandwidthFilter = new MaxBandwidthFilter(config.bandwidthWindowLength());
        minRttFilter = new MinRttFilter(config.rttWindowLength(), now);
        gainCycle = new PacingGainCycle(now);
        ackAggregation = new AckAggregationEstimator(config.extraAckedWindowLength(), config.ackEpochAckedResetThreshold(), now);
        ecnEstimator = new DctcpAlphaEstimator(config.dctcpG(), config.dctcpAlphaOnInit());
        pacingGain = config.highGain();
        cwndGain = config.highGain();
    }

    private BbrCongestionController(BbrCongestionController original, BbrEventListener eventListener) {
        super(original.log, original.clock);
        setSuppressIncreaseIfCwndLimited(original.isSuppressIncreaseIfCwndLimited());
        config = original.config;
        this.eventListener = eventListener;
        random = new Random(original.random.nextLong());
        maxBandwidthFilter = original.maxBandwidthFilter.copy();
        minRttFilter = original.minRttFilter.copy();
        gainCycle = original.gainCycle.copy();
        ackAggregation = original.ackAggregation.copy();
        ecnEstimator = original.ecnEstimator.copy();

        mode = original.mode;
        pacingGain = original.pacingGain;
        cwndGain = original.cwndGain;
        modelInitialized = original.modelInitialized;
        hasSeenRtt = original.hasSeenRtt;
        delivered = original.delivered;
        roundCount = original.roundCount;
        nextRoundDelivered = original.nextRoundDelivered;
        roundStart = original.roundStart;
        pipeFilled = original.pipeFilled;
        fullBandwidth = original.fullBandwidth;
        fullBandwidthCount = original.fullBandwidthCount;
        priorCwnd = original.priorCwnd;
        targetCwnd = original.targetCwnd;
        minPipeCwnd = original.minPipeCwnd;
        sendQuantum = original.sendQuantum;
        packetConservation = original.packetConservation;
        idleRestart = original.idleRestart;
        probeRttDoneStamp = original.probeRttDoneStamp;
        probeRttRoundDone = original.probeRttRoundDone;
        rttJitter = original.rttJitter;
    }

    @Override
    public String getName() {
        return "BBR";
    }

    @Override
    public void initialize(SocketState socketState) {
        log.info("Enabling DCTCP ECN for BBR");
        socketState.setUseEcn(UseEcn.On);
        socketState.setEcnMode(EcnMode.DctcpEcn);
        socketState.setEctCodePoint(config.useEct0()? EcnCodePoint.Ect0: EcnCodePoint.Ect1);
        setSuppressIncreaseIfCwndLimited(false);
        ecnEstimator.markInitialized();
    }

    /**
     * Overrides the configured initial DCTCP alpha.
     * @throws IllegalStateException  when the controller has already been initialized
     */
    public void setInitialDctcpAlpha(double alpha) {
        ecnEstimator.setInitialAlpha(alpha);
    }

    @Override
    public void onCongestionStateChanged(SocketState socketState, CongestionState newState) {
        Instant now = clock.instant();
        if (newState == CongestionState.Open && !modelInitialized) {
            initModel(socketState, now);
        }
        else if (newState == CongestionState.Loss) {
            saveCwnd(socketState);
            roundStart = true;
            log.recovery("Entering loss state; saved cwnd " + priorCwnd);
        }
        else if (newState == CongestionState.Recovery) {
            saveCwnd(socketState);
            long cwnd = socketState.getBytesInFlight() + Long.max(socketState.getLastAckedSackedBytes(), socketState.getSegmentSize());
            socketState.setCwnd(cwnd);
            packetConservation = true;
            log.recovery("Entering recovery; cwnd: " + cwnd + "; saved cwnd " + priorCwnd);
        }
    }

    private void initModel(SocketState socketState, Instant now) {
        Duration previousMinRtt = minRttFilter.getMinRtt();
        minRttFilter.reset(socketState.getSmoothedRtt(), now);
        if (!Objects.equals(previousMinRtt, minRttFilter.getMinRtt())) {
            eventListener.minRttChanged(previousMinRtt, minRttFilter.getMinRtt());
        }
        priorCwnd = socketState.getCwnd();
        socketState.setSsThresh(socketState.getInitialSsThresh());
        targetCwnd = socketState.getCwnd();
        minPipeCwnd = (long) MIN_PIPE_CWND_SEGMENTS * socketState.getSegmentSize();
        sendQuantum = socketState.getSegmentSize();

        roundCount = 0;
        nextRoundDelivered = 0;
        roundStart = false;
        pipeFilled = false;
        fullBandwidth = 0;
        fullBandwidthCount = 0;
        enterStartup();
        long nominalBandwidth = initPacingRate(socketState);
        if (hasSeenRtt) {
            maxBandwidthFilter.reset(nominalBandwidth, 0);
        }
        ackAggregation.reset(now);
        modelInitialized = true;
        log.cc("BBR initialized; cwnd: " + socketState.getCwnd() + "; pacing rate: " + socketState.getPacingRate());
    }

    /**
     * Sets the pacing rate to the rate that would send the current congestion window in one (minimum) RTT, using the
     * startup gain.
     * @return  the nominal bandwidth (i.e. without gain) in bits per second
     */
    private long initPacingRate(SocketState socketState) {
        if (!socketState.isPacing()) {
            log.warn("BBR must use pacing; enabling pacing");
            socketState.setPacing(true);
        }
        Duration rtt = Duration.ofMillis(1);
        if (socketState.getMinRtt() != null) {
            Duration minRttMillis = Duration.ofMillis(socketState.getMinRtt().toMillis());
            if (minRttMillis.compareTo(rtt) > 0) {
                rtt = minRttMillis;
            }
            hasSeenRtt = true;
        }
        long nominalBandwidth = (long) (socketState.getCwnd() * 8 * 1_000_000_000.0 / rtt.toNanos());
        socketState.setPacingRate((long) (pacingGain * nominalBandwidth));
        return nominalBandwidth;
    }

    @Override
    public void onCwndEvent(SocketState socketState, CwndEvent event) {
        switch (event) {
            case CompleteCwr:
                packetConservation = false;
                restoreCwnd(socketState);
                log.recovery("Recovery completed; cwnd: " + socketState.getCwnd());
                break;
            case TxStart:
                if (socketState.getAppLimited() == 0) {
                    break;
                }
                Instant now = clock.instant();
                idleRestart = true;
                ackAggregation.resetEpoch(now);
                if (mode == BbrMode.ProbeBW) {
                    setPacingRate(socketState, 1.0);
                }
                else if (mode == BbrMode.ProbeRTT) {
                    if (probeRttRoundDone && probeRttDoneStamp != null && now.isAfter(probeRttDoneStamp)) {
                        minRttFilter.restamp(now);
                        restoreCwnd(socketState);
                        exitProbeRtt(now);
                    }
                }
                break;
            case EcnIsCe:
                ecnEstimator.ceEntered(socketState);
                break;
            case EcnNoCe:
                ecnEstimator.ceCleared(socketState);
                break;
            case DelayedAck:
                ecnEstimator.setDelayedAckReserved(true);
                break;
            case NonDelayedAck:
                ecnEstimator.setDelayedAckReserved(false);
                break;
            default:
                break;
        }
    }

    @Override
    public void onAck(SocketState socketState, RateConnection rateConnection, RateSample rateSample) {
        Instant now = clock.instant();
        checkBytesInFlight(socketState);
        delivered = rateConnection.getDelivered();
        updateModelAndState(socketState, rateSample, now);
        updateControlParameters(socketState, rateSample);
        emitMetrics(socketState, now);
    }

    @Override
    public void onPacketsAcked(SocketState socketState, int segmentsAcked, Duration rtt) {
        Duration minRtt = minRttFilter.getMinRtt();
        if (rtt != null && minRtt != null) {
            long deviation = Math.abs(rtt.toNanos() - minRtt.toNanos());
            // Smoothed with the same gain as the DCTCP alpha
            double g = config.dctcpG();
            rttJitter = (1 - g) * rttJitter + g * deviation;
        }

        if (socketState.getEcnState() == EcnState.EceReceived) {
            setCwndGain(ecnEstimator.adjustCwndGain(cwndGain, socketState.getEctCodePoint()));
        }
        ecnEstimator.onPacketsAcked(socketState, segmentsAcked, (marked, acked, alpha) -> {
            log.info("DCTCP alpha: " + alpha + " (" + marked + " of " + acked + " bytes marked)");
            log.getQLog().emitCongestionEstimate(marked, acked, alpha, clock.instant());
            eventListener.congestionEstimateUpdated(marked, acked, alpha);
        });
    }

    @Override
    public long getSlowStartThreshold(SocketState socketState, long bytesInFlight) {
        saveCwnd(socketState);
        return socketState.getSsThresh();
    }

    @Override
    public CongestionController fork() {
        return fork(eventListener);
    }

    /**
     * Creates an independent copy of this controller, that reports to the given listener.
     */
    public BbrCongestionController fork(BbrEventListener eventListener) {
        return new BbrCongestionController(this, eventListener != null? eventListener: BbrEventListener.NONE);
    }

    private void updateModelAndState(SocketState socketState, RateSample rateSample, Instant now) {
        updateBottleneckBandwidth(rateSample);
        updateAckAggregation(socketState, rateSample, now);
        checkCyclePhase(socketState, rateSample, now);
        checkFullPipe(rateSample);
        checkDrain(socketState, now);
        updateMinRttEstimate(socketState.getLastRtt(), now);
        checkProbeRtt(socketState, rateSample, now);
    }

    private void updateControlParameters(SocketState socketState, RateSample rateSample) {
        setPacingRate(socketState, pacingGain);
        setSendQuantum(socketState);
        setCwnd(socketState, rateSample);
    }

    /**
     * Skipped samples leave the round start flag as it is, so a round start forced on loss survives until the next valid
     * sample.
     */
    private void updateBottleneckBandwidth(RateSample rateSample) {
        if (rateSample.getDelivered() < 0 || rateSample.getInterval().isZero() || rateSample.getInterval().isNegative()) {
            return;
        }
        updateRound(rateSample);
        // App limited samples only count when they show a higher bandwidth than the current estimate
        if (rateSample.getDeliveryRate() >= maxBandwidthFilter.getBest() || !rateSample.isAppLimited()) {
            maxBandwidthFilter.update(rateSample.getDeliveryRate(), roundCount);
        }
    }

    private void updateRound(RateSample rateSample) {
        if (rateSample.getPriorDelivered() >= nextRoundDelivered) {
            nextRoundDelivered = delivered;
            roundCount++;
            roundStart = true;
            packetConservation = false;
        }
        else {
            roundStart = false;
        }
    }

    private void updateAckAggregation(SocketState socketState, RateSample rateSample, Instant now) {
        if (rateSample.getAckedSacked() <= 0 || rateSample.getDelivered() < 0) {
            return;
        }
        ackAggregation.update(rateSample.getAckedSacked(), roundStart, maxBandwidthFilter.getBest(), socketState.getCwnd(), now);
    }

    private void checkCyclePhase(SocketState socketState, RateSample rateSample, Instant now) {
        if (mode == BbrMode.ProbeBW && isNextCyclePhase(socketState, rateSample, now)) {
            gainCycle.advance(now);
            setPacingGain(gainCycle.getGain());
        }
    }

    private boolean isNextCyclePhase(SocketState socketState, RateSample rateSample, Instant now) {
        Duration minRtt = minRttFilter.getMinRtt();
        boolean isFullLength = minRtt != null && Duration.between(gainCycle.getStamp(), now).compareTo(minRtt) > 0;
        if (pacingGain == 1.0) {
            return isFullLength;
        }
        else if (pacingGain > 1.0) {
            // Probing: continue until inflight reached the probing target or losses show the pipe is full
            return isFullLength && (rateSample.getBytesLoss() > 0 || rateSample.getPriorInFlight() >= inFlight(socketState, pacingGain));
        }
        else {
            // Draining: stop as soon as the queue created by probing is drained
            return isFullLength || rateSample.getPriorInFlight() <= inFlight(socketState, 1.0);
        }
    }

    private void checkFullPipe(RateSample rateSample) {
        if (pipeFilled || !roundStart || rateSample.isAppLimited()) {
            return;
        }
        long bandwidth = maxBandwidthFilter.getBest();
        if (bandwidth >= fullBandwidth * FULL_BANDWIDTH_THRESHOLD) {
            fullBandwidth = bandwidth;
            fullBandwidthCount = 0;
            return;
        }
        fullBandwidthCount++;
        if (fullBandwidthCount >= FULL_BANDWIDTH_ROUNDS) {
            pipeFilled = true;
            log.cc("Pipe filled at " + fullBandwidth + " bps (round " + roundCount + ")");
        }
    }

    private void checkDrain(SocketState socketState, Instant now) {
        if (mode == BbrMode.Startup && pipeFilled) {
            enterDrain();
            socketState.setSsThresh(inFlight(socketState, 1.0));
        }
        if (mode == BbrMode.Drain && socketState.getBytesInFlight() <= inFlight(socketState, 1.0)) {
            enterProbeBw(now);
        }
    }

    private void updateMinRttEstimate(Duration rtt, Instant now) {
        Duration previous = minRttFilter.getMinRtt();
        if (minRttFilter.update(rtt, now) && !Objects.equals(previous, minRttFilter.getMinRtt())) {
            eventListener.minRttChanged(previous, minRttFilter.getMinRtt());
        }
    }

    private void checkProbeRtt(SocketState socketState, RateSample rateSample, Instant now) {
        if (mode != BbrMode.ProbeRTT && minRttFilter.isExpired() && !idleRestart) {
            enterProbeRtt();
            saveCwnd(socketState);
            probeRttDoneStamp = null;
        }
        if (mode == BbrMode.ProbeRTT) {
            handleProbeRtt(socketState, now);
        }
        if (rateSample.getDelivered() > 0) {
            idleRestart = false;
        }
    }

    private void handleProbeRtt(SocketState socketState, Instant now) {
        // Ignore low rate samples during ProbeRTT
        long appLimited = delivered + socketState.getBytesInFlight();
        socketState.setAppLimited(appLimited > 0? appLimited: 1);

        if (probeRttDoneStamp == null && socketState.getBytesInFlight() <= minPipeCwnd) {
            probeRttDoneStamp = now.plus(config.probeRttDuration());
            probeRttRoundDone = false;
            nextRoundDelivered = delivered;
        }
        else if (probeRttDoneStamp != null) {
            if (roundStart) {
                probeRttRoundDone = true;
            }
            if (probeRttRoundDone && now.isAfter(probeRttDoneStamp)) {
                minRttFilter.restamp(now);
                restoreCwnd(socketState);
                exitProbeRtt(now);
            }
        }
    }

    private void setPacingRate(SocketState socketState, double gain) {
        long rate = (long) (gain * maxBandwidthFilter.getBest() * (1.0 - config.pacingMargin()));
        rate = Long.min(rate, socketState.getMaxPacingRate());
        if (!hasSeenRtt && socketState.getMinRtt() != null) {
            // First RTT sample: only the pacing rate is re-initialized, the bandwidth filter keeps its samples
            initPacingRate(socketState);
        }
        if (pipeFilled || rate > socketState.getPacingRate()) {
            if (rate != socketState.getPacingRate()) {
                log.debug("Pacing rate: " + rate + " bps (gain " + gain + ")");
            }
            socketState.setPacingRate(rate);
        }
    }

    private void setSendQuantum(SocketState socketState) {
        // No segment batching: each send is a single segment.
        sendQuantum = socketState.getSegmentSize();
    }

    private void setCwnd(SocketState socketState, RateSample rateSample) {
        long acked = rateSample.getAckedSacked();
        if (acked > 0) {
            boolean conserving = false;
            if (socketState.getCongestionState() == CongestionState.Recovery) {
                conserving = modulateCwndForRecovery(socketState, rateSample);
            }
            if (!conserving) {
                updateTargetCwnd(socketState);
                long cwnd = socketState.getCwnd();
                if (pipeFilled) {
                    cwnd = Long.min(cwnd + acked, targetCwnd);
                }
                else if (cwnd < targetCwnd || delivered < socketState.getInitialCwndBytes()) {
                    cwnd = cwnd + acked;
                }
                if (cwnd != socketState.getCwnd()) {
                    log.debug("Cwnd: " + cwnd + " (target " + targetCwnd + ")");
                }
                socketState.setCwnd(cwnd);
            }
            socketState.setCwnd(Long.max(socketState.getCwnd(), minPipeCwnd));
        }
        modulateCwndForProbeRtt(socketState);
    }

    private boolean modulateCwndForRecovery(SocketState socketState, RateSample rateSample) {
        if (rateSample.getBytesLoss() > 0) {
            long reduced = ByteCounts.saturatingSubtract(socketState.getCwnd(), rateSample.getBytesLoss());
            socketState.setCwnd(Long.max(reduced, socketState.getSegmentSize()));
            log.recovery("Cwnd(-): " + socketState.getCwnd() + " (" + rateSample.getBytesLoss() + " bytes lost)");
        }
        if (packetConservation) {
            long conserved = socketState.getBytesInFlight() + rateSample.getAckedSacked();
            socketState.setCwnd(Long.max(socketState.getCwnd(), conserved));
            return true;
        }
        return false;
    }

    private void modulateCwndForProbeRtt(SocketState socketState) {
        if (mode == BbrMode.ProbeRTT) {
            socketState.setCwnd(Long.min(socketState.getCwnd(), minPipeCwnd));
        }
    }

    private void updateTargetCwnd(SocketState socketState) {
        targetCwnd = inFlight(socketState, cwndGain) + ackAggregation.aggregationCwnd(maxBandwidthFilter.getBest(), pipeFilled);
    }

    /**
     * @return  the amount of data that should be in flight for the given gain, based on the estimated BDP
     */
    long inFlight(SocketState socketState, double gain) {
        Duration minRtt = minRttFilter.getMinRtt();
        if (minRtt == null) {
            return socketState.getInitialCwndBytes();
        }
        double bdp = maxBandwidthFilter.getBest() * (minRtt.toNanos() / 8e9);
        long inFlight = (long) (gain * bdp) + 3 * sendQuantum;
        if (mode == BbrMode.ProbeBW && gainCycle.getIndex() == 0) {
            inFlight += 2L * socketState.getSegmentSize();
        }
        return inFlight;
    }

    private void saveCwnd(SocketState socketState) {
        if (socketState.getCongestionState() != CongestionState.Recovery && mode != BbrMode.ProbeRTT) {
            priorCwnd = socketState.getCwnd();
        }
        else {
            priorCwnd = Long.max(priorCwnd, socketState.getCwnd());
        }
    }

    private void restoreCwnd(SocketState socketState) {
        socketState.setCwnd(Long.max(priorCwnd, socketState.getCwnd()));
    }

    private void enterStartup() {
        setMode(BbrMode.Startup);
        setPacingGain(config.highGain());
        setCwndGain(config.highGain());
    }

    private void enterDrain() {
        setMode(BbrMode.Drain);
        setPacingGain(1.0 / config.highGain());
        setCwndGain(config.highGain());
    }

    private void enterProbeBw(Instant now) {
        setMode(BbrMode.ProbeBW);
        setPacingGain(1.0);
        setCwndGain(PROBE_BW_CWND_GAIN);
        gainCycle.start(random, now);
        setPacingGain(gainCycle.getGain());
    }

    private void enterProbeRtt() {
        setMode(BbrMode.ProbeRTT);
        setPacingGain(1.0);
        setCwndGain(1.0);
    }

    private void exitProbeRtt(Instant now) {
        if (pipeFilled) {
            enterProbeBw(now);
        }
        else {
            enterStartup();
        }
    }

    private void setMode(BbrMode newMode) {
        BbrMode oldMode = mode;
        mode = newMode;
        if (oldMode != newMode) {
            log.cc("BBR mode " + oldMode + " -> " + newMode);
            log.getQLog().emitCongestionStateUpdated(oldMode.name(), newMode.name(), clock.instant());
            eventListener.modeChanged(oldMode, newMode);
        }
    }

    private void setPacingGain(double gain) {
        double oldGain = pacingGain;
        pacingGain = gain;
        if (oldGain != gain) {
            eventListener.pacingGainChanged(oldGain, gain);
        }
    }

    private void setCwndGain(double gain) {
        double oldGain = cwndGain;
        cwndGain = gain;
        if (oldGain != gain) {
            eventListener.cwndGainChanged(oldGain, gain);
        }
    }

    public BbrMode getMode() {
        return mode;
    }

    public double getPacingGain() {
        return pacingGain;
    }

    public double getCwndGain() {
        return cwndGain;
    }

    /**
     * @return  the current min RTT estimate, or null if there is none
     */
    public Duration getMinRtt() {
        return minRttFilter.getMinRtt();
    }

    /**
     * @return  the current bottleneck bandwidth estimate, in bits per second
     */
    public long getBandwidthEstimate() {
        return maxBandwidthFilter.getBest();
    }

    public long getTargetCwnd() {
        return targetCwnd;
    }

    public long getRoundCount() {
        return roundCount;
    }

    public boolean isRoundStart() {
        return roundStart;
    }

    public boolean isPipeFilled() {
        return pipeFilled;
    }

    public long getPriorCwnd() {
        return priorCwnd;
    }

    public long getSendQuantum() {
        return sendQuantum;
    }

    public int getCycleIndex() {
        return gainCycle.getIndex();
    }

    public double getAlpha() {
        return ecnEstimator.getAlpha();
    }

    /**
     * @return  smoothed deviation of RTT samples from the min RTT, in nanoseconds
     */
    public double getRttJitter() {
        return rttJitter;
    }
}
