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
import tech.kwik.bbr.socket.AckSender;
import tech.kwik.bbr.socket.EcnCodePoint;
import tech.kwik.bbr.socket.EcnState;
import tech.kwik.bbr.socket.SocketState;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DctcpAlphaEstimatorTest {

    private DctcpAlphaEstimator estimator;
    private SocketState socketState;
    private DctcpAlphaEstimator.EstimateListener listener;

    @BeforeEach
    void initObjectUnderTest() {
        estimator = new DctcpAlphaEstimator(0.0625, 1.0);
        socketState = new SocketState(50);
        listener = mock(DctcpAlphaEstimator.EstimateListener.class);
    }

    @Test
    void alphaIsUpdatedWhenObservationWindowCloses() {
        socketState.setNextTxSequence(100);
        socketState.setEcnState(EcnState.EceReceived);
        socketState.setLastAckedSeq(50);
        boolean updated = estimator.onPacketsAcked(socketState, 1, listener);
        assertThat(updated).isFalse();

        socketState.setEcnState(EcnState.Idle);
        socketState.setLastAckedSeq(100);
        updated = estimator.onPacketsAcked(socketState, 1, listener);

        assertThat(updated).isTrue();
        // 0.9375 * 1.0 + 0.0625 * 0.5
        assertThat(estimator.getAlpha()).isEqualTo(0.96875);
        verify(listener).estimateUpdated(50, 100, 0.96875);
    }

    @Test
    void countersAreResetAndBoundaryMovedWhenWindowCloses() {
        socketState.setNextTxSequence(100);
        socketState.setLastAckedSeq(100);
        estimator.onPacketsAcked(socketState, 2, listener);
        assertThat(estimator.getNextSeq()).isEqualTo(100);

        socketState.setNextTxSequence(400);
        socketState.setLastAckedSeq(150);
        estimator.onPacketsAcked(socketState, 1, listener);

        assertThat(estimator.getAckedBytesTotal()).isEqualTo(0);
        assertThat(estimator.getNextSeq()).isEqualTo(400);
    }

    @Test
    void alphaDecaysWithoutMarking() {
        socketState.setNextTxSequence(0);
        for (int i = 0; i < 16; i++) {
            estimator.onPacketsAcked(socketState, 1, listener);
        }

        assertThat(estimator.getAlpha()).isCloseTo(Math.pow(0.9375, 16), within(1e-12));
    }

    @Test
    void alphaStaysWithinUnitInterval() {
        socketState.setNextTxSequence(0);
        socketState.setEcnState(EcnState.EceReceived);
        for (int i = 0; i < 100; i++) {
            estimator.onPacketsAcked(socketState, 3, listener);
            assertThat(estimator.getAlpha()).isBetween(0.0, 1.0);
        }
    }

    @Test
    void initialAlphaCannotBeChangedAfterInitialization() {
        estimator.setInitialAlpha(0.5);
        assertThat(estimator.getAlpha()).isEqualTo(0.5);

        estimator.markInitialized();

        assertThatThrownBy(() -> estimator.setInitialAlpha(0.2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> new DctcpAlphaEstimator(0.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DctcpAlphaEstimator(1.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DctcpAlphaEstimator(0.5, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cwndGainIsIncreasedForEct0UpToBound() {
        assertThat(estimator.adjustCwndGain(2.0, EcnCodePoint.Ect0)).isCloseTo(2.1, within(1e-9));
        assertThat(estimator.adjustCwndGain(2.45, EcnCodePoint.Ect0)).isEqualTo(2.5);
    }

    @Test
    void cwndGainIsDecreasedForEct1DownToBound() {
        assertThat(estimator.adjustCwndGain(2.0, EcnCodePoint.Ect1)).isCloseTo(1.9, within(1e-9));
        assertThat(estimator.adjustCwndGain(1.55, EcnCodePoint.Ect1)).isEqualTo(1.5);
    }

    @Test
    void cwndGainIsUnchangedForOtherCodePoints() {
        assertThat(estimator.adjustCwndGain(2.0, EcnCodePoint.NotEct)).isEqualTo(2.0);
    }

    @Test
    void pendingDelayedAckIsSentWhenCongestionStateChanges() {
        AckSender ackSender = mock(AckSender.class);
        socketState.setAckSender(ackSender);
        estimator.setDelayedAckReserved(true);

        socketState.setNextRxSequence(100);
        estimator.ceEntered(socketState);
        verify(ackSender, never()).sendEmptyAck(anyLong(), anyBoolean());
        assertThat(socketState.getEcnState()).isEqualTo(EcnState.CeReceived);

        socketState.setNextRxSequence(200);
        estimator.ceCleared(socketState);
        verify(ackSender).sendEmptyAck(100, true);
        assertThat(socketState.getEcnState()).isEqualTo(EcnState.Idle);

        socketState.setNextRxSequence(300);
        estimator.ceEntered(socketState);
        verify(ackSender).sendEmptyAck(200, false);
    }

    @Test
    void noAckIsSentWithoutPendingDelayedAck() {
        AckSender ackSender = mock(AckSender.class);
        socketState.setAckSender(ackSender);

        estimator.ceEntered(socketState);
        estimator.ceCleared(socketState);
        estimator.ceEntered(socketState);

        verify(ackSender, never()).sendEmptyAck(anyLong(), anyBoolean());
        assertThat(estimator.isCeState()).isTrue();
    }

    @Test
    void copyIsIndependent() {
        DctcpAlphaEstimator copy = estimator.copy();
        socketState.setNextTxSequence(0);

        copy.onPacketsAcked(socketState, 1, listener);

        assertThat(copy.getAlpha()).isLessThan(1.0);
        assertThat(estimator.getAlpha()).isEqualTo(1.0);
    }
}
