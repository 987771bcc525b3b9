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

import tech.kwik.bbr.rate.RateConnection;
import tech.kwik.bbr.rate.RateSample;
import tech.kwik.bbr.socket.CongestionState;
import tech.kwik.bbr.socket.CwndEvent;
import tech.kwik.bbr.socket.SocketState;

import java.time.Duration;

/**
 * Operations a connection invokes on its congestion controller. All operations are invoked from the connection's
 * event processing and never concurrently for the same connection.
 */
public interface CongestionController {

    String getName();

    /**
     * Sets the socket configuration the algorithm requires.
     */
    void initialize(SocketState socketState);

    /**
     * Called when the connection's congestion state changes, before the new state is stored in the socket state.
     */
    void onCongestionStateChanged(SocketState socketState, CongestionState newState);

    void onCwndEvent(SocketState socketState, CwndEvent event);

    /**
     * Main control entry point, called for every ack with the rate sample it produced.
     */
    void onAck(SocketState socketState, RateConnection rateConnection, RateSample rateSample);

    /**
     * Called for every ack that acknowledges new data.
     * @param rtt  RTT sample of this ack, or null if there is none
     */
    void onPacketsAcked(SocketState socketState, int segmentsAcked, Duration rtt);

    long getSlowStartThreshold(SocketState socketState, long bytesInFlight);

    /**
     * Creates an independent copy of this congestion controller for a connection that is derived from the one this
     * congestion controller belongs to (e.g. a connection accepted by a listening socket).
     */
    CongestionController fork();
}
