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

import java.time.Duration;

/**
 * Observer for changes of the BBR model and control variables. All methods are called synchronously on the
 * thread processing the connection's events, and only when the value actually changed.
 */
public interface BbrEventListener {

    BbrEventListener NONE = new BbrEventListener() {};

    default void modeChanged(BbrMode oldMode, BbrMode newMode) {}

    /**
     * @param oldMinRtt  previous estimate, or null if there was none
     * @param newMinRtt  new estimate
     */
    default void minRttChanged(Duration oldMinRtt, Duration newMinRtt) {}

    default void pacingGainChanged(double oldGain, double newGain) {}

    default void cwndGainChanged(double oldGain, double newGain) {}

    /**
     * Called at the end of each ECN observation window.
     * @param bytesMarked  bytes acked with congestion echo in the window
     * @param bytesAcked  bytes acked in the window
     * @param alpha  new congestion estimate
     */
    default void congestionEstimateUpdated(long bytesMarked, long bytesAcked, double alpha) {}
}
