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
package tech.kwik.bbr.log;

import java.time.Duration;
import java.time.Instant;


public class NullQLog implements QLog {

    @Override
    public void emitConnectionCreatedEvent(Instant created) {}

    @Override
    public void emitCongestionControlMetrics(long congestionWindow, long bytesInFlight, long pacingRate, Instant time) {}

    @Override
    public void emitRttMetrics(Duration minRtt, Duration smoothedRtt, Duration latestRtt, Instant time) {}

    @Override
    public void emitCongestionStateUpdated(String oldState, String newState, Instant time) {}

    @Override
    public void emitCongestionEstimate(long bytesMarked, long bytesAcked, double alpha, Instant time) {}

    @Override
    public void emitConnectionTerminatedEvent() {}
}
