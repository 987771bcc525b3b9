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
import tech.kwik.bbr.socket.SocketState;

import java.time.Clock;
import java.time.Instant;

public abstract class AbstractCongestionController implements CongestionController {

    protected final Logger log;
    protected final Clock clock;
    private boolean suppressIncreaseIfCwndLimited = true;

    protected AbstractCongestionController(Logger logger, Clock clock) {
        this.log = logger;
        this.clock = clock;
    }

    /**
     * @return  whether window growth is suppressed when the sender is not limited by the congestion window
     */
    public boolean isSuppressIncreaseIfCwndLimited() {
        return suppressIncreaseIfCwndLimited;
    }

    protected void setSuppressIncreaseIfCwndLimited(boolean suppress) {
        suppressIncreaseIfCwndLimited = suppress;
    }

    protected void emitMetrics(SocketState socketState, Instant now) {
        log.getQLog().emitCongestionControlMetrics(socketState.getCwnd(), socketState.getBytesInFlight(), socketState.getPacingRate(), now);
    }

    protected void checkBytesInFlight(SocketState socketState) {
        if (socketState.getBytesInFlight() < 0) {
            log.error("Inconsistency error in congestion controller; bytes in-flight below 0: " + socketState.getBytesInFlight());
            socketState.setBytesInFlight(0);
        }
    }
}
