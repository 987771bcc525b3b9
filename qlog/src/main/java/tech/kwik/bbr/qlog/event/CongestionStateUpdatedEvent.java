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
package tech.kwik.bbr.qlog.event;

import tech.kwik.bbr.qlog.QLogEvent;

import java.time.Instant;

public class CongestionStateUpdatedEvent extends QLogEvent {

    private final String oldState;
    private final String newState;

    public CongestionStateUpdatedEvent(String connectionId, String oldState, String newState, Instant time) {
        super(connectionId, time);
        this.oldState = oldState;
        this.newState = newState;
    }

    @Override
    public void accept(QLogEventProcessor processor) {
        processor.process(this);
    }

    public String getOldState() {
        return oldState;
    }

    public String getNewState() {
        return newState;
    }
}
