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

import java.time.Duration;
import java.time.Instant;

public class RttMetricsEvent extends QLogEvent {

    private final Duration minRtt;
    private final Duration smoothedRtt;
    private final Duration latestRtt;

    public RttMetricsEvent(String connectionId, Duration minRtt, Duration smoothedRtt, Duration latestRtt, Instant time) {
        super(connectionId, time);
        this.minRtt = minRtt;
        this.smoothedRtt = smoothedRtt;
        this.latestRtt = latestRtt;
    }

    @Override
    public void accept(QLogEventProcessor processor) {
        processor.process(this);
    }

    public Duration getMinRtt() {
        return minRtt;
    }

    public Duration getSmoothedRtt() {
        return smoothedRtt;
    }

    public Duration getLatestRtt() {
        return latestRtt;
    }
}
