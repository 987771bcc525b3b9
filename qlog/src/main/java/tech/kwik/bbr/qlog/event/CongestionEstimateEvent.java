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

/**
 * Update of the estimated fraction of congestion marked traffic.
 */
public class CongestionEstimateEvent extends QLogEvent {

    private final long bytesMarked;
    private final long bytesAcked;
    private final double alpha;

    public CongestionEstimateEvent(String connectionId, long bytesMarked, long bytesAcked, double alpha, Instant time) {
        super(connectionId, time);
        this.bytesMarked = bytesMarked;
        this.bytesAcked = bytesAcked;
        this.alpha = alpha;
    }

    @Override
    public void accept(QLogEventProcessor processor) {
        processor.process(this);
    }

    public long getBytesMarked() {
        return bytesMarked;
    }

    public long getBytesAcked() {
        return bytesAcked;
    }

    public double getAlpha() {
        return alpha;
    }
}
