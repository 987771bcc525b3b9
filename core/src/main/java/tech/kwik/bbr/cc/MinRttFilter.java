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
import java.time.Instant;

/**
 * Keeps the minimum RTT observed during a time window. A sample is only replaced by a smaller one, unless the current
 * minimum is older than the window; once it is, the next sample is accepted regardless of its value.
 */
public class MinRttFilter {

    private final Duration filterLength;
    private Duration minRtt;
    private Instant stamp;
    private boolean expired;

    public MinRttFilter(Duration filterLength, Instant now) {
        this.filterLength = filterLength;
        this.stamp = now;
    }

    private MinRttFilter(MinRttFilter original) {
        filterLength = original.filterLength;
        minRtt = original.minRtt;
        stamp = original.stamp;
        expired = original.expired;
    }

    /**
     * Restarts the filter with the given estimate (which may be null, for no estimate).
     */
    public void reset(Duration initialRtt, Instant now) {
        minRtt = initialRtt;
        stamp = now;
        expired = false;
    }

    /**
     * Evaluates expiry and offers a new sample.
     * @param rtt  RTT sample, may be null if the connection has none yet
     * @return  true if the sample was accepted as the new minimum
     */
    public boolean update(Duration rtt, Instant now) {
        expired = now.isAfter(stamp.plus(filterLength));
        if (rtt != null && !rtt.isNegative() && !rtt.isZero() && (minRtt == null || rtt.compareTo(minRtt) <= 0 || expired)) {
            minRtt = rtt;
            stamp = now;
            return true;
        }
        return false;
    }

    /**
     * @return  whether the estimate had expired at the time of the last update; stays true after a sample was admitted
     * in that update, so that the expiry can still trigger a ProbeRTT.
     */
    public boolean isExpired() {
        return expired;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(stamp.plus(filterLength));
    }

    /**
     * Marks the current estimate as fresh, without changing it.
     */
    public void restamp(Instant now) {
        stamp = now;
    }

    public boolean hasEstimate() {
        return minRtt != null;
    }

    /**
     * @return  current estimate, or null if there is none
     */
    public Duration getMinRtt() {
        return minRtt;
    }

    public Instant getStamp() {
        return stamp;
    }

    public Duration getFilterLength() {
        return filterLength;
    }

    public MinRttFilter copy() {
        return new MinRttFilter(this);
    }
}
