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
package tech.kwik.bbr.rate;

import java.time.Duration;

/**
 * Delivery statistics computed by the connection's rate sampler for one acknowledgement.
 * See https://datatracker.ietf.org/doc/html/draft-cheng-iccrg-delivery-rate-estimation
 */
public class RateSample {

    private final long delivered;
    private final Duration interval;
    private final long deliveryRate;
    private final boolean appLimited;
    private final long priorInFlight;
    private final long bytesLoss;
    private final long ackedSacked;
    private final long priorDelivered;

    private RateSample(Builder builder) {
        delivered = builder.delivered;
        interval = builder.interval;
        deliveryRate = builder.deliveryRate;
        appLimited = builder.appLimited;
        priorInFlight = builder.priorInFlight;
        bytesLoss = builder.bytesLoss;
        ackedSacked = builder.ackedSacked;
        priorDelivered = builder.priorDelivered;
    }

    /**
     * @return  bytes delivered during the sample interval; negative if the sample is invalid
     */
    public long getDelivered() {
        return delivered;
    }

    public Duration getInterval() {
        return interval;
    }

    /**
     * @return  delivery rate in bits per second
     */
    public long getDeliveryRate() {
        return deliveryRate;
    }

    public boolean isAppLimited() {
        return appLimited;
    }

    public long getPriorInFlight() {
        return priorInFlight;
    }

    public long getBytesLoss() {
        return bytesLoss;
    }

    public long getAckedSacked() {
        return ackedSacked;
    }

    /**
     * @return  the connection's delivered count at the time the acknowledged packet was sent
     */
    public long getPriorDelivered() {
        return priorDelivered;
    }

    @Override
    public String toString() {
        return "RateSample[delivered=" + delivered + ", interval=" + interval.toMillis() + "ms, rate=" + deliveryRate
                + (appLimited? " (app-limited)": "") + ", acked=" + ackedSacked + ", lost=" + bytesLoss + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long delivered = -1;
        private Duration interval = Duration.ZERO;
        private long deliveryRate;
        private boolean appLimited;
        private long priorInFlight;
        private long bytesLoss;
        private long ackedSacked;
        private long priorDelivered;

        public Builder delivered(long delivered) {
            this.delivered = delivered;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder deliveryRate(long bitsPerSecond) {
            this.deliveryRate = bitsPerSecond;
            return this;
        }

        public Builder appLimited(boolean appLimited) {
            this.appLimited = appLimited;
            return this;
        }

        public Builder priorInFlight(long priorInFlight) {
            this.priorInFlight = priorInFlight;
            return this;
        }

        public Builder bytesLoss(long bytesLoss) {
            this.bytesLoss = bytesLoss;
            return this;
        }

        public Builder ackedSacked(long ackedSacked) {
            this.ackedSacked = ackedSacked;
            return this;
        }

        public Builder priorDelivered(long priorDelivered) {
            this.priorDelivered = priorDelivered;
            return this;
        }

        public RateSample build() {
            if (interval == null) {
                throw new IllegalArgumentException("interval must not be null");
            }
            return new RateSample(this);
        }
    }
}
