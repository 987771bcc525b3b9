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

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MinRttFilterTest {

    private Instant start;
    private MinRttFilter filter;

    @BeforeEach
    void initObjectUnderTest() {
        start = Instant.EPOCH;
        filter = new MinRttFilter(Duration.ofSeconds(10), start);
    }

    @Test
    void firstSampleIsAccepted() {
        boolean accepted = filter.update(Duration.ofMillis(80), start.plusMillis(5));

        assertThat(accepted).isTrue();
        assertThat(filter.getMinRtt()).isEqualTo(Duration.ofMillis(80));
        assertThat(filter.getStamp()).isEqualTo(start.plusMillis(5));
    }

    @Test
    void largerSampleIsIgnoredWithinWindow() {
        filter.update(Duration.ofMillis(80), start);

        boolean accepted = filter.update(Duration.ofMillis(90), start.plusSeconds(9));

        assertThat(accepted).isFalse();
        assertThat(filter.getMinRtt()).isEqualTo(Duration.ofMillis(80));
        assertThat(filter.isExpired()).isFalse();
    }

    @Test
    void equalSampleRefreshesStamp() {
        filter.update(Duration.ofMillis(80), start);

        filter.update(Duration.ofMillis(80), start.plusSeconds(4));

        assertThat(filter.getStamp()).isEqualTo(start.plusSeconds(4));
    }

    @Test
    void largerSampleIsAcceptedWhenEstimateExpired() {
        filter.update(Duration.ofMillis(80), start);

        boolean accepted = filter.update(Duration.ofMillis(120), start.plusSeconds(10).plusMillis(1));

        assertThat(accepted).isTrue();
        assertThat(filter.getMinRtt()).isEqualTo(Duration.ofMillis(120));
        assertThat(filter.isExpired()).isTrue();
    }

    @Test
    void estimateIsNotExpiredAtExactlyTheWindowLength() {
        filter.update(Duration.ofMillis(80), start);

        filter.update(Duration.ofMillis(120), start.plusSeconds(10));

        assertThat(filter.isExpired()).isFalse();
        assertThat(filter.getMinRtt()).isEqualTo(Duration.ofMillis(80));
    }

    @Test
    void missingOrInvalidSamplesAreIgnored() {
        assertThat(filter.update(null, start)).isFalse();
        assertThat(filter.update(Duration.ZERO, start)).isFalse();
        assertThat(filter.hasEstimate()).isFalse();
        assertThat(filter.getMinRtt()).isNull();
    }

    @Test
    void restampKeepsEstimate() {
        filter.update(Duration.ofMillis(80), start);

        filter.restamp(start.plusSeconds(8));

        assertThat(filter.isExpired(start.plusSeconds(17))).isFalse();
        assertThat(filter.getMinRtt()).isEqualTo(Duration.ofMillis(80));
    }
}
