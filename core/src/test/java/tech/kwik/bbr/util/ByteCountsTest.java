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
package tech.kwik.bbr.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ByteCountsTest {

    @Test
    void subtractionNeverGoesBelowZero() {
        assertThat(ByteCounts.saturatingSubtract(1000, 400)).isEqualTo(600);
        assertThat(ByteCounts.saturatingSubtract(400, 1000)).isEqualTo(0);
    }

    @Test
    void bytesDeliveredAtRate() {
        // 8 Mbit/s during 10 ms
        assertThat(ByteCounts.bytesAt(8_000_000, 10_000_000)).isEqualTo(10_000);
    }

    @Test
    void largeRatesDoNotOverflow() {
        // 100 Gbit/s during 10 s
        assertThat(ByteCounts.bytesAt(100_000_000_000L, 10_000_000_000L)).isEqualTo(125_000_000_000L);
    }
}
