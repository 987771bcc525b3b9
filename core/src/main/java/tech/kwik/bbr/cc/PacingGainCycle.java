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

import java.time.Instant;
import java.util.Random;

/**
 * The eight-phase pacing gain cycle used in ProbeBW: one phase probing for more bandwidth, one phase draining the
 * queue this may have created, and six phases cruising at the estimated bandwidth.
 */
public class PacingGainCycle {

    public static final int GAIN_CYCLE_LENGTH = 8;

    private static final double[] PACING_GAIN_CYCLE = { 5.0 / 4, 3.0 / 4, 1, 1, 1, 1, 1, 1 };

    // Phase randomization: start in any phase but the draining one.
    private static final int RANDOM_PHASES = GAIN_CYCLE_LENGTH - 1;

    private int index;
    private Instant stamp;

    public PacingGainCycle(Instant now) {
        stamp = now;
    }

    private PacingGainCycle(PacingGainCycle original) {
        index = original.index;
        stamp = original.stamp;
    }

    /**
     * Picks a random phase to start from, then advances to it.
     */
    public void start(Random random, Instant now) {
        index = GAIN_CYCLE_LENGTH - 1 - random.nextInt(RANDOM_PHASES);
        advance(now);
    }

    public void advance(Instant now) {
        stamp = now;
        index = (index + 1) % GAIN_CYCLE_LENGTH;
    }

    public double getGain() {
        return PACING_GAIN_CYCLE[index];
    }

    public int getIndex() {
        return index;
    }

    public Instant getStamp() {
        return stamp;
    }

    public static double gainAt(int index) {
        return PACING_GAIN_CYCLE[index];
    }

    public PacingGainCycle copy() {
        return new PacingGainCycle(this);
    }
}
