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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Windowed max filter that keeps the best bandwidth sample of the last n rounds.
 * Implemented as a monotonic deque: round numbers strictly increase and values strictly decrease from head to tail,
 * so the head always holds the maximum of the window and the deque never holds more entries than the window length.
 */
public class MaxBandwidthFilter {

    private final int windowLength;
    private final Deque<Sample> samples;

    /**
     * @param windowLength  window length in rounds
     */
    public MaxBandwidthFilter(int windowLength) {
        if (windowLength < 1) {
            throw new IllegalArgumentException();
        }
        this.windowLength = windowLength;
        samples = new ArrayDeque<>(windowLength);
    }

    private MaxBandwidthFilter(MaxBandwidthFilter original) {
        windowLength = original.windowLength;
        samples = new ArrayDeque<>(original.samples);
    }

    /**
     * Discards all samples and starts over with the given one.
     */
    public void reset(long value, long round) {
        samples.clear();
        samples.addLast(new Sample(value, round));
    }

    /**
     * Adds a sample taken in the given round; expires samples that are outside the window, as seen from that round.
     * @param value  bandwidth, in bits per second
     * @param round  round in which the sample was taken; must not be less than the round of any previous sample
     */
    public void update(long value, long round) {
        while (!samples.isEmpty() && round - samples.peekFirst().round >= windowLength) {
            samples.removeFirst();
        }
        Sample last = samples.peekLast();
        if (last != null && last.round >= round && last.value >= value) {
            // Dominated by a sample that will not expire earlier.
            return;
        }
        while (!samples.isEmpty() && samples.peekLast().value <= value) {
            samples.removeLast();
        }
        samples.addLast(new Sample(value, round));
    }

    /**
     * @return  the maximum of the samples in the window, or 0 if there are none
     */
    public long getBest() {
        Sample first = samples.peekFirst();
        return first != null? first.value: 0;
    }

    public int getWindowLength() {
        return windowLength;
    }

    int size() {
        return samples.size();
    }

    public MaxBandwidthFilter copy() {
        return new MaxBandwidthFilter(this);
    }

    private static final class Sample {
        final long value;
        final long round;

        Sample(long value, long round) {
            this.value = value;
            this.round = round;
        }
    }
}
