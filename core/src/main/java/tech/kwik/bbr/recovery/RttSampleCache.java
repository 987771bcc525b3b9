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
package tech.kwik.bbr.recovery;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded buffer of the most recent RTT samples, shared by the connections that are given the same instance.
 * When full, adding a sample evicts the oldest one.
 */
public class RttSampleCache {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<Duration> samples;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RttSampleCache() {
        this(DEFAULT_CAPACITY);
    }

    public RttSampleCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        samples = new ArrayDeque<>(capacity);
    }

    public void add(Duration rtt) {
        lock.writeLock().lock();
        try {
            if (samples.size() == capacity) {
                samples.removeFirst();
            }
            samples.addLast(rtt);
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return  the cached samples, oldest first
     */
    public List<Duration> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(samples);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return samples.size();
        }
        finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
