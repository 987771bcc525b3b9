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
package tech.kwik.bbr.qlog;

import tech.kwik.bbr.log.QLog;
import tech.kwik.bbr.qlog.event.CongestionControlMetricsEvent;
import tech.kwik.bbr.qlog.event.CongestionEstimateEvent;
import tech.kwik.bbr.qlog.event.CongestionStateUpdatedEvent;
import tech.kwik.bbr.qlog.event.ConnectionCreatedEvent;
import tech.kwik.bbr.qlog.event.ConnectionTerminatedEvent;
import tech.kwik.bbr.qlog.event.RttMetricsEvent;

import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.AbstractQueue;
import java.util.Collections;
import java.util.Iterator;
import java.util.Queue;

/**
 * Entrypoint of the QLog module. Collects qlog events and processes them asynchronously.
 * Note that a QLOG log file will only be written if the environment variable "QLOGDIR" is set, or an output directory
 * is passed explicitly.
 */
public class QLogFrontEnd implements QLog {

    private final String connectionId;
    private final File qlogDir;
    private final Queue<QLogEvent> eventQueue;

    public QLogFrontEnd(String connectionId) {
        this(connectionId, qlogDirFromEnvironment());
    }

    /**
     * @param qlogDir  directory to write the qlog file to, or null to disable qlog output
     */
    public QLogFrontEnd(String connectionId, File qlogDir) {
        this(connectionId, qlogDir, qlogDir != null? QLogBackEnd.getInstance().getQueue(): new NullQueue());
    }

    QLogFrontEnd(String connectionId, File qlogDir, Queue<QLogEvent> eventQueue) {
        this.connectionId = connectionId;
        this.qlogDir = qlogDir;
        this.eventQueue = eventQueue;
        if (qlogDir != null && !qlogDir.exists()) {
            qlogDir.mkdirs();
        }
    }

    private static File qlogDirFromEnvironment() {
        String qlogdirEnvVar = System.getenv("QLOGDIR");
        if (qlogdirEnvVar != null && !qlogdirEnvVar.isBlank()) {
            return new File(qlogdirEnvVar);
        }
        else {
            return null;
        }
    }

    public boolean isEnabled() {
        return qlogDir != null;
    }

    @Override
    public void emitConnectionCreatedEvent(Instant created) {
        eventQueue.add(new ConnectionCreatedEvent(connectionId, created, qlogDir));
    }

    @Override
    public void emitCongestionControlMetrics(long congestionWindow, long bytesInFlight, long pacingRate, Instant time) {
        eventQueue.add(new CongestionControlMetricsEvent(connectionId, congestionWindow, bytesInFlight, pacingRate, time));
    }

    @Override
    public void emitRttMetrics(Duration minRtt, Duration smoothedRtt, Duration latestRtt, Instant time) {
        eventQueue.add(new RttMetricsEvent(connectionId, minRtt, smoothedRtt, latestRtt, time));
    }

    @Override
    public void emitCongestionStateUpdated(String oldState, String newState, Instant time) {
        eventQueue.add(new CongestionStateUpdatedEvent(connectionId, oldState, newState, time));
    }

    @Override
    public void emitCongestionEstimate(long bytesMarked, long bytesAcked, double alpha, Instant time) {
        eventQueue.add(new CongestionEstimateEvent(connectionId, bytesMarked, bytesAcked, alpha, time));
    }

    @Override
    public void emitConnectionTerminatedEvent() {
        eventQueue.add(new ConnectionTerminatedEvent(connectionId));
    }

    private static class NullQueue extends AbstractQueue<QLogEvent> {
        @Override
        public boolean offer(QLogEvent qLogEvent) {
            return true;
        }

        @Override
        public QLogEvent poll() {
            return null;
        }

        @Override
        public QLogEvent peek() {
            return null;
        }

        @Override
        public Iterator<QLogEvent> iterator() {
            return Collections.emptyIterator();
        }

        @Override
        public int size() {
            return 0;
        }
    }
}
