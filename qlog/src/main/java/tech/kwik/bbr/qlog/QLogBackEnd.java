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

import tech.kwik.bbr.qlog.event.ConnectionCreatedEvent;
import tech.kwik.bbr.qlog.event.ConnectionTerminatedEvent;

import java.io.IOException;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Writes the qlog events of all connections, on a single (daemon) thread.
 */
public class QLogBackEnd {

    private static volatile QLogBackEnd instance;

    private final BlockingQueue<QLogEvent> queue;
    private final Map<String, ConnectionQLog> connections;

    public static QLogBackEnd getInstance() {
        if (instance == null) {
            synchronized (QLogBackEnd.class) {
                if (instance == null) {
                    instance = new QLogBackEnd();
                }
            }
        }
        return instance;
    }

    QLogBackEnd() {
        this.queue = new LinkedBlockingQueue<>();
        this.connections = new ConcurrentHashMap<>();

        Thread qlogWriterThread = new Thread(() -> generateConnectionLog());
        qlogWriterThread.setDaemon(true);
        qlogWriterThread.setPriority(Thread.MIN_PRIORITY);
        qlogWriterThread.setName("qlog-writer");
        qlogWriterThread.start();
    }

    public Queue<QLogEvent> getQueue() {
        return queue;
    }

    private void generateConnectionLog() {
        while (true) {
            try {
                QLogEvent event = queue.poll(63_000, TimeUnit.MILLISECONDS);   // Flush logs of connections that have gone quiet
                if (event != null) {
                    process(event);
                }
                else {
                    connections.values().forEach(log -> log.close());
                    connections.clear();
                }
            }
            catch (InterruptedException e) {
                connections.values().forEach(log -> log.close());
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void process(QLogEvent event) {
        String key = event.getConnectionId();
        if (event instanceof ConnectionCreatedEvent) {
            try {
                connections.put(key, new ConnectionQLog((ConnectionCreatedEvent) event));
            }
            catch (IOException e) {
                System.err.println("QLog: cannot create log for connection " + key + ": " + e);
                return;
            }
        }

        ConnectionQLog connectionQLog = connections.get(key);
        if (connectionQLog != null) {
            event.accept(connectionQLog);
            if (event instanceof ConnectionTerminatedEvent) {
                connections.remove(key);
            }
        }
    }
}
