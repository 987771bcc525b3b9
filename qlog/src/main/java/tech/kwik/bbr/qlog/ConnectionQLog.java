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

import jakarta.json.Json;
import jakarta.json.stream.JsonGenerator;
import tech.kwik.bbr.qlog.event.CongestionControlMetricsEvent;
import tech.kwik.bbr.qlog.event.CongestionEstimateEvent;
import tech.kwik.bbr.qlog.event.CongestionStateUpdatedEvent;
import tech.kwik.bbr.qlog.event.ConnectionCreatedEvent;
import tech.kwik.bbr.qlog.event.ConnectionTerminatedEvent;
import tech.kwik.bbr.qlog.event.QLogEventProcessor;
import tech.kwik.bbr.qlog.event.RttMetricsEvent;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static jakarta.json.stream.JsonGenerator.PRETTY_PRINTING;
import static java.util.Collections.emptyMap;


/**
 * Manages (collects and stores) the qlog file for exactly one connection.
 * The log is identified by the connection id the connection's front end was created with.
 */
public class ConnectionQLog implements QLogEventProcessor {

    private final String connectionId;
    private final Instant startTime;
    private final JsonGenerator jsonGenerator;
    private boolean closed;  // thread-confined

    public ConnectionQLog(ConnectionCreatedEvent startEvent) throws IOException {
        this(startEvent, getOutputStream(startEvent));
    }

    public ConnectionQLog(QLogEvent event, OutputStream output) throws IOException {
        this.connectionId = event.getConnectionId();
        this.startTime = event.getTime();

        boolean prettyPrinting = false;
        Map<String, ?> configuration = prettyPrinting ? Map.of(PRETTY_PRINTING, "whatever") : emptyMap();
        jsonGenerator = Json.createGeneratorFactory(configuration).createGenerator(output);

        writeHeader();
    }

    @Override
    public void process(ConnectionCreatedEvent event) {
        // Not used
    }

    @Override
    public void process(ConnectionTerminatedEvent event) {
        close();
    }

    @Override
    public void process(CongestionControlMetricsEvent event) {
        jsonGenerator.writeStartObject()
                .write("time", relativeTime(event))
                .write("name", "recovery:metrics_updated")
                .writeStartObject("data")
                .write("bytes_in_flight", event.getBytesInFlight())
                .write("congestion_window", event.getCongestionWindow())
                .write("pacing_rate", event.getPacingRate())
                .writeEnd()  // data
                .writeEnd(); // event
    }

    @Override
    public void process(RttMetricsEvent event) {
        jsonGenerator.writeStartObject()
                .write("time", relativeTime(event))
                .write("name", "recovery:metrics_updated")
                .writeStartObject("data");
        if (event.getMinRtt() != null) {
            jsonGenerator.write("min_rtt", toMillis(event.getMinRtt()));
        }
        if (event.getSmoothedRtt() != null) {
            jsonGenerator.write("smoothed_rtt", toMillis(event.getSmoothedRtt()));
        }
        if (event.getLatestRtt() != null) {
            jsonGenerator.write("latest_rtt", toMillis(event.getLatestRtt()));
        }
        jsonGenerator
                .writeEnd()  // data
                .writeEnd(); // event
    }

    @Override
    public void process(CongestionStateUpdatedEvent event) {
        jsonGenerator.writeStartObject()
                .write("time", relativeTime(event))
                .write("name", "recovery:congestion_state_updated")
                .writeStartObject("data")
                .write("old", event.getOldState())
                .write("new", event.getNewState())
                .writeEnd()  // data
                .writeEnd(); // event
    }

    @Override
    public void process(CongestionEstimateEvent event) {
        jsonGenerator.writeStartObject()
                .write("time", relativeTime(event))
                .write("name", "recovery:congestion_estimate_updated")
                .writeStartObject("data")
                .write("bytes_marked", event.getBytesMarked())
                .write("bytes_acked", event.getBytesAcked())
                .write("alpha", event.getAlpha())
                .writeEnd()  // data
                .writeEnd(); // event
    }

    public void close() {
        if (! closed) {
            closed = true;
            writeFooter();
        }
    }

    private static OutputStream getOutputStream(ConnectionCreatedEvent event) throws FileNotFoundException {
        // Buffering not needed on top of output stream, JsonGenerator has its own buffering.
        File qlogDir = event.getOutputDirectory() != null? event.getOutputDirectory(): new File(System.getenv("QLOGDIR"));
        return new FileOutputStream(new File(qlogDir, event.getConnectionId() + ".qlog"));
    }

    private long relativeTime(QLogEvent event) {
        return Duration.between(startTime, event.getTime()).toMillis();
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    private void writeHeader() {
        jsonGenerator.writeStartObject()
                .write("qlog_version", "draft-02")
                .write("qlog_format", "JSON")
                .writeStartArray("traces")
                .writeStartObject()  // start trace
                .writeStartObject("common_fields")
                .write("group_id", connectionId)
                .write("time_format", "relative")
                .write("reference_time", startTime.toEpochMilli())
                .writeEnd()
                .writeStartObject("vantage_point")
                .write("name", "kwik-bbr")
                .write("type", "unknown")
                .writeEnd()
                .writeStartArray("events");
    }

    private void writeFooter() {
        jsonGenerator.writeEnd()  // events
                .writeEnd()       // trace
                .writeEnd()       // traces
                .writeEnd();
        jsonGenerator.close();
    }
}
