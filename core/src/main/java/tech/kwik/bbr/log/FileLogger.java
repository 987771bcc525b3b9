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
package tech.kwik.bbr.log;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Writes congestion control log lines to a file, one line per message. The file is truncated when the logger is created.
 */
public class FileLogger extends BaseLogger implements AutoCloseable {

    private final PrintWriter writer;

    public FileLogger(Path logFile) throws IOException {
        this(logFile, Clock.systemUTC());
    }

    public FileLogger(Path logFile, Clock clock) throws IOException {
        super(clock);
        BufferedWriter fileWriter = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8);
        writer = new PrintWriter(fileWriter);
    }

    @Override
    protected void log(String message) {
        synchronized (this) {
            writer.println(message);
            writer.flush();
        }
    }

    @Override
    protected void log(String message, Throwable ex) {
        synchronized (this) {
            writer.println(message);
            ex.printStackTrace(writer);
            writer.flush();
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            writer.close();
        }
    }
}
