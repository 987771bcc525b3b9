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

import java.io.PrintStream;
import java.time.Clock;

/**
 * Logs to standard out, or to the print stream it is given.
 */
public class SysOutLogger extends BaseLogger {

    private final PrintStream out;

    public SysOutLogger() {
        this(Clock.systemUTC(), System.out);
    }

    public SysOutLogger(Clock clock, PrintStream out) {
        super(clock);
        this.out = out;
    }

    @Override
    protected void log(String message) {
        synchronized (this) {
            out.println(message);
        }
    }

    @Override
    protected void log(String message, Throwable error) {
        synchronized (this) {
            out.println(message);
            error.printStackTrace(out);
        }
    }
}
