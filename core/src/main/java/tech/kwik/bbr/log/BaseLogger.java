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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;


public abstract class BaseLogger implements Logger {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS", Locale.ROOT);

    private volatile boolean logDebug;
    private volatile boolean logInfo;
    private volatile boolean logWarning;
    private volatile boolean logRecovery;
    private volatile boolean logCongestionControl;
    private volatile boolean useRelativeTime;
    private final Clock clock;
    private final QLog qlog = new NullQLog();
    private Instant start;

    public BaseLogger() {
        this(Clock.systemUTC());
    }

    public BaseLogger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void logDebug(boolean enabled) {
        logDebug = enabled;
    }

    @Override
    public void logInfo(boolean enabled) {
        logInfo = enabled;
    }

    @Override
    public void logWarning(boolean enabled) {
        logWarning = enabled;
    }

    @Override
    public void logRecovery(boolean enabled) {
        logRecovery = enabled;
    }

    @Override
    public void logCongestionControl(boolean enabled) {
        logCongestionControl = enabled;
    }

    @Override
    public void useRelativeTime(boolean enabled) {
        useRelativeTime = enabled;
    }

    @Override
    public void debug(String message) {
        logIf(logDebug, message);
    }

    @Override
    public void info(String message) {
        logIf(logInfo, message);
    }

    @Override
    public void warn(String message) {
        logIf(logWarning, message);
    }

    @Override
    public void error(String message) {
        log("Error: " + message);
    }

    @Override
    public void error(String message, Throwable error) {
        log("Error: " + message + ": " + error, error);
    }

    @Override
    public void recovery(String message) {
        logIf(logRecovery, timestamped(message));
    }

    @Override
    public void cc(String message) {
        logIf(logCongestionControl, timestamped(message));
    }

    @Override
    public QLog getQLog() {
        return qlog;
    }

    private void logIf(boolean enabled, String message) {
        if (enabled) {
            log(message);
        }
    }

    private String timestamped(String message) {
        return formatTime(clock.instant()) + " " + message;
    }

    protected String formatTime(Instant time) {
        if (useRelativeTime) {
            synchronized (this) {
                if (start == null) {
                    start = time;
                }
            }
            Duration relativeTime = Duration.between(start, time);
            // Nanos, to get correct rounding to millis
            return String.format(Locale.ROOT, "%.3f", relativeTime.toNanos() / 1_000_000_000.0);
        }
        else {
            return TIME_FORMATTER.format(time.atZone(clock.getZone()));
        }
    }

    abstract protected void log(String message);

    abstract protected void log(String message, Throwable ex);
}
