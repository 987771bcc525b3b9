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

/**
 * Logger for the congestion controller. Messages are grouped in categories that can be switched on and off
 * independently; errors are always logged.
 */
public interface Logger {

    void logDebug(boolean enabled);

    void logInfo(boolean enabled);

    void logWarning(boolean enabled);

    void logRecovery(boolean enabled);

    void logCongestionControl(boolean enabled);

    /**
     * Prefix recovery and congestion control messages with the time (in seconds) since the first such message, instead
     * of the wall clock time.
     */
    void useRelativeTime(boolean enabled);

    void debug(String message);

    void info(String message);

    void warn(String message);

    void error(String message);

    void error(String message, Throwable error);

    /**
     * Loss and recovery events (cwnd reductions, packet conservation).
     */
    void recovery(String message);

    /**
     * Model and mode changes of the congestion controller.
     */
    void cc(String message);

    QLog getQLog();
}
