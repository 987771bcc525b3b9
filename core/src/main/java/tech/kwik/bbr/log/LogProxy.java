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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Logger that delegates to another logger and adds a qlog front end, when the qlog module is available.
 */
public class LogProxy implements Logger {

    static final String QLOG_FRONT_END_CLASS = "tech.kwik.bbr.qlog.QLogFrontEnd";

    private final QLog qlogFrontEnd;
    private final Logger proxiedLogger;

    public LogProxy(Logger log, String connectionId) {
        this.proxiedLogger = log;
        qlogFrontEnd = loadImplementation(connectionId);
    }

    private QLog loadImplementation(String connectionId) {
        try {
            Class<?> clazz = this.getClass().getClassLoader().loadClass(QLOG_FRONT_END_CLASS);
            Constructor<?> constructor = clazz.getConstructor(String.class);
            return (QLog) constructor.newInstance(connectionId);
        }
        catch (ClassNotFoundException e) {
            return new NullQLog();
        }
        catch (NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            proxiedLogger.error("Cannot load qlog implementation", e);
            return new NullQLog();
        }
    }

    @Override
    public void logDebug(boolean enabled) {
        proxiedLogger.logDebug(enabled);
    }

    @Override
    public void logInfo(boolean enabled) {
        proxiedLogger.logInfo(enabled);
    }

    @Override
    public void logWarning(boolean enabled) {
        proxiedLogger.logWarning(enabled);
    }

    @Override
    public void logRecovery(boolean enabled) {
        proxiedLogger.logRecovery(enabled);
    }

    @Override
    public void logCongestionControl(boolean enabled) {
        proxiedLogger.logCongestionControl(enabled);
    }

    @Override
    public void useRelativeTime(boolean enabled) {
        proxiedLogger.useRelativeTime(enabled);
    }

    @Override
    public void debug(String message) {
        proxiedLogger.debug(message);
    }

    @Override
    public void info(String message) {
        proxiedLogger.info(message);
    }

    @Override
    public void warn(String message) {
        proxiedLogger.warn(message);
    }

    @Override
    public void error(String message) {
        proxiedLogger.error(message);
    }

    @Override
    public void error(String message, Throwable error) {
        proxiedLogger.error(message, error);
    }

    @Override
    public void recovery(String message) {
        proxiedLogger.recovery(message);
    }

    @Override
    public void cc(String message) {
        proxiedLogger.cc(message);
    }

    @Override
    public QLog getQLog() {
        return qlogFrontEnd;
    }
}
