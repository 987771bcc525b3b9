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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.kwik.bbr.test.TestClock;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BaseLoggerTest {

    private TestClock clock;
    private List<String> messages;
    private BaseLogger logger;

    @BeforeEach
    void initObjectUnderTest() {
        clock = new TestClock();
        messages = new ArrayList<>();
        logger = new BaseLogger(clock) {
            @Override
            protected void log(String message) {
                messages.add(message);
            }

            @Override
            protected void log(String message, Throwable ex) {
                messages.add(message);
            }
        };
    }

    @Test
    void disabledCategoriesAreNotLogged() {
        logger.cc("cwnd: 14600");
        logger.debug("pacing rate: 1000000");

        assertThat(messages).isEmpty();
    }

    @Test
    void errorsAreAlwaysLogged() {
        logger.error("bytes in flight below 0");

        assertThat(messages).containsExactly("Error: bytes in flight below 0");
    }

    @Test
    void congestionControlMessagesArePrefixedWithRelativeTime() {
        logger.logCongestionControl(true);
        logger.useRelativeTime(true);

        logger.cc("BBR mode Startup -> Drain");
        clock.fastForward(1250);
        logger.cc("BBR mode Drain -> ProbeBW");

        assertThat(messages).containsExactly("0.000 BBR mode Startup -> Drain", "1.250 BBR mode Drain -> ProbeBW");
    }

    @Test
    void recoveryMessagesArePrefixedWithClockTime() {
        logger.logRecovery(true);
        clock.fastForward(61_250);

        logger.recovery("Entering recovery");

        assertThat(messages).containsExactly("00:01:01.250 Entering recovery");
    }

    @Test
    void defaultQLogIsNullImplementation() {
        assertThat(logger.getQLog()).isInstanceOf(NullQLog.class);
    }
}
