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
package tech.kwik.bbr.socket;

public enum EcnState {
    /** ECN is enabled, but no congestion signal was received or sent. */
    Disabled,
    Idle,
    /** Last packet received had the CE codepoint set. */
    CeReceived,
    /** Receiver is sending ECE flags until sender responds with CWR. */
    SendingEce,
    /** Last ack received had the ECE flag set. */
    EceReceived,
    /** Sender has reduced the congestion window and set CWR. */
    CwrSent
}
