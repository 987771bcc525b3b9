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

/**
 * Callback into the connection for sending an empty (pure) acknowledgement.
 */
@FunctionalInterface
public interface AckSender {

    /**
     * Sends an empty ack acknowledging all data up to (but not including) the given receive sequence.
     * @param receiveNext  the sequence number to acknowledge
     * @param echoCongestion  whether the ECE flag must be set
     */
    void sendEmptyAck(long receiveNext, boolean echoCongestion);
}
