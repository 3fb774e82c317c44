/*
 * Copyright (C) 2014  Ohm Data
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU Affero General Public License as
 *  published by the Free Software Foundation, either version 3 of the
 *  License, or (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU Affero General Public License for more details.
 *
 *  You should have received a copy of the GNU Affero General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package pageserver.walreceiver;

/**
 * Why the connection manager decided to connect to a different safekeeper.
 */
public enum ReconnectReason {
  NO_EXISTING_CONNECTION,
  /**
   * The current connection did not get established in time.
   */
  CONNECTION_TIMEOUT,
  /**
   * Another safekeeper is ahead of the current one by more than the allowed lag.
   */
  LAGGING_WAL,
  /**
   * The current connection has not reported anything for too long.
   */
  NO_KEEP_ALIVES,
  /**
   * The current connection has not delivered WAL for too long while another safekeeper has
   * WAL we lack.
   */
  NO_WAL_TIMEOUT,
  SWITCH_AVAILABILITY_ZONE,
}
