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

public class DefaultSystemTimeWalReceiverClock implements WalReceiverClock {
  private final long checkInterval;

  public DefaultSystemTimeWalReceiverClock() {
    this(WalReceiverConstants.DEFAULT_CONNECTION_CHECK_INTERVAL_MILLISECONDS);
  }

  public DefaultSystemTimeWalReceiverClock(long checkIntervalMillis) {
    this.checkInterval = checkIntervalMillis;
  }

  @Override
  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long checkIntervalMillis() {
    return checkInterval;
  }
}
