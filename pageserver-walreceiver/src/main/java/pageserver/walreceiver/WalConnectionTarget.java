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

import org.jetbrains.annotations.Nullable;
import pageserver.id.NodeId;

/**
 * Where and how a WAL streaming connection should connect.
 */
public final class WalConnectionTarget {
  public final NodeId safekeeperId;
  public final String connstr;
  @Nullable
  public final String authToken;
  /**
   * Availability zone of the safekeeper, as it advertised through the broker.
   */
  @Nullable
  public final String availabilityZone;
  public final long connectTimeoutMillis;

  public WalConnectionTarget(NodeId safekeeperId,
                             String connstr,
                             @Nullable String authToken,
                             @Nullable String availabilityZone,
                             long connectTimeoutMillis) {
    this.safekeeperId = safekeeperId;
    this.connstr = connstr;
    this.authToken = authToken;
    this.availabilityZone = availabilityZone;
    this.connectTimeoutMillis = connectTimeoutMillis;
  }

  @Override
  public String toString() {
    return "WalConnectionTarget{" +
        "safekeeperId=" + safekeeperId +
        ", connstr='" + connstr + '\'' +
        ", availabilityZone='" + availabilityZone + '\'' +
        ", connectTimeoutMillis=" + connectTimeoutMillis +
        '}';
  }
}
