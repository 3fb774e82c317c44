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

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.Nullable;
import pageserver.id.NodeId;

/**
 * Snapshot of the connection manager of one timeline, as exposed by
 * {@link WalReceiver#status()}.
 */
public final class ConnectionManagerStatus {
  @Nullable
  public final WalConnectionStatus existingConnection;
  public final ImmutableMap<NodeId, BrokerSkTimeline> candidates;

  public ConnectionManagerStatus(@Nullable WalConnectionStatus existingConnection,
                                 ImmutableMap<NodeId, BrokerSkTimeline> candidates) {
    this.existingConnection = existingConnection;
    this.candidates = candidates;
  }

  @Override
  public String toString() {
    return "ConnectionManagerStatus{" +
        "existingConnection=" + existingConnection +
        ", candidates=" + candidates.keySet() +
        '}';
  }
}
