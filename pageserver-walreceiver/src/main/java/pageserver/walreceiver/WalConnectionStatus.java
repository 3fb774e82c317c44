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
import pageserver.lsn.Lsn;

/**
 * Progress report of one WAL streaming connection, published by the connection task through
 * its {@link TaskHandle}. Times are in milliseconds of the {@link WalReceiverClock}.
 */
public final class WalConnectionStatus {
  /**
   * Whether the connection to the safekeeper has been established.
   */
  public final boolean isConnected;
  /**
   * Whether any WAL has been received and ingested over this connection.
   */
  public final boolean hasProcessedWal;
  /**
   * When the connection last reported anything, keepalives included.
   */
  public final long latestConnectionUpdate;
  /**
   * When the connection last received WAL.
   */
  public final long latestWalUpdate;
  @Nullable
  public final Lsn streamingLsn;
  @Nullable
  public final Lsn commitLsn;
  public final NodeId node;

  private WalConnectionStatus(Builder builder) {
    this.isConnected = builder.isConnected;
    this.hasProcessedWal = builder.hasProcessedWal;
    this.latestConnectionUpdate = builder.latestConnectionUpdate;
    this.latestWalUpdate = builder.latestWalUpdate;
    this.streamingLsn = builder.streamingLsn;
    this.commitLsn = builder.commitLsn;
    this.node = builder.node;
  }

  /**
   * The status of a connection which has only just been asked to start.
   */
  public static WalConnectionStatus initial(NodeId node, long now) {
    return builder(node)
        .setLatestConnectionUpdate(now)
        .setLatestWalUpdate(now)
        .build();
  }

  public static Builder builder(NodeId node) {
    return new Builder(node);
  }

  public Builder toBuilder() {
    return new Builder(node)
        .setConnected(isConnected)
        .setProcessedWal(hasProcessedWal)
        .setLatestConnectionUpdate(latestConnectionUpdate)
        .setLatestWalUpdate(latestWalUpdate)
        .setStreamingLsn(streamingLsn)
        .setCommitLsn(commitLsn);
  }

  @Override
  public String toString() {
    return "WalConnectionStatus{" +
        "node=" + node +
        ", isConnected=" + isConnected +
        ", hasProcessedWal=" + hasProcessedWal +
        ", latestConnectionUpdate=" + latestConnectionUpdate +
        ", latestWalUpdate=" + latestWalUpdate +
        ", streamingLsn=" + streamingLsn +
        ", commitLsn=" + commitLsn +
        '}';
  }

  public static final class Builder {
    private final NodeId node;
    private boolean isConnected;
    private boolean hasProcessedWal;
    private long latestConnectionUpdate;
    private long latestWalUpdate;
    private Lsn streamingLsn;
    private Lsn commitLsn;

    private Builder(NodeId node) {
      if (node == null) {
        throw new NullPointerException("node");
      }
      this.node = node;
    }

    public Builder setConnected(boolean isConnected) {
      this.isConnected = isConnected;
      return this;
    }

    public Builder setProcessedWal(boolean hasProcessedWal) {
      this.hasProcessedWal = hasProcessedWal;
      return this;
    }

    public Builder setLatestConnectionUpdate(long latestConnectionUpdate) {
      this.latestConnectionUpdate = latestConnectionUpdate;
      return this;
    }

    public Builder setLatestWalUpdate(long latestWalUpdate) {
      this.latestWalUpdate = latestWalUpdate;
      return this;
    }

    public Builder setStreamingLsn(@Nullable Lsn streamingLsn) {
      this.streamingLsn = streamingLsn;
      return this;
    }

    public Builder setCommitLsn(@Nullable Lsn commitLsn) {
      this.commitLsn = commitLsn;
      return this;
    }

    public WalConnectionStatus build() {
      return new WalConnectionStatus(this);
    }
  }
}
