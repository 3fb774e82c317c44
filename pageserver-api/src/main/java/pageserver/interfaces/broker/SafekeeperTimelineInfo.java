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

package pageserver.interfaces.broker;

import org.jetbrains.annotations.Nullable;
import pageserver.id.NodeId;
import pageserver.id.TenantTimelineId;
import pageserver.lsn.Lsn;

import java.util.Objects;

/**
 * What a safekeeper advertises through the broker about one timeline it holds.
 */
public final class SafekeeperTimelineInfo {
  public final NodeId safekeeperId;
  public final TenantTimelineId timeline;
  public final long term;
  public final long lastLogTerm;
  public final Lsn flushLsn;
  public final Lsn commitLsn;
  public final Lsn backupLsn;
  public final Lsn remoteConsistentLsn;
  public final Lsn peerHorizonLsn;
  public final Lsn localStartLsn;
  public final String safekeeperConnstr;
  @Nullable
  public final String availabilityZone;

  private SafekeeperTimelineInfo(Builder builder) {
    this.safekeeperId = Objects.requireNonNull(builder.safekeeperId, "safekeeperId");
    this.timeline = Objects.requireNonNull(builder.timeline, "timeline");
    this.term = builder.term;
    this.lastLogTerm = builder.lastLogTerm;
    this.flushLsn = builder.flushLsn;
    this.commitLsn = builder.commitLsn;
    this.backupLsn = builder.backupLsn;
    this.remoteConsistentLsn = builder.remoteConsistentLsn;
    this.peerHorizonLsn = builder.peerHorizonLsn;
    this.localStartLsn = builder.localStartLsn;
    this.safekeeperConnstr = Objects.requireNonNull(builder.safekeeperConnstr, "safekeeperConnstr");
    this.availabilityZone = builder.availabilityZone;
  }

  public static Builder builder(NodeId safekeeperId, TenantTimelineId timeline) {
    return new Builder(safekeeperId, timeline);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SafekeeperTimelineInfo that = (SafekeeperTimelineInfo) o;
    return term == that.term
        && lastLogTerm == that.lastLogTerm
        && safekeeperId.equals(that.safekeeperId)
        && timeline.equals(that.timeline)
        && flushLsn.equals(that.flushLsn)
        && commitLsn.equals(that.commitLsn)
        && backupLsn.equals(that.backupLsn)
        && remoteConsistentLsn.equals(that.remoteConsistentLsn)
        && peerHorizonLsn.equals(that.peerHorizonLsn)
        && localStartLsn.equals(that.localStartLsn)
        && safekeeperConnstr.equals(that.safekeeperConnstr)
        && Objects.equals(availabilityZone, that.availabilityZone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(safekeeperId, timeline, term, commitLsn, safekeeperConnstr);
  }

  @Override
  public String toString() {
    return "SafekeeperTimelineInfo{" +
        "safekeeperId=" + safekeeperId +
        ", timeline=" + timeline +
        ", term=" + term +
        ", lastLogTerm=" + lastLogTerm +
        ", flushLsn=" + flushLsn +
        ", commitLsn=" + commitLsn +
        ", backupLsn=" + backupLsn +
        ", remoteConsistentLsn=" + remoteConsistentLsn +
        ", peerHorizonLsn=" + peerHorizonLsn +
        ", localStartLsn=" + localStartLsn +
        ", safekeeperConnstr='" + safekeeperConnstr + '\'' +
        ", availabilityZone='" + availabilityZone + '\'' +
        '}';
  }

  public static final class Builder {
    private final NodeId safekeeperId;
    private final TenantTimelineId timeline;
    private long term;
    private long lastLogTerm;
    private Lsn flushLsn = Lsn.INVALID;
    private Lsn commitLsn = Lsn.INVALID;
    private Lsn backupLsn = Lsn.INVALID;
    private Lsn remoteConsistentLsn = Lsn.INVALID;
    private Lsn peerHorizonLsn = Lsn.INVALID;
    private Lsn localStartLsn = Lsn.INVALID;
    private String safekeeperConnstr = "";
    private String availabilityZone;

    private Builder(NodeId safekeeperId, TenantTimelineId timeline) {
      this.safekeeperId = safekeeperId;
      this.timeline = timeline;
    }

    public Builder setTerm(long term) {
      this.term = term;
      return this;
    }

    public Builder setLastLogTerm(long lastLogTerm) {
      this.lastLogTerm = lastLogTerm;
      return this;
    }

    public Builder setFlushLsn(Lsn flushLsn) {
      this.flushLsn = flushLsn;
      return this;
    }

    public Builder setCommitLsn(Lsn commitLsn) {
      this.commitLsn = commitLsn;
      return this;
    }

    public Builder setBackupLsn(Lsn backupLsn) {
      this.backupLsn = backupLsn;
      return this;
    }

    public Builder setRemoteConsistentLsn(Lsn remoteConsistentLsn) {
      this.remoteConsistentLsn = remoteConsistentLsn;
      return this;
    }

    public Builder setPeerHorizonLsn(Lsn peerHorizonLsn) {
      this.peerHorizonLsn = peerHorizonLsn;
      return this;
    }

    public Builder setLocalStartLsn(Lsn localStartLsn) {
      this.localStartLsn = localStartLsn;
      return this;
    }

    public Builder setSafekeeperConnstr(String safekeeperConnstr) {
      this.safekeeperConnstr = safekeeperConnstr;
      return this;
    }

    public Builder setAvailabilityZone(@Nullable String availabilityZone) {
      this.availabilityZone = availabilityZone;
      return this;
    }

    public SafekeeperTimelineInfo build() {
      return new SafekeeperTimelineInfo(this);
    }
  }
}
