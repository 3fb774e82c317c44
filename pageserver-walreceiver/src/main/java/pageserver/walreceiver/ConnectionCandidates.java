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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.Nullable;
import pageserver.id.NodeId;
import pageserver.interfaces.broker.SafekeeperTimelineInfo;
import pageserver.lsn.Lsn;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import static pageserver.walreceiver.WalReceiverConstants.WAL_CONNECTION_RETRY_BACKOFF_MULTIPLIER;
import static pageserver.walreceiver.WalReceiverConstants.WAL_CONNECTION_RETRY_MAX_BACKOFF_MILLISECONDS;
import static pageserver.walreceiver.WalReceiverConstants.WAL_CONNECTION_RETRY_MIN_BACKOFF_MILLISECONDS;

/**
 * The safekeepers a timeline could stream WAL from, as last advertised through the broker,
 * together with the retry back-off of each one, and the policy choosing which of them to be
 * connected to.
 * <p>
 * Not thread safe; owned by a single connection manager.
 */
class ConnectionCandidates {
  private final WalReceiverConfig config;
  private final Map<NodeId, BrokerSkTimeline> candidates = new HashMap<>();
  private final Map<NodeId, RetryInfo> retries = new HashMap<>();

  ConnectionCandidates(WalReceiverConfig config) {
    this.config = config;
  }

  /**
   * Record what a safekeeper advertised.
   *
   * @return true if the safekeeper was not a candidate before
   */
  boolean update(SafekeeperTimelineInfo info, long now) {
    return candidates.put(info.safekeeperId, new BrokerSkTimeline(info, now)) == null;
  }

  /**
   * Forget safekeepers which have not advertised anything for longer than the lagging WAL
   * timeout; they are probably gone.
   *
   * @return how many candidates were dropped
   */
  int dropStale(long now) {
    int dropped = 0;
    Iterator<BrokerSkTimeline> iterator = candidates.values().iterator();
    while (iterator.hasNext()) {
      if (now - iterator.next().latestUpdate > config.getLaggingWalTimeoutMillis()) {
        iterator.remove();
        dropped++;
      }
    }
    return dropped;
  }

  /**
   * A connection attempt to the node is being made: it will not be chosen again until its
   * back-off has passed, and the back-off grows with every attempt.
   *
   * @return the back-off applied, in milliseconds
   */
  long recordAttempt(NodeId node, long now) {
    RetryInfo previous = retries.get(node);
    long backoff = previous == null
        ? WAL_CONNECTION_RETRY_MIN_BACKOFF_MILLISECONDS
        : Math.min(WAL_CONNECTION_RETRY_MAX_BACKOFF_MILLISECONDS,
        (long) (previous.backoffMillis * WAL_CONNECTION_RETRY_BACKOFF_MULTIPLIER));
    retries.put(node, new RetryInfo(now + backoff, backoff));
    return backoff;
  }

  /**
   * The node delivered WAL, so it is healthy again.
   */
  void recordProgress(NodeId node) {
    retries.remove(node);
  }

  ImmutableMap<NodeId, BrokerSkTimeline> snapshot() {
    return ImmutableMap.copyOf(candidates);
  }

  /**
   * Decide whether to connect to another safekeeper.
   *
   * @param current          status of the current connection, or null if there is none
   * @param currentStartedAt when the current connection was started
   * @param lastRecordLsn    the last WAL position ingested into the timeline
   * @return the safekeeper to connect to and why, or null to keep things as they are
   */
  @Nullable
  NewWalConnectionCandidate nextCandidate(@Nullable WalConnectionStatus current,
                                          long currentStartedAt,
                                          Lsn lastRecordLsn,
                                          long now) {
    if (current == null) {
      BrokerSkTimeline best = selectBest(null, false, now);
      return best == null ? null : candidate(best, ReconnectReason.NO_EXISTING_CONNECTION);
    }

    BrokerSkTimeline best = selectBest(current.node, false, now);
    if (best == null) {
      return null;
    }
    SafekeeperTimelineInfo bestInfo = best.timeline;

    if (!current.isConnected) {
      if (now - currentStartedAt >= config.getWalConnectTimeoutMillis()) {
        return candidate(best, ReconnectReason.CONNECTION_TIMEOUT);
      }
      return null;
    }

    if (current.commitLsn != null
        && bestInfo.commitLsn.bytesAhead(current.commitLsn) > config.getMaxLsnWalLag()) {
      return candidate(best, ReconnectReason.LAGGING_WAL);
    }

    if (now - current.latestConnectionUpdate >= config.getLaggingWalTimeoutMillis()) {
      return candidate(best, ReconnectReason.NO_KEEP_ALIVES);
    }

    Lsn streamingLsn = current.streamingLsn != null ? current.streamingLsn : lastRecordLsn;
    if (bestInfo.commitLsn.isAfter(streamingLsn)
        && now - current.latestWalUpdate >= config.getLaggingWalTimeoutMillis()) {
      return candidate(best, ReconnectReason.NO_WAL_TIMEOUT);
    }

    if (config.getAvailabilityZone() != null) {
      BrokerSkTimeline currentEntry = candidates.get(current.node);
      if (currentEntry == null || !isInOurZone(currentEntry)) {
        BrokerSkTimeline bestInZone = selectBest(current.node, true, now);
        Lsn currentCommitLsn = current.commitLsn != null
            ? current.commitLsn
            : currentEntry != null ? currentEntry.timeline.commitLsn : Lsn.INVALID;
        if (bestInZone != null && bestInZone.timeline.commitLsn.compareTo(currentCommitLsn) >= 0) {
          return candidate(bestInZone, ReconnectReason.SWITCH_AVAILABILITY_ZONE);
        }
      }
    }
    return null;
  }

  /**
   * The candidate with the highest commit LSN, preferring our availability zone and then the
   * lowest node id at equal LSN. Nodes in retry back-off and nodes without a commit LSN are
   * not eligible.
   */
  @Nullable
  private BrokerSkTimeline selectBest(@Nullable NodeId exclude, boolean onlyOurZone, long now) {
    BrokerSkTimeline best = null;
    for (BrokerSkTimeline entry : candidates.values()) {
      SafekeeperTimelineInfo info = entry.timeline;
      if (info.safekeeperId.equals(exclude)
          || !info.commitLsn.isValid()
          || isBackingOff(info.safekeeperId, now)
          || (onlyOurZone && !isInOurZone(entry))) {
        continue;
      }
      if (best == null || isBetter(entry, best)) {
        best = entry;
      }
    }
    return best;
  }

  private boolean isBetter(BrokerSkTimeline a, BrokerSkTimeline b) {
    return ComparisonChain.start()
        .compare(b.timeline.commitLsn, a.timeline.commitLsn)
        .compareTrueFirst(isInOurZone(a), isInOurZone(b))
        .compare(a.timeline.safekeeperId, b.timeline.safekeeperId)
        .result() < 0;
  }

  private boolean isBackingOff(NodeId node, long now) {
    RetryInfo retry = retries.get(node);
    return retry != null && retry.nextRetryAt > now;
  }

  private boolean isInOurZone(BrokerSkTimeline entry) {
    String ourZone = config.getAvailabilityZone();
    return ourZone != null && ourZone.equals(entry.timeline.availabilityZone);
  }

  private static NewWalConnectionCandidate candidate(BrokerSkTimeline entry, ReconnectReason reason) {
    return new NewWalConnectionCandidate(entry.timeline.safekeeperId, entry.timeline, reason);
  }

  private static class RetryInfo {
    final long nextRetryAt;
    final long backoffMillis;

    RetryInfo(long nextRetryAt, long backoffMillis) {
      this.nextRetryAt = nextRetryAt;
      this.backoffMillis = backoffMillis;
    }
  }
}
