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

import pageserver.interfaces.broker.SafekeeperTimelineInfo;

/**
 * A connection candidate: the latest state a safekeeper advertised through the broker, and
 * when it arrived.
 */
public final class BrokerSkTimeline {
  public final SafekeeperTimelineInfo timeline;
  public final long latestUpdate;

  public BrokerSkTimeline(SafekeeperTimelineInfo timeline, long latestUpdate) {
    this.timeline = timeline;
    this.latestUpdate = latestUpdate;
  }

  @Override
  public String toString() {
    return "BrokerSkTimeline{" +
        "timeline=" + timeline +
        ", latestUpdate=" + latestUpdate +
        '}';
  }
}
