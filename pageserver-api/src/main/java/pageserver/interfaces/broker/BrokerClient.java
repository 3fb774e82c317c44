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

import pageserver.id.TenantTimelineId;

/**
 * Client of the storage broker, the pub/sub service through which safekeepers periodically
 * advertise their state for every timeline they hold.
 */
public interface BrokerClient {
  /**
   * Subscribe to safekeeper updates for one timeline.
   *
   * @throws BrokerException if the subscription could not be established
   */
  BrokerSubscription subscribe(TenantTimelineId timeline) throws BrokerException;
}
