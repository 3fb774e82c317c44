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

import pageserver.context.RequestContext;
import pageserver.interfaces.Timeline;

/**
 * Creates the bodies of WAL streaming tasks. A body connects to the target safekeeper, streams
 * WAL into the timeline, and reports its {@link WalConnectionStatus} through the task's state
 * sender until it fails or its cancellation token is cancelled.
 */
@FunctionalInterface
public interface WalConnectionFactory {
  TaskBody<WalConnectionStatus> newConnection(Timeline timeline, WalConnectionTarget target, RequestContext ctx);
}
