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

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Stream of safekeeper updates for one timeline.
 */
public interface BrokerSubscription extends AutoCloseable {
  /**
   * Returns a future of the next update. If the stream fails, the future fails with a
   * {@link BrokerException}; a {@link BrokerClosedException} means the stream has ended.
   * <p>
   * Callers must not request a new update before the previous future has completed.
   */
  ListenableFuture<SafekeeperTimelineInfo> nextUpdate();

  @Override
  void close();
}
