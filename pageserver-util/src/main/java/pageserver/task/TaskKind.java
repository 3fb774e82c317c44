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

package pageserver.task;

/**
 * What a background task is for. Together with the tenant and timeline a task works on, the
 * kind is the tag by which tasks are selected for shutdown.
 */
public enum TaskKind {
  /**
   * Per-timeline loop choosing the safekeeper to stream WAL from.
   */
  WAL_RECEIVER_MANAGER,

  /**
   * A single WAL streaming connection to a safekeeper.
   */
  WAL_RECEIVER_CONNECTION_HANDLER,

  /**
   * Work done on behalf of a request rather than in the background.
   */
  REQUEST_HANDLER,
}
