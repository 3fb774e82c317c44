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

/**
 * Handed to the body of a task spawned with {@link TaskHandle#spawn}, to report progress to
 * whoever watches the handle. Only the latest progress value is kept.
 */
@FunctionalInterface
public interface TaskStateSender<E> {
  /**
   * @return false if nobody can observe the update any more.
   */
  boolean sendProgress(E progress);
}
