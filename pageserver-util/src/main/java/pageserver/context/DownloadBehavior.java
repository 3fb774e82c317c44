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

package pageserver.context;

/**
 * What to do when a request needs a layer that is not present locally and would have to be
 * downloaded from remote storage.
 */
public enum DownloadBehavior {
  /**
   * Download the layer.
   */
  DOWNLOAD,

  /**
   * Download the layer, but log a warning, since this is unexpected for the caller.
   */
  WARN,

  /**
   * Fail the request rather than downloading.
   */
  ERROR,
}
