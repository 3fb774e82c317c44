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

package pageserver.interfaces;

import pageserver.id.TenantTimelineId;
import pageserver.lsn.Lsn;

/**
 * A timeline of a tenant loaded in this pageserver: a replicated, append only WAL whose records
 * are ingested into local storage. Only what WAL reception needs is exposed here.
 */
public interface Timeline {
  TenantTimelineId getTenantTimelineId();

  /**
   * Position just after the last WAL record ingested into the timeline.
   */
  Lsn getLastRecordLsn();
}
