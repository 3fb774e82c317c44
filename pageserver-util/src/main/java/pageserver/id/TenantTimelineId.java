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

package pageserver.id;

import java.util.Objects;

/**
 * Fully qualified timeline identity: timelines ids are only unique within their tenant.
 */
public final class TenantTimelineId {
  public final TenantId tenantId;
  public final TimelineId timelineId;

  public TenantTimelineId(TenantId tenantId, TimelineId timelineId) {
    this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
    this.timelineId = Objects.requireNonNull(timelineId, "timelineId");
  }

  public static TenantTimelineId generate() {
    return new TenantTimelineId(TenantId.generate(), TimelineId.generate());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TenantTimelineId that = (TenantTimelineId) o;
    return tenantId.equals(that.tenantId) && timelineId.equals(that.timelineId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tenantId, timelineId);
  }

  @Override
  public String toString() {
    return tenantId + "/" + timelineId;
  }
}
