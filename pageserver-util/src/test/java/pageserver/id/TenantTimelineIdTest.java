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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class TenantTimelineIdTest {
  @Test
  public void roundTripsThroughHex() throws Exception {
    TenantId tenantId = TenantId.generate();
    TimelineId timelineId = TimelineId.generate();

    assertThat(TenantId.fromHex(tenantId.toHex()), is(equalTo(tenantId)));
    assertThat(TimelineId.fromHex(timelineId.toHex().toUpperCase()), is(equalTo(timelineId)));
  }

  @Test
  public void printsAsTenantSlashTimeline() throws Exception {
    TenantTimelineId id = TenantTimelineId.generate();

    assertThat(id.toString(), is(equalTo(id.tenantId.toHex() + "/" + id.timelineId.toHex())));
  }

  @Test
  public void timelineIdsOfDifferentTenantsDiffer() throws Exception {
    TimelineId timelineId = TimelineId.generate();

    assertThat(new TenantTimelineId(TenantId.generate(), timelineId),
        is(not(equalTo(new TenantTimelineId(TenantId.generate(), timelineId)))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void refusesHexOfTheWrongLength() throws Exception {
    TenantId.fromHex("abcd");
  }
}
