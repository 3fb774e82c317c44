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

import org.junit.Test;

import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

public class WalReceiverConfigTest {
  @Test
  public void usesTheDefaultsForMissingProperties() throws Exception {
    WalReceiverConfig config = WalReceiverConfig.fromProperties(new Properties());

    assertThat(config.getWalConnectTimeoutMillis(), is(equalTo(10_000L)));
    assertThat(config.getLaggingWalTimeoutMillis(), is(equalTo(10_000L)));
    assertThat(config.getMaxLsnWalLag(), is(equalTo(256L * 1024 * 1024)));
    assertThat(config.getAuthToken(), is(nullValue()));
    assertThat(config.getAvailabilityZone(), is(nullValue()));
  }

  @Test
  public void readsEveryProperty() throws Exception {
    Properties properties = new Properties();
    properties.setProperty("wal_connect_timeout_ms", "1000");
    properties.setProperty("lagging_wal_timeout_ms", " 5000 ");
    properties.setProperty("max_lsn_wal_lag", "1048576");
    properties.setProperty("auth_token", "secret");
    properties.setProperty("availability_zone", "zone-a");

    WalReceiverConfig expected = WalReceiverConfig.builder()
        .setWalConnectTimeout(1, TimeUnit.SECONDS)
        .setLaggingWalTimeout(5, TimeUnit.SECONDS)
        .setMaxLsnWalLag(1024 * 1024)
        .setAuthToken("secret")
        .setAvailabilityZone("zone-a")
        .build();

    assertThat(WalReceiverConfig.fromProperties(properties), is(equalTo(expected)));
  }

  @Test
  public void keepsTheAuthTokenOutOfItsStringForm() throws Exception {
    WalReceiverConfig config = WalReceiverConfig.builder().setAuthToken("secret").build();

    assertThat(config.toString(), not(containsString("secret")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void refusesANonPositiveMaxLag() throws Exception {
    WalReceiverConfig.builder().setMaxLsnWalLag(0).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void refusesANegativeTimeout() throws Exception {
    WalReceiverConfig.builder().setLaggingWalTimeout(-1, TimeUnit.SECONDS).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void refusesAMalformedProperty() throws Exception {
    Properties properties = new Properties();
    properties.setProperty("max_lsn_wal_lag", "a lot");

    WalReceiverConfig.fromProperties(properties);
  }
}
