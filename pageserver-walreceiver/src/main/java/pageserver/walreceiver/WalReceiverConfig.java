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

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static pageserver.walreceiver.WalReceiverConstants.AUTH_TOKEN_PROPERTY;
import static pageserver.walreceiver.WalReceiverConstants.AVAILABILITY_ZONE_PROPERTY;
import static pageserver.walreceiver.WalReceiverConstants.DEFAULT_LAGGING_WAL_TIMEOUT_MILLISECONDS;
import static pageserver.walreceiver.WalReceiverConstants.DEFAULT_MAX_LSN_WAL_LAG;
import static pageserver.walreceiver.WalReceiverConstants.DEFAULT_WAL_CONNECT_TIMEOUT_MILLISECONDS;
import static pageserver.walreceiver.WalReceiverConstants.LAGGING_WAL_TIMEOUT_PROPERTY;
import static pageserver.walreceiver.WalReceiverConstants.MAX_LSN_WAL_LAG_PROPERTY;
import static pageserver.walreceiver.WalReceiverConstants.WAL_CONNECT_TIMEOUT_PROPERTY;

/**
 * Per-timeline WAL receiver policy. Instances are immutable.
 */
public final class WalReceiverConfig {
  /**
   * The timeout on the connection to a safekeeper for WAL streaming.
   */
  private final long walConnectTimeoutMillis;
  /**
   * How long the current connection may go without progress before it is considered stale and
   * a connection to another safekeeper is tried.
   */
  private final long laggingWalTimeoutMillis;
  /**
   * How far, in bytes, the current connection may fall behind the best safekeeper before a
   * connection to that one is tried instead.
   */
  private final long maxLsnWalLag;
  @Nullable
  private final String authToken;
  @Nullable
  private final String availabilityZone;

  private WalReceiverConfig(Builder builder) {
    this.walConnectTimeoutMillis = builder.walConnectTimeoutMillis;
    this.laggingWalTimeoutMillis = builder.laggingWalTimeoutMillis;
    this.maxLsnWalLag = builder.maxLsnWalLag;
    this.authToken = builder.authToken;
    this.availabilityZone = builder.availabilityZone;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Read a config from properties, using the defaults for missing keys.
   *
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static WalReceiverConfig fromProperties(Properties properties) {
    Builder builder = builder();
    String connectTimeout = properties.getProperty(WAL_CONNECT_TIMEOUT_PROPERTY);
    if (connectTimeout != null) {
      builder.setWalConnectTimeout(parseLong(WAL_CONNECT_TIMEOUT_PROPERTY, connectTimeout), TimeUnit.MILLISECONDS);
    }
    String laggingTimeout = properties.getProperty(LAGGING_WAL_TIMEOUT_PROPERTY);
    if (laggingTimeout != null) {
      builder.setLaggingWalTimeout(parseLong(LAGGING_WAL_TIMEOUT_PROPERTY, laggingTimeout), TimeUnit.MILLISECONDS);
    }
    String maxLag = properties.getProperty(MAX_LSN_WAL_LAG_PROPERTY);
    if (maxLag != null) {
      builder.setMaxLsnWalLag(parseLong(MAX_LSN_WAL_LAG_PROPERTY, maxLag));
    }
    builder.setAuthToken(properties.getProperty(AUTH_TOKEN_PROPERTY));
    builder.setAvailabilityZone(properties.getProperty(AVAILABILITY_ZONE_PROPERTY));
    return builder.build();
  }

  public long getWalConnectTimeoutMillis() {
    return walConnectTimeoutMillis;
  }

  public long getLaggingWalTimeoutMillis() {
    return laggingWalTimeoutMillis;
  }

  public long getMaxLsnWalLag() {
    return maxLsnWalLag;
  }

  @Nullable
  public String getAuthToken() {
    return authToken;
  }

  @Nullable
  public String getAvailabilityZone() {
    return availabilityZone;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    WalReceiverConfig that = (WalReceiverConfig) o;
    return walConnectTimeoutMillis == that.walConnectTimeoutMillis
        && laggingWalTimeoutMillis == that.laggingWalTimeoutMillis
        && maxLsnWalLag == that.maxLsnWalLag
        && Objects.equals(authToken, that.authToken)
        && Objects.equals(availabilityZone, that.availabilityZone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(walConnectTimeoutMillis, laggingWalTimeoutMillis, maxLsnWalLag, authToken, availabilityZone);
  }

  @Override
  public String toString() {
    // The auth token stays out of logs.
    return "WalReceiverConfig{" +
        "walConnectTimeoutMillis=" + walConnectTimeoutMillis +
        ", laggingWalTimeoutMillis=" + laggingWalTimeoutMillis +
        ", maxLsnWalLag=" + maxLsnWalLag +
        ", authToken=" + (authToken == null ? "none" : "***") +
        ", availabilityZone='" + availabilityZone + '\'' +
        '}';
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Malformed value for " + key + ": '" + value + "'", e);
    }
  }

  public static final class Builder {
    private long walConnectTimeoutMillis = DEFAULT_WAL_CONNECT_TIMEOUT_MILLISECONDS;
    private long laggingWalTimeoutMillis = DEFAULT_LAGGING_WAL_TIMEOUT_MILLISECONDS;
    private long maxLsnWalLag = DEFAULT_MAX_LSN_WAL_LAG;
    private String authToken;
    private String availabilityZone;

    private Builder() {
    }

    public Builder setWalConnectTimeout(long duration, TimeUnit unit) {
      this.walConnectTimeoutMillis = unit.toMillis(duration);
      return this;
    }

    public Builder setLaggingWalTimeout(long duration, TimeUnit unit) {
      this.laggingWalTimeoutMillis = unit.toMillis(duration);
      return this;
    }

    public Builder setMaxLsnWalLag(long maxLsnWalLag) {
      this.maxLsnWalLag = maxLsnWalLag;
      return this;
    }

    public Builder setAuthToken(@Nullable String authToken) {
      this.authToken = authToken;
      return this;
    }

    public Builder setAvailabilityZone(@Nullable String availabilityZone) {
      this.availabilityZone = availabilityZone;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a timeout is negative or the lag is not positive
     */
    public WalReceiverConfig build() {
      if (walConnectTimeoutMillis < 0) {
        throw new IllegalArgumentException("walConnectTimeout must not be negative");
      }
      if (laggingWalTimeoutMillis < 0) {
        throw new IllegalArgumentException("laggingWalTimeout must not be negative");
      }
      if (maxLsnWalLag <= 0) {
        throw new IllegalArgumentException("maxLsnWalLag must be positive, got " + maxLsnWalLag);
      }
      return new WalReceiverConfig(this);
    }
  }
}
