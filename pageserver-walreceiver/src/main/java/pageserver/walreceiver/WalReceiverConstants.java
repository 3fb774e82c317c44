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

public class WalReceiverConstants {
  public static final long DEFAULT_WAL_CONNECT_TIMEOUT_MILLISECONDS = 10_000;
  public static final long DEFAULT_LAGGING_WAL_TIMEOUT_MILLISECONDS = 10_000;
  public static final long DEFAULT_MAX_LSN_WAL_LAG = 256L * 1024 * 1024;

  public static final long WAL_CONNECTION_RETRY_MIN_BACKOFF_MILLISECONDS = 100;
  public static final long WAL_CONNECTION_RETRY_MAX_BACKOFF_MILLISECONDS = 15_000;
  public static final double WAL_CONNECTION_RETRY_BACKOFF_MULTIPLIER = 1.5;

  public static final long BROKER_SUBSCRIBE_RETRY_MIN_BACKOFF_MILLISECONDS = 100;
  public static final long BROKER_SUBSCRIBE_RETRY_MAX_BACKOFF_MILLISECONDS = 5_000;

  public static final int DEFAULT_CONNECTION_CHECK_INTERVAL_MILLISECONDS = 100;

  public static final String WAL_CONNECT_TIMEOUT_PROPERTY = "wal_connect_timeout_ms";
  public static final String LAGGING_WAL_TIMEOUT_PROPERTY = "lagging_wal_timeout_ms";
  public static final String MAX_LSN_WAL_LAG_PROPERTY = "max_lsn_wal_lag";
  public static final String AUTH_TOKEN_PROPERTY = "auth_token";
  public static final String AVAILABILITY_ZONE_PROPERTY = "availability_zone";
}
