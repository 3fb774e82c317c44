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

import com.google.common.io.BaseEncoding;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Identifier of a timeline within a tenant: 16 random bytes, written as 32 lowercase hex characters.
 */
public final class TimelineId implements Comparable<TimelineId> {
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final int LENGTH_BYTES = 16;

  private final byte[] bytes;

  private TimelineId(byte[] bytes) {
    this.bytes = bytes;
  }

  public static TimelineId generate() {
    byte[] bytes = new byte[LENGTH_BYTES];
    RANDOM.nextBytes(bytes);
    return new TimelineId(bytes);
  }

  public static TimelineId fromHex(String hex) {
    byte[] bytes = BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    if (bytes.length != LENGTH_BYTES) {
      throw new IllegalArgumentException("TimelineId must be " + LENGTH_BYTES + " bytes, got '" + hex + "'");
    }
    return new TimelineId(bytes);
  }

  public String toHex() {
    return BaseEncoding.base16().lowerCase().encode(bytes);
  }

  @Override
  public int compareTo(TimelineId other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(bytes, ((TimelineId) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
