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

package pageserver.lsn;

import com.google.common.primitives.UnsignedLongs;

/**
 * A log sequence number: an unsigned 64 bit byte offset into the WAL. It is printed the usual
 * way, as the high and low 32 bits in hex separated by a slash, e.g. "16/B374D848".
 */
public final class Lsn implements Comparable<Lsn> {
  public static final Lsn INVALID = new Lsn(0);

  private final long value;

  private Lsn(long value) {
    this.value = value;
  }

  public static Lsn of(long value) {
    return value == 0 ? INVALID : new Lsn(value);
  }

  public long value() {
    return value;
  }

  public boolean isValid() {
    return value != 0;
  }

  /**
   * Distance in bytes from {@code other} up to this Lsn, or 0 when other is not behind.
   */
  public long bytesAhead(Lsn other) {
    return compareTo(other) > 0 ? value - other.value : 0;
  }

  public boolean isAfter(Lsn other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(Lsn other) {
    return UnsignedLongs.compare(value, other.value);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Lsn && ((Lsn) o).value == value);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return String.format("%X/%X", value >>> 32, value & 0xFFFFFFFFL);
  }
}
