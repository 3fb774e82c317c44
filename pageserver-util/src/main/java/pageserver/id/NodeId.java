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

/**
 * Numeric id of a node in the storage cluster, such as a safekeeper.
 */
public final class NodeId implements Comparable<NodeId> {
  public final long id;

  private NodeId(long id) {
    this.id = id;
  }

  public static NodeId of(long id) {
    return new NodeId(id);
  }

  @Override
  public int compareTo(NodeId other) {
    return Long.compare(id, other.id);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof NodeId && ((NodeId) o).id == id);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public String toString() {
    return Long.toString(id);
  }
}
