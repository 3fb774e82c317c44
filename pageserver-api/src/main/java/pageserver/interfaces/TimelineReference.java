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

import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;

/**
 * A reference to a {@link Timeline} that does not keep it alive. Owners of per-timeline
 * helpers hand them one of these, so that a helper never prolongs the life of a timeline which
 * is being deleted or detached.
 */
@FunctionalInterface
public interface TimelineReference {
  /**
   * Resolve the reference.
   *
   * @return the timeline, or null if it is gone. A non-null result only means the timeline
   * was alive when this method ran.
   */
  @Nullable
  Timeline upgrade();

  static TimelineReference weakly(Timeline timeline) {
    final WeakReference<Timeline> reference = new WeakReference<>(timeline);
    return reference::get;
  }
}
