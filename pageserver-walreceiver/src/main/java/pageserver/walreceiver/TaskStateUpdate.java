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

/**
 * A state a task reports through its {@link TaskHandle}: either that it has started, or some
 * task-specific progress.
 *
 * @param <E> type of the progress values; they are shared between threads, so should be
 *            immutable.
 */
public final class TaskStateUpdate<E> {
  @SuppressWarnings("rawtypes")
  private static final TaskStateUpdate STARTED = new TaskStateUpdate<>(null);

  @Nullable
  private final E progress;

  private TaskStateUpdate(@Nullable E progress) {
    this.progress = progress;
  }

  @SuppressWarnings("unchecked")
  public static <E> TaskStateUpdate<E> started() {
    return (TaskStateUpdate<E>) STARTED;
  }

  public static <E> TaskStateUpdate<E> progress(E progress) {
    if (progress == null) {
      throw new NullPointerException("progress");
    }
    return new TaskStateUpdate<>(progress);
  }

  public boolean isStarted() {
    return progress == null;
  }

  /**
   * @return the progress value, or null for the started update.
   */
  @Nullable
  public E getProgress() {
    return progress;
  }

  @Override
  public String toString() {
    return isStarted() ? "Started" : "Progress(" + progress + ")";
  }
}
