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
 * Something observed about a task through {@link TaskHandle#nextTaskEvent()}: either a state
 * update, or the end of the task together with its result.
 */
public final class TaskEvent<E> {
  public enum EventType {
    UPDATE,
    END,
  }

  public final EventType eventType;
  @Nullable
  public final TaskStateUpdate<E> update;
  /**
   * For an END event, why the task failed; null if it succeeded.
   */
  @Nullable
  public final Throwable failure;

  private TaskEvent(EventType eventType, @Nullable TaskStateUpdate<E> update, @Nullable Throwable failure) {
    this.eventType = eventType;
    this.update = update;
    this.failure = failure;
  }

  public static <E> TaskEvent<E> update(TaskStateUpdate<E> update) {
    return new TaskEvent<>(EventType.UPDATE, update, null);
  }

  public static <E> TaskEvent<E> end(@Nullable Throwable failure) {
    return new TaskEvent<>(EventType.END, null, failure);
  }

  public boolean isEnd() {
    return eventType == EventType.END;
  }

  public boolean isSuccessfulEnd() {
    return eventType == EventType.END && failure == null;
  }

  @Override
  public String toString() {
    return "TaskEvent{" +
        "eventType=" + eventType +
        ", update=" + update +
        ", failure=" + failure +
        '}';
  }
}
