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

package pageserver.context;

import pageserver.task.TaskKind;

/**
 * Cross-cutting information carried along with a unit of work: which kind of task it runs in,
 * and how on-demand downloads should be treated. Contexts are immutable; children are derived
 * for sub-tasks.
 */
public final class RequestContext {
  private final TaskKind taskKind;
  private final DownloadBehavior downloadBehavior;

  private RequestContext(TaskKind taskKind, DownloadBehavior downloadBehavior) {
    this.taskKind = taskKind;
    this.downloadBehavior = downloadBehavior;
  }

  public static RequestContext root(TaskKind taskKind, DownloadBehavior downloadBehavior) {
    return new RequestContext(taskKind, downloadBehavior);
  }

  /**
   * A context for a background task which outlives the request that started it.
   */
  public RequestContext detachedChild(TaskKind taskKind, DownloadBehavior downloadBehavior) {
    return new RequestContext(taskKind, downloadBehavior);
  }

  public TaskKind taskKind() {
    return taskKind;
  }

  public DownloadBehavior downloadBehavior() {
    return downloadBehavior;
  }

  @Override
  public String toString() {
    return "RequestContext{" +
        "taskKind=" + taskKind +
        ", downloadBehavior=" + downloadBehavior +
        '}';
  }
}
