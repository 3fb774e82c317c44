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

import com.google.common.util.concurrent.ListeningExecutorService;
import pageserver.task.TaskManager;
import pageserver.util.FiberSupplier;

/**
 * Process wide services shared by the WAL receivers of all timelines: the task registry, the
 * fibers the connection managers run on, the worker pool of the WAL streaming tasks, and the
 * factory of the streaming task bodies.
 */
public final class WalReceiverRuntime {
  public final TaskManager taskManager;
  public final FiberSupplier fiberSupplier;
  public final ListeningExecutorService connectionExecutor;
  public final WalConnectionFactory connectionFactory;
  public final WalReceiverClock clock;

  public WalReceiverRuntime(TaskManager taskManager,
                            FiberSupplier fiberSupplier,
                            ListeningExecutorService connectionExecutor,
                            WalConnectionFactory connectionFactory,
                            WalReceiverClock clock) {
    this.taskManager = taskManager;
    this.fiberSupplier = fiberSupplier;
    this.connectionExecutor = connectionExecutor;
    this.connectionFactory = connectionFactory;
    this.clock = clock;
  }
}
