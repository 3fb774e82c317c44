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

package pageserver.util;

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;

import java.util.function.Consumer;

/**
 * BatchExecutor that catches every Throwable thrown by a fiber task and passes it to the given
 * handler, then carries on with the rest of the batch. Without it an uncaught exception would
 * kill the pool thread running the fiber.
 */
public class ExceptionHandlingBatchExecutor implements BatchExecutor {
  private final Consumer<Throwable> handler;

  /**
   * @param handler receives Throwables thrown by tasks of fibers using this batch executor. The
   *                handler executes in the context of the failed fiber.
   */
  public ExceptionHandlingBatchExecutor(Consumer<Throwable> handler) {
    this.handler = handler;
  }

  @Override
  public void execute(EventReader toExecute) {
    for (int i = 0; i < toExecute.size(); i++) {
      try {
        toExecute.get(i).run();
      } catch (Throwable throwable) {
        handler.accept(throwable);
      }
    }
  }
}
