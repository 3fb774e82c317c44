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

import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Source of fibers for objects that need their own serialized execution context. Fibers
 * returned are not started; the caller starts them, and must dispose of them.
 */
@FunctionalInterface
public interface FiberSupplier {
  /**
   * @param throwableHandler receives any Throwable escaping a task executed on the fiber.
   *                         It runs in the context of the failed fiber.
   */
  Fiber getFiber(Consumer<Throwable> throwableHandler);
}
