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

import com.google.common.util.concurrent.ListenableFuture;
import org.jetbrains.annotations.NotNull;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Utilities for messing about with guava listenable futures and jetlang fibers.
 */
public class PageserverFutures {

  /**
   * Run success or failure on the given fiber once the future completes. A cancelled future
   * counts as a failure, with a CancellationException.
   */
  public static <V> void addCallback(@NotNull final ListenableFuture<V> future,
                                     @NotNull final Consumer<? super V> success,
                                     @NotNull final Consumer<Throwable> failure,
                                     @NotNull Fiber fiber) {
    Runnable callbackListener = () -> {
      final V value;
      try {
        value = getUninterruptibly(future);
      } catch (ExecutionException e) {
        failure.accept(e.getCause());
        return;
      } catch (RuntimeException | Error e) {
        failure.accept(e);
        return;
      }
      success.accept(value);
    };
    future.addListener(callbackListener, fiber);
  }

  public static <V> V getUninterruptibly(@NotNull Future<V> future)
      throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

}
