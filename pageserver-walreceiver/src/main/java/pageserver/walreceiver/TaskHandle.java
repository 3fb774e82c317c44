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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pageserver.util.CancellationToken;
import pageserver.util.PageserverFutures;
import pageserver.util.WatchChannel;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * A handle of a task running in the background on a worker pool.
 * <p>
 * The task communicates its lifecycle through a {@link WatchChannel}, which does not accumulate
 * events but replaces the old one with the newer one on submission. An observer which does not
 * keep up may therefore miss intermediate states; it is only guaranteed to see the started
 * state first, the latest progress, and the end of the task. The task also gets a cancellation
 * token it should listen to for earlier interrupts.
 * <p>
 * The task's result can be joined exactly once, either through {@link #nextTaskEvent()} or
 * {@link #shutdown()}. The event channel is closed only after the task body has returned, so
 * an observer seeing the end of the events never has to wait for a task which is still
 * running.
 *
 * @param <E> type of the progress values reported by the task.
 */
public class TaskHandle<E> {
  private static final Logger LOG = LoggerFactory.getLogger(TaskHandle.class);

  private final WatchChannel<TaskStateUpdate<E>>.Receiver eventsReceiver;
  private final CancellationToken cancellation;

  // Cleared once the result has been handed out; guarded by this.
  @Nullable
  private ListenableFuture<Void> joinHandle;
  @Nullable
  private ListenableFuture<TaskEvent<E>> pendingEvent;
  private boolean startedDelivered = false;

  private TaskHandle(ListenableFuture<Void> joinHandle,
                     WatchChannel<TaskStateUpdate<E>>.Receiver eventsReceiver,
                     CancellationToken cancellation) {
    this.joinHandle = joinHandle;
    this.eventsReceiver = eventsReceiver;
    this.cancellation = cancellation;
  }

  /**
   * Start the task immediately on the given executor.
   *
   * @throws java.util.concurrent.RejectedExecutionException if the executor will not run it
   */
  public static <E> TaskHandle<E> spawn(ListeningExecutorService executor, TaskBody<E> body) {
    final CancellationToken cancellation = new CancellationToken();
    final WatchChannel<TaskStateUpdate<E>> events = new WatchChannel<>(TaskStateUpdate.started());
    final WatchChannel<TaskStateUpdate<E>>.Receiver receiver = events.newReceiver();

    ListenableFuture<Void> joinHandle = executor.submit(() -> {
      body.run(progress -> events.send(TaskStateUpdate.progress(progress)), cancellation);
      return null;
    });
    joinHandle.addListener(events::close, MoreExecutors.directExecutor());

    return new TaskHandle<>(joinHandle, receiver, cancellation);
  }

  /**
   * Returns a future of the next state change of the task, or of its end. The first event is
   * always the started update. Once the task has finished and its last state has been seen, the
   * future results in an END event carrying the task's result, which consumes the join; any
   * later END event carries a {@link TaskAlreadyJoinedException} failure.
   * <p>
   * While a previously returned future is still pending, the same future is returned again, so
   * an event is never lost by a caller which abandoned an earlier wait.
   */
  public synchronized ListenableFuture<TaskEvent<E>> nextTaskEvent() {
    if (pendingEvent != null && !pendingEvent.isDone()) {
      return pendingEvent;
    }

    if (!startedDelivered) {
      startedDelivered = true;
      pendingEvent = Futures.immediateFuture(TaskEvent.update(TaskStateUpdate.started()));
      return pendingEvent;
    }

    pendingEvent = Futures.transformAsync(eventsReceiver.changed(),
        (Boolean hasNewState) -> {
          if (hasNewState) {
            return Futures.immediateFuture(TaskEvent.update(eventsReceiver.borrow()));
          }
          return joinTask();
        },
        MoreExecutors.directExecutor());
    return pendingEvent;
  }

  /**
   * Request cancellation of the task and wait for it to finish. The outcome is logged, never
   * thrown: the returned future always succeeds, with the END event the task produced.
   * Shutting down a task which has already been joined does nothing, and results in an END
   * event with a {@link TaskAlreadyJoinedException}.
   */
  public ListenableFuture<TaskEvent<E>> shutdown() {
    final ListenableFuture<Void> toJoin;
    synchronized (this) {
      toJoin = joinHandle;
      joinHandle = null;
    }
    if (toJoin == null) {
      LOG.debug("Shutdown of an already joined task");
      return Futures.immediateFuture(alreadyJoined());
    }

    cancellation.cancel();
    SettableFuture<TaskEvent<E>> shutdownResult = SettableFuture.create();
    toJoin.addListener(() -> {
      Throwable failure = resultOf(toJoin);
      if (failure == null) {
        LOG.debug("Shutdown success");
      } else if (failure instanceof CancellationException) {
        // The body gave up with a CancellationException of its own.
        LOG.info("Shutdown task was cancelled");
      } else {
        LOG.error("Shutdown task error", failure);
      }
      shutdownResult.set(TaskEvent.end(failure));
    }, MoreExecutors.directExecutor());
    return shutdownResult;
  }

  public boolean isCancellationRequested() {
    return cancellation.isCancelled();
  }

  private ListenableFuture<TaskEvent<E>> joinTask() {
    final ListenableFuture<Void> toJoin;
    synchronized (this) {
      toJoin = joinHandle;
    }
    if (toJoin == null) {
      return Futures.immediateFuture(alreadyJoined());
    }

    SettableFuture<TaskEvent<E>> endEvent = SettableFuture.create();
    toJoin.addListener(() -> {
      // Only a completed join consumes the handle.
      synchronized (this) {
        if (joinHandle != toJoin) {
          endEvent.set(alreadyJoined());
          return;
        }
        joinHandle = null;
      }
      endEvent.set(TaskEvent.end(resultOf(toJoin)));
    }, MoreExecutors.directExecutor());
    return endEvent;
  }

  /**
   * The join future itself is never cancelled, so a completed one either succeeded or carries
   * the failure of the body.
   */
  @Nullable
  private static Throwable resultOf(ListenableFuture<Void> completed) {
    try {
      PageserverFutures.getUninterruptibly(completed);
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    }
  }

  private TaskEvent<E> alreadyJoined() {
    return TaskEvent.end(new TaskAlreadyJoinedException("Task was joined more than once"));
  }

  /**
   * The result of a task was asked for after it had already been handed out.
   */
  public static class TaskAlreadyJoinedException extends Exception {
    public TaskAlreadyJoinedException(String message) {
      super(message);
    }
  }
}
