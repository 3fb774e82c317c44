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
import com.google.common.util.concurrent.MoreExecutors;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pageserver.context.DownloadBehavior;
import pageserver.context.RequestContext;
import pageserver.id.TenantTimelineId;
import pageserver.interfaces.Timeline;
import pageserver.interfaces.TimelineReference;
import pageserver.interfaces.broker.BrokerClient;
import pageserver.task.TaskKind;
import pageserver.task.TaskManager;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Receives WAL for one timeline. A started WalReceiver runs a connection manager task in the
 * background which follows the safekeepers advertised through the broker and keeps a single
 * WAL streaming connection to the most suitable one.
 * <p>
 * The receiver holds its timeline only weakly, so it never keeps a dropped timeline alive;
 * starting a receiver whose timeline is gone fails.
 * <p>
 * At most one manager task runs per receiver. {@link #start} and {@link #stop} may be called
 * from any thread.
 */
public class WalReceiver {
  private static final Logger LOG = LoggerFactory.getLogger(WalReceiver.class);

  private enum ReceiverState {
    NOT_STARTED,
    STARTING,
    ACTIVE,
    STOPPING,
  }

  private final TenantTimelineId id;
  private final TimelineReference timelineRef;
  private final WalReceiverConfig config;
  private final WalReceiverRuntime runtime;

  private final AtomicReference<ReceiverState> state = new AtomicReference<>(ReceiverState.NOT_STARTED);
  private final AtomicReference<ConnectionManagerStatus> connectionManagerStatus = new AtomicReference<>();

  // Guarded by this.
  @Nullable
  private ListenableFuture<Void> stopFuture;

  public WalReceiver(TenantTimelineId id,
                     TimelineReference timelineRef,
                     WalReceiverConfig config,
                     WalReceiverRuntime runtime) {
    this.id = id;
    this.timelineRef = timelineRef;
    this.config = config;
    this.runtime = runtime;
  }

  /**
   * Start the connection manager task of this timeline.
   *
   * @throws AlreadyStartedException if the receiver is started, or being started or stopped
   * @throws TimelineGoneException   if the timeline has been dropped
   * @throws TaskManager.ShutdownInProgressException if the process is shutting down
   */
  public synchronized void start(RequestContext ctx, BrokerClient brokerClient)
      throws AlreadyStartedException, TimelineGoneException, TaskManager.ShutdownInProgressException {
    ReceiverState current = state.get();
    if (current != ReceiverState.NOT_STARTED) {
      throw new AlreadyStartedException("WAL receiver for timeline " + id + " is already " + current);
    }

    Timeline timeline = timelineRef.upgrade();
    if (timeline == null) {
      throw new TimelineGoneException("walreceiver start on a dropped timeline " + id);
    }

    state.set(ReceiverState.STARTING);
    RequestContext managerCtx = ctx.detachedChild(TaskKind.WAL_RECEIVER_MANAGER, DownloadBehavior.ERROR);
    ConnectionManagerLoop loop = new ConnectionManagerLoop(id, timelineRef, config, runtime, brokerClient,
        managerCtx, connectionManagerStatus);

    final ListenableFuture<Void> managerDone;
    try {
      managerDone = runtime.taskManager.spawn(TaskKind.WAL_RECEIVER_MANAGER,
          id.tenantId,
          id.timelineId,
          "walreceiver for timeline " + id,
          loop::run);
    } catch (TaskManager.ShutdownInProgressException | RejectedExecutionException e) {
      state.set(ReceiverState.NOT_STARTED);
      throw e;
    }

    state.set(ReceiverState.ACTIVE);
    managerDone.addListener(() -> {
      if (state.compareAndSet(ReceiverState.ACTIVE, ReceiverState.NOT_STARTED)) {
        LOG.info("WAL receiver manager of timeline {} exited on its own", id);
      }
    }, MoreExecutors.directExecutor());
    LOG.info("Started WAL receiver for timeline {}", id);
  }

  /**
   * Shut down the connection manager task and its WAL connection.
   *
   * @return a future completing once they have finished. Stopping a receiver which is not
   * started completes immediately; stopping one which is being stopped returns the pending stop.
   */
  public synchronized ListenableFuture<Void> stop() {
    ReceiverState current = state.get();
    if (current == ReceiverState.NOT_STARTED) {
      LOG.debug("WAL receiver for timeline {} is not started, nothing to stop", id);
      return Futures.immediateFuture(null);
    }
    if (current == ReceiverState.STOPPING && stopFuture != null) {
      return stopFuture;
    }

    LOG.info("Stopping WAL receiver for timeline {}", id);
    state.set(ReceiverState.STOPPING);
    ListenableFuture<Void> tasksDone =
        runtime.taskManager.shutdownTasks(TaskKind.WAL_RECEIVER_MANAGER, id.tenantId, id.timelineId);
    stopFuture = Futures.transform(tasksDone, ignore -> {
      synchronized (this) {
        connectionManagerStatus.set(null);
        state.set(ReceiverState.NOT_STARTED);
        stopFuture = null;
      }
      LOG.info("Stopped WAL receiver for timeline {}", id);
      return null;
    }, MoreExecutors.directExecutor());
    return stopFuture;
  }

  /**
   * The latest status published by the connection manager, or null if there is none. This
   * never waits for the connection manager.
   */
  @Nullable
  public ConnectionManagerStatus status() {
    return connectionManagerStatus.get();
  }

  public boolean isStarted() {
    return state.get() != ReceiverState.NOT_STARTED;
  }

  public TenantTimelineId getTenantTimelineId() {
    return id;
  }

  public static class AlreadyStartedException extends Exception {
    public AlreadyStartedException(String message) {
      super(message);
    }
  }

  public static class TimelineGoneException extends Exception {
    public TimelineGoneException(String message) {
      super(message);
    }
  }
}
