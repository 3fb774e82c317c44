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
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import pageserver.context.RequestContext;
import pageserver.id.NodeId;
import pageserver.id.TenantTimelineId;
import pageserver.interfaces.Timeline;
import pageserver.interfaces.TimelineReference;
import pageserver.interfaces.broker.BrokerClient;
import pageserver.interfaces.broker.BrokerClosedException;
import pageserver.interfaces.broker.BrokerException;
import pageserver.interfaces.broker.BrokerSubscription;
import pageserver.interfaces.broker.SafekeeperTimelineInfo;
import pageserver.task.TaskKind;
import pageserver.util.FiberOnly;
import pageserver.util.PageserverFutures;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static pageserver.walreceiver.WalReceiverConstants.BROKER_SUBSCRIBE_RETRY_MAX_BACKOFF_MILLISECONDS;
import static pageserver.walreceiver.WalReceiverConstants.BROKER_SUBSCRIBE_RETRY_MIN_BACKOFF_MILLISECONDS;

/**
 * Everything the connection manager of one timeline knows: the broker subscription, the
 * connection candidates, and the WAL connection currently streaming, if any. All of it is
 * confined to the manager's fiber.
 * <p>
 * There is never more than one WAL connection: a new one is spawned only after the previous
 * one has been shut down and has finished.
 */
class ConnectionManagerState {
  private final Logger logger;
  private final TenantTimelineId id;
  private final TimelineReference timelineRef;
  private final WalReceiverConfig config;
  private final WalReceiverRuntime runtime;
  private final Fiber fiber;
  private final ConnectionCandidates candidates;

  @Nullable
  private WalConnection walConnection;
  // Set while a replaced connection is winding down.
  @Nullable
  private ListenableFuture<?> connectionShutdown;

  @Nullable
  private BrokerSubscription subscription;
  @Nullable
  private ListenableFuture<SafekeeperTimelineInfo> pendingBrokerUpdate;
  private boolean brokerClosed = false;
  private long subscribeBackoffMillis = 0;
  private long nextSubscribeAttemptAt = 0;

  // Completed by whatever ends the current step; null between steps.
  @Nullable
  private SettableFuture<Void> wakeup;
  // Something happened which the next step has to look at.
  private boolean woken = false;

  private boolean stopped = false;

  ConnectionManagerState(TenantTimelineId id,
                         TimelineReference timelineRef,
                         WalReceiverConfig config,
                         WalReceiverRuntime runtime,
                         Fiber fiber,
                         Logger logger) {
    this.id = id;
    this.timelineRef = timelineRef;
    this.config = config;
    this.runtime = runtime;
    this.fiber = fiber;
    this.logger = logger;
    this.candidates = new ConnectionCandidates(config);
  }

  /**
   * One iteration of the connection manager: wait for something to happen (a broker update, a
   * connection event, or the periodic check), reconsider which safekeeper to be connected to,
   * and publish the resulting status.
   * <p>
   * Broker updates and connection events are taken in on the fiber as soon as they arrive,
   * whether a step is waiting or not, and each of those futures is listened to exactly once.
   * A step only waits for the next of them, so cancelling it never loses an event.
   */
  @FiberOnly
  ListenableFuture<LoopControl> loopStep(BrokerClient brokerClient,
                                         RequestContext ctx,
                                         AtomicReference<ConnectionManagerStatus> statusCell) {
    if (stopped) {
      return Futures.immediateFuture(LoopControl.BREAK);
    }

    long now = runtime.clock.currentTimeMillis();
    if (subscription == null && !brokerClosed && now >= nextSubscribeAttemptAt) {
      try {
        subscription = brokerClient.subscribe(id);
        logger.debug("Subscribed for broker updates");
        awaitBrokerUpdate();
      } catch (BrokerClosedException e) {
        logger.info("Broker client is closed, no more safekeeper updates will come: {}", e.getMessage());
        brokerClosed = true;
      } catch (BrokerException e) {
        long backoff = bumpSubscribeBackoff(now);
        logger.warn("Failed to subscribe for broker updates, retrying in {} ms", backoff, e);
      }
    }
    if (brokerClosed) {
      return Futures.immediateFuture(LoopControl.BREAK);
    }

    final SettableFuture<Void> stepWakeup = SettableFuture.create();
    wakeup = stepWakeup;
    final Disposable checkTimerTask = fiber.schedule(() -> stepWakeup.set(null),
        runtime.clock.checkIntervalMillis(), TimeUnit.MILLISECONDS);
    if (woken) {
      stepWakeup.set(null);
    }

    final SettableFuture<LoopControl> stepResult = SettableFuture.create();
    stepWakeup.addListener(() -> {
      checkTimerTask.dispose();
      if (wakeup == stepWakeup) {
        wakeup = null;
      }
      if (stepResult.isCancelled() || stopped) {
        return;
      }
      woken = false;
      try {
        stepResult.setFuture(handleStep(ctx, statusCell));
      } catch (RuntimeException e) {
        stepResult.setException(e);
      }
    }, fiber);
    return stepResult;
  }

  /**
   * Stop for good: close the broker subscription and shut down the WAL connection.
   *
   * @return a future completing once the connection task has finished.
   */
  @FiberOnly
  ListenableFuture<Void> shutdown() {
    stopped = true;
    closeSubscription();

    List<ListenableFuture<?>> pending = new ArrayList<>(2);
    if (walConnection != null) {
      logger.debug("Shutting down WAL connection to safekeeper {}", walConnection.node);
      pending.add(walConnection.handle.shutdown());
      walConnection = null;
    }
    if (connectionShutdown != null) {
      pending.add(connectionShutdown);
    }
    return Futures.whenAllComplete(pending).call(() -> null, MoreExecutors.directExecutor());
  }

  @FiberOnly
  private ListenableFuture<LoopControl> handleStep(RequestContext ctx,
                                                   AtomicReference<ConnectionManagerStatus> statusCell) {
    if (brokerClosed) {
      return Futures.immediateFuture(LoopControl.BREAK);
    }

    long now = runtime.clock.currentTimeMillis();
    int dropped = candidates.dropStale(now);
    if (dropped > 0) {
      logger.debug("Dropped {} stale connection candidate(s)", dropped);
    }

    Timeline timeline = timelineRef.upgrade();
    if (timeline == null) {
      logger.info("Timeline was dropped, stopping the connection manager");
      return Futures.immediateFuture(LoopControl.BREAK);
    }

    WalConnectionStatus currentStatus = walConnection == null ? null : walConnection.status;
    long currentStartedAt = walConnection == null ? 0 : walConnection.startedAt;
    NewWalConnectionCandidate newCandidate =
        candidates.nextCandidate(currentStatus, currentStartedAt, timeline.getLastRecordLsn(), now);
    if (newCandidate == null) {
      publishStatus(statusCell);
      return Futures.immediateFuture(LoopControl.CONTINUE);
    }

    logger.info("Switching to new connection candidate {}", newCandidate);
    return changeConnection(timeline, newCandidate, ctx, statusCell);
  }

  /**
   * Wake the current step, or the next one if no step is waiting.
   */
  @FiberOnly
  private void wake() {
    woken = true;
    if (wakeup != null) {
      wakeup.set(null);
    }
  }

  @FiberOnly
  private void awaitBrokerUpdate() {
    final ListenableFuture<SafekeeperTimelineInfo> update = subscription.nextUpdate();
    pendingBrokerUpdate = update;
    PageserverFutures.addCallback(update,
        info -> onBrokerUpdate(update, info),
        failure -> onBrokerFailure(update, failure),
        fiber);
  }

  @FiberOnly
  private void onBrokerUpdate(ListenableFuture<SafekeeperTimelineInfo> update, SafekeeperTimelineInfo info) {
    if (stopped || update != pendingBrokerUpdate) {
      return;
    }
    pendingBrokerUpdate = null;
    subscribeBackoffMillis = 0;

    long now = runtime.clock.currentTimeMillis();
    if (!info.timeline.equals(id)) {
      logger.warn("Ignoring broker update for an unexpected timeline {}", info.timeline);
    } else if (candidates.update(info, now)) {
      logger.info("New connection candidate: safekeeper {} at commit lsn {}", info.safekeeperId, info.commitLsn);
    } else {
      logger.trace("Broker update {}", info);
    }

    awaitBrokerUpdate();
    wake();
  }

  @FiberOnly
  private void onBrokerFailure(ListenableFuture<SafekeeperTimelineInfo> update, Throwable failure) {
    if (stopped || update != pendingBrokerUpdate) {
      return;
    }
    closeSubscription();
    if (failure instanceof BrokerClosedException) {
      logger.info("Broker subscription ended, no more safekeeper updates will come");
      brokerClosed = true;
    } else {
      long backoff = bumpSubscribeBackoff(runtime.clock.currentTimeMillis());
      logger.warn("Broker subscription failed, resubscribing in {} ms", backoff, failure);
    }
    wake();
  }

  @FiberOnly
  private void awaitConnectionEvent(WalConnection connection) {
    PageserverFutures.addCallback(connection.handle.nextTaskEvent(),
        event -> onConnectionEvent(connection, event),
        failure -> onConnectionEvent(connection, TaskEvent.end(failure)),
        fiber);
  }

  @FiberOnly
  private void onConnectionEvent(WalConnection connection, TaskEvent<WalConnectionStatus> event) {
    if (stopped || connection != walConnection) {
      return;
    }

    if (event.isEnd()) {
      if (event.failure == null) {
        logger.info("WAL connection to safekeeper {} ended", connection.node);
      } else {
        logger.warn("WAL connection to safekeeper {} failed", connection.node, event.failure);
      }
      walConnection = null;
      wake();
      return;
    }

    TaskStateUpdate<WalConnectionStatus> update = event.update;
    if (update == null || update.isStarted()) {
      logger.debug("WAL connection to safekeeper {} started", connection.node);
    } else {
      WalConnectionStatus status = update.getProgress();
      connection.status = status;
      if (status.hasProcessedWal) {
        candidates.recordProgress(connection.node);
      }
      logger.trace("WAL connection status {}", status);
    }
    awaitConnectionEvent(connection);
    wake();
  }

  @FiberOnly
  private ListenableFuture<LoopControl> changeConnection(Timeline timeline,
                                                         NewWalConnectionCandidate newCandidate,
                                                         RequestContext ctx,
                                                         AtomicReference<ConnectionManagerStatus> statusCell) {
    final ListenableFuture<?> oldShutdown;
    WalConnection old = walConnection;
    walConnection = null;
    if (old != null) {
      logger.info("Shutting down WAL connection to safekeeper {}, reason {}", old.node, newCandidate.reason);
      oldShutdown = old.handle.shutdown();
    } else {
      oldShutdown = Futures.immediateFuture(null);
    }
    connectionShutdown = oldShutdown;

    final SettableFuture<LoopControl> result = SettableFuture.create();
    oldShutdown.addListener(() -> {
      connectionShutdown = null;
      if (stopped) {
        result.set(LoopControl.BREAK);
        return;
      }
      boolean spawned = spawnConnection(timeline, newCandidate, ctx);
      publishStatus(statusCell);
      result.set(spawned ? LoopControl.CONTINUE : LoopControl.BREAK);
    }, fiber);
    return result;
  }

  @FiberOnly
  private boolean spawnConnection(Timeline timeline, NewWalConnectionCandidate newCandidate, RequestContext ctx) {
    long now = runtime.clock.currentTimeMillis();
    NodeId node = newCandidate.safekeeperId;
    WalConnectionTarget target = new WalConnectionTarget(node,
        newCandidate.info.safekeeperConnstr,
        config.getAuthToken(),
        newCandidate.info.availabilityZone,
        config.getWalConnectTimeoutMillis());
    RequestContext connectionCtx =
        ctx.detachedChild(TaskKind.WAL_RECEIVER_CONNECTION_HANDLER, ctx.downloadBehavior());

    try {
      TaskBody<WalConnectionStatus> body = runtime.connectionFactory.newConnection(timeline, target, connectionCtx);
      TaskHandle<WalConnectionStatus> handle = TaskHandle.spawn(runtime.connectionExecutor, body);
      walConnection = new WalConnection(node, handle, now, WalConnectionStatus.initial(node, now));
      awaitConnectionEvent(walConnection);
    } catch (RejectedExecutionException e) {
      logger.error("Could not start the WAL connection task for safekeeper {}", node, e);
      return false;
    }

    long backoff = candidates.recordAttempt(node, now);
    logger.info("Connecting to safekeeper {} at {} (next attempt allowed in {} ms)", node, target.connstr, backoff);
    return true;
  }

  @FiberOnly
  private void publishStatus(AtomicReference<ConnectionManagerStatus> statusCell) {
    if (stopped) {
      return;
    }
    statusCell.set(new ConnectionManagerStatus(
        walConnection == null ? null : walConnection.status,
        candidates.snapshot()));
  }

  private long bumpSubscribeBackoff(long now) {
    subscribeBackoffMillis = subscribeBackoffMillis == 0
        ? BROKER_SUBSCRIBE_RETRY_MIN_BACKOFF_MILLISECONDS
        : Math.min(BROKER_SUBSCRIBE_RETRY_MAX_BACKOFF_MILLISECONDS, subscribeBackoffMillis * 2);
    nextSubscribeAttemptAt = now + subscribeBackoffMillis;
    return subscribeBackoffMillis;
  }

  @FiberOnly
  private void closeSubscription() {
    ListenableFuture<SafekeeperTimelineInfo> abandoned = pendingBrokerUpdate;
    pendingBrokerUpdate = null;
    if (abandoned != null) {
      abandoned.cancel(false);
    }
    if (subscription != null) {
      subscription.close();
      subscription = null;
    }
  }

  private static class WalConnection {
    final NodeId node;
    final TaskHandle<WalConnectionStatus> handle;
    final long startedAt;
    WalConnectionStatus status;

    WalConnection(NodeId node, TaskHandle<WalConnectionStatus> handle, long startedAt, WalConnectionStatus status) {
      this.node = node;
      this.handle = handle;
      this.startedAt = startedAt;
      this.status = status;
    }
  }
}
