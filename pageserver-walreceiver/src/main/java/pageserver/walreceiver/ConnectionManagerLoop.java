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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pageserver.context.RequestContext;
import pageserver.id.TenantTimelineId;
import pageserver.interfaces.TimelineReference;
import pageserver.interfaces.broker.BrokerClient;
import pageserver.util.CancellationToken;
import pageserver.util.FiberOnly;
import pageserver.util.PageserverFutures;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The background task of a {@link WalReceiver}: runs connection manager steps one after the
 * other on a fiber of its own, until a step says to stop or shutdown is requested. Shutdown
 * takes priority over whatever the current step waits for; it is listened to once for the
 * whole life of the loop, not once per step.
 */
class ConnectionManagerLoop {
  private final Logger logger;
  private final Fiber fiber;
  private final BrokerClient brokerClient;
  private final RequestContext ctx;
  private final AtomicReference<ConnectionManagerStatus> statusCell;
  private final ConnectionManagerState state;
  private final SettableFuture<Void> loopDone = SettableFuture.create();

  private CancellationToken shutdown;
  @Nullable
  private ListenableFuture<LoopControl> currentStep;
  private boolean tearingDown = false;

  ConnectionManagerLoop(TenantTimelineId id,
                        TimelineReference timelineRef,
                        WalReceiverConfig config,
                        WalReceiverRuntime runtime,
                        BrokerClient brokerClient,
                        RequestContext ctx,
                        AtomicReference<ConnectionManagerStatus> statusCell) {
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + id + ")");
    this.fiber = runtime.fiberSupplier.getFiber(this::failLoop);
    this.brokerClient = brokerClient;
    this.ctx = ctx;
    this.statusCell = statusCell;
    this.state = new ConnectionManagerState(id, timelineRef, config, runtime, fiber, logger);
  }

  /**
   * Start the loop.
   *
   * @return a future completing once the loop has exited and its connection has been shut
   * down; it fails if the loop itself failed.
   */
  ListenableFuture<Void> run(CancellationToken shutdown) {
    this.shutdown = shutdown;
    fiber.start();
    fiber.execute(() -> {
      logger.info("WAL receiver manager started, connecting to broker");
      shutdown.whenCancelled().addListener(this::onShutdownRequested, fiber);
      runStep();
    });
    return loopDone;
  }

  @FiberOnly
  private void onShutdownRequested() {
    if (tearingDown) {
      return;
    }
    if (currentStep != null) {
      currentStep.cancel(false);
      currentStep = null;
    }
    logger.info("WAL receiver shutdown requested, shutting down");
    teardown(null);
  }

  @FiberOnly
  private void runStep() {
    if (shutdown.isCancelled()) {
      onShutdownRequested();
      return;
    }

    final ListenableFuture<LoopControl> step = state.loopStep(brokerClient, ctx, statusCell);
    currentStep = step;
    step.addListener(() -> {
      if (tearingDown || step != currentStep) {
        return;
      }
      currentStep = null;

      final LoopControl control;
      try {
        control = PageserverFutures.getUninterruptibly(step);
      } catch (ExecutionException e) {
        logger.error("Connection manager step failed", e.getCause());
        teardown(e.getCause());
        return;
      } catch (CancellationException e) {
        teardown(e);
        return;
      }

      if (control == LoopControl.CONTINUE) {
        runStep();
      } else {
        logger.info("Connection manager loop ended, shutting down");
        teardown(null);
      }
    }, fiber);
  }

  @FiberOnly
  private void teardown(@Nullable Throwable failure) {
    if (tearingDown) {
      return;
    }
    tearingDown = true;

    state.shutdown().addListener(() -> {
      statusCell.set(null);
      if (failure == null) {
        loopDone.set(null);
      } else {
        loopDone.setException(failure);
      }
      fiber.dispose();
    }, fiber);
  }

  @FiberOnly
  private void failLoop(Throwable t) {
    logger.error("Error in connection manager fiber", t);
    teardown(t);
  }
}
