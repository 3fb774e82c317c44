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
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import pageserver.context.DownloadBehavior;
import pageserver.context.RequestContext;
import pageserver.id.NodeId;
import pageserver.id.TenantTimelineId;
import pageserver.interfaces.Timeline;
import pageserver.interfaces.TimelineReference;
import pageserver.interfaces.broker.SafekeeperTimelineInfo;
import pageserver.lsn.Lsn;
import pageserver.task.TaskKind;
import pageserver.task.TaskManager;
import pageserver.util.FiberSupplier;
import pageserver.util.JUnitRuleFiberExceptions;
import pageserver.util.PoolFiberSupplier;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;
import static pageserver.ConcurrencyTestUtil.runNTimesAndWaitForAllToComplete;

public class WalReceiverTest {
  private static final NodeId SK_1 = NodeId.of(1);
  private static final NodeId SK_2 = NodeId.of(2);
  private static final long CHECK_INTERVAL = 50;

  @Rule
  public JUnitRuleFiberExceptions fiberExceptions = new JUnitRuleFiberExceptions();

  private final ExecutorService taskExecutor = Executors.newCachedThreadPool();
  private final ExecutorService fiberPool = Executors.newFixedThreadPool(2);
  private final ListeningExecutorService connectionExecutor =
      MoreExecutors.listeningDecorator(Executors.newCachedThreadPool());
  private final ScheduledExecutorService advertiser = Executors.newSingleThreadScheduledExecutor();

  private final PoolFiberSupplier poolFiberSupplier = new PoolFiberSupplier(fiberPool);
  private final FiberSupplier fiberSupplier = throwableHandler -> poolFiberSupplier.getFiber(throwable -> {
    fiberExceptions.accept(throwable);
    throwableHandler.accept(throwable);
  });
  private final WalReceiverClock clock = new DefaultSystemTimeWalReceiverClock(CHECK_INTERVAL);
  private final TaskManager taskManager = new TaskManager(taskExecutor);
  private final FakeWalConnectionFactory connectionFactory = new FakeWalConnectionFactory(clock);
  private final FakeBrokerClient broker = new FakeBrokerClient();
  private final WalReceiverRuntime runtime =
      new WalReceiverRuntime(taskManager, fiberSupplier, connectionExecutor, connectionFactory, clock);

  private final TenantTimelineId id = TenantTimelineId.generate();
  private final FakeTimeline timeline = new FakeTimeline(id, Lsn.of(0x1000));
  private final AtomicReference<Timeline> timelineHolder = new AtomicReference<>(timeline);
  private final WalReceiverConfig config = WalReceiverConfig.builder()
      .setWalConnectTimeout(1, TimeUnit.SECONDS)
      .setLaggingWalTimeout(5, TimeUnit.SECONDS)
      .setMaxLsnWalLag(1024 * 1024)
      .build();
  private final WalReceiver walReceiver = new WalReceiver(id, timelineHolder::get, config, runtime);
  private final RequestContext ctx = RequestContext.root(TaskKind.REQUEST_HANDLER, DownloadBehavior.DOWNLOAD);

  @After
  public void shutdown() throws Exception {
    advertiser.shutdownNow();
    walReceiver.stop().get(5, TimeUnit.SECONDS);
    taskManager.shutdownAll().get(5, TimeUnit.SECONDS);
    connectionExecutor.shutdownNow();
    poolFiberSupplier.close();
    fiberPool.shutdownNow();
    taskExecutor.shutdownNow();
  }

  @Test
  public void stoppingAReceiverWhichWasNotStartedDoesNothing() throws Exception {
    assertThat(walReceiver.stop().isDone(), is(true));
    assertThat(walReceiver.status(), is(nullValue()));
    assertThat(walReceiver.isStarted(), is(false));
  }

  @Test
  public void refusesToStartForADroppedTimeline() throws Exception {
    WalReceiver orphan = new WalReceiver(id, () -> null, config, runtime);

    try {
      orphan.start(ctx, broker);
      fail("expected the start to be refused");
    } catch (WalReceiver.TimelineGoneException expected) {
      // expected
    }

    assertThat(orphan.isStarted(), is(false));
    assertThat(taskManager.countTasks(TaskKind.WAL_RECEIVER_MANAGER, id.tenantId, id.timelineId), is(equalTo(0)));
  }

  @Test
  public void aWeakTimelineReferenceResolvesWhileTheTimelineIsAlive() throws Exception {
    TimelineReference reference = TimelineReference.weakly(timeline);

    assertThat(reference.upgrade(), is(notNullValue()));
  }

  @Test(timeout = 10000)
  public void connectsToTheMostAdvancedSafekeeperAndPublishesTheStatus() throws Exception {
    advertise(Lsn.of(0x2000), Lsn.of(0x3000));
    walReceiver.start(ctx, broker);

    FakeWalConnectionFactory.StartedConnection connection = connectionFactory.nextStarted(5, TimeUnit.SECONDS);
    assertThat(connection, is(notNullValue()));
    assertThat(connection.target.safekeeperId, is(equalTo(SK_2)));
    assertThat(connection.target.connectTimeoutMillis, is(equalTo(1000L)));
    assertThat(connection.ctx.taskKind(), is(TaskKind.WAL_RECEIVER_CONNECTION_HANDLER));
    assertThat(connection.ctx.downloadBehavior(), is(DownloadBehavior.ERROR));

    waitUntil(() -> {
      ConnectionManagerStatus status = walReceiver.status();
      return status != null
          && status.existingConnection != null
          && status.existingConnection.isConnected
          && status.candidates.size() == 2;
    }, 5000);
  }

  @Test(timeout = 10000)
  public void onlyOneOfSeveralConcurrentStartsSucceeds() throws Exception {
    final AtomicInteger started = new AtomicInteger();
    final AtomicInteger refused = new AtomicInteger();
    final ExecutorService starters = Executors.newFixedThreadPool(8);

    try {
      runNTimesAndWaitForAllToComplete(8, starters, (i) -> {
        try {
          walReceiver.start(ctx, broker);
          started.incrementAndGet();
        } catch (WalReceiver.AlreadyStartedException e) {
          refused.incrementAndGet();
        }
      });
    } finally {
      starters.shutdownNow();
    }

    assertThat(started.get(), is(equalTo(1)));
    assertThat(refused.get(), is(equalTo(7)));
    assertThat(taskManager.countTasks(TaskKind.WAL_RECEIVER_MANAGER, id.tenantId, id.timelineId), is(equalTo(1)));
  }

  @Test(timeout = 10000, expected = WalReceiver.AlreadyStartedException.class)
  public void refusesASecondStart() throws Exception {
    walReceiver.start(ctx, broker);
    walReceiver.start(ctx, broker);
  }

  @Test(timeout = 10000)
  public void stoppingDuringAConnectionShutsItDownWithoutReconnecting() throws Exception {
    advertise(Lsn.of(0x2000), Lsn.of(0x2000));
    walReceiver.start(ctx, broker);
    assertThat(connectionFactory.nextStarted(5, TimeUnit.SECONDS), is(notNullValue()));

    walReceiver.stop().get(5, TimeUnit.SECONDS);

    assertThat(connectionFactory.nextStarted(500, TimeUnit.MILLISECONDS), is(nullValue()));
    assertThat(walReceiver.isStarted(), is(false));
    assertThat(walReceiver.status(), is(nullValue()));
    assertThat(taskManager.countTasks(TaskKind.WAL_RECEIVER_MANAGER, id.tenantId, id.timelineId), is(equalTo(0)));
    assertThat(connectionFactory.getMaxRunningConnections(), is(equalTo(1)));
  }

  @Test(timeout = 10000)
  public void canBeStartedAgainAfterAStop() throws Exception {
    walReceiver.start(ctx, broker);
    walReceiver.stop().get(5, TimeUnit.SECONDS);

    walReceiver.start(ctx, broker);

    assertThat(walReceiver.isStarted(), is(true));
  }

  @Test(timeout = 15000)
  public void reconnectsWhenTheConnectionStopsReportingProgress() throws Exception {
    advertise(Lsn.of(0x2000), Lsn.of(0x2000));
    walReceiver.start(ctx, broker);

    FakeWalConnectionFactory.StartedConnection first = connectionFactory.nextStarted(5, TimeUnit.SECONDS);
    assertThat(first, is(notNullValue()));
    assertThat(first.target.safekeeperId, is(equalTo(SK_1)));

    FakeWalConnectionFactory.StartedConnection second = connectionFactory.nextStarted(8, TimeUnit.SECONDS);
    assertThat(second, is(notNullValue()));
    assertThat(second.target.safekeeperId, is(equalTo(SK_2)));
    assertThat(second.startedAt - first.startedAt, is(greaterThanOrEqualTo(4900L)));
    assertThat(connectionFactory.getMaxRunningConnections(), is(equalTo(1)));
  }

  @Test(timeout = 10000)
  public void returnsToNotStartedWhenTheBrokerGoesAway() throws Exception {
    walReceiver.start(ctx, broker);
    waitUntil(() -> broker.getSubscriptionCount() > 0, 5000);

    broker.close();

    waitUntil(() -> !walReceiver.isStarted(), 5000);
    assertThat(walReceiver.status(), is(nullValue()));
  }

  @Test(timeout = 10000)
  public void returnsToNotStartedWhenTheTimelineIsDropped() throws Exception {
    advertise(Lsn.of(0x2000), Lsn.of(0x2000));
    walReceiver.start(ctx, broker);
    assertThat(connectionFactory.nextStarted(5, TimeUnit.SECONDS), is(notNullValue()));

    timelineHolder.set(null);

    waitUntil(() -> !walReceiver.isStarted(), 5000);
    assertThat(taskManager.countTasks(TaskKind.WAL_RECEIVER_MANAGER, id.tenantId, id.timelineId), is(equalTo(0)));
  }

  /**
   * Have both safekeepers advertise the timeline through the broker every 200ms, which keeps
   * them from going stale.
   */
  private void advertise(Lsn sk1CommitLsn, Lsn sk2CommitLsn) {
    advertiser.scheduleWithFixedDelay(() -> {
      broker.publish(info(SK_1, sk1CommitLsn));
      broker.publish(info(SK_2, sk2CommitLsn));
    }, 0, 200, TimeUnit.MILLISECONDS);
  }

  private SafekeeperTimelineInfo info(NodeId node, Lsn commitLsn) {
    return SafekeeperTimelineInfo.builder(node, id)
        .setTerm(1)
        .setCommitLsn(commitLsn)
        .setFlushLsn(commitLsn)
        .setSafekeeperConnstr("sk-" + node + ":5454")
        .build();
  }

  private static void waitUntil(BooleanSupplier condition, long timeoutMillis) throws InterruptedException {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        fail("condition not met within " + timeoutMillis + " ms");
      }
      Thread.sleep(20);
    }
  }
}
