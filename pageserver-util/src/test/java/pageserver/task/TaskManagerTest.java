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

package pageserver.task;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.junit.After;
import org.junit.Test;
import pageserver.id.TenantId;
import pageserver.id.TimelineId;
import pageserver.util.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static pageserver.FutureMatchers.isStillPending;
import static pageserver.FutureMatchers.resultsIn;
import static pageserver.FutureMatchers.resultsInException;

public class TaskManagerTest {
  private final ExecutorService executorService = Executors.newCachedThreadPool();
  private final TaskManager taskManager = new TaskManager(executorService);

  private final TenantId tenant = TenantId.generate();
  private final TimelineId timeline = TimelineId.generate();
  private final TimelineId otherTimeline = TimelineId.generate();

  @After
  public void shutdownExecutor() {
    executorService.shutdownNow();
  }

  @Test
  public void completesTheTaskFutureWithTheResultOfTheBody() throws Exception {
    ListenableFuture<Void> done = taskManager.spawn(TaskKind.REQUEST_HANDLER, null, null, "ok",
        shutdown -> Futures.immediateFuture(null));

    assertThat(done, resultsIn(nullValue()));
  }

  @Test
  public void completesTheTaskFutureWithTheFailureOfTheBody() throws Exception {
    ListenableFuture<Void> done = taskManager.spawn(TaskKind.REQUEST_HANDLER, null, null, "throws",
        shutdown -> {
          throw new IllegalStateException("boom");
        });

    assertThat(done, resultsInException(IllegalStateException.class));
  }

  @Test(timeout = 5000)
  public void finishedTasksAreNotKeptAroundForTheProcessShutdown() throws Exception {
    final List<CancellationToken> tokens = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      ListenableFuture<Void> done = taskManager.spawn(TaskKind.REQUEST_HANDLER, tenant, timeline, "short lived " + i,
          shutdown -> {
            synchronized (tokens) {
              tokens.add(shutdown);
            }
            return Futures.immediateFuture(null);
          });
      assertThat(done, resultsIn(nullValue()));
    }

    assertThat(taskManager.shutdownAll(), resultsIn(nullValue()));

    synchronized (tokens) {
      assertThat(tokens.size(), is(equalTo(100)));
      for (CancellationToken token : tokens) {
        assertThat(token.isCancelled(), is(false));
      }
    }
  }

  @Test(timeout = 5000)
  public void shutsDownOnlyTheTasksMatchingTheFilters() throws Exception {
    ListenableFuture<Void> target = spawnTaskWaitingForShutdown(TaskKind.WAL_RECEIVER_MANAGER, timeline);
    ListenableFuture<Void> otherKind = spawnTaskWaitingForShutdown(TaskKind.REQUEST_HANDLER, timeline);
    ListenableFuture<Void> otherTimelineTask = spawnTaskWaitingForShutdown(TaskKind.WAL_RECEIVER_MANAGER, otherTimeline);

    assertThat(taskManager.shutdownTasks(TaskKind.WAL_RECEIVER_MANAGER, tenant, timeline), resultsIn(nullValue()));

    assertThat(target.isDone(), is(true));
    assertThat(otherKind, isStillPending());
    assertThat(otherTimelineTask, isStillPending());
    assertThat(taskManager.countTasks(null, tenant, null), is(equalTo(2)));
  }

  @Test(timeout = 5000)
  public void theShutdownFutureWaitsForTheTasksToFinish() throws Exception {
    SettableFuture<Void> release = SettableFuture.create();
    taskManager.spawn(TaskKind.WAL_RECEIVER_MANAGER, tenant, timeline, "slow to stop", shutdown -> release);

    ListenableFuture<Void> shutdownDone = taskManager.shutdownTasks(TaskKind.WAL_RECEIVER_MANAGER, tenant, timeline);
    assertThat(shutdownDone, isStillPending());

    release.set(null);
    assertThat(shutdownDone, resultsIn(nullValue()));
  }

  @Test(timeout = 5000, expected = TaskManager.ShutdownInProgressException.class)
  public void refusesNewTasksOnceShutdownOfEverythingWasRequested() throws Exception {
    spawnTaskWaitingForShutdown(TaskKind.REQUEST_HANDLER, timeline);

    assertThat(taskManager.shutdownAll(), resultsIn(nullValue()));
    assertThat(taskManager.isShutdownRequested(), is(true));
    assertThat(taskManager.countTasks(null, null, null), is(equalTo(0)));

    spawnTaskWaitingForShutdown(TaskKind.REQUEST_HANDLER, timeline);
  }

  @Test
  public void shuttingDownWhenNothingMatchesCompletesImmediately() throws Exception {
    assertThat(taskManager.shutdownTasks(TaskKind.WAL_RECEIVER_MANAGER, tenant, timeline).isDone(), is(true));
  }

  private ListenableFuture<Void> spawnTaskWaitingForShutdown(TaskKind kind, TimelineId timelineId)
      throws TaskManager.ShutdownInProgressException {
    return taskManager.spawn(kind, tenant, timelineId, kind + " of " + timelineId, CancellationToken::whenCancelled);
  }
}
