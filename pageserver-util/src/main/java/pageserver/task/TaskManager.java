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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pageserver.id.TenantId;
import pageserver.id.TimelineId;
import pageserver.util.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of the background tasks of a pageserver process. Every task is tagged with a
 * {@link TaskKind} and optionally the tenant and timeline it works on; tasks can then be shut
 * down in bulk by any combination of those tags, e.g. all tasks of a timeline when it is
 * detached, or everything when the process exits.
 * <p>
 * Shutdown is cooperative: each task gets its own {@link CancellationToken}, and the futures
 * returned by the shutdown methods complete only after the selected tasks have actually
 * finished.
 * <p>
 * One TaskManager should exist per process; it owns no threads itself, task bodies are started
 * on the executor given at construction.
 */
public class TaskManager {
  private static final Logger LOG = LoggerFactory.getLogger(TaskManager.class);

  private final ListeningExecutorService executor;
  private final CancellationToken processShutdown = new CancellationToken();
  private final AtomicLong taskIdGen = new AtomicLong(1);
  private final ConcurrentMap<Long, PageserverTask> tasks = new ConcurrentHashMap<>();

  public TaskManager(ExecutorService executor) {
    this.executor = MoreExecutors.listeningDecorator(executor);
  }

  /**
   * Register and start a task.
   *
   * @param kind       what the task is
   * @param tenantId   tenant the task works on, if any
   * @param timelineId timeline the task works on, if any
   * @param name       human readable description, used for logging
   * @param function   the task body
   * @return a future which completes when the task has finished; it results in the failure of
   * the task body, if there was one. Cancelling the returned future has no effect on the task.
   * @throws ShutdownInProgressException if the process is shutting down
   * @throws RejectedExecutionException  if the executor refuses the task
   */
  public ListenableFuture<Void> spawn(TaskKind kind,
                                      @Nullable TenantId tenantId,
                                      @Nullable TimelineId timelineId,
                                      String name,
                                      TaskFunction function) throws ShutdownInProgressException {
    if (processShutdown.isCancelled()) {
      throw new ShutdownInProgressException("Cannot spawn task '" + name + "', shutdown in progress");
    }

    long taskId = taskIdGen.getAndIncrement();
    CancellationToken shutdown = processShutdown.child();
    SettableFuture<Void> completion = SettableFuture.create();
    PageserverTask task = new PageserverTask(taskId, kind, tenantId, timelineId, name, shutdown, completion);

    tasks.put(taskId, task);
    LOG.debug("Spawning task {}", task);

    Futures.addCallback(completion, new FutureCallback<Void>() {
      @Override
      public void onSuccess(Void result) {
        tasks.remove(taskId);
        shutdown.detach();
        LOG.debug("Task {} finished", task);
      }

      @Override
      public void onFailure(Throwable t) {
        tasks.remove(taskId);
        shutdown.detach();
        LOG.error("Task {} failed", task, t);
      }
    }, MoreExecutors.directExecutor());

    try {
      completion.setFuture(Futures.submitAsync(() -> function.run(shutdown), executor));
    } catch (RejectedExecutionException e) {
      tasks.remove(taskId);
      shutdown.detach();
      throw e;
    }
    return Futures.nonCancellationPropagating(completion);
  }

  /**
   * Ask every task matching all the non-null filters to shut down.
   *
   * @return a future which completes once every selected task has finished, whatever its
   * outcome was.
   */
  public ListenableFuture<Void> shutdownTasks(@Nullable TaskKind kind,
                                              @Nullable TenantId tenantId,
                                              @Nullable TimelineId timelineId) {
    List<PageserverTask> victims = matchingTasks(kind, tenantId, timelineId);
    if (victims.isEmpty()) {
      return Futures.immediateFuture(null);
    }

    LOG.info("Shutting down {} task(s) kind={} tenant={} timeline={}", victims.size(), kind, tenantId, timelineId);
    List<ListenableFuture<Void>> completions = new ArrayList<>(victims.size());
    for (PageserverTask task : victims) {
      task.shutdown.cancel();
      completions.add(task.completion);
    }
    return Futures.whenAllComplete(completions).call(() -> null, MoreExecutors.directExecutor());
  }

  /**
   * Process wide teardown: refuses new tasks and shuts down every running one.
   */
  public ListenableFuture<Void> shutdownAll() {
    LOG.info("Shutting down all tasks");
    processShutdown.cancel();
    return shutdownTasks(null, null, null);
  }

  public boolean isShutdownRequested() {
    return processShutdown.isCancelled();
  }

  /**
   * Number of registered, unfinished tasks matching all the non-null filters.
   */
  public int countTasks(@Nullable TaskKind kind,
                        @Nullable TenantId tenantId,
                        @Nullable TimelineId timelineId) {
    return matchingTasks(kind, tenantId, timelineId).size();
  }

  private List<PageserverTask> matchingTasks(@Nullable TaskKind kind,
                                             @Nullable TenantId tenantId,
                                             @Nullable TimelineId timelineId) {
    List<PageserverTask> matching = new ArrayList<>();
    for (PageserverTask task : tasks.values()) {
      if ((kind == null || kind == task.kind)
          && (tenantId == null || tenantId.equals(task.tenantId))
          && (timelineId == null || timelineId.equals(task.timelineId))) {
        matching.add(task);
      }
    }
    return matching;
  }

  private static class PageserverTask {
    final long taskId;
    final TaskKind kind;
    final TenantId tenantId;
    final TimelineId timelineId;
    final String name;
    final CancellationToken shutdown;
    final ListenableFuture<Void> completion;

    PageserverTask(long taskId,
                   TaskKind kind,
                   @Nullable TenantId tenantId,
                   @Nullable TimelineId timelineId,
                   String name,
                   CancellationToken shutdown,
                   ListenableFuture<Void> completion) {
      this.taskId = taskId;
      this.kind = kind;
      this.tenantId = tenantId;
      this.timelineId = timelineId;
      this.name = name;
      this.shutdown = shutdown;
      this.completion = completion;
    }

    @Override
    public String toString() {
      return "PageserverTask{" +
          "taskId=" + taskId +
          ", kind=" + kind +
          ", name='" + name + '\'' +
          '}';
    }
  }

  public static class ShutdownInProgressException extends Exception {
    public ShutdownInProgressException(String message) {
      super(message);
    }
  }
}
