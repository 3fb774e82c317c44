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
import com.google.common.util.concurrent.SettableFuture;
import pageserver.id.TenantTimelineId;
import pageserver.interfaces.broker.BrokerClient;
import pageserver.interfaces.broker.BrokerClosedException;
import pageserver.interfaces.broker.BrokerException;
import pageserver.interfaces.broker.BrokerSubscription;
import pageserver.interfaces.broker.SafekeeperTimelineInfo;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory broker: updates published while nobody waits are queued for the current
 * subscription.
 */
class FakeBrokerClient implements BrokerClient {
  private final AtomicInteger subscriptionCount = new AtomicInteger();
  private FakeSubscription current;
  private boolean closed = false;

  @Override
  public synchronized BrokerSubscription subscribe(TenantTimelineId timeline) throws BrokerException {
    if (closed) {
      throw new BrokerClosedException("fake broker is closed");
    }
    subscriptionCount.incrementAndGet();
    current = new FakeSubscription();
    return current;
  }

  synchronized void publish(SafekeeperTimelineInfo info) {
    if (current != null) {
      current.offer(info);
    }
  }

  /**
   * Ends the current subscription and refuses any new one.
   */
  synchronized void close() {
    closed = true;
    if (current != null) {
      current.fail(new BrokerClosedException("fake broker was closed"));
    }
  }

  int getSubscriptionCount() {
    return subscriptionCount.get();
  }

  private class FakeSubscription implements BrokerSubscription {
    private final Queue<SafekeeperTimelineInfo> queued = new ArrayDeque<>();
    private SettableFuture<SafekeeperTimelineInfo> waiting;
    private BrokerException failure;

    @Override
    public ListenableFuture<SafekeeperTimelineInfo> nextUpdate() {
      synchronized (FakeBrokerClient.this) {
        if (!queued.isEmpty()) {
          return Futures.immediateFuture(queued.remove());
        }
        if (failure != null) {
          return Futures.immediateFailedFuture(failure);
        }
        waiting = SettableFuture.create();
        return waiting;
      }
    }

    @Override
    public void close() {
      synchronized (FakeBrokerClient.this) {
        if (current == this) {
          current = null;
        }
      }
    }

    // Called holding the broker's lock.
    private void offer(SafekeeperTimelineInfo info) {
      if (waiting != null && !waiting.isDone()) {
        waiting.set(info);
      } else {
        queued.add(info);
      }
    }

    private void fail(BrokerException e) {
      failure = e;
      if (waiting != null) {
        waiting.setException(e);
      }
    }
  }
}
