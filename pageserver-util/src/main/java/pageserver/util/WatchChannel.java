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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import java.util.ArrayList;
import java.util.List;

/**
 * A single-slot channel holding only the latest value sent. Sending overwrites the slot and
 * wakes whoever is waiting for a change; nothing is queued, so a receiver that does not keep
 * up sees only the most recent value and misses the ones in between. This keeps a slow
 * observer from ever applying backpressure to the sender.
 * <p>
 * Closing the channel is the sender's way of saying no more values will come. Receivers then
 * get one last look at any value they have not seen, after which {@link Receiver#changed()}
 * reports the closure.
 *
 * @param <T> type of the values, which should be immutable since receivers share them.
 */
public final class WatchChannel<T> {
  private final Object lock = new Object();
  private final List<SettableFuture<Boolean>> waiters = new ArrayList<>();

  private T value;
  private long version = 0;
  private boolean closed = false;

  public WatchChannel(T initialValue) {
    this.value = initialValue;
  }

  /**
   * Replaces the current value. Returns false, without changing anything, if the channel has
   * already been closed.
   */
  public boolean send(T newValue) {
    List<SettableFuture<Boolean>> toWake;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      value = newValue;
      version++;
      toWake = drainWaiters();
    }
    toWake.forEach(waiter -> waiter.set(true));
    return true;
  }

  public void close() {
    List<SettableFuture<Boolean>> toWake;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      toWake = drainWaiters();
    }
    // Waiters re-check their version, so waking them with "true" is fine even on close.
    toWake.forEach(waiter -> waiter.set(true));
  }

  /**
   * A receiver which considers the current value as already seen.
   */
  public Receiver newReceiver() {
    synchronized (lock) {
      return new Receiver(version);
    }
  }

  private List<SettableFuture<Boolean>> drainWaiters() {
    List<SettableFuture<Boolean>> drained = new ArrayList<>(waiters);
    waiters.clear();
    return drained;
  }

  /**
   * Receiving end of a WatchChannel. A receiver tracks which version it has seen, so it is
   * meant for a single consumer.
   */
  public final class Receiver {
    private long seenVersion;

    private Receiver(long seenVersion) {
      this.seenVersion = seenVersion;
    }

    /**
     * The latest value, marking it as seen.
     */
    public T borrow() {
      synchronized (lock) {
        seenVersion = version;
        return value;
      }
    }

    /**
     * Returns a future which results in true as soon as a value this receiver has not seen is
     * available (marking it seen), or in false once the channel is closed and nothing unseen
     * remains.
     */
    public ListenableFuture<Boolean> changed() {
      SettableFuture<Boolean> waiter;
      synchronized (lock) {
        if (version != seenVersion) {
          seenVersion = version;
          return Futures.immediateFuture(true);
        }
        if (closed) {
          return Futures.immediateFuture(false);
        }
        waiter = SettableFuture.create();
        waiters.add(waiter);
      }
      return Futures.transformAsync(waiter, ignore -> changed(), Runnable::run);
    }
  }
}
