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
import org.jetbrains.annotations.Nullable;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A cooperative cancellation signal. Cancelling it does not interrupt anything; the work
 * holding the token is expected to check {@link #isCancelled()} or listen to
 * {@link #whenCancelled()} at its own pace and wind down.
 * <p>
 * Child tokens are cancelled together with their parent, but cancelling a child leaves the
 * parent alone.
 */
public final class CancellationToken {
  private final SettableFuture<Void> cancelled = SettableFuture.create();
  private final Set<CancellationToken> children = ConcurrentHashMap.newKeySet();
  @Nullable
  private final CancellationToken parent;

  public CancellationToken() {
    this(null);
  }

  private CancellationToken(@Nullable CancellationToken parent) {
    this.parent = parent;
  }

  public void cancel() {
    if (cancelled.set(null)) {
      for (CancellationToken child : children) {
        child.cancel();
      }
      children.clear();
    }
  }

  public boolean isCancelled() {
    return cancelled.isDone();
  }

  /**
   * A future which completes (successfully) once the token has been cancelled. Cancelling the
   * returned future has no effect on the token.
   * <p>
   * Every call adds a listener to the token which stays until the token is cancelled, so long
   * lived holders should call this once and keep the result.
   */
  public ListenableFuture<Void> whenCancelled() {
    return Futures.nonCancellationPropagating(cancelled);
  }

  public CancellationToken child() {
    CancellationToken child = new CancellationToken(this);
    children.add(child);
    if (isCancelled()) {
      child.cancel();
    }
    return child;
  }

  /**
   * Stop following the parent token. Work holding a child token calls this once it has
   * finished, so the parent does not keep track of it any longer.
   */
  public void detach() {
    if (parent != null) {
      parent.children.remove(this);
    }
  }

  @Override
  public String toString() {
    return "CancellationToken{" +
        "cancelled=" + isCancelled() +
        '}';
  }
}
