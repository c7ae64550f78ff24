// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.twitter.muxpool.net.pool;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;
import com.twitter.muxpool.util.Clock;

/**
 * Tracks the activity of one pooled transport and closes it once it has stayed idle for a full
 * idle timeout.
 *
 * <p>The idle timer decays rather than restarts: when it fires on a transport that went idle part
 * way through the window, it is re-armed for only the remainder of the window.  A transport that
 * is active when the timer fires gets a fresh full window.  The timer firing is never itself
 * counted as activity.
 *
 * <p>Once eviction has been decided, or the state disposed, the state is <em>retired</em> and
 * will no longer hand out its transport.
 *
 * @param <T> the transport type
 */
final class ConnectionState<T extends MultiplexedTransport> implements ActiveStateListener {
  private static final Logger LOG = Logger.getLogger(ConnectionState.class.getName());

  /**
   * Idle timeouts shorter than this are raised to it.
   */
  static final Amount<Long, Time> MIN_IDLE_TIMEOUT = Amount.of(100L, Time.MILLISECONDS);

  private final T transport;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final Runnable tick = new Runnable() {
    @Override public void run() {
      tick();
    }
  };

  // Guarded by this.
  private boolean active = true;
  private long latestIdleMillis;
  private long idleTimeoutMillis;
  @Nullable private Runnable onIdle;
  @Nullable private ScheduledFuture<?> timer;
  private boolean retired;
  private boolean disposed;

  private ConnectionState(T transport, Clock clock, ScheduledExecutorService scheduler) {
    this.transport = transport;
    this.clock = clock;
    this.scheduler = scheduler;
    this.latestIdleMillis = nowMillis();
  }

  /**
   * Creates a state for a freshly established transport and subscribes it to the transport's
   * active state changes.
   */
  static <T extends MultiplexedTransport> ConnectionState<T> create(T transport, Clock clock,
      ScheduledExecutorService scheduler) {
    ConnectionState<T> state = new ConnectionState<T>(
        Preconditions.checkNotNull(transport),
        Preconditions.checkNotNull(clock),
        Preconditions.checkNotNull(scheduler));
    transport.addActiveStateListener(state);
    return state;
  }

  T getTransport() {
    return transport;
  }

  boolean isOpen() {
    return transport.isOpen();
  }

  /**
   * Hands out the transport, marking it active.
   *
   * @return the transport, or {@code null} if this state has been retired
   */
  @Nullable
  synchronized T tryActivate() {
    if (retired) {
      return null;
    }
    active = true;
    latestIdleMillis = nowMillis();
    return transport;
  }

  @Override
  public synchronized void onActiveStateChanged(boolean active) {
    this.active = active;
    if (!active) {
      latestIdleMillis = nowMillis();
    }
  }

  /**
   * Arms the idle timer.  {@code onIdle} runs once on the scheduler thread after the transport
   * has been idle for {@code idleTimeout}; it is expected to drop this state from its pool and
   * {@link #dispose()} it.
   *
   * @param idleTimeout how long the transport may stay idle, raised to {@link #MIN_IDLE_TIMEOUT}
   * @param onIdle the eviction callback
   */
  synchronized void delayClose(Amount<Long, Time> idleTimeout, Runnable onIdle) {
    Preconditions.checkNotNull(idleTimeout);
    Preconditions.checkNotNull(onIdle);
    Preconditions.checkState(this.onIdle == null, "Idle timer already armed for %s", transport);
    if (retired) {
      return;
    }
    this.idleTimeoutMillis =
        Math.max(idleTimeout.as(Time.MILLISECONDS), MIN_IDLE_TIMEOUT.as(Time.MILLISECONDS));
    this.onIdle = onIdle;
    schedule(idleTimeoutMillis);
  }

  /**
   * Cancels the idle timer and finishes the transport.  Safe to call more than once.
   */
  void dispose() {
    ScheduledFuture<?> pendingTimer;
    synchronized (this) {
      if (disposed) {
        return;
      }
      disposed = true;
      retired = true;
      pendingTimer = timer;
      timer = null;
    }

    if (pendingTimer != null) {
      pendingTimer.cancel(false);
    }
    transport.removeActiveStateListener(this);
    try {
      transport.finish();
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to finish transport " + transport, e);
    }
  }

  @VisibleForTesting
  synchronized boolean isActive() {
    return active;
  }

  @VisibleForTesting
  synchronized boolean isRetired() {
    return retired;
  }

  @VisibleForTesting
  synchronized long getIdleTimeoutMillis() {
    return idleTimeoutMillis;
  }

  private void tick() {
    Runnable evict;
    synchronized (this) {
      timer = null;
      if (retired) {
        return;
      }
      if (active) {
        schedule(idleTimeoutMillis);
        return;
      }
      long idleMillis = nowMillis() - latestIdleMillis;
      if (idleMillis < idleTimeoutMillis) {
        schedule(idleTimeoutMillis - idleMillis);
        return;
      }
      retired = true;
      evict = onIdle;
    }

    LOG.fine("Transport " + transport + " idle for " + idleTimeoutMillis + "ms, evicting");
    try {
      evict.run();
    } catch (RuntimeException e) {
      LOG.log(Level.WARNING, "Failed to evict idle transport " + transport, e);
    }
  }

  // Guarded by this.
  private void schedule(long delayMillis) {
    timer = scheduler.schedule(tick, delayMillis, TimeUnit.MILLISECONDS);
  }

  private long nowMillis() {
    return TimeUnit.NANOSECONDS.toMillis(clock.nowNanos());
  }

  @Override
  public String toString() {
    return "ConnectionState[" + transport + "]";
  }
}
