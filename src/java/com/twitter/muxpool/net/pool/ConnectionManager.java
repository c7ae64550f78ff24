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

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import com.twitter.muxpool.net.Authority;
import com.twitter.muxpool.net.tls.ClientSetting;
import com.twitter.muxpool.net.tls.ClientSettingCustomizer;
import com.twitter.muxpool.quantity.Amount;
import com.twitter.muxpool.quantity.Time;
import com.twitter.muxpool.util.Clock;

/**
 * Shares multiplexed transports between callers, keeping at most one live transport per
 * {@link Authority}.
 *
 * <p>A request for an authority with a cached, open transport is answered immediately with that
 * transport.  Otherwise a single establishment attempt is made on the connect executor and every
 * caller asking for the authority before it completes waits on that same attempt; for a given
 * authority no two attempts ever overlap.  Established transports are evicted by their
 * {@link ConnectionState} once idle for the configured idle timeout.
 *
 * <p>Transports returned remain owned by this manager.  Callers that find a transport broken
 * should hand it to {@link #removeConnection} so the next request establishes a fresh one.
 *
 * @param <T> the transport type managed
 */
public final class ConnectionManager<T extends MultiplexedTransport> {
  private static final Logger LOG = Logger.getLogger(ConnectionManager.class.getName());

  /**
   * The idle timeout used when none is configured.  Shorter timeouts defeat reuse of transports
   * between bursts of requests.
   */
  public static final Amount<Long, Time> DEFAULT_IDLE_TIMEOUT = Amount.of(1L, Time.SECONDS);

  /**
   * The idle timeout given to transports established after a draining {@link #close()}.
   */
  public static final Amount<Long, Time> DRAIN_IDLE_TIMEOUT = Amount.of(50L, Time.MILLISECONDS);

  private static final Amount<Long, Time> IDLE_TIMER_KEEP_ALIVE = Amount.of(1L, Time.SECONDS);

  private final TransportEstablisher<T> establisher;
  @Nullable private final ClientSettingCustomizer customizer;
  private final Amount<Long, Time> idleTimeout;
  private final Executor connectExecutor;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;

  private final Lock lock = new ReentrantLock();

  // Guarded by lock.
  private final Map<Authority, ConnectionState<T>> connections = Maps.newHashMap();
  private final Map<Authority, SettableFuture<ConnectionState<T>>> pendingAttempts =
      Maps.newHashMap();
  private boolean closed;
  private boolean forceClosed;

  private ConnectionManager(Builder<T> builder) {
    this.establisher = builder.establisher;
    this.customizer = builder.customizer;
    this.idleTimeout = builder.idleTimeout;
    this.connectExecutor = builder.connectExecutor;
    this.scheduler = builder.scheduler;
    this.clock = builder.clock;
  }

  /**
   * Starts building a manager whose transports are created by {@code establisher}.
   */
  public static <T extends MultiplexedTransport> Builder<T> builder(
      TransportEstablisher<T> establisher) {
    return new Builder<T>(establisher);
  }

  /**
   * Gets a transport to the authority of {@code request}, reusing a cached one when it is still
   * open.  The transport is marked active, which restarts its idle clock.
   *
   * @param request the request a transport is needed for
   * @return a future transport; it fails with {@link ManagerClosedException} if this manager is
   *     closed, or with the cause of a failed establishment attempt, eg: a
   *     {@link com.twitter.muxpool.net.ConnectTimeoutException} or a
   *     {@link com.twitter.muxpool.net.ProxyTunnelException}
   */
  public ListenableFuture<T> getConnection(final ConnectionRequest request) {
    Preconditions.checkNotNull(request);
    Authority authority = request.getAuthority();

    ConnectionState<T> stale = null;
    SettableFuture<ConnectionState<T>> attempt;
    boolean startAttempt = false;
    lock.lock();
    try {
      if (closed) {
        return Futures.immediateFailedFuture(
            new ManagerClosedException("Can't establish a connection after " + this + " closed"));
      }

      ConnectionState<T> state = connections.get(authority);
      if (state != null) {
        T transport = state.isOpen() ? state.tryActivate() : null;
        if (transport != null) {
          LOG.fine("Reusing transport to " + authority);
          return Futures.immediateFuture(transport);
        }
        connections.remove(authority);
        stale = state;
      }

      attempt = pendingAttempts.get(authority);
      if (attempt == null) {
        attempt = SettableFuture.create();
        pendingAttempts.put(authority, attempt);
        startAttempt = true;
      }
    } finally {
      lock.unlock();
    }

    if (stale != null) {
      LOG.fine("Replacing stale transport to " + authority);
      stale.dispose();
    }
    if (startAttempt) {
      startAttempt(request, attempt);
    }
    return handOff(request, attempt);
  }

  /**
   * Waits for {@link #getConnection} to complete.
   *
   * @param request the request a transport is needed for
   * @return an open transport
   * @throws IOException if no transport could be had; the failure of the attempt is rethrown
   *     as-is when it is an {@code IOException}
   * @throws InterruptedException if interrupted while waiting
   */
  public T awaitConnection(ConnectionRequest request) throws IOException, InterruptedException {
    try {
      return getConnection(request).get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, IOException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IOException("Failed to connect to " + request.getAuthority(), cause);
    }
  }

  /**
   * Drops the cached entry holding {@code transport}, if any, and finishes it.  Use this when a
   * transport is found broken so the next request for its authority reconnects.
   *
   * @param transport a transport previously returned by this manager
   */
  public void removeConnection(MultiplexedTransport transport) {
    Preconditions.checkNotNull(transport);

    ConnectionState<T> removed = null;
    lock.lock();
    try {
      Iterator<ConnectionState<T>> states = connections.values().iterator();
      while (states.hasNext()) {
        ConnectionState<T> state = states.next();
        if (state.getTransport() == transport) {
          states.remove();
          removed = state;
          break;
        }
      }
    } finally {
      lock.unlock();
    }

    if (removed != null) {
      LOG.fine("Removed transport " + transport);
      removed.dispose();
    }
  }

  /**
   * Equivalent to {@code close(false)}.
   */
  public void close() {
    close(false);
  }

  /**
   * Stops handing out transports.  All later calls to {@link #getConnection} fail with
   * {@link ManagerClosedException}.
   *
   * <p>A draining close leaves cached transports to their idle timers, and transports whose
   * establishment completes after the close get the short {@link #DRAIN_IDLE_TIMEOUT}.  A forced
   * close finishes every cached transport now, and transports still being established are
   * finished on arrival instead of being cached.  A forced close may follow a draining one.
   *
   * @param force whether to finish cached transports immediately
   */
  public void close(boolean force) {
    List<ConnectionState<T>> disposals = ImmutableList.of();
    int remaining;
    lock.lock();
    try {
      closed = true;
      if (force) {
        forceClosed = true;
        disposals = ImmutableList.copyOf(connections.values());
        connections.clear();
      }
      remaining = connections.size();
    } finally {
      lock.unlock();
    }

    if (force) {
      LOG.info("Force closing " + this + ", finishing " + disposals.size() + " transports");
    } else {
      LOG.info("Closing " + this + ", draining " + remaining + " transports");
    }
    for (ConnectionState<T> state : disposals) {
      state.dispose();
    }
  }

  /**
   * Returns the number of cached transports.
   */
  public int size() {
    lock.lock();
    try {
      return connections.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  ScheduledExecutorService getScheduler() {
    return scheduler;
  }

  @VisibleForTesting
  @Nullable
  ConnectionState<T> getCachedState(Authority authority) {
    lock.lock();
    try {
      return connections.get(authority);
    } finally {
      lock.unlock();
    }
  }

  private void startAttempt(final ConnectionRequest request,
      final SettableFuture<ConnectionState<T>> attempt) {
    try {
      connectExecutor.execute(new Runnable() {
        @Override public void run() {
          establish(request, attempt);
        }
      });
    } catch (RuntimeException e) {
      failAttempt(request.getAuthority(), attempt, e);
    }
  }

  // Waiters share the attempt, so one caller cancelling its future must not cancel the attempt.
  private ListenableFuture<T> handOff(final ConnectionRequest request,
      SettableFuture<ConnectionState<T>> attempt) {
    return Futures.transformAsync(Futures.nonCancellationPropagating(attempt),
        new AsyncFunction<ConnectionState<T>, T>() {
          @Override public ListenableFuture<T> apply(ConnectionState<T> state) {
            T transport = state.tryActivate();
            // Evicted between publication and hand off; go around again.
            return transport != null ? Futures.immediateFuture(transport) : getConnection(request);
          }
        },
        MoreExecutors.directExecutor());
  }

  private void establish(ConnectionRequest request, SettableFuture<ConnectionState<T>> attempt) {
    Authority authority = request.getAuthority();
    ConnectionState<T> state;
    try {
      ClientSetting setting = new ClientSetting();
      if (customizer != null) {
        customizer.customize(request.getTarget(), setting);
      }
      T transport = establisher.establish(request, setting);
      Preconditions.checkState(transport != null, "%s returned no transport", establisher);
      state = ConnectionState.create(transport, clock, scheduler);
    } catch (Exception e) {
      LOG.log(Level.WARNING, "Failed to establish a transport to " + authority, e);
      failAttempt(authority, attempt, e);
      return;
    }

    Throwable failure = null;
    lock.lock();
    try {
      pendingAttempts.remove(authority);
      if (forceClosed) {
        failure = new ManagerClosedException(
            this + " was force closed while connecting to " + authority);
      } else {
        state.delayClose(closed ? DRAIN_IDLE_TIMEOUT : idleTimeout, evictor(authority, state));
        connections.put(authority, state);
      }
    } catch (RuntimeException e) {
      failure = e;
    } finally {
      lock.unlock();
    }

    if (failure != null) {
      state.dispose();
      attempt.setException(failure);
    } else {
      LOG.fine("Established transport to " + authority);
      attempt.set(state);
    }
  }

  private void failAttempt(Authority authority, SettableFuture<ConnectionState<T>> attempt,
      Throwable cause) {
    lock.lock();
    try {
      pendingAttempts.remove(authority);
    } finally {
      lock.unlock();
    }
    attempt.setException(cause);
  }

  private Runnable evictor(final Authority authority, final ConnectionState<T> state) {
    return new Runnable() {
      @Override public void run() {
        lock.lock();
        try {
          // The authority may have been reconnected since; only drop our own entry.
          if (connections.get(authority) == state) {
            connections.remove(authority);
          }
        } finally {
          lock.unlock();
        }
        state.dispose();
      }
    };
  }

  @Override
  public String toString() {
    return "ConnectionManager[" + establisher + "]";
  }

  /**
   * Configures a {@link ConnectionManager}.
   *
   * @param <T> the transport type managed
   */
  public static class Builder<T extends MultiplexedTransport> {
    private final TransportEstablisher<T> establisher;
    private Amount<Long, Time> idleTimeout = DEFAULT_IDLE_TIMEOUT;
    @Nullable private ClientSettingCustomizer customizer;
    @Nullable private Executor connectExecutor;
    @Nullable private ScheduledExecutorService scheduler;
    private Clock clock = Clock.SYSTEM_CLOCK;

    Builder(TransportEstablisher<T> establisher) {
      this.establisher = Preconditions.checkNotNull(establisher);
    }

    /**
     * Sets how long a transport may sit without open streams before it is finished.  Values
     * under {@link ConnectionState#MIN_IDLE_TIMEOUT} are raised to it.
     *
     * @param idleTimeout the idle timeout
     * @return A reference to the builder.
     */
    public Builder<T> withIdleTimeout(Amount<Long, Time> idleTimeout) {
      Preconditions.checkNotNull(idleTimeout);
      Preconditions.checkArgument(idleTimeout.getValue() > 0, "Idle timeout must be positive");
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Sets a hook that adjusts trust, certificate policy, or proxy before each attempt.
     *
     * @param customizer the per-attempt hook
     * @return A reference to the builder.
     */
    public Builder<T> withClientSettingCustomizer(ClientSettingCustomizer customizer) {
      this.customizer = Preconditions.checkNotNull(customizer);
      return this;
    }

    /**
     * Sets the executor establishment attempts run on.  Attempts block on socket connects and
     * TLS handshakes.
     *
     * @param connectExecutor the executor for establishment
     * @return A reference to the builder.
     */
    public Builder<T> withConnectExecutor(Executor connectExecutor) {
      this.connectExecutor = Preconditions.checkNotNull(connectExecutor);
      return this;
    }

    /**
     * Sets the scheduler idle timers run on.
     *
     * @param scheduler the scheduler for idle timers
     * @return A reference to the builder.
     */
    public Builder<T> withScheduler(ScheduledExecutorService scheduler) {
      this.scheduler = Preconditions.checkNotNull(scheduler);
      return this;
    }

    public Builder<T> withClock(Clock clock) {
      this.clock = Preconditions.checkNotNull(clock);
      return this;
    }

    public ConnectionManager<T> build() {
      if (idleTimeout.compareTo(DEFAULT_IDLE_TIMEOUT) < 0) {
        LOG.warning("Idle timeout of " + idleTimeout + " is below " + DEFAULT_IDLE_TIMEOUT
            + ", transports may be finished between bursts of requests");
      }
      if (connectExecutor == null) {
        connectExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("CM-connect-[%d]")
                .setDaemon(true)
                .build());
      }
      if (scheduler == null) {
        ScheduledThreadPoolExecutor idleTimers = new ScheduledThreadPoolExecutor(1,
            new ThreadFactoryBuilder()
                .setNameFormat("CM-idle-[%d]")
                .setDaemon(true)
                .build());
        idleTimers.setRemoveOnCancelPolicy(true);
        // Lets the timer thread die once no transport has a timer armed, eg: after close.
        idleTimers.setKeepAliveTime(IDLE_TIMER_KEEP_ALIVE.as(Time.MILLISECONDS),
            TimeUnit.MILLISECONDS);
        idleTimers.allowCoreThreadTimeOut(true);
        scheduler = idleTimers;
      }
      return new ConnectionManager<T>(this);
    }
  }
}
