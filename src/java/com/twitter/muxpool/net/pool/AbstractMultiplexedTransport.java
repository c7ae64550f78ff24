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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/**
 * Stream bookkeeping for transport adapters.  Subclasses call {@link #streamOpened()} and
 * {@link #streamClosed()} as streams come and go; listeners hear only the transitions between
 * zero and one open stream, delivered in order while holding this transport's monitor.
 */
public abstract class AbstractMultiplexedTransport implements MultiplexedTransport {
  private static final Logger LOG = Logger.getLogger(AbstractMultiplexedTransport.class.getName());

  private final List<ActiveStateListener> listeners =
      new CopyOnWriteArrayList<ActiveStateListener>();
  private int openStreams;

  @Override
  public void addActiveStateListener(ActiveStateListener listener) {
    listeners.add(Preconditions.checkNotNull(listener));
  }

  @Override
  public void removeActiveStateListener(ActiveStateListener listener) {
    listeners.remove(listener);
  }

  /**
   * Records a newly opened stream.
   */
  protected final synchronized void streamOpened() {
    if (openStreams++ == 0) {
      notifyListeners(true);
    }
  }

  /**
   * Records a stream that has completed or been reset.
   *
   * @throws IllegalStateException if no stream is open
   */
  protected final synchronized void streamClosed() {
    Preconditions.checkState(openStreams > 0, "No open stream to close on %s", this);
    if (--openStreams == 0) {
      notifyListeners(false);
    }
  }

  /**
   * Returns the number of streams currently open.
   */
  public synchronized int getOpenStreams() {
    return openStreams;
  }

  private void notifyListeners(boolean active) {
    for (ActiveStateListener listener : listeners) {
      try {
        listener.onActiveStateChanged(active);
      } catch (RuntimeException e) {
        LOG.log(Level.WARNING, "Active state listener " + listener + " failed", e);
      }
    }
  }
}
