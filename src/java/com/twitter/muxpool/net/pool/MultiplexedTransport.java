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

/**
 * A connection able to carry many concurrent streams, eg: an HTTP/2 client connection.
 *
 * <p>Transports handed out by a {@link ConnectionManager} remain owned by the manager: callers
 * open streams on them but must not {@link #finish() finish} them; use
 * {@link ConnectionManager#removeConnection} instead.
 */
public interface MultiplexedTransport {

  /**
   * @return {@code true} while new streams may be opened on this transport
   */
  boolean isOpen();

  /**
   * Gracefully closes this transport, letting open streams complete.  Calling this on a finished
   * transport has no effect.
   */
  void finish();

  /**
   * Subscribes {@code listener} to transitions between zero and non-zero open streams.
   */
  void addActiveStateListener(ActiveStateListener listener);

  /**
   * Unsubscribes {@code listener}; unknown listeners are ignored.
   */
  void removeActiveStateListener(ActiveStateListener listener);
}
